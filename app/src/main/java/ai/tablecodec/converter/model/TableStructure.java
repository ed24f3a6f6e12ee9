package ai.tablecodec.converter.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable grid representation of a table shared by both codecs.
 *
 * <p>{@code cells} holds one entry per logical cell, anchored at its origin. The position of a cell in the
 * list is its id when violations refer to it. Cell content is held without leading or trailing whitespace,
 * as neither rendering can carry it. {@code footerRowIndices} is kept sorted and distinct;
 * {@code geometry} is the opaque location preamble carried by the tag stream and may be empty.</p>
 */
public record TableStructure(int numRows,
                             int numCols,
                             List<Cell> cells,
                             Optional<String> caption,
                             boolean hadHeaderSection,
                             boolean hadBodySection,
                             boolean hadFooterSection,
                             List<Integer> footerRowIndices,
                             List<Integer> geometry) {

    public TableStructure {
        if (numRows < 0 || numCols < 0) {
            throw new IllegalArgumentException("table dimensions must be non-negative: " + numRows + "x" + numCols);
        }
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
        caption = Objects.requireNonNull(caption, "caption").filter(value -> !value.isBlank());
        footerRowIndices = footerRowIndices == null ? List.of() : footerRowIndices.stream()
                .distinct()
                .sorted()
                .collect(Collectors.toUnmodifiableList());
        geometry = geometry == null ? List.of() : List.copyOf(geometry);
    }

    /**
     * Creates a table carrying only cells and dimensions, without section flags or caption.
     */
    public static TableStructure of(int numRows, int numCols, List<Cell> cells) {
        return new TableStructure(numRows, numCols, cells, Optional.empty(), false, false, false, List.of(), List.of());
    }

    /**
     * Returns the single-cell empty table used when lenient decoding finds nothing to read.
     */
    public static TableStructure emptyTable(Optional<String> caption, List<Integer> geometry) {
        return new TableStructure(1, 1, List.of(Cell.empty(0, 0)), caption, false, false, false, List.of(), geometry);
    }

    /**
     * Returns the cell whose origin is at the given position.
     */
    public Optional<Cell> originAt(int row, int col) {
        return cells.stream().filter(cell -> cell.isOriginAt(row, col)).findFirst();
    }

    public boolean isFooterRow(int row) {
        return footerRowIndices.contains(row);
    }
}
