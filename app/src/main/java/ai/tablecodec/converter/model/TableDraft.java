package ai.tablecodec.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Mutable table under construction. Decoders and repairs work on a draft and freeze it with {@link #toTable()}.
 */
public final class TableDraft {

    private static final Comparator<Cell> ORIGIN_ORDER = Comparator.comparingInt(Cell::rowIdx)
            .thenComparingInt(Cell::colIdx);

    private int numRows;
    private int numCols;
    private final List<Cell> cells = new ArrayList<>();
    private final TreeSet<Integer> footerRowIndices = new TreeSet<>();
    private Optional<String> caption = Optional.empty();
    private boolean hadHeaderSection;
    private boolean hadBodySection;
    private boolean hadFooterSection;
    private List<Integer> geometry = List.of();

    public TableDraft(int numRows, int numCols) {
        resize(numRows, numCols);
    }

    public int numRows() {
        return numRows;
    }

    public int numCols() {
        return numCols;
    }

    public void resize(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("table dimensions must be non-negative: " + rows + "x" + cols);
        }
        this.numRows = rows;
        this.numCols = cols;
    }

    /**
     * Appends a cell and returns its index.
     */
    public int addCell(Cell cell) {
        cells.add(Objects.requireNonNull(cell, "cell"));
        return cells.size() - 1;
    }

    public List<Cell> cells() {
        return Collections.unmodifiableList(cells);
    }

    public void replaceCells(UnaryOperator<Cell> operator) {
        cells.replaceAll(operator);
    }

    public boolean removeCells(Predicate<Cell> predicate) {
        return cells.removeIf(predicate);
    }

    public void sortByOrigin() {
        cells.sort(ORIGIN_ORDER);
    }

    public List<Integer> footerRowIndices() {
        return List.copyOf(footerRowIndices);
    }

    public void footerRowIndices(List<Integer> indices) {
        footerRowIndices.clear();
        footerRowIndices.addAll(indices);
    }

    public void caption(Optional<String> value) {
        this.caption = Objects.requireNonNull(value, "caption");
    }

    public void sections(boolean header, boolean body, boolean footer) {
        this.hadHeaderSection = header;
        this.hadBodySection = body;
        this.hadFooterSection = footer;
    }

    public void geometry(List<Integer> value) {
        this.geometry = List.copyOf(value);
    }

    public TableStructure toTable() {
        return new TableStructure(numRows, numCols, cells, caption, hadHeaderSection, hadBodySection,
                hadFooterSection, List.copyOf(footerRowIndices), geometry);
    }
}
