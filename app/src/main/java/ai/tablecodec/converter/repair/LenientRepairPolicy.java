package ai.tablecodec.converter.repair;

import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.OccupancyGrid;
import ai.tablecodec.converter.model.Span;
import ai.tablecodec.converter.model.TableDraft;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalization routines shared by the lenient decoders. Every repair is deterministic and logged at debug.
 */
public class LenientRepairPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(LenientRepairPolicy.class);

    private final StructureValidator validator;

    public LenientRepairPolicy() {
        this(new StructureValidator());
    }

    public LenientRepairPolicy(StructureValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Pads short rows with {@code padding} and truncates long rows so every row has exactly {@code width} entries.
     */
    public <T> List<List<T>> normalizeRowLengths(List<List<T>> rows, int width, Supplier<T> padding) {
        List<List<T>> normalized = new ArrayList<>(rows.size());
        for (int index = 0; index < rows.size(); index++) {
            List<T> row = rows.get(index);
            if (row.size() == width) {
                normalized.add(row);
                continue;
            }
            List<T> adjusted = new ArrayList<>(row.subList(0, Math.min(row.size(), width)));
            while (adjusted.size() < width) {
                adjusted.add(padding.get());
            }
            LOGGER.debug("Normalized row {} from {} to {} entries", index, row.size(), width);
            normalized.add(adjusted);
        }
        return normalized;
    }

    /**
     * Shrinks a requested span so the cell stays inside the grid and only claims uncovered positions.
     * The origin itself must be uncovered.
     */
    public Span fitToFreeRegion(OccupancyGrid grid, int row, int col, Span requested) {
        int colspan = Math.max(1, Math.min(requested.colspan(), grid.cols() - col));
        for (int c = col + 1; c < col + colspan; c++) {
            if (grid.isCovered(row, c)) {
                colspan = c - col;
                break;
            }
        }
        int rowspan = Math.max(1, Math.min(requested.rowspan(), grid.rows() - row));
        for (int r = row + 1; r < row + rowspan; r++) {
            if (!grid.isRegionFree(r, col, 1, colspan)) {
                rowspan = r - row;
                break;
            }
        }
        Span fitted = new Span(rowspan, colspan);
        if (!fitted.equals(requested)) {
            LOGGER.debug("Clamped span at ({}, {}) from {}x{} to {}x{}", row, col,
                    requested.rowspan(), requested.colspan(), rowspan, colspan);
        }
        return fitted;
    }

    /**
     * Clamps every span to the table bounds and drops cells whose origin lies outside the grid.
     */
    public int clampSpans(TableDraft draft) {
        int rows = draft.numRows();
        int cols = draft.numCols();
        int dropped = (int) draft.cells().stream()
                .filter(cell -> cell.rowIdx() >= rows || cell.colIdx() >= cols)
                .count();
        if (dropped > 0) {
            draft.removeCells(cell -> cell.rowIdx() >= rows || cell.colIdx() >= cols);
            LOGGER.debug("Dropped {} cell(s) anchored outside the {}x{} grid", dropped, rows, cols);
        }
        int[] clamped = {0};
        draft.replaceCells(cell -> {
            int rowspan = Math.min(cell.rowspan(), rows - cell.rowIdx());
            int colspan = Math.min(cell.colspan(), cols - cell.colIdx());
            if (rowspan == cell.rowspan() && colspan == cell.colspan()) {
                return cell;
            }
            clamped[0]++;
            return cell.withSpans(rowspan, colspan);
        });
        if (clamped[0] > 0) {
            LOGGER.debug("Clamped {} overflowing span(s)", clamped[0]);
        }
        return dropped + clamped[0];
    }

    /**
     * Removes the given rows from the draft. Surviving cells are shifted up and their rowspans recounted
     * over the rows that remain; footer indices are remapped the same way.
     */
    public int removeRows(TableDraft draft, Set<Integer> emptyRows) {
        int originalRows = draft.numRows();
        Set<Integer> removed = emptyRows.stream()
                .filter(row -> row >= 0 && row < originalRows)
                .collect(Collectors.toSet());
        if (removed.isEmpty()) {
            return 0;
        }
        int[] remapped = new int[originalRows];
        int next = 0;
        for (int row = 0; row < originalRows; row++) {
            remapped[row] = removed.contains(row) ? -1 : next++;
        }

        draft.removeCells(cell -> cell.rowIdx() < originalRows && removed.contains(cell.rowIdx()));
        draft.replaceCells(cell -> {
            if (cell.rowIdx() >= originalRows) {
                return cell;
            }
            int spanEnd = Math.min(cell.rowEnd(), originalRows);
            int kept = 0;
            for (int row = cell.rowIdx(); row < spanEnd; row++) {
                if (!removed.contains(row)) {
                    kept++;
                }
            }
            return new Cell(remapped[cell.rowIdx()], cell.colIdx(), Math.max(1, kept), cell.colspan(),
                    cell.content(), cell.headerType());
        });
        draft.footerRowIndices(draft.footerRowIndices().stream()
                .filter(row -> row < originalRows && remapped[row] >= 0)
                .map(row -> remapped[row])
                .collect(Collectors.toList()));
        draft.resize(next, draft.numCols());
        LOGGER.debug("Removed {} empty row(s); {} row(s) remain", removed.size(), next);
        return removed.size();
    }

    /**
     * Inserts an empty non-header cell at every uncovered position.
     */
    public int fillGaps(TableDraft draft) {
        OccupancyGrid grid = OccupancyGrid.of(draft.numRows(), draft.numCols(), draft.cells());
        int filled = 0;
        for (int row = 0; row < grid.rows(); row++) {
            for (int col = 0; col < grid.cols(); col++) {
                if (!grid.isCovered(row, col)) {
                    draft.addCell(Cell.empty(row, col));
                    filled++;
                }
            }
        }
        if (filled > 0) {
            LOGGER.debug("Filled {} uncovered position(s) with empty cells", filled);
        }
        return filled;
    }

    /**
     * Applies the final repairs and freezes the draft. Fails if the result is still invalid.
     */
    public TableStructure finish(TableDraft draft) {
        clampSpans(draft);
        fillGaps(draft);
        draft.sortByOrigin();
        return requireValid(draft.toTable());
    }

    public TableStructure requireValid(TableStructure table) {
        List<Violation> violations = validator.validate(table);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Lenient repair left " + violations.size() + " violation(s): "
                    + violations.get(0).describe());
        }
        return table;
    }
}
