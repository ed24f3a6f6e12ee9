package ai.tablecodec.converter.validate;

import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.TableStructure;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that every grid position is covered by exactly one cell and that no span leaves the grid.
 *
 * <p>Findings are returned, never thrown. Overflow violations come first in cell order, followed by gaps
 * and conflicts in row-major position order.</p>
 */
public class StructureValidator {

    public List<Violation> validate(TableStructure table) {
        Objects.requireNonNull(table, "table");
        int rows = table.numRows();
        int cols = table.numCols();
        List<Cell> cells = table.cells();
        List<Violation> violations = new ArrayList<>();

        int[][] coverage = new int[rows][cols];
        for (int id = 0; id < cells.size(); id++) {
            Cell cell = cells.get(id);
            if (cell.rowEnd() > rows || cell.colEnd() > cols) {
                violations.add(Violation.spanOverflow(id, cell.rowIdx(), cell.colIdx()));
            }
            int rowEnd = Math.min(cell.rowEnd(), rows);
            int colEnd = Math.min(cell.colEnd(), cols);
            for (int row = cell.rowIdx(); row < rowEnd; row++) {
                for (int col = cell.colIdx(); col < colEnd; col++) {
                    coverage[row][col]++;
                }
            }
        }

        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                if (coverage[row][col] == 0) {
                    violations.add(Violation.gap(row, col));
                } else if (coverage[row][col] > 1) {
                    violations.add(Violation.conflict(row, col, coveringIds(cells, row, col)));
                }
            }
        }
        return violations;
    }

    public boolean isValid(TableStructure table) {
        return validate(table).isEmpty();
    }

    private static List<Integer> coveringIds(List<Cell> cells, int row, int col) {
        List<Integer> ids = new ArrayList<>();
        for (int id = 0; id < cells.size(); id++) {
            if (cells.get(id).covers(row, col)) {
                ids.add(id);
            }
        }
        return ids;
    }
}
