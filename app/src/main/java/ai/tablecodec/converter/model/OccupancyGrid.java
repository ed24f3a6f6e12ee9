package ai.tablecodec.converter.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-size arena mapping each grid position to the index of the cell that covers it.
 *
 * <p>Marking is first-wins: a position keeps its first owner even when a later cell also claims it.
 * Positions outside the grid are ignored when marking.</p>
 */
public final class OccupancyGrid {

    public static final int UNCOVERED = -1;

    private final int rows;
    private final int cols;
    private final int[][] owners;

    public OccupancyGrid(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("grid dimensions must be non-negative: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.owners = new int[rows][cols];
        for (int[] row : owners) {
            Arrays.fill(row, UNCOVERED);
        }
    }

    public static OccupancyGrid of(TableStructure table) {
        return of(table.numRows(), table.numCols(), table.cells());
    }

    public static OccupancyGrid of(int rows, int cols, List<Cell> cells) {
        OccupancyGrid grid = new OccupancyGrid(rows, cols);
        for (int index = 0; index < cells.size(); index++) {
            grid.mark(index, cells.get(index));
        }
        return grid;
    }

    public void mark(int cellIndex, Cell cell) {
        int rowEnd = Math.min(cell.rowEnd(), rows);
        int colEnd = Math.min(cell.colEnd(), cols);
        for (int row = cell.rowIdx(); row < rowEnd; row++) {
            for (int col = cell.colIdx(); col < colEnd; col++) {
                if (owners[row][col] == UNCOVERED) {
                    owners[row][col] = cellIndex;
                }
            }
        }
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public boolean isCovered(int row, int col) {
        return inBounds(row, col) && owners[row][col] != UNCOVERED;
    }

    public int ownerAt(int row, int col) {
        return inBounds(row, col) ? owners[row][col] : UNCOVERED;
    }

    /**
     * Returns true when every in-bounds position of the rectangle is uncovered.
     */
    public boolean isRegionFree(int row, int col, int rowspan, int colspan) {
        int rowEnd = Math.min(row + rowspan, rows);
        int colEnd = Math.min(col + colspan, cols);
        for (int r = row; r < rowEnd; r++) {
            for (int c = col; c < colEnd; c++) {
                if (owners[r][c] != UNCOVERED) {
                    return false;
                }
            }
        }
        return true;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }
}
