package ai.tablecodec.converter.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class OccupancyGridTest {

    @Test
    void marksSpannedRegionWithOwningCellIndex() {
        List<Cell> cells = List.of(
                new Cell(0, 0, 2, 2, "X", HeaderType.NONE),
                Cell.of(0, 2, "Y"));

        OccupancyGrid grid = OccupancyGrid.of(3, 3, cells);

        assertThat(grid.ownerAt(0, 0)).isZero();
        assertThat(grid.ownerAt(0, 1)).isZero();
        assertThat(grid.ownerAt(1, 0)).isZero();
        assertThat(grid.ownerAt(1, 1)).isZero();
        assertThat(grid.ownerAt(0, 2)).isEqualTo(1);
        assertThat(grid.isCovered(1, 2)).isFalse();
        assertThat(grid.isCovered(2, 0)).isFalse();
    }

    @Test
    void keepsFirstOwnerWhenCellsOverlap() {
        List<Cell> cells = List.of(
                new Cell(0, 0, 1, 2, "wide", HeaderType.NONE),
                Cell.of(0, 1, "late"));

        OccupancyGrid grid = OccupancyGrid.of(1, 2, cells);

        assertThat(grid.ownerAt(0, 1)).isZero();
    }

    @Test
    void ignoresPositionsOutsideTheGrid() {
        OccupancyGrid grid = OccupancyGrid.of(2, 2, List.of(new Cell(1, 1, 3, 3, "big", HeaderType.NONE)));

        assertThat(grid.ownerAt(1, 1)).isZero();
        assertThat(grid.ownerAt(5, 5)).isEqualTo(OccupancyGrid.UNCOVERED);
        assertThat(grid.isRegionFree(0, 0, 1, 2)).isTrue();
        assertThat(grid.isRegionFree(0, 0, 2, 2)).isFalse();
    }
}
