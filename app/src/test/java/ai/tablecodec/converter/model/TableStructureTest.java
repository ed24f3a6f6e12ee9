package ai.tablecodec.converter.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TableStructureTest {

    @Test
    void normalizesFooterIndicesAndBlankCaption() {
        TableStructure table = new TableStructure(3, 1,
                List.of(Cell.of(0, 0, "a"), Cell.of(1, 0, "b"), Cell.of(2, 0, "c")),
                Optional.of("   "), false, false, true, List.of(2, 1, 2), null);

        assertThat(table.caption()).isEmpty();
        assertThat(table.footerRowIndices()).containsExactly(1, 2);
        assertThat(table.geometry()).isEmpty();
        assertThat(table.isFooterRow(2)).isTrue();
    }

    @Test
    void isNotAffectedByLaterChangesToTheCellList() {
        List<Cell> cells = new ArrayList<>(List.of(Cell.of(0, 0, "a")));
        TableStructure table = TableStructure.of(1, 1, cells);

        cells.add(Cell.of(0, 1, "b"));

        assertThat(table.cells()).hasSize(1);
    }

    @Test
    void findsCellByOrigin() {
        Cell wide = new Cell(0, 0, 1, 2, "wide", HeaderType.COLUMN);
        TableStructure table = TableStructure.of(1, 2, List.of(wide));

        assertThat(table.originAt(0, 0)).contains(wide);
        assertThat(table.originAt(0, 1)).isEmpty();
        assertThat(wide.covers(0, 1)).isTrue();
    }

    @Test
    void rejectsCellsWithNonPositiveSpans() {
        Throwable thrown = catchThrowable(() -> new Cell(0, 0, 0, 1, "x", HeaderType.NONE));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("spans");
    }

    @Test
    void draftFreezesIntoEquivalentTable() {
        TableDraft draft = new TableDraft(1, 2);
        draft.addCell(Cell.of(0, 1, "b"));
        draft.addCell(Cell.of(0, 0, "a"));
        draft.caption(Optional.of("cap"));
        draft.sections(true, true, false);
        draft.footerRowIndices(List.of(0, 0));
        draft.geometry(List.of(1, 2, 3, 4));
        draft.sortByOrigin();

        TableStructure table = draft.toTable();

        assertThat(table).isEqualTo(new TableStructure(1, 2, List.of(Cell.of(0, 0, "a"), Cell.of(0, 1, "b")),
                Optional.of("cap"), true, true, false, List.of(0), List.of(1, 2, 3, 4)));
    }

    @Test
    void stripsSurroundingWhitespaceFromCellContent() {
        assertThat(Cell.of(0, 0, "  a b \n").content()).isEqualTo("a b");
        assertThat(Cell.of(0, 0, null).content()).isEmpty();
    }
}
