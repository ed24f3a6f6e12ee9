package ai.tablecodec.converter.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.HeaderType;
import ai.tablecodec.converter.model.TableStructure;
import java.util.List;
import org.junit.jupiter.api.Test;

class StructureValidatorTest {

    private final StructureValidator validator = new StructureValidator();

    @Test
    void acceptsFullyCoveredGrid() {
        TableStructure table = TableStructure.of(3, 3, List.of(
                new Cell(0, 0, 2, 2, "X", HeaderType.NONE),
                Cell.of(0, 2, "a"),
                Cell.of(1, 2, "b"),
                Cell.of(2, 0, "c"),
                Cell.of(2, 1, "d"),
                Cell.of(2, 2, "e")));

        assertThat(validator.validate(table)).isEmpty();
        assertThat(validator.isValid(table)).isTrue();
    }

    @Test
    void reportsUncoveredPositionsInRowMajorOrder() {
        TableStructure table = TableStructure.of(2, 2, List.of(Cell.of(0, 0, "a"), Cell.of(1, 1, "d")));

        assertThat(validator.validate(table))
                .extracting(Violation::type, Violation::row, Violation::col)
                .containsExactly(
                        tuple(ViolationType.OCCUPANCY_GAP, 0, 1),
                        tuple(ViolationType.OCCUPANCY_GAP, 1, 0));
    }

    @Test
    void reportsConflictWithEveryCoveringCell() {
        TableStructure table = TableStructure.of(1, 2, List.of(
                new Cell(0, 0, 1, 2, "wide", HeaderType.NONE),
                Cell.of(0, 1, "late")));

        List<Violation> violations = validator.validate(table);

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.type()).isEqualTo(ViolationType.OCCUPANCY_CONFLICT);
            assertThat(violation.cellIds()).containsExactly(0, 1);
            assertThat(violation.describe()).contains("(0, 1)");
        });
    }

    @Test
    void reportsSpanOverflowBeforePositionFindings() {
        TableStructure table = TableStructure.of(2, 1, List.of(
                Cell.of(0, 0, "a"),
                new Cell(1, 0, 2, 1, "tall", HeaderType.NONE)));

        assertThat(validator.validate(table))
                .extracting(Violation::type, Violation::cellIds)
                .containsExactly(tuple(ViolationType.SPAN_OVERFLOW, List.of(1)));
    }

    @Test
    void treatsOriginOutsideGridAsOverflow() {
        TableStructure table = TableStructure.of(1, 1, List.of(Cell.of(0, 0, "a"), Cell.of(3, 3, "far")));

        assertThat(validator.validate(table))
                .extracting(Violation::type)
                .containsExactly(ViolationType.SPAN_OVERFLOW);
    }
}
