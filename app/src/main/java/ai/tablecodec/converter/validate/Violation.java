package ai.tablecodec.converter.validate;

import java.util.List;
import java.util.Objects;

/**
 * A single structural problem found in a table.
 *
 * <p>Gaps and conflicts refer to a grid position; overflows refer to the origin of the offending cell.
 * {@code cellIds} are indices into the table's cell list.</p>
 */
public record Violation(ViolationType type, int row, int col, List<Integer> cellIds) {

    public Violation {
        Objects.requireNonNull(type, "type");
        cellIds = List.copyOf(Objects.requireNonNull(cellIds, "cellIds"));
    }

    public static Violation gap(int row, int col) {
        return new Violation(ViolationType.OCCUPANCY_GAP, row, col, List.of());
    }

    public static Violation conflict(int row, int col, List<Integer> cellIds) {
        return new Violation(ViolationType.OCCUPANCY_CONFLICT, row, col, cellIds);
    }

    public static Violation spanOverflow(int cellId, int row, int col) {
        return new Violation(ViolationType.SPAN_OVERFLOW, row, col, List.of(cellId));
    }

    public String describe() {
        return switch (type) {
            case OCCUPANCY_GAP -> "No cell covers position (" + row + ", " + col + ")";
            case OCCUPANCY_CONFLICT -> "Position (" + row + ", " + col + ") is covered by cells " + cellIds;
            case SPAN_OVERFLOW -> "Cell " + cellIds.get(0) + " at (" + row + ", " + col + ") extends beyond the grid";
        };
    }
}
