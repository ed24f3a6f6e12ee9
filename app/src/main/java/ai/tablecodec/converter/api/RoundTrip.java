package ai.tablecodec.converter.api;

import ai.tablecodec.converter.model.TableStructure;
import java.util.Objects;

/**
 * Result of converting a table to the other rendering and back.
 *
 * @param intermediate  the other rendering produced from the input
 * @param reconstructed the input rendering rebuilt from {@code intermediate}
 * @param summary       dimensions and cell count of the decoded input, e.g. {@code TableStructure(3x4, 11 cells)}
 */
public record RoundTrip(String intermediate, String reconstructed, String summary) {

    public RoundTrip {
        Objects.requireNonNull(intermediate, "intermediate");
        Objects.requireNonNull(reconstructed, "reconstructed");
        Objects.requireNonNull(summary, "summary");
    }

    static String summarize(TableStructure table) {
        return "TableStructure(" + table.numRows() + "x" + table.numCols() + ", " + table.cells().size() + " cells)";
    }
}
