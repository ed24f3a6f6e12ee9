package ai.tablecodec.converter.error;

import ai.tablecodec.converter.validate.Violation;
import java.util.List;

/**
 * Strict-mode failure where a grid position is covered by no cell.
 */
public class OccupancyGapException extends TableViolationException {

    public OccupancyGapException(String message, List<Violation> violations) {
        super(message, violations);
    }
}
