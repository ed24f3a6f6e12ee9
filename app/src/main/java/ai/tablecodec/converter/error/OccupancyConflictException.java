package ai.tablecodec.converter.error;

import ai.tablecodec.converter.validate.Violation;
import java.util.List;

/**
 * Strict-mode failure where a grid position is covered by more than one cell.
 */
public class OccupancyConflictException extends TableViolationException {

    public OccupancyConflictException(String message, List<Violation> violations) {
        super(message, violations);
    }
}
