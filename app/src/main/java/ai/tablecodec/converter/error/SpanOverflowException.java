package ai.tablecodec.converter.error;

import ai.tablecodec.converter.validate.Violation;
import java.util.List;

/**
 * Strict-mode failure where a cell extends beyond the grid.
 */
public class SpanOverflowException extends TableViolationException {

    public SpanOverflowException(String message, List<Violation> violations) {
        super(message, violations);
    }
}
