package ai.tablecodec.converter.error;

import ai.tablecodec.converter.validate.Violation;
import ai.tablecodec.converter.validate.ViolationType;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised in strict mode when a table fails validation. Carries every violation found, not only the first.
 */
public class TableViolationException extends TableConversionException {

    private final List<Violation> violations;

    protected TableViolationException(String message, List<Violation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    /**
     * Builds the exception matching the most severe violation in the list.
     */
    public static TableViolationException forViolations(List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        ViolationType worst = violations.stream()
                .map(Violation::type)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        String message = summarize(violations);
        return switch (worst) {
            case SPAN_OVERFLOW -> new SpanOverflowException(message, violations);
            case OCCUPANCY_CONFLICT -> new OccupancyConflictException(message, violations);
            case OCCUPANCY_GAP -> new OccupancyGapException(message, violations);
        };
    }

    private static String summarize(List<Violation> violations) {
        String details = violations.stream()
                .limit(5)
                .map(Violation::describe)
                .collect(Collectors.joining("; "));
        if (violations.size() > 5) {
            details += "; and " + (violations.size() - 5) + " more";
        }
        return "Table has " + violations.size() + " structural violation(s): " + details;
    }
}
