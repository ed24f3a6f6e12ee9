package ai.tablecodec.converter.html;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one tree parsing strategy. Only {@link Status#PARSED} outcomes are guaranteed to hold rows.
 */
public record ParseOutcome(Status status, Optional<TableMarkup> markup, String reason) {

    public enum Status {
        PARSED,
        EMPTY,
        FAILED
    }

    public ParseOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(markup, "markup");
        reason = reason == null ? "" : reason;
    }

    public static ParseOutcome parsed(TableMarkup markup) {
        return new ParseOutcome(Status.PARSED, Optional.of(markup), "");
    }

    public static ParseOutcome empty(String reason, TableMarkup markup) {
        return new ParseOutcome(Status.EMPTY, Optional.ofNullable(markup), reason);
    }

    public static ParseOutcome failed(String reason) {
        return new ParseOutcome(Status.FAILED, Optional.empty(), reason);
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    /**
     * Classifies freshly read markup as parsed or empty.
     */
    static ParseOutcome of(TableMarkup markup) {
        return markup.hasRows() ? parsed(markup) : empty("Table has no rows", markup);
    }
}
