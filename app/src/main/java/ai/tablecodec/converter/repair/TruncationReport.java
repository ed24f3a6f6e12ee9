package ai.tablecodec.converter.repair;

import java.util.Objects;

/**
 * Outcome of a truncation check on raw converter input.
 */
public record TruncationReport(boolean truncated, ContentType contentType, String reason) {

    public enum ContentType {
        HTML,
        OTSL,
        UNKNOWN
    }

    public TruncationReport {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(reason, "reason");
    }

    static TruncationReport truncated(ContentType type, String reason) {
        return new TruncationReport(true, type, reason);
    }

    static TruncationReport complete(ContentType type, String reason) {
        return new TruncationReport(false, type, reason);
    }
}
