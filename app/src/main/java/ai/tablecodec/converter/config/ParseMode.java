package ai.tablecodec.converter.config;

/**
 * Whether structural problems fail the conversion or are repaired.
 */
public enum ParseMode {
    STRICT,
    LENIENT;

    public boolean isStrict() {
        return this == STRICT;
    }

    public static ParseMode of(boolean strict) {
        return strict ? STRICT : LENIENT;
    }

    public static ParseMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STRICT;
        }
        for (ParseMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported parse mode: " + raw);
    }
}
