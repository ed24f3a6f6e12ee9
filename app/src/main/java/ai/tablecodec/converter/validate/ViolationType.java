package ai.tablecodec.converter.validate;

/**
 * Kinds of structural violation, ordered from least to most severe.
 */
public enum ViolationType {
    OCCUPANCY_GAP,
    OCCUPANCY_CONFLICT,
    SPAN_OVERFLOW
}
