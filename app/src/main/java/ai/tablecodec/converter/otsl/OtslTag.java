package ai.tablecodec.converter.otsl;

import ai.tablecodec.converter.model.HeaderType;
import java.util.Optional;

/**
 * Cell-level tokens of the tag stream. Origin tags start a new cell; continuation tags extend an earlier one.
 */
public enum OtslTag {
    COLUMN_HEADER("ched", true, HeaderType.COLUMN),
    ROW_HEADER("rhed", true, HeaderType.ROW),
    FILLED("fcel", true, HeaderType.NONE),
    EMPTY("ecel", true, HeaderType.NONE),
    LEFT("lcel", false, HeaderType.NONE),
    UP("ucel", false, HeaderType.NONE),
    CROSS("xcel", false, HeaderType.NONE);

    private final String name;
    private final boolean origin;
    private final HeaderType headerType;

    OtslTag(String name, boolean origin, HeaderType headerType) {
        this.name = name;
        this.origin = origin;
        this.headerType = headerType;
    }

    public String markup() {
        return "<" + name + ">";
    }

    public boolean isOrigin() {
        return origin;
    }

    public boolean isContinuation() {
        return !origin;
    }

    /** True for tags that continue a cell from the row above. */
    public boolean continuesDown() {
        return this == UP || this == CROSS;
    }

    public HeaderType headerType() {
        return headerType;
    }

    public static Optional<OtslTag> fromName(String raw) {
        for (OtslTag tag : values()) {
            if (tag.name.equals(raw)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    /**
     * Picks the origin tag for a cell with the given header type and content.
     */
    public static OtslTag originFor(HeaderType headerType, String content) {
        return switch (headerType) {
            case COLUMN -> COLUMN_HEADER;
            case ROW -> ROW_HEADER;
            case NONE -> content == null || content.isBlank() ? EMPTY : FILLED;
        };
    }
}
