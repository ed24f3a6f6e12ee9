package ai.tablecodec.converter.otsl;

import java.util.Objects;

/**
 * A cell-level tag together with the text that followed it.
 */
public record OtslToken(OtslTag tag, String text) {

    public OtslToken {
        Objects.requireNonNull(tag, "tag");
        text = text == null ? "" : text;
    }

    public static OtslToken of(OtslTag tag) {
        return new OtslToken(tag, "");
    }

    public boolean isOrigin() {
        return tag.isOrigin();
    }

    public boolean isContinuation() {
        return tag.isContinuation();
    }
}
