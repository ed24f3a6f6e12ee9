package ai.tablecodec.converter.api;

import java.util.Objects;

/**
 * Result of comparing the tables decoded from an HTML and an OTSL rendering of the same table.
 */
public record ConversionCheck(boolean matches, String message) {

    public ConversionCheck {
        Objects.requireNonNull(message, "message");
    }

    static ConversionCheck match() {
        return new ConversionCheck(true, "Conversion is valid - structures match");
    }

    static ConversionCheck mismatch(String message) {
        return new ConversionCheck(false, message);
    }
}
