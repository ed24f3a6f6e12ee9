package ai.tablecodec.converter.error;

/**
 * Base runtime exception for failed table conversions.
 */
public class TableConversionException extends RuntimeException {

    public TableConversionException(String message) {
        super(message);
    }

    public TableConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
