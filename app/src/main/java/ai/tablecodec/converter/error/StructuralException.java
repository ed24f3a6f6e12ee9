package ai.tablecodec.converter.error;

/**
 * Raised in strict mode when the input's shape cannot be read as a table: missing wrappers, no rows,
 * rows longer than the first row.
 */
public class StructuralException extends TableConversionException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
