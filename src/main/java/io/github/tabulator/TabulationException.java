package io.github.tabulator;

/**
 * Base exception for all tabulation errors.
 */
public class TabulationException extends RuntimeException {

    private final String fieldPath;

    public TabulationException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public TabulationException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public TabulationException(String fieldPath, String message) {
        super(message);
        this.fieldPath = fieldPath;
    }

    public TabulationException(String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = fieldPath;
    }

    /**
     * Returns the dotted field path where the error occurred, or null.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        if (fieldPath != null && !fieldPath.isEmpty()) {
            return "Field '" + fieldPath + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
