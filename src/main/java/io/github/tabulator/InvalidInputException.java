package io.github.tabulator;

/**
 * Thrown when a document cannot be read or parsed into a value tree, or when the
 * parsed value has a shape the caller does not accept.
 */
public class InvalidInputException extends TabulationException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
