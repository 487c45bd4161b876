package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when a value does not fit its field, or an instance is missing required values.
 */
public class ValidationException extends RepositoryException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
