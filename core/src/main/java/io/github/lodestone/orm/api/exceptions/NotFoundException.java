package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when a lookup that expects exactly one row finds none.
 */
public class NotFoundException extends RepositoryException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
