package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when an insert or update collides with a unique column.
 */
public class AlreadyExistsException extends RepositoryException {
    public AlreadyExistsException(String message) {
        super(message);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
