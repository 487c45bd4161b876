package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when an instance no longer agrees with the database, for example after its row was deleted.
 */
public class ConsistencyException extends RepositoryException {
    public ConsistencyException(String message) {
        super(message);
    }

    public ConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
