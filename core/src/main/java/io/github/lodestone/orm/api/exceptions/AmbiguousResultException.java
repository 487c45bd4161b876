package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when a lookup that expects exactly one row finds several.
 */
public class AmbiguousResultException extends RepositoryException {
    public AmbiguousResultException(String message) {
        super(message);
    }

    public AmbiguousResultException(String message, Throwable cause) {
        super(message, cause);
    }
}
