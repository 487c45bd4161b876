package io.github.lodestone.orm.api.exceptions;

/**
 * Base type of every error raised by the repository layer.
 *
 * <p>All repository errors are unchecked. SQL failures that do not map to a more specific
 * subtype are surfaced as a plain {@code RepositoryException} with the driver exception as cause.</p>
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
