package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when the database cannot be opened or initialized.
 */
public class StartupException extends RepositoryException {
    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
