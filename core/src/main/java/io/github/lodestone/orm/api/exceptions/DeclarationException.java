package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown when an entity declaration is malformed, or when one of its field types
 * cannot be stored once the schema is first used.
 */
public class DeclarationException extends RepositoryException {
    public DeclarationException(String message) {
        super(message);
    }

    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
