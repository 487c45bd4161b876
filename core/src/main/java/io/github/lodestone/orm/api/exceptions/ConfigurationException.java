package io.github.lodestone.orm.api.exceptions;

/**
 * Thrown for invalid registrations: duplicate converters, duplicate tables, bad hooks.
 */
public class ConfigurationException extends RepositoryException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
