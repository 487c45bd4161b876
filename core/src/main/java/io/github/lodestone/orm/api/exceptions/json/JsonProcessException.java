package io.github.lodestone.orm.api.exceptions.json;

import io.github.lodestone.orm.api.exceptions.RepositoryException;

/**
 * Raised when a JSON column value cannot be written or read back.
 */
public class JsonProcessException extends RepositoryException {
    private final JsonLocation location;

    public JsonProcessException(String message, Throwable cause, JsonLocation location) {
        super(message, cause);
        this.location = location;
    }

    public JsonLocation getLocation() {
        return location;
    }
}
