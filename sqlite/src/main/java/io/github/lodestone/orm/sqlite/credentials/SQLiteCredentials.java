package io.github.lodestone.orm.sqlite.credentials;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of an SQLite database file.
 */
public record SQLiteCredentials(@NotNull Path path) {
    public SQLiteCredentials {
        Objects.requireNonNull(path, "Database path cannot be null");
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + path;
    }
}
