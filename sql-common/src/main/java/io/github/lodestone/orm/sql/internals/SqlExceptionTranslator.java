package io.github.lodestone.orm.sql.internals;

import io.github.lodestone.orm.api.exceptions.AlreadyExistsException;
import io.github.lodestone.orm.api.exceptions.RepositoryException;
import org.jetbrains.annotations.NotNull;

import java.sql.SQLException;

/**
 * Maps driver exceptions to the repository exception hierarchy.
 */
@FunctionalInterface
public interface SqlExceptionTranslator {
    /**
     * Translator relying only on standard SQL states: class {@code 23} (integrity constraint
     * violation) becomes {@link AlreadyExistsException}.
     */
    SqlExceptionTranslator STANDARD = (sql, exception) -> {
        String state = exception.getSQLState();
        if (state != null && state.startsWith("23")) {
            return new AlreadyExistsException(exception.getMessage(), exception);
        }
        return new RepositoryException("Failed to execute: " + sql, exception);
    };

    @NotNull RepositoryException translate(@NotNull String sql, @NotNull SQLException exception);
}
