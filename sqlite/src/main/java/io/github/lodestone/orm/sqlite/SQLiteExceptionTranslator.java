package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.exceptions.AlreadyExistsException;
import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.RepositoryException;
import io.github.lodestone.orm.sql.internals.SqlExceptionTranslator;
import org.jetbrains.annotations.NotNull;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Unique and primary key violations become {@link AlreadyExistsException}, foreign key violations
 * {@link ConsistencyException}.
 */
public final class SQLiteExceptionTranslator implements SqlExceptionTranslator {
    @Override
    public @NotNull RepositoryException translate(@NotNull String sql, @NotNull SQLException exception) {
        if (isUniqueViolation(exception)) {
            return new AlreadyExistsException(exception.getMessage(), exception);
        }
        if (isReferenceViolation(exception)) {
            return new ConsistencyException("Statement would leave a dangling reference: " + sql, exception);
        }
        return new RepositoryException("Failed to execute: " + sql, exception);
    }

    static boolean isUniqueViolation(SQLException exception) {
        if (exception instanceof SQLiteException sqliteException) {
            SQLiteErrorCode code = sqliteException.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        String message = exception.getMessage();
        return message != null && message.contains("UNIQUE constraint failed");
    }

    static boolean isReferenceViolation(SQLException exception) {
        if (exception instanceof SQLiteException sqliteException
            && sqliteException.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY) {
            return true;
        }
        String message = exception.getMessage();
        return message != null && message.contains("FOREIGN KEY constraint failed");
    }
}
