package io.github.lodestone.orm.sql.internals.repository;

import io.github.lodestone.orm.api.CloseableIterator;
import io.github.lodestone.orm.api.exceptions.RepositoryException;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.SQLConnectionProvider;
import io.github.lodestone.orm.sql.internals.SqlExceptionTranslator;
import io.github.lodestone.orm.sql.iteration.ResultSetIterator;
import io.github.lodestone.orm.sql.iteration.Row;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Runs statements against the shared connection. Statements are closed after use, the connection never is.
 */
public class SqlStatementExecutor {
    private final SQLConnectionProvider connectionProvider;
    private final SqlExceptionTranslator translator;
    private final SqlParameterBinder binder;

    public SqlStatementExecutor(SQLConnectionProvider connectionProvider, SqlExceptionTranslator translator,
                                SqlParameterBinder binder) {
        this.connectionProvider = connectionProvider;
        this.translator = translator;
        this.binder = binder;
    }

    public SqlParameterBinder binder() {
        return binder;
    }

    public SqlExceptionTranslator translator() {
        return translator;
    }

    /**
     * Runs a statement for its side effects. For an {@code INSERT} or {@code REPLACE} the id of the
     * inserted row is read back with {@code last_insert_rowid()} while the connection is held.
     * That value is per connection, so the monitor keeps another thread's insert from landing in between.
     */
    public @NotNull StatementResult execute(@NotNull String sql, @NotNull List<?> parameters) {
        log(sql, parameters);
        Connection connection = connectionProvider.getConnection();
        synchronized (connection) {
            int updateCount;
            try (PreparedStatement statement = connectionProvider.prepareStatement(sql, connection)) {
                binder.bind(statement, parameters);
                if (statement.execute()) {
                    statement.getResultSet().close();
                    updateCount = -1;
                } else {
                    updateCount = statement.getUpdateCount();
                }
            } catch (SQLException e) {
                throw translator.translate(sql, e);
            }

            if (!isInsert(sql)) {
                return StatementResult.of(updateCount);
            }
            return new StatementResult(updateCount, OptionalLong.of(lastInsertRowId(connection)));
        }
    }

    /**
     * Opens a cursor. The caller must exhaust or close the returned iterator.
     */
    public @NotNull CloseableIterator<Row> fetch(@NotNull String sql, @NotNull List<?> parameters) {
        log(sql, parameters);
        Connection connection = connectionProvider.getConnection();
        PreparedStatement statement = null;
        try {
            statement = connectionProvider.prepareStatement(sql, connection);
            binder.bind(statement, parameters);
            ResultSet resultSet = statement.executeQuery();
            return new ResultSetIterator<>(sql, statement, resultSet, Row::read, translator);
        } catch (SQLException e) {
            closeQuietly(statement);
            throw translator.translate(sql, e);
        }
    }

    public @NotNull List<Row> fetchAll(@NotNull String sql, @NotNull List<?> parameters) {
        List<Row> rows = new ArrayList<>();
        try (CloseableIterator<Row> iterator = fetch(sql, parameters)) {
            while (iterator.hasNext()) {
                rows.add(iterator.next());
            }
        }
        return rows;
    }

    public long fetchLong(@NotNull String sql, @NotNull List<?> parameters) {
        try (CloseableIterator<Row> iterator = fetch(sql, parameters)) {
            if (!iterator.hasNext()) {
                throw new RepositoryException("Query returned no rows: " + sql);
            }
            return iterator.next().getLong(0);
        }
    }

    public @NotNull List<Long> fetchLongs(@NotNull String sql, @NotNull List<?> parameters) {
        List<Long> values = new ArrayList<>();
        try (CloseableIterator<Row> iterator = fetch(sql, parameters)) {
            while (iterator.hasNext()) {
                values.add(iterator.next().getLong(0));
            }
        }
        return values;
    }

    private long lastInsertRowId(Connection connection) {
        String sql = "SELECT last_insert_rowid()";
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getLong(1);
        } catch (SQLException e) {
            throw translator.translate(sql, e);
        }
    }

    static boolean isInsert(String sql) {
        String head = sql.stripLeading().toUpperCase(Locale.ROOT);
        return head.startsWith("INSERT") || head.startsWith("REPLACE");
    }

    private static void log(String sql, List<?> parameters) {
        Logging.info(() -> "Executing: " + sql);
        Logging.deepInfo(() -> "Parameters: " + parameters);
    }

    private static void closeQuietly(Statement statement) {
        if (statement == null) {
            return;
        }
        try {
            statement.close();
        } catch (SQLException e) {
            Logging.warn("Error closing statement: " + e.getMessage());
        }
    }
}
