package io.github.lodestone.orm.sql;

import io.github.lodestone.orm.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * One private in-memory SQLite database per provider.
 */
public final class MemoryConnectionProvider implements SQLConnectionProvider {
    private Connection connection;

    @Override
    public synchronized @NotNull Connection getConnection() {
        if (connection == null) {
            try {
                connection = DriverManager.getConnection("jdbc:sqlite::memory:");
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        }
        return connection;
    }

    @Override
    public synchronized boolean isConnected() {
        return connection != null;
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        } finally {
            connection = null;
        }
    }
}
