package io.github.lodestone.orm.sql.internals;

import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Supplies the single connection shared by every caller of a database.
 *
 * <p>The connection is owned by the provider: callers close the statements they prepare but never
 * the connection itself.</p>
 */
public interface SQLConnectionProvider extends AutoCloseable {
    /**
     * Returns the shared connection, opening it on first use.
     */
    @NotNull Connection getConnection();

    default @NotNull PreparedStatement prepareStatement(@NotNull String sql, @NotNull Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    boolean isConnected();

    @Override
    void close();
}
