package io.github.lodestone.orm.sqlite.connections;

import io.github.lodestone.orm.api.exceptions.StartupException;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.SQLConnectionProvider;
import io.github.lodestone.orm.sqlite.credentials.SQLiteCredentials;
import org.jetbrains.annotations.NotNull;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import java.nio.file.Files;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the single connection to an SQLite file, opened on first use.
 *
 * <p>The connection is opened with {@code SQLITE_OPEN_FULLMUTEX} so it can be shared between
 * threads; a library compiled with {@code THREADSAFE=0} is refused. Foreign keys are enforced, so a
 * write that would leave a reference pointing at a missing row fails.</p>
 */
public class SQLiteConnectionProvider implements SQLConnectionProvider {
    private static final String THREADSAFE_OPTION = "THREADSAFE=";

    private final SQLiteCredentials credentials;
    private final ReentrantLock initLock = new ReentrantLock();
    private volatile Connection connection;

    public SQLiteConnectionProvider(@NotNull SQLiteCredentials credentials) {
        this.credentials = credentials;
    }

    public SQLiteCredentials credentials() {
        return credentials;
    }

    /**
     * @throws StartupException if the database file does not exist yet
     */
    @Override
    public @NotNull Connection getConnection() {
        Connection current = connection;
        if (current != null) {
            return current;
        }

        initLock.lock();
        try {
            if (connection == null) {
                if (!Files.exists(credentials.path())) {
                    throw new StartupException("The database at " + credentials.path() + " has not been created yet. "
                        + "Initialize it first, or point DB_PATH at another database");
                }
                connection = open(false);
            }
            return connection;
        } finally {
            initLock.unlock();
        }
    }

    /**
     * Opens the connection, creating the database file.
     *
     * @throws StartupException if a connection is already open
     */
    public @NotNull Connection create() {
        initLock.lock();
        try {
            if (connection != null) {
                throw new StartupException("Database is already loaded, cannot re-create it");
            }
            connection = open(true);
            return connection;
        } finally {
            initLock.unlock();
        }
    }

    private Connection open(boolean create) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        if (!create) {
            config.resetOpenMode(SQLiteOpenMode.CREATE);
        }
        config.enforceForeignKeys(true);

        Connection opened;
        try {
            opened = config.createConnection(credentials.jdbcUrl());
        } catch (SQLException e) {
            throw new StartupException("Error opening database " + credentials.path()
                + ". Check that the database path is valid", e);
        }

        try {
            checkThreadSafety(opened);
        } catch (StartupException e) {
            closeAfterFailure(opened, e);
            throw e;
        }
        Logging.info(() -> "Opened SQLite database " + credentials.path());
        return opened;
    }

    /**
     * Reads {@code PRAGMA compile_options} and refuses single-threaded builds.
     *
     * @throws StartupException if the library reports {@code THREADSAFE=0} or no threading mode
     */
    public static void checkThreadSafety(@NotNull Connection connection) {
        String threadSafe = null;
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA compile_options")) {
            while (resultSet.next()) {
                String option = resultSet.getString(1);
                if (option != null && option.startsWith(THREADSAFE_OPTION)) {
                    threadSafe = option.substring(THREADSAFE_OPTION.length());
                }
            }
        } catch (SQLException e) {
            throw new StartupException("Could not read the SQLite compile options", e);
        }

        if (threadSafe == null) {
            throw new StartupException("SQLite reports no threading mode; a serialized build is required");
        }
        if ("0".equals(threadSafe)) {
            throw new StartupException("SQLite was compiled single-threaded (THREADSAFE=0); a serialized build is required");
        }
        String mode = threadSafe;
        Logging.deepInfo(() -> "SQLite THREADSAFE=" + mode);
    }

    private static void closeAfterFailure(Connection opened, StartupException failure) {
        try {
            opened.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public void close() {
        initLock.lock();
        try {
            if (connection == null) {
                return;
            }
            try {
                connection.close();
            } catch (SQLException e) {
                Logging.error("Failed to close SQLite database " + credentials.path(), e);
            } finally {
                connection = null;
            }
        } finally {
            initLock.unlock();
        }
    }
}
