package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.exceptions.StartupException;
import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.RelationalDatabase;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import io.github.lodestone.orm.sqlite.connections.SQLiteConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A {@link RelationalDatabase} stored in one SQLite file.
 *
 * <p>A new file is created with {@link #init(boolean)}, which also creates the tables and runs the
 * init hooks. An existing file is opened on first use, or eagerly with {@link #open()}.</p>
 */
public class SQLiteDatabase extends RelationalDatabase {
    private final SQLiteConnectionProvider sqliteProvider;

    public SQLiteDatabase(@NotNull SQLiteConnectionProvider connectionProvider, @NotNull TypeResolverRegistry resolverRegistry) {
        super(connectionProvider, new SQLiteExceptionTranslator(), resolverRegistry, QueryParseEngine.SQLType.SQLITE);
        this.sqliteProvider = connectionProvider;
    }

    public @NotNull Path path() {
        return sqliteProvider.credentials().path();
    }

    /**
     * Creates the database file, its tables, and runs the init hooks.
     *
     * @param force delete an existing file first instead of failing
     * @throws StartupException if the database is already open, or the file exists and {@code force} is not set
     */
    public void init(boolean force) {
        if (sqliteProvider.isConnected()) {
            throw new StartupException("Database is already loaded, cannot re-init");
        }

        Path path = path();
        if (Files.exists(path)) {
            if (!force) {
                throw new StartupException("The database " + path + " already exists, force its re-initialization to replace it");
            }
            try {
                Files.delete(path);
            } catch (IOException e) {
                throw new StartupException("Could not delete the existing database " + path, e);
            }
            Logging.warn("Deleted existing database " + path);
        }

        sqliteProvider.create();
        runInitHooks();
        Logging.info(() -> "Initialized database " + path);
    }

    /**
     * Opens the existing database file now rather than on first use.
     *
     * @throws StartupException if the file does not exist
     */
    public SQLiteDatabase open() {
        sqliteProvider.getConnection();
        return this;
    }
}
