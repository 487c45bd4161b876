package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.exceptions.ConfigurationException;
import io.github.lodestone.orm.api.meta.EntityDeclaration;
import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.sqlite.connections.SQLiteConnectionProvider;
import io.github.lodestone.orm.sqlite.credentials.SQLiteCredentials;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configures an {@link SQLiteDatabase}.
 *
 * <pre>{@code
 * SQLiteDatabase database = new SQLiteDatabaseBuilder()
 *     .withDefaultPath(Path.of("/var/lib/app/db.sqlite3"))
 *     .declare(Sample1.DECLARATION, Sample2.DECLARATION)
 *     .build();
 * }</pre>
 *
 * The file is chosen by {@link DatabasePathResolver} when {@link #build()} runs.
 */
public class SQLiteDatabaseBuilder {
    private Path explicitPath;
    private Path defaultPath;
    private Function<String, String> environment = System::getenv;
    private Function<SQLiteCredentials, SQLiteConnectionProvider> connectionProvider = SQLiteConnectionProvider::new;
    private TypeResolverRegistry resolverRegistry;
    private final List<EntityDeclaration<?>> declarations = new ArrayList<>();

    /**
     * Sets the database path, overriding {@code DB_PATH} and the default path.
     *
     * @throws ConfigurationException if a path was already set
     */
    public SQLiteDatabaseBuilder withCredentials(@NotNull SQLiteCredentials credentials) {
        return withPath(credentials.path());
    }

    public SQLiteDatabaseBuilder withPath(@NotNull Path path) {
        Objects.requireNonNull(path, "Path cannot be null");
        if (explicitPath != null) {
            throw new ConfigurationException("Database path already set to " + explicitPath);
        }
        if (path.toString().isEmpty()) {
            throw new ConfigurationException("Invalid database path '" + path + "'");
        }
        this.explicitPath = path;
        return this;
    }

    /**
     * Sets the path used when neither an explicit path nor {@code DB_PATH} is present.
     *
     * @throws ConfigurationException if a default path was already set
     */
    public SQLiteDatabaseBuilder withDefaultPath(@NotNull Path path) {
        Objects.requireNonNull(path, "Path cannot be null");
        if (defaultPath != null) {
            throw new ConfigurationException("Default database path already set to " + defaultPath);
        }
        this.defaultPath = path;
        return this;
    }

    public SQLiteDatabaseBuilder withEnvironment(@NotNull Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
        return this;
    }

    public SQLiteDatabaseBuilder withConnectionProvider(@NotNull Function<SQLiteCredentials, SQLiteConnectionProvider> connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
        return this;
    }

    public SQLiteDatabaseBuilder withTypeResolverRegistry(@NotNull TypeResolverRegistry resolverRegistry) {
        this.resolverRegistry = Objects.requireNonNull(resolverRegistry, "Resolver registry cannot be null");
        return this;
    }

    public SQLiteDatabaseBuilder declare(@NotNull EntityDeclaration<?>... declarations) {
        Collections.addAll(this.declarations, declarations);
        return this;
    }

    /**
     * @throws io.github.lodestone.orm.api.exceptions.StartupException if no database path can be resolved
     */
    public SQLiteDatabase build() {
        Path path = new DatabasePathResolver(explicitPath, defaultPath, environment).resolve();
        TypeResolverRegistry registry = resolverRegistry != null ? resolverRegistry : new TypeResolverRegistry();

        SQLiteDatabase database = new SQLiteDatabase(connectionProvider.apply(new SQLiteCredentials(path)), registry);
        for (EntityDeclaration<?> declaration : declarations) {
            database.declare(declaration);
        }
        return database;
    }
}
