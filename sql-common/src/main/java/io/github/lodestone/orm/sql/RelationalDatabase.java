package io.github.lodestone.orm.sql;

import io.github.lodestone.orm.api.CloseableIterator;
import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.EntityContext;
import io.github.lodestone.orm.api.exceptions.ConfigurationException;
import io.github.lodestone.orm.api.exceptions.StartupException;
import io.github.lodestone.orm.api.meta.EntityDeclaration;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.SchemaRegistry;
import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.CascadeEngine;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import io.github.lodestone.orm.sql.internals.SQLConnectionProvider;
import io.github.lodestone.orm.sql.internals.SqlExceptionTranslator;
import io.github.lodestone.orm.sql.internals.repository.SqlParameterBinder;
import io.github.lodestone.orm.sql.internals.repository.SqlStatementExecutor;
import io.github.lodestone.orm.sql.internals.repository.StatementResult;
import io.github.lodestone.orm.sql.iteration.Row;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handle over one relational connection: the entity declarations, their repositories and the
 * initialization hooks.
 *
 * <pre>{@code
 * RelationalDatabase database = ...;
 * database.declare(Sample1.DECLARATION, Sample2.DECLARATION);
 * Sample1 sample = database.repository(Sample1.class).create(42L);
 * }</pre>
 */
public class RelationalDatabase implements EntityContext, AutoCloseable {
    /**
     * Priority at which the tables are created during {@link #runInitHooks()}.
     */
    public static final int TABLE_CREATION_PRIORITY = 0;

    protected final SQLConnectionProvider connectionProvider;
    private final QueryParseEngine.SQLType sqlType;
    private final SchemaRegistry schemas;
    private final SqlStatementExecutor executor;
    private final CascadeEngine cascadeEngine;

    private final Map<Class<?>, RelationalRepositoryAdapter<?>> repositories = new ConcurrentHashMap<>();
    private final Map<EntityModel<?>, QueryParseEngine> engines = new ConcurrentHashMap<>();
    private final List<RegisteredHook> hooks = new ArrayList<>();
    private boolean initialized;

    public RelationalDatabase(@NotNull SQLConnectionProvider connectionProvider,
                              @NotNull SqlExceptionTranslator translator,
                              @NotNull TypeResolverRegistry resolverRegistry,
                              @NotNull QueryParseEngine.SQLType sqlType) {
        this.connectionProvider = connectionProvider;
        this.sqlType = sqlType;
        this.schemas = new SchemaRegistry(resolverRegistry);
        this.executor = new SqlStatementExecutor(connectionProvider, translator, new SqlParameterBinder());
        this.cascadeEngine = new CascadeEngine(executor, schemas, this::engineFor);
    }

    public RelationalDatabase declare(@NotNull EntityDeclaration<?>... declarations) {
        for (EntityDeclaration<?> declaration : declarations) {
            schemas.declare(declaration);
        }
        return this;
    }

    @Override
    public @NotNull SchemaRegistry getSchemaRegistry() {
        return schemas;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends DbObject> @NotNull RelationalRepositoryAdapter<T> repository(@NotNull Class<T> entityClass) {
        RelationalRepositoryAdapter<?> existing = repositories.get(entityClass);
        if (existing != null) {
            return (RelationalRepositoryAdapter<T>) existing;
        }

        // Fails with DeclarationException for undeclared types.
        schemas.declaration(entityClass);
        return (RelationalRepositoryAdapter<T>) repositories.computeIfAbsent(entityClass,
            key -> new RelationalRepositoryAdapter<>(this, entityClass));
    }

    @ApiStatus.Internal
    public @NotNull QueryParseEngine engineFor(@NotNull EntityModel<?> model) {
        return engines.computeIfAbsent(model, key -> {
            Logging.info(() -> "Creating QueryParseEngine for table " + key.tableName() + " with sqlType: " + sqlType.displayName());
            return new QueryParseEngine(sqlType, key);
        });
    }

    @ApiStatus.Internal
    public @NotNull SqlStatementExecutor executor() {
        return executor;
    }

    @ApiStatus.Internal
    public @NotNull CascadeEngine cascadeEngine() {
        return cascadeEngine;
    }

    /**
     * Registers work to run during {@link #runInitHooks()}. Hooks run in ascending priority, and in
     * registration order within one priority. Negative priorities run before the tables exist.
     *
     * @throws ConfigurationException if {@code priority} is {@link #TABLE_CREATION_PRIORITY}
     */
    public synchronized RelationalDatabase registerInitHook(int priority, @NotNull InitHook hook) {
        if (priority == TABLE_CREATION_PRIORITY) {
            throw new ConfigurationException("Init hook priority " + TABLE_CREATION_PRIORITY + " is reserved for table creation");
        }
        if (initialized) {
            throw new ConfigurationException("Init hooks have already run");
        }
        hooks.add(new RegisteredHook(priority, hook));
        return this;
    }

    /**
     * Creates the tables and runs the registered hooks, once.
     *
     * @throws StartupException if the hooks have already run
     */
    public synchronized void runInitHooks() {
        if (initialized) {
            throw new StartupException("Database is already initialized");
        }
        initialized = true;

        List<RegisteredHook> ordered = new ArrayList<>(hooks);
        ordered.add(new RegisteredHook(TABLE_CREATION_PRIORITY, RelationalDatabase::createTables));
        ordered.sort(Comparator.comparingInt(RegisteredHook::priority));

        for (RegisteredHook registered : ordered) {
            Logging.deepInfo(() -> "Running init hook with priority " + registered.priority());
            registered.hook().run(this);
        }
    }

    /**
     * Issues {@code CREATE TABLE IF NOT EXISTS} for every declared entity, in declaration order.
     */
    public void createTables() {
        for (EntityDeclaration<?> declaration : schemas.declarations()) {
            EntityModel<?> model = schemas.schemaFor(declaration.entityClass());
            executor.execute(engineFor(model).parseRepository(), List.of());
            Logging.info(() -> "Created table " + model.tableName());
        }
    }

    /**
     * Runs a raw statement with bound parameters.
     *
     * @return the update count and, for inserts, the id of the inserted row
     */
    public @NotNull StatementResult execute(@NotNull String sql, Object... parameters) {
        return executor.execute(sql, Arrays.asList(parameters));
    }

    /**
     * Runs a raw query. The returned cursor must be exhausted or closed.
     */
    public @NotNull CloseableIterator<Row> fetch(@NotNull String sql, Object... parameters) {
        return executor.fetch(sql, Arrays.asList(parameters));
    }

    public @NotNull List<Row> fetchAll(@NotNull String sql, Object... parameters) {
        return executor.fetchAll(sql, Arrays.asList(parameters));
    }

    public boolean isConnected() {
        return connectionProvider.isConnected();
    }

    @Override
    public void close() {
        connectionProvider.close();
    }

    private record RegisteredHook(int priority, InitHook hook) {}
}
