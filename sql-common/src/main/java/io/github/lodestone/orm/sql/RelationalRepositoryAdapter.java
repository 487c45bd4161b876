package io.github.lodestone.orm.sql;

import io.github.lodestone.orm.api.CloseableIterator;
import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.EntityQuery;
import io.github.lodestone.orm.api.RepositoryAdapter;
import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityDeclaration;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.FieldModel;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import io.github.lodestone.orm.sql.internals.repository.SqlParameterBinder;
import io.github.lodestone.orm.sql.internals.repository.SqlStatementExecutor;
import io.github.lodestone.orm.sql.iteration.ResultSetIterator;
import io.github.lodestone.orm.sql.iteration.Row;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Repository for one entity type over a {@link RelationalDatabase}.
 *
 * <p>The schema is derived on first use, so declaring an entity with an unknown field type only
 * fails once the repository is actually used.</p>
 */
public class RelationalRepositoryAdapter<E extends DbObject> implements RepositoryAdapter<E> {
    private final RelationalDatabase database;
    private final Class<E> elementType;
    private final SqlStatementExecutor executor;
    private final SqlParameterBinder binder;

    private volatile EntityModel<E> model;

    protected RelationalRepositoryAdapter(@NotNull RelationalDatabase database, @NotNull Class<E> elementType) {
        this.database = database;
        this.elementType = elementType;
        this.executor = database.executor();
        this.binder = executor.binder();
    }

    @Override
    public @NotNull EntityModel<E> getRepositoryModel() {
        EntityModel<E> current = model;
        if (current == null) {
            current = database.getSchemaRegistry().schemaFor(elementType);
            model = current;
        }
        return current;
    }

    @Override
    public @NotNull Class<E> getElementType() {
        return elementType;
    }

    private QueryParseEngine engine() {
        return database.engineFor(getRepositoryModel());
    }

    @Override
    public @NotNull E create(@NotNull Map<String, ?> values) {
        EntityDeclaration<E> declaration = getRepositoryModel().declaration();
        E entity = newEmpty();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = entry.getKey();
            if (!ColumnModel.ID.equals(name) && declaration.field(name) == null) {
                throw new ValidationException(elementType.getSimpleName() + " has no field '" + name + "'");
            }
            entity.set(name, entry.getValue());
        }

        for (FieldModel<?> field : declaration.fields()) {
            if (!field.hasDefault() && !values.containsKey(field.name())) {
                throw missing(field);
            }
        }

        save(entity);
        return entity;
    }

    @Override
    public @NotNull E create(@NotNull Object... values) {
        EntityDeclaration<E> declaration = getRepositoryModel().declaration();
        if (declaration.keywordOnly()) {
            throw new ValidationException(elementType.getSimpleName() + " only accepts named values");
        }

        List<FieldModel<?>> fields = declaration.fields();
        if (values.length > fields.size()) {
            throw new ValidationException(elementType.getSimpleName() + " takes at most " + fields.size()
                + " values, got " + values.length);
        }

        E entity = newEmpty();
        for (int i = 0; i < fields.size(); i++) {
            FieldModel<?> field = fields.get(i);
            if (i < values.length) {
                entity.set(field.name(), values[i]);
            } else if (!field.hasDefault()) {
                throw missing(field);
            }
        }

        save(entity);
        return entity;
    }

    @Override
    public @NotNull E newEmpty() {
        EntityModel<E> current = getRepositoryModel();
        E entity = current.newInstance();
        entity.bind(database, current);
        entity.applyDefaults();
        return entity;
    }

    @Override
    public @NotNull E newEmpty(long id) {
        E entity = newEmpty();
        entity.setId(id);
        return entity;
    }

    @Override
    public @NotNull EntityQuery<E> getAll() {
        return new EntityQuery<>(this, SelectQuery.all());
    }

    @Override
    public @Nullable E findById(long id) {
        try (CloseableIterator<Row> rows = executor.fetch(engine().parseSelectById(), List.of(id))) {
            return rows.hasNext() ? materialize(rows.next()) : null;
        }
    }

    @Override
    public @NotNull List<E> find(@NotNull SelectQuery query) {
        List<E> results = new ArrayList<>();
        try (CloseableIterator<E> iterator = findIterator(query)) {
            while (iterator.hasNext()) {
                results.add(iterator.next());
            }
        }
        return results;
    }

    @Override
    public @NotNull CloseableIterator<E> findIterator(@NotNull SelectQuery query) {
        EntityModel<E> current = getRepositoryModel();
        CloseableIterator<Row> rows = executor.fetch(engine().parseSelect(query), binder.selectParameters(current, query));
        return new CloseableIterator<>() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public E next() {
                return materialize(rows.next());
            }

            @Override
            public void close() {
                rows.close();
            }
        };
    }

    @Override
    public @NotNull Stream<E> findStream(@NotNull SelectQuery query) {
        return ResultSetIterator.stream(findIterator(query));
    }

    @Override
    public @Nullable E first(@NotNull SelectQuery query) {
        SelectQuery bounded = query.windowed() ? query : query.withWindow(0, 1);
        try (CloseableIterator<E> iterator = findIterator(bounded)) {
            return iterator.hasNext() ? iterator.next() : null;
        }
    }

    @Override
    public @NotNull List<Long> findIds(@NotNull SelectQuery query) {
        return executor.fetchLongs(engine().parseQueryIds(query), binder.selectParameters(getRepositoryModel(), query));
    }

    @Override
    public long count(@NotNull SelectQuery query) {
        SelectQuery unwindowed = query.unwindowed();
        return executor.fetchLong(engine().parseCount(unwindowed), binder.filterParameters(getRepositoryModel(), unwindowed));
    }

    @Override
    public void save(@NotNull E entity) {
        checkOwned(entity);
        switch (entity.getState()) {
            case TRANSIENT -> insert(entity);
            case PERSISTED -> update(entity);
            case STALE -> throw new ConsistencyException("Cannot save a deleted " + elementType.getSimpleName());
        }
    }

    private void insert(E entity) {
        Map<String, Object> row = entity.toStorage();
        Long explicitId = entity.pendingId();

        List<Object> parameters = new ArrayList<>(row.size() + 1);
        if (explicitId != null) {
            parameters.add(explicitId);
        }
        parameters.addAll(row.values());

        long id = executor.execute(engine().parseInsert(explicitId != null), parameters)
            .lastInsertId()
            .orElseThrow(() -> new ConsistencyException("Insert into " + getRepositoryModel().tableName() + " reported no row id"));
        entity.markPersisted(id);
        Logging.deepInfo(() -> "Inserted " + elementType.getSimpleName() + " #" + id);
    }

    private void update(E entity) {
        Map<String, Object> row = entity.toStorage();
        long storedId = entity.storedId();
        long newId = entity.getId();

        List<Object> parameters = new ArrayList<>(row.size() + 2);
        parameters.add(newId);
        parameters.addAll(row.values());
        parameters.add(storedId);

        int updated = executor.execute(engine().parseUpdateFromEntity(), parameters).updateCount();
        if (updated == 0) {
            entity.markStale();
            throw new ConsistencyException(elementType.getSimpleName() + " #" + storedId + " no longer exists");
        }
        entity.markPersisted(newId);
        Logging.deepInfo(() -> "Updated " + elementType.getSimpleName() + " #" + newId);
    }

    @Override
    public void delete(@NotNull E entity) {
        checkOwned(entity);
        switch (entity.getState()) {
            case TRANSIENT -> throw new ValidationException("Cannot delete a " + elementType.getSimpleName() + " that was never saved");
            case STALE -> throw new ConsistencyException(elementType.getSimpleName() + " was already deleted");
            case PERSISTED -> {
                database.cascadeEngine().cascadeDelete(getRepositoryModel(), entity.storedId());
                entity.markStale();
            }
        }
    }

    @Override
    public int delete(@NotNull SelectQuery query) {
        EntityModel<E> current = getRepositoryModel();
        if (database.getSchemaRegistry().incomingReferences(elementType).isEmpty()) {
            return executor.execute(engine().parseDeleteMatching(query), binder.selectParameters(current, query)).updateCount();
        }

        int deleted = 0;
        for (long id : findIds(query)) {
            if (database.cascadeEngine().cascadeDelete(current, id)) {
                deleted++;
            }
        }
        return deleted;
    }

    private E materialize(Row row) {
        EntityModel<E> current = getRepositoryModel();
        E entity = current.newInstance();
        entity.bind(database, current);
        entity.load(row.asMap());
        return entity;
    }

    private void checkOwned(E entity) {
        if (entity.getClass() != elementType) {
            throw new ValidationException(entity.getClass().getSimpleName() + " is not a " + elementType.getSimpleName());
        }
    }

    private ValidationException missing(FieldModel<?> field) {
        return new ValidationException("Missing value for " + elementType.getSimpleName() + "." + field.name());
    }

    @Override
    public String toString() {
        return "RelationalRepositoryAdapter[" + elementType.getSimpleName() + "]";
    }
}
