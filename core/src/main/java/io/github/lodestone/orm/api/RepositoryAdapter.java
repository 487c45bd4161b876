package io.github.lodestone.orm.api;

import io.github.lodestone.orm.api.exceptions.AlreadyExistsException;
import io.github.lodestone.orm.api.exceptions.AmbiguousResultException;
import io.github.lodestone.orm.api.exceptions.NotFoundException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.FilterOption;
import io.github.lodestone.orm.api.options.SelectQuery;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistence operations for one entity type.
 *
 * @param <E> the entity type
 */
public interface RepositoryAdapter<E extends DbObject> {
    @NotNull EntityModel<E> getRepositoryModel();

    @NotNull Class<E> getElementType();

    /**
     * Builds an instance from named values, filling in defaults, and inserts it right away.
     *
     * @throws ValidationException if a value is missing, unknown or of the wrong type
     * @throws AlreadyExistsException if a unique column collides
     */
    @NotNull E create(@NotNull Map<String, ?> values);

    /**
     * Builds an instance from values given in declaration order, filling in defaults for the
     * trailing fields, and inserts it right away. Not available for keyword-only declarations.
     */
    @NotNull E create(@NotNull Object... values);

    /**
     * A transient instance holding only its defaults. Nothing is written until {@link DbObject#save()}.
     */
    @NotNull E newEmpty();

    /**
     * A transient instance that will be inserted with the given id.
     */
    @NotNull E newEmpty(long id);

    @NotNull EntityQuery<E> getAll();

    /**
     * @throws NotFoundException if no row matches
     * @throws AmbiguousResultException if more than one row matches
     */
    default @NotNull E getOne(@NotNull FilterOption... filters) {
        return getAll().where(filters).one();
    }

    default @NotNull E getOne(@NotNull String spec, @Nullable Object value) {
        return getAll().where(spec, value).one();
    }

    /**
     * Like {@link #getOne(FilterOption...)} but empty instead of failing when nothing matches.
     */
    default @NotNull Optional<E> getOpt(@NotNull FilterOption... filters) {
        return getAll().where(filters).optional();
    }

    default @NotNull Optional<E> getOpt(@NotNull String spec, @Nullable Object value) {
        return getAll().where(spec, value).optional();
    }

    @Nullable E findById(long id);

    @NotNull List<E> find(@NotNull SelectQuery query);

    @NotNull CloseableIterator<E> findIterator(@NotNull SelectQuery query);

    @NotNull Stream<E> findStream(@NotNull SelectQuery query);

    @Nullable E first(@NotNull SelectQuery query);

    @NotNull List<Long> findIds(@NotNull SelectQuery query);

    /**
     * Counts the rows matching the query's filters. The window is ignored.
     */
    long count(@NotNull SelectQuery query);

    /**
     * Inserts a transient instance or overwrites the whole row of a persisted one.
     */
    void save(@NotNull E entity);

    /**
     * Deletes the instance's row, cascading to rows that reference it, and marks the instance stale.
     */
    void delete(@NotNull E entity);

    /**
     * Deletes every row selected by filters, order and window, cascading per row.
     *
     * @return the number of rows of this type that were deleted
     */
    int delete(@NotNull SelectQuery query);
}
