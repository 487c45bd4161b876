package io.github.lodestone.orm.api;

import io.github.lodestone.orm.api.exceptions.AmbiguousResultException;
import io.github.lodestone.orm.api.exceptions.NotFoundException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.options.FilterOption;
import io.github.lodestone.orm.api.options.QueryField;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.api.options.SortOption;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A lazily executed query over one entity type.
 *
 * <p>Queries are immutable: every refinement returns a new query. Nothing runs until the query is
 * iterated, counted or deleted, and every iteration runs the statement again, so two iterations
 * may see different rows.</p>
 *
 * <pre>{@code
 * for (Sample sample : samples.getAll().where("a").gte(10).orderBy("-id").slice(0, 5)) {
 *     ...
 * }
 * samples.getAll().orderBy("-id").slice(10).delete(); // keep the ten newest
 * }</pre>
 *
 * <p>Breaking out of a for-each loop early leaves the cursor open until it is garbage collected;
 * use {@link #stream()} in a try-with-resources block, or {@link #toList()}, when that matters.</p>
 */
public final class EntityQuery<E extends DbObject> implements Iterable<E> {
    private final RepositoryAdapter<E> adapter;
    private final SelectQuery query;

    public EntityQuery(@NotNull RepositoryAdapter<E> adapter, @NotNull SelectQuery query) {
        this.adapter = adapter;
        this.query = query;
    }

    public @NotNull SelectQuery toSelectQuery() {
        return query;
    }

    @Contract("_ -> new")
    public @NotNull QueryField<E> where(@NotNull String field) {
        return new QueryField<>(this, field);
    }

    @Contract("_ -> new")
    public @NotNull EntityQuery<E> where(@NotNull FilterOption... filters) {
        SelectQuery refined = query;
        for (FilterOption filter : filters) {
            adapter.getRepositoryModel().requireColumn(filter.field());
            refined = refined.withFilter(filter);
        }
        return new EntityQuery<>(adapter, refined);
    }

    /**
     * Adds a filter written as {@code field__op}, for example {@code where("age__lt", 30)}.
     */
    @Contract("_, _ -> new")
    public @NotNull EntityQuery<E> where(@NotNull String spec, @Nullable Object value) {
        return where(FilterOption.parse(spec, value));
    }

    @Contract("_ -> new")
    public @NotNull EntityQuery<E> where(@NotNull Map<String, ?> filters) {
        List<FilterOption> parsed = new ArrayList<>(filters.size());
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            parsed.add(FilterOption.parse(entry.getKey(), entry.getValue()));
        }
        return where(parsed.toArray(new FilterOption[0]));
    }

    /**
     * Replaces the sort keys. {@code "-id"} sorts descending, {@code "id"} or {@code "+id"} ascending.
     */
    @Contract("_ -> new")
    public @NotNull EntityQuery<E> orderBy(@NotNull String... specs) {
        List<SortOption> options = new ArrayList<>(specs.length);
        for (String spec : specs) {
            options.add(SortOption.parse(spec));
        }
        return orderBy(options.toArray(new SortOption[0]));
    }

    @Contract("_ -> new")
    public @NotNull EntityQuery<E> orderBy(@NotNull SortOption... options) {
        for (SortOption option : options) {
            adapter.getRepositoryModel().requireColumn(option.field());
        }
        return new EntityQuery<>(adapter, query.withSort(Arrays.asList(options)));
    }

    /**
     * Skips the first {@code start} rows.
     */
    @Contract("_ -> new")
    public @NotNull EntityQuery<E> slice(long start) {
        return new EntityQuery<>(adapter, query.withWindow(start, -1));
    }

    /**
     * Keeps rows {@code start} (inclusive) to {@code end} (exclusive), after filtering and ordering.
     */
    @Contract("_, _ -> new")
    public @NotNull EntityQuery<E> slice(long start, long end) {
        if (end < 0) {
            throw new ValidationException("Cannot exclude rows from the end; reverse the ordering and set a start offset instead");
        }
        return new EntityQuery<>(adapter, query.withWindow(start, end));
    }

    @Contract("_ -> new")
    public @NotNull EntityQuery<E> limit(long count) {
        return slice(0, count);
    }

    @Override
    public @NotNull CloseableIterator<E> iterator() {
        return adapter.findIterator(query);
    }

    public @NotNull Stream<E> stream() {
        return adapter.findStream(query);
    }

    public @NotNull List<E> toList() {
        return adapter.find(query);
    }

    public @Nullable E first() {
        return adapter.first(query);
    }

    /**
     * @throws NotFoundException if no row matches
     * @throws AmbiguousResultException if more than one row matches
     */
    public @NotNull E one() {
        return optional().orElseThrow(() -> new NotFoundException(
            "No " + adapter.getElementType().getSimpleName() + " matches " + query.filters()));
    }

    /**
     * @throws AmbiguousResultException if more than one row matches
     */
    public @NotNull Optional<E> optional() {
        try (CloseableIterator<E> iterator = adapter.findIterator(query)) {
            if (!iterator.hasNext()) {
                return Optional.empty();
            }
            E found = iterator.next();
            if (iterator.hasNext()) {
                throw new AmbiguousResultException(
                    "More than one " + adapter.getElementType().getSimpleName() + " matches " + query.filters());
            }
            return Optional.of(found);
        }
    }

    /**
     * Number of rows matching the filters, regardless of any window.
     */
    public long count() {
        return adapter.count(query.unwindowed());
    }

    /**
     * Deletes the filtered, ordered and windowed rows, cascading to their dependents.
     *
     * @return the number of rows of this type that were deleted
     */
    public int delete() {
        return adapter.delete(query);
    }

    @Override
    public String toString() {
        return "EntityQuery[" + adapter.getElementType().getSimpleName() + " " + query + "]";
    }
}
