package io.github.lodestone.orm.api.options;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of a table scan: filters, sort keys and an optional window.
 *
 * <p>{@code limit} is {@code -1} when the window has no upper bound. Each {@code with*}
 * method returns a new value and leaves the receiver untouched.</p>
 */
public record SelectQuery(
    List<FilterOption> filters,
    List<SortOption> sortOptions,
    long offset,
    long limit,
    boolean windowed
) {
    private static final SelectQuery ALL = new SelectQuery(List.of(), List.of(), 0, -1, false);

    public SelectQuery {
        filters = List.copyOf(filters);
        sortOptions = List.copyOf(sortOptions);
    }

    public static SelectQuery all() {
        return ALL;
    }

    @Contract("_ -> new")
    public @NotNull SelectQuery withFilter(@NotNull FilterOption filter) {
        for (FilterOption existing : filters) {
            if (existing.field().equals(filter.field()) && existing.operator() == filter.operator()) {
                throw new ValidationException("This query is already filtered using " + filter.field()
                    + "__" + filter.operator().keyword());
            }
        }

        List<FilterOption> merged = new ArrayList<>(filters);
        merged.add(filter);
        return new SelectQuery(merged, sortOptions, offset, limit, windowed);
    }

    /**
     * Replaces the sort keys.
     */
    @Contract("_ -> new")
    public @NotNull SelectQuery withSort(@NotNull List<SortOption> sortOptions) {
        return new SelectQuery(filters, sortOptions, offset, limit, windowed);
    }

    /**
     * Applies the half-open window {@code [start, end)}; {@code end} may be {@code -1} for no upper bound.
     * An {@code end} at or before {@code start} yields an empty window.
     *
     * @throws ValidationException if a window is already set or a bound is negative
     */
    @Contract("_, _ -> new")
    public @NotNull SelectQuery withWindow(long start, long end) {
        if (windowed) {
            throw new ValidationException("Query limits already set");
        }
        if (start < 0) {
            throw new ValidationException("Cannot slice from a negative offset; reverse the ordering instead");
        }
        if (end < -1) {
            throw new ValidationException("Cannot slice to a negative end; reverse the ordering and set a start offset instead");
        }

        long newLimit = end == -1 ? -1 : Math.max(0, end - start);
        return new SelectQuery(filters, sortOptions, start, newLimit, true);
    }

    /**
     * The same query without its window, as used by {@code count()}.
     */
    public @NotNull SelectQuery unwindowed() {
        return windowed ? new SelectQuery(filters, sortOptions, 0, -1, false) : this;
    }

    public boolean hasLimit() {
        return limit >= 0;
    }
}
