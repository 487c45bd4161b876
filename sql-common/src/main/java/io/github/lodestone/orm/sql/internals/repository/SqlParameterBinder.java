package io.github.lodestone.orm.sql.internals.repository;

import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.FilterOption;
import io.github.lodestone.orm.api.options.SelectQuery;
import org.jetbrains.annotations.NotNull;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes and binds placeholder values in the order the statement builders emit them.
 */
public final class SqlParameterBinder {
    /**
     * Storage values of the filters. {@code null} equality tests render as {@code IS NULL} and bind nothing.
     */
    public @NotNull List<Object> filterParameters(@NotNull EntityModel<?> model, @NotNull SelectQuery query) {
        List<Object> parameters = new ArrayList<>(query.filters().size() + 2);
        for (FilterOption filter : query.filters()) {
            if (filter.value() == null) {
                continue;
            }
            parameters.add(model.requireColumn(filter.field()).toStorage(filter.value()));
        }
        return parameters;
    }

    /**
     * Filter values followed by {@code LIMIT} and {@code OFFSET} when the query is windowed.
     */
    public @NotNull List<Object> selectParameters(@NotNull EntityModel<?> model, @NotNull SelectQuery query) {
        List<Object> parameters = filterParameters(model, query);
        if (query.windowed()) {
            parameters.add(query.limit());
            parameters.add(query.offset());
        }
        return parameters;
    }

    public void bind(@NotNull PreparedStatement statement, @NotNull List<?> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            statement.setObject(i + 1, parameters.get(i));
        }
    }
}
