package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

public final class DeleteSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    public DeleteSqlBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model,
                            SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        this.sqlType = sqlType;
        this.model = model;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;
    }

    public @NotNull String parseDeleteById() {
        return "DELETE FROM " + sqlType.quote(model.tableName()) + " WHERE " + sqlType.quote(ColumnModel.ID) + " = ?";
    }

    /**
     * Deletes the rows a select with the same query would return. Order and window are applied in a
     * sub-select since SQLite's {@code DELETE} only honours them when compiled in.
     */
    public @NotNull String parseDeleteMatching(@NotNull SelectQuery query) {
        String table = sqlType.quote(model.tableName());
        if (query.filters().isEmpty() && !query.windowed()) {
            return "DELETE FROM " + table;
        }
        if (!query.windowed()) {
            return "DELETE FROM " + table + " WHERE " + conditionBuilder.buildConditions(query.filters());
        }

        StringBuilder inner = new StringBuilder("SELECT rowid FROM ").append(table);
        SelectSqlBuilder.appendTail(inner, query, true, conditionBuilder, sortBuilder);
        return "DELETE FROM " + table + " WHERE rowid IN (" + inner + ")";
    }
}
