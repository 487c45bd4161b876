package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class SelectSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    private final String table;
    private final String columns;

    public SelectSqlBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model,
                            SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        this.sqlType = sqlType;
        this.model = model;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;

        this.table = sqlType.quote(model.tableName());
        StringJoiner joiner = new StringJoiner(", ");
        for (ColumnModel column : model.columns()) {
            joiner.add(sqlType.quote(column.name()));
        }
        this.columns = joiner.toString();
    }

    /**
     * Full-row select. A windowed query ends in {@code LIMIT ? OFFSET ?}, binding {@code -1} when
     * there is no upper bound.
     */
    public @NotNull String parseSelect(@NotNull SelectQuery query) {
        return build(columns, query, true);
    }

    public @NotNull String parseQueryIds(@NotNull SelectQuery query) {
        return build(sqlType.quote(ColumnModel.ID), query, true);
    }

    /**
     * Count of the filtered rows. Sorting and the window play no part.
     */
    public @NotNull String parseCount(@NotNull SelectQuery query) {
        return build("COUNT(*)", query, false);
    }

    public @NotNull String parseSelectById() {
        return "SELECT " + columns + " FROM " + table + " WHERE " + sqlType.quote(ColumnModel.ID) + " = ?";
    }

    public @NotNull String parseSelectIdsWhere(@NotNull String column) {
        return "SELECT " + sqlType.quote(ColumnModel.ID) + " FROM " + table + " WHERE " + sqlType.quote(column) + " = ?";
    }

    String build(String projection, SelectQuery query, boolean ordered) {
        StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(table);
        appendTail(sql, query, ordered, conditionBuilder, sortBuilder);
        return sql.toString();
    }

    static void appendTail(StringBuilder sql, SelectQuery query, boolean ordered,
                           SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        if (!query.filters().isEmpty()) {
            sql.append(" WHERE ").append(conditionBuilder.buildConditions(query.filters()));
        }
        if (!ordered) {
            return;
        }
        if (!query.sortOptions().isEmpty()) {
            sql.append(" ORDER BY ").append(sortBuilder.buildSortOptions(query.sortOptions()));
        }
        if (query.windowed()) {
            sql.append(" LIMIT ? OFFSET ?");
        }
    }

    @Override
    public String toString() {
        return "SelectSqlBuilder[" + model.tableName() + "]";
    }
}
