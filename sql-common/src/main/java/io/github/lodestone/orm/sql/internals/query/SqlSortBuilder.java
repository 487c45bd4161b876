package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.SortOption;
import io.github.lodestone.orm.api.options.SortOrder;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class SqlSortBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;

    public SqlSortBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model) {
        this.sqlType = sqlType;
        this.model = model;
    }

    public String buildSortOptions(@NotNull Iterable<SortOption> sortOptions) {
        StringJoiner joiner = new StringJoiner(", ");
        for (SortOption sortOption : sortOptions) {
            String column = model.requireColumn(sortOption.field()).name();
            joiner.add(sqlType.quote(column) + " " + (sortOption.order() == SortOrder.ASCENDING ? "ASC" : "DESC"));
        }
        return joiner.toString();
    }
}
