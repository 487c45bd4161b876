package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.options.FilterOption;
import io.github.lodestone.orm.api.options.Operator;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;

import java.util.StringJoiner;

/**
 * Renders filters as a conjunction of placeholders. An equality test against {@code null} becomes
 * {@code IS NULL} and binds nothing.
 */
public final class SqlConditionBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;

    public SqlConditionBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model) {
        this.sqlType = sqlType;
        this.model = model;
    }

    public String buildConditions(Iterable<FilterOption> filters) {
        StringJoiner joiner = new StringJoiner(" AND ");
        for (FilterOption filter : filters) {
            joiner.add(buildColumnCondition(filter));
        }
        return joiner.toString();
    }

    private String buildColumnCondition(FilterOption filter) {
        ColumnModel column = model.requireColumn(filter.field());
        String quoted = sqlType.quote(column.name());

        if (filter.value() == null) {
            if (filter.operator() != Operator.EQ) {
                throw new ValidationException("Cannot compare " + filter.field() + " with null using '"
                    + filter.operator().keyword() + "'");
            }
            return quoted + " IS NULL";
        }
        return quoted + " " + filter.operator().symbol() + " ?";
    }
}
