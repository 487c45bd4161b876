package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class InsertSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;

    public InsertSqlBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model) {
        this.sqlType = sqlType;
        this.model = model;
    }

    /**
     * With {@code explicitId} the first placeholder binds the id, otherwise SQLite assigns one.
     */
    public @NotNull String parseInsert(boolean explicitId) {
        StringJoiner columns = new StringJoiner(", ", "(", ")");
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (ColumnModel column : explicitId ? model.columns() : model.valueColumns()) {
            columns.add(sqlType.quote(column.name()));
            placeholders.add("?");
        }

        String table = sqlType.quote(model.tableName());
        if (columns.length() == 2) {
            return "INSERT INTO " + table + " DEFAULT VALUES";
        }
        return "INSERT INTO " + table + " " + columns + " VALUES " + placeholders;
    }
}
