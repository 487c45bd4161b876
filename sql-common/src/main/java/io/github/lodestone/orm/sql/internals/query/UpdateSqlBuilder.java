package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class UpdateSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;

    public UpdateSqlBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model) {
        this.sqlType = sqlType;
        this.model = model;
    }

    /**
     * Overwrites every column, the id included, of the row whose current id is bound last.
     */
    public @NotNull String parseUpdateFromEntity() {
        StringJoiner assignments = new StringJoiner(", ");
        for (ColumnModel column : model.columns()) {
            assignments.add(sqlType.quote(column.name()) + " = ?");
        }
        return "UPDATE " + sqlType.quote(model.tableName()) + " SET " + assignments
            + " WHERE " + sqlType.quote(ColumnModel.ID) + " = ?";
    }

    public @NotNull String parseSetNull(@NotNull ColumnModel column) {
        return "UPDATE " + sqlType.quote(model.tableName()) + " SET " + sqlType.quote(column.name())
            + " = NULL WHERE " + sqlType.quote(ColumnModel.ID) + " = ?";
    }
}
