package io.github.lodestone.orm.sql.internals.query;

import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

/**
 * {@code CREATE TABLE IF NOT EXISTS} for an entity. References become {@code REFERENCES} clauses,
 * checked by the connection when it enforces foreign keys.
 */
public final class RepositoryDdlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final EntityModel<?> model;

    public RepositoryDdlBuilder(QueryParseEngine.SQLType sqlType, EntityModel<?> model) {
        this.sqlType = sqlType;
        this.model = model;
    }

    public @NotNull String parseRepository() {
        StringJoiner definitions = new StringJoiner(", ", "(", ")");
        for (ColumnModel column : model.columns()) {
            definitions.add(columnDefinition(column));
        }
        return "CREATE TABLE IF NOT EXISTS " + sqlType.quote(model.tableName()) + " " + definitions;
    }

    private String columnDefinition(ColumnModel column) {
        StringBuilder definition = new StringBuilder(sqlType.quote(column.name()))
            .append(' ')
            .append(column.storageType().sqlName());

        if (column.isPrimaryKey()) {
            return definition.append(" PRIMARY KEY").toString();
        }
        if (!column.nullable()) {
            definition.append(" NOT NULL");
        }
        if (column.unique()) {
            definition.append(" UNIQUE");
        }
        if (column.isReference()) {
            definition.append(" REFERENCES ")
                .append(sqlType.quote(column.reference().tableName()))
                .append('(').append(sqlType.quote(ColumnModel.ID)).append(')');
        }
        return definition.toString();
    }
}
