package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The derived schema of an entity type: {@code id} first, then one column per declared field.
 */
public final class EntityModel<E extends DbObject> {
    private final EntityDeclaration<E> declaration;
    private final List<ColumnModel> columns;
    private final List<ColumnModel> valueColumns;
    private final Map<String, ColumnModel> byField;
    private final Map<String, ColumnModel> byColumn;

    EntityModel(EntityDeclaration<E> declaration, List<ColumnModel> columns) {
        this.declaration = declaration;
        this.columns = List.copyOf(columns);
        this.valueColumns = this.columns.subList(1, this.columns.size());

        Map<String, ColumnModel> fieldMap = new HashMap<>();
        Map<String, ColumnModel> columnMap = new HashMap<>();
        for (ColumnModel column : columns) {
            fieldMap.put(column.fieldName(), column);
            columnMap.put(column.name(), column);
        }
        this.byField = Collections.unmodifiableMap(fieldMap);
        this.byColumn = Collections.unmodifiableMap(columnMap);
    }

    public EntityDeclaration<E> declaration() {
        return declaration;
    }

    public Class<E> entityClass() {
        return declaration.entityClass();
    }

    public String tableName() {
        return declaration.tableName();
    }

    public List<ColumnModel> columns() {
        return columns;
    }

    public ColumnModel idColumn() {
        return columns.get(0);
    }

    /**
     * All columns except {@code id}, in declaration order.
     */
    public List<ColumnModel> valueColumns() {
        return valueColumns;
    }

    /**
     * Looks a column up by field name ({@code "id"} included).
     */
    public @Nullable ColumnModel column(String fieldName) {
        return byField.get(fieldName);
    }

    public @NotNull ColumnModel requireColumn(String fieldName) {
        ColumnModel column = byField.get(fieldName);
        if (column == null) {
            throw new ValidationException(entityClass().getSimpleName() + " has no field '" + fieldName + "'");
        }
        return column;
    }

    public @Nullable ColumnModel columnNamed(String columnName) {
        return byColumn.get(columnName);
    }

    public E newInstance() {
        return declaration.newInstance();
    }

    @Override
    public String toString() {
        return "EntityModel[" + tableName() + " " + columns + "]";
    }
}
