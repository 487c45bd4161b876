package io.github.lodestone.orm.api.meta;

/**
 * An edge of the reference graph: {@code source} holds {@code column}, which points at another entity.
 */
public record ReferenceEdge(EntityModel<?> source, ColumnModel column) {
    public boolean nullable() {
        return column.nullable();
    }

    @Override
    public String toString() {
        return source.tableName() + "." + column.name() + (nullable() ? " (nullable)" : "");
    }
}
