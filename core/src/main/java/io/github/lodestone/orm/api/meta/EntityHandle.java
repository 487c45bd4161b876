package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;

/**
 * Forward reference to an entity schema that may still be under construction.
 */
public final class EntityHandle<E extends DbObject> {
    private final Class<E> entityClass;
    private final SchemaRegistry registry;

    EntityHandle(Class<E> entityClass, SchemaRegistry registry) {
        this.entityClass = entityClass;
        this.registry = registry;
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    public String tableName() {
        return registry.declaration(entityClass).tableName();
    }

    public EntityModel<E> model() {
        return registry.schemaFor(entityClass);
    }

    @Override
    public String toString() {
        return "EntityHandle[" + entityClass.getSimpleName() + "]";
    }
}
