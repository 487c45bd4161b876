package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.ConfigurationException;
import io.github.lodestone.orm.api.exceptions.DeclarationException;
import io.github.lodestone.orm.api.resolver.TypeResolver;
import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Knows every declared entity type of one database and derives their schemas.
 *
 * <p>Declaring is cheap and only checks for duplicate classes and tables. The field types of an
 * entity are validated when {@link #schemaFor(Class)} first runs for it, because a reference
 * may name an entity that was not declared yet at that point. Derivation follows references
 * eagerly; an entity that is already being derived further up the stack is linked through an
 * {@link EntityHandle} instead of being derived again, so reference cycles terminate.</p>
 */
public class SchemaRegistry {
    private final TypeResolverRegistry resolverRegistry;

    private final Map<Class<?>, EntityDeclaration<?>> declarations = new LinkedHashMap<>();
    private final Map<String, Class<?>> tables = new HashMap<>();
    private final Map<Class<?>, EntityModel<?>> models = new HashMap<>();
    private final Set<Class<?>> inProgress = new HashSet<>();
    private final Map<Class<?>, List<ReferenceEdge>> incoming = new HashMap<>();

    public SchemaRegistry(TypeResolverRegistry resolverRegistry) {
        this.resolverRegistry = resolverRegistry;
    }

    public TypeResolverRegistry resolverRegistry() {
        return resolverRegistry;
    }

    public synchronized <E extends DbObject> void declare(@NotNull EntityDeclaration<E> declaration) {
        Class<E> entityClass = declaration.entityClass();
        if (declarations.containsKey(entityClass)) {
            throw new ConfigurationException(entityClass.getName() + " is already declared");
        }

        String table = declaration.tableName().toLowerCase();
        Class<?> owner = tables.get(table);
        if (owner != null) {
            throw new ConfigurationException("Table name '" + declaration.tableName() + "' of " + entityClass.getName()
                + " is already used by " + owner.getName());
        }

        declarations.put(entityClass, declaration);
        tables.put(table, entityClass);
        incoming.clear();
        Logging.info(() -> "Declared entity " + declaration);
    }

    public synchronized boolean isDeclared(Class<?> entityClass) {
        return declarations.containsKey(entityClass);
    }

    @SuppressWarnings("unchecked")
    public synchronized <E extends DbObject> @NotNull EntityDeclaration<E> declaration(@NotNull Class<E> entityClass) {
        EntityDeclaration<E> declaration = (EntityDeclaration<E>) declarations.get(entityClass);
        if (declaration == null) {
            throw new DeclarationException(entityClass.getName() + " is not a declared entity");
        }
        return declaration;
    }

    public synchronized List<EntityDeclaration<?>> declarations() {
        return List.copyOf(declarations.values());
    }

    /**
     * Returns the schema of an entity, deriving and caching it on first call.
     *
     * @throws DeclarationException if the entity or one of its field types is unknown
     */
    @SuppressWarnings("unchecked")
    public synchronized <E extends DbObject> @NotNull EntityModel<E> schemaFor(@NotNull Class<E> entityClass) {
        EntityModel<E> model = (EntityModel<E>) models.get(entityClass);
        if (model != null) {
            return model;
        }
        if (inProgress.contains(entityClass)) {
            throw new IllegalStateException("Schema of " + entityClass.getName() + " is still being derived");
        }

        EntityDeclaration<E> declaration = declaration(entityClass);
        inProgress.add(entityClass);
        try {
            model = derive(declaration);
        } finally {
            inProgress.remove(entityClass);
        }

        models.put(entityClass, model);
        EntityModel<E> derived = model;
        Logging.info(() -> "Derived schema " + derived);
        return model;
    }

    /**
     * All reference columns, across every declared entity, that point at {@code target}.
     * Deriving them derives every declared schema.
     */
    public synchronized List<ReferenceEdge> incomingReferences(@NotNull Class<? extends DbObject> target) {
        List<ReferenceEdge> edges = incoming.get(target);
        if (edges != null) {
            return edges;
        }

        List<ReferenceEdge> found = new ArrayList<>();
        for (EntityDeclaration<?> declaration : declarations.values()) {
            EntityModel<?> source = schemaFor(declaration.entityClass());
            for (ColumnModel column : source.valueColumns()) {
                EntityHandle<?> reference = column.reference();
                if (reference != null && reference.entityClass() == target) {
                    found.add(new ReferenceEdge(source, column));
                }
            }
        }

        edges = List.copyOf(found);
        incoming.put(target, edges);
        return edges;
    }

    @SuppressWarnings("unchecked")
    private <E extends DbObject> EntityModel<E> derive(EntityDeclaration<E> declaration) {
        List<ColumnModel> columns = new ArrayList<>();
        columns.add(ColumnModel.primaryKey());

        String owner = declaration.entityClass().getSimpleName();
        for (FieldModel<?> field : declaration.fields()) {
            if (field.isReference()) {
                Class<? extends DbObject> target = (Class<? extends DbObject>) field.type();
                if (!declarations.containsKey(target)) {
                    throw new DeclarationException(owner + "." + field.name() + ": referenced type "
                        + target.getName() + " is not a declared entity");
                }
                if (!models.containsKey(target) && !inProgress.contains(target)) {
                    schemaFor(target);
                }
                columns.add(ColumnModel.reference(field, handle(target)));
                continue;
            }

            TypeResolver<?> resolver = resolverRegistry.resolve(field.type());
            if (resolver == null) {
                throw new DeclarationException(owner + "." + field.name() + ": no converter is registered for "
                    + field.type().getName());
            }
            columns.add(ColumnModel.value(field, resolver));
        }

        return new EntityModel<>(declaration, columns);
    }

    private <T extends DbObject> EntityHandle<T> handle(Class<T> target) {
        return new EntityHandle<>(target, this);
    }
}
