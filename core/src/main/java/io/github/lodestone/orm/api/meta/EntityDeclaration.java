package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.DeclarationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * The table name and ordered field list of an entity type.
 *
 * <p>Local rules (naming, reserved names, default ordering) are checked by {@link Builder#build()}.
 * Whether each field type can be stored is checked later, when the {@link SchemaRegistry}
 * derives the schema on first use.</p>
 *
 * @param <E> the entity type
 */
public final class EntityDeclaration<E extends DbObject> {
    private static final Pattern FIELD_NAME = Pattern.compile("[a-z][a-z0-9_]*");
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Set<String> RESERVED = Set.of("id", "rowid", "oid", "_rowid_");

    private final Class<E> entityClass;
    private final String tableName;
    private final Supplier<E> factory;
    private final List<FieldModel<?>> fields;
    private final Map<String, FieldModel<?>> fieldsByName;
    private final boolean keywordOnly;

    private EntityDeclaration(Class<E> entityClass, String tableName, Supplier<E> factory, List<FieldModel<?>> fields, boolean keywordOnly) {
        this.entityClass = entityClass;
        this.tableName = tableName;
        this.factory = factory;
        this.fields = List.copyOf(fields);
        this.keywordOnly = keywordOnly;

        Map<String, FieldModel<?>> byName = new LinkedHashMap<>();
        for (FieldModel<?> field : fields) {
            byName.put(field.name(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    @Contract("_, _, _ -> new")
    public static <E extends DbObject> @NotNull Builder<E> builder(@NotNull Class<E> entityClass, @NotNull String tableName, @NotNull Supplier<E> factory) {
        return new Builder<>(entityClass, tableName, factory);
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    public String tableName() {
        return tableName;
    }

    public List<FieldModel<?>> fields() {
        return fields;
    }

    public @Nullable FieldModel<?> field(String name) {
        return fieldsByName.get(name);
    }

    public boolean keywordOnly() {
        return keywordOnly;
    }

    public E newInstance() {
        E instance = factory.get();
        if (instance == null || instance.getClass() != entityClass) {
            throw new DeclarationException("Factory of " + entityClass.getSimpleName() + " must return a new " + entityClass.getSimpleName());
        }
        return instance;
    }

    @Override
    public String toString() {
        return entityClass.getSimpleName() + "(table=" + tableName + ", fields=" + fieldsByName.keySet() + ")";
    }

    public static final class Builder<E extends DbObject> {
        private final Class<E> entityClass;
        private final String tableName;
        private final Supplier<E> factory;
        private final List<FieldModel<?>> fields = new ArrayList<>();
        private boolean keywordOnly;

        private Builder(Class<E> entityClass, String tableName, Supplier<E> factory) {
            this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
            this.tableName = Objects.requireNonNull(tableName, "tableName").trim();
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<E> field(@NotNull FieldModel<?> field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        public Builder<E> fields(@NotNull FieldModel<?>... fields) {
            for (FieldModel<?> field : fields) {
                field(field);
            }
            return this;
        }

        /**
         * Values can then only be passed by name, which lifts the rule that defaulted fields must come last.
         */
        public Builder<E> keywordOnly() {
            this.keywordOnly = true;
            return this;
        }

        public EntityDeclaration<E> build() {
            String owner = entityClass.getSimpleName();
            if (!TABLE_NAME.matcher(tableName).matches()) {
                throw new DeclarationException("Invalid table name '" + tableName + "' for " + owner);
            }

            Set<String> names = new HashSet<>();
            Map<String, FieldModel<?>> columns = new HashMap<>();
            FieldModel<?> firstDefaulted = null;
            for (FieldModel<?> field : fields) {
                String name = field.name();
                if (!FIELD_NAME.matcher(name).matches()) {
                    throw new DeclarationException(owner + "." + name + ": field names must be lowercase and start with a letter");
                }
                if (RESERVED.contains(name)) {
                    throw new DeclarationException(owner + "." + name + ": '" + name + "' is a reserved name");
                }
                if (!names.add(name)) {
                    throw new DeclarationException(owner + "." + name + " is declared twice");
                }

                FieldModel<?> clash = columns.putIfAbsent(field.columnName(), field);
                if (clash != null) {
                    throw new DeclarationException(owner + "." + name + " conflicts with " + owner + "." + clash.name()
                        + " on column '" + field.columnName() + "'");
                }
                if (RESERVED.contains(field.columnName())) {
                    throw new DeclarationException(owner + "." + name + ": column '" + field.columnName() + "' is reserved");
                }

                if (field.hasDefault()) {
                    if (firstDefaulted == null) firstDefaulted = field;
                } else if (firstDefaulted != null && !keywordOnly) {
                    throw new DeclarationException(owner + "." + name + " has no default but follows defaulted field "
                        + firstDefaulted.name() + "; reorder the fields or make the declaration keyword-only");
                }
            }

            return new EntityDeclaration<>(entityClass, tableName, factory, fields, keywordOnly);
        }
    }
}
