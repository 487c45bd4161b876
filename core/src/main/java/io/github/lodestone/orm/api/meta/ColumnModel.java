package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.resolver.StorageType;
import io.github.lodestone.orm.api.resolver.TypeResolver;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One column of a derived table: the implicit {@code id} key, a value column backed by a
 * {@link TypeResolver}, or a reference column holding another entity's id.
 */
public final class ColumnModel {
    public static final String ID = "id";

    private final String name;
    private final @Nullable FieldModel<?> field;
    private final StorageType storageType;
    private final @Nullable TypeResolver<?> resolver;
    private final @Nullable EntityHandle<?> reference;

    private ColumnModel(String name, @Nullable FieldModel<?> field, StorageType storageType,
                        @Nullable TypeResolver<?> resolver, @Nullable EntityHandle<?> reference) {
        this.name = name;
        this.field = field;
        this.storageType = storageType;
        this.resolver = resolver;
        this.reference = reference;
    }

    @Contract(" -> new")
    static @NotNull ColumnModel primaryKey() {
        return new ColumnModel(ID, null, StorageType.INTEGER, null, null);
    }

    @Contract("_, _ -> new")
    static @NotNull ColumnModel value(@NotNull FieldModel<?> field, @NotNull TypeResolver<?> resolver) {
        return new ColumnModel(field.columnName(), field, resolver.storageType(), resolver, null);
    }

    @Contract("_, _ -> new")
    static @NotNull ColumnModel reference(@NotNull FieldModel<?> field, @NotNull EntityHandle<?> target) {
        return new ColumnModel(field.columnName(), field, StorageType.INTEGER, null, target);
    }

    public String name() {
        return name;
    }

    /**
     * @return the declared field, or {@code null} for the {@code id} column
     */
    public @Nullable FieldModel<?> field() {
        return field;
    }

    public String fieldName() {
        return field == null ? ID : field.name();
    }

    public StorageType storageType() {
        return storageType;
    }

    public @Nullable EntityHandle<?> reference() {
        return reference;
    }

    public boolean isPrimaryKey() {
        return field == null;
    }

    public boolean isReference() {
        return reference != null;
    }

    public boolean nullable() {
        return field != null && field.nullable();
    }

    public boolean unique() {
        return field != null && field.unique();
    }

    /**
     * Converts a domain value (or, for references, an entity instance or raw id) to its storage primitive.
     *
     * @throws ValidationException if the value does not fit this column
     */
    @SuppressWarnings("unchecked")
    public @Nullable Object toStorage(@Nullable Object value) {
        if (value == null) {
            return null;
        }

        if (field == null || reference != null) {
            return toKey(value);
        }

        Object accepted;
        try {
            accepted = field.accept(value);
        } catch (ClassCastException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        return ((TypeResolver<Object>) resolver).encode(accepted);
    }

    public @Nullable Object fromStorage(@Nullable Object stored) {
        if (stored == null) {
            return null;
        }
        if (field == null || reference != null) {
            return ((Number) stored).longValue();
        }
        return resolver.decode(stored);
    }

    private Long toKey(Object value) {
        if (value instanceof DbObject entity) {
            if (reference != null && entity.getClass() != reference.entityClass()) {
                throw new ValidationException("Field '" + fieldName() + "' references " + reference.entityClass().getSimpleName()
                    + ", not " + entity.getClass().getSimpleName());
            }
            if (!entity.hasId()) {
                throw new ValidationException(entity.getClass().getSimpleName() + " must be saved before it can be referenced by '" + fieldName() + "'");
            }
            return entity.getId();
        }

        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }

        throw new ValidationException("Column '" + name + "' expects an id but got " + value.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return name + " " + storageType;
    }
}
