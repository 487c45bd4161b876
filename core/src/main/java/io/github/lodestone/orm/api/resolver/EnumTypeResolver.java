package io.github.lodestone.orm.api.resolver;

import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import org.jetbrains.annotations.NotNull;

/**
 * Stores an enum constant by its name.
 */
public final class EnumTypeResolver<E extends Enum<E>> implements TypeResolver<E> {
    private final Class<E> type;

    public EnumTypeResolver(Class<E> type) {
        this.type = type;
    }

    @Override
    public Class<E> getType() {
        return type;
    }

    @Override
    public StorageType storageType() {
        return StorageType.TEXT;
    }

    @Override
    public Object encode(@NotNull E value) {
        return value.name();
    }

    @Override
    public E decode(@NotNull Object stored) {
        try {
            return Enum.valueOf(type, (String) stored);
        } catch (IllegalArgumentException e) {
            throw new ConsistencyException("Stored value '" + stored + "' is not a constant of " + type.getSimpleName(), e);
        }
    }
}
