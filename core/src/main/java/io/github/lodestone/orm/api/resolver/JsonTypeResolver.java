package io.github.lodestone.orm.api.resolver;

import io.github.lodestone.orm.api.json.DefaultJsonCodec;
import io.github.lodestone.orm.api.json.JsonCodec;
import org.jetbrains.annotations.NotNull;

/**
 * Stores arbitrary values as JSON text through a {@link JsonCodec}.
 *
 * <p>The round-trip law only holds when the value type has a meaningful {@code equals}
 * and the codec reproduces it, which is the case for records and plain data classes.</p>
 */
public final class JsonTypeResolver<T> implements TypeResolver<T> {
    private final Class<T> type;
    private final JsonCodec<T> codec;

    public JsonTypeResolver(Class<T> type) {
        this(type, new DefaultJsonCodec<>());
    }

    public JsonTypeResolver(Class<T> type, JsonCodec<T> codec) {
        this.type = type;
        this.codec = codec;
    }

    @Override
    public Class<T> getType() {
        return type;
    }

    @Override
    public StorageType storageType() {
        return StorageType.TEXT;
    }

    @Override
    public Object encode(@NotNull T value) {
        return codec.serialize(value, type);
    }

    @Override
    public T decode(@NotNull Object stored) {
        return codec.deserialize((String) stored, type);
    }
}
