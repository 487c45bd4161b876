package io.github.lodestone.orm.api.json;

/**
 * Converts values of a JSON-stored field to and from their textual form.
 */
public interface JsonCodec<T> {

    String serialize(T value, Class<T> targetType);

    T deserialize(String json, Class<T> targetType);
}
