package io.github.lodestone.orm.api.resolver;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.function.Function;

/**
 * Converts between a field's domain type and one storage primitive.
 *
 * <p>Implementations must be pure and satisfy {@code decode(encode(v)).equals(v)}
 * for every value of the domain ({@code Arrays.equals} for arrays). Neither method is
 * called with {@code null}; absent values are handled by the caller.</p>
 *
 * @param <T> the domain type
 */
public interface TypeResolver<T> {
    Class<T> getType();

    StorageType storageType();

    /**
     * @return an instance of {@code storageType().javaType()}
     */
    Object encode(@NotNull T value);

    T decode(@NotNull Object stored);

    @Contract("_, _, _, _ -> new")
    static <T> @NotNull TypeResolver<T> of(
        Class<T> type,
        StorageType storageType,
        Function<? super T, ?> encoder,
        Function<Object, ? extends T> decoder
    ) {
        return new TypeResolver<>() {
            @Override
            public Class<T> getType() {
                return type;
            }

            @Override
            public StorageType storageType() {
                return storageType;
            }

            @Override
            public Object encode(@NotNull T value) {
                return encoder.apply(value);
            }

            @Override
            public T decode(@NotNull Object stored) {
                return decoder.apply(stored);
            }

            @Override
            public String toString() {
                return "TypeResolver[" + type.getSimpleName() + " -> " + storageType + "]";
            }
        };
    }
}
