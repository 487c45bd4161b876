package io.github.lodestone.orm.api.resolver;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.ConfigurationException;
import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.api.utils.Primitives;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds one {@link TypeResolver} per domain type.
 *
 * <p>The built-in types ({@code Long}, {@code Integer}, {@code Double}, {@code Boolean},
 * {@code String}, {@code byte[]} and {@code Instant}) are always present. A domain type may be
 * registered only once; a second registration fails immediately, including over a built-in.</p>
 */
public class TypeResolverRegistry {
    private final Map<Class<?>, TypeResolver<?>> resolvers = new ConcurrentHashMap<>();
    private final Set<Class<?>> builtins;

    public TypeResolverRegistry() {
        registerInternal(TypeResolver.of(Long.class, StorageType.INTEGER, value -> value, stored -> ((Number) stored).longValue()));
        registerInternal(TypeResolver.of(Integer.class, StorageType.INTEGER, Integer::longValue, TypeResolverRegistry::decodeInt));
        registerInternal(TypeResolver.of(Double.class, StorageType.REAL, TypeResolverRegistry::encodeDouble, stored -> ((Number) stored).doubleValue()));
        registerInternal(TypeResolver.of(Boolean.class, StorageType.INTEGER, value -> value ? 1L : 0L, stored -> ((Number) stored).longValue() != 0L));
        registerInternal(TypeResolver.of(String.class, StorageType.TEXT, value -> value, stored -> (String) stored));
        registerInternal(TypeResolver.of(byte[].class, StorageType.BLOB, byte[]::clone, stored -> ((byte[]) stored).clone()));
        registerInternal(new InstantTypeResolver());
        this.builtins = Set.copyOf(resolvers.keySet());
    }

    /**
     * Installs a converter for its domain type.
     *
     * @throws ConfigurationException if the type already has a converter, or is an entity type
     */
    public <T> void register(@NotNull TypeResolver<T> resolver) {
        Class<T> type = resolver.getType();
        if (DbObject.class.isAssignableFrom(type)) {
            throw new ConfigurationException("Entity type " + type.getName() + " is stored as a reference and cannot have a converter");
        }

        TypeResolver<?> existing = resolvers.putIfAbsent(type, resolver);
        if (existing != null) {
            throw new ConfigurationException(builtins.contains(type)
                ? "Built-in type " + type.getName() + " cannot be overridden"
                : "A converter for " + type.getName() + " is already registered: " + existing);
        }
        Logging.info(() -> "Registered converter " + type.getName() + " -> " + resolver.storageType());
    }

    public <T> void register(
        @NotNull Class<T> type,
        @NotNull StorageType storageType,
        @NotNull Function<? super T, ?> encoder,
        @NotNull Function<Object, ? extends T> decoder
    ) {
        register(TypeResolver.of(type, storageType, encoder, decoder));
    }

    public <E extends Enum<E>> void registerEnum(@NotNull Class<E> enumType) {
        register(new EnumTypeResolver<>(enumType));
    }

    public <T> void registerJson(@NotNull Class<T> type) {
        register(new JsonTypeResolver<>(type));
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable TypeResolver<T> resolve(@NotNull Class<T> type) {
        return (TypeResolver<T>) resolvers.get(Primitives.wrap(type));
    }

    public boolean isRegistered(@NotNull Class<?> type) {
        return resolvers.containsKey(Primitives.wrap(type));
    }

    public boolean isBuiltin(@NotNull Class<?> type) {
        return builtins.contains(Primitives.wrap(type));
    }

    private static Integer decodeInt(Object stored) {
        long value = ((Number) stored).longValue();
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConsistencyException("Stored value " + value + " does not fit in an Integer");
        }
        return (int) value;
    }

    // SQLite stores NaN as NULL.
    private static Double encodeDouble(Double value) {
        if (value.isNaN()) {
            throw new ValidationException("NaN cannot be stored");
        }
        return value;
    }

    private void registerInternal(TypeResolver<?> resolver) {
        resolvers.put(resolver.getType(), resolver);
    }
}
