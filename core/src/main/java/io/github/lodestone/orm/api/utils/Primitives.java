package io.github.lodestone.orm.api.utils;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

public final class Primitives {
    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        short.class, Short.class,
        char.class, Character.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    private Primitives() {}

    @SuppressWarnings("unchecked")
    public static <T> @NotNull Class<T> wrap(@NotNull Class<T> type) {
        Class<?> wrapper = WRAPPERS.get(type);
        return wrapper == null ? type : (Class<T>) wrapper;
    }

    /**
     * Applies the lossless widenings allowed when assigning a field: any integral box to
     * {@code Long}, and integral boxes to {@code Double}. Other values are returned untouched.
     */
    public static Object widen(@NotNull Class<?> target, Object value) {
        if (value == null || target.isInstance(value)) {
            return value;
        }
        boolean integral = value instanceof Integer || value instanceof Short || value instanceof Byte;
        if (target == Long.class && integral) {
            return ((Number) value).longValue();
        }
        if (target == Double.class && (integral || value instanceof Long)) {
            return ((Number) value).doubleValue();
        }
        return value;
    }
}
