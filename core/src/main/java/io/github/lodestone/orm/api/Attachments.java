package io.github.lodestone.orm.api;

import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Extension data attached to an instance, keyed by type. Attachments are never persisted.
 *
 * <pre>{@code
 * user.attachments().set(LoginSession.class, session);
 * Optional<LoginSession> current = user.attachments().get(LoginSession.class);
 * }</pre>
 */
public final class Attachments {
    private final Map<Class<?>, Object> values = new HashMap<>();

    public <T> @NotNull Optional<T> get(@NotNull Class<T> type) {
        return Optional.ofNullable(type.cast(values.get(type)));
    }

    public <T> void set(@NotNull Class<T> type, @NotNull T value) {
        values.put(type, type.cast(Objects.requireNonNull(value, "value")));
    }

    public <T> @NotNull T computeIfAbsent(@NotNull Class<T> type, @NotNull Supplier<? extends T> factory) {
        Object value = values.get(type);
        if (value == null) {
            value = Objects.requireNonNull(factory.get(), "factory result");
            values.put(type, value);
        }
        return type.cast(value);
    }

    public <T> @NotNull Optional<T> remove(@NotNull Class<T> type) {
        return Optional.ofNullable(type.cast(values.remove(type)));
    }

    public boolean contains(@NotNull Class<?> type) {
        return values.containsKey(type);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
