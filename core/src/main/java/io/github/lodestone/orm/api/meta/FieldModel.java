package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.DeclarationException;
import io.github.lodestone.orm.api.utils.Primitives;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declares one persistent field of an entity.
 *
 * <p>Field models are usually kept as {@code static final} constants on the entity class and
 * double as typed keys for {@link DbObject#get(FieldModel)} and {@link DbObject#set(FieldModel, Object)}:</p>
 *
 * <pre>{@code
 * public static final FieldModel<String> NAME = FieldModel.builder("name", String.class).unique().build();
 * public static final FieldModel<Owner> OWNER = FieldModel.builder("owner", Owner.class).nullable().defaultValue(null).build();
 * }</pre>
 *
 * <p>A field whose type is a {@link DbObject} subclass is a reference: it is stored in a column
 * named {@code <name>_id} holding the referenced row's id. Whether the type can actually be
 * stored is only checked when the owning entity's schema is first used.</p>
 *
 * @param <V> the domain type of the field
 */
public final class FieldModel<V> {
    private final String name;
    private final Class<V> type;
    private final boolean nullable;
    private final boolean unique;
    private final boolean hasDefault;
    private final Supplier<? extends V> defaultSupplier;

    private FieldModel(Builder<V> builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.nullable = builder.nullable;
        this.unique = builder.unique;
        this.hasDefault = builder.hasDefault;
        this.defaultSupplier = builder.defaultSupplier;
    }

    @Contract("_, _ -> new")
    public static <V> @NotNull Builder<V> builder(@NotNull String name, @NotNull Class<V> type) {
        return new Builder<>(name, type);
    }

    public static <V> @NotNull FieldModel<V> of(@NotNull String name, @NotNull Class<V> type) {
        return new Builder<>(name, type).build();
    }

    public String name() {
        return name;
    }

    public Class<V> type() {
        return type;
    }

    public boolean nullable() {
        return nullable;
    }

    public boolean unique() {
        return unique;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * Produces the default for a new instance. Factories are invoked once per call.
     */
    public V newDefault() {
        if (!hasDefault) {
            throw new IllegalStateException("Field '" + name + "' has no default");
        }
        return defaultSupplier.get();
    }

    public boolean isReference() {
        return DbObject.class.isAssignableFrom(type);
    }

    public String columnName() {
        return isReference() ? name + "_id" : name;
    }

    /**
     * Checks that {@code value} may be assigned to this field, applying lossless numeric widening.
     *
     * @return the value to store
     * @throws ClassCastException if the value has the wrong type
     */
    public V accept(@Nullable Object value) {
        Object widened = Primitives.widen(type, value);
        if (widened != null && !type.isInstance(widened)) {
            throw new ClassCastException("Field '" + name + "' expects " + type.getSimpleName()
                + " but got " + widened.getClass().getSimpleName());
        }
        return type.cast(widened);
    }

    @Override
    public String toString() {
        return "FieldModel[" + name + ": " + type.getSimpleName() + (nullable ? "?" : "") + (unique ? ", unique" : "") + "]";
    }

    public static final class Builder<V> {
        private final String name;
        private final Class<V> type;
        private boolean nullable;
        private boolean unique;
        private boolean hasDefault;
        private Supplier<? extends V> defaultSupplier;
        private boolean nullDefault;

        private Builder(String name, Class<V> type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Primitives.wrap(Objects.requireNonNull(type, "type"));
        }

        public Builder<V> nullable() {
            this.nullable = true;
            return this;
        }

        public Builder<V> unique() {
            this.unique = true;
            return this;
        }

        public Builder<V> defaultValue(@Nullable V value) {
            this.hasDefault = true;
            this.nullDefault = value == null;
            this.defaultSupplier = () -> value;
            return this;
        }

        /**
         * Sets a factory invoked once for every new instance, for defaults that must not be shared.
         */
        public Builder<V> defaultFactory(@NotNull Supplier<? extends V> factory) {
            this.hasDefault = true;
            this.nullDefault = false;
            this.defaultSupplier = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public FieldModel<V> build() {
            if (nullDefault && !nullable) {
                throw new DeclarationException("Field '" + name + "' is not nullable but defaults to null");
            }
            return new FieldModel<>(this);
        }
    }
}
