package io.github.lodestone.orm.api;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The value held by a reference field: nothing, a stored id that has not been loaded yet,
 * or the loaded instance.
 */
public final class ReferenceSlot {
    public enum State {
        NULL,
        UNRESOLVED,
        RESOLVED
    }

    private static final ReferenceSlot EMPTY = new ReferenceSlot(State.NULL, -1, null);

    private final State state;
    private final long id;
    private final @Nullable DbObject instance;

    private ReferenceSlot(State state, long id, @Nullable DbObject instance) {
        this.state = state;
        this.id = id;
        this.instance = instance;
    }

    public static ReferenceSlot empty() {
        return EMPTY;
    }

    @Contract("_ -> new")
    public static @NotNull ReferenceSlot unresolved(long id) {
        return new ReferenceSlot(State.UNRESOLVED, id, null);
    }

    @Contract("_ -> new")
    public static @NotNull ReferenceSlot resolved(@NotNull DbObject instance) {
        return new ReferenceSlot(State.RESOLVED, -1, instance);
    }

    public State state() {
        return state;
    }

    /**
     * The referenced row id. For a resolved slot this is the instance's current id.
     */
    public long id() {
        return switch (state) {
            case NULL -> throw new IllegalStateException("Empty reference has no id");
            case UNRESOLVED -> id;
            case RESOLVED -> instance.getId();
        };
    }

    public @Nullable DbObject instance() {
        return instance;
    }

    @Override
    public String toString() {
        return switch (state) {
            case NULL -> "null";
            case UNRESOLVED -> "#" + id;
            case RESOLVED -> String.valueOf(instance);
        };
    }
}
