package io.github.lodestone.orm.api;

/**
 * Where an instance stands relative to its backing row.
 */
public enum LifecycleState {
    /** Built through {@code newEmpty}; no row exists yet. */
    TRANSIENT,
    /** A row with the instance's id exists. */
    PERSISTED,
    /** The row was deleted; the instance can no longer be saved, deleted or used to resolve references. */
    STALE
}
