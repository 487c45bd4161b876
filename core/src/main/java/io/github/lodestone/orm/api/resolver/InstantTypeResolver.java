package io.github.lodestone.orm.api.resolver;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Stores timestamps as a single {@code INTEGER} of nanoseconds since the epoch, so that
 * values survive a round trip exactly and sort correctly. That covers roughly the years
 * 1677 to 2262; instants outside that range are rejected.
 */
public final class InstantTypeResolver implements TypeResolver<Instant> {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    @Override
    public Class<Instant> getType() {
        return Instant.class;
    }

    @Override
    public StorageType storageType() {
        return StorageType.INTEGER;
    }

    @Override
    public Object encode(@NotNull Instant value) {
        try {
            return Math.addExact(Math.multiplyExact(value.getEpochSecond(), NANOS_PER_SECOND), value.getNano());
        } catch (ArithmeticException e) {
            throw new ValidationException("Instant " + value + " cannot be stored as epoch nanoseconds", e);
        }
    }

    @Override
    public Instant decode(@NotNull Object stored) {
        long nanos = ((Number) stored).longValue();
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
