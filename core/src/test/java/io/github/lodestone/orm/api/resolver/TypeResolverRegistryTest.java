package io.github.lodestone.orm.api.resolver;

import io.github.lodestone.orm.api.exceptions.ConfigurationException;
import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeResolverRegistryTest {
    enum Status { ONLINE, OFFLINE }

    public record Location(String room, int floor) {}

    private static <T> T roundTrip(TypeResolverRegistry registry, Class<T> type, T value) {
        TypeResolver<T> resolver = registry.resolve(type);
        assertNotNull(resolver, "no converter for " + type);
        Object stored = resolver.encode(value);
        assertTrue(resolver.storageType().javaType().isInstance(stored),
            type.getSimpleName() + " encoded to " + stored.getClass().getSimpleName());
        return resolver.decode(stored);
    }

    @Test
    public void builtins_round_trip() {
        TypeResolverRegistry registry = new TypeResolverRegistry();

        assertEquals(Long.MIN_VALUE, roundTrip(registry, Long.class, Long.MIN_VALUE));
        assertEquals(-7, roundTrip(registry, Integer.class, -7));
        assertEquals(Math.PI, roundTrip(registry, Double.class, Math.PI));
        assertEquals(true, roundTrip(registry, Boolean.class, true));
        assertEquals(false, roundTrip(registry, Boolean.class, false));
        assertEquals("héllo 'quoted'", roundTrip(registry, String.class, "héllo 'quoted'"));
        assertArrayEquals(new byte[] {0, -1, 127}, roundTrip(registry, byte[].class, new byte[] {0, -1, 127}));
    }

    @Test
    public void instants_round_trip_to_the_nanosecond() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        for (Instant instant : List.of(
            Instant.ofEpochSecond(1_700_000_000L, 123_456_789),
            Instant.ofEpochSecond(-5, 1),
            Instant.EPOCH)) {
            assertEquals(instant, roundTrip(registry, Instant.class, instant));
        }
    }

    @Test
    public void instants_outside_the_nanosecond_range_are_rejected() {
        TypeResolver<Instant> resolver = new TypeResolverRegistry().resolve(Instant.class);
        assertNotNull(resolver);
        assertThrows(ValidationException.class, () -> resolver.encode(Instant.MAX));
    }

    @Test
    public void nan_is_rejected_before_it_reaches_storage() {
        TypeResolver<Double> resolver = new TypeResolverRegistry().resolve(Double.class);
        assertNotNull(resolver);
        assertThrows(ValidationException.class, () -> resolver.encode(Double.NaN));
        assertEquals(Double.POSITIVE_INFINITY, resolver.decode(resolver.encode(Double.POSITIVE_INFINITY)));
    }

    @Test
    public void stored_integers_out_of_range_are_inconsistent() {
        TypeResolver<Integer> resolver = new TypeResolverRegistry().resolve(Integer.class);
        assertNotNull(resolver);
        assertEquals(Integer.MIN_VALUE, resolver.decode((long) Integer.MIN_VALUE));
        assertThrows(ConsistencyException.class, () -> resolver.decode(Integer.MAX_VALUE + 1L));
    }

    @Test
    public void primitive_classes_resolve_through_their_wrappers() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        assertSame(registry.resolve(Long.class), registry.resolve(long.class));
        assertTrue(registry.isBuiltin(int.class));
    }

    @Test
    public void builtins_cannot_be_overridden() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> registry.register(String.class, StorageType.BLOB, String::getBytes, stored -> new String((byte[]) stored)));
        assertTrue(e.getMessage().contains("cannot be overridden"));
    }

    @Test
    public void second_registration_fails_at_registration_time() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        registry.registerEnum(Status.class);
        assertThrows(ConfigurationException.class, () -> registry.registerEnum(Status.class));
    }

    @Test
    public void enums_are_stored_by_name() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        registry.registerEnum(Status.class);

        TypeResolver<Status> resolver = registry.resolve(Status.class);
        assertNotNull(resolver);
        assertEquals(StorageType.TEXT, resolver.storageType());
        assertEquals("OFFLINE", resolver.encode(Status.OFFLINE));
        assertEquals(Status.ONLINE, resolver.decode("ONLINE"));
        assertThrows(ConsistencyException.class, () -> resolver.decode("UNKNOWN"));
    }

    @Test
    public void json_types_share_the_text_storage() {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        registry.registerJson(Location.class);

        assertEquals(new Location("kitchen", 2), roundTrip(registry, Location.class, new Location("kitchen", 2)));
        assertEquals(StorageType.TEXT, registry.resolve(Location.class).storageType());
        assertEquals(StorageType.TEXT, registry.resolve(String.class).storageType());
    }

    @Test
    public void unknown_types_resolve_to_null() {
        assertNull(new TypeResolverRegistry().resolve(Thread.class));
    }
}
