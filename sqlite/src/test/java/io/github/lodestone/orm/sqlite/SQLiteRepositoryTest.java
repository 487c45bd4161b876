package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.EntityQuery;
import io.github.lodestone.orm.api.LifecycleState;
import io.github.lodestone.orm.api.RepositoryAdapter;
import io.github.lodestone.orm.api.exceptions.AlreadyExistsException;
import io.github.lodestone.orm.api.exceptions.AmbiguousResultException;
import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.NotFoundException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.sql.iteration.Row;
import io.github.lodestone.orm.sqlite.Samples.Device;
import io.github.lodestone.orm.sqlite.Samples.Sample1;
import io.github.lodestone.orm.sqlite.Samples.Sample2;
import io.github.lodestone.orm.sqlite.Samples.Sample3;
import io.github.lodestone.orm.sqlite.Samples.Sample4;
import io.github.lodestone.orm.sqlite.Samples.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class SQLiteRepositoryTest {
    @TempDir
    Path directory;

    private SQLiteDatabase database;
    private RepositoryAdapter<Sample1> samples1;
    private RepositoryAdapter<Sample2> samples2;
    private RepositoryAdapter<Sample3> samples3;

    @BeforeEach
    public void setUp() {
        database = SQLiteTestSupport.initialized(directory);
        samples1 = database.repository(Sample1.class);
        samples2 = database.repository(Sample2.class);
        samples3 = database.repository(Sample3.class);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private static List<Long> ids(Iterable<? extends DbObject> entities) {
        List<Long> ids = new ArrayList<>();
        for (DbObject entity : entities) {
            ids.add(entity.getId());
        }
        return ids;
    }

    @Test
    public void create_persists_immediately() {
        Sample1 sample = samples1.create(42L);

        assertEquals(LifecycleState.PERSISTED, sample.getState());
        assertFalse(sample.isModified());
        Sample1 loaded = samples1.findById(sample.getId());
        assertNotNull(loaded);
        assertEquals(42L, loaded.getA());
        assertNotSame(sample, loaded);
    }

    @Test
    public void unique_columns_reject_duplicates() {
        samples1.create(1L);
        assertThrows(AlreadyExistsException.class, () -> samples1.create(1L));

        Sample1 other = samples1.create(2L);
        other.setA(1L);
        assertThrows(AlreadyExistsException.class, other::save);
        assertEquals(2, samples1.getAll().count());
    }

    @Test
    public void explicit_ids_collide_like_unique_columns() {
        Sample1 first = samples1.newEmpty(7);
        first.setA(70L);
        first.save();
        assertEquals(7L, first.getId());

        Sample1 second = samples1.newEmpty(7);
        second.setA(71L);
        assertThrows(AlreadyExistsException.class, second::save);
    }

    @Test
    public void values_round_trip_through_the_database() {
        Instant seen = Instant.ofEpochSecond(1_700_000_000L, 987_654_321);
        Map<String, Object> values = new HashMap<>();
        values.put("name", "boiler");
        values.put("port", 8080);
        values.put("temperature", -3.25);
        values.put("enabled", false);
        values.put("key", new byte[] {1, 2, 3});
        values.put("seen", seen);
        values.put("status", Status.ONLINE);

        RepositoryAdapter<Device> devices = database.repository(Device.class);
        Device created = devices.create(values);
        Device loaded = devices.getOne("name", "boiler");

        assertEquals(created.getId(), loaded.getId());
        assertEquals(8080, loaded.get(Device.PORT));
        assertEquals(-3.25, loaded.get(Device.TEMPERATURE));
        assertEquals(false, loaded.get(Device.ENABLED));
        assertArrayEquals(new byte[] {1, 2, 3}, loaded.get(Device.KEY));
        assertEquals(seen, loaded.get(Device.SEEN));
        assertEquals(Status.ONLINE, loaded.get(Device.STATUS));
    }

    @Test
    public void defaults_fill_missing_values() {
        RepositoryAdapter<Device> devices = database.repository(Device.class);
        Device device = devices.create(Map.of("name", "thermostat", "port", 1, "temperature", 0.0));

        Device loaded = devices.findById(device.getId());
        assertNotNull(loaded);
        assertEquals(true, loaded.get(Device.ENABLED));
        assertNull(loaded.get(Device.KEY));
        assertEquals(Status.OFFLINE, loaded.get(Device.STATUS));
        assertEquals(device.get(Device.SEEN), loaded.get(Device.SEEN));
    }

    @Test
    public void create_validates_its_arguments() {
        RepositoryAdapter<Device> devices = database.repository(Device.class);
        assertThrows(ValidationException.class, () -> devices.create("thermostat", 1, 0.0));
        assertThrows(ValidationException.class, () -> devices.create(Map.of("name", "thermostat", "port", 1)));
        assertThrows(ValidationException.class, () -> devices.create(Map.of("name", "thermostat", "port", 1, "temperature", 0.0, "colour", "red")));
        assertThrows(ValidationException.class, () -> devices.create(Map.of("name", "thermostat", "port", "one", "temperature", 0.0)));

        assertThrows(ValidationException.class, () -> samples1.create(1L, 2L));
        assertThrows(ValidationException.class, () -> samples1.create());
        assertEquals(0, samples1.getAll().count());
    }

    @Test
    public void transient_instances_need_every_field_before_saving() {
        Sample1 sample = samples1.newEmpty();
        ValidationException e = assertThrows(ValidationException.class, sample::save);
        assertEquals("No value set for Sample1.a", e.getMessage());

        sample.setA(3L);
        sample.save();
        assertTrue(sample.hasId());
    }

    @Test
    public void deleting_cascades_to_non_nullable_references() {
        Sample1 parent = samples1.create(1L);
        Sample1 unrelated = samples1.create(2L);
        Sample2 child = samples2.create(parent);
        Sample2 otherChild = samples2.create(unrelated);
        Sample4 grandchild = database.repository(Sample4.class).create(child);

        parent.delete();

        assertEquals(LifecycleState.STALE, parent.getState());
        assertNull(samples2.findById(child.getId()));
        assertNull(database.repository(Sample4.class).findById(grandchild.getId()));
        assertNotNull(samples2.findById(otherChild.getId()));
        assertEquals(List.of(unrelated.getId()), ids(samples1.getAll()));
    }

    @Test
    public void deleting_nulls_nullable_references() {
        Sample1 parent = samples1.create(1L);
        Sample3 dependent = samples3.create(parent);
        Sample3 orphan = samples3.create((Object) null);

        parent.delete();

        Sample3 reloaded = samples3.findById(dependent.getId());
        assertNotNull(reloaded);
        assertNull(reloaded.getSample1());
        assertNotNull(samples3.findById(orphan.getId()));
        assertEquals(2, samples3.getAll().count());
    }

    @Test
    public void stale_instances_cannot_be_saved_or_deleted() {
        Sample1 sample = samples1.create(1L);
        sample.delete();

        assertThrows(ConsistencyException.class, sample::save);
        assertThrows(ConsistencyException.class, sample::delete);
        assertThrows(ConsistencyException.class, sample::getId);
        assertEquals("Sample1(<deleted>)", sample.toString());
    }

    @Test
    public void transient_instances_cannot_be_deleted() {
        Sample1 sample = samples1.newEmpty();
        assertThrows(ValidationException.class, sample::delete);
    }

    @Test
    public void saving_a_row_deleted_elsewhere_marks_the_instance_stale() {
        Sample1 sample = samples1.create(1L);
        Sample1 copy = samples1.findById(sample.getId());
        assertNotNull(copy);

        sample.delete();
        copy.setA(5L);

        assertThrows(ConsistencyException.class, copy::save);
        assertEquals(LifecycleState.STALE, copy.getState());
    }

    @Test
    public void references_to_deleted_rows_are_reported() {
        Sample1 parent = samples1.create(1L);
        Sample3 dependent = samples3.create(parent);
        Sample3 loaded = samples3.findById(dependent.getId());
        assertNotNull(loaded);

        parent.delete();

        assertThrows(ConsistencyException.class, loaded::getSample1);
    }

    @Test
    public void saving_a_copy_loaded_before_a_cascade_cannot_restore_the_reference() {
        Sample1 parent = samples1.create(1L);
        Sample3 dependent = samples3.create(parent);
        Sample3 loaded = samples3.findById(dependent.getId());
        assertNotNull(loaded);

        parent.delete();

        assertThrows(ConsistencyException.class, loaded::save);
        List<Row> rows = database.fetchAll("SELECT \"sample1_id\" FROM \"sample3\"");
        assertEquals(1, rows.size());
        assertNull(rows.get(0).get(0));
    }

    @Test
    public void raw_deletes_of_referenced_rows_are_refused() {
        Sample1 parent = samples1.create(1L);
        samples2.create(parent);

        assertThrows(ConsistencyException.class,
            () -> database.execute("DELETE FROM \"sample1\" WHERE \"id\" = ?", parent.getId()));
        assertNotNull(samples1.findById(parent.getId()));
    }

    @Test
    public void referenced_rows_cannot_be_renumbered() {
        Sample1 parent = samples1.create(1L);
        long original = parent.getId();
        Sample2 child = samples2.create(parent);

        parent.setId(500L);
        assertThrows(ConsistencyException.class, parent::save);

        assertNull(samples1.findById(500L));
        Sample2 reloaded = samples2.findById(child.getId());
        assertNotNull(reloaded);
        assertEquals(original, reloaded.getSample1().getId());
    }

    @Test
    public void saving_one_changed_field_keeps_the_others() {
        RepositoryAdapter<Device> devices = database.repository(Device.class);
        Device device = devices.create(Map.of("name", "thermostat", "port", 22, "temperature", 1.5, "status", Status.ONLINE));

        Device loaded = devices.findById(device.getId());
        assertNotNull(loaded);
        loaded.set(Device.PORT, 23);
        assertTrue(loaded.isModified());
        loaded.save();
        assertFalse(loaded.isModified());

        Device reloaded = devices.findById(device.getId());
        assertNotNull(reloaded);
        assertEquals(23, reloaded.get(Device.PORT));
        assertEquals("thermostat", reloaded.get(Device.NAME));
        assertEquals(1.5, reloaded.get(Device.TEMPERATURE));
        assertEquals(Status.ONLINE, reloaded.get(Device.STATUS));
        assertEquals(device.get(Device.SEEN), reloaded.get(Device.SEEN));
    }

    @Test
    public void saves_overwrite_the_full_row() {
        Sample1 target = samples1.create(1L);
        Sample2 row = samples2.create(Map.of("sample1", target, "label", "first"));

        Sample2 copyA = samples2.findById(row.getId());
        Sample2 copyB = samples2.findById(row.getId());
        assertNotNull(copyA);
        assertNotNull(copyB);

        copyA.set(Sample2.LABEL, "from A");
        copyA.save();
        copyB.set(Sample2.SAMPLE1, samples1.create(2L));
        copyB.save();

        Sample2 reloaded = samples2.findById(row.getId());
        assertNotNull(reloaded);
        assertEquals("first", reloaded.get(Sample2.LABEL));
        assertEquals(2L, reloaded.getSample1().getA());
    }

    @Test
    public void changing_the_id_renumbers_the_row() {
        Sample1 sample = samples1.create(1L);
        long original = sample.getId();
        sample.setId(original + 100);
        sample.save();

        assertNull(samples1.findById(original));
        assertNotNull(samples1.findById(original + 100));
        assertEquals(original + 100, sample.storedId());
    }

    @Test
    public void get_one_requires_a_single_match() {
        samples1.create(1L);
        samples1.create(2L);

        assertEquals(2L, samples1.getOne("a", 2L).getA());
        assertThrows(NotFoundException.class, () -> samples1.getOne("a", 3L));
        assertThrows(AmbiguousResultException.class, () -> samples1.getOne("a__gte", 1L));
        assertTrue(samples1.getOpt("a", 3L).isEmpty());
    }

    @Test
    public void filters_accept_reference_instances() {
        Sample1 first = samples1.create(1L);
        Sample1 second = samples1.create(2L);
        samples3.create(first);
        samples3.create(first);
        samples3.create(second);
        samples3.create((Object) null);

        assertEquals(2, samples3.getAll().where("sample1").eq(first).count());
        assertEquals(1, samples3.getAll().where("sample1", second.getId()).count());
        assertEquals(1, samples3.getAll().where("sample1", null).count());
    }

    @Test
    public void ordering_and_slicing() {
        for (long a = 1; a <= 6; a++) {
            samples1.create(a * 10);
        }

        List<Long> values = samples1.getAll().orderBy("-a").slice(1, 4).toList().stream()
            .map(Sample1::getA)
            .toList();
        assertEquals(List.of(50L, 40L, 30L), values);

        assertEquals(20L, samples1.getAll().where("a__gt", 10L).orderBy("a").first().getA());
        assertTrue(samples1.getAll().slice(3, 3).toList().isEmpty());
    }

    @Test
    public void count_matches_iteration() {
        for (long a = 1; a <= 12; a++) {
            samples1.create(a);
        }

        assertCountMatches(samples1.getAll().where("a__lt", 5L));
        assertCountMatches(samples1.getAll().where("a__gte", 5L).where("a__lte", 9L));
        assertCountMatches(samples1.getAll().where("a", 100L));
        assertEquals(12, samples1.getAll().slice(0, 2).count());
    }

    private static void assertCountMatches(EntityQuery<Sample1> query) {
        int iterated = 0;
        for (Sample1 ignored : query) {
            iterated++;
        }
        assertEquals(iterated, query.count());
    }

    @Test
    public void windowed_delete_keeps_the_newest_rows() {
        for (long a = 1; a <= 20; a++) {
            samples1.create(a);
        }
        Sample1 oldest = samples1.getOne("a", 1L);
        Sample2 dependent = samples2.create(oldest);

        int deleted = samples1.getAll().orderBy("-id").slice(10).delete();

        assertEquals(10, deleted);
        List<Long> remaining = samples1.getAll().orderBy("a").toList().stream().map(Sample1::getA).toList();
        assertEquals(List.of(11L, 12L, 13L, 14L, 15L, 16L, 17L, 18L, 19L, 20L), remaining);
        assertNull(samples2.findById(dependent.getId()));
    }

    @Test
    public void bulk_delete_without_dependents_runs_one_statement() {
        List<Sample3> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(samples3.create((Object) null));
        }

        int deleted = samples3.getAll().where("id__gt", rows.get(1).getId()).delete();

        assertEquals(3, deleted);
        assertEquals(ids(rows.subList(0, 2)), ids(samples3.getAll().orderBy("id")));
    }

    @Test
    public void queries_see_rows_added_between_iterations() {
        samples1.create(1L);
        EntityQuery<Sample1> all = samples1.getAll();
        assertEquals(1, all.toList().size());

        samples1.create(2L);
        assertEquals(2, all.toList().size());
    }

    @Test
    public void streams_close_their_cursor() {
        samples1.create(1L);
        samples1.create(2L);

        try (Stream<Sample1> stream = samples1.getAll().orderBy("a").stream()) {
            assertEquals("1,2", stream.map(sample -> String.valueOf(sample.getA())).collect(Collectors.joining(",")));
        }
    }

    @Test
    public void to_string_lists_fields() {
        Sample1 parent = samples1.create(9L);
        Sample2 child = samples2.create(parent);
        Sample2 loaded = samples2.findById(child.getId());
        assertNotNull(loaded);

        assertEquals("Sample1(id=" + parent.getId() + ", a=9)", parent.toString());
        assertEquals("Sample2(id=" + child.getId() + ", sample1=Sample1#" + parent.getId() + ", label='')", loaded.toString());
    }
}
