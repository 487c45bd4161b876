package io.github.lodestone.orm.api.meta;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.exceptions.DeclarationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EntityDeclarationTest {
    public static final class Device extends DbObject {}

    public static final class Other extends DbObject {}

    private static EntityDeclaration.Builder<Device> device() {
        return EntityDeclaration.builder(Device.class, "device", Device::new);
    }

    @Test
    public void fields_keep_declaration_order() {
        EntityDeclaration<Device> declaration = device()
            .fields(FieldModel.of("name", String.class), FieldModel.of("port", Integer.class))
            .build();

        assertEquals(List.of("name", "port"), declaration.fields().stream().map(FieldModel::name).toList());
        assertSame(Integer.class, declaration.field("port").type());
        assertNull(declaration.field("missing"));
    }

    @Test
    public void invalid_names_are_rejected() {
        assertThrows(DeclarationException.class, () -> device().field(FieldModel.of("Name", String.class)).build());
        assertThrows(DeclarationException.class, () -> device().field(FieldModel.of("_hidden", String.class)).build());
        assertThrows(DeclarationException.class,
            () -> EntityDeclaration.builder(Device.class, " ", Device::new).build());
        assertThrows(DeclarationException.class,
            () -> EntityDeclaration.builder(Device.class, "drop table;", Device::new).build());
    }

    @Test
    public void reserved_names_are_rejected() {
        for (String reserved : List.of("id", "rowid", "oid")) {
            assertThrows(DeclarationException.class, () -> device().field(FieldModel.of(reserved, Long.class)).build(), reserved);
        }
    }

    @Test
    public void duplicate_names_and_column_clashes_are_rejected() {
        assertThrows(DeclarationException.class,
            () -> device().fields(FieldModel.of("name", String.class), FieldModel.of("name", Long.class)).build());

        DeclarationException clash = assertThrows(DeclarationException.class,
            () -> device().fields(FieldModel.of("other", Other.class), FieldModel.of("other_id", Long.class)).build());
        assertTrue(clash.getMessage().contains("other_id"), clash.getMessage());
    }

    @Test
    public void defaulted_fields_must_come_last_unless_keyword_only() {
        FieldModel<Boolean> enabled = FieldModel.builder("enabled", Boolean.class).defaultValue(true).build();
        FieldModel<String> name = FieldModel.of("name", String.class);

        assertThrows(DeclarationException.class, () -> device().fields(enabled, name).build());

        EntityDeclaration<Device> keywordOnly = device().fields(enabled, name).keywordOnly().build();
        assertTrue(keywordOnly.keywordOnly());
    }

    @Test
    public void null_default_needs_a_nullable_field() {
        assertThrows(DeclarationException.class, () -> FieldModel.builder("note", String.class).defaultValue(null).build());

        FieldModel<String> note = FieldModel.builder("note", String.class).nullable().defaultValue(null).build();
        assertTrue(note.hasDefault());
        assertNull(note.newDefault());
    }

    @Test
    public void default_factories_run_once_per_instance() {
        FieldModel<List> tags = FieldModel.builder("tags", List.class).defaultFactory(ArrayList::new).build();
        assertNotSame(tags.newDefault(), tags.newDefault());
    }

    @Test
    public void references_are_stored_in_an_id_column() {
        FieldModel<Other> other = FieldModel.of("other", Other.class);
        assertTrue(other.isReference());
        assertEquals("other_id", other.columnName());
        assertEquals("port", FieldModel.of("port", int.class).columnName());
    }

    @Test
    public void accept_widens_integral_values_and_rejects_others() {
        FieldModel<Long> count = FieldModel.of("count", Long.class);
        assertEquals(5L, count.accept(5));
        assertThrows(ClassCastException.class, () -> count.accept("5"));

        FieldModel<Double> ratio = FieldModel.of("ratio", Double.class);
        assertEquals(2.0, ratio.accept(2));
    }

    @Test
    public void factory_must_produce_the_declared_class() {
        EntityDeclaration<Device> declaration = EntityDeclaration.builder(Device.class, "device", () -> null).build();
        assertThrows(DeclarationException.class, declaration::newInstance);
    }
}
