package io.github.lodestone.orm.sql.internals.repository;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.SchemaRegistry;
import io.github.lodestone.orm.api.options.FilterOption;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.sql.Fixtures.Owner;
import io.github.lodestone.orm.sql.Fixtures.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class SqlParameterBinderTest {
    private final SqlParameterBinder binder = new SqlParameterBinder();
    private EntityModel<Sample> model;

    @BeforeEach
    public void setUp() {
        SchemaRegistry registry = new SchemaRegistry(new TypeResolverRegistry());
        registry.declare(Owner.DECLARATION);
        registry.declare(Sample.DECLARATION);
        model = registry.schemaFor(Sample.class);
    }

    @Test
    public void filter_values_are_converted_and_nulls_skipped() {
        SelectQuery query = SelectQuery.all()
            .withFilter(FilterOption.parse("a__gt", 3))
            .withFilter(FilterOption.parse("owner", null))
            .withFilter(FilterOption.parse("id__lt", 40));

        assertEquals(List.of(3L, 40L), binder.filterParameters(model, query));
    }

    @Test
    public void window_appends_limit_then_offset() {
        SelectQuery bounded = SelectQuery.all().withFilter(FilterOption.parse("a", 1L)).withWindow(4, 10);
        assertEquals(List.of(1L, 6L, 4L), binder.selectParameters(model, bounded));

        SelectQuery open = SelectQuery.all().withWindow(4, -1);
        assertEquals(List.of(-1L, 4L), binder.selectParameters(model, open));

        assertEquals(List.of(), binder.selectParameters(model, SelectQuery.all()));
    }

    @Test
    public void mistyped_filter_values_are_rejected() {
        SelectQuery query = SelectQuery.all().withFilter(FilterOption.parse("a", "one"));
        assertThrows(ValidationException.class, () -> binder.filterParameters(model, query));

        SelectQuery reference = SelectQuery.all().withFilter(FilterOption.parse("owner", "alice"));
        assertThrows(ValidationException.class, () -> binder.filterParameters(model, reference));
    }

    @Test
    public void bind_uses_one_based_positions() throws SQLException {
        PreparedStatement statement = mock(PreparedStatement.class);

        binder.bind(statement, Arrays.asList(7L, null, "x"));

        verify(statement).setObject(1, 7L);
        verify(statement).setObject(2, null);
        verify(statement).setObject(3, "x");
        verifyNoMoreInteractions(statement);
    }
}
