package io.github.lodestone.orm.sql.iteration;

import io.github.lodestone.orm.api.exceptions.RepositoryException;
import io.github.lodestone.orm.sql.internals.SqlExceptionTranslator;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ResultSetIteratorTest {
    @Test
    public void closes_statement_once_exhausted() throws SQLException {
        Statement statement = mock(Statement.class);
        ResultSet resultSet = mock(ResultSet.class);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getLong(1)).thenReturn(1L, 2L);

        ResultSetIterator<Long> iterator = new ResultSetIterator<>("SELECT", statement, resultSet,
            rs -> rs.getLong(1), SqlExceptionTranslator.STANDARD);

        assertEquals(1L, iterator.next());
        assertEquals(2L, iterator.next());
        assertFalse(iterator.hasNext());
        assertTrue(iterator.isClosed());
        assertThrows(NoSuchElementException.class, iterator::next);

        verify(resultSet).close();
        verify(statement).close();
    }

    @Test
    public void driver_errors_close_and_translate() throws SQLException {
        Statement statement = mock(Statement.class);
        ResultSet resultSet = mock(ResultSet.class);
        when(resultSet.next()).thenThrow(new SQLException("disk I/O error"));

        ResultSetIterator<Long> iterator = new ResultSetIterator<>("SELECT 1", statement, resultSet,
            rs -> rs.getLong(1), SqlExceptionTranslator.STANDARD);

        RepositoryException e = assertThrows(RepositoryException.class, iterator::hasNext);
        assertTrue(e.getMessage().contains("SELECT 1"));
        verify(statement).close();
    }

    @Test
    public void early_close_is_idempotent() throws SQLException {
        Statement statement = mock(Statement.class);
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetIterator<Long> iterator = new ResultSetIterator<>("SELECT", statement, resultSet,
            rs -> rs.getLong(1), SqlExceptionTranslator.STANDARD);

        iterator.close();
        iterator.close();

        assertFalse(iterator.hasNext());
        verify(resultSet, times(1)).close();
        verify(statement, times(1)).close();
    }

    @Test
    public void rows_normalize_numbers() throws SQLException {
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(3);
        when(metaData.getColumnLabel(1)).thenReturn("id");
        when(metaData.getColumnLabel(2)).thenReturn("ratio");
        when(metaData.getColumnLabel(3)).thenReturn("name");
        when(resultSet.getObject(1)).thenReturn(12);
        when(resultSet.getObject(2)).thenReturn(0.5f);
        when(resultSet.getObject(3)).thenReturn("x");

        Row row = Row.read(resultSet);

        assertEquals(12L, row.get("id"));
        assertEquals(0.5, row.get("ratio"));
        assertEquals("x", row.get(2));
        assertEquals(12L, row.getLong(0));
        assertEquals(3, row.size());
    }
}
