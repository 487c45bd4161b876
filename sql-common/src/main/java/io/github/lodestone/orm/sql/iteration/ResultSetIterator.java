package io.github.lodestone.orm.sql.iteration;

import io.github.lodestone.orm.api.CloseableIterator;
import io.github.lodestone.orm.api.exceptions.RepositoryException;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.SqlExceptionTranslator;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.NoSuchElementException;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Iterates a cursor row by row. The statement and result set are closed once the cursor is
 * exhausted, when mapping fails, or on {@link #close()}.
 *
 * @param <T> the type of elements returned by this iterator
 */
public class ResultSetIterator<T> implements CloseableIterator<T> {
    private final String sql;
    private final Statement statement;
    private final ResultSet resultSet;
    private final RowMapper<T> mapper;
    private final SqlExceptionTranslator translator;
    private Boolean hasNext;
    private boolean closed = false;

    public ResultSetIterator(String sql, Statement statement, ResultSet resultSet,
                             RowMapper<T> mapper, SqlExceptionTranslator translator) {
        this.sql = sql;
        this.statement = statement;
        this.resultSet = resultSet;
        this.mapper = mapper;
        this.translator = translator;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }

        if (hasNext == null) {
            try {
                hasNext = resultSet.next();
                if (!hasNext) {
                    close();
                }
            } catch (SQLException e) {
                close();
                throw translator.translate(sql, e);
            }
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements in ResultSet");
        }

        try {
            T result = mapper.map(resultSet);
            hasNext = null;
            return result;
        } catch (SQLException e) {
            close();
            throw translator.translate(sql, e);
        } catch (RepositoryException e) {
            close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            resultSet.close();
        } catch (SQLException e) {
            Logging.warn("Error closing ResultSet: " + e.getMessage());
        }
        try {
            statement.close();
        } catch (SQLException e) {
            Logging.warn("Error closing statement: " + e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Wraps an iterator in a sequential stream that closes the cursor when the stream is closed.
     */
    public static <T> Stream<T> stream(CloseableIterator<T> iterator) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, 0), false)
            .onClose(iterator::close);
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet resultSet) throws SQLException;
    }
}
