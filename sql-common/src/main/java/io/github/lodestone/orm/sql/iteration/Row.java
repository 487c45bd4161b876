package io.github.lodestone.orm.sql.iteration;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result row copied out of a cursor. Values are normalized to the storage primitives:
 * integral numbers as {@code Long}, floating point numbers as {@code Double}, text as
 * {@code String} and blobs as {@code byte[]}.
 */
public final class Row {
    private final List<Object> values;
    private final Map<String, Object> byLabel;

    private Row(List<Object> values, Map<String, Object> byLabel) {
        this.values = values;
        this.byLabel = byLabel;
    }

    public static @NotNull Row read(@NotNull ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Object> values = new ArrayList<>(columnCount);
        Map<String, Object> byLabel = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            Object value = normalize(resultSet.getObject(i));
            values.add(value);
            byLabel.put(metaData.getColumnLabel(i), value);
        }
        return new Row(Collections.unmodifiableList(values), Collections.unmodifiableMap(byLabel));
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    public int size() {
        return values.size();
    }

    /**
     * @param index zero-based column index
     */
    public @Nullable Object get(int index) {
        return values.get(index);
    }

    public @Nullable Object get(@NotNull String label) {
        return byLabel.get(label);
    }

    public long getLong(int index) {
        Object value = values.get(index);
        if (value == null) {
            throw new IllegalStateException("Column " + index + " is null");
        }
        return ((Number) value).longValue();
    }

    public @NotNull Map<String, Object> asMap() {
        return byLabel;
    }

    @Override
    public String toString() {
        return "Row" + byLabel;
    }
}
