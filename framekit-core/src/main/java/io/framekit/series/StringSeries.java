package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.storage.ColumnStorage;
import io.framekit.storage.StringColumn;

/**
 * Series of strings, ordered lexicographically by {@link String#compareTo}.
 */
public final class StringSeries extends Series {

    StringSeries(String name, String[] values) {
        this(name, new StringColumn(values, null));
    }

    StringSeries(String name, ColumnStorage storage) {
        super(name, storage);
    }

    @Override
    public DType dtype() {
        return DType.STRING;
    }

    /**
     * Value at {@code i}, or the empty string when the cell is null or out of range.
     */
    public String getString(int i) {
        return read(s -> i < 0 || i >= s.length() || s.isNull(i) ? "" : ((StringColumn) s).get(i));
    }

    /**
     * Snapshot of all cells; null cells hold the empty string.
     */
    public String[] toStringArray() {
        return read(s -> {
            var column = (StringColumn) s;
            var result = new String[s.length()];
            for (var i = 0; i < result.length; i++) {
                result[i] = s.isNull(i) ? "" : column.get(i);
            }
            return result;
        });
    }

    @Override
    Series wrap(String name, ColumnStorage storage) {
        return new StringSeries(name, storage);
    }

    @Override
    Object coerce(Object value) {
        return value instanceof String ? value : String.valueOf(value);
    }

    @Override
    double numericAt(ColumnStorage storage, int offset) {
        throw notNumeric();
    }

    @Override
    int compareCells(ColumnStorage storage, int left, int right) {
        var column = (StringColumn) storage;
        return column.get(left).compareTo(column.get(right));
    }
}
