package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.storage.BooleanColumn;
import io.framekit.storage.ColumnStorage;

/**
 * Series of booleans; {@code false} orders before {@code true}.
 */
public final class BoolSeries extends Series {

    BoolSeries(String name, boolean[] values) {
        this(name, new BooleanColumn(values));
    }

    BoolSeries(String name, ColumnStorage storage) {
        super(name, storage);
    }

    @Override
    public DType dtype() {
        return DType.BOOL;
    }

    /**
     * Value at {@code i}, or false when the cell is null or out of range.
     */
    public boolean getBoolean(int i) {
        return read(s -> i >= 0 && i < s.length() && !s.isNull(i) && ((BooleanColumn) s).get(i));
    }

    /**
     * Snapshot of all cells; null cells hold false.
     */
    public boolean[] toBooleanArray() {
        return read(s -> {
            var column = (BooleanColumn) s;
            var result = new boolean[s.length()];
            for (var i = 0; i < result.length; i++) {
                result[i] = s.isNull(i) ? false : column.get(i);
            }
            return result;
        });
    }

    @Override
    Series wrap(String name, ColumnStorage storage) {
        return new BoolSeries(name, storage);
    }

    @Override
    Object coerce(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        throw incompatible(value);
    }

    @Override
    double numericAt(ColumnStorage storage, int offset) {
        throw notNumeric();
    }

    @Override
    int compareCells(ColumnStorage storage, int left, int right) {
        var column = (BooleanColumn) storage;
        return Boolean.compare(column.get(left), column.get(right));
    }
}
