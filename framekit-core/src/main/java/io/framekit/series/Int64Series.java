package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.storage.ColumnStorage;
import io.framekit.storage.LongColumn;

/**
 * Series of 64-bit integers.
 */
public final class Int64Series extends Series {

    Int64Series(String name, long[] values) {
        this(name, new LongColumn(values, null));
    }

    Int64Series(String name, ColumnStorage storage) {
        super(name, storage);
    }

    @Override
    public DType dtype() {
        return DType.INT64;
    }

    /**
     * Value at {@code i}, or 0 when the cell is null or out of range.
     */
    public long getLong(int i) {
        return read(s -> i < 0 || i >= s.length() || s.isNull(i) ? 0L : ((LongColumn) s).get(i));
    }

    /**
     * Snapshot of all cells; null cells hold 0.
     */
    public long[] toLongArray() {
        return read(s -> {
            var column = (LongColumn) s;
            var result = new long[s.length()];
            for (var i = 0; i < result.length; i++) {
                result[i] = s.isNull(i) ? 0L : column.get(i);
            }
            return result;
        });
    }

    @Override
    Series wrap(String name, ColumnStorage storage) {
        return new Int64Series(name, storage);
    }

    @Override
    Object coerce(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            var d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
        }
        throw incompatible(value);
    }

    @Override
    double numericAt(ColumnStorage storage, int offset) {
        return ((LongColumn) storage).get(offset);
    }

    @Override
    int compareCells(ColumnStorage storage, int left, int right) {
        var column = (LongColumn) storage;
        return Long.compare(column.get(left), column.get(right));
    }
}
