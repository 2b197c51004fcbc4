package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.storage.ColumnStorage;
import io.framekit.storage.DoubleColumn;

/**
 * Series of doubles. A stored NaN is a value; nullness is tracked by the mask.
 */
public final class Float64Series extends Series {

    Float64Series(String name, double[] values) {
        this(name, new DoubleColumn(values, null));
    }

    Float64Series(String name, ColumnStorage storage) {
        super(name, storage);
    }

    @Override
    public DType dtype() {
        return DType.FLOAT64;
    }

    /**
     * Value at {@code i}, or 0.0 when the cell is null or out of range.
     */
    public double getDouble(int i) {
        return read(s -> i < 0 || i >= s.length() || s.isNull(i) ? 0.0 : ((DoubleColumn) s).get(i));
    }

    @Override
    Series wrap(String name, ColumnStorage storage) {
        return new Float64Series(name, storage);
    }

    @Override
    Object coerce(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw incompatible(value);
    }

    @Override
    double numericAt(ColumnStorage storage, int offset) {
        return ((DoubleColumn) storage).get(offset);
    }

    @Override
    int compareCells(ColumnStorage storage, int left, int right) {
        var column = (DoubleColumn) storage;
        var l = column.get(left);
        var r = column.get(right);
        return l == r ? 0 : Double.compare(l, r);
    }
}
