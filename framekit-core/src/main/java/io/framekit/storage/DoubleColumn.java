package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;

import java.util.Arrays;

/**
 * Primitive double column storage.
 * <p>
 * A stored {@code NaN} is a value, not a null; nullness lives in the mask only.
 */
public final class DoubleColumn extends ColumnStorage {

    private final double[] values;

    public DoubleColumn(double[] values, Bitset nulls) {
        super(nulls);
        if (nulls != null && nulls.length() != values.length) {
            throw new IllegalArgumentException("mask length " + nulls.length() + " != " + values.length);
        }
        this.values = values;
    }

    public DoubleColumn(int length) {
        this(new double[length], null);
    }

    @Override
    public DType dtype() {
        return DType.FLOAT64;
    }

    @Override
    public int length() {
        return values.length;
    }

    public double get(int offset) {
        checkOffset(offset);
        return values[offset];
    }

    public void set(int offset, double value) {
        checkOffset(offset);
        values[offset] = value;
        clearNull(offset);
    }

    @Override
    public Object boxed(int offset) {
        return get(offset);
    }

    @Override
    public void setBoxed(int offset, Object value) {
        set(offset, ((Number) value).doubleValue());
    }

    @Override
    public DoubleColumn copy() {
        return new DoubleColumn(values.clone(), copyNulls());
    }

    @Override
    public DoubleColumn gather(int[] positions) {
        var result = new double[positions.length];
        for (var i = 0; i < positions.length; i++) {
            var position = positions[i];
            if (position != MISSING) {
                result[i] = values[position];
            }
        }
        return new DoubleColumn(result, gatherNulls(positions));
    }

    @Override
    public DoubleColumn slice(int start, int end) {
        var bounds = checkedSliceBounds(start, end, values.length);
        return new DoubleColumn(Arrays.copyOfRange(values, bounds[0], bounds[1]),
                bounds[0] == bounds[1] ? null : sliceNulls(bounds[0], bounds[1]));
    }
}
