package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;

import java.util.Arrays;

/**
 * Primitive long column storage.
 */
public final class LongColumn extends ColumnStorage {

    private final long[] values;

    /**
     * Wrap {@code values} without copying.
     *
     * @param values backing array, owned by this column afterwards
     * @param nulls  null mask, or null for no nulls
     */
    public LongColumn(long[] values, Bitset nulls) {
        super(nulls);
        if (nulls != null && nulls.length() != values.length) {
            throw new IllegalArgumentException("mask length " + nulls.length() + " != " + values.length);
        }
        this.values = values;
    }

    public LongColumn(int length) {
        this(new long[length], null);
    }

    @Override
    public DType dtype() {
        return DType.INT64;
    }

    @Override
    public int length() {
        return values.length;
    }

    /**
     * Get the primitive value at offset, ignoring the null mask.
     */
    public long get(int offset) {
        checkOffset(offset);
        return values[offset];
    }

    public void set(int offset, long value) {
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
        set(offset, ((Number) value).longValue());
    }

    @Override
    public LongColumn copy() {
        return new LongColumn(values.clone(), copyNulls());
    }

    @Override
    public LongColumn gather(int[] positions) {
        var result = new long[positions.length];
        for (var i = 0; i < positions.length; i++) {
            var position = positions[i];
            if (position != MISSING) {
                result[i] = values[position];
            }
        }
        return new LongColumn(result, gatherNulls(positions));
    }

    @Override
    public LongColumn slice(int start, int end) {
        var bounds = checkedSliceBounds(start, end, values.length);
        return new LongColumn(Arrays.copyOfRange(values, bounds[0], bounds[1]),
                bounds[0] == bounds[1] ? null : sliceNulls(bounds[0], bounds[1]));
    }
}
