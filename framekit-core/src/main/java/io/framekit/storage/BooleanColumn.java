package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;

/**
 * Boolean column storage packed into a {@link Bitset}, one bit per cell.
 */
public final class BooleanColumn extends ColumnStorage {

    private final Bitset values;

    public BooleanColumn(Bitset values, Bitset nulls) {
        super(nulls);
        if (nulls != null && nulls.length() != values.length()) {
            throw new IllegalArgumentException("mask length " + nulls.length() + " != " + values.length());
        }
        this.values = values;
    }

    public BooleanColumn(boolean[] values) {
        this(pack(values), null);
    }

    @Override
    public DType dtype() {
        return DType.BOOL;
    }

    @Override
    public int length() {
        return values.length();
    }

    public boolean get(int offset) {
        return values.test(offset);
    }

    public void set(int offset, boolean value) {
        values.set(offset, value);
        clearNull(offset);
    }

    @Override
    public Object boxed(int offset) {
        return get(offset);
    }

    @Override
    public void setBoxed(int offset, Object value) {
        set(offset, (Boolean) value);
    }

    @Override
    public BooleanColumn copy() {
        return new BooleanColumn(values.copy(), copyNulls());
    }

    @Override
    public BooleanColumn gather(int[] positions) {
        var result = new Bitset(positions.length);
        for (var i = 0; i < positions.length; i++) {
            var position = positions[i];
            if (position != MISSING && values.test(position)) {
                result.set(i);
            }
        }
        return new BooleanColumn(result, gatherNulls(positions));
    }

    @Override
    public BooleanColumn slice(int start, int end) {
        var bounds = checkedSliceBounds(start, end, values.length());
        return new BooleanColumn(values.slice(bounds[0], bounds[1]),
                bounds[0] == bounds[1] ? null : sliceNulls(bounds[0], bounds[1]));
    }

    private static Bitset pack(boolean[] values) {
        var bits = new Bitset(values.length);
        for (var i = 0; i < values.length; i++) {
            if (values[i]) {
                bits.set(i);
            }
        }
        return bits;
    }
}
