package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;

import java.util.Arrays;

/**
 * String column storage.
 * <p>
 * Null cells hold the empty string so that {@link #get(int)} never returns null.
 */
public final class StringColumn extends ColumnStorage {

    private final String[] values;

    public StringColumn(String[] values, Bitset nulls) {
        super(nulls);
        if (nulls != null && nulls.length() != values.length) {
            throw new IllegalArgumentException("mask length " + nulls.length() + " != " + values.length);
        }
        this.values = values;
        for (var i = 0; i < values.length; i++) {
            if (values[i] == null) {
                values[i] = "";
            }
        }
    }

    public StringColumn(int length) {
        this(new String[length], null);
    }

    @Override
    public DType dtype() {
        return DType.STRING;
    }

    @Override
    public int length() {
        return values.length;
    }

    public String get(int offset) {
        checkOffset(offset);
        return values[offset];
    }

    public void set(int offset, String value) {
        checkOffset(offset);
        if (value == null) {
            throw new IllegalArgumentException("value required, use setNull for missing cells");
        }
        values[offset] = value;
        clearNull(offset);
    }

    @Override
    public Object boxed(int offset) {
        return get(offset);
    }

    @Override
    public void setBoxed(int offset, Object value) {
        set(offset, (String) value);
    }

    @Override
    public StringColumn copy() {
        return new StringColumn(values.clone(), copyNulls());
    }

    @Override
    public StringColumn gather(int[] positions) {
        var result = new String[positions.length];
        for (var i = 0; i < positions.length; i++) {
            var position = positions[i];
            result[i] = position == MISSING ? "" : values[position];
        }
        return new StringColumn(result, gatherNulls(positions));
    }

    @Override
    public StringColumn slice(int start, int end) {
        var bounds = checkedSliceBounds(start, end, values.length);
        return new StringColumn(Arrays.copyOfRange(values, bounds[0], bounds[1]),
                bounds[0] == bounds[1] ? null : sliceNulls(bounds[0], bounds[1]));
    }
}
