package io.framekit.frame;

import io.framekit.core.InvalidArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cursor over one row of a {@link DataFrame}. Only valid for the duration of the callback it is passed to.
 */
public final class Row {

    private final DataFrame frame;
    private int position;

    Row(DataFrame frame) {
        this.frame = frame;
    }

    Row at(int position) {
        this.position = position;
        return this;
    }

    public int position() {
        return position;
    }

    /**
     * Cell value, or {@code null} for a null cell.
     *
     * @throws io.framekit.core.ColumnNotFoundException if the column does not exist
     */
    public Object get(String column) {
        return frame.column(column).get(position);
    }

    public boolean isNull(String column) {
        return frame.column(column).isNull(position);
    }

    /**
     * Numeric cell as a double, NaN for a null cell.
     *
     * @throws InvalidArgumentException if the cell is not numeric
     */
    public double getDouble(String column) {
        var value = get(column);
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new InvalidArgumentException("column \"" + column + "\" is not numeric");
    }

    /**
     * Cell rendered as a string, {@code null} for a null cell.
     */
    public String getString(String column) {
        var value = get(column);
        return value == null ? null : value.toString();
    }

    /**
     * Column name to value, in column order.
     */
    public Map<String, Object> toMap() {
        var values = new LinkedHashMap<String, Object>();
        for (var column : frame.columns()) {
            values.put(column, get(column));
        }
        return values;
    }

    @Override
    public String toString() {
        return "Row[" + position + "]" + toMap();
    }
}
