package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.series.Series;

import java.util.Locale;

/**
 * Per-group reducers applied by {@link GroupBy}.
 * <p>
 * Every reducer except {@link #SIZE} ignores null cells. A group with no
 * usable value yields a null cell; {@link #STD} and {@link #VAR} yield NaN
 * for a group with exactly one value.
 */
public enum Aggregation {
    SUM,
    MEAN,
    MEDIAN,
    STD,
    VAR,
    MIN,
    MAX,
    COUNT,
    SIZE,
    FIRST,
    LAST;

    /**
     * Lower-case name used in result column suffixes.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by name.
     *
     * @throws InvalidArgumentException if no aggregation has that name
     */
    public static Aggregation fromName(String name) {
        for (var aggregation : values()) {
            if (aggregation.name().equalsIgnoreCase(name)) {
                return aggregation;
            }
        }
        throw new InvalidArgumentException("unknown aggregation: \"" + name + "\"");
    }

    boolean numeric() {
        return switch (this) {
            case SUM, MEAN, MEDIAN, STD, VAR -> true;
            default -> false;
        };
    }

    DType resultType(DType source) {
        return switch (this) {
            case SUM, MEAN, MEDIAN, STD, VAR -> DType.FLOAT64;
            case COUNT, SIZE -> DType.INT64;
            case MIN, MAX, FIRST, LAST -> source;
        };
    }

    /**
     * @throws InvalidArgumentException if a numeric reducer is applied to a non-numeric column
     */
    void validate(Series column) {
        if (numeric() && !column.dtype().isNumeric()) {
            throw new InvalidArgumentException("aggregation " + label() + " needs a numeric column, \""
                    + column.name() + "\" is " + column.dtype());
        }
    }

    /**
     * Reduce the cells of one group.
     *
     * @param group the group's cells, gathered in scan order
     */
    Object reduce(Series group) {
        if (this == SIZE) {
            return (long) group.length();
        }
        var count = group.count();
        if (this == COUNT) {
            return (long) count;
        }
        if (count == 0) {
            return null;
        }
        return switch (this) {
            case SUM -> group.sum();
            case MEAN -> group.mean();
            case MEDIAN -> group.median();
            case STD -> group.std();
            case VAR -> group.var();
            case MIN -> group.min();
            case MAX -> group.max();
            case FIRST -> firstValid(group, true);
            case LAST -> firstValid(group, false);
            case COUNT, SIZE -> throw new IllegalStateException("unreachable: " + this);
        };
    }

    private static Object firstValid(Series group, boolean fromStart) {
        var n = group.length();
        for (var k = 0; k < n; k++) {
            var value = group.get(fromStart ? k : n - 1 - k);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
