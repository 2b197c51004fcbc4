package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.series.Series;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Gap filling for numeric columns.
 */
final class Interpolation {

    private Interpolation() {
    }

    static Series fill(Series column, FillMethod method, int limit) {
        return switch (method) {
            case LINEAR -> linear(column, limit);
            case FORWARD -> carry(column, limit, false);
            case BACKWARD -> carry(column, limit, true);
        };
    }

    /**
     * Interior gaps become points on the line between their neighbours; the result is Float64.
     */
    private static Series linear(Series column, int limit) {
        var n = column.length();
        var values = column.toDoubleArray();
        var result = Arrays.asList(new Object[n]);
        var previous = -1;
        for (var i = 0; i < n; i++) {
            if (column.isNull(i)) {
                continue;
            }
            result.set(i, values[i]);
            var gap = i - previous;
            if (previous >= 0 && gap > 1 && (limit < 0 || gap - 1 <= limit)) {
                for (var j = previous + 1; j < i; j++) {
                    var fraction = (double) (j - previous) / gap;
                    result.set(j, values[previous] + fraction * (values[i] - values[previous]));
                }
            }
            previous = i;
        }
        return Series.of(column.name(), DType.FLOAT64, result);
    }

    private static Series carry(Series column, int limit, boolean backward) {
        var n = column.length();
        var result = new ArrayList<>(column.values());
        Object carried = null;
        var run = 0;
        for (var k = 0; k < n; k++) {
            var i = backward ? n - 1 - k : k;
            var value = result.get(i);
            if (value != null) {
                carried = value;
                run = 0;
            } else if (carried != null && (limit < 0 || run < limit)) {
                result.set(i, carried);
                run++;
            }
        }
        return Series.of(column.name(), column.dtype(), result);
    }
}
