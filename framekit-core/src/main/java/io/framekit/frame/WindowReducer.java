package io.framekit.frame;

import io.framekit.series.Stats;

import java.util.Arrays;
import java.util.Locale;

/**
 * Reducers over the non-null values of one window.
 */
public enum WindowReducer {
    MEAN,
    SUM,
    /** Sample standard deviation; NaN for a single value. */
    STD,
    MIN,
    MAX;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    double reduce(double[] values, int from, int to) {
        return switch (this) {
            case MEAN -> Stats.mean(Arrays.copyOfRange(values, from, to));
            case SUM -> Stats.sum(Arrays.copyOfRange(values, from, to));
            case STD -> Stats.std(Arrays.copyOfRange(values, from, to));
            case MIN -> {
                var min = Double.POSITIVE_INFINITY;
                for (var i = from; i < to; i++) {
                    min = Math.min(min, values[i]);
                }
                yield min;
            }
            case MAX -> {
                var max = Double.NEGATIVE_INFINITY;
                for (var i = from; i < to; i++) {
                    max = Math.max(max, values[i]);
                }
                yield max;
            }
        };
    }
}
