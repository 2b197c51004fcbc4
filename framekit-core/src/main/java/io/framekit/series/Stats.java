package io.framekit.series;

import java.util.Arrays;

/**
 * Descriptive statistics over dense double arrays that already exclude nulls.
 */
public final class Stats {

    private Stats() {
    }

    public static double sum(double[] values) {
        var sum = 0.0;
        for (var value : values) {
            sum += value;
        }
        return sum;
    }

    /**
     * NaN for an empty array.
     */
    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : sum(values) / values.length;
    }

    /**
     * Sample variance, NaN for fewer than two values.
     */
    public static double variance(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        var mean = mean(values);
        var sumSq = 0.0;
        for (var value : values) {
            var diff = value - mean;
            sumSq += diff * diff;
        }
        return sumSq / (values.length - 1);
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double median(double[] values) {
        var sorted = values.clone();
        Arrays.sort(sorted);
        return quantileOfSorted(sorted, 0.5);
    }

    /**
     * Linear interpolation between the two ranks around {@code q * (n - 1)}.
     *
     * @param sorted ascending values
     * @return NaN for an empty array or {@code q} outside [0, 1]
     */
    public static double quantileOfSorted(double[] sorted, double q) {
        if (sorted.length == 0 || !(q >= 0.0 && q <= 1.0)) {
            return Double.NaN;
        }
        var pos = q * (sorted.length - 1);
        var lower = (int) Math.floor(pos);
        var upper = (int) Math.ceil(pos);
        if (lower == upper) {
            return sorted[lower];
        }
        var fraction = pos - lower;
        return sorted[lower] * (1 - fraction) + sorted[upper] * fraction;
    }
}
