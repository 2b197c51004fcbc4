package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.series.Float64Series;
import io.framekit.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Windowed aggregation over the rows of a table.
 * <p>
 * A rolling window covers {@code [i - size + 1, i]}, or {@code [i - size/2, i + size/2]}
 * when centred, clipped to the table. Expanding and exponentially weighted
 * windows cover {@code [0, i]}. Null cells are skipped; a row whose window
 * holds fewer than {@code minPeriods} non-null values gets a null result.
 * Every reducer returns a Float64 series named {@code <column>_<reducer>}.
 */
public final class Window {

    private static final Logger LOG = LoggerFactory.getLogger(Window.class);

    enum Kind {
        ROLLING,
        EXPANDING,
        EWM
    }

    private final DataFrame frame;
    private final Kind kind;
    private final int size;
    private final int minPeriods;
    private final boolean center;
    private final double alpha;

    private Window(DataFrame frame, Kind kind, int size, int minPeriods, boolean center, double alpha) {
        this.frame = frame;
        this.kind = kind;
        this.size = size;
        this.minPeriods = minPeriods;
        this.center = center;
        this.alpha = alpha;
    }

    static Window rolling(DataFrame frame, int size, WindowOptions options) {
        if (size < 1) {
            throw new InvalidArgumentException("window size must be at least 1, got " + size);
        }
        var minPeriods = options.minPeriods() < 0 ? size : options.minPeriods();
        return new Window(frame, Kind.ROLLING, size, minPeriods, options.center(), Double.NaN);
    }

    static Window expanding(DataFrame frame, int minPeriods) {
        return new Window(frame, Kind.EXPANDING, 0, Math.max(1, minPeriods), false, Double.NaN);
    }

    static Window ewm(DataFrame frame, double alpha) {
        var effective = alpha > 0 && alpha < 1 ? alpha : frame.configuration().ewmDefaultAlpha();
        return new Window(frame, Kind.EWM, 0, 1, false, effective);
    }

    public double alpha() {
        return alpha;
    }

    public int minPeriods() {
        return minPeriods;
    }

    public Float64Series mean(String column) {
        return aggregate(column, WindowReducer.MEAN);
    }

    public Float64Series sum(String column) {
        return aggregate(column, WindowReducer.SUM);
    }

    public Float64Series std(String column) {
        return aggregate(column, WindowReducer.STD);
    }

    public Float64Series min(String column) {
        return aggregate(column, WindowReducer.MIN);
    }

    public Float64Series max(String column) {
        return aggregate(column, WindowReducer.MAX);
    }

    /**
     * @throws io.framekit.core.ColumnNotFoundException if the column does not exist
     * @throws InvalidArgumentException                  if the column is not numeric
     */
    public Float64Series aggregate(String column, WindowReducer reducer) {
        var source = frame.column(column);
        if (!source.dtype().isNumeric()) {
            throw new InvalidArgumentException("window " + reducer.label() + " needs a numeric column, \""
                    + column + "\" is " + source.dtype());
        }
        var n = source.length();
        var values = source.toDoubleArray();
        var valid = new boolean[n];
        for (var i = 0; i < n; i++) {
            valid[i] = !source.isNull(i);
        }
        var results = kind == Kind.EWM && reducer == WindowReducer.MEAN
                ? ewmMean(values, valid)
                : windowed(values, valid, reducer);
        LOG.debug("{} window {} over {} rows of '{}'", kind, reducer.label(), n, column);
        return (Float64Series) Series.of(column + "_" + reducer.label(), DType.FLOAT64, results);
    }

    private ArrayList<Object> windowed(double[] values, boolean[] valid, WindowReducer reducer) {
        var n = values.length;
        var results = new ArrayList<Object>(n);
        var scratch = new double[n];
        for (var i = 0; i < n; i++) {
            int start;
            int end;
            if (kind != Kind.ROLLING) {
                start = 0;
                end = i + 1;
            } else if (center) {
                start = Math.max(0, i - size / 2);
                end = Math.min(n, i + size / 2 + 1);
            } else {
                start = Math.max(0, i - size + 1);
                end = i + 1;
            }
            var count = 0;
            for (var j = start; j < end; j++) {
                if (valid[j]) {
                    scratch[count++] = values[j];
                }
            }
            results.add(count == 0 || count < minPeriods ? null : reducer.reduce(scratch, 0, count));
        }
        return results;
    }

    /**
     * Recurrence {@code alpha * x + (1 - alpha) * previous} over the non-null values, seeded by the first one.
     */
    private ArrayList<Object> ewmMean(double[] values, boolean[] valid) {
        var results = new ArrayList<Object>(values.length);
        var seen = 0;
        var current = Double.NaN;
        for (var i = 0; i < values.length; i++) {
            if (valid[i]) {
                current = seen == 0 ? values[i] : alpha * values[i] + (1 - alpha) * current;
                seen++;
            }
            results.add(seen < minPeriods ? null : current);
        }
        return results;
    }
}
