package io.framekit.series;

import io.framekit.core.DType;
import io.framekit.core.FrameConfiguration;
import io.framekit.core.InvalidArgumentException;
import io.framekit.core.PositionOutOfBoundsException;
import io.framekit.kernel.Bitset;
import io.framekit.storage.ColumnStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * One named, typed, nullable column.
 * <p>
 * Values live in a dense {@link ColumnStorage} of the series' dtype with an
 * optional null mask. {@link #get(int)} returns the boxed value, or
 * {@code null} when the position is out of range or the cell is null.
 * <p>
 * <b>Sharing:</b> {@link #view()} and {@link #rename(String)} return new
 * series over the same storage. The first {@link #set} or {@link #setNull}
 * on a series whose storage is shared copies the storage first, so a view
 * never observes writes made through another view.
 * <p>
 * <b>Thread-safety:</b> every series owns a read/write lock. Reads and
 * transformations hold the read lock; {@code set} and {@code setNull} hold
 * the write lock.
 */
public abstract sealed class Series permits Int64Series, Float64Series, BoolSeries, StringSeries {

    private static final Logger LOG = LoggerFactory.getLogger(Series.class);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final int DISPLAY_EDGE = 5;

    private final String name;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private ColumnStorage storage;

    Series(String name, ColumnStorage storage) {
        this.name = Objects.requireNonNull(name, "name");
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static Int64Series ofLongs(String name, long... values) {
        return new Int64Series(name, values.clone());
    }

    public static Float64Series ofDoubles(String name, double... values) {
        return new Float64Series(name, values.clone());
    }

    public static BoolSeries ofBooleans(String name, boolean... values) {
        return new BoolSeries(name, values.clone());
    }

    /**
     * String series; {@code null} elements become null cells.
     */
    public static StringSeries ofStrings(String name, String... values) {
        return (StringSeries) of(name, DType.STRING, Arrays.asList(values));
    }

    /**
     * Series with the dtype inferred from every non-null element. A shared dtype is kept,
     * integral mixed with floating values is FLOAT64, any other mix is STRING, and a list
     * with no non-null element is STRING. {@code null} elements become null cells.
     */
    public static Series of(String name, List<?> values) {
        DType dtype = null;
        for (var value : values) {
            if (value == null) {
                continue;
            }
            var cell = DType.of(value);
            if (dtype == null || dtype == cell) {
                dtype = cell;
            } else if (dtype.isNumeric() && cell.isNumeric()) {
                dtype = DType.FLOAT64;
            } else {
                dtype = DType.STRING;
                break;
            }
        }
        return of(name, dtype == null ? DType.STRING : dtype, values);
    }

    /**
     * Series of the given dtype; {@code null} elements become null cells.
     *
     * @throws InvalidArgumentException if an element cannot be converted to the dtype
     */
    public static Series of(String name, DType dtype, List<?> values) {
        var series = empty(name, dtype, values.size());
        var target = series.storage;
        for (var i = 0; i < values.size(); i++) {
            var value = values.get(i);
            if (value == null) {
                target.setNull(i);
            } else {
                target.setBoxed(i, series.coerce(value));
            }
        }
        return series;
    }

    /**
     * Series of {@code length} null cells.
     */
    public static Series nulls(String name, DType dtype, int length) {
        var series = empty(name, dtype, length);
        for (var i = 0; i < length; i++) {
            series.storage.setNull(i);
        }
        return series;
    }

    /**
     * Parse raw text cells, marking configured NA tokens as null.
     * <p>
     * The dtype is the narrowest of INT64, FLOAT64, BOOL, STRING that accepts
     * every non-NA token; a column with no non-NA token is STRING.
     */
    public static Series parse(String name, String[] raw, FrameConfiguration configuration) {
        var present = new ArrayList<String>(raw.length);
        for (var token : raw) {
            if (!configuration.isNaToken(token)) {
                present.add(token.trim());
            }
        }
        var dtype = inferTextType(present);
        var values = new ArrayList<Object>(raw.length);
        for (var token : raw) {
            if (configuration.isNaToken(token)) {
                values.add(null);
                continue;
            }
            var text = token.trim();
            values.add(switch (dtype) {
                case INT64 -> Long.parseLong(text);
                case FLOAT64 -> Double.parseDouble(text);
                case BOOL -> Boolean.parseBoolean(text);
                case STRING -> token;
            });
        }
        LOG.debug("Parsed column '{}' as {} ({} cells)", name, dtype, raw.length);
        return of(name, dtype, values);
    }

    private static DType inferTextType(List<String> tokens) {
        if (tokens.isEmpty()) {
            return DType.STRING;
        }
        if (tokens.stream().allMatch(Series::isLong)) {
            return DType.INT64;
        }
        if (tokens.stream().allMatch(Series::isDouble)) {
            return DType.FLOAT64;
        }
        if (tokens.stream().allMatch(t -> t.equalsIgnoreCase("true") || t.equalsIgnoreCase("false"))) {
            return DType.BOOL;
        }
        return DType.STRING;
    }

    private static boolean isLong(String token) {
        try {
            Long.parseLong(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String token) {
        if (!DECIMAL.matcher(token).matches()) {
            return false;
        }
        try {
            Double.parseDouble(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static Series empty(String name, DType dtype, int length) {
        return switch (dtype) {
            case INT64 -> new Int64Series(name, new long[length]);
            case FLOAT64 -> new Float64Series(name, new double[length]);
            case BOOL -> new BoolSeries(name, new boolean[length]);
            case STRING -> new StringSeries(name, new String[length]);
        };
    }

    // ---------------------------------------------------------------------
    // Type hooks
    // ---------------------------------------------------------------------

    public abstract DType dtype();

    /**
     * New series of this type over {@code storage}, which it takes ownership of.
     */
    abstract Series wrap(String name, ColumnStorage storage);

    /**
     * Convert a non-null boxed value to this series' cell type.
     *
     * @throws InvalidArgumentException if the value has an incompatible type
     */
    abstract Object coerce(Object value);

    /**
     * Numeric value of a non-null cell; non-numeric series reject the call.
     */
    abstract double numericAt(ColumnStorage storage, int offset);

    /**
     * Natural ordering of two non-null cells.
     */
    abstract int compareCells(ColumnStorage storage, int left, int right);

    // ---------------------------------------------------------------------
    // Locking
    // ---------------------------------------------------------------------

    final <T> T read(Function<ColumnStorage, T> action) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return action.apply(storage);
        } finally {
            readLock.unlock();
        }
    }

    private ColumnStorage exclusiveStorage() {
        if (storage.isShared()) {
            var detached = storage.copy();
            storage.release();
            storage = detached;
            LOG.trace("Series '{}' detached from shared storage before write", name);
        }
        return storage;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String name() {
        return name;
    }

    public int length() {
        return read(ColumnStorage::length);
    }

    /**
     * Boxed value at position {@code i}, or {@code null} if {@code i} is out of range or the cell is null.
     */
    public Object get(int i) {
        return read(s -> i < 0 || i >= s.length() || s.isNull(i) ? null : s.boxed(i));
    }

    /**
     * True if {@code i} is in range and the cell is not null.
     */
    public boolean isValid(int i) {
        return read(s -> i >= 0 && i < s.length() && !s.isNull(i));
    }

    /**
     * True if {@code i} is in range and the cell is null.
     */
    public boolean isNull(int i) {
        return read(s -> i >= 0 && i < s.length() && s.isNull(i));
    }

    /**
     * Stored value at {@code i} without consulting the null mask.
     * Callers must have established validity themselves.
     *
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public Object getUnsafe(int i) {
        return read(s -> s.boxed(i));
    }

    public int nullCount() {
        return read(ColumnStorage::nullCount);
    }

    /**
     * Number of non-null cells.
     */
    public int count() {
        return read(s -> s.length() - s.nullCount());
    }

    public boolean hasNulls() {
        return read(ColumnStorage::hasNulls);
    }

    /**
     * Copy of the null mask, or {@code null} if the series has no nulls.
     */
    public Bitset nullMask() {
        return read(ColumnStorage::nullMask);
    }

    /**
     * Boxed snapshot of all cells; null cells appear as {@code null}.
     */
    public List<Object> values() {
        return read(s -> {
            var values = new ArrayList<>(s.length());
            for (var i = 0; i < s.length(); i++) {
                values.add(s.isNull(i) ? null : s.boxed(i));
            }
            return Collections.unmodifiableList(values);
        });
    }

    /**
     * True if the storage is currently shared with another series.
     */
    public boolean sharesStorage() {
        return read(ColumnStorage::isShared);
    }

    /**
     * True if both series currently read the same storage buffer.
     */
    public boolean sharesStorageWith(Series other) {
        var mine = read(Function.identity());
        return other.read(theirs -> mine == theirs);
    }

    // ---------------------------------------------------------------------
    // Mutators
    // ---------------------------------------------------------------------

    /**
     * Store {@code value} at {@code i} and mark it valid; a {@code null} value marks the cell null.
     *
     * @throws PositionOutOfBoundsException if {@code i} is out of range
     */
    public void set(int i, Object value) {
        var converted = value == null ? null : coerce(value);
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (i < 0 || i >= storage.length()) {
                throw new PositionOutOfBoundsException(i, storage.length());
            }
            var target = exclusiveStorage();
            if (converted == null) {
                target.setNull(i);
            } else {
                target.setBoxed(i, converted);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Mark the cell at {@code i} null, allocating the mask on first use.
     * Out-of-range positions are ignored.
     */
    public void setNull(int i) {
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (i < 0 || i >= storage.length()) {
                return;
            }
            exclusiveStorage().setNull(i);
        } finally {
            writeLock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Transformations
    // ---------------------------------------------------------------------

    /**
     * Deep copy of values and mask.
     */
    public Series copy() {
        return read(s -> wrap(name, s.copy()));
    }

    /**
     * New series sharing this one's storage until either side writes.
     */
    public Series view() {
        return read(s -> wrap(name, s.retain()));
    }

    /**
     * View of this series under another name.
     */
    public Series rename(String newName) {
        return read(s -> wrap(newName, s.retain()));
    }

    /**
     * Cells in {@code [start, end)}; bounds are clamped.
     */
    public Series slice(int start, int end) {
        return read(s -> wrap(name, s.slice(start, end)));
    }

    /**
     * Cells at {@code positions}, in order. {@link ColumnStorage#MISSING} yields a null cell.
     *
     * @throws PositionOutOfBoundsException if a position is out of range
     */
    public Series take(int[] positions) {
        return read(s -> {
            for (var position : positions) {
                if (position != ColumnStorage.MISSING && (position < 0 || position >= s.length())) {
                    throw new PositionOutOfBoundsException(position, s.length());
                }
            }
            return wrap(name, s.gather(positions));
        });
    }

    /**
     * Series without its null cells, relative order preserved.
     */
    public Series dropNA() {
        return read(s -> {
            if (!s.hasNulls()) {
                return wrap(name, s.copy());
            }
            var positions = new int[s.length() - s.nullCount()];
            var next = 0;
            for (var i = 0; i < s.length(); i++) {
                if (!s.isNull(i)) {
                    positions[next++] = i;
                }
            }
            return wrap(name, s.gather(positions));
        });
    }

    /**
     * Series with every null cell replaced by {@code value}; the result has no mask.
     */
    public Series fillNA(Object value) {
        Objects.requireNonNull(value, "value");
        var converted = coerce(value);
        return read(s -> {
            var filled = s.copy();
            for (var i = 0; i < s.length(); i++) {
                if (s.isNull(i)) {
                    filled.setBoxed(i, converted);
                }
            }
            return wrap(name, filled);
        });
    }

    /**
     * Non-null cells accepted by {@code predicate}, in order.
     */
    public Series filter(Predicate<Object> predicate) {
        return read(s -> {
            var positions = new ArrayList<Integer>();
            for (var i = 0; i < s.length(); i++) {
                if (!s.isNull(i) && predicate.test(s.boxed(i))) {
                    positions.add(i);
                }
            }
            return wrap(name, s.gather(positions.stream().mapToInt(Integer::intValue).toArray()));
        });
    }

    /**
     * Apply {@code fn} to every non-null cell; null cells stay null, and a {@code null} result becomes null.
     * The result keeps this series' dtype.
     */
    public Series map(UnaryOperator<Object> fn) {
        return read(s -> {
            var result = s.copy();
            for (var i = 0; i < s.length(); i++) {
                if (s.isNull(i)) {
                    continue;
                }
                var mapped = fn.apply(s.boxed(i));
                if (mapped == null) {
                    result.setNull(i);
                } else {
                    result.setBoxed(i, coerce(mapped));
                }
            }
            return wrap(name, result);
        });
    }

    // ---------------------------------------------------------------------
    // Reducers (all skip null cells)
    // ---------------------------------------------------------------------

    public double sum() {
        requireNumeric();
        return read(s -> {
            var sum = 0.0;
            for (var i = 0; i < s.length(); i++) {
                if (!s.isNull(i)) {
                    sum += numericAt(s, i);
                }
            }
            return sum;
        });
    }

    /**
     * Arithmetic mean, NaN when there are no non-null cells.
     */
    public double mean() {
        requireNumeric();
        return read(this::meanOf);
    }

    /**
     * Sample variance (divides by n - 1), NaN with fewer than two non-null cells.
     */
    public double var() {
        requireNumeric();
        return read(s -> {
            var mean = meanOf(s);
            var count = s.length() - s.nullCount();
            if (count < 2) {
                return Double.NaN;
            }
            var sumSq = 0.0;
            for (var i = 0; i < s.length(); i++) {
                if (!s.isNull(i)) {
                    var diff = numericAt(s, i) - mean;
                    sumSq += diff * diff;
                }
            }
            return sumSq / (count - 1);
        });
    }

    /**
     * Sample standard deviation, NaN with fewer than two non-null cells.
     */
    public double std() {
        return Math.sqrt(var());
    }

    public double median() {
        return quantile(0.5);
    }

    /**
     * Quantile by linear interpolation between ranks; NaN if {@code q} is outside [0, 1]
     * or there are no non-null cells.
     */
    public double quantile(double q) {
        requireNumeric();
        if (!(q >= 0.0 && q <= 1.0)) {
            return Double.NaN;
        }
        return read(s -> Stats.quantileOfSorted(sortedNumeric(s), q));
    }

    /**
     * Smallest non-null value in the dtype's natural order, or {@code null} if there is none.
     */
    public Object min() {
        return read(s -> extreme(s, -1));
    }

    /**
     * Largest non-null value in the dtype's natural order, or {@code null} if there is none.
     */
    public Object max() {
        return read(s -> extreme(s, 1));
    }

    /**
     * Non-null cells as doubles, null cells as NaN.
     */
    public double[] toDoubleArray() {
        requireNumeric();
        return read(s -> {
            var result = new double[s.length()];
            for (var i = 0; i < s.length(); i++) {
                result[i] = s.isNull(i) ? Double.NaN : numericAt(s, i);
            }
            return result;
        });
    }

    private double meanOf(ColumnStorage s) {
        var sum = 0.0;
        var count = 0;
        for (var i = 0; i < s.length(); i++) {
            if (!s.isNull(i)) {
                sum += numericAt(s, i);
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private double[] sortedNumeric(ColumnStorage s) {
        var values = new double[s.length() - s.nullCount()];
        var next = 0;
        for (var i = 0; i < s.length(); i++) {
            if (!s.isNull(i)) {
                values[next++] = numericAt(s, i);
            }
        }
        Arrays.sort(values);
        return values;
    }

    private Object extreme(ColumnStorage s, int direction) {
        var best = -1;
        for (var i = 0; i < s.length(); i++) {
            if (s.isNull(i)) {
                continue;
            }
            if (best < 0 || Integer.signum(compareCells(s, i, best)) == direction) {
                best = i;
            }
        }
        return best < 0 ? null : s.boxed(best);
    }

    /**
     * @throws InvalidArgumentException if this series' dtype is not numeric
     */
    public void requireNumeric() {
        if (!dtype().isNumeric()) {
            throw notNumeric();
        }
    }

    InvalidArgumentException notNumeric() {
        return new InvalidArgumentException("series \"" + name + "\" of type " + dtype() + " is not numeric");
    }

    InvalidArgumentException incompatible(Object value) {
        return new InvalidArgumentException("value " + value + " (" + value.getClass().getSimpleName()
                + ") is not compatible with " + dtype() + " series \"" + name + "\"");
    }

    @Override
    public String toString() {
        return read(s -> {
            var n = s.length();
            if (n == 0) {
                return "Series(" + name + "): []";
            }
            var sb = new StringBuilder();
            sb.append("Series(").append(name).append(", dtype=").append(dtype()).append(", len=").append(n).append(")\n");
            if (n <= DISPLAY_EDGE * 2) {
                appendCells(sb, s, 0, n);
            } else {
                appendCells(sb, s, 0, DISPLAY_EDGE);
                sb.append("  ...\n");
                appendCells(sb, s, n - DISPLAY_EDGE, n);
            }
            return sb.toString();
        });
    }

    private static void appendCells(StringBuilder sb, ColumnStorage s, int from, int to) {
        for (var i = from; i < to; i++) {
            sb.append("  ").append(i).append(": ").append(s.isNull(i) ? "<null>" : s.boxed(i)).append('\n');
        }
    }
}
