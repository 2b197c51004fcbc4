package io.framekit.frame;

import io.framekit.core.ColumnNotFoundException;
import io.framekit.core.FrameConfiguration;
import io.framekit.core.InvalidArgumentException;
import io.framekit.core.InvalidShapeException;
import io.framekit.core.PositionOutOfBoundsException;
import io.framekit.core.SortOrder;
import io.framekit.index.Index;
import io.framekit.index.LabelIndex;
import io.framekit.index.RangeIndex;
import io.framekit.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Ordered set of equal-length named {@link Series} sharing one row {@link Index}.
 * <p>
 * Every operation returns a new table and leaves its input unchanged.
 * Column projections ({@link #select}, {@link #drop}, {@link #withColumn},
 * {@link #rename}) share column storage with the source; row operations
 * ({@link #filter}, {@link #iloc}, sort, join, group-by output, reshape)
 * rebuild every column.
 * <p>
 * <b>Thread-safety:</b> a table owns a read/write lock guarding its index.
 * {@link #setIndex(Index)} is the only mutator and takes the write lock.
 */
public final class DataFrame {

    private static final Logger LOG = LoggerFactory.getLogger(DataFrame.class);

    private final List<String> columns;
    private final Map<String, Series> series;
    private final int rowCount;
    private final FrameConfiguration configuration;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Index index;

    DataFrame(List<? extends Series> columns, Index index, FrameConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.columns = new ArrayList<>(columns.size());
        this.series = new HashMap<>();
        var rows = columns.isEmpty() ? (index == null ? 0 : index.length()) : columns.get(0).length();
        for (var column : columns) {
            if (series.putIfAbsent(column.name(), column) != null) {
                throw new InvalidArgumentException("duplicate column: \"" + column.name() + "\"");
            }
            if (column.length() != rows) {
                throw new InvalidShapeException("column \"" + column.name() + "\" has length "
                        + column.length() + ", expected " + rows);
            }
            this.columns.add(column.name());
        }
        this.rowCount = rows;
        this.index = index == null ? Index.range(rows) : index;
        if (this.index.length() != rows) {
            throw new InvalidShapeException("index length " + this.index.length() + " != row count " + rows);
        }
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    /**
     * Table over views of {@code columns} with a default range index.
     *
     * @throws InvalidArgumentException if two columns share a name
     * @throws InvalidShapeException    if the columns differ in length
     */
    public static DataFrame of(Series... columns) {
        return of(Arrays.asList(columns));
    }

    public static DataFrame of(List<? extends Series> columns) {
        return of(FrameConfiguration.defaults(), columns);
    }

    public static DataFrame of(FrameConfiguration configuration, List<? extends Series> columns) {
        var views = new ArrayList<Series>(columns.size());
        for (var column : columns) {
            views.add(column.view());
        }
        return new DataFrame(views, null, configuration);
    }

    public static DataFrame empty() {
        return new DataFrame(List.of(), null, FrameConfiguration.defaults());
    }

    public static DataFrameBuilder builder() {
        return new DataFrameBuilder();
    }

    /**
     * Table from row records. Columns appear in first-seen key order;
     * a record missing a key yields a null cell. Each column's dtype is
     * inferred from its non-null values; integers mixed with decimals widen to FLOAT64.
     */
    public static DataFrame fromRecords(List<? extends Map<String, ?>> records) {
        var names = new LinkedHashSet<String>();
        for (var record : records) {
            names.addAll(record.keySet());
        }
        var columns = new ArrayList<Series>(names.size());
        for (var name : names) {
            var values = new ArrayList<Object>(records.size());
            for (var record : records) {
                values.add(record.get(name));
            }
            columns.add(Series.of(name, values));
        }
        return new DataFrame(columns, null, FrameConfiguration.defaults());
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * {@code {rowCount, columnCount}}.
     */
    public int[] shape() {
        return new int[]{rowCount, columns.size()};
    }

    public boolean hasColumn(String name) {
        return series.containsKey(name);
    }

    /**
     * @throws ColumnNotFoundException if there is no such column
     */
    public Series column(String name) {
        var column = series.get(name);
        if (column == null) {
            throw new ColumnNotFoundException(name);
        }
        return column;
    }

    public FrameConfiguration configuration() {
        return configuration;
    }

    public Index index() {
        return read(() -> index);
    }

    /**
     * Replace the row index.
     *
     * @throws InvalidShapeException if the index length differs from the row count
     */
    public void setIndex(Index index) {
        Objects.requireNonNull(index, "index");
        if (index.length() != rowCount) {
            throw new InvalidShapeException("index length " + index.length() + " != row count " + rowCount);
        }
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            this.index = index;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * True if the table has no rows.
     */
    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Same columns and index under another configuration. Columns are shared.
     */
    public DataFrame withConfiguration(FrameConfiguration configuration) {
        return read(() -> new DataFrame(views(columns), index, configuration));
    }

    /**
     * Deep copy of every column.
     */
    public DataFrame copy() {
        return read(() -> {
            var copies = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                copies.add(series.get(name).copy());
            }
            return new DataFrame(copies, index, configuration);
        });
    }

    public DataFrame head(int n) {
        return sliceRows(0, Math.max(0, n));
    }

    public DataFrame tail(int n) {
        return sliceRows(rowCount - Math.max(0, n), rowCount);
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    /**
     * Projection onto {@code names}, in argument order. Columns are shared with this table.
     *
     * @throws ColumnNotFoundException if a name is not a column
     */
    public DataFrame select(String... names) {
        var selected = List.of(names);
        return read(() -> {
            requireColumns(selected);
            return new DataFrame(views(selected), index, configuration);
        });
    }

    /**
     * Table without {@code names}; names that are not columns are ignored. Remaining columns are shared.
     */
    public DataFrame drop(String... names) {
        var dropped = new HashSet<>(Arrays.asList(names));
        return read(() -> {
            var kept = new ArrayList<String>(columns.size());
            for (var name : columns) {
                if (!dropped.contains(name)) {
                    kept.add(name);
                }
            }
            return new DataFrame(views(kept), index, configuration);
        });
    }

    /**
     * Rows accepted by {@code predicate}, in order, with a fresh range index.
     */
    public DataFrame filter(RowPredicate predicate) {
        return read(() -> {
            var row = new Row(this);
            var positions = new ArrayList<Integer>();
            for (var i = 0; i < rowCount; i++) {
                if (predicate.test(row.at(i))) {
                    positions.add(i);
                }
            }
            LOG.debug("Filter kept {} of {} rows", positions.size(), rowCount);
            return takeRows(positions.stream().mapToInt(Integer::intValue).toArray());
        });
    }

    /**
     * Rows at {@code positions}, in argument order, with a fresh range index.
     *
     * @throws PositionOutOfBoundsException if a position is out of range
     */
    public DataFrame iloc(int... positions) {
        for (var position : positions) {
            if (position < 0 || position >= rowCount) {
                throw new PositionOutOfBoundsException(position, rowCount);
            }
        }
        return read(() -> takeRows(positions));
    }

    /**
     * Rows whose index labels are {@code labels}, in argument order.
     *
     * @throws io.framekit.core.KeyNotFoundException if a label is not in the index
     */
    public DataFrame loc(Object... labels) {
        return read(() -> takeRows(index.positionsOf(labels)));
    }

    /**
     * Rows in {@code [start, end)} with the matching slice of the index; bounds are clamped.
     */
    public DataFrame sliceRows(int start, int end) {
        return read(() -> {
            var sliced = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                sliced.add(series.get(name).slice(start, end));
            }
            return new DataFrame(sliced, index.slice(start, end), configuration);
        });
    }

    /**
     * Table with {@code column} appended, or replacing the column of the same name in place.
     *
     * @throws InvalidShapeException if the column length differs from the row count
     */
    public DataFrame withColumn(Series column) {
        if (column.length() != rowCount && !columns.isEmpty()) {
            throw new InvalidShapeException("column \"" + column.name() + "\" has length "
                    + column.length() + ", expected " + rowCount);
        }
        return read(() -> {
            var result = new ArrayList<Series>(columns.size() + 1);
            var replaced = false;
            for (var name : columns) {
                if (name.equals(column.name())) {
                    result.add(column.view());
                    replaced = true;
                } else {
                    result.add(series.get(name).view());
                }
            }
            if (!replaced) {
                result.add(column.view());
            }
            return new DataFrame(result, columns.isEmpty() ? null : index, configuration);
        });
    }

    /**
     * Table with columns renamed by {@code mapping}; unmapped columns keep their names.
     *
     * @throws InvalidArgumentException if renaming produces duplicate names
     */
    public DataFrame rename(Map<String, String> mapping) {
        return read(() -> {
            var renamed = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                renamed.add(series.get(name).rename(mapping.getOrDefault(name, name)));
            }
            return new DataFrame(renamed, index, configuration);
        });
    }

    // ---------------------------------------------------------------------
    // Missing values
    // ---------------------------------------------------------------------

    /**
     * Boolean table, true where a cell is null.
     */
    public DataFrame isNa() {
        return nullFlags(true);
    }

    /**
     * Boolean table, true where a cell is not null.
     */
    public DataFrame notNa() {
        return nullFlags(false);
    }

    private DataFrame nullFlags(boolean whenNull) {
        return read(() -> {
            var flags = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                var column = series.get(name);
                var values = new boolean[rowCount];
                for (var i = 0; i < rowCount; i++) {
                    values[i] = column.isNull(i) == whenNull;
                }
                flags.add(Series.ofBooleans(name, values));
            }
            return new DataFrame(flags, index, configuration);
        });
    }

    /**
     * Rows kept by {@code options}, with a fresh range index.
     *
     * @throws ColumnNotFoundException if a subset column does not exist
     */
    public DataFrame dropNa(DropNaOptions options) {
        return read(() -> {
            var inspected = options.subset().isEmpty() ? columns : options.subset();
            requireColumns(inspected);
            var kept = new ArrayList<Integer>();
            for (var i = 0; i < rowCount; i++) {
                var nulls = 0;
                for (var name : inspected) {
                    if (series.get(name).isNull(i)) {
                        nulls++;
                    }
                }
                if (options.keep(inspected.size() - nulls, nulls)) {
                    kept.add(i);
                }
            }
            LOG.debug("dropNa({}) kept {} of {} rows", options.how(), kept.size(), rowCount);
            return takeRows(kept.stream().mapToInt(Integer::intValue).toArray());
        });
    }

    public DataFrame dropNa() {
        return dropNa(DropNaOptions.any());
    }

    /**
     * Every null cell replaced by {@code value}. Columns whose dtype cannot hold the value are left as they are.
     */
    public DataFrame fillNa(Object value) {
        return read(() -> {
            var filled = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                var column = series.get(name);
                filled.add(fillable(column, value) ? column.fillNA(value) : column.view());
            }
            return new DataFrame(filled, index, configuration);
        });
    }

    /**
     * Null cells of one column replaced by {@code value}.
     *
     * @throws ColumnNotFoundException  if the column does not exist
     * @throws InvalidArgumentException if the value does not fit the column's dtype
     */
    public DataFrame fillNa(String column, Object value) {
        return fillNa(Map.of(column, value));
    }

    /**
     * Null cells of each mapped column replaced by its value.
     *
     * @throws ColumnNotFoundException  if a mapped column does not exist
     * @throws InvalidArgumentException if a value does not fit its column's dtype
     */
    public DataFrame fillNa(Map<String, ?> values) {
        return read(() -> {
            requireColumns(values.keySet());
            var filled = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                var column = series.get(name);
                filled.add(values.containsKey(name) ? column.fillNA(values.get(name)) : column.view());
            }
            return new DataFrame(filled, index, configuration);
        });
    }

    private static boolean fillable(Series column, Object value) {
        return switch (column.dtype()) {
            case INT64 -> value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
            case FLOAT64 -> value instanceof Number;
            case BOOL -> value instanceof Boolean;
            case STRING -> value instanceof String;
        };
    }

    /**
     * Fill gaps in numeric columns. A negative {@code limit} fills every gap; otherwise
     * at most {@code limit} consecutive nulls are filled, and linear interpolation
     * skips gaps longer than {@code limit}. Non-numeric columns are shared unchanged.
     */
    public DataFrame interpolate(FillMethod method, int limit) {
        Objects.requireNonNull(method, "method");
        return read(() -> {
            var result = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                var column = series.get(name);
                result.add(column.dtype().isNumeric() ? Interpolation.fill(column, method, limit) : column.view());
            }
            return new DataFrame(result, index, configuration);
        });
    }

    public DataFrame interpolate(FillMethod method) {
        return interpolate(method, -1);
    }

    // ---------------------------------------------------------------------
    // Apply
    // ---------------------------------------------------------------------

    /**
     * Table with a new column {@code name} holding {@code fn} of every row.
     * The dtype is inferred from the non-null results as {@link Series#of(String, List)} does; {@code null} results are null cells.
     */
    public DataFrame apply(String name, Function<Row, Object> fn) {
        return read(() -> {
            var row = new Row(this);
            var results = new ArrayList<Object>(rowCount);
            for (var i = 0; i < rowCount; i++) {
                results.add(fn.apply(row.at(i)));
            }
            return withColumn(Series.of(name, results));
        });
    }

    /**
     * Table with {@code fn} applied to the non-null cells of one column, keeping its dtype.
     *
     * @throws ColumnNotFoundException if the column does not exist
     */
    public DataFrame applyColumn(String name, UnaryOperator<Object> fn) {
        return withColumn(column(name).map(fn));
    }

    /**
     * Table with {@code fn} applied to every non-null cell; each column keeps its dtype.
     */
    public DataFrame map(UnaryOperator<Object> fn) {
        return read(() -> {
            var mapped = new ArrayList<Series>(columns.size());
            for (var name : columns) {
                mapped.add(series.get(name).map(fn));
            }
            return new DataFrame(mapped, index, configuration);
        });
    }

    // ---------------------------------------------------------------------
    // Column statistics
    // ---------------------------------------------------------------------

    public Map<String, Double> sum(String... names) {
        return numericStat(names, Series::sum);
    }

    public Map<String, Double> mean(String... names) {
        return numericStat(names, Series::mean);
    }

    public Map<String, Double> median(String... names) {
        return numericStat(names, Series::median);
    }

    public Map<String, Double> std(String... names) {
        return numericStat(names, Series::std);
    }

    public Map<String, Double> var(String... names) {
        return numericStat(names, Series::var);
    }

    public Map<String, Object> min(String... names) {
        return stat(names, Series::min);
    }

    public Map<String, Object> max(String... names) {
        return stat(names, Series::max);
    }

    /**
     * Non-null cell count per column.
     */
    public Map<String, Integer> count(String... names) {
        return stat(names, Series::count);
    }

    /**
     * One row per statistic (count, mean, std, min, 25%, 50%, 75%, max) and one
     * Float64 column per numeric column, indexed by statistic name.
     *
     * @throws InvalidArgumentException if the table has no numeric column
     */
    public DataFrame describe() {
        return read(() -> {
            var numeric = numericColumns();
            if (numeric.isEmpty()) {
                throw new InvalidArgumentException("no numeric columns to describe");
            }
            var labels = LabelIndex.of("count", "mean", "std", "min", "25%", "50%", "75%", "max");
            var result = new ArrayList<Series>(numeric.size());
            for (var name : numeric) {
                var column = series.get(name);
                var count = column.count();
                var min = column.min();
                var max = column.max();
                result.add(Series.ofDoubles(name,
                        count,
                        column.mean(),
                        column.std(),
                        min == null ? Double.NaN : ((Number) min).doubleValue(),
                        column.quantile(0.25),
                        column.median(),
                        column.quantile(0.75),
                        max == null ? Double.NaN : ((Number) max).doubleValue()));
            }
            return new DataFrame(result, labels, configuration);
        });
    }

    private Map<String, Double> numericStat(String[] names, Function<Series, Double> reducer) {
        return read(() -> {
            var targets = names.length == 0 ? numericColumns() : List.of(names);
            requireColumns(targets);
            var result = new LinkedHashMap<String, Double>();
            for (var name : targets) {
                var column = series.get(name);
                column.requireNumeric();
                result.put(name, reducer.apply(column));
            }
            return result;
        });
    }

    private <T> Map<String, T> stat(String[] names, Function<Series, T> reducer) {
        return read(() -> {
            var targets = names.length == 0 ? columns : List.of(names);
            requireColumns(targets);
            var result = new LinkedHashMap<String, T>();
            for (var name : targets) {
                result.put(name, reducer.apply(series.get(name)));
            }
            return result;
        });
    }

    private List<String> numericColumns() {
        var numeric = new ArrayList<String>();
        for (var name : columns) {
            if (series.get(name).dtype().isNumeric()) {
                numeric.add(name);
            }
        }
        return numeric;
    }

    // ---------------------------------------------------------------------
    // Relational operations
    // ---------------------------------------------------------------------

    /**
     * Group rows by the values of {@code keys}; a null key value forms its own group.
     *
     * @throws InvalidArgumentException if no key is given
     * @throws ColumnNotFoundException  if a key is not a column
     */
    public GroupBy groupBy(String... keys) {
        return read(() -> new GroupBy(this, List.of(keys)));
    }

    /**
     * Join on one column present under the same name on both sides, with default options.
     */
    public DataFrame join(DataFrame other, JoinType type, String on) {
        return merge(other, type, List.of(on), List.of(on), JoinOptions.from(configuration));
    }

    public DataFrame join(DataFrame other, JoinType type, List<String> on) {
        return merge(other, type, on, on, JoinOptions.from(configuration));
    }

    /**
     * Join this table (left) with {@code other} (right) on pairwise-matched key columns.
     * Null keys never match. A cross join takes no keys.
     */
    public DataFrame merge(DataFrame other, JoinType type, List<String> leftOn, List<String> rightOn,
                           JoinOptions options) {
        return JoinEngine.merge(this, other, type, leftOn, rightOn, options);
    }

    public DataFrame crossJoin(DataFrame other) {
        return merge(other, JoinType.CROSS, List.of(), List.of(), JoinOptions.from(configuration));
    }

    /**
     * Rows ordered by one column, using the configured null placement and stability.
     */
    public DataFrame sort(String column, SortOrder order) {
        return sort(List.of(new SortKey(column, order)), SortOptions.from(configuration));
    }

    public DataFrame sort(List<SortKey> keys, SortOptions options) {
        return read(() -> takeRows(SortEngine.argsort(this, keys, options)));
    }

    /**
     * Row permutation that {@link #sort(List, SortOptions)} would apply.
     */
    public int[] argsort(List<SortKey> keys, SortOptions options) {
        return read(() -> SortEngine.argsort(this, keys, options));
    }

    public int[] argsort(String column, SortOrder order) {
        return argsort(List.of(new SortKey(column, order)), SortOptions.from(configuration));
    }

    /**
     * Rows ordered by their index labels. String labels move with their rows;
     * range and datetime indexes are replaced by a fresh range index.
     */
    public DataFrame sortIndex(SortOrder order) {
        return read(() -> {
            var permutation = SortEngine.argsortIndex(index, order, configuration.stableSort());
            var result = takeRows(permutation);
            if (index instanceof LabelIndex labels) {
                var reordered = new ArrayList<String>(permutation.length);
                for (var position : permutation) {
                    reordered.add(labels.get(position));
                }
                result.setIndex(new LabelIndex(reordered));
            }
            return result;
        });
    }

    public Window rolling(int size) {
        return rolling(size, WindowOptions.defaults());
    }

    /**
     * Fixed-size window of {@code size} rows.
     *
     * @throws InvalidArgumentException if {@code size < 1}
     */
    public Window rolling(int size, WindowOptions options) {
        return Window.rolling(this, size, options);
    }

    /**
     * Window over every row up to the current one.
     */
    public Window expanding(int minPeriods) {
        return Window.expanding(this, minPeriods);
    }

    /**
     * Exponentially weighted window; an alpha outside (0, 1) falls back to the configured default.
     */
    public Window ewm(double alpha) {
        return Window.ewm(this, alpha);
    }

    public DataFrame pivot(String index, String columns, String values) {
        return Reshape.pivot(this, index, columns, values);
    }

    public DataFrame melt(List<String> idVars, List<String> valueVars, String varName, String valueName) {
        return Reshape.melt(this, idVars, valueVars, varName, valueName);
    }

    public DataFrame melt(List<String> idVars, List<String> valueVars) {
        return Reshape.melt(this, idVars, valueVars, null, null);
    }

    public DataFrame stack() {
        return Reshape.stack(this);
    }

    public DataFrame unstack(String rowColumn, String columnColumn, String valueColumn) {
        return Reshape.pivot(this, rowColumn, columnColumn, valueColumn);
    }

    public DataFrame transpose() {
        return Reshape.transpose(this);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    <T> T read(Supplier<T> action) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    void requireColumns(Iterable<String> names) {
        for (var name : names) {
            if (!series.containsKey(name)) {
                throw new ColumnNotFoundException(name);
            }
        }
    }

    List<Series> seriesList() {
        var result = new ArrayList<Series>(columns.size());
        for (var name : columns) {
            result.add(series.get(name));
        }
        return result;
    }

    private List<Series> views(List<String> names) {
        var result = new ArrayList<Series>(names.size());
        for (var name : names) {
            result.add(series.get(name).view());
        }
        return result;
    }

    /**
     * Every column gathered at {@code positions}; a fresh range index.
     */
    DataFrame takeRows(int[] positions) {
        var taken = new ArrayList<Series>(columns.size());
        for (var name : columns) {
            taken.add(series.get(name).take(positions));
        }
        return new DataFrame(taken, new RangeIndex(0, positions.length, 1), configuration);
    }

    @Override
    public String toString() {
        return read(() -> {
            var sb = new StringBuilder();
            sb.append("DataFrame(shape=(").append(rowCount).append(", ").append(columns.size()).append("))\n");
            if (columns.isEmpty()) {
                return sb.toString();
            }
            sb.append(String.format("%-6s", ""));
            for (var name : columns) {
                sb.append(String.format("%-15s ", name));
            }
            sb.append('\n');
            var shown = Math.min(rowCount, configuration.displayRows());
            for (var i = 0; i < shown; i++) {
                var label = index.get(i);
                sb.append(String.format("%-6s", label));
                for (var name : columns) {
                    var value = series.get(name).get(i);
                    sb.append(String.format("%-15s ", value == null ? "<null>" : value));
                }
                sb.append('\n');
            }
            if (shown < rowCount) {
                sb.append("... (").append(rowCount - shown).append(" more rows)\n");
            }
            return sb.toString();
        });
    }
}
