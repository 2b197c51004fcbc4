package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.core.KeyNotFoundException;
import io.framekit.kernel.CompositeKey;
import io.framekit.kernel.KeyedBuckets;
import io.framekit.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rows of a table bucketed by the values of one or more key columns.
 * <p>
 * Groups are ordered by the first row at which their key occurs. A null key
 * value is a group of its own. Every result table starts with the key
 * columns, holding each group's key with the key columns' dtypes.
 * <p>
 * The source is captured as a copy-on-write snapshot at construction and the
 * bucketing is computed once over it; later writes to the source table do not
 * reach the groups.
 */
public final class GroupBy {

    private static final Logger LOG = LoggerFactory.getLogger(GroupBy.class);

    private final DataFrame source;
    private final List<String> keys;
    private final KeyedBuckets buckets = new KeyedBuckets();

    GroupBy(DataFrame source, List<String> keys) {
        if (keys.isEmpty()) {
            throw new InvalidArgumentException("group by needs at least one key column");
        }
        source.requireColumns(keys);
        this.source = source.select(source.columns().toArray(new String[0]));
        this.keys = List.copyOf(keys);
        var keyColumns = new Series[keys.size()];
        for (var k = 0; k < keyColumns.length; k++) {
            keyColumns[k] = this.source.column(keys.get(k));
        }
        var rowCount = this.source.rowCount();
        var values = new Object[keyColumns.length];
        for (var row = 0; row < rowCount; row++) {
            for (var k = 0; k < keyColumns.length; k++) {
                values[k] = keyColumns[k].get(row);
            }
            buckets.add(CompositeKey.of(values), row);
        }
        LOG.debug("Grouped {} rows by {} into {} groups", rowCount, keys, buckets.bucketCount());
    }

    public List<String> keys() {
        return keys;
    }

    public int groupCount() {
        return buckets.bucketCount();
    }

    /**
     * Key values of every group in output order; a null component is a null key value.
     */
    public List<List<Object>> groupKeys() {
        var result = new ArrayList<List<Object>>(buckets.bucketCount());
        for (var b = 0; b < buckets.bucketCount(); b++) {
            var key = buckets.key(b);
            var values = new ArrayList<>(key.size());
            for (var k = 0; k < key.size(); k++) {
                values.add(source.column(keys.get(k)).get(buckets.rows(b).first()));
            }
            result.add(Collections.unmodifiableList(values));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Rows of the group with the given key values, in scan order.
     *
     * @throws InvalidArgumentException if the number of values differs from the number of keys
     * @throws KeyNotFoundException     if no group has that key
     */
    public DataFrame group(Object... keyValues) {
        if (keyValues.length != keys.size()) {
            throw new InvalidArgumentException("expected " + keys.size() + " key values, got " + keyValues.length);
        }
        var bucket = buckets.bucketOf(CompositeKey.of(keyValues));
        if (bucket < 0) {
            throw new KeyNotFoundException(Arrays.asList(keyValues));
        }
        return source.takeRows(buckets.rows(bucket).toIntArray());
    }

    /**
     * One row per group: the keys, then one column per entry of {@code operations},
     * named after the source column, in map iteration order.
     *
     * @throws io.framekit.core.ColumnNotFoundException if a column does not exist
     * @throws InvalidArgumentException                  if a numeric reducer targets a non-numeric column
     */
    public DataFrame agg(Map<String, Aggregation> operations) {
        var plan = new ArrayList<Planned>(operations.size());
        operations.forEach((column, aggregation) -> plan.add(new Planned(column, aggregation, column)));
        return run(plan);
    }

    /**
     * Like {@link #agg(Map)} with several reducers per column; result columns are named {@code <column>_<reducer>}.
     */
    public DataFrame aggMultiple(Map<String, List<Aggregation>> operations) {
        var plan = new ArrayList<Planned>();
        operations.forEach((column, aggregations) -> {
            for (var aggregation : aggregations) {
                plan.add(new Planned(column, aggregation, column + "_" + aggregation.label()));
            }
        });
        return run(plan);
    }

    /**
     * Group sizes including null cells, in a column named "size".
     */
    public DataFrame size() {
        var sizes = new ArrayList<Object>(buckets.bucketCount());
        for (var b = 0; b < buckets.bucketCount(); b++) {
            sizes.add((long) buckets.rows(b).size());
        }
        var result = keyColumns();
        result.add(Series.of("size", DType.INT64, sizes));
        return new DataFrame(result, null, source.configuration());
    }

    /**
     * Non-null counts of every non-key column.
     */
    public DataFrame count() {
        var plan = new ArrayList<Planned>();
        for (var column : source.columns()) {
            if (!keys.contains(column)) {
                plan.add(new Planned(column, Aggregation.COUNT, column));
            }
        }
        return run(plan);
    }

    /**
     * One row per group: the keys, then {@code fn} of the group's sub-table in a column named "result".
     * The result dtype is inferred from the non-null values: numbers of mixed kinds widen to FLOAT64, other mixes become STRING.
     */
    public DataFrame apply(Function<DataFrame, Object> fn) {
        var results = new ArrayList<Object>(buckets.bucketCount());
        for (var b = 0; b < buckets.bucketCount(); b++) {
            results.add(fn.apply(source.takeRows(buckets.rows(b).toIntArray())));
        }
        var result = keyColumns();
        result.add(Series.of("result", results));
        return new DataFrame(result, null, source.configuration());
    }

    private DataFrame run(List<Planned> plan) {
        for (var step : plan) {
            step.aggregation.validate(source.column(step.column));
        }
        var result = keyColumns();
        for (var step : plan) {
            var column = source.column(step.column);
            var values = new ArrayList<Object>(buckets.bucketCount());
            for (var b = 0; b < buckets.bucketCount(); b++) {
                values.add(step.aggregation.reduce(column.take(buckets.rows(b).toIntArray())));
            }
            result.add(Series.of(step.output, step.aggregation.resultType(column.dtype()), values));
        }
        LOG.debug("Aggregated {} groups with {} operations", buckets.bucketCount(), plan.size());
        return new DataFrame(result, null, source.configuration());
    }

    private List<Series> keyColumns() {
        var firstRows = new int[buckets.bucketCount()];
        for (var b = 0; b < firstRows.length; b++) {
            firstRows[b] = buckets.rows(b).first();
        }
        var result = new ArrayList<Series>(keys.size() + 1);
        for (var key : keys) {
            result.add(source.column(key).take(firstRows));
        }
        return result;
    }

    private record Planned(String column, Aggregation aggregation, String output) {
    }
}
