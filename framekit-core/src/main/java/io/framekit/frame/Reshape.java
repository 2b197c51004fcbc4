package io.framekit.frame;

import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.kernel.CompositeKey;
import io.framekit.kernel.KeyedBuckets;
import io.framekit.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

/**
 * Long/wide reshaping. Every result is a fresh table with a range index.
 */
final class Reshape {

    private static final Logger LOG = LoggerFactory.getLogger(Reshape.class);

    static final String DEFAULT_VAR_NAME = "variable";
    static final String DEFAULT_VALUE_NAME = "value";

    private Reshape() {
    }

    /**
     * One row per distinct non-null {@code index} value and one column per distinct
     * non-null {@code columns} value, both in first-seen order. A later non-null
     * value for the same cell replaces an earlier one.
     */
    static DataFrame pivot(DataFrame frame, String index, String columns, String values) {
        return frame.read(() -> {
            frame.requireColumns(List.of(index, columns, values));
            var indexColumn = frame.column(index);
            var keyColumn = frame.column(columns);
            var valueColumn = frame.column(values);

            var rows = new KeyedBuckets();
            var targets = new KeyedBuckets();
            for (var i = 0; i < frame.rowCount(); i++) {
                var rowValue = indexColumn.get(i);
                var columnValue = keyColumn.get(i);
                if (rowValue != null && columnValue != null) {
                    rows.add(CompositeKey.of(rowValue), i);
                    targets.add(CompositeKey.of(columnValue), i);
                }
            }

            var cells = new Object[targets.bucketCount()][rows.bucketCount()];
            for (var i = 0; i < frame.rowCount(); i++) {
                var rowValue = indexColumn.get(i);
                var columnValue = keyColumn.get(i);
                var value = valueColumn.get(i);
                if (rowValue == null || columnValue == null || value == null) {
                    continue;
                }
                cells[targets.bucketOf(CompositeKey.of(columnValue))][rows.bucketOf(CompositeKey.of(rowValue))] = value;
            }

            var result = new ArrayList<Series>(targets.bucketCount() + 1);
            result.add(indexColumn.take(firstRows(rows)));
            for (var t = 0; t < targets.bucketCount(); t++) {
                var name = String.valueOf(keyColumn.get(targets.rows(t).first()));
                result.add(Series.of(name, valueColumn.dtype(), Arrays.asList(cells[t])));
            }
            LOG.debug("Pivoted {} rows into {} x {}", frame.rowCount(), rows.bucketCount(), targets.bucketCount());
            return new DataFrame(result, null, frame.configuration());
        });
    }

    /**
     * One row per (source row, value column): the id columns, the value column's name, then its value.
     * An empty {@code valueVars} melts every non-id column.
     *
     * @throws InvalidArgumentException if there is nothing to melt
     */
    static DataFrame melt(DataFrame frame, List<String> idVars, List<String> valueVars, String varName,
                          String valueName) {
        return frame.read(() -> {
            frame.requireColumns(idVars);
            var melted = new ArrayList<String>();
            if (valueVars == null || valueVars.isEmpty()) {
                var ids = new HashSet<>(idVars);
                for (var column : frame.columns()) {
                    if (!ids.contains(column)) {
                        melted.add(column);
                    }
                }
            } else {
                frame.requireColumns(valueVars);
                melted.addAll(valueVars);
            }
            if (melted.isEmpty()) {
                throw new InvalidArgumentException("no value columns to melt");
            }
            var variable = varName == null || varName.isEmpty() ? DEFAULT_VAR_NAME : varName;
            var value = valueName == null || valueName.isEmpty() ? DEFAULT_VALUE_NAME : valueName;

            var n = frame.rowCount();
            var positions = new int[n * melted.size()];
            var names = new String[positions.length];
            var cells = new ArrayList<Object>(positions.length);
            var k = 0;
            for (var i = 0; i < n; i++) {
                for (var column : melted) {
                    positions[k] = i;
                    names[k] = column;
                    cells.add(frame.column(column).get(i));
                    k++;
                }
            }
            var result = new ArrayList<Series>(idVars.size() + 2);
            for (var id : idVars) {
                result.add(frame.column(id).take(positions));
            }
            result.add(Series.ofStrings(variable, names));
            var dtype = commonType(frame, melted);
            result.add(Series.of(value, dtype, cells));
            return new DataFrame(result, null, frame.configuration());
        });
    }

    /**
     * Every cell as a row of ("row", "column", "value"), row-major.
     */
    static DataFrame stack(DataFrame frame) {
        return frame.read(() -> {
            var n = frame.rowCount();
            var columns = frame.columns();
            var rows = new long[n * columns.size()];
            var names = new String[rows.length];
            var cells = new ArrayList<Object>(rows.length);
            var k = 0;
            for (var i = 0; i < n; i++) {
                for (var column : columns) {
                    rows[k] = i;
                    names[k] = column;
                    cells.add(frame.column(column).get(i));
                    k++;
                }
            }
            var dtype = commonType(frame, columns);
            return new DataFrame(List.of(
                    Series.ofLongs("row", rows),
                    Series.ofStrings("column", names),
                    Series.of("value", dtype, cells)), null, frame.configuration());
        });
    }

    /**
     * Columns become rows: a leading "column" of the original names, then "row_0" .. "row_(n-1)".
     */
    static DataFrame transpose(DataFrame frame) {
        return frame.read(() -> {
            var columns = frame.columns();
            var dtype = commonType(frame, columns);
            var result = new ArrayList<Series>(frame.rowCount() + 1);
            result.add(Series.ofStrings("column", columns.toArray(new String[0])));
            for (var i = 0; i < frame.rowCount(); i++) {
                var cells = new ArrayList<Object>(columns.size());
                for (var column : columns) {
                    cells.add(frame.column(column).get(i));
                }
                result.add(Series.of("row_" + i, dtype, cells));
            }
            return new DataFrame(result, null, frame.configuration());
        });
    }

    /**
     * The shared dtype of {@code columns}; mixed numeric columns widen to Float64,
     * any other mix is String with each cell rendered by {@link String#valueOf(Object)}.
     */
    private static DType commonType(DataFrame frame, List<String> columns) {
        DType common = null;
        for (var column : columns) {
            var dtype = frame.column(column).dtype();
            if (common == null || common == dtype) {
                common = dtype;
            } else if (common.isNumeric() && dtype.isNumeric()) {
                common = DType.FLOAT64;
            } else {
                return DType.STRING;
            }
        }
        return common == null ? DType.STRING : common;
    }

    private static int[] firstRows(KeyedBuckets buckets) {
        var rows = new int[buckets.bucketCount()];
        for (var b = 0; b < rows.length; b++) {
            rows[b] = buckets.rows(b).first();
        }
        return rows;
    }
}
