package io.framekit.frame;

import io.framekit.core.ColumnNotFoundException;
import io.framekit.core.DType;
import io.framekit.core.InvalidArgumentException;
import io.framekit.kernel.CompositeKey;
import io.framekit.kernel.HashJoin;
import io.framekit.kernel.JoinPairs;
import io.framekit.series.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Hash joins of two tables.
 * <p>
 * Inner, left and outer joins build on the right table and probe with the
 * left; a right join builds on the left and probes with the right, then
 * lays the columns out left-then-right like the others. Output rows follow
 * the probe side's order; an outer join appends the never-matched right rows
 * in right order.
 * <p>
 * Both inputs are read-locked for the whole join.
 */
final class JoinEngine {

    private static final Logger LOG = LoggerFactory.getLogger(JoinEngine.class);

    private JoinEngine() {
    }

    static DataFrame merge(DataFrame left, DataFrame right, JoinType type, List<String> leftOn, List<String> rightOn,
                           JoinOptions options) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(options, "options");
        if (type != JoinType.CROSS) {
            if (leftOn.isEmpty() || rightOn.isEmpty()) {
                throw new InvalidArgumentException("join keys cannot be empty");
            }
            if (leftOn.size() != rightOn.size()) {
                throw new InvalidArgumentException("left and right join keys differ in count: "
                        + leftOn.size() + " != " + rightOn.size());
            }
        }
        var leftKeys = type == JoinType.CROSS ? List.<String>of() : List.copyOf(leftOn);
        var rightKeys = type == JoinType.CROSS ? List.<String>of() : List.copyOf(rightOn);
        return left.read(() -> right.read(() -> {
            for (var key : leftKeys) {
                if (!left.hasColumn(key)) {
                    throw new ColumnNotFoundException("left key", key);
                }
            }
            for (var key : rightKeys) {
                if (!right.hasColumn(key)) {
                    throw new ColumnNotFoundException("right key", key);
                }
            }
            requireDistinctOutputNames(left, right, leftKeys, rightKeys, options);
            var pairs = pair(left, right, type, leftKeys, rightKeys);
            var leftRows = type == JoinType.RIGHT ? pairs.buildRows() : pairs.probeRows();
            var rightRows = type == JoinType.RIGHT ? pairs.probeRows() : pairs.buildRows();
            return assemble(left, right, type, leftKeys, rightKeys, leftRows, rightRows, options);
        }));
    }

    private static JoinPairs pair(DataFrame left, DataFrame right, JoinType type,
                                  List<String> leftKeys, List<String> rightKeys) {
        if (type == JoinType.CROSS) {
            LOG.debug("Cross join {} x {}", left.rowCount(), right.rowCount());
            return HashJoin.cross(left.rowCount(), right.rowCount());
        }
        var build = type == JoinType.RIGHT ? left : right;
        var probe = type == JoinType.RIGHT ? right : left;
        var buildKeys = type == JoinType.RIGHT ? leftKeys : rightKeys;
        var probeKeys = type == JoinType.RIGHT ? rightKeys : leftKeys;

        var join = new HashJoin();
        join.build(build.rowCount(), keyExtractor(build, buildKeys));
        var keepUnmatchedProbe = type != JoinType.INNER;
        var pairs = join.probe(probe.rowCount(), keyExtractor(probe, probeKeys),
                keepUnmatchedProbe, type == JoinType.OUTER);
        LOG.debug("{} join: built {} rows ({} distinct keys, {} null keys), probed {} rows, emitted {} rows",
                type.label(), join.buildRowCount(), join.distinctKeys(), join.nullKeyRows(),
                probe.rowCount(), pairs.size());
        return pairs;
    }

    private static IntFunction<CompositeKey> keyExtractor(DataFrame frame, List<String> keys) {
        var columns = new Series[keys.size()];
        for (var k = 0; k < columns.length; k++) {
            columns[k] = frame.column(keys.get(k));
        }
        return row -> {
            var values = new Object[columns.length];
            for (var k = 0; k < columns.length; k++) {
                values[k] = columns[k].get(row);
            }
            return CompositeKey.of(values);
        };
    }

    private static DataFrame assemble(DataFrame left, DataFrame right, JoinType type,
                                      List<String> leftKeys, List<String> rightKeys,
                                      int[] leftRows, int[] rightRows, JoinOptions options) {
        var foldedRightKeys = foldedRightKeys(leftKeys, rightKeys);
        var clash = clashing(left.columns(), right.columns(), foldedRightKeys);
        var leftMayBeMissing = type == JoinType.RIGHT || type == JoinType.OUTER;

        var result = new ArrayList<Series>(left.columnCount() + right.columnCount() + 1);
        for (var name : left.columns()) {
            var column = left.column(name);
            var keyPosition = leftKeys.indexOf(name);
            Series out;
            if (keyPosition >= 0 && leftMayBeMissing) {
                out = coalesce(column, leftRows, right.column(rightKeys.get(keyPosition)), rightRows);
            } else {
                out = column.take(leftRows);
            }
            var suffixed = clash.contains(name) && keyPosition < 0;
            result.add(suffixed ? out.rename(name + options.leftSuffix()) : out);
        }
        for (var name : right.columns()) {
            if (foldedRightKeys.contains(name)) {
                continue;
            }
            var out = right.column(name).take(rightRows);
            result.add(clash.contains(name) ? out.rename(name + options.rightSuffix()) : out);
        }
        if (options.indicator() != null) {
            var indicator = new String[leftRows.length];
            for (var i = 0; i < indicator.length; i++) {
                if (leftRows[i] != JoinPairs.UNMATCHED && rightRows[i] != JoinPairs.UNMATCHED) {
                    indicator[i] = JoinOptions.BOTH;
                } else if (leftRows[i] != JoinPairs.UNMATCHED) {
                    indicator[i] = JoinOptions.LEFT_ONLY;
                } else {
                    indicator[i] = JoinOptions.RIGHT_ONLY;
                }
            }
            result.add(Series.ofStrings(options.indicator(), indicator));
        }
        return new DataFrame(result, null, left.configuration());
    }

    /**
     * Fails before any work when suffixing, or the indicator column, would produce a name twice.
     *
     * @throws InvalidArgumentException naming the first repeated output column
     */
    private static void requireDistinctOutputNames(DataFrame left, DataFrame right, List<String> leftKeys,
                                                   List<String> rightKeys, JoinOptions options) {
        var foldedRightKeys = foldedRightKeys(leftKeys, rightKeys);
        var clash = clashing(left.columns(), right.columns(), foldedRightKeys);
        var names = new ArrayList<String>(left.columnCount() + right.columnCount() + 1);
        for (var name : left.columns()) {
            names.add(clash.contains(name) && !leftKeys.contains(name) ? name + options.leftSuffix() : name);
        }
        for (var name : right.columns()) {
            if (!foldedRightKeys.contains(name)) {
                names.add(clash.contains(name) ? name + options.rightSuffix() : name);
            }
        }
        if (options.indicator() != null) {
            names.add(options.indicator());
        }
        var seen = new HashSet<String>();
        for (var name : names) {
            if (!seen.add(name)) {
                throw new InvalidArgumentException("join would produce duplicate column \"" + name
                        + "\"; choose other suffixes or rename the inputs");
            }
        }
    }

    /**
     * Right keys named like their left key; they share the left key column in the output.
     */
    private static Set<String> foldedRightKeys(List<String> leftKeys, List<String> rightKeys) {
        var folded = new HashSet<String>();
        for (var k = 0; k < rightKeys.size(); k++) {
            if (rightKeys.get(k).equals(leftKeys.get(k))) {
                folded.add(rightKeys.get(k));
            }
        }
        return folded;
    }

    /**
     * Right output column names that also name a left column.
     */
    private static Set<String> clashing(List<String> leftColumns, List<String> rightColumns,
                                        Set<String> foldedRightKeys) {
        var leftNames = new HashSet<>(leftColumns);
        var clash = new HashSet<String>();
        for (var name : rightColumns) {
            if (!foldedRightKeys.contains(name) && leftNames.contains(name)) {
                clash.add(name);
            }
        }
        return clash;
    }

    /**
     * Left key values, falling back to the paired right key for rows with no left side.
     */
    private static Series coalesce(Series leftKey, int[] leftRows, Series rightKey, int[] rightRows) {
        var values = new ArrayList<Object>(leftRows.length);
        for (var i = 0; i < leftRows.length; i++) {
            values.add(leftRows[i] != JoinPairs.UNMATCHED ? leftKey.get(leftRows[i]) : rightKey.get(rightRows[i]));
        }
        var dtype = leftKey.dtype();
        if (dtype != rightKey.dtype()) {
            dtype = dtype.isNumeric() && rightKey.dtype().isNumeric() ? DType.FLOAT64 : DType.STRING;
        }
        return Series.of(leftKey.name(), dtype, values);
    }
}
