package io.framekit.frame;

import io.framekit.core.InvalidArgumentException;
import io.framekit.core.NullPlacement;
import io.framekit.core.SortOrder;
import io.framekit.index.Index;
import io.framekit.series.BoolSeries;
import io.framekit.series.Float64Series;
import io.framekit.series.Int64Series;
import io.framekit.series.Series;
import io.framekit.series.StringSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Row permutations for multi-column ordering.
 * <p>
 * Each sort column is snapshotted once into a typed order key; rows are then
 * compared key by key, stopping at the first difference. Nulls go first or
 * last according to {@link NullPlacement}, whatever the key's direction.
 * The stable variant breaks residual ties by original position and uses a
 * merge sort; the unstable variant uses quicksort and leaves ties in no
 * particular order.
 */
final class SortEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SortEngine.class);

    private SortEngine() {
    }

    /**
     * @throws InvalidArgumentException                 if {@code keys} is empty
     * @throws io.framekit.core.ColumnNotFoundException if a key column does not exist
     */
    static int[] argsort(DataFrame frame, List<SortKey> keys, SortOptions options) {
        if (keys.isEmpty()) {
            throw new InvalidArgumentException("sort needs at least one key");
        }
        frame.requireColumns(keys.stream().map(SortKey::column).toList());
        var orderKeys = new OrderKey[keys.size()];
        for (var k = 0; k < orderKeys.length; k++) {
            var key = keys.get(k);
            orderKeys[k] = orderKey(frame.column(key.column()), key.order(), options.nullPlacement());
        }
        LOG.debug("Sorting {} rows by {} (stable={})", frame.rowCount(), keys, options.stable());
        return permutation(frame.rowCount(), orderKeys, options.stable());
    }

    /**
     * Permutation ordering rows by their index labels.
     */
    static int[] argsortIndex(Index index, SortOrder order, boolean stable) {
        var labels = new Object[index.length()];
        for (var i = 0; i < labels.length; i++) {
            labels[i] = index.get(i);
        }
        return permutation(labels.length, new OrderKey[]{new LabelOrderKey(labels, order)}, stable);
    }

    private static int[] permutation(int rowCount, OrderKey[] keys, boolean stable) {
        var rows = new int[rowCount];
        for (var i = 0; i < rowCount; i++) {
            rows[i] = i;
        }
        if (rowCount < 2) {
            return rows;
        }
        if (stable) {
            mergeSort(rows, new int[rowCount], 0, rowCount, keys);
        } else {
            quickSort(rows, 0, rowCount - 1, keys);
        }
        return rows;
    }

    private static OrderKey orderKey(Series column, SortOrder order, NullPlacement placement) {
        var nulls = new boolean[column.length()];
        for (var i = 0; i < nulls.length; i++) {
            nulls[i] = column.isNull(i);
        }
        if (column instanceof Int64Series longs) {
            return new LongOrderKey(longs.toLongArray(), nulls, order, placement);
        }
        if (column instanceof Float64Series doubles) {
            var values = new double[nulls.length];
            for (var i = 0; i < values.length; i++) {
                values[i] = doubles.getDouble(i);
            }
            return new DoubleOrderKey(values, nulls, order, placement);
        }
        if (column instanceof BoolSeries booleans) {
            return new BooleanOrderKey(booleans.toBooleanArray(), nulls, order, placement);
        }
        return new StringOrderKey(((StringSeries) column).toStringArray(), nulls, order, placement);
    }

    private static int compareRows(int left, int right, OrderKey[] keys) {
        for (var key : keys) {
            var cmp = key.compare(left, right);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static void mergeSort(int[] rows, int[] scratch, int from, int to, OrderKey[] keys) {
        if (to - from < 2) {
            return;
        }
        var mid = (from + to) >>> 1;
        mergeSort(rows, scratch, from, mid, keys);
        mergeSort(rows, scratch, mid, to, keys);
        if (compareRows(rows[mid - 1], rows[mid], keys) <= 0) {
            return;
        }
        System.arraycopy(rows, from, scratch, from, to - from);
        var i = from;
        var j = mid;
        for (var k = from; k < to; k++) {
            // take from the left run on ties; it holds the earlier rows
            if (j >= to || (i < mid && compareRows(scratch[i], scratch[j], keys) <= 0)) {
                rows[k] = scratch[i++];
            } else {
                rows[k] = scratch[j++];
            }
        }
    }

    private static void quickSort(int[] rows, int low, int high, OrderKey[] keys) {
        var i = low;
        var j = high;
        var pivot = rows[low + ((high - low) >>> 1)];
        while (i <= j) {
            while (compareRows(rows[i], pivot, keys) < 0) {
                i++;
            }
            while (compareRows(rows[j], pivot, keys) > 0) {
                j--;
            }
            if (i <= j) {
                var tmp = rows[i];
                rows[i] = rows[j];
                rows[j] = tmp;
                i++;
                j--;
            }
        }
        if (low < j) {
            quickSort(rows, low, j, keys);
        }
        if (i < high) {
            quickSort(rows, i, high, keys);
        }
    }

    private interface OrderKey {
        int compare(int leftRow, int rightRow);
    }

    private abstract static class NullableOrderKey implements OrderKey {
        private final boolean[] nulls;
        private final SortOrder order;
        private final int nullSign;

        NullableOrderKey(boolean[] nulls, SortOrder order, NullPlacement placement) {
            this.nulls = nulls;
            this.order = order;
            this.nullSign = placement == NullPlacement.NULLS_FIRST ? -1 : 1;
        }

        @Override
        public final int compare(int leftRow, int rightRow) {
            var leftNull = nulls[leftRow];
            var rightNull = nulls[rightRow];
            if (leftNull || rightNull) {
                if (leftNull == rightNull) {
                    return 0;
                }
                return leftNull ? nullSign : -nullSign;
            }
            return order.apply(compareValues(leftRow, rightRow));
        }

        abstract int compareValues(int leftRow, int rightRow);
    }

    private static final class LongOrderKey extends NullableOrderKey {
        private final long[] values;

        LongOrderKey(long[] values, boolean[] nulls, SortOrder order, NullPlacement placement) {
            super(nulls, order, placement);
            this.values = values;
        }

        @Override
        int compareValues(int leftRow, int rightRow) {
            return Long.compare(values[leftRow], values[rightRow]);
        }
    }

    private static final class DoubleOrderKey extends NullableOrderKey {
        private final double[] values;

        DoubleOrderKey(double[] values, boolean[] nulls, SortOrder order, NullPlacement placement) {
            super(nulls, order, placement);
            this.values = values;
        }

        @Override
        int compareValues(int leftRow, int rightRow) {
            var l = values[leftRow];
            var r = values[rightRow];
            // -0.0 == 0.0; NaN above every number
            return l == r ? 0 : Double.compare(l, r);
        }
    }

    private static final class BooleanOrderKey extends NullableOrderKey {
        private final boolean[] values;

        BooleanOrderKey(boolean[] values, boolean[] nulls, SortOrder order, NullPlacement placement) {
            super(nulls, order, placement);
            this.values = values;
        }

        @Override
        int compareValues(int leftRow, int rightRow) {
            return Boolean.compare(values[leftRow], values[rightRow]);
        }
    }

    private static final class StringOrderKey extends NullableOrderKey {
        private final String[] values;

        StringOrderKey(String[] values, boolean[] nulls, SortOrder order, NullPlacement placement) {
            super(nulls, order, placement);
            this.values = values;
        }

        @Override
        int compareValues(int leftRow, int rightRow) {
            return values[leftRow].compareTo(values[rightRow]);
        }
    }

    private static final class LabelOrderKey implements OrderKey {
        private final Object[] labels;
        private final SortOrder order;

        LabelOrderKey(Object[] labels, SortOrder order) {
            this.labels = labels;
            this.order = order;
        }

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public int compare(int leftRow, int rightRow) {
            return order.apply(((Comparable) labels[leftRow]).compareTo(labels[rightRow]));
        }
    }
}
