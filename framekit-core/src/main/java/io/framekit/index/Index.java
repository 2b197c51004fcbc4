package io.framekit.index;

/**
 * Row labels of a table, resolving labels to row positions.
 * <p>
 * All implementations are immutable.
 */
public sealed interface Index permits RangeIndex, LabelIndex, DatetimeIndex {

    int length();

    /**
     * Label at {@code position}, or {@code null} if out of range.
     */
    Object get(int position);

    /**
     * Labels in {@code [start, end)}; bounds are clamped.
     */
    Index slice(int start, int end);

    /**
     * Positions of {@code labels}, in argument order.
     *
     * @throws io.framekit.core.KeyNotFoundException if a label is absent or of the wrong type
     */
    int[] positionsOf(Object... labels);

    static RangeIndex range(int length) {
        return new RangeIndex(0, length, 1);
    }

    static int[] clamp(int start, int end, int length) {
        var from = Math.max(0, Math.min(start, length));
        var to = Math.max(from, Math.min(end, length));
        return new int[]{from, to};
    }
}
