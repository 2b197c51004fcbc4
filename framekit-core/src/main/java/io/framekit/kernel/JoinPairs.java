package io.framekit.kernel;

import java.util.Arrays;

/**
 * Parallel lists of (probe row, build row) pairs emitted by a join.
 * A position of {@link #UNMATCHED} means the side has no row for that output row.
 */
public final class JoinPairs {
    public static final int UNMATCHED = -1;

    private int[] probeRows;
    private int[] buildRows;
    private int size;

    public JoinPairs(int initialCapacity) {
        var capacity = Math.max(16, initialCapacity);
        this.probeRows = new int[capacity];
        this.buildRows = new int[capacity];
    }

    public void add(int probeRow, int buildRow) {
        if (size == probeRows.length) {
            var newCapacity = probeRows.length * 2;
            probeRows = Arrays.copyOf(probeRows, newCapacity);
            buildRows = Arrays.copyOf(buildRows, newCapacity);
        }
        probeRows[size] = probeRow;
        buildRows[size] = buildRow;
        size++;
    }

    public int size() {
        return size;
    }

    public int[] probeRows() {
        return Arrays.copyOf(probeRows, size);
    }

    public int[] buildRows() {
        return Arrays.copyOf(buildRows, size);
    }
}
