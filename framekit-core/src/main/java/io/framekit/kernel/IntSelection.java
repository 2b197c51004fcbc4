package io.framekit.kernel;

import java.util.Arrays;

/**
 * Growable, insertion-ordered list of row positions.
 * <p>
 * Duplicates are allowed; positions are kept in the order they were added,
 * which is what gives group buckets and filter results their scan order.
 */
public final class IntSelection {
    private static final int DEFAULT_CAPACITY = 16;

    private int[] values;
    private int size;

    public IntSelection() {
        this.values = new int[DEFAULT_CAPACITY];
    }

    public IntSelection(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.values = new int[Math.max(4, initialCapacity)];
    }

    public void add(int rowIndex) {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex must be non-negative");
        }
        ensureCapacity(size + 1);
        values[size++] = rowIndex;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index out of range: " + index);
        }
        return values[index];
    }

    public int first() {
        return get(0);
    }

    public int[] toIntArray() {
        return Arrays.copyOf(values, size);
    }

    private void ensureCapacity(int desired) {
        if (desired <= values.length) {
            return;
        }
        int newCapacity = Math.max(values.length * 2, desired);
        values = Arrays.copyOf(values, newCapacity);
    }
}
