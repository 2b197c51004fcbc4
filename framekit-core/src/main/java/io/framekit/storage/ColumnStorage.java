package io.framekit.storage;

import io.framekit.core.DType;
import io.framekit.kernel.Bitset;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dense, fixed-length column buffer with an optional null mask.
 * <p>
 * Buffers are shared between series views by reference counting: a view
 * calls {@link #retain()} instead of copying, and a writer that finds the
 * buffer {@link #isShared() shared} must {@link #copy()} it and
 * {@link #release()} its reference before mutating. The mask is allocated
 * lazily on the first null.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Reference counting is atomic.</li>
 *   <li>Cell reads and writes are not synchronised; the owning series guards them.</li>
 *   <li>A buffer reachable from more than one series is never written in place.</li>
 * </ul>
 */
public abstract class ColumnStorage {
    /**
     * Position marker in {@link #gather(int[])} that produces a null cell.
     */
    public static final int MISSING = -1;

    private final AtomicInteger references = new AtomicInteger(1);
    private Bitset nulls;

    protected ColumnStorage(Bitset nulls) {
        this.nulls = nulls;
    }

    public abstract DType dtype();

    public abstract int length();

    /**
     * Boxed value at {@code offset} ignoring the null mask.
     */
    public abstract Object boxed(int offset);

    /**
     * Store a boxed, already-converted value and clear the null bit.
     */
    public abstract void setBoxed(int offset, Object value);

    /**
     * Deep copy of values and mask with a fresh reference count.
     */
    public abstract ColumnStorage copy();

    /**
     * New buffer holding the cells at {@code positions}, in order.
     * A {@link #MISSING} position yields a null cell.
     */
    public abstract ColumnStorage gather(int[] positions);

    /**
     * New buffer holding the cells in {@code [start, end)}.
     */
    public abstract ColumnStorage slice(int start, int end);

    public boolean isNull(int offset) {
        checkOffset(offset);
        return nulls != null && nulls.test(offset);
    }

    public void setNull(int offset) {
        checkOffset(offset);
        if (nulls == null) {
            nulls = new Bitset(length());
        }
        nulls.set(offset);
    }

    protected void clearNull(int offset) {
        if (nulls != null) {
            nulls.clear(offset);
        }
    }

    public int nullCount() {
        return nulls == null ? 0 : nulls.count();
    }

    public boolean hasNulls() {
        return nulls != null && nulls.any();
    }

    /**
     * The live mask, or null when no null was ever recorded.
     */
    protected Bitset nulls() {
        return nulls;
    }

    /**
     * Copy of the mask, or null when there are no nulls.
     */
    public Bitset nullMask() {
        return hasNulls() ? nulls.copy() : null;
    }

    protected Bitset copyNulls() {
        return nulls == null ? null : nulls.copy();
    }

    protected Bitset sliceNulls(int start, int end) {
        return nulls == null ? null : nulls.slice(start, end);
    }

    /**
     * Mask for a gather: a cell is null if its position is {@link #MISSING}
     * or the source cell is null. Returns null when the result has no nulls.
     */
    protected Bitset gatherNulls(int[] positions) {
        Bitset result = null;
        for (var i = 0; i < positions.length; i++) {
            var position = positions[i];
            if (position == MISSING || (nulls != null && nulls.test(position))) {
                if (result == null) {
                    result = new Bitset(positions.length);
                }
                result.set(i);
            }
        }
        return result;
    }

    public ColumnStorage retain() {
        references.incrementAndGet();
        return this;
    }

    public void release() {
        references.decrementAndGet();
    }

    public boolean isShared() {
        return references.get() > 1;
    }

    public int references() {
        return references.get();
    }

    protected void checkOffset(int offset) {
        if (offset < 0 || offset >= length()) {
            throw new IndexOutOfBoundsException("offset out of range: " + offset);
        }
    }

    protected static int[] checkedSliceBounds(int start, int end, int length) {
        var from = Math.max(0, start);
        var to = Math.min(length, end);
        return from >= to ? new int[] { 0, 0 } : new int[] { from, to };
    }
}
