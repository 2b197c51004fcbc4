package io.framekit.kernel;

import java.util.Arrays;

/**
 * Fixed-length packed bit vector.
 * <p>
 * Used as the null mask of a column (bit set = cell is null) and as the
 * value store of boolean columns. The length is fixed at creation; all
 * positional operations reject positions outside {@code [0, length)}.
 * <p>
 * <b>Thread-safety:</b> none. Owners guard access.
 */
public final class Bitset {
    private static final int WORD_SHIFT = 6;
    private static final int WORD_MASK = 63;

    private final long[] words;
    private final int length;

    /**
     * Create a bitset of {@code length} cleared bits. Negative lengths are treated as zero.
     */
    public Bitset(int length) {
        this.length = Math.max(0, length);
        this.words = new long[wordCount(this.length)];
    }

    private Bitset(long[] words, int length) {
        this.words = words;
        this.length = length;
    }

    public int length() {
        return length;
    }

    public void set(int index) {
        checkIndex(index);
        words[index >>> WORD_SHIFT] |= 1L << (index & WORD_MASK);
    }

    public void clear(int index) {
        checkIndex(index);
        words[index >>> WORD_SHIFT] &= ~(1L << (index & WORD_MASK));
    }

    public void set(int index, boolean value) {
        if (value) {
            set(index);
        } else {
            clear(index);
        }
    }

    public boolean test(int index) {
        checkIndex(index);
        return (words[index >>> WORD_SHIFT] & (1L << (index & WORD_MASK))) != 0L;
    }

    /**
     * Population count.
     */
    public int count() {
        var count = 0;
        for (var word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    public boolean any() {
        for (var word : words) {
            if (word != 0L) {
                return true;
            }
        }
        return false;
    }

    public boolean none() {
        return !any();
    }

    public boolean all() {
        return count() == length;
    }

    public void setAll() {
        Arrays.fill(words, -1L);
        var tail = length & WORD_MASK;
        if (tail != 0) {
            words[words.length - 1] &= (1L << tail) - 1L;
        }
    }

    public void clearAll() {
        Arrays.fill(words, 0L);
    }

    /**
     * Deep copy.
     */
    public Bitset copy() {
        return new Bitset(words.clone(), length);
    }

    /**
     * Copy of the bits in {@code [start, end)} re-indexed from zero.
     * Bounds are clamped; an empty range yields an empty bitset.
     */
    public Bitset slice(int start, int end) {
        var from = Math.max(0, start);
        var to = Math.min(length, end);
        if (from >= to) {
            return new Bitset(0);
        }
        var result = new Bitset(to - from);
        for (var i = from; i < to; i++) {
            if (test(i)) {
                result.set(i - from);
            }
        }
        return result;
    }

    /**
     * Position of the next set bit at or after {@code from}, or -1.
     */
    public int nextSetBit(int from) {
        if (from < 0) {
            from = 0;
        }
        if (from >= length) {
            return -1;
        }
        var wordIndex = from >>> WORD_SHIFT;
        var word = words[wordIndex] & (-1L << (from & WORD_MASK));
        while (true) {
            if (word != 0L) {
                var bit = (wordIndex << WORD_SHIFT) + Long.numberOfTrailingZeros(word);
                return bit < length ? bit : -1;
            }
            if (++wordIndex == words.length) {
                return -1;
            }
            word = words[wordIndex];
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Bitset other)) {
            return false;
        }
        return length == other.length && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(words) + length;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(length + 8);
        sb.append("Bitset[");
        for (var i = 0; i < length; i++) {
            sb.append(test(i) ? '1' : '0');
        }
        return sb.append(']').toString();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("bit index out of range: " + index + " (length " + length + ")");
        }
    }

    private static int wordCount(int bits) {
        return (bits + WORD_MASK) >>> WORD_SHIFT;
    }
}
