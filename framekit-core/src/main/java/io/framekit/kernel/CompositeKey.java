package io.framekit.kernel;

import java.util.Arrays;

/**
 * Structured multi-column key used by grouping and joins.
 * <p>
 * Components are compared field by field, never through a formatted string,
 * so {@code ("a|b")} and {@code ("a", "|b")} are distinct keys. Numeric
 * components are canonicalised: an integral double equals the matching long
 * ({@code 1 == 1.0}) and {@code -0.0} equals {@code 0.0}. A {@code null}
 * component marks a missing cell; whether such a key participates is the
 * caller's decision.
 */
public final class CompositeKey {
    private final Object[] values;
    private final int hash;

    private CompositeKey(Object[] values) {
        this.values = values;
        this.hash = Arrays.hashCode(values);
    }

    public static CompositeKey of(Object... values) {
        var canonical = new Object[values.length];
        for (var i = 0; i < values.length; i++) {
            canonical[i] = canonicalize(values[i]);
        }
        return new CompositeKey(canonical);
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    /**
     * True if any component is missing.
     */
    public boolean hasNull() {
        for (var value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    static Object canonicalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            value = f.doubleValue();
        }
        if (value instanceof Double d) {
            var v = d.doubleValue();
            if (v == 0.0) {
                return 0L;
            }
            if (v == Math.rint(v) && v >= Long.MIN_VALUE && v < Long.MAX_VALUE) {
                return (long) v;
            }
            return d;
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CompositeKey other)) {
            return false;
        }
        return hash == other.hash && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
