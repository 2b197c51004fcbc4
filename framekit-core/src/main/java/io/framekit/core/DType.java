package io.framekit.core;

/**
 * Column data type tag.
 */
public enum DType {
    INT64("int64"),
    FLOAT64("float64"),
    BOOL("bool"),
    STRING("string");

    private final String label;

    DType(String label) {
        this.label = label;
    }

    public boolean isNumeric() {
        return this == INT64 || this == FLOAT64;
    }

    /**
     * Infer the dtype of a boxed cell value.
     * Integral boxes map to INT64, floating boxes to FLOAT64, anything
     * unrecognised to STRING.
     */
    public static DType of(Object value) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return INT64;
        }
        if (value instanceof Double || value instanceof Float) {
            return FLOAT64;
        }
        if (value instanceof Boolean) {
            return BOOL;
        }
        return STRING;
    }

    @Override
    public String toString() {
        return label;
    }
}
