package io.framekit.core;

public enum SortOrder {
    ASCENDING,
    DESCENDING;

    public int apply(int comparison) {
        return this == ASCENDING ? comparison : -comparison;
    }
}
