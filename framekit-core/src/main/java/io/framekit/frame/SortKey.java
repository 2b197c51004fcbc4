package io.framekit.frame;

import io.framekit.core.SortOrder;

/**
 * One column of a multi-column ordering.
 */
public record SortKey(String column, SortOrder order) {

    public SortKey {
        if (column == null || column.isEmpty()) {
            throw new IllegalArgumentException("column required");
        }
        if (order == null) {
            throw new IllegalArgumentException("order required");
        }
    }

    public static SortKey asc(String column) {
        return new SortKey(column, SortOrder.ASCENDING);
    }

    public static SortKey desc(String column) {
        return new SortKey(column, SortOrder.DESCENDING);
    }
}
