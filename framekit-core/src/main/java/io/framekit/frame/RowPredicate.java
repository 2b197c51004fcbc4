package io.framekit.frame;

/**
 * Row filter used by {@link DataFrame#filter(RowPredicate)}.
 */
@FunctionalInterface
public interface RowPredicate {

    boolean test(Row row);

    default RowPredicate and(RowPredicate other) {
        return row -> test(row) && other.test(row);
    }

    default RowPredicate negate() {
        return row -> !test(row);
    }
}
