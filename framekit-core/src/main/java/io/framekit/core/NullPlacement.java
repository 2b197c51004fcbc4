package io.framekit.core;

/**
 * Position of null cells in a sorted permutation, independent of the sort direction.
 */
public enum NullPlacement {
    NULLS_FIRST,
    NULLS_LAST
}
