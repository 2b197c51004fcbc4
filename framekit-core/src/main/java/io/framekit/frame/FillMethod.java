package io.framekit.frame;

/**
 * Gap-filling strategy for {@link DataFrame#interpolate(FillMethod, int)}.
 */
public enum FillMethod {
    /** Straight line between the nearest non-null neighbours; leading and trailing gaps stay null. */
    LINEAR,
    /** Carry the last non-null value forward. */
    FORWARD,
    /** Carry the next non-null value backward. */
    BACKWARD
}
