package io.framekit.frame;

import io.framekit.core.FrameConfiguration;

/**
 * Output naming for joins.
 *
 * @param leftSuffix  appended to left columns whose names clash with right non-key columns
 * @param rightSuffix appended to the clashing right columns
 * @param indicator   name of a column recording "both", "left_only" or "right_only" per row; {@code null} for none
 */
public record JoinOptions(String leftSuffix, String rightSuffix, String indicator) {

    public static final String BOTH = "both";
    public static final String LEFT_ONLY = "left_only";
    public static final String RIGHT_ONLY = "right_only";

    public JoinOptions {
        if (leftSuffix == null || rightSuffix == null) {
            throw new IllegalArgumentException("suffixes required");
        }
        if (leftSuffix.equals(rightSuffix)) {
            throw new IllegalArgumentException("suffixes must differ: " + leftSuffix);
        }
    }

    public static JoinOptions defaults() {
        return from(FrameConfiguration.defaults());
    }

    public static JoinOptions from(FrameConfiguration configuration) {
        return new JoinOptions(configuration.leftSuffix(), configuration.rightSuffix(), null);
    }

    public JoinOptions withSuffixes(String left, String right) {
        return new JoinOptions(left, right, indicator);
    }

    public JoinOptions withIndicator(String column) {
        return new JoinOptions(leftSuffix, rightSuffix, column);
    }
}
