package io.framekit.core;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration for the table engine.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * FrameConfiguration config = FrameConfiguration.builder()
 *     .naValues(List.of("", "NA"))
 *     .suffixes("_l", "_r")
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class FrameConfiguration {

    /**
     * Strings treated as missing when parsing raw cells.
     */
    public static final List<String> DEFAULT_NA_VALUES = List.of(
            "", "NA", "N/A", "NULL", "null", "NaN", "nan", "#N/A", "#NA", "None", "none", "-");

    private static final FrameConfiguration DEFAULTS = builder().build();

    // Ingestion
    private final Set<String> naValues;

    // Join configuration
    private final String leftSuffix;
    private final String rightSuffix;

    // Sorting configuration
    private final NullPlacement nullPlacement;
    private final boolean stableSort;

    // Window configuration
    private final double ewmDefaultAlpha;

    // Display
    private final int displayRows;

    private FrameConfiguration(Builder builder) {
        this.naValues = Set.copyOf(builder.naValues);
        this.leftSuffix = builder.leftSuffix;
        this.rightSuffix = builder.rightSuffix;
        this.nullPlacement = builder.nullPlacement;
        this.stableSort = builder.stableSort;
        this.ewmDefaultAlpha = builder.ewmDefaultAlpha;
        this.displayRows = builder.displayRows;
    }

    /**
     * Create a new builder for FrameConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared configuration holding every default.
     */
    public static FrameConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check whether a raw token denotes a missing value.
     *
     * @param token the raw token, may be null
     * @return true if the token is null or one of the configured NA values
     */
    public boolean isNaToken(String token) {
        return token == null || naValues.contains(token);
    }

    public Set<String> naValues() {
        return naValues;
    }

    /**
     * Get the suffix appended to overlapping left-side column names in joins.
     *
     * @return left suffix (default "_left")
     */
    public String leftSuffix() {
        return leftSuffix;
    }

    /**
     * Get the suffix appended to overlapping right-side column names in joins.
     *
     * @return right suffix (default "_right")
     */
    public String rightSuffix() {
        return rightSuffix;
    }

    /**
     * Get the default null placement for sorting.
     *
     * @return null placement (default NULLS_LAST)
     */
    public NullPlacement nullPlacement() {
        return nullPlacement;
    }

    /**
     * Check if sorts are stable unless requested otherwise.
     *
     * @return true if stable sorting is the default
     */
    public boolean stableSort() {
        return stableSort;
    }

    /**
     * Smoothing factor used when an exponentially weighted window is given an alpha outside (0, 1).
     */
    public double ewmDefaultAlpha() {
        return ewmDefaultAlpha;
    }

    /**
     * Get the number of rows rendered by {@code toString()}.
     */
    public int displayRows() {
        return displayRows;
    }

    /**
     * Builder for FrameConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private Collection<String> naValues = DEFAULT_NA_VALUES;
        private String leftSuffix = "_left";
        private String rightSuffix = "_right";
        private NullPlacement nullPlacement = NullPlacement.NULLS_LAST;
        private boolean stableSort = true;
        private double ewmDefaultAlpha = 0.5;
        private int displayRows = 10;

        private Builder() {
        }

        /**
         * Set the tokens treated as missing values when parsing.
         *
         * @param naValues the NA tokens
         * @return this builder for method chaining
         */
        public Builder naValues(Collection<String> naValues) {
            if (naValues == null) {
                throw new IllegalArgumentException("naValues required");
            }
            this.naValues = naValues;
            return this;
        }

        /**
         * Set the suffixes for overlapping non-key join columns.
         *
         * @param leftSuffix  suffix for left columns
         * @param rightSuffix suffix for right columns
         * @return this builder for method chaining
         */
        public Builder suffixes(String leftSuffix, String rightSuffix) {
            if (leftSuffix == null || rightSuffix == null) {
                throw new IllegalArgumentException("suffixes required");
            }
            this.leftSuffix = leftSuffix;
            this.rightSuffix = rightSuffix;
            return this;
        }

        public Builder nullPlacement(NullPlacement nullPlacement) {
            if (nullPlacement == null) {
                throw new IllegalArgumentException("nullPlacement required");
            }
            this.nullPlacement = nullPlacement;
            return this;
        }

        public Builder stableSort(boolean stableSort) {
            this.stableSort = stableSort;
            return this;
        }

        public Builder ewmDefaultAlpha(double ewmDefaultAlpha) {
            if (!(ewmDefaultAlpha > 0.0 && ewmDefaultAlpha < 1.0)) {
                throw new IllegalArgumentException("ewmDefaultAlpha must be in (0, 1): " + ewmDefaultAlpha);
            }
            this.ewmDefaultAlpha = ewmDefaultAlpha;
            return this;
        }

        public Builder displayRows(int displayRows) {
            if (displayRows < 0) {
                throw new IllegalArgumentException("displayRows must be non-negative: " + displayRows);
            }
            this.displayRows = displayRows;
            return this;
        }

        /**
         * Build the immutable FrameConfiguration.
         *
         * @return a new FrameConfiguration instance
         */
        public FrameConfiguration build() {
            return new FrameConfiguration(this);
        }
    }
}
