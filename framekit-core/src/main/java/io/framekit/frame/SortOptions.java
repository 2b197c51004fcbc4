package io.framekit.frame;

import io.framekit.core.FrameConfiguration;
import io.framekit.core.NullPlacement;

/**
 * @param nullPlacement where null cells go, regardless of each key's direction
 * @param stable        keep the original relative order of rows that compare equal on every key
 */
public record SortOptions(NullPlacement nullPlacement, boolean stable) {

    public SortOptions {
        if (nullPlacement == null) {
            throw new IllegalArgumentException("nullPlacement required");
        }
    }

    public static SortOptions defaults() {
        return from(FrameConfiguration.defaults());
    }

    public static SortOptions from(FrameConfiguration configuration) {
        return new SortOptions(configuration.nullPlacement(), configuration.stableSort());
    }

    public SortOptions nullsFirst() {
        return new SortOptions(NullPlacement.NULLS_FIRST, stable);
    }

    public SortOptions nullsLast() {
        return new SortOptions(NullPlacement.NULLS_LAST, stable);
    }

    public SortOptions unstable() {
        return new SortOptions(nullPlacement, false);
    }
}
