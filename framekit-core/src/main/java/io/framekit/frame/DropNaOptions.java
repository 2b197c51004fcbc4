package io.framekit.frame;

import java.util.List;

/**
 * Row-dropping policy for {@link DataFrame#dropNa(DropNaOptions)}.
 *
 * @param how    drop rows with any null, or only rows that are entirely null
 * @param thresh keep rows with at least this many non-null cells; negative disables it and {@code how} applies
 * @param subset columns to inspect; empty means all columns
 */
public record DropNaOptions(How how, int thresh, List<String> subset) {

    public enum How {
        ANY,
        ALL
    }

    public DropNaOptions {
        if (how == null) {
            throw new IllegalArgumentException("how required");
        }
        subset = subset == null ? List.of() : List.copyOf(subset);
    }

    public static DropNaOptions any() {
        return new DropNaOptions(How.ANY, -1, List.of());
    }

    public static DropNaOptions all() {
        return new DropNaOptions(How.ALL, -1, List.of());
    }

    public static DropNaOptions thresh(int thresh) {
        return new DropNaOptions(How.ANY, thresh, List.of());
    }

    public DropNaOptions withSubset(String... columns) {
        return new DropNaOptions(how, thresh, List.of(columns));
    }

    boolean keep(int nonNull, int nulls) {
        if (thresh >= 0) {
            return nonNull >= thresh;
        }
        return how == How.ANY ? nulls == 0 : nonNull > 0;
    }
}
