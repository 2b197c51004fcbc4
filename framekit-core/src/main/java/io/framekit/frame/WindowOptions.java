package io.framekit.frame;

/**
 * Rolling window settings.
 *
 * @param minPeriods fewest non-null values a window needs to produce a result; negative means the window size
 * @param center     centre the window on each row instead of ending it there
 */
public record WindowOptions(int minPeriods, boolean center) {

    public static WindowOptions defaults() {
        return new WindowOptions(-1, false);
    }

    public WindowOptions withMinPeriods(int minPeriods) {
        return new WindowOptions(minPeriods, center);
    }

    public WindowOptions centered() {
        return new WindowOptions(minPeriods, true);
    }
}
