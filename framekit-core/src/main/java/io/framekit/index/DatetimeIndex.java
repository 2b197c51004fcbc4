package io.framekit.index;

import io.framekit.core.InvalidArgumentException;
import io.framekit.core.KeyNotFoundException;

import java.time.Instant;
import java.util.List;

/**
 * Timestamps in non-decreasing order, looked up by binary search.
 */
public final class DatetimeIndex implements Index {

    private final List<Instant> instants;

    /**
     * @throws InvalidArgumentException if the timestamps are not in non-decreasing order
     */
    public DatetimeIndex(List<Instant> instants) {
        this.instants = List.copyOf(instants);
        for (var i = 1; i < this.instants.size(); i++) {
            if (this.instants.get(i).isBefore(this.instants.get(i - 1))) {
                throw new InvalidArgumentException("datetime index must be sorted, position " + i
                        + " (" + this.instants.get(i) + ") precedes " + this.instants.get(i - 1));
            }
        }
    }

    public List<Instant> instants() {
        return instants;
    }

    @Override
    public int length() {
        return instants.size();
    }

    @Override
    public Instant get(int position) {
        return position < 0 || position >= instants.size() ? null : instants.get(position);
    }

    @Override
    public DatetimeIndex slice(int start, int end) {
        var bounds = Index.clamp(start, end, instants.size());
        return new DatetimeIndex(instants.subList(bounds[0], bounds[1]));
    }

    @Override
    public int[] positionsOf(Object... labels) {
        var result = new int[labels.length];
        for (var i = 0; i < labels.length; i++) {
            if (!(labels[i] instanceof Instant instant)) {
                throw new KeyNotFoundException(labels[i], "datetime index labels are instants, got " + labels[i]);
            }
            result[i] = firstPosition(instant);
        }
        return result;
    }

    private int firstPosition(Instant target) {
        var low = 0;
        var high = instants.size();
        while (low < high) {
            var mid = (low + high) >>> 1;
            if (instants.get(mid).isBefore(target)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        if (low == instants.size() || !instants.get(low).equals(target)) {
            throw new KeyNotFoundException(target);
        }
        return low;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DatetimeIndex other && instants.equals(other.instants);
    }

    @Override
    public int hashCode() {
        return instants.hashCode();
    }

    @Override
    public String toString() {
        return "DatetimeIndex" + instants;
    }
}
