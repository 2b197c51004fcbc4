package io.framekit.index;

import io.framekit.core.KeyNotFoundException;

/**
 * Contiguous integer labels {@code start, start + step, ...} stopping before {@code stop}.
 * A step of zero is treated as one; negative steps count down.
 */
public record RangeIndex(long start, long stop, long step) implements Index {

    public RangeIndex {
        if (step == 0) {
            step = 1;
        }
    }

    @Override
    public int length() {
        if (step > 0) {
            return stop <= start ? 0 : (int) ((stop - start + step - 1) / step);
        }
        return stop >= start ? 0 : (int) ((start - stop - step - 1) / -step);
    }

    @Override
    public Long get(int position) {
        if (position < 0 || position >= length()) {
            return null;
        }
        return start + position * step;
    }

    @Override
    public RangeIndex slice(int start, int end) {
        var bounds = Index.clamp(start, end, length());
        return new RangeIndex(this.start + bounds[0] * step, this.start + bounds[1] * step, step);
    }

    @Override
    public int[] positionsOf(Object... labels) {
        var positions = new int[labels.length];
        for (var i = 0; i < labels.length; i++) {
            positions[i] = positionOf(labels[i]);
        }
        return positions;
    }

    private int positionOf(Object label) {
        if (!(label instanceof Integer || label instanceof Long || label instanceof Short || label instanceof Byte)) {
            throw new KeyNotFoundException(label, "range index labels are integers, got " + label);
        }
        var value = ((Number) label).longValue();
        var offset = value - start;
        if (offset % step != 0) {
            throw new KeyNotFoundException(label);
        }
        var position = offset / step;
        if (position < 0 || position >= length()) {
            throw new KeyNotFoundException(label);
        }
        return (int) position;
    }
}
