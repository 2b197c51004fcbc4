package io.framekit.index;

import io.framekit.core.KeyNotFoundException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Discrete string labels. A repeated label resolves to its first position.
 */
public final class LabelIndex implements Index {

    private final List<String> labels;
    private final Map<String, Integer> positions;

    public LabelIndex(List<String> labels) {
        this.labels = List.copyOf(labels);
        this.positions = new HashMap<>();
        for (var i = 0; i < this.labels.size(); i++) {
            positions.putIfAbsent(this.labels.get(i), i);
        }
    }

    public static LabelIndex of(String... labels) {
        return new LabelIndex(List.of(labels));
    }

    public List<String> labels() {
        return labels;
    }

    @Override
    public int length() {
        return labels.size();
    }

    @Override
    public String get(int position) {
        return position < 0 || position >= labels.size() ? null : labels.get(position);
    }

    @Override
    public LabelIndex slice(int start, int end) {
        var bounds = Index.clamp(start, end, labels.size());
        return new LabelIndex(labels.subList(bounds[0], bounds[1]));
    }

    @Override
    public int[] positionsOf(Object... labels) {
        var result = new int[labels.length];
        for (var i = 0; i < labels.length; i++) {
            var label = labels[i];
            var position = label instanceof String s ? positions.get(s) : null;
            if (position == null) {
                throw new KeyNotFoundException(label);
            }
            result[i] = position;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LabelIndex other && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "LabelIndex" + labels;
    }
}
