package io.framekit.kernel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash buckets of row positions keyed by {@link CompositeKey}, ordered by first occurrence.
 * <p>
 * Bucket order is held in explicit lists next to the hash map, so iteration
 * order is the order in which keys were first added and never depends on the
 * map's internal layout.
 */
public final class KeyedBuckets {
    private final Map<CompositeKey, Integer> bucketByKey = new HashMap<>();
    private final List<CompositeKey> keys = new ArrayList<>();
    private final List<IntSelection> rows = new ArrayList<>();

    /**
     * Append a row to the bucket of {@code key}, opening the bucket if it is new.
     *
     * @return the bucket ordinal
     */
    public int add(CompositeKey key, int row) {
        var bucket = bucketByKey.get(key);
        if (bucket == null) {
            bucket = keys.size();
            bucketByKey.put(key, bucket);
            keys.add(key);
            rows.add(new IntSelection(4));
        }
        rows.get(bucket).add(row);
        return bucket;
    }

    public int bucketCount() {
        return keys.size();
    }

    public CompositeKey key(int bucket) {
        return keys.get(bucket);
    }

    public IntSelection rows(int bucket) {
        return rows.get(bucket);
    }

    /**
     * Bucket ordinal for {@code key}, or -1 when absent.
     */
    public int bucketOf(CompositeKey key) {
        var bucket = bucketByKey.get(key);
        return bucket == null ? -1 : bucket;
    }
}
