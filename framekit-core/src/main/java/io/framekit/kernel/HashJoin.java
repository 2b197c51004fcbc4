package io.framekit.kernel;

import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Hash build/probe core shared by every keyed join kind.
 * <p>
 * The build side is bucketed by its full {@link CompositeKey}; rows whose key
 * has a missing component are never inserted, so a null key matches nothing,
 * not even another null key. Lookups go through {@link CompositeKey#equals},
 * so two keys that merely share a hash code never pair up.
 * <p>
 * One instance serves one join: build once, probe once.
 */
public final class HashJoin {
    private final Map<CompositeKey, IntSelection> buildTable = new HashMap<>();
    private Bitset matchedBuildRows = new Bitset(0);
    private int buildRowCount;
    private int nullKeyRows;

    public void build(int rowCount, IntFunction<CompositeKey> keys) {
        matchedBuildRows = new Bitset(rowCount);
        for (var row = 0; row < rowCount; row++) {
            var key = keys.apply(row);
            if (key.hasNull()) {
                nullKeyRows++;
                continue;
            }
            buildTable.computeIfAbsent(key, k -> new IntSelection(4)).add(row);
            buildRowCount++;
        }
    }

    /**
     * Probe every row of the other side in order.
     *
     * @param rowCount            probe-side row count
     * @param keys                probe-side key extractor
     * @param keepUnmatchedProbe  emit (probe, UNMATCHED) for probe rows without a match
     * @param emitUnmatchedBuild  after probing, emit (UNMATCHED, build) for build rows never matched
     * @return the emitted pairs, probe order first, then unmatched build rows in build order
     */
    public JoinPairs probe(int rowCount, IntFunction<CompositeKey> keys,
            boolean keepUnmatchedProbe, boolean emitUnmatchedBuild) {
        var pairs = new JoinPairs(rowCount);
        for (var row = 0; row < rowCount; row++) {
            var key = keys.apply(row);
            var matches = key.hasNull() ? null : buildTable.get(key);
            if (matches == null) {
                if (keepUnmatchedProbe) {
                    pairs.add(row, JoinPairs.UNMATCHED);
                }
                continue;
            }
            for (var i = 0; i < matches.size(); i++) {
                var buildRow = matches.get(i);
                matchedBuildRows.set(buildRow);
                pairs.add(row, buildRow);
            }
        }
        if (emitUnmatchedBuild) {
            for (var row = 0; row < matchedBuildRows.length(); row++) {
                if (!matchedBuildRows.test(row)) {
                    pairs.add(JoinPairs.UNMATCHED, row);
                }
            }
        }
        return pairs;
    }

    /**
     * Cartesian product of two row ranges, left-major.
     */
    public static JoinPairs cross(int leftRows, int rightRows) {
        var pairs = new JoinPairs((int) Math.min(1 << 20, (long) leftRows * rightRows));
        for (var left = 0; left < leftRows; left++) {
            for (var right = 0; right < rightRows; right++) {
                pairs.add(left, right);
            }
        }
        return pairs;
    }

    public int buildRowCount() {
        return buildRowCount;
    }

    public int distinctKeys() {
        return buildTable.size();
    }

    /**
     * Build rows skipped because their key had a missing component.
     */
    public int nullKeyRows() {
        return nullKeyRows;
    }
}
