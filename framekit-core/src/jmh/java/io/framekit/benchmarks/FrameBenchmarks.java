package io.framekit.benchmarks;

import io.framekit.core.SortOrder;
import io.framekit.frame.Aggregation;
import io.framekit.frame.DataFrame;
import io.framekit.frame.JoinType;
import io.framekit.frame.SortKey;
import io.framekit.frame.SortOptions;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FrameBenchmarks {

    @Param({"100000"})
    private int rows;

    private DataFrame facts;
    private DataFrame dimension;

    @Setup(Level.Trial)
    public void setup() {
        var random = new Random(7);
        var keys = new long[rows];
        var categories = new String[rows];
        var amounts = new double[rows];
        for (int i = 0; i < rows; i++) {
            keys[i] = random.nextInt(1_000);
            categories[i] = "cat" + (i % 100);
            amounts[i] = random.nextDouble() * 100.0;
        }
        facts = DataFrame.builder()
                .longs("key", keys)
                .strings("category", categories)
                .doubles("amount", amounts)
                .build();

        var dimensionKeys = new long[1_000];
        var labels = new String[1_000];
        for (int i = 0; i < dimensionKeys.length; i++) {
            dimensionKeys[i] = i;
            labels[i] = "label" + i;
        }
        dimension = DataFrame.builder()
                .longs("key", dimensionKeys)
                .strings("label", labels)
                .build();
    }

    @Benchmark
    public void groupBySum(Blackhole blackhole) {
        blackhole.consume(facts.groupBy("category").agg(Map.of("amount", Aggregation.SUM)));
    }

    @Benchmark
    public void groupByTwoKeys(Blackhole blackhole) {
        blackhole.consume(facts.groupBy("category", "key").size());
    }

    @Benchmark
    public void innerJoin(Blackhole blackhole) {
        blackhole.consume(facts.join(dimension, JoinType.INNER, "key"));
    }

    @Benchmark
    public void sortSingleColumn(Blackhole blackhole) {
        blackhole.consume(facts.argsort("amount", SortOrder.ASCENDING));
    }

    @Benchmark
    public void sortTwoColumnsUnstable(Blackhole blackhole) {
        blackhole.consume(facts.argsort(List.of(SortKey.asc("category"), SortKey.desc("amount")),
                SortOptions.defaults().unstable()));
    }

    @Benchmark
    public void rollingMean(Blackhole blackhole) {
        blackhole.consume(facts.rolling(20).mean("amount"));
    }

    public static void main(String[] args) throws Exception {
        org.openjdk.jmh.Main.main(args);
    }
}
