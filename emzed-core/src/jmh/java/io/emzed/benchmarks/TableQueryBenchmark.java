package io.emzed.benchmarks;

import io.emzed.storage.Table;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Filter, sort and grouping throughput on a peak table.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class TableQueryBenchmark {

    @Param({"10000", "100000"})
    public int rowCount;

    private Table peaks;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(List.of(i, 100.0 + random.nextDouble() * 900.0, random.nextDouble() * 1200.0,
                    "sample" + (i % 20)));
        }
        peaks = new Table(List.of("id", "mz", "rt", "sample"),
                List.<Class<?>>of(Integer.class, Double.class, Double.class, String.class),
                List.of("%d", "%.5f", "minutes", "%s"), rows, "peaks", null);
    }

    @Benchmark
    public void filterRange(Blackhole blackhole) {
        blackhole.consume(peaks.filter(peaks.column("mz").between(300.0, 400.0)));
    }

    @Benchmark
    public void filterCombined(Blackhole blackhole) {
        blackhole.consume(peaks.filter(peaks.column("mz").gt(500.0).and(peaks.column("rt").lt(600.0))));
    }

    @Benchmark
    public void filterGroupAggregate(Blackhole blackhole) {
        blackhole.consume(peaks.filter(
                peaks.column("mz").eq(peaks.column("mz").max().groupBy(peaks.column("sample")))));
    }

    @Benchmark
    public void sortCopy(Blackhole blackhole) {
        Table copy = peaks.copy();
        blackhole.consume(copy.sortBy("sample", "mz"));
    }

    @Benchmark
    public void splitBySample(Blackhole blackhole) {
        blackhole.consume(peaks.splitBy("sample"));
    }

    @Benchmark
    public void uniqueId(Blackhole blackhole) {
        peaks.resetInternals();
        blackhole.consume(peaks.uniqueId());
    }
}
