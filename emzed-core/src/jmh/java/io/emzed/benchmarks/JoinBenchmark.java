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
 * Nested loop join of features against a mass list. The cost grows with the product of both sizes.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class JoinBenchmark {

    @Param({"100", "1000"})
    public int featureCount;

    @Param({"1000"})
    public int massCount;

    private Table features;
    private Table masses;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(7);
        features = Table.toTable("mz", randomMasses(random, featureCount));
        masses = Table.toTable("mz", randomMasses(random, massCount));
    }

    private static List<Double> randomMasses(Random random, int count) {
        List<Double> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(100.0 + random.nextDouble() * 900.0);
        }
        return values;
    }

    @Benchmark
    public void joinWithinTolerance(Blackhole blackhole) {
        blackhole.consume(features.join(masses,
                features.column("mz").approxEqual(masses.column("mz"), 0.01)));
    }

    @Benchmark
    public void leftJoinWithinTolerance(Blackhole blackhole) {
        blackhole.consume(features.leftJoin(masses,
                features.column("mz").approxEqual(masses.column("mz"), 0.01)));
    }

    @Benchmark
    public void crossProduct(Blackhole blackhole) {
        blackhole.consume(features.join(masses.slice(0, 10)));
    }
}
