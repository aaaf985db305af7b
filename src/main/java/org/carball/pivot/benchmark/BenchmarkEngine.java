package org.carball.pivot.benchmark;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.carball.pivot.config.BenchmarkSettings;
import org.carball.pivot.model.benchmark.BaselineComparison;
import org.carball.pivot.model.benchmark.BenchmarkSample;
import org.carball.pivot.validator.FunctionRunner;
import org.carball.pivot.validator.TimedInvoker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Times repeated invocations of a function and summarizes them. Warmup runs and timed-out
 * iterations are left out of the statistics.
 */
@Slf4j
public class BenchmarkEngine {

    private final BenchmarkSettings settings;
    private final LongSupplier nanoClock;
    private final Clock clock;

    public BenchmarkEngine(BenchmarkSettings settings) {
        this(settings, System::nanoTime, Clock.systemUTC());
    }

    public BenchmarkEngine(BenchmarkSettings settings, LongSupplier nanoClock, Clock clock) {
        settings.validate();
        this.settings = settings;
        this.nanoClock = nanoClock;
        this.clock = clock;
    }

    public BenchmarkSample benchmark(String name, FunctionRunner runner, List<Object> arguments,
                                     BenchmarkSample baseline) {
        return benchmark(name, runner, arguments, settings.getIterations(), settings.getWarmupIterations(), baseline);
    }

    /**
     * @param baseline previous sample to compare against, or null
     */
    public BenchmarkSample benchmark(String name, FunctionRunner runner, List<Object> arguments,
                                     int iterations, int warmupIterations, BenchmarkSample baseline) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Iterations must be positive, was " + iterations);
        }
        if (warmupIterations < 0) {
            throw new IllegalArgumentException("Warmup iterations must not be negative, was " + warmupIterations);
        }

        log.info("Benchmarking {}: {} iteration(s) after {} warmup", name, iterations, warmupIterations);
        Duration timeout = Duration.ofMillis(settings.getCallTimeoutMs());
        List<Double> durations = new ArrayList<>(iterations);
        int discarded = 0;

        try (TimedInvoker invoker = new TimedInvoker(nanoClock, "pivot-bench")) {
            for (int i = 0; i < warmupIterations; i++) {
                TimedInvoker.Outcome outcome = invoker.call(runner, arguments, timeout);
                if (!outcome.succeeded()) {
                    log.debug("Warmup iteration {} of {} failed: {}", i + 1, name, outcome.describeFailure());
                }
            }

            for (int i = 0; i < iterations; i++) {
                TimedInvoker.Outcome outcome = invoker.call(runner, arguments, timeout);
                if (outcome.succeeded()) {
                    durations.add(outcome.durationMs());
                } else {
                    discarded++;
                    log.warn("Discarding iteration {} of {}: {}", i + 1, name, outcome.describeFailure());
                }
            }
        }

        BenchmarkSample sample = summarize(name, durations, warmupIterations, discarded, baseline);
        if (sample.isRegression()) {
            log.warn("Performance regression in {}: mean {}ms is {}% above baseline '{}'",
                    name, format(sample.mean()), format(sample.baseline().deltaPercent()), sample.baseline().name());
        } else {
            log.info("{}: mean {}ms, median {}ms, p95 {}ms over {} iteration(s)",
                    name, format(sample.mean()), format(sample.median()), format(sample.p95()), sample.iterations());
        }
        return sample;
    }

    /**
     * Builds a sample from recorded durations. Percentiles use the nearest-rank method.
     */
    public BenchmarkSample summarize(String name, List<Double> durationsMs, int warmupIterations,
                                     int discardedIterations, BenchmarkSample baseline) {
        BenchmarkSample.BenchmarkSampleBuilder builder = BenchmarkSample.builder()
                .name(name)
                .iterations(durationsMs.size())
                .warmupIterations(warmupIterations)
                .discardedIterations(discardedIterations)
                .durationsMs(durationsMs)
                .createdAt(clock.instant());

        if (durationsMs.isEmpty()) {
            log.warn("No successful iterations recorded for {}", name);
            return builder.build();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        durationsMs.forEach(stats::addValue);
        double[] sorted = stats.getSortedValues();

        double mean = stats.getMean();
        builder.mean(mean)
                .median(median(sorted))
                .min(stats.getMin())
                .max(stats.getMax())
                .stddev(stats.getN() > 1 ? stats.getStandardDeviation() : 0.0)
                .p95(nearestRank(sorted, 95))
                .p99(nearestRank(sorted, 99));

        if (baseline != null) {
            builder.baseline(compare(mean, baseline));
        }
        return builder.build();
    }

    public BaselineComparison compare(double mean, BenchmarkSample baseline) {
        double threshold = settings.getRegressionThresholdPercent();
        if (baseline.mean() <= 0) {
            log.warn("Baseline '{}' has no positive mean, skipping regression check", baseline.name());
            return new BaselineComparison(baseline.name(), baseline.mean(), 0.0, threshold, false);
        }
        double delta = (mean - baseline.mean()) / baseline.mean() * 100.0;
        return new BaselineComparison(baseline.name(), baseline.mean(), delta, threshold, delta > threshold);
    }

    static double nearestRank(double[] sorted, double percentile) {
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }

    // Middle value, or the mean of the two middle values, so it never exceeds the nearest-rank p95
    static double median(double[] sorted) {
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
