package org.carball.pivot.model.benchmark;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Timings from one benchmark run. Durations keep invocation order; the summary fields
 * are derived from them.
 */
@Builder(toBuilder = true)
public record BenchmarkSample(
        String name,
        int iterations,
        int warmupIterations,
        int discardedIterations,
        List<Double> durationsMs,
        double mean,
        double median,
        double min,
        double max,
        double stddev,
        double p95,
        double p99,
        BaselineComparison baseline,
        Instant createdAt
) {

    public BenchmarkSample {
        durationsMs = durationsMs == null ? List.of() : List.copyOf(durationsMs);
    }

    @JsonIgnore
    public boolean isRegression() {
        return baseline != null && baseline.regressionDetected();
    }
}
