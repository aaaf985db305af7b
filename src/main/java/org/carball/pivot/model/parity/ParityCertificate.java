package org.carball.pivot.model.parity;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one validation run. {@code certified == false} is an ordinary result, not an error.
 */
@Builder
public record ParityCertificate(
        String functionName,
        boolean certified,
        double confidence,
        int testCount,
        int passed,
        int failed,
        int timedOut,
        long seed,
        double tolerance,
        double confidenceThreshold,
        PerformanceComparison performance,
        ErrorStatistics statistics,
        List<TestFailure> failures,
        Instant createdAt
) {

    public ParityCertificate {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public double passRate() {
        return testCount == 0 ? 0.0 : (double) passed / testCount;
    }
}
