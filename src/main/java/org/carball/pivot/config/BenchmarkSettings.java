package org.carball.pivot.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class BenchmarkSettings {

    @JsonProperty("iterations")
    private int iterations = 100;

    @JsonProperty("warmup_iterations")
    private int warmupIterations = 10;

    @JsonProperty("regression_threshold_percent")
    private double regressionThresholdPercent = 10.0;

    @JsonProperty("call_timeout_ms")
    private long callTimeoutMs = 30_000L;

    public void validate() {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (warmupIterations < 0) {
            throw new IllegalArgumentException("warmup_iterations must not be negative");
        }
        if (regressionThresholdPercent < 0) {
            throw new IllegalArgumentException("regression_threshold_percent must not be negative");
        }
    }
}
