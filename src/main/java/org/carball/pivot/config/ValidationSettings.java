package org.carball.pivot.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class ValidationSettings {

    @JsonProperty("test_case_count")
    private int testCaseCount = 100;

    @JsonProperty("tolerance")
    private double tolerance = 0.001;

    // Percent
    @JsonProperty("confidence_threshold")
    private double confidenceThreshold = 99.9;

    @JsonProperty("seed")
    private long seed = 42L;

    @JsonProperty("call_timeout_ms")
    private long callTimeoutMs = 5_000L;

    // Failure rate the confidence figure is stated against
    @JsonProperty("acceptable_failure_rate")
    private double acceptableFailureRate = 0.10;

    @JsonProperty("int_domain_min")
    private long intDomainMin = -1_000L;

    @JsonProperty("int_domain_max")
    private long intDomainMax = 1_000L;

    @JsonProperty("float_domain_min")
    private double floatDomainMin = -1_000.0;

    @JsonProperty("float_domain_max")
    private double floatDomainMax = 1_000.0;

    public void validate() {
        if (testCaseCount < 0) {
            throw new IllegalArgumentException("test_case_count must not be negative");
        }
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must not be negative");
        }
        if (confidenceThreshold < 0 || confidenceThreshold > 100) {
            throw new IllegalArgumentException("confidence_threshold must be a percentage");
        }
        if (acceptableFailureRate <= 0 || acceptableFailureRate >= 1) {
            throw new IllegalArgumentException("acceptable_failure_rate must be between 0 and 1");
        }
        if (intDomainMin > intDomainMax || floatDomainMin > floatDomainMax) {
            throw new IllegalArgumentException("Argument domain minimum exceeds maximum");
        }
    }
}
