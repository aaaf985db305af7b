package org.carball.pivot.validator;

import org.apache.commons.math3.special.Beta;

/**
 * Turns a pass/fail count and a distribution similarity statistic into a confidence percentage.
 *
 * <p>With a uniform prior the posterior failure rate is Beta(1 + failed, 1 + passed). The
 * confidence that the true failure rate is below {@code acceptableFailureRate} is the
 * regularized incomplete beta function at that rate. It is then scaled down by how far the
 * Kolmogorov-Smirnov statistic exceeds its critical value at alpha = 0.001.
 */
public class ConfidenceCalculator {

    // c(alpha) for alpha = 0.001
    static final double KS_COEFFICIENT = 1.95;

    private final double acceptableFailureRate;

    public ConfidenceCalculator(double acceptableFailureRate) {
        if (acceptableFailureRate <= 0 || acceptableFailureRate >= 1) {
            throw new IllegalArgumentException("Acceptable failure rate must be in (0, 1), was " + acceptableFailureRate);
        }
        this.acceptableFailureRate = acceptableFailureRate;
    }

    /**
     * @param n size of the legacy sample used for the KS statistic
     * @param m size of the vessel sample used for the KS statistic
     * @return confidence in percent, in [0, 100]
     */
    public double confidence(int passed, int failed, double ksStatistic, int n, int m) {
        double posterior = Beta.regularizedBeta(acceptableFailureRate, 1.0 + failed, 1.0 + passed);
        double penalty = Math.min(1.0, Math.max(0.0, ksStatistic - ksCritical(n, m)));
        double confidence = 100.0 * posterior * (1.0 - penalty);
        return Math.max(0.0, Math.min(100.0, confidence));
    }

    /**
     * Critical KS distance for two samples. Returns 1 when either sample is empty, so no
     * penalty can apply.
     */
    public static double ksCritical(int n, int m) {
        if (n <= 0 || m <= 0) {
            return 1.0;
        }
        return KS_COEFFICIENT * Math.sqrt((double) (n + m) / ((double) n * m));
    }
}
