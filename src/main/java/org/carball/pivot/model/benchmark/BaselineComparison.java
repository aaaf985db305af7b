package org.carball.pivot.model.benchmark;

public record BaselineComparison(
        String name,
        double mean,
        double deltaPercent,
        double thresholdPercent,
        boolean regressionDetected
) {
}
