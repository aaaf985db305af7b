package org.carball.pivot.model.parity;

public record ErrorStatistics(
        double meanError,
        double medianError,
        double stddev,
        double maxError,
        double similarityStatistic
) {

    public static ErrorStatistics empty() {
        return new ErrorStatistics(0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
