package org.carball.pivot.model.parity;

public record PerformanceComparison(double legacyMs, double vesselMs, double speedup) {

    /**
     * Speedup is total legacy time over total vessel time, 0 when the vessel time is unknown.
     */
    public static PerformanceComparison of(double legacyMs, double vesselMs) {
        double speedup = vesselMs > 0 ? legacyMs / vesselMs : 0.0;
        return new PerformanceComparison(legacyMs, vesselMs, speedup);
    }
}
