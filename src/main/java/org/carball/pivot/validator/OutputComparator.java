package org.carball.pivot.validator;

import java.util.List;
import java.util.Objects;

/**
 * Compares a legacy output with a vessel output. Numbers and lists of numbers are compared by
 * relative error against the tolerance; everything else must be equal.
 */
public class OutputComparator {

    private final double tolerance;

    public OutputComparator(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must not be negative, was " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public record Comparison(boolean matches, double relativeError, String reason) {

        static Comparison exact() {
            return new Comparison(true, 0.0, null);
        }
    }

    public Comparison compare(Object legacy, Object vessel) {
        if (legacy instanceof Number l && vessel instanceof Number v) {
            return withinTolerance(relativeError(l.doubleValue(), v.doubleValue()));
        }

        if (legacy instanceof List<?> l && vessel instanceof List<?> v && isNumeric(l) && isNumeric(v)) {
            if (l.size() != v.size()) {
                return new Comparison(false, 1.0,
                        "Length mismatch: legacy " + l.size() + ", vessel " + v.size());
            }
            double worst = 0.0;
            for (int i = 0; i < l.size(); i++) {
                double error = relativeError(((Number) l.get(i)).doubleValue(), ((Number) v.get(i)).doubleValue());
                worst = Math.max(worst, error);
            }
            return withinTolerance(worst);
        }

        if (Objects.equals(legacy, vessel)) {
            return Comparison.exact();
        }
        return new Comparison(false, 1.0, "Outputs differ");
    }

    /**
     * |l - v| / max(|l|, |v|), 0 when the values are equal.
     */
    public static double relativeError(double legacy, double vessel) {
        if (legacy == vessel) {
            return 0.0;
        }
        if (Double.isNaN(legacy) || Double.isNaN(vessel)) {
            return Double.isNaN(legacy) && Double.isNaN(vessel) ? 0.0 : 1.0;
        }
        double scale = Math.max(Math.abs(legacy), Math.abs(vessel));
        if (Double.isInfinite(scale)) {
            return 1.0;
        }
        return Math.abs(legacy - vessel) / scale;
    }

    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(element -> element instanceof Number);
        }
        return false;
    }

    private Comparison withinTolerance(double error) {
        if (error <= tolerance) {
            return new Comparison(true, error, null);
        }
        return new Comparison(false, error,
                String.format("Relative error %.6g exceeds tolerance %.6g", error, tolerance));
    }
}
