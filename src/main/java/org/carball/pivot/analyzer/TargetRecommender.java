package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.TargetLanguage;

/**
 * Chooses a target from function traits. Rules are tried in declaration order and the
 * first match wins, so the same traits always produce the same target.
 */
public class TargetRecommender {

    public record Recommendation(TargetLanguage target, String justification) {
    }

    private final int loopComplexityThreshold;

    public TargetRecommender(int loopComplexityThreshold) {
        this.loopComplexityThreshold = loopComplexityThreshold;
    }

    public Recommendation recommend(FunctionTraits traits) {
        // Rule 1: CPU-bound loops
        if (traits.hasLoops() && !traits.hasIo() && traits.complexity() >= loopComplexityThreshold) {
            return new Recommendation(TargetLanguage.COMPILED_CONCURRENT, String.format(
                    "Loop-heavy and I/O-free with complexity %d (>= %d): compile for concurrent loop execution",
                    traits.complexity(), loopComplexityThreshold));
        }

        // Rule 2: arithmetic without I/O
        if (traits.mathHeavy() && !traits.hasIo()) {
            return new Recommendation(TargetLanguage.COMPILED_NATIVE, String.format(
                    "Math-heavy (%d arithmetic operations) and I/O-free: compile to native code",
                    traits.mathOperations()));
        }

        // Rule 3: cryptography
        if (traits.cryptographic()) {
            return new Recommendation(TargetLanguage.MEMORY_SAFE_NATIVE,
                    "Cryptographic operations detected: compile to a memory-safe native target");
        }

        String reason = traits.hasIo()
                ? "Performs I/O, compilation would not remove the bottleneck"
                : String.format("Complexity %d without loops, math or crypto hot paths", traits.complexity());
        return new Recommendation(TargetLanguage.INTERPRETED, "No optimization rule matched: " + reason);
    }
}
