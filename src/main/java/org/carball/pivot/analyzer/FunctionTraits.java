package org.carball.pivot.analyzer;

public record FunctionTraits(
        int complexity,
        boolean hasLoops,
        boolean hasRecursion,
        boolean hasIo,
        int mathOperations,
        boolean mathHeavy,
        boolean cryptographic
) {
}
