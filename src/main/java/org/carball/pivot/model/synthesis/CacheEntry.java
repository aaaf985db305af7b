package org.carball.pivot.model.synthesis;

import org.carball.pivot.model.analysis.TargetLanguage;

import java.time.Instant;

/**
 * Immutable build cache entry. A changed input produces a new hash and therefore a new entry.
 */
public record CacheEntry(
        String hash,
        String binaryPath,
        TargetLanguage targetLanguage,
        String profileId,
        String toolchainVersion,
        String targetTriple,
        long sizeBytes,
        Instant createdAt
) {
}
