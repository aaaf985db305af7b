package org.carball.pivot.model.synthesis;

import lombok.Builder;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;

/**
 * One generated artifact. A {@link VesselStatus#CACHED} record always carries a hash
 * that is present in the build cache it was produced against.
 */
@Builder(toBuilder = true)
public record VesselRecord(
        String functionName,
        SourceLanguage sourceLanguage,
        TargetLanguage targetLanguage,
        String sourcePath,
        String binaryPath,
        String shimPath,
        VesselStatus status,
        String contentHash,
        long compileDurationMs,
        long binarySizeBytes,
        String diagnostics
) {
}
