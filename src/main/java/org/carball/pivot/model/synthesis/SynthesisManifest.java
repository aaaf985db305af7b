package org.carball.pivot.model.synthesis;

import java.util.List;
import java.util.Optional;

public record SynthesisManifest(
        String status,
        String profileId,
        String toolchainVersion,
        String targetTriple,
        List<VesselRecord> vessels,
        int cacheHits,
        int cacheMisses
) {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_PARTIAL = "partial";

    public SynthesisManifest {
        vessels = vessels == null ? List.of() : List.copyOf(vessels);
    }

    public Optional<VesselRecord> findVessel(String functionName) {
        return vessels.stream()
                .filter(v -> v.functionName().equals(functionName))
                .findFirst();
    }

    public long countByStatus(VesselStatus status) {
        return vessels.stream().filter(v -> v.status() == status).count();
    }
}
