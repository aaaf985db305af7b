package org.carball.pivot.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.TargetLanguage;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@Slf4j
public class OptimizationProfile {

    @Builder.Default
    private String id = "balanced";

    @Builder.Default
    private String description = "Balanced optimization and build time";

    // 0 (none) to 3 (aggressive)
    @Builder.Default
    private int optLevel = 2;

    @Builder.Default
    private boolean simd = false;

    @Builder.Default
    private boolean lto = false;

    @Builder.Default
    private boolean unsafe = false;

    @Builder.Default
    private boolean allowFallback = true;

    // Extra flags keyed by target identifier
    @Builder.Default
    private Map<String, String> compilerFlags = new HashMap<>();

    /**
     * Creates the profile used when no preset is requested.
     */
    public static OptimizationProfile defaults() {
        return OptimizationProfile.builder().build();
    }

    /**
     * Returns the extra compiler flags configured for a target, or an empty string.
     */
    public String extraFlagsFor(TargetLanguage target) {
        return compilerFlags.getOrDefault(target.getId(), "");
    }

    /**
     * Validates the profile and logs warnings for questionable combinations.
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Optimization profile id must not be blank");
        }

        if (optLevel < 0 || optLevel > 3) {
            throw new IllegalArgumentException("Optimization level must be between 0 and 3, was " + optLevel);
        }

        if (unsafe && !allowFallback) {
            log.warn("Profile '{}' enables unsafe optimizations without interpreter fallback; " +
                    "a miscompiled vessel will fail parity instead of falling back", id);
        }

        if (lto && optLevel == 0) {
            log.warn("Profile '{}' enables LTO at optimization level 0, which has little effect", id);
        }

        for (String target : compilerFlags.keySet()) {
            try {
                TargetLanguage.fromId(target);
            } catch (IllegalArgumentException e) {
                log.warn("Profile '{}' defines compiler flags for unknown target '{}'", id, target);
            }
        }

        log.debug("Using profile - id: {}, opt: {}, simd: {}, lto: {}, unsafe: {}, fallback: {}",
                id, optLevel, simd, lto, unsafe, allowFallback);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Opt level: %d | SIMD: %s | LTO: %s | Unsafe: %s | Fallback: %s",
                id, optLevel, simd, lto, unsafe, allowFallback);
    }
}
