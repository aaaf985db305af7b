package org.carball.pivot.config;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

@Getter
public enum ProfilePreset {

    BALANCED("balanced", "Balanced optimization and build time",
            2, false, false, false, true),

    SPEED("speed", "Aggressive optimization tuned for the host CPU",
            3, true, false, false, true),

    ULTRA("ultra", "Maximum speed - native SIMD, LTO and bounds-check elimination",
            3, true, true, true, true),

    SIZE("size", "Smallest binaries, moderate speed",
            1, false, true, false, true) {
        @Override
        public OptimizationProfile buildProfile() {
            OptimizationProfile base = super.buildProfile();
            Map<String, String> flags = new HashMap<>(base.getCompilerFlags());
            flags.put("compiled-native", "-Os");
            flags.put("memory-safe-native", "-C strip=symbols");
            flags.put("compiled-concurrent", "\"-ldflags=-s -w\"");
            return base.toBuilder()
                    .compilerFlags(flags)
                    .build();
        }
    },

    SAFE("safe", "Conservative - no unsafe optimizations and no interpreter fallback",
            2, false, false, false, false),

    DEBUG("debug", "No optimization, debug symbols for troubleshooting parity failures",
            0, false, false, false, true) {
        @Override
        public OptimizationProfile buildProfile() {
            OptimizationProfile base = super.buildProfile();
            Map<String, String> flags = new HashMap<>(base.getCompilerFlags());
            flags.put("compiled-native", "-g");
            flags.put("memory-safe-native", "-g");
            return base.toBuilder()
                    .compilerFlags(flags)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final int optLevel;
    private final boolean simd;
    private final boolean lto;
    private final boolean unsafe;
    private final boolean allowFallback;

    ProfilePreset(String name, String description, int optLevel,
                  boolean simd, boolean lto, boolean unsafe, boolean allowFallback) {
        this.name = name;
        this.description = description;
        this.optLevel = optLevel;
        this.simd = simd;
        this.lto = lto;
        this.unsafe = unsafe;
        this.allowFallback = allowFallback;
    }

    /**
     * Creates an OptimizationProfile from this preset.
     */
    public OptimizationProfile buildProfile() {
        return OptimizationProfile.builder()
                .id(name)
                .description(description)
                .optLevel(optLevel)
                .simd(simd)
                .lto(lto)
                .unsafe(unsafe)
                .allowFallback(allowFallback)
                .compilerFlags(new HashMap<>())
                .build();
    }

    public static ProfilePreset fromName(String name) {
        for (ProfilePreset preset : values()) {
            if (preset.name.equalsIgnoreCase(name)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown optimization profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ProfilePreset preset : values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(preset.name);
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Optimization Profiles:\n\n");
        for (ProfilePreset preset : values()) {
            help.append(String.format("  %-10s %s%n", preset.name, preset.description));
        }
        help.append("\nUsage: --profile <name>\n");
        return help.toString();
    }
}
