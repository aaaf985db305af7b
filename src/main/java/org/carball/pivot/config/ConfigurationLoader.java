package org.carball.pivot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String FLAGS_PREFIX = "--profile.flags.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads pipeline settings using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public PipelineSettings loadSettings(Path settingsFile, String[] args) throws IOException {
        PipelineSettings settings = readSettingsFile(settingsFile);

        applySettingsEnvironment(settings);
        applySettingsArguments(settings, args);

        settings.validate();
        log.info("Settings loaded: {}", settings.getDescription());
        return settings;
    }

    /**
     * Loads an optimization profile preset.
     */
    public OptimizationProfile loadProfile(String profileName) {
        try {
            ProfilePreset preset = ProfilePreset.fromName(profileName);
            OptimizationProfile profile = preset.buildProfile();
            log.info("Loaded profile '{}': {}", profileName, profile.getConfigurationSummary());
            return profile;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads a preset, then overlays environment variables and CLI arguments.
     */
    public OptimizationProfile loadProfileWithOverrides(String profileName, String[] args) {
        OptimizationProfile base = loadProfile(profileName);
        OptimizationProfile.OptimizationProfileBuilder builder = base.toBuilder()
                .compilerFlags(new HashMap<>(base.getCompilerFlags()));

        applyProfileEnvironment(builder);
        applyProfileArguments(builder, args);

        OptimizationProfile profile = builder.build();
        profile.validate();

        log.info("Profile loaded with overrides: {}", profile.getConfigurationSummary());
        return profile;
    }

    private PipelineSettings readSettingsFile(Path settingsFile) throws IOException {
        if (settingsFile == null) {
            log.debug("No settings file provided, using defaults");
            return PipelineSettings.defaults();
        }

        if (!Files.exists(settingsFile)) {
            log.warn("Settings file not found: {}, using defaults", settingsFile);
            return PipelineSettings.defaults();
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        PipelineSettings settings = mapper.readValue(settingsFile.toFile(), PipelineSettings.class);
        log.info("Loaded settings from: {}", settingsFile);
        return settings;
    }

    private void applySettingsEnvironment(PipelineSettings settings) {
        if (environment.containsKey("PIVOT_TOOLCHAIN_VERSION")) {
            settings.setToolchainVersion(environment.get("PIVOT_TOOLCHAIN_VERSION"));
        }
        if (environment.containsKey("PIVOT_TARGET_TRIPLE")) {
            settings.setTargetTriple(environment.get("PIVOT_TARGET_TRIPLE"));
        }
        if (environment.containsKey("PIVOT_CACHE_DIR")) {
            settings.setCacheDirectory(environment.get("PIVOT_CACHE_DIR"));
        }
        try {
            if (environment.containsKey("PIVOT_CONCURRENCY")) {
                settings.setConcurrency(Integer.parseInt(environment.get("PIVOT_CONCURRENCY")));
            }
            if (environment.containsKey("PIVOT_TEST_CASES")) {
                settings.getValidation().setTestCaseCount(Integer.parseInt(environment.get("PIVOT_TEST_CASES")));
            }
            if (environment.containsKey("PIVOT_TOLERANCE")) {
                settings.getValidation().setTolerance(Double.parseDouble(environment.get("PIVOT_TOLERANCE")));
            }
            if (environment.containsKey("PIVOT_SEED")) {
                settings.getValidation().setSeed(Long.parseLong(environment.get("PIVOT_SEED")));
            }
            if (environment.containsKey("PIVOT_REGRESSION_THRESHOLD")) {
                settings.getBenchmark().setRegressionThresholdPercent(
                        Double.parseDouble(environment.get("PIVOT_REGRESSION_THRESHOLD")));
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric environment value: {}", e.getMessage());
        }
    }

    private void applySettingsArguments(PipelineSettings settings, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--settings.toolchain-version":
                        settings.setToolchainVersion(value);
                        break;
                    case "--settings.target-triple":
                        settings.setTargetTriple(value);
                        break;
                    case "--settings.concurrency":
                        settings.setConcurrency(Integer.parseInt(value));
                        break;
                    case "--settings.cache-dir":
                        settings.setCacheDirectory(value);
                        break;
                    case "--settings.work-dir":
                        settings.setWorkDirectory(value);
                        break;
                    case "--settings.test-cases":
                        settings.getValidation().setTestCaseCount(Integer.parseInt(value));
                        break;
                    case "--settings.tolerance":
                        settings.getValidation().setTolerance(Double.parseDouble(value));
                        break;
                    case "--settings.confidence":
                        settings.getValidation().setConfidenceThreshold(Double.parseDouble(value));
                        break;
                    case "--settings.seed":
                        settings.getValidation().setSeed(Long.parseLong(value));
                        break;
                    case "--settings.iterations":
                        settings.getBenchmark().setIterations(Integer.parseInt(value));
                        break;
                    case "--settings.warmup":
                        settings.getBenchmark().setWarmupIterations(Integer.parseInt(value));
                        break;
                    case "--settings.regression-threshold":
                        settings.getBenchmark().setRegressionThresholdPercent(Double.parseDouble(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private void applyProfileEnvironment(OptimizationProfile.OptimizationProfileBuilder builder) {
        try {
            if (environment.containsKey("PIVOT_OPT_LEVEL")) {
                builder.optLevel(Integer.parseInt(environment.get("PIVOT_OPT_LEVEL")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid PIVOT_OPT_LEVEL: {}", environment.get("PIVOT_OPT_LEVEL"));
        }
        if (environment.containsKey("PIVOT_ALLOW_FALLBACK")) {
            builder.allowFallback(Boolean.parseBoolean(environment.get("PIVOT_ALLOW_FALLBACK")));
        }
    }

    private void applyProfileArguments(OptimizationProfile.OptimizationProfileBuilder builder, String[] args) {
        Map<String, String> flags = new HashMap<>(builder.build().getCompilerFlags());

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            if (arg.startsWith(FLAGS_PREFIX)) {
                flags.put(arg.substring(FLAGS_PREFIX.length()), value);
                continue;
            }

            try {
                switch (arg) {
                    case "--profile.opt-level":
                        builder.optLevel(Integer.parseInt(value));
                        break;
                    case "--profile.simd":
                        builder.simd(Boolean.parseBoolean(value));
                        break;
                    case "--profile.lto":
                        builder.lto(Boolean.parseBoolean(value));
                        break;
                    case "--profile.unsafe":
                        builder.unsafe(Boolean.parseBoolean(value));
                        break;
                    case "--profile.fallback":
                        builder.allowFallback(Boolean.parseBoolean(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }

        builder.compilerFlags(flags);
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            Settings file:
              --settings <file.yml>                 YAML pipeline settings (snake_case keys)

            Settings overrides:
              --settings.toolchain-version <ver>    Toolchain version string used in cache keys
              --settings.target-triple <triple>     Target triple used in cache keys
              --settings.concurrency <num>          Parallel compile jobs (default: CPU count)
              --settings.cache-dir <dir>            Build cache directory
              --settings.work-dir <dir>             Directory for generated vessels
              --settings.test-cases <num>           Random parity test cases
              --settings.tolerance <num>            Relative error tolerance
              --settings.confidence <num>           Confidence threshold (percent)
              --settings.seed <num>                 Seed for test input generation
              --settings.iterations <num>           Benchmark iterations
              --settings.warmup <num>               Benchmark warmup iterations
              --settings.regression-threshold <num> Regression threshold (percent)

            Profile overrides:
              --profile.opt-level <0-3>             Optimization level
              --profile.simd <true|false>           Target the host CPU's vector units
              --profile.lto <true|false>            Link-time optimization
              --profile.unsafe <true|false>         Disable bounds checks where supported
              --profile.fallback <true|false>       Fall back to the interpreter on compile failure
              --profile.flags.<target> "<flags>"    Extra compiler flags for a target id

            Environment Variables:
              PIVOT_TOOLCHAIN_VERSION, PIVOT_TARGET_TRIPLE, PIVOT_CACHE_DIR, PIVOT_CONCURRENCY,
              PIVOT_TEST_CASES, PIVOT_TOLERANCE, PIVOT_SEED, PIVOT_REGRESSION_THRESHOLD,
              PIVOT_OPT_LEVEL, PIVOT_ALLOW_FALLBACK

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file / profile preset
              4. Built-in defaults
            """;
    }
}
