package org.carball.pivot.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings supplied by the orchestrator. Loaded from YAML with snake_case keys, then
 * overlaid with environment variables and command-line options.
 */
@Data
public class PipelineSettings {

    // Null means probe the installed compilers
    @JsonProperty("toolchain_version")
    private String toolchainVersion;

    @JsonProperty("target_triple")
    private String targetTriple = detectTargetTriple();

    @JsonProperty("concurrency")
    private int concurrency = Runtime.getRuntime().availableProcessors();

    @JsonProperty("compile_timeout_seconds")
    private long compileTimeoutSeconds = 120L;

    @JsonProperty("cache_directory")
    private String cacheDirectory = ".pivot/cache";

    @JsonProperty("work_directory")
    private String workDirectory = ".pivot/vessels";

    @JsonProperty("baseline_directory")
    private String baselineDirectory = ".pivot/baselines";

    @JsonProperty("regression_input_directory")
    private String regressionInputDirectory = ".pivot/regressions";

    @JsonProperty("loop_complexity_threshold")
    private int loopComplexityThreshold = 8;

    @JsonProperty("math_operation_threshold")
    private int mathOperationThreshold = 3;

    // Interpreter executable keyed by source language id
    @JsonProperty("interpreters")
    private Map<String, String> interpreters = new HashMap<>();

    @JsonProperty("validation")
    private ValidationSettings validation = new ValidationSettings();

    @JsonProperty("benchmark")
    private BenchmarkSettings benchmark = new BenchmarkSettings();

    public static PipelineSettings defaults() {
        return new PipelineSettings();
    }

    public String interpreterFor(SourceLanguage language) {
        return interpreters.getOrDefault(language.getId(), language.getInterpreter());
    }

    public Path cachePath() {
        return Path.of(cacheDirectory);
    }

    public Path workPath() {
        return Path.of(workDirectory);
    }

    public Path baselinePath() {
        return Path.of(baselineDirectory);
    }

    public Path regressionInputPath() {
        return Path.of(regressionInputDirectory);
    }

    public void validate() {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, was " + concurrency);
        }
        if (compileTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("compile_timeout_seconds must be positive");
        }
        if (loopComplexityThreshold < 1) {
            throw new IllegalArgumentException("loop_complexity_threshold must be at least 1");
        }
        validation.validate();
        benchmark.validate();
    }

    public String getDescription() {
        return String.format(
                "Settings: toolchain=%s, triple=%s, concurrency=%d, cache=%s, tests=%d, tolerance=%s, " +
                "confidence=%.2f, iterations=%d, warmup=%d, regression=%.1f%%",
                toolchainVersion == null ? "probe" : toolchainVersion,
                targetTriple,
                concurrency,
                cacheDirectory,
                validation.getTestCaseCount(),
                validation.getTolerance(),
                validation.getConfidenceThreshold(),
                benchmark.getIterations(),
                benchmark.getWarmupIterations(),
                benchmark.getRegressionThresholdPercent()
        );
    }

    /**
     * Builds a triple such as {@code x86_64-linux} from the running JVM.
     */
    public static String detectTargetTriple() {
        String arch = System.getProperty("os.arch", "unknown");
        if (arch.equals("amd64")) {
            arch = "x86_64";
        }
        String os = System.getProperty("os.name", "unknown").toLowerCase();
        if (os.contains("linux")) {
            os = "linux";
        } else if (os.contains("mac")) {
            os = "darwin";
        } else if (os.contains("win")) {
            os = "windows";
        }
        return arch + "-" + os.replace(' ', '_');
    }
}
