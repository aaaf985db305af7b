package org.carball.pivot.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.config.ConfigurationLoader;
import org.carball.pivot.config.OptimizationProfile;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.config.ProfilePreset;
import org.carball.pivot.model.analysis.AnalysisBlueprint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.benchmark.BenchmarkSample;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.synthesis.SynthesisManifest;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.model.synthesis.VesselStatus;
import org.carball.pivot.pipeline.EvolutionPipeline;
import org.carball.pivot.pipeline.PivotException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class PivotCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              Pivot Evolution Pipeline v%s                  ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_CERTIFIED = 2;

    private static final List<String> COMMANDS = List.of("analyze", "synthesize", "validate", "benchmark", "evolve");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            return args.length < 2 && !isHelpRequested(args) ? EXIT_ERROR : EXIT_OK;
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.isVerbose()) {
                Logger root = (Logger) LoggerFactory.getLogger("org.carball.pivot");
                root.setLevel(Level.DEBUG);
            }

            ConfigurationLoader loader = new ConfigurationLoader();
            PipelineSettings settings = loader.loadSettings(options.getSettingsFile(), args);
            try (EvolutionPipeline pipeline = EvolutionPipeline.create(settings)) {
                return switch (options.getCommand()) {
                    case "analyze" -> analyze(pipeline, options);
                    case "synthesize" -> synthesize(pipeline, options, loader.loadProfileWithOverrides(
                            options.getProfileName(), args));
                    case "validate" -> validate(pipeline, options);
                    case "benchmark" -> benchmark(pipeline, options);
                    default -> evolve(pipeline, options,
                            loader.loadProfileWithOverrides(options.getProfileName(), args));
                };
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (PivotException e) {
            System.err.println("\n❌ Pipeline error: " + e.getMessage());
            log.debug("Pipeline error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_ERROR;
        }
    }

    private static int analyze(EvolutionPipeline pipeline, CliOptions options) throws IOException, PivotException {
        Path source = options.getInputs().get(0);
        Path output = outputOr(options, "blueprint.json");

        System.out.println("\n🔍 Analyzing " + source + "...");
        AnalysisBlueprint blueprint = pipeline.analyze(source, options.getLanguage(), output);

        printBlueprint(blueprint);
        System.out.println("\n✅ Analysis complete!");
        System.out.println("   Output file: " + output);
        return EXIT_OK;
    }

    private static int synthesize(EvolutionPipeline pipeline, CliOptions options, OptimizationProfile profile)
            throws IOException, PivotException {
        Path blueprint = options.getInputs().get(0);
        Path output = outputOr(options, "manifest.json");

        System.out.println("\n🔨 Synthesizing vessels from " + blueprint + "...");
        System.out.println("   " + profile.getConfigurationSummary());
        SynthesisManifest manifest = pipeline.synthesize(blueprint, profile, output);

        printManifest(manifest);
        System.out.println("\n✅ Synthesis complete!");
        System.out.println("   Output file: " + output);
        return SynthesisManifest.STATUS_OK.equals(manifest.status()) ? EXIT_OK : EXIT_ERROR;
    }

    private static int validate(EvolutionPipeline pipeline, CliOptions options) throws IOException, PivotException {
        requireInputs(options, 2, "validate <blueprint.json> <manifest.json>");
        Path outputDirectory = outputOr(options, "certificates");

        System.out.println("\n🧪 Validating parity...");
        List<ParityCertificate> certificates = pipeline.validate(options.getInputs().get(0),
                options.getInputs().get(1), options.getFunctions(), outputDirectory);

        certificates.forEach(PivotCLI::printCertificate);
        if (certificates.isEmpty()) {
            System.out.println("\n💡 No vessel in the manifest has a native binary; nothing to validate.");
        }
        System.out.println("\n✅ Validation complete!");
        System.out.println("   Certificates: " + outputDirectory);
        return certificates.stream().allMatch(ParityCertificate::certified) ? EXIT_OK : EXIT_NOT_CERTIFIED;
    }

    private static int benchmark(EvolutionPipeline pipeline, CliOptions options) throws IOException, PivotException {
        requireInputs(options, 2, "benchmark <blueprint.json> <manifest.json> --function <name>");
        if (options.getFunctions().size() != 1) {
            throw new IllegalArgumentException("benchmark needs exactly one --function");
        }
        String function = options.getFunctions().get(0);
        Path output = outputOr(options, function + ".benchmark.json");

        System.out.println("\n⏱️ Benchmarking " + function + "...");
        BenchmarkSample sample = pipeline.benchmark(options.getInputs().get(0), options.getInputs().get(1),
                function, options.getArguments(), options.getBaselineName(), options.getSaveBaselineName(), output);

        printSample(sample);
        System.out.println("\n✅ Benchmark complete!");
        System.out.println("   Output file: " + output);
        return EXIT_OK;
    }

    /**
     * Runs all four stages, writing every artifact into the output directory. Only vessels
     * with a binary are validated and benchmarked.
     */
    private static int evolve(EvolutionPipeline pipeline, CliOptions options, OptimizationProfile profile)
            throws IOException, PivotException {
        Path source = options.getInputs().get(0);
        Path outputDirectory = outputOr(options, "pivot-out");

        System.out.print("\n📊 Analyzing " + source + "... ");
        AnalysisBlueprint blueprint = pipeline.analyze(source, options.getLanguage(),
                outputDirectory.resolve("blueprint.json"));
        System.out.println("✓");

        System.out.print("🔨 Synthesizing vessels... ");
        SynthesisManifest manifest = pipeline.synthesize(blueprint, profile);
        pipeline.artifacts().writeManifest(outputDirectory.resolve("manifest.json"), manifest);
        System.out.println("✓");

        List<String> built = manifest.vessels().stream()
                .filter(vessel -> vessel.status().hasBinary())
                .map(VesselRecord::functionName)
                .toList();

        boolean allCertified = true;
        if (!built.isEmpty()) {
            System.out.print("🧪 Validating parity... ");
            List<ParityCertificate> certificates = pipeline.validate(blueprint, manifest, built);
            System.out.println("✓");

            for (ParityCertificate certificate : certificates) {
                pipeline.artifacts().writeCertificate(
                        outputDirectory.resolve(certificate.functionName() + ".certificate.json"), certificate);
                allCertified &= certificate.certified();

                if (certificate.certified()) {
                    System.out.print("⏱️ Benchmarking " + certificate.functionName() + "... ");
                    BenchmarkSample sample = pipeline.benchmark(blueprint, manifest, certificate.functionName(),
                            List.of(), options.getBaselineName(), options.getSaveBaselineName());
                    pipeline.artifacts().writeBenchmark(
                            outputDirectory.resolve(certificate.functionName() + ".benchmark.json"), sample);
                    System.out.println("✓");
                }
            }
        }

        printBlueprint(blueprint);
        printManifest(manifest);
        System.out.println("\n✅ Evolution complete!");
        System.out.println("   Output directory: " + outputDirectory);
        if (built.isEmpty()) {
            System.out.println("\n💡 No vessels were compiled; every function stays in its interpreter.");
        }
        return allCertified ? EXIT_OK : EXIT_NOT_CERTIFIED;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar pivot.jar <command> <inputs...> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  analyze <source-file>                       Write an analysis blueprint");
        System.out.println("  synthesize <blueprint.json>                 Build vessels, write a synthesis manifest");
        System.out.println("  validate <blueprint.json> <manifest.json>   Certify vessels against the original code");
        System.out.println("  benchmark <blueprint.json> <manifest.json>  Time one vessel, compare with a baseline");
        System.out.println("  evolve <source-file>                        Run all four stages");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file, or output directory for validate and evolve");
        System.out.println("  --language, -l      Source language: python|javascript|ruby (default: from extension)");
        System.out.println("  --profile, -p       Optimization profile: " + ProfilePreset.getAvailableProfiles()
                + " (default: balanced)");
        System.out.println("  --settings          YAML pipeline settings file");
        System.out.println("  --function          Function to validate or benchmark (repeatable)");
        System.out.println("  --args              Comma-separated benchmark arguments");
        System.out.println("  --baseline          Baseline name to compare against");
        System.out.println("  --save-baseline     Store this run as a named baseline");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar pivot.jar analyze slow_math.py -o blueprint.json");
        System.out.println("  java -jar pivot.jar synthesize blueprint.json --profile speed -o manifest.json");
        System.out.println("  java -jar pivot.jar validate blueprint.json manifest.json --function calculate_pi");
        System.out.println("  java -jar pivot.jar benchmark blueprint.json manifest.json --function calculate_pi \\");
        System.out.println("      --args 100000 --baseline main");
        System.out.println("  java -jar pivot.jar evolve slow_math.py --profile ultra -o pivot-out");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        String command = args[0].toLowerCase();
        if (!COMMANDS.contains(command)) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use one of " + COMMANDS);
        }
        options.setCommand(command);

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];

            // Handled by ConfigurationLoader
            if (arg.startsWith("--settings.") || arg.startsWith("--profile.")) {
                i++;
                continue;
            }

            switch (arg) {
                case "--output":
                case "-o":
                    options.setOutput(Paths.get(valueFor(args, ++i, "Output path")));
                    break;

                case "--language":
                case "-l":
                    options.setLanguage(SourceLanguage.fromId(valueFor(args, ++i, "Language")));
                    break;

                case "--profile":
                case "-p":
                    options.setProfileName(valueFor(args, ++i, "Profile"));
                    break;

                case "--settings":
                    options.setSettingsFile(Paths.get(valueFor(args, ++i, "Settings file")));
                    break;

                case "--function":
                    options.getFunctions().add(valueFor(args, ++i, "Function name"));
                    break;

                case "--args":
                    options.setArguments(parseArguments(valueFor(args, ++i, "Arguments")));
                    break;

                case "--baseline":
                    options.setBaselineName(valueFor(args, ++i, "Baseline name"));
                    break;

                case "--save-baseline":
                    options.setSaveBaselineName(valueFor(args, ++i, "Baseline name"));
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    options.getInputs().add(Paths.get(arg));
                    break;
            }
        }

        if (options.getInputs().isEmpty()) {
            throw new IllegalArgumentException("No input file given for " + command);
        }
        return options;
    }

    private static String valueFor(String[] args, int index, String what) {
        if (index >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index];
    }

    // Arguments are handed to the vessel as strings, so no type conversion is needed here
    private static List<Object> parseArguments(String value) {
        if (value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .map(Object.class::cast)
                .toList();
    }

    private static void requireInputs(CliOptions options, int count, String usage) {
        if (options.getInputs().size() < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }

    private static Path outputOr(CliOptions options, String fallback) {
        return options.getOutput() != null ? options.getOutput() : Paths.get(fallback);
    }

    private static void printBlueprint(AnalysisBlueprint blueprint) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("\nLanguage: " + blueprint.sourceLanguage().getId());
        System.out.println("Functions found: " + blueprint.functions().size());
        System.out.println();

        for (FunctionSpec function : blueprint.functions()) {
            System.out.printf("%-24s → %-20s complexity %d%n",
                    function.name(), function.recommendedTarget().getId(), function.complexity());
            System.out.printf("  └─ %s%n", function.justification());
        }
    }

    private static void printManifest(SynthesisManifest manifest) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("🔨 SYNTHESIS SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("\nProfile: " + manifest.profileId() + " | Toolchain: " + manifest.toolchainVersion()
                + " | Target: " + manifest.targetTriple());
        System.out.println("Cache: " + manifest.cacheHits() + " hit(s), " + manifest.cacheMisses() + " miss(es)");
        System.out.println();

        for (VesselRecord vessel : manifest.vessels()) {
            String icon = switch (vessel.status()) {
                case COMPILED -> "🟢";
                case CACHED -> "🔵";
                case INTERPRETED_FALLBACK -> "🟡";
                case ERROR -> "🔴";
            };
            System.out.printf("  %s %-24s %-20s %s%n", icon, vessel.functionName(),
                    vessel.targetLanguage().getId(), vessel.status().getLabel());
            if (vessel.status() == VesselStatus.ERROR && vessel.diagnostics() != null) {
                System.out.printf("     └─ %s%n", vessel.diagnostics().lines().findFirst().orElse(""));
            }
        }
    }

    private static void printCertificate(ParityCertificate certificate) {
        System.out.printf("%n%s %s: %d/%d passed, confidence %.4f%%, speedup %.2fx%n",
                certificate.certified() ? "✅" : "❌",
                certificate.functionName(),
                certificate.passed(),
                certificate.testCount(),
                certificate.confidence(),
                certificate.performance().speedup());
        if (certificate.timedOut() > 0) {
            System.out.printf("  └─ %d call(s) timed out%n", certificate.timedOut());
        }
        certificate.failures().stream().limit(3).forEach(failure ->
                System.out.printf("  └─ %s: %s%n", failure.input(), failure.reason()));
    }

    private static void printSample(BenchmarkSample sample) {
        System.out.printf("%n%s: mean %.3fms | median %.3fms | p95 %.3fms | p99 %.3fms | min %.3fms | max %.3fms%n",
                sample.name(), sample.mean(), sample.median(), sample.p95(), sample.p99(), sample.min(), sample.max());
        if (sample.discardedIterations() > 0) {
            System.out.printf("  └─ %d iteration(s) timed out and were discarded%n", sample.discardedIterations());
        }
        if (sample.baseline() != null) {
            System.out.printf("  └─ %+.2f%% vs baseline '%s' (threshold %.1f%%)%s%n",
                    sample.baseline().deltaPercent(),
                    sample.baseline().name(),
                    sample.baseline().thresholdPercent(),
                    sample.baseline().regressionDetected() ? " ⚠️ regression" : "");
        }
    }
}
