package org.carball.pivot.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.analyzer.Analyzer;
import org.carball.pivot.analyzer.SourceParseException;
import org.carball.pivot.benchmark.BaselineStore;
import org.carball.pivot.benchmark.BenchmarkEngine;
import org.carball.pivot.cache.BuildCache;
import org.carball.pivot.config.OptimizationProfile;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.analysis.AnalysisBlueprint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.benchmark.BenchmarkSample;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.synthesis.SynthesisManifest;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.output.ArtifactStore;
import org.carball.pivot.registry.ComponentRegistry;
import org.carball.pivot.synthesizer.Compiler;
import org.carball.pivot.synthesizer.ProcessCompiler;
import org.carball.pivot.synthesizer.TemplateCatalog;
import org.carball.pivot.synthesizer.TemplateSynthesizer;
import org.carball.pivot.validator.ArgumentDomain;
import org.carball.pivot.validator.FunctionRunner;
import org.carball.pivot.validator.ParityValidator;
import org.carball.pivot.validator.ProcessFunctionRunner;
import org.carball.pivot.validator.TestInputGenerator;
import org.carball.pivot.validator.Validator;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The four pipeline stages. Each stage can be called on its own with in-memory records, or
 * through the file variants that read and write the JSON artifacts between stages.
 *
 * <p>The pipeline opens the build cache on first use and keeps it open until
 * {@link #close()}, so concurrent {@code synthesize} calls share one cache and its per-hash
 * locks.
 */
@Slf4j
public class EvolutionPipeline implements Closeable {

    private final PipelineSettings settings;
    private final ComponentRegistry registry;
    private final Map<TargetLanguage, Compiler> compilers;
    private final TemplateCatalog catalog;
    private final ArtifactStore artifacts;

    private BuildCache cache;

    public EvolutionPipeline(PipelineSettings settings,
                             ComponentRegistry registry,
                             Map<TargetLanguage, Compiler> compilers,
                             TemplateCatalog catalog,
                             ArtifactStore artifacts) {
        this.settings = settings;
        this.registry = registry;
        this.compilers = compilers;
        this.catalog = catalog;
        this.artifacts = artifacts;
    }

    /**
     * Wires the default components and the installed compilers.
     */
    public static EvolutionPipeline create(PipelineSettings settings) {
        return new EvolutionPipeline(
                settings,
                ComponentRegistry.defaults(settings),
                ProcessCompiler.defaults(Duration.ofSeconds(settings.getCompileTimeoutSeconds())),
                TemplateCatalog.defaults(),
                new ArtifactStore());
    }

    public PipelineSettings settings() {
        return settings;
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public AnalysisBlueprint analyze(String source, SourceLanguage language, String sourceFile)
            throws SourceParseException {
        Analyzer analyzer = registry.analyzer(language);
        List<FunctionSpec> functions = analyzer.analyze(source);
        log.info("Analyzed {}: {} function(s), {} worth compiling", sourceFile, functions.size(),
                functions.stream().filter(f -> f.recommendedTarget().isCompiled()).count());
        return AnalysisBlueprint.of(language, sourceFile, functions);
    }

    /**
     * Analyzes a source file, detecting its language from the extension when none is given.
     */
    public AnalysisBlueprint analyze(Path sourceFile, SourceLanguage language) throws IOException, PivotException {
        if (!Files.isRegularFile(sourceFile)) {
            throw new IOException("Source file not found: " + sourceFile);
        }
        SourceLanguage resolved = language != null ? language : SourceLanguage.detect(sourceFile.toString())
                .orElseThrow(() -> new IllegalArgumentException("Cannot detect the language of " + sourceFile
                        + "; pass --language python|javascript|ruby"));

        String source = Files.readString(sourceFile, StandardCharsets.UTF_8);
        return analyze(source, resolved, sourceFile.toString());
    }

    public AnalysisBlueprint analyze(Path sourceFile, SourceLanguage language, Path blueprintOut)
            throws IOException, PivotException {
        AnalysisBlueprint blueprint = analyze(sourceFile, language);
        artifacts.writeBlueprint(blueprintOut, blueprint);
        return blueprint;
    }

    public SynthesisManifest synthesize(AnalysisBlueprint blueprint, OptimizationProfile profile)
            throws IOException, PivotException {
        TemplateSynthesizer synthesizer = new TemplateSynthesizer(
                settings, buildCache(), compilers, catalog, registry::codeGenerator);
        return synthesizer.synthesize(blueprint, profile);
    }

    public SynthesisManifest synthesize(Path blueprintIn, OptimizationProfile profile, Path manifestOut)
            throws IOException, PivotException {
        SynthesisManifest manifest = synthesize(artifacts.readBlueprint(blueprintIn), profile);
        artifacts.writeManifest(manifestOut, manifest);
        return manifest;
    }

    public ParityCertificate validate(FunctionSpec spec, FunctionRunner legacy, FunctionRunner vessel)
            throws IOException {
        return validator().validate(spec, legacy, vessel);
    }

    /**
     * Validates each vessel in the manifest against its interpreter shim. Only functions named
     * in {@code functionNames} are validated when it is not empty; otherwise vessels without a
     * native binary are skipped.
     *
     * @throws IllegalArgumentException if a named vessel has no native binary
     */
    public List<ParityCertificate> validate(AnalysisBlueprint blueprint, SynthesisManifest manifest,
                                            List<String> functionNames) throws IOException {
        List<ParityCertificate> certificates = new ArrayList<>();
        for (VesselRecord vessel : selectVessels(manifest, functionNames)) {
            FunctionSpec spec = findFunction(blueprint, vessel.functionName());
            certificates.add(validate(spec,
                    ProcessFunctionRunner.forLegacy(vessel, settings),
                    ProcessFunctionRunner.forVessel(vessel, settings)));
        }
        return certificates;
    }

    /**
     * Writes one certificate per vessel as {@code <function>.certificate.json} under the
     * output directory.
     */
    public List<ParityCertificate> validate(Path blueprintIn, Path manifestIn, List<String> functionNames,
                                            Path outputDirectory) throws IOException, PivotException {
        List<ParityCertificate> certificates = validate(
                artifacts.readBlueprint(blueprintIn), artifacts.readManifest(manifestIn), functionNames);
        for (ParityCertificate certificate : certificates) {
            artifacts.writeCertificate(
                    outputDirectory.resolve(certificate.functionName() + ".certificate.json"), certificate);
        }
        return certificates;
    }

    /**
     * Benchmarks a runner and, when {@code baselineName} names a stored baseline, compares
     * against it. A {@code saveAs} name stores the new sample as a baseline.
     */
    public BenchmarkSample benchmark(String name, FunctionRunner runner, List<Object> arguments,
                                     String baselineName, String saveAs) throws IOException {
        BaselineStore baselines = new BaselineStore(settings.baselinePath());
        BenchmarkSample baseline = null;
        if (baselineName != null) {
            baseline = baselines.load(baselineName).orElse(null);
            if (baseline == null) {
                log.warn("Baseline '{}' not found in {}, running without comparison",
                        baselineName, settings.baselinePath());
            }
        }

        BenchmarkSample sample = new BenchmarkEngine(settings.getBenchmark())
                .benchmark(name, runner, arguments, baseline);

        if (saveAs != null) {
            baselines.save(saveAs, sample);
        }
        return sample;
    }

    /**
     * Benchmarks one vessel from a manifest. Without explicit arguments the function is called
     * with the single seeded random case that follows the boundary set for its argument domains.
     */
    public BenchmarkSample benchmark(AnalysisBlueprint blueprint, SynthesisManifest manifest, String functionName,
                                     List<Object> arguments, String baselineName, String saveAs)
            throws IOException {
        VesselRecord vessel = manifest.findVessel(functionName)
                .orElseThrow(() -> new IllegalArgumentException("No vessel for function '" + functionName + "'"));
        FunctionSpec spec = findFunction(blueprint, functionName);

        List<Object> callArguments = arguments;
        if (callArguments == null || callArguments.isEmpty()) {
            callArguments = representativeInput(spec);
        } else if (callArguments.size() != spec.arguments().size()) {
            throw new IllegalArgumentException("Function '" + functionName + "' takes "
                    + spec.arguments().size() + " argument(s), got " + callArguments.size());
        }

        return benchmark(functionName, ProcessFunctionRunner.forVessel(vessel, settings), callArguments,
                baselineName, saveAs);
    }

    public BenchmarkSample benchmark(Path blueprintIn, Path manifestIn, String functionName, List<Object> arguments,
                                     String baselineName, String saveAs, Path reportOut)
            throws IOException, PivotException {
        BenchmarkSample sample = benchmark(artifacts.readBlueprint(blueprintIn), artifacts.readManifest(manifestIn),
                functionName, arguments, baselineName, saveAs);
        artifacts.writeBenchmark(reportOut, sample);
        return sample;
    }

    @Override
    public synchronized void close() throws IOException {
        if (cache != null) {
            cache.close();
            cache = null;
        }
    }

    private synchronized BuildCache buildCache() throws IOException {
        if (cache == null) {
            cache = new BuildCache(settings.cachePath()).open();
        }
        return cache;
    }

    private Validator validator() {
        return registry.validator(ParityValidator.NAME);
    }

    private List<Object> representativeInput(FunctionSpec spec) {
        List<ArgumentDomain> domains = spec.arguments().stream()
                .map(argument -> ArgumentDomain.of(argument, settings.getValidation()))
                .toList();
        List<List<Object>> generated = new TestInputGenerator(1, settings.getValidation().getSeed())
                .generate(domains, List.of());
        return generated.get(generated.size() - 1);
    }

    private static List<VesselRecord> selectVessels(SynthesisManifest manifest, List<String> functionNames) {
        if (functionNames == null || functionNames.isEmpty()) {
            List<VesselRecord> built = new ArrayList<>();
            for (VesselRecord vessel : manifest.vessels()) {
                if (vessel.status().hasBinary()) {
                    built.add(vessel);
                } else {
                    log.info("Skipping {}: vessel status is {}", vessel.functionName(), vessel.status().getLabel());
                }
            }
            return built;
        }
        List<VesselRecord> selected = new ArrayList<>();
        for (String name : functionNames) {
            VesselRecord vessel = manifest.findVessel(name)
                    .orElseThrow(() -> new IllegalArgumentException("No vessel for function '" + name + "'"));
            if (!vessel.status().hasBinary()) {
                throw new IllegalArgumentException("Vessel for '" + name + "' has no native binary (status "
                        + vessel.status().getLabel() + ")");
            }
            selected.add(vessel);
        }
        return selected;
    }

    private static FunctionSpec findFunction(AnalysisBlueprint blueprint, String name) {
        return blueprint.functions().stream()
                .filter(function -> function.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Function '" + name + "' is not in the blueprint"));
    }
}
