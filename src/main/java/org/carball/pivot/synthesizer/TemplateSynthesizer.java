package org.carball.pivot.synthesizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.cache.BuildCache;
import org.carball.pivot.cache.ContentHasher;
import org.carball.pivot.cache.HashLockTable;
import org.carball.pivot.config.OptimizationProfile;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.analysis.AnalysisBlueprint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.analysis.ValueKind;
import org.carball.pivot.model.synthesis.CacheEntry;
import org.carball.pivot.model.synthesis.SynthesisManifest;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.model.synthesis.VesselStatus;
import org.carball.pivot.pipeline.PivotException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Renders vessels from templates and builds them through the build cache.
 *
 * <p>Every compile is preceded by a cache lookup. Compiles for the same content hash are
 * serialized by the cache's {@link HashLockTable}; the cache is checked again after the
 * lock is acquired, so concurrent requests for one hash compile once and the rest report
 * {@link VesselStatus#CACHED}. This holds across synthesizers sharing one cache.
 *
 * <p>Generated sources and build output go to {@code <vessel dir>/<hash prefix>/}, so builds
 * of one function under different profiles never share files.
 */
@Slf4j
public class TemplateSynthesizer {

    static final String AUTO_TOOLCHAIN = "auto";
    static final int BUILD_DIR_HASH_CHARS = 12;

    private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase().contains("win");

    private final PipelineSettings settings;
    private final BuildCache cache;
    private final Map<TargetLanguage, Compiler> compilers;
    private final TemplateCatalog catalog;
    private final Function<TargetLanguage, CodeGenerator> generators;
    private final AtomicInteger workerCounter = new AtomicInteger();

    public TemplateSynthesizer(PipelineSettings settings,
                               BuildCache cache,
                               Map<TargetLanguage, Compiler> compilers,
                               TemplateCatalog catalog,
                               Function<TargetLanguage, CodeGenerator> generators) {
        this.settings = settings;
        this.cache = cache;
        this.compilers = Map.copyOf(compilers);
        this.catalog = catalog;
        this.generators = generators;
    }

    public SynthesisManifest synthesize(AnalysisBlueprint blueprint, OptimizationProfile profile)
            throws PivotException, IOException {
        return synthesize(blueprint.sourceLanguage(), blueprint.functions(), profile);
    }

    /**
     * Builds one vessel per function. Vessels are returned in input order.
     *
     * @throws ToolchainUnavailableException if fallback is disabled and no compiler exists
     *                                       for any compiled target the batch needs
     */
    public SynthesisManifest synthesize(SourceLanguage language, List<FunctionSpec> functions,
                                        OptimizationProfile profile) throws PivotException, IOException {
        profile.validate();
        checkToolchains(functions, profile);
        Files.createDirectories(settings.workPath());

        log.info("Synthesizing {} function(s) with profile '{}' on {} worker(s)",
                functions.size(), profile.getId(), settings.getConcurrency());

        Batch batch = new Batch();
        ExecutorService executor = Executors.newFixedThreadPool(settings.getConcurrency(), r -> {
            Thread t = new Thread(r, "pivot-synth-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<VesselRecord> vessels = new ArrayList<>();
        try {
            List<Future<VesselRecord>> futures = new ArrayList<>();
            for (FunctionSpec spec : functions) {
                futures.add(executor.submit(() -> buildVessel(language, spec, profile, batch)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    vessels.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    FunctionSpec spec = functions.get(i);
                    log.error("Vessel job for {} failed unexpectedly", spec.name(), e.getCause());
                    vessels.add(baseRecord(language, spec)
                            .status(VesselStatus.ERROR)
                            .diagnostics(String.valueOf(e.getCause()))
                            .build());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PivotException("synthesize", "Interrupted while waiting for vessel builds", e);
        } finally {
            shutdown(executor);
        }

        boolean anyErrors = vessels.stream().anyMatch(v -> v.status() == VesselStatus.ERROR);
        SynthesisManifest manifest = new SynthesisManifest(
                anyErrors ? SynthesisManifest.STATUS_PARTIAL : SynthesisManifest.STATUS_OK,
                profile.getId(),
                settings.getToolchainVersion() != null ? settings.getToolchainVersion() : AUTO_TOOLCHAIN,
                settings.getTargetTriple(),
                vessels,
                batch.hits.get(),
                batch.misses.get());

        log.info("Synthesis finished: {} compiled, {} cached, {} fallback, {} error ({} hits / {} misses)",
                manifest.countByStatus(VesselStatus.COMPILED),
                manifest.countByStatus(VesselStatus.CACHED),
                manifest.countByStatus(VesselStatus.INTERPRETED_FALLBACK),
                manifest.countByStatus(VesselStatus.ERROR),
                manifest.cacheHits(),
                manifest.cacheMisses());
        return manifest;
    }

    private void checkToolchains(List<FunctionSpec> functions, OptimizationProfile profile)
            throws ToolchainUnavailableException {
        if (profile.isAllowFallback()) {
            return;
        }

        Set<TargetLanguage> needed = new LinkedHashSet<>();
        functions.stream()
                .map(FunctionSpec::recommendedTarget)
                .filter(TargetLanguage::isCompiled)
                .forEach(needed::add);

        if (needed.isEmpty()) {
            return;
        }

        boolean anyAvailable = needed.stream().anyMatch(this::hasCompiler);
        if (!anyAvailable) {
            List<String> targets = needed.stream().map(TargetLanguage::getId).toList();
            log.error("No compiler installed for targets {} and profile '{}' disallows fallback",
                    targets, profile.getId());
            throw new ToolchainUnavailableException("No compiler available for targets " + targets);
        }
    }

    private boolean hasCompiler(TargetLanguage target) {
        Compiler compiler = compilers.get(target);
        return compiler != null && compiler.isAvailable();
    }

    private VesselRecord buildVessel(SourceLanguage language, FunctionSpec spec,
                                     OptimizationProfile profile, Batch batch) {
        VesselRecord.VesselRecordBuilder record = baseRecord(language, spec);
        try {
            return buildVessel(language, spec, profile, batch, record);
        } catch (IOException | CompilationException | RuntimeException e) {
            return failed(record, spec, profile, e.getMessage(), null);
        }
    }

    private VesselRecord buildVessel(SourceLanguage language, FunctionSpec spec, OptimizationProfile profile,
                                     Batch batch, VesselRecord.VesselRecordBuilder record)
            throws IOException, CompilationException {
        TargetLanguage target = spec.recommendedTarget();
        String identifier = NativeTypes.identifier(spec.name());
        Path directory = vesselDirectory(spec, identifier);
        Files.createDirectories(directory);

        Path shimPath = writeShim(language, spec, directory, identifier);
        record.shimPath(shimPath.toString());

        if (!target.isCompiled()) {
            log.debug("{} stays interpreted: {}", spec.name(), spec.justification());
            return record.status(VesselStatus.INTERPRETED_FALLBACK)
                    .diagnostics(spec.justification())
                    .build();
        }

        if (!hasCompiler(target)) {
            return failed(record, spec, profile, "No compiler available for target " + target.getId(), null);
        }
        Compiler compiler = compilers.get(target);

        List<String> flags = CompilerFlagBuilder.flagsFor(target, profile);
        String rendered = renderProgram(language, spec, target, flags, shimPath, identifier);
        log.trace("Rendered {} source for {}:\n{}", target.getDialect(), spec.name(), rendered);

        String toolchainVersion = settings.getToolchainVersion() != null
                ? settings.getToolchainVersion()
                : compiler.version();
        String hash = ContentHasher.hash(rendered, profile.getId(), toolchainVersion, settings.getTargetTriple());
        record.contentHash(hash);

        Path buildDirectory = Files.createDirectories(directory.resolve(hash.substring(0, BUILD_DIR_HASH_CHARS)));
        Path sourcePath = buildDirectory.resolve(identifier + target.getSourceExtension());
        writeAtomically(sourcePath, rendered);
        record.sourcePath(sourcePath.toString());

        Optional<CacheEntry> hit = cache.lookup(hash);
        if (hit.isPresent()) {
            return cached(record, spec, hit.get(), batch);
        }
        if (batch.failures.containsKey(hash)) {
            return failed(record, spec, profile, "Compilation failed earlier in this batch", batch.failures.get(hash));
        }

        try (HashLockTable.Handle ignored = cache.lock(hash)) {
            hit = cache.lookup(hash);
            if (hit.isPresent()) {
                return cached(record, spec, hit.get(), batch);
            }
            if (batch.failures.containsKey(hash)) {
                return failed(record, spec, profile, "Compilation failed earlier in this batch",
                        batch.failures.get(hash));
            }

            batch.misses.incrementAndGet();
            Path binary = buildDirectory.resolve(WINDOWS ? identifier + ".exe" : identifier);

            try {
                CompilationResult result = compiler.compile(sourcePath, binary, flags);
                CacheEntry entry = cache.insert(hash, result.binary(), target, profile.getId(),
                        toolchainVersion, settings.getTargetTriple());

                log.debug("Compiled {} to {} in {} ms", spec.name(), target.getId(), result.durationMs());
                return record.status(VesselStatus.COMPILED)
                        .binaryPath(entry.binaryPath())
                        .compileDurationMs(result.durationMs())
                        .binarySizeBytes(entry.sizeBytes())
                        .build();
            } catch (CompilationException e) {
                String diagnostics = e.diagnostics() != null ? e.diagnostics() : e.getMessage();
                batch.failures.put(hash, diagnostics);
                return failed(record, spec, profile, e.getMessage(), diagnostics);
            }
        }
    }

    private String renderProgram(SourceLanguage language, FunctionSpec spec, TargetLanguage target,
                                 List<String> flags, Path shimPath, String identifier) {
        List<String> shimCommand = List.of(settings.interpreterFor(language), shimPath.toAbsolutePath().toString());

        Map<String, String> values = new HashMap<>();
        values.put("function_name", identifier);
        values.put("arguments", NativeTypes.parameters(spec.arguments(), target));
        values.put("return_type", NativeTypes.typeName(ValueKind.forReturn(spec.returnHint()), target));
        values.put("body", generators.apply(target).translateBody(spec, target));
        values.put("argument_parsing", NativeTypes.argumentParsing(spec.arguments(), target));
        values.put("argument_count", String.valueOf(spec.arguments().size()));
        values.put("call_arguments", NativeTypes.callArguments(spec.arguments().size()));
        values.put("compiler_flags", String.join(" ", flags));
        values.put("shim_command", NativeTypes.stringLiterals(shimCommand));

        return TemplateRenderer.render(catalog.programFor(target), values);
    }

    private Path writeShim(SourceLanguage language, FunctionSpec spec, Path directory, String identifier)
            throws IOException {
        Map<String, String> values = new HashMap<>();
        values.put("function_name", spec.name());
        values.put("original_source", spec.source().stripIndent().strip());
        values.put("argument_converters", NativeTypes.shimConverters(spec.arguments(), language));

        String shim = TemplateRenderer.render(catalog.shimFor(language), values);
        Path shimPath = directory.resolve(identifier + "_shim" + language.getShimExtension());
        writeAtomically(shimPath, shim);
        return shimPath;
    }

    private VesselRecord cached(VesselRecord.VesselRecordBuilder record, FunctionSpec spec,
                                CacheEntry entry, Batch batch) {
        batch.hits.incrementAndGet();
        log.debug("Reusing cached binary for {}", spec.name());
        return record.status(VesselStatus.CACHED)
                .binaryPath(entry.binaryPath())
                .binarySizeBytes(entry.sizeBytes())
                .build();
    }

    private VesselRecord failed(VesselRecord.VesselRecordBuilder record, FunctionSpec spec,
                                OptimizationProfile profile, String reason, String diagnostics) {
        String details = diagnostics != null && !diagnostics.isBlank() ? reason + "\n" + diagnostics : reason;
        if (profile.isAllowFallback()) {
            log.warn("Vessel for {} not built ({}), falling back to the interpreter", spec.name(), reason);
            return record.status(VesselStatus.INTERPRETED_FALLBACK)
                    .binaryPath(null)
                    .diagnostics(details)
                    .build();
        }
        log.warn("Vessel for {} failed: {}", spec.name(), reason);
        return record.status(VesselStatus.ERROR)
                .binaryPath(null)
                .diagnostics(details)
                .build();
    }

    private static VesselRecord.VesselRecordBuilder baseRecord(SourceLanguage language, FunctionSpec spec) {
        return VesselRecord.builder()
                .functionName(spec.name())
                .sourceLanguage(language)
                .targetLanguage(spec.recommendedTarget());
    }

    // Same function text shares a directory; different functions with one name do not collide
    private Path vesselDirectory(FunctionSpec spec, String identifier) {
        String digest = ContentHasher.hash(spec.source(), spec.name(), "", "").substring(0, 8);
        return settings.workPath().resolve(identifier + "-" + digest);
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class Batch {
        private final AtomicInteger hits = new AtomicInteger();
        private final AtomicInteger misses = new AtomicInteger();
        // Diagnostics of failed compiles keyed by content hash
        private final Map<String, String> failures = new ConcurrentHashMap<>();
    }
}
