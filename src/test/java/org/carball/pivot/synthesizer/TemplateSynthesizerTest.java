package org.carball.pivot.synthesizer;

import org.carball.pivot.cache.BuildCache;
import org.carball.pivot.config.OptimizationProfile;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.config.ProfilePreset;
import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.synthesis.SynthesisManifest;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.model.synthesis.VesselStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TemplateSynthesizerTest {

    @TempDir
    Path tempDir;

    private PipelineSettings settings;
    private FakeCompiler compiler;

    @BeforeEach
    void setUp() {
        settings = new PipelineSettings();
        settings.setWorkDirectory(tempDir.resolve("vessels").toString());
        settings.setTargetTriple("x86_64-linux");
        settings.setConcurrency(4);
        compiler = new FakeCompiler(TargetLanguage.COMPILED_NATIVE);
    }

    @Test
    void shouldCompileEachFunctionAndKeepInputOrder() throws Exception {
        // Given
        List<FunctionSpec> functions = List.of(
                spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b"),
                spec("mul", TargetLanguage.COMPILED_NATIVE, "def mul(a, b):\n    return a * b"));

        // When
        SynthesisManifest manifest;
        try (BuildCache cache = openCache()) {
            manifest = synthesizer(cache).synthesize(SourceLanguage.PYTHON, functions, balanced());
        }

        // Then
        assertThat(manifest.status()).isEqualTo(SynthesisManifest.STATUS_OK);
        assertThat(manifest.profileId()).isEqualTo("balanced");
        assertThat(manifest.toolchainVersion()).isEqualTo("auto");
        assertThat(manifest.targetTriple()).isEqualTo("x86_64-linux");
        assertThat(manifest.vessels()).extracting(VesselRecord::functionName).containsExactly("add", "mul");
        assertThat(manifest.vessels()).extracting(VesselRecord::status)
                .containsOnly(VesselStatus.COMPILED);
        assertThat(manifest.cacheMisses()).isEqualTo(2);
        assertThat(manifest.cacheHits()).isZero();
        assertThat(compiler.compiles.get()).isEqualTo(2);

        VesselRecord add = manifest.vessels().get(0);
        assertThat(add.contentHash()).hasSize(64);
        assertThat(Path.of(add.binaryPath())).exists();
        assertThat(Path.of(add.shimPath())).exists();
        assertThat(Files.readString(Path.of(add.sourcePath())))
                .contains("long long add(long long arg0, long long arg1)")
                .contains("-std=c++17 -O2")
                .doesNotContain("${");
        assertThat(Files.readString(Path.of(add.shimPath())))
                .contains("def add(a, b):")
                .contains("_CONVERTERS = [int, int]");
    }

    @Test
    void shouldReuseCachedBinariesOnSecondRun() throws Exception {
        // Given
        List<FunctionSpec> functions = List.of(
                spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b"),
                spec("mul", TargetLanguage.COMPILED_NATIVE, "def mul(a, b):\n    return a * b"));
        try (BuildCache cache = openCache()) {
            synthesizer(cache).synthesize(SourceLanguage.PYTHON, functions, balanced());
        }

        // When
        SynthesisManifest second;
        try (BuildCache cache = openCache()) {
            second = synthesizer(cache).synthesize(SourceLanguage.PYTHON, functions, balanced());
        }

        // Then
        assertThat(second.vessels()).extracting(VesselRecord::status).containsOnly(VesselStatus.CACHED);
        assertThat(second.cacheHits()).isEqualTo(2);
        assertThat(second.cacheMisses()).isZero();
        assertThat(compiler.compiles.get()).isEqualTo(2);
    }

    @Test
    void shouldCompileDuplicateFunctionsOnceUnderConcurrency() throws Exception {
        // Given
        compiler.delayMs = 50;
        FunctionSpec spec = spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b");
        List<FunctionSpec> functions = List.of(spec, spec, spec, spec);

        // When
        SynthesisManifest manifest;
        try (BuildCache cache = openCache()) {
            manifest = synthesizer(cache).synthesize(SourceLanguage.PYTHON, functions, balanced());
        }

        // Then
        assertThat(compiler.compiles.get()).isEqualTo(1);
        assertThat(manifest.countByStatus(VesselStatus.COMPILED)).isEqualTo(1);
        assertThat(manifest.countByStatus(VesselStatus.CACHED)).isEqualTo(3);
        assertThat(manifest.vessels()).extracting(VesselRecord::contentHash).containsOnly(
                manifest.vessels().get(0).contentHash());
    }

    @Test
    void shouldChangeHashWhenProfileChanges() throws Exception {
        FunctionSpec spec = spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b");

        try (BuildCache cache = openCache()) {
            TemplateSynthesizer synthesizer = synthesizer(cache);
            String balancedHash = synthesizer.synthesize(SourceLanguage.PYTHON, List.of(spec), balanced())
                    .vessels().get(0).contentHash();
            String speedHash = synthesizer.synthesize(SourceLanguage.PYTHON, List.of(spec),
                    ProfilePreset.SPEED.buildProfile()).vessels().get(0).contentHash();

            assertThat(speedHash).isNotEqualTo(balancedHash);
            assertThat(compiler.compiles.get()).isEqualTo(2);
        }
    }

    @Test
    void shouldKeepInterpretedFunctionsOnTheInterpreter() throws Exception {
        // Given
        FunctionSpec spec = spec("greet", TargetLanguage.INTERPRETED, "def greet(a, b):\n    print(a, b)")
                .toBuilder().justification("I/O-bound").build();

        // When
        SynthesisManifest manifest;
        try (BuildCache cache = openCache()) {
            manifest = synthesizer(cache).synthesize(SourceLanguage.PYTHON, List.of(spec), balanced());
        }

        // Then
        VesselRecord vessel = manifest.vessels().get(0);
        assertThat(vessel.status()).isEqualTo(VesselStatus.INTERPRETED_FALLBACK);
        assertThat(vessel.binaryPath()).isNull();
        assertThat(vessel.shimPath()).isNotNull();
        assertThat(vessel.diagnostics()).isEqualTo("I/O-bound");
        assertThat(manifest.status()).isEqualTo(SynthesisManifest.STATUS_OK);
        assertThat(compiler.compiles.get()).isZero();
    }

    @Test
    void shouldFallBackWhenCompileFails() throws Exception {
        // Given
        compiler.failWith = "error: expected ';'";
        FunctionSpec spec = spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b");

        // When
        SynthesisManifest manifest;
        try (BuildCache cache = openCache()) {
            manifest = synthesizer(cache).synthesize(SourceLanguage.PYTHON, List.of(spec), balanced());
            assertThat(cache.size()).isZero();
        }

        // Then
        VesselRecord vessel = manifest.vessels().get(0);
        assertThat(vessel.status()).isEqualTo(VesselStatus.INTERPRETED_FALLBACK);
        assertThat(vessel.diagnostics()).contains("expected ';'");
        assertThat(manifest.status()).isEqualTo(SynthesisManifest.STATUS_OK);
    }

    @Test
    void shouldReportPartialManifestWhenFallbackIsDisabled() throws Exception {
        // Given
        compiler.failWith = "error: expected ';'";
        OptimizationProfile safe = ProfilePreset.SAFE.buildProfile();
        List<FunctionSpec> functions = List.of(
                spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b"),
                spec("greet", TargetLanguage.INTERPRETED, "def greet(a, b):\n    print(a)"));

        // When
        SynthesisManifest manifest;
        try (BuildCache cache = openCache()) {
            manifest = synthesizer(cache).synthesize(SourceLanguage.PYTHON, functions, safe);
        }

        // Then
        assertThat(manifest.status()).isEqualTo(SynthesisManifest.STATUS_PARTIAL);
        assertThat(manifest.vessels()).extracting(VesselRecord::status)
                .containsExactly(VesselStatus.ERROR, VesselStatus.INTERPRETED_FALLBACK);
        assertThat(manifest.vessels().get(0).diagnostics()).contains("expected ';'");
    }

    @Test
    void shouldFailFastWhenNoToolchainAndFallbackDisabled() throws Exception {
        FunctionSpec spec = spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b");

        try (BuildCache cache = openCache()) {
            TemplateSynthesizer synthesizer = new TemplateSynthesizer(settings, cache, Map.of(),
                    TemplateCatalog.defaults(), target -> new ShimBridgeCodeGenerator());

            assertThatThrownBy(() -> synthesizer.synthesize(SourceLanguage.PYTHON, List.of(spec),
                    ProfilePreset.SAFE.buildProfile()))
                    .isInstanceOf(ToolchainUnavailableException.class)
                    .hasMessageContaining("compiled-native");
        }
    }

    @Test
    void shouldFallBackWhenCompilerIsMissing() throws Exception {
        FunctionSpec spec = spec("add", TargetLanguage.MEMORY_SAFE_NATIVE, "def add(a, b):\n    return a + b");

        try (BuildCache cache = openCache()) {
            SynthesisManifest manifest = synthesizer(cache)
                    .synthesize(SourceLanguage.PYTHON, List.of(spec), balanced());

            assertThat(manifest.vessels().get(0).status()).isEqualTo(VesselStatus.INTERPRETED_FALLBACK);
            assertThat(manifest.vessels().get(0).diagnostics()).contains("memory-safe-native");
        }
    }

    @Test
    void shouldReportConfiguredToolchainVersion() throws Exception {
        settings.setToolchainVersion("g++ 13.2");
        FunctionSpec spec = spec("add", TargetLanguage.COMPILED_NATIVE, "def add(a, b):\n    return a + b");

        try (BuildCache cache = openCache()) {
            SynthesisManifest manifest = synthesizer(cache)
                    .synthesize(SourceLanguage.PYTHON, List.of(spec), balanced());

            assertThat(manifest.toolchainVersion()).isEqualTo("g++ 13.2");
            assertThat(cache.entries().get(0).toolchainVersion()).isEqualTo("g++ 13.2");
        }
    }

    private BuildCache openCache() throws Exception {
        return new BuildCache(tempDir.resolve("cache")).open();
    }

    private TemplateSynthesizer synthesizer(BuildCache cache) {
        Map<TargetLanguage, Compiler> compilers = new EnumMap<>(TargetLanguage.class);
        compilers.put(TargetLanguage.COMPILED_NATIVE, compiler);
        return new TemplateSynthesizer(settings, cache, compilers, TemplateCatalog.defaults(),
                target -> new ShimBridgeCodeGenerator());
    }

    private static OptimizationProfile balanced() {
        return ProfilePreset.BALANCED.buildProfile();
    }

    private static FunctionSpec spec(String name, TargetLanguage target, String source) {
        return FunctionSpec.builder()
                .name(name)
                .startLine(1)
                .lineCount(source.split("\n").length)
                .complexity(1)
                .arguments(List.of(new ArgumentHint("a", "int"), new ArgumentHint("b", "int")))
                .returnHint("int")
                .recommendedTarget(target)
                .justification("test")
                .source(source)
                .build();
    }

    static final class FakeCompiler implements Compiler {

        private final TargetLanguage target;
        final AtomicInteger compiles = new AtomicInteger();
        volatile String failWith;
        volatile long delayMs;

        FakeCompiler(TargetLanguage target) {
            this.target = target;
        }

        @Override
        public TargetLanguage target() {
            return target;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public String version() {
            return "fake 1.0";
        }

        @Override
        public CompilationResult compile(Path sourceFile, Path outputBinary, List<String> flags)
                throws CompilationException {
            compiles.incrementAndGet();
            try {
                if (delayMs > 0) {
                    Thread.sleep(delayMs);
                }
                if (failWith != null) {
                    throw new CompilationException("fake exited with code 1", failWith);
                }
                Files.writeString(outputBinary, "binary for " + sourceFile.getFileName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompilationException("interrupted", e);
            } catch (java.io.IOException e) {
                throw new CompilationException("write failed", e);
            }
            return new CompilationResult(outputBinary, 7, "");
        }
    }
}
