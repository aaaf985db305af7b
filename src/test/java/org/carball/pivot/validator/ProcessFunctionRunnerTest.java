package org.carball.pivot.validator;

import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.model.synthesis.VesselStatus;
import org.carball.pivot.process.ProcessExecutor;
import org.carball.pivot.process.ProcessOutput;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProcessFunctionRunnerTest {

    @Test
    void shouldPassArgumentsAndDecodeLastLine() throws Exception {
        // Given
        CannedExecutor executor = new CannedExecutor(new ProcessOutput(0, "warming up\n[1, 2.5]\n\n", "", false, 1));
        ProcessFunctionRunner runner = new ProcessFunctionRunner(List.of("./calc"), Duration.ofSeconds(1), executor);

        // When
        Object result = runner.invoke(List.of(3L, 1.5, "a b"));

        // Then
        assertThat(executor.commands.get(0)).containsExactly("./calc", "3", "1.5", "a b");
        assertThat(result).isEqualTo(List.of(1, 2.5));
    }

    @Test
    void shouldRaiseTimeoutException() {
        CannedExecutor executor = new CannedExecutor(new ProcessOutput(-1, "", "", true, 1));
        ProcessFunctionRunner runner = new ProcessFunctionRunner(List.of("./calc"), Duration.ofMillis(20), executor);

        assertThatThrownBy(() -> runner.invoke(List.of()))
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("20ms");
    }

    @Test
    void shouldIncludeStderrWhenProcessFails() {
        CannedExecutor executor = new CannedExecutor(new ProcessOutput(2, "", "expected 1 arguments\n", false, 1));
        ProcessFunctionRunner runner = new ProcessFunctionRunner(List.of("./calc"), Duration.ofSeconds(1), executor);

        assertThatThrownBy(() -> runner.invoke(List.of()))
                .isInstanceOf(IOException.class)
                .hasMessage("./calc exited with code 2: expected 1 arguments");
    }

    @Test
    void shouldDecodeJsonOrKeepRawText() {
        assertThat(ProcessFunctionRunner.decode("42")).isEqualTo(42);
        assertThat(ProcessFunctionRunner.decode("\"hi\"")).isEqualTo("hi");
        assertThat(ProcessFunctionRunner.decode("{\"a\": true}")).isEqualTo(Map.of("a", true));
        assertThat(ProcessFunctionRunner.decode("not json")).isEqualTo("not json");
        assertThat(ProcessFunctionRunner.decode("")).isNull();
    }

    @Test
    void shouldRunBinaryForCompiledVesselAndShimOtherwise() {
        // Given
        PipelineSettings settings = new PipelineSettings();
        settings.getInterpreters().put("python", "/usr/bin/python3.12");
        VesselRecord compiled = VesselRecord.builder()
                .functionName("calc")
                .sourceLanguage(SourceLanguage.PYTHON)
                .targetLanguage(TargetLanguage.COMPILED_NATIVE)
                .status(VesselStatus.CACHED)
                .binaryPath("/cache/calc")
                .shimPath("/work/calc_shim.py")
                .build();
        VesselRecord fallback = compiled.toBuilder()
                .status(VesselStatus.INTERPRETED_FALLBACK)
                .binaryPath(null)
                .build();

        // When / Then
        assertThat(ProcessFunctionRunner.forVessel(compiled, settings).command()).containsExactly("/cache/calc");
        assertThat(ProcessFunctionRunner.forVessel(fallback, settings).command())
                .containsExactly("/usr/bin/python3.12", "/work/calc_shim.py");
        assertThat(ProcessFunctionRunner.forLegacy(compiled, settings).command())
                .containsExactly("/usr/bin/python3.12", "/work/calc_shim.py");
    }

    @Test
    void shouldRefuseVesselThatFailedToBuild() {
        // Given
        VesselRecord failed = VesselRecord.builder()
                .functionName("calc")
                .sourceLanguage(SourceLanguage.PYTHON)
                .targetLanguage(TargetLanguage.COMPILED_NATIVE)
                .status(VesselStatus.ERROR)
                .shimPath("/work/calc_shim.py")
                .build();

        // When / Then
        assertThatThrownBy(() -> ProcessFunctionRunner.forVessel(failed, new PipelineSettings()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("failed to build");
    }

    @Test
    void shouldRequireShimForLegacyRunner() {
        VesselRecord noShim = VesselRecord.builder()
                .functionName("calc")
                .sourceLanguage(SourceLanguage.RUBY)
                .status(VesselStatus.ERROR)
                .build();

        assertThatThrownBy(() -> ProcessFunctionRunner.forLegacy(noShim, new PipelineSettings()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no interpreter shim");
    }

    static final class CannedExecutor extends ProcessExecutor {

        private final ProcessOutput output;
        final List<List<String>> commands = new ArrayList<>();

        CannedExecutor(ProcessOutput output) {
            this.output = output;
        }

        @Override
        public ProcessOutput run(List<String> command, Duration timeout) {
            commands.add(command);
            return output;
        }
    }
}
