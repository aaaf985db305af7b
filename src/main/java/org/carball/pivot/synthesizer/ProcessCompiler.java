package org.carball.pivot.synthesizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.process.ProcessExecutor;
import org.carball.pivot.process.ProcessOutput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes an installed compiler ({@code go build}, {@code g++}, {@code rustc}) as an external
 * process with a timeout.
 */
@Slf4j
public class ProcessCompiler implements Compiler {

    private static final Duration VERSION_PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final TargetLanguage target;
    private final String executable;
    private final Duration timeout;
    private final ProcessExecutor executor;

    private volatile String version;
    private volatile Boolean available;

    public ProcessCompiler(TargetLanguage target, String executable, Duration timeout) {
        this(target, executable, timeout, new ProcessExecutor());
    }

    ProcessCompiler(TargetLanguage target, String executable, Duration timeout, ProcessExecutor executor) {
        if (!target.isCompiled()) {
            throw new IllegalArgumentException("No compiler for target '" + target.getId() + "'");
        }
        this.target = target;
        this.executable = executable;
        this.timeout = timeout;
        this.executor = executor;
    }

    /**
     * One compiler per compiled target using the default executable names.
     */
    public static Map<TargetLanguage, Compiler> defaults(Duration timeout) {
        Map<TargetLanguage, Compiler> compilers = new EnumMap<>(TargetLanguage.class);
        compilers.put(TargetLanguage.COMPILED_CONCURRENT, new ProcessCompiler(TargetLanguage.COMPILED_CONCURRENT, "go", timeout));
        compilers.put(TargetLanguage.COMPILED_NATIVE, new ProcessCompiler(TargetLanguage.COMPILED_NATIVE, "g++", timeout));
        compilers.put(TargetLanguage.MEMORY_SAFE_NATIVE, new ProcessCompiler(TargetLanguage.MEMORY_SAFE_NATIVE, "rustc", timeout));
        return compilers;
    }

    @Override
    public TargetLanguage target() {
        return target;
    }

    @Override
    public boolean isAvailable() {
        if (available == null) {
            probe();
        }
        return available;
    }

    @Override
    public String version() {
        if (available == null) {
            probe();
        }
        return version;
    }

    @Override
    public CompilationResult compile(Path sourceFile, Path outputBinary, List<String> flags) throws CompilationException {
        List<String> command = buildCommand(sourceFile, outputBinary, flags);
        log.debug("Compiling {} with: {}", sourceFile.getFileName(), String.join(" ", command));

        ProcessOutput output;
        try {
            output = executor.run(command, timeout);
        } catch (IOException e) {
            throw new CompilationException("Failed to start " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompilationException("Compilation interrupted", e);
        }

        if (output.timedOut()) {
            throw new CompilationException("Compilation timed out after " + timeout.toSeconds() + "s",
                    output.combinedOutput());
        }
        if (output.exitCode() != 0 || !Files.isRegularFile(outputBinary)) {
            throw new CompilationException(executable + " exited with code " + output.exitCode(),
                    output.combinedOutput());
        }

        return new CompilationResult(outputBinary, Math.round(output.durationMs()), output.combinedOutput());
    }

    List<String> buildCommand(Path sourceFile, Path outputBinary, List<String> flags) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (target == TargetLanguage.COMPILED_CONCURRENT) {
            command.add("build");
        }
        command.addAll(flags);
        command.add("-o");
        command.add(outputBinary.toString());
        command.add(sourceFile.toString());
        return command;
    }

    private synchronized void probe() {
        if (available != null) {
            return;
        }
        List<String> command = target == TargetLanguage.COMPILED_CONCURRENT
                ? List.of(executable, "version")
                : List.of(executable, "--version");
        try {
            ProcessOutput output = executor.run(command, VERSION_PROBE_TIMEOUT);
            if (output.succeeded()) {
                version = output.stdout().lines().findFirst().orElse("unknown").trim();
                available = true;
                log.debug("Found {} for {}: {}", executable, target.getId(), version);
                return;
            }
            log.debug("{} version probe exited with {}", executable, output.exitCode());
        } catch (IOException e) {
            log.debug("{} is not installed: {}", executable, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        version = "unavailable";
        available = false;
    }
}
