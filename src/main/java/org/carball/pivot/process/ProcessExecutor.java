package org.carball.pivot.process;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a hard timeout. Output goes to temporary files so a child
 * that fills its pipe cannot block the wait.
 */
@Slf4j
public class ProcessExecutor {

    private final Path workingDirectory;
    private final Map<String, String> environment;

    public ProcessExecutor() {
        this(null, Map.of());
    }

    public ProcessExecutor(Path workingDirectory, Map<String, String> environment) {
        this.workingDirectory = workingDirectory;
        this.environment = Map.copyOf(environment);
    }

    public ProcessOutput run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path stdoutFile = Files.createTempFile("pivot-out", ".log");
        Path stderrFile = Files.createTempFile("pivot-err", ".log");

        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.environment().putAll(environment);

            log.trace("Running: {}", String.join(" ", command));
            long start = System.nanoTime();
            Process process = pb.start();

            boolean completed;
            try {
                completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            long duration = System.nanoTime() - start;

            if (!completed) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                log.debug("Process timed out after {}: {}", timeout, command.get(0));
                return new ProcessOutput(-1, read(stdoutFile), read(stderrFile), true, duration);
            }

            return new ProcessOutput(process.exitValue(), read(stdoutFile), read(stderrFile), false, duration);
        } finally {
            Files.deleteIfExists(stdoutFile);
            Files.deleteIfExists(stderrFile);
        }
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().contains("win");
        return new File(windows ? "NUL" : "/dev/null");
    }
}
