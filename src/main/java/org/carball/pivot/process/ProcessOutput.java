package org.carball.pivot.process;

/**
 * Captured result of an external process. When {@code timedOut} is set the process was
 * destroyed and {@code exitCode} is -1.
 */
public record ProcessOutput(int exitCode, String stdout, String stderr, boolean timedOut, long durationNanos) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public double durationMs() {
        return durationNanos / 1_000_000.0;
    }

    /**
     * Last non-blank line of stdout, or an empty string.
     */
    public String lastStdoutLine() {
        String[] lines = stdout.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i].trim();
            }
        }
        return "";
    }

    /**
     * Combined output for diagnostics.
     */
    public String combinedOutput() {
        if (stderr.isBlank()) {
            return stdout;
        }
        if (stdout.isBlank()) {
            return stderr;
        }
        return stdout + System.lineSeparator() + stderr;
    }
}
