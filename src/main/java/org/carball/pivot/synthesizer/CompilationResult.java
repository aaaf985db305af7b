package org.carball.pivot.synthesizer;

import java.nio.file.Path;

/**
 * @param binary      executable written by the compiler
 * @param durationMs  wall-clock compile time
 * @param diagnostics compiler output, warnings included (may be empty)
 */
public record CompilationResult(Path binary, long durationMs, String diagnostics) {
}
