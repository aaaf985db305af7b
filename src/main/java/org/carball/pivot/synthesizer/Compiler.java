package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.TargetLanguage;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds one target dialect into an executable.
 */
public interface Compiler {

    TargetLanguage target();

    boolean isAvailable();

    /**
     * Version string of the installed toolchain. Part of every cache key for this target.
     */
    String version();

    CompilationResult compile(Path sourceFile, Path outputBinary, List<String> flags) throws CompilationException;
}
