package org.carball.pivot.synthesizer;

import org.carball.pivot.pipeline.PivotException;

public class CompilationException extends PivotException {

    private final String diagnostics;

    public CompilationException(String message, String diagnostics) {
        super("synthesize", message);
        this.diagnostics = diagnostics;
    }

    public CompilationException(String message, Throwable cause) {
        super("synthesize", message, cause);
        this.diagnostics = cause.getMessage();
    }

    public String diagnostics() {
        return diagnostics;
    }
}
