package org.carball.pivot.output;

import org.carball.pivot.pipeline.PivotException;

import java.util.List;

public class ArtifactValidationException extends PivotException {

    private final List<String> violations;

    public ArtifactValidationException(String artifact, List<String> violations) {
        super("artifact", "Invalid " + artifact + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ArtifactValidationException(String artifact, String message, Throwable cause) {
        super("artifact", "Unreadable " + artifact + ": " + message, cause);
        this.violations = List.of(message);
    }

    public List<String> violations() {
        return violations;
    }
}
