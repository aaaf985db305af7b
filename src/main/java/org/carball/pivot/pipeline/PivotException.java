package org.carball.pivot.pipeline;

/**
 * Checked exception for failures that stop a pipeline stage.
 */
public class PivotException extends Exception {

    private final String stage;

    public PivotException(String message) {
        super(message);
        this.stage = null;
    }

    public PivotException(String message, Throwable cause) {
        super(message, cause);
        this.stage = null;
    }

    public PivotException(String stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
    }

    public PivotException(String stage, String message, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
    }

    /**
     * Returns the pipeline stage where the error occurred (may be null).
     */
    public String stage() {
        return stage;
    }
}
