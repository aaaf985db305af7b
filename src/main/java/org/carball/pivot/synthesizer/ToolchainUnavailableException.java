package org.carball.pivot.synthesizer;

import org.carball.pivot.pipeline.PivotException;

/**
 * No compiler is installed for any target the batch needs and fallback is disabled.
 */
public class ToolchainUnavailableException extends PivotException {

    public ToolchainUnavailableException(String message) {
        super("synthesize", message);
    }
}
