package org.carball.pivot.model.parity;

import java.util.List;

public record TestFailure(
        List<Object> input,
        Object legacyOutput,
        Object vesselOutput,
        double relativeError,
        String reason
) {
}
