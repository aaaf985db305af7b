package org.carball.pivot.model.analysis;

import lombok.Builder;

import java.util.List;

/**
 * One analyzed function. Produced by an analyzer and never modified afterwards.
 */
@Builder(toBuilder = true)
public record FunctionSpec(
        String name,
        int startLine,
        int lineCount,
        int complexity,
        boolean hasLoops,
        boolean hasRecursion,
        boolean hasIo,
        boolean mathHeavy,
        boolean cryptographic,
        List<ArgumentHint> arguments,
        String returnHint,
        TargetLanguage recommendedTarget,
        String justification,
        String source
) {

    public FunctionSpec {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public List<String> argumentNames() {
        return arguments.stream().map(ArgumentHint::name).toList();
    }
}
