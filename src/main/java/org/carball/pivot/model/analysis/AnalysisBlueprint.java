package org.carball.pivot.model.analysis;

import java.util.List;

public record AnalysisBlueprint(
        String status,
        SourceLanguage sourceLanguage,
        String sourceFile,
        List<FunctionSpec> functions
) {

    public static final String STATUS_OK = "ok";

    public AnalysisBlueprint {
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static AnalysisBlueprint of(SourceLanguage language, String sourceFile, List<FunctionSpec> functions) {
        return new AnalysisBlueprint(STATUS_OK, language, sourceFile, functions);
    }
}
