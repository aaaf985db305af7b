package org.carball.pivot.output;

import org.carball.pivot.model.analysis.AnalysisBlueprint;
import org.carball.pivot.model.benchmark.BenchmarkSample;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.synthesis.SynthesisManifest;

import java.util.List;

/**
 * JSON artifacts passed between pipeline stages, with the fields each must carry.
 */
public enum ArtifactKind {
    BLUEPRINT("analysis blueprint", AnalysisBlueprint.class,
            List.of("status", "sourceLanguage", "functions"),
            "functions", List.of("name", "startLine", "complexity", "recommendedTarget", "source")),
    MANIFEST("synthesis manifest", SynthesisManifest.class,
            List.of("status", "profileId", "vessels"),
            "vessels", List.of("functionName", "sourceLanguage", "targetLanguage", "status")),
    CERTIFICATE("parity certificate", ParityCertificate.class,
            List.of("functionName", "certified", "confidence", "testCount", "passed", "failed", "seed"),
            null, List.of()),
    BENCHMARK("benchmark report", BenchmarkSample.class,
            List.of("name", "iterations", "durationsMs", "mean"),
            null, List.of());

    private final String displayName;
    private final Class<?> type;
    private final List<String> requiredFields;
    private final String elementsField;
    private final List<String> requiredElementFields;

    ArtifactKind(String displayName, Class<?> type, List<String> requiredFields,
                 String elementsField, List<String> requiredElementFields) {
        this.displayName = displayName;
        this.type = type;
        this.requiredFields = requiredFields;
        this.elementsField = elementsField;
        this.requiredElementFields = requiredElementFields;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Class<?> getType() {
        return type;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    // Array field whose elements are checked too, may be null
    public String getElementsField() {
        return elementsField;
    }

    public List<String> getRequiredElementFields() {
        return requiredElementFields;
    }
}
