package org.carball.pivot.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TargetLanguage {
    COMPILED_CONCURRENT("compiled-concurrent", "go", ".go"),
    COMPILED_NATIVE("compiled-native", "cpp", ".cpp"),
    MEMORY_SAFE_NATIVE("memory-safe-native", "rust", ".rs"),
    INTERPRETED("interpreted", null, null);

    private final String id;
    private final String dialect;
    private final String sourceExtension;

    TargetLanguage(String id, String dialect, String sourceExtension) {
        this.id = id;
        this.dialect = dialect;
        this.sourceExtension = sourceExtension;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDialect() {
        return dialect;
    }

    public String getSourceExtension() {
        return sourceExtension;
    }

    public boolean isCompiled() {
        return this != INTERPRETED;
    }

    @JsonCreator
    public static TargetLanguage fromId(String id) {
        for (TargetLanguage target : values()) {
            if (target.id.equalsIgnoreCase(id) || target.name().equalsIgnoreCase(id)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target language: " + id);
    }
}
