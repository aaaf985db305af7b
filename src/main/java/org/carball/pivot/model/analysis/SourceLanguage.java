package org.carball.pivot.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Optional;

public enum SourceLanguage {
    PYTHON("python", "python3", List.of(".py")),
    JAVASCRIPT("javascript", "node", List.of(".js", ".mjs", ".cjs")),
    RUBY("ruby", "ruby", List.of(".rb"));

    private final String id;
    private final String interpreter;
    private final List<String> extensions;

    SourceLanguage(String id, String interpreter, List<String> extensions) {
        this.id = id;
        this.interpreter = interpreter;
        this.extensions = extensions;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getInterpreter() {
        return interpreter;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public String getShimExtension() {
        return extensions.get(0);
    }

    @JsonCreator
    public static SourceLanguage fromId(String id) {
        for (SourceLanguage language : values()) {
            if (language.id.equalsIgnoreCase(id)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported source language: " + id);
    }

    /**
     * Maps a file name to its language by extension.
     */
    public static Optional<SourceLanguage> detect(String fileName) {
        String lower = fileName.toLowerCase();
        for (SourceLanguage language : values()) {
            for (String extension : language.extensions) {
                if (lower.endsWith(extension)) {
                    return Optional.of(language);
                }
            }
        }
        return Optional.empty();
    }
}
