package org.carball.pivot.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.AnalysisBlueprint;
import org.carball.pivot.model.benchmark.BenchmarkSample;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.synthesis.SynthesisManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes stage artifacts. Every artifact is checked for its required fields before
 * it is bound, so a truncated or hand-edited file fails with the list of problems.
 */
@Slf4j
public class ArtifactStore {

    private final ObjectMapper objectMapper;

    public ArtifactStore() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public void writeBlueprint(Path file, AnalysisBlueprint blueprint) throws IOException {
        write(file, ArtifactKind.BLUEPRINT, blueprint);
    }

    public AnalysisBlueprint readBlueprint(Path file) throws IOException, ArtifactValidationException {
        return read(file, ArtifactKind.BLUEPRINT, AnalysisBlueprint.class);
    }

    public void writeManifest(Path file, SynthesisManifest manifest) throws IOException {
        write(file, ArtifactKind.MANIFEST, manifest);
    }

    public SynthesisManifest readManifest(Path file) throws IOException, ArtifactValidationException {
        return read(file, ArtifactKind.MANIFEST, SynthesisManifest.class);
    }

    public void writeCertificate(Path file, ParityCertificate certificate) throws IOException {
        write(file, ArtifactKind.CERTIFICATE, certificate);
    }

    public ParityCertificate readCertificate(Path file) throws IOException, ArtifactValidationException {
        return read(file, ArtifactKind.CERTIFICATE, ParityCertificate.class);
    }

    public void writeBenchmark(Path file, BenchmarkSample sample) throws IOException {
        write(file, ArtifactKind.BENCHMARK, sample);
    }

    public BenchmarkSample readBenchmark(Path file) throws IOException, ArtifactValidationException {
        return read(file, ArtifactKind.BENCHMARK, BenchmarkSample.class);
    }

    public String toJson(Object artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {}", artifact.getClass().getSimpleName(), e);
            throw new IllegalStateException("Failed to serialize " + artifact.getClass().getSimpleName(), e);
        }
    }

    /**
     * Validates and binds an artifact held in memory.
     */
    public <T> T fromJson(String json, ArtifactKind kind, Class<T> type) throws ArtifactValidationException {
        if (!kind.getType().equals(type)) {
            throw new IllegalArgumentException(kind.getDisplayName() + " binds to "
                    + kind.getType().getSimpleName() + ", not " + type.getSimpleName());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ArtifactValidationException(kind.getDisplayName(), e.getOriginalMessage(), e);
        }

        List<String> violations = validate(root, kind);
        if (!violations.isEmpty()) {
            throw new ArtifactValidationException(kind.getDisplayName(), violations);
        }

        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            throw new ArtifactValidationException(kind.getDisplayName(), e.getOriginalMessage(), e);
        }
    }

    /**
     * Lists missing or null required fields. An empty list means the artifact is well formed.
     */
    public List<String> validate(JsonNode root, ArtifactKind kind) {
        List<String> violations = new ArrayList<>();
        if (root == null || !root.isObject()) {
            violations.add("expected a JSON object");
            return violations;
        }

        checkFields(root, kind.getRequiredFields(), "", violations);

        String elementsField = kind.getElementsField();
        if (elementsField != null && root.hasNonNull(elementsField)) {
            JsonNode elements = root.get(elementsField);
            if (!elements.isArray()) {
                violations.add("'" + elementsField + "' must be an array");
            } else {
                for (int i = 0; i < elements.size(); i++) {
                    String prefix = elementsField + "[" + i + "].";
                    JsonNode element = elements.get(i);
                    if (!element.isObject()) {
                        violations.add("'" + prefix + "' must be an object");
                    } else {
                        checkFields(element, kind.getRequiredElementFields(), prefix, violations);
                    }
                }
            }
        }
        return violations;
    }

    private static void checkFields(JsonNode node, List<String> fields, String prefix, List<String> violations) {
        for (String field : fields) {
            if (!node.hasNonNull(field)) {
                violations.add("missing required field '" + prefix + field + "'");
            }
        }
    }

    private void write(Path file, ArtifactKind kind, Object artifact) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, toJson(artifact), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        log.info("Wrote {} to {}", kind.getDisplayName(), file);
    }

    private <T> T read(Path file, ArtifactKind kind, Class<T> type) throws IOException, ArtifactValidationException {
        if (!Files.exists(file)) {
            throw new IOException(kind.getDisplayName() + " not found: " + file);
        }
        T artifact = fromJson(Files.readString(file, StandardCharsets.UTF_8), kind, type);
        log.debug("Read {} from {}", kind.getDisplayName(), file);
        return artifact;
    }
}
