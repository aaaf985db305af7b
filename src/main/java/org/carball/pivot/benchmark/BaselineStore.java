package org.carball.pivot.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.benchmark.BenchmarkSample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Named benchmark baselines, one JSON file per name.
 */
@Slf4j
public class BaselineStore {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public BaselineStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Stores a sample under a baseline name, replacing any previous baseline with that name.
     * The stored copy carries the baseline name and no comparison of its own.
     */
    public Path save(String baselineName, BenchmarkSample sample) throws IOException {
        Path file = fileFor(baselineName);
        Files.createDirectories(directory);

        BenchmarkSample stored = sample.toBuilder().name(baselineName).baseline(null).build();
        Path temp = directory.resolve(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), stored);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);

        log.info("Saved baseline '{}' (mean {}ms) to {}", baselineName, String.format("%.3f", stored.mean()), file);
        return file;
    }

    public Optional<BenchmarkSample> load(String baselineName) throws IOException {
        Path file = fileFor(baselineName);
        if (!Files.exists(file)) {
            log.debug("No baseline named '{}' in {}", baselineName, directory);
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), BenchmarkSample.class));
    }

    public List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(EXTENSION))
                    .map(fileName -> fileName.substring(0, fileName.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        }
    }

    private Path fileFor(String baselineName) {
        if (baselineName == null || !VALID_NAME.matcher(baselineName).matches()) {
            throw new IllegalArgumentException("Invalid baseline name: '" + baselineName
                    + "' (use letters, digits, '.', '_' or '-')");
        }
        return directory.resolve(baselineName + EXTENSION);
    }
}
