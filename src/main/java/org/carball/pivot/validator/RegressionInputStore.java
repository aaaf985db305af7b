package org.carball.pivot.validator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Inputs that failed parity once, stored per function as a JSON array of argument lists.
 * They are replayed on every later validation of the function.
 */
@Slf4j
public class RegressionInputStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public RegressionInputStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<List<Object>> load(String functionName) throws IOException {
        Path file = fileFor(functionName);
        if (!Files.exists(file)) {
            return List.of();
        }

        List<List<Object>> stored = objectMapper.readValue(file.toFile(), new TypeReference<>() {
        });
        List<List<Object>> normalized = new ArrayList<>();
        for (List<Object> arguments : stored) {
            normalized.add(arguments.stream().map(RegressionInputStore::normalize).toList());
        }
        log.debug("Loaded {} regression inputs for {}", normalized.size(), functionName);
        return normalized;
    }

    /**
     * Adds inputs not already stored. Returns the number added.
     */
    public int append(String functionName, List<List<Object>> inputs) throws IOException {
        if (inputs.isEmpty()) {
            return 0;
        }

        Set<List<Object>> merged = new LinkedHashSet<>(load(functionName));
        int before = merged.size();
        for (List<Object> input : inputs) {
            merged.add(input.stream().map(RegressionInputStore::normalize).toList());
        }

        int added = merged.size() - before;
        if (added > 0) {
            Files.createDirectories(directory);
            Path file = fileFor(functionName);
            Path temp = directory.resolve(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), new ArrayList<>(merged));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("Stored {} new regression input(s) for {}", added, functionName);
        }
        return added;
    }

    private Path fileFor(String functionName) {
        return directory.resolve(functionName.replaceAll("[^A-Za-z0-9_.-]", "_") + ".json");
    }

    // JSON round trips narrow integers; widen them back to the generator's types
    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        return value;
    }
}
