package org.carball.pivot.validator;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.ValueKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Produces argument lists in a fixed order: boundary cases, seeded random cases, then stored
 * regression inputs. The same seed and domains always yield the same list.
 */
@Slf4j
public class TestInputGenerator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_RANDOM_STRING_LENGTH = 16;

    private final int randomCaseCount;
    private final long seed;

    public TestInputGenerator(int randomCaseCount, long seed) {
        this.randomCaseCount = randomCaseCount;
        this.seed = seed;
    }

    public List<List<Object>> generate(List<ArgumentDomain> domains, List<List<Object>> regressionInputs) {
        List<List<Object>> inputs = new ArrayList<>(boundaryCases(domains));

        Random random = new Random(seed);
        for (int i = 0; i < randomCaseCount; i++) {
            List<Object> arguments = new ArrayList<>(domains.size());
            for (ArgumentDomain domain : domains) {
                arguments.add(randomValue(domain, random));
            }
            inputs.add(arguments);
        }

        for (List<Object> regression : regressionInputs) {
            if (regression.size() == domains.size()) {
                inputs.add(regression);
            } else {
                log.warn("Skipping stored input with {} arguments, function takes {}", regression.size(), domains.size());
            }
        }

        log.debug("Generated {} inputs ({} random, {} regression)", inputs.size(), randomCaseCount, regressionInputs.size());
        return inputs;
    }

    /**
     * Case {@code i} gives every argument its {@code i}-th boundary value, cycling arguments
     * with fewer boundaries. A function without arguments gets one empty case.
     */
    List<List<Object>> boundaryCases(List<ArgumentDomain> domains) {
        if (domains.isEmpty()) {
            return List.of(List.of());
        }

        List<List<Object>> perArgument = domains.stream().map(TestInputGenerator::boundaryValues).toList();
        int caseCount = perArgument.stream().mapToInt(List::size).max().orElse(0);

        List<List<Object>> cases = new ArrayList<>();
        for (int i = 0; i < caseCount; i++) {
            List<Object> arguments = new ArrayList<>(domains.size());
            for (List<Object> values : perArgument) {
                arguments.add(values.get(i % values.size()));
            }
            cases.add(arguments);
        }
        return cases;
    }

    static List<Object> boundaryValues(ArgumentDomain domain) {
        Set<Object> values = new LinkedHashSet<>();
        switch (domain.kind()) {
            case FLOAT -> {
                for (double candidate : new double[]{0.0, 1.0, -1.0, domain.min(), domain.max()}) {
                    if (domain.contains(candidate)) {
                        values.add(candidate);
                    }
                }
            }
            case STRING -> {
                values.add("");
                values.add("a");
                values.add("x".repeat(ArgumentDomain.LONG_STRING_LENGTH));
            }
            case BOOL -> {
                values.add(Boolean.TRUE);
                values.add(Boolean.FALSE);
            }
            default -> {
                long min = (long) Math.ceil(domain.min());
                long max = (long) Math.floor(domain.max());
                for (long candidate : new long[]{0L, 1L, -1L, min, max}) {
                    if (candidate >= min && candidate <= max) {
                        values.add(candidate);
                    }
                }
            }
        }
        return new ArrayList<>(values);
    }

    private static Object randomValue(ArgumentDomain domain, Random random) {
        ValueKind kind = domain.kind();
        return switch (kind) {
            case FLOAT -> domain.min() + random.nextDouble() * (domain.max() - domain.min());
            case STRING -> {
                int length = random.nextInt(MAX_RANDOM_STRING_LENGTH + 1);
                StringBuilder value = new StringBuilder(length);
                for (int i = 0; i < length; i++) {
                    value.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
                }
                yield value.toString();
            }
            case BOOL -> random.nextBoolean();
            default -> {
                long min = (long) Math.ceil(domain.min());
                long max = (long) Math.floor(domain.max());
                yield min + (long) Math.floor(random.nextDouble() * (max - min + 1));
            }
        };
    }
}
