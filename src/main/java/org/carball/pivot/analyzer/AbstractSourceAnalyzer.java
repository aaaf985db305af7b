package org.carball.pivot.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.FunctionSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared flow for the regex-driven front-ends: sanitize, check bracket structure, locate
 * functions, then score and recommend. Any structural error fails the whole file.
 */
@Slf4j
public abstract class AbstractSourceAnalyzer implements Analyzer {

    protected static final Pattern MATH_PATTERN = Pattern.compile(
            "\\*\\*|//|[*/%]|\\b(?:math|Math)\\.\\w+|\\b(?:sqrt|pow|exp|log|sin|cos|tan|hypot)\\s*\\(");

    private final ComplexityScorer complexityScorer;
    private final TargetRecommender targetRecommender;

    protected AbstractSourceAnalyzer(int loopComplexityThreshold, int mathOperationThreshold) {
        this.complexityScorer = new ComplexityScorer(mathOperationThreshold);
        this.targetRecommender = new TargetRecommender(loopComplexityThreshold);
    }

    protected abstract SourceSanitizer sanitizer();

    protected abstract LanguageRules rules();

    /**
     * Locates every function definition. Implementations throw on malformed definitions.
     */
    protected abstract List<FunctionDescriptor> locateFunctions(SourceText text) throws SourceParseException;

    @Override
    public List<FunctionSpec> analyze(String sourceText) throws SourceParseException {
        String sanitized = sanitizer().sanitize(sourceText);
        checkBrackets(sanitized);

        List<FunctionDescriptor> descriptors = locateFunctions(new SourceText(sourceText, sanitized));
        List<FunctionSpec> functions = new ArrayList<>();

        for (FunctionDescriptor descriptor : descriptors) {
            FunctionTraits traits = complexityScorer.score(descriptor, rules());
            TargetRecommender.Recommendation recommendation = targetRecommender.recommend(traits);

            if (log.isDebugEnabled()) {
                log.debug("{}", complexityScorer.generateComplexityReport(descriptor, traits));
            }

            functions.add(FunctionSpec.builder()
                    .name(descriptor.name())
                    .startLine(descriptor.startLine())
                    .lineCount(descriptor.lineCount())
                    .complexity(traits.complexity())
                    .hasLoops(traits.hasLoops())
                    .hasRecursion(traits.hasRecursion())
                    .hasIo(traits.hasIo())
                    .mathHeavy(traits.mathHeavy())
                    .cryptographic(traits.cryptographic())
                    .arguments(descriptor.arguments())
                    .returnHint(descriptor.returnHint())
                    .recommendedTarget(recommendation.target())
                    .justification(recommendation.justification())
                    .source(descriptor.source())
                    .build());
        }

        log.info("Analyzed {} {} function(s)", functions.size(), language().getId());
        return functions;
    }

    /**
     * Fails on the first closing bracket without a matching opener, or on an opener that is never closed.
     */
    protected void checkBrackets(String sanitized) throws SourceParseException {
        Deque<int[]> open = new ArrayDeque<>();
        int line = 1;

        for (int i = 0; i < sanitized.length(); i++) {
            char c = sanitized.charAt(i);
            switch (c) {
                case '\n' -> line++;
                case '(', '[', '{' -> open.push(new int[]{c, line});
                case ')', ']', '}' -> {
                    if (open.isEmpty()) {
                        throw new SourceParseException("Unexpected '" + c + "'", line);
                    }
                    int[] opener = open.pop();
                    if (opener[0] != matchingOpener(c)) {
                        throw new SourceParseException(
                                "Mismatched '" + (char) opener[0] + "' closed by '" + c + "'", line);
                    }
                }
                default -> {
                }
            }
        }

        if (!open.isEmpty()) {
            int[] unclosed = open.peekLast();
            throw new SourceParseException("Unclosed '" + (char) unclosed[0] + "'", unclosed[1]);
        }
    }

    private static char matchingOpener(char closer) {
        return switch (closer) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    /**
     * Returns the offset of the bracket closing the one at {@code openIndex}. Brackets are
     * known to be balanced by the time this is called.
     */
    protected static int findClosing(String sanitized, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < sanitized.length(); i++) {
            char c = sanitized.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return sanitized.length() - 1;
    }

    /**
     * Splits a parameter list on commas that are not nested inside brackets.
     */
    protected static List<String> splitParameters(String parameterList) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();

        for (char c : parameterList.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }

            if (c == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        if (!current.toString().isBlank()) {
            parts.add(current.toString().trim());
        }
        return parts;
    }

    /**
     * Builds untyped hints, skipping empty entries and stripping default values and splat markers.
     */
    protected static List<ArgumentHint> untypedArguments(String parameterList) {
        List<ArgumentHint> arguments = new ArrayList<>();
        int index = 0;
        for (String part : splitParameters(parameterList)) {
            String name = stripDefault(part).replaceAll("^[*&.]+", "").replaceAll(":$", "").trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!name.matches("\\w+")) {
                name = "arg" + index;
            }
            arguments.add(ArgumentHint.untyped(name));
            index++;
        }
        return arguments;
    }

    protected static String stripDefault(String parameter) {
        int depth = 0;
        for (int i = 0; i < parameter.length(); i++) {
            char c = parameter.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '=' && depth == 0) {
                return parameter.substring(0, i).trim();
            }
        }
        return parameter.trim();
    }

    /**
     * Original and sanitized text of one file with line lookup. Both strings have identical
     * offsets and line structure.
     */
    protected static final class SourceText {

        private final String original;
        private final String sanitized;
        private final int[] lineStarts;

        SourceText(String original, String sanitized) {
            this.original = original;
            this.sanitized = sanitized;

            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < original.length(); i++) {
                if (original.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        public String original() {
            return original;
        }

        public String sanitized() {
            return sanitized;
        }

        public int lineCount() {
            return lineStarts.length;
        }

        /**
         * 1-based line containing the offset.
         */
        public int lineOf(int offset) {
            int low = 0;
            int high = lineStarts.length - 1;
            while (low < high) {
                int mid = (low + high + 1) >>> 1;
                if (lineStarts[mid] <= offset) {
                    low = mid;
                } else {
                    high = mid - 1;
                }
            }
            return low + 1;
        }

        public int lineStart(int line) {
            return lineStarts[line - 1];
        }

        public int lineEnd(int line) {
            return line < lineStarts.length ? lineStarts[line] - 1 : original.length();
        }

        public String sanitizedLine(int line) {
            return sanitized.substring(lineStart(line), lineEnd(line));
        }

        public String originalLines(int fromLine, int toLine) {
            return original.substring(lineStart(fromLine), lineEnd(toLine));
        }

        public String sanitizedRange(int from, int to) {
            return sanitized.substring(from, Math.min(to, sanitized.length()));
        }
    }
}
