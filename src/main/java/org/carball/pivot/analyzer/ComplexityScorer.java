package org.carball.pivot.analyzer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ComplexityScorer {

    private static final Pattern CRYPTO_PATTERN = Pattern.compile(
            "(?i)\\b(hashlib|sha\\d*|md5|digest|hmac|cipher\\w*|encrypt\\w*|decrypt\\w*|crypto\\w*|openssl|createhash)\\b");

    private final int mathOperationThreshold;

    public ComplexityScorer(int mathOperationThreshold) {
        this.mathOperationThreshold = mathOperationThreshold;
    }

    public FunctionTraits score(FunctionDescriptor function, LanguageRules rules) {
        String body = function.body();

        // Factor 1: one decision point per branch, loop or handler
        int complexity = 1 + count(rules.branchPattern(), body);

        // Factor 2: loops anywhere in the body
        boolean hasLoops = rules.loopPattern().matcher(body).find();

        // Factor 3: own name in call position
        Pattern selfCall = Pattern.compile("(?<![\\w.])" + Pattern.quote(function.name()) + "\\s*\\(");
        boolean hasRecursion = selfCall.matcher(body).find();

        // Factor 4: I/O disqualifies the pure-compute targets
        boolean hasIo = rules.ioPattern().matcher(body).find();

        // Factor 5: arithmetic density
        int mathOperations = count(rules.mathPattern(), body);

        // Factor 6: crypto keywords (header included, e.g. parameter names)
        boolean cryptographic = CRYPTO_PATTERN.matcher(body).find()
                || CRYPTO_PATTERN.matcher(function.name()).find();

        return new FunctionTraits(complexity, hasLoops, hasRecursion, hasIo,
                mathOperations, mathOperations >= mathOperationThreshold, cryptographic);
    }

    public String generateComplexityReport(FunctionDescriptor function, FunctionTraits traits) {
        StringBuilder report = new StringBuilder();

        report.append("Function: ").append(function.name()).append("\n");
        report.append("Complexity: ").append(traits.complexity()).append("\n");
        report.append("Factors:\n");
        report.append("  - Lines: ").append(function.lineCount()).append("\n");
        report.append("  - Loops: ").append(traits.hasLoops() ? "Yes" : "No").append("\n");
        report.append("  - Math operations: ").append(traits.mathOperations()).append("\n");

        if (traits.hasRecursion()) {
            report.append("  - Recursive: Yes\n");
        }
        if (traits.hasIo()) {
            report.append("  - Performs I/O: Yes\n");
        }
        if (traits.cryptographic()) {
            report.append("  - Cryptographic: Yes\n");
        }

        return report.toString();
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
