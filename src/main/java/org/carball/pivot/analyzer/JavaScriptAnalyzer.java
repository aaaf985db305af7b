package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code function name(...) {}} declarations and arrow functions bound with
 * {@code const}, {@code let} or {@code var}. Bodies are delimited by brace matching.
 */
public class JavaScriptAnalyzer extends AbstractSourceAnalyzer {

    private static final Pattern FUNCTION_PATTERN =
            Pattern.compile("\\b(?:async\\s+)?function\\s*\\*?\\s*(\\w+)\\s*\\(");

    private static final Pattern ARROW_PATTERN =
            Pattern.compile("\\b(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s*)?(?:(function\\s*\\*?\\s*)?\\(|(\\w+)\\s*=>)");

    private static final Pattern ARROW_TAIL_PATTERN = Pattern.compile("\\s*=>\\s*");

    private static final Pattern BODY_OPEN_PATTERN = Pattern.compile("\\s*\\{");

    private static final LanguageRules RULES = new LanguageRules(
            Pattern.compile("\\b(?:if|for|while|case|catch)\\b|(?<!\\?)\\?(?![.?])"),
            Pattern.compile("\\b(?:for|while)\\b|\\.forEach\\s*\\("),
            Pattern.compile("\\bconsole\\.|\\bfs\\.|\\bfetch\\s*\\(|\\bprocess\\.std(?:in|out|err)\\b|"
                    + "\\bXMLHttpRequest\\b|\\b(?:readFile|writeFile)\\w*\\s*\\("),
            MATH_PATTERN);

    private final SourceSanitizer sanitizer = SourceSanitizer.javascript();

    public JavaScriptAnalyzer() {
        this(8, 3);
    }

    public JavaScriptAnalyzer(int loopComplexityThreshold, int mathOperationThreshold) {
        super(loopComplexityThreshold, mathOperationThreshold);
    }

    @Override
    public SourceLanguage language() {
        return SourceLanguage.JAVASCRIPT;
    }

    @Override
    protected SourceSanitizer sanitizer() {
        return sanitizer;
    }

    @Override
    protected LanguageRules rules() {
        return RULES;
    }

    @Override
    protected List<FunctionDescriptor> locateFunctions(SourceText text) throws SourceParseException {
        List<FunctionDescriptor> functions = new ArrayList<>();
        String sanitized = text.sanitized();

        Matcher declarations = FUNCTION_PATTERN.matcher(sanitized);
        while (declarations.find()) {
            String name = declarations.group(1);
            int openParen = declarations.end() - 1;
            int closeParen = findClosing(sanitized, openParen);

            Matcher bodyOpen = matchAt(BODY_OPEN_PATTERN, sanitized, closeParen + 1);
            if (bodyOpen == null) {
                throw new SourceParseException("Function '" + name + "' has no body",
                        text.lineOf(closeParen));
            }

            functions.add(describe(text, name, declarations.start(),
                    sanitized.substring(openParen + 1, closeParen), bodyOpen.end() - 1));
        }

        Matcher arrows = ARROW_PATTERN.matcher(sanitized);
        while (arrows.find()) {
            String name = arrows.group(1);
            String parameters;
            int tailStart;

            if (arrows.group(3) != null) {
                parameters = arrows.group(3);
                tailStart = arrows.end();
            } else if (arrows.group(2) != null) {
                // Anonymous function expression
                int openParen = arrows.end() - 1;
                int closeParen = findClosing(sanitized, openParen);
                Matcher bodyOpen = matchAt(BODY_OPEN_PATTERN, sanitized, closeParen + 1);
                if (bodyOpen == null) {
                    throw new SourceParseException("Function '" + name + "' has no body",
                            text.lineOf(closeParen));
                }
                functions.add(describe(text, name, arrows.start(),
                        sanitized.substring(openParen + 1, closeParen), bodyOpen.end() - 1));
                continue;
            } else {
                int openParen = arrows.end() - 1;
                int closeParen = findClosing(sanitized, openParen);
                Matcher arrowTail = matchAt(ARROW_TAIL_PATTERN, sanitized, closeParen + 1);
                if (arrowTail == null) {
                    // Parenthesized expression, not a function
                    continue;
                }
                parameters = sanitized.substring(openParen + 1, closeParen);
                tailStart = arrowTail.end();
            }

            Matcher bodyOpen = matchAt(BODY_OPEN_PATTERN, sanitized, tailStart);
            if (bodyOpen != null) {
                functions.add(describe(text, name, arrows.start(), parameters, bodyOpen.end() - 1));
            } else {
                functions.add(describeExpression(text, name, arrows.start(), parameters, tailStart));
            }
        }

        functions.sort(Comparator.comparingInt(FunctionDescriptor::startLine));
        return functions;
    }

    private static Matcher matchAt(Pattern pattern, String text, int from) {
        Matcher matcher = pattern.matcher(text);
        matcher.region(Math.min(from, text.length()), text.length());
        return matcher.lookingAt() ? matcher : null;
    }

    private FunctionDescriptor describe(SourceText text, String name, int start,
                                        String parameters, int openBrace) {
        String sanitized = text.sanitized();
        int closeBrace = findClosing(sanitized, openBrace);
        int startLine = text.lineOf(start);
        int endLine = text.lineOf(closeBrace);

        return new FunctionDescriptor(
                name,
                startLine,
                endLine - startLine + 1,
                untypedArguments(parameters),
                ArgumentHint.UNKNOWN_TYPE,
                sanitized.substring(start, openBrace),
                sanitized.substring(openBrace + 1, closeBrace),
                text.originalLines(startLine, endLine));
    }

    // Expression-bodied arrow: the body runs to the end of its statement
    private FunctionDescriptor describeExpression(SourceText text, String name, int start,
                                                  String parameters, int bodyStart) {
        String sanitized = text.sanitized();
        int end = bodyStart;
        while (end < sanitized.length()) {
            char c = sanitized.charAt(end);
            if (c == '(' || c == '[' || c == '{') {
                end = findClosing(sanitized, end) + 1;
            } else if (c == ';' || c == '\n' || c == ')' || c == ']' || c == '}') {
                break;
            } else {
                end++;
            }
        }

        int startLine = text.lineOf(start);
        int endLine = text.lineOf(Math.max(bodyStart, end - 1));

        return new FunctionDescriptor(
                name,
                startLine,
                endLine - startLine + 1,
                untypedArguments(parameters),
                ArgumentHint.UNKNOWN_TYPE,
                sanitized.substring(start, bodyStart),
                sanitized.substring(bodyStart, end),
                text.originalLines(startLine, endLine));
    }
}
