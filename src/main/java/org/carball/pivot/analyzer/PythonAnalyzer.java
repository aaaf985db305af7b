package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code def} blocks by indentation. Annotations supply argument and return hints.
 */
public class PythonAnalyzer extends AbstractSourceAnalyzer {

    private static final Pattern DEF_PATTERN =
            Pattern.compile("^([ \\t]*)(?:async[ \\t]+)?def[ \\t]+(\\w+)[ \\t]*\\(", Pattern.MULTILINE);

    private static final Pattern HEADER_TAIL_PATTERN =
            Pattern.compile("^[ \\t]*(?:->[ \\t]*(.+?))?[ \\t]*:(.*)$");

    private static final Set<String> RECEIVER_NAMES = Set.of("self", "cls");

    private static final LanguageRules RULES = new LanguageRules(
            Pattern.compile("\\b(?:if|elif|for|while|except)\\b"),
            Pattern.compile("\\b(?:for|while)\\b"),
            Pattern.compile("\\b(?:print|open|input)\\s*\\(|\\bsys\\.std(?:in|out|err)\\b|\\brequests\\.|"
                    + "\\bsocket\\b|\\burllib\\b|\\.(?:read|write)\\w*\\s*\\("),
            MATH_PATTERN);

    private final SourceSanitizer sanitizer = SourceSanitizer.python();

    public PythonAnalyzer() {
        this(8, 3);
    }

    public PythonAnalyzer(int loopComplexityThreshold, int mathOperationThreshold) {
        super(loopComplexityThreshold, mathOperationThreshold);
    }

    @Override
    public SourceLanguage language() {
        return SourceLanguage.PYTHON;
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
        Matcher matcher = DEF_PATTERN.matcher(sanitized);

        while (matcher.find()) {
            int indent = indentWidth(matcher.group(1));
            String name = matcher.group(2);
            int startLine = text.lineOf(matcher.start());

            int openParen = matcher.end() - 1;
            int closeParen = findClosing(sanitized, openParen);
            int headerLine = text.lineOf(closeParen);

            String tail = text.sanitizedRange(closeParen + 1, text.lineEnd(headerLine));
            Matcher tailMatcher = HEADER_TAIL_PATTERN.matcher(tail);
            if (!tailMatcher.matches()) {
                throw new SourceParseException("Function '" + name + "' header is missing ':'", headerLine);
            }

            String returnHint = tailMatcher.group(1) != null
                    ? tailMatcher.group(1).trim()
                    : ArgumentHint.UNKNOWN_TYPE;
            String inlineBody = tailMatcher.group(2);

            int endLine = findBodyEnd(text, headerLine, indent);
            if (endLine == headerLine && inlineBody.isBlank()) {
                throw new SourceParseException("Function '" + name + "' has no body", headerLine);
            }

            String body = inlineBody;
            if (endLine > headerLine) {
                body = body + "\n" + text.sanitizedRange(text.lineStart(headerLine + 1), text.lineEnd(endLine));
            }

            functions.add(new FunctionDescriptor(
                    name,
                    startLine,
                    endLine - startLine + 1,
                    parseArguments(sanitized.substring(openParen + 1, closeParen)),
                    returnHint,
                    text.sanitizedRange(matcher.start(), closeParen + 1 + tail.length()),
                    body,
                    text.originalLines(startLine, endLine)));
        }

        return functions;
    }

    // Last line indented deeper than the def, trailing blank lines excluded
    private int findBodyEnd(SourceText text, int headerLine, int defIndent) {
        int endLine = headerLine;
        for (int line = headerLine + 1; line <= text.lineCount(); line++) {
            String content = text.sanitizedLine(line);
            if (content.isBlank()) {
                continue;
            }
            if (indentWidth(content) <= defIndent) {
                break;
            }
            endLine = line;
        }
        return endLine;
    }

    private List<ArgumentHint> parseArguments(String parameterList) {
        List<ArgumentHint> arguments = new ArrayList<>();

        for (String part : splitParameters(parameterList)) {
            String parameter = stripDefault(part).replaceFirst("^\\*{1,2}", "").trim();
            if (parameter.isEmpty() || parameter.equals("/")) {
                continue;
            }

            String name = parameter;
            String typeHint = ArgumentHint.UNKNOWN_TYPE;
            int colon = parameter.indexOf(':');
            if (colon >= 0) {
                name = parameter.substring(0, colon).trim();
                String annotation = parameter.substring(colon + 1).trim();
                if (!annotation.isEmpty()) {
                    typeHint = annotation;
                }
            }

            if (arguments.isEmpty() && RECEIVER_NAMES.contains(name)) {
                continue;
            }
            arguments.add(new ArgumentHint(name, typeHint));
        }

        return arguments;
    }

    private static int indentWidth(String line) {
        int width = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 8 - (width % 8);
            } else {
                break;
            }
        }
        return width;
    }
}
