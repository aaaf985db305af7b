package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code def ... end} blocks by tracking keyword nesting line by line.
 */
public class RubyAnalyzer extends AbstractSourceAnalyzer {

    private static final Pattern DEF_PATTERN =
            Pattern.compile("^\\s*def\\s+(?:self\\.)?(\\w+[?!]?)\\s*(?:\\(([^)]*)\\)|([^=;]*))?\\s*(=)?");

    private static final Pattern LEADING_OPENER_PATTERN =
            Pattern.compile("^\\s*(?:def|class|module|begin|case|if|unless|while|until|for)\\b");

    private static final Pattern LOOP_STATEMENT_PATTERN =
            Pattern.compile("^\\s*(?:while|until|for)\\b");

    private static final Pattern ASSIGNED_OPENER_PATTERN =
            Pattern.compile("=\\s*(?:if|unless|case|begin)\\b");

    private static final Pattern TRAILING_DO_PATTERN =
            Pattern.compile("\\bdo\\s*(?:\\|[^|]*\\|)?\\s*$");

    private static final Pattern END_PATTERN = Pattern.compile("(?<![.\\w:])end\\b");

    private static final LanguageRules RULES = new LanguageRules(
            Pattern.compile("\\b(?:if|elsif|unless|while|until|for|when|rescue|loop)\\b|"
                    + "\\.(?:each\\w*|times|upto|downto)\\b"),
            Pattern.compile("\\b(?:while|until|for|loop)\\b|\\.(?:each\\w*|times|upto|downto|step)\\b"),
            Pattern.compile("\\b(?:puts|print|printf|gets)\\b|\\b(?:File|IO|Dir|Socket|STDIN|STDOUT)\\b|"
                    + "\\bNet::HTTP\\b|\\$std(?:in|out|err)\\b"),
            MATH_PATTERN);

    private final SourceSanitizer sanitizer = SourceSanitizer.ruby();

    public RubyAnalyzer() {
        this(8, 3);
    }

    public RubyAnalyzer(int loopComplexityThreshold, int mathOperationThreshold) {
        super(loopComplexityThreshold, mathOperationThreshold);
    }

    @Override
    public SourceLanguage language() {
        return SourceLanguage.RUBY;
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
        Deque<Block> open = new ArrayDeque<>();

        for (int line = 1; line <= text.lineCount(); line++) {
            String content = text.sanitizedLine(line);
            if (content.isBlank()) {
                continue;
            }

            Matcher def = DEF_PATTERN.matcher(content);
            boolean isDef = def.find();
            // Endless form requires parentheses unless there are no parameters
            boolean endless = isDef && def.group(4) != null
                    && (def.group(2) != null || def.group(3) == null || def.group(3).isBlank());

            if (isDef && endless) {
                // def name(args) = expression
                functions.add(describe(text, def, line, line, content.substring(def.end())));
            } else if (isDef) {
                open.push(new Block(line, def.group(1), parameterText(def), def.end()));
                for (int i = 1; i < openersIn(content); i++) {
                    open.push(new Block(line, null, null, 0));
                }
            } else {
                for (int i = 0; i < openersIn(content); i++) {
                    open.push(new Block(line, null, null, 0));
                }
            }

            Matcher closers = END_PATTERN.matcher(content);
            while (closers.find()) {
                if (open.isEmpty()) {
                    throw new SourceParseException("Unexpected 'end'", line);
                }
                Block block = open.pop();
                if (block.functionName() != null) {
                    functions.add(describeBlock(text, block, line));
                }
            }
        }

        if (!open.isEmpty()) {
            Block unclosed = open.pop();
            String what = unclosed.functionName() != null ? "def " + unclosed.functionName() : "block";
            throw new SourceParseException("Missing 'end' for " + what, unclosed.startLine());
        }

        functions.sort(Comparator.comparingInt(FunctionDescriptor::startLine));
        return functions;
    }

    private int openersIn(String content) {
        int openers = 0;
        boolean leading = LEADING_OPENER_PATTERN.matcher(content).find();
        if (leading) {
            openers++;
        }

        Matcher assigned = ASSIGNED_OPENER_PATTERN.matcher(content);
        while (assigned.find()) {
            openers++;
        }

        // "while cond do" opens a single block
        if (TRAILING_DO_PATTERN.matcher(content).find() && !LOOP_STATEMENT_PATTERN.matcher(content).find()) {
            openers++;
        }
        return openers;
    }

    private FunctionDescriptor describeBlock(SourceText text, Block block, int endLine) {
        String body = endLine > block.startLine() + 1
                ? text.sanitizedRange(text.lineStart(block.startLine() + 1), text.lineEnd(endLine - 1))
                : "";

        // Keep anything between the header and "end" on a one-line def
        String line = text.sanitizedLine(block.startLine());
        String header = line.substring(0, block.headerEnd());
        if (endLine == block.startLine()) {
            Matcher end = END_PATTERN.matcher(line);
            body = end.find(block.headerEnd()) ? line.substring(block.headerEnd(), end.start()) : "";
        }

        return new FunctionDescriptor(
                block.functionName(),
                block.startLine(),
                endLine - block.startLine() + 1,
                untypedArguments(block.parameters()),
                ArgumentHint.UNKNOWN_TYPE,
                header,
                body,
                text.originalLines(block.startLine(), endLine));
    }

    private FunctionDescriptor describe(SourceText text, Matcher def, int startLine, int endLine, String body) {
        return new FunctionDescriptor(
                def.group(1),
                startLine,
                endLine - startLine + 1,
                untypedArguments(parameterText(def)),
                ArgumentHint.UNKNOWN_TYPE,
                text.sanitizedLine(startLine).substring(0, def.end()),
                body,
                text.originalLines(startLine, endLine));
    }

    private static String parameterText(Matcher def) {
        if (def.group(2) != null) {
            return def.group(2);
        }
        return def.group(3) != null ? def.group(3).trim() : "";
    }

    private record Block(int startLine, String functionName, String parameters, int headerEnd) {
    }
}
