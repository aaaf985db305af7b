package org.carball.pivot.analyzer;

/**
 * Blanks out string literals and comments so that keyword and bracket scans only see code.
 * Output has the same length and line structure as the input.
 */
public final class SourceSanitizer {

    private final String lineComment;
    private final boolean blockComments;
    private final boolean tripleQuotes;
    private final boolean backtickStrings;

    private SourceSanitizer(String lineComment, boolean blockComments, boolean tripleQuotes, boolean backtickStrings) {
        this.lineComment = lineComment;
        this.blockComments = blockComments;
        this.tripleQuotes = tripleQuotes;
        this.backtickStrings = backtickStrings;
    }

    public static SourceSanitizer python() {
        return new SourceSanitizer("#", false, true, false);
    }

    public static SourceSanitizer javascript() {
        return new SourceSanitizer("//", true, false, true);
    }

    public static SourceSanitizer ruby() {
        return new SourceSanitizer("#", false, false, false);
    }

    public String sanitize(String source) throws SourceParseException {
        char[] out = source.toCharArray();
        int line = 1;
        int i = 0;
        int length = source.length();

        while (i < length) {
            char c = source.charAt(i);

            if (c == '\n') {
                line++;
                i++;
            } else if (source.startsWith(lineComment, i)) {
                while (i < length && source.charAt(i) != '\n') {
                    out[i++] = ' ';
                }
            } else if (blockComments && source.startsWith("/*", i)) {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new SourceParseException("Unterminated block comment", line);
                }
                line += blank(out, source, i, end + 2);
                i = end + 2;
            } else if (tripleQuotes && (source.startsWith("\"\"\"", i) || source.startsWith("'''", i))) {
                String delimiter = source.substring(i, i + 3);
                int end = source.indexOf(delimiter, i + 3);
                if (end < 0) {
                    throw new SourceParseException("Unterminated triple-quoted string", line);
                }
                line += blank(out, source, i, end + 3);
                i = end + 3;
            } else if (c == '"' || c == '\'' || (backtickStrings && c == '`')) {
                int end = findStringEnd(source, i, c, line);
                line += blank(out, source, i, end + 1);
                i = end + 1;
            } else {
                i++;
            }
        }

        return new String(out);
    }

    private int findStringEnd(String source, int start, char quote, int line) throws SourceParseException {
        boolean multiline = quote == '`';
        for (int i = start + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i;
            } else if (c == '\n' && !multiline) {
                break;
            }
        }
        throw new SourceParseException("Unterminated string literal", line);
    }

    // Returns the number of newlines inside the blanked range
    private static int blank(char[] out, String source, int from, int to) {
        int newlines = 0;
        for (int i = from; i < to; i++) {
            if (source.charAt(i) == '\n') {
                newlines++;
            } else {
                out[i] = ' ';
            }
        }
        return newlines;
    }
}
