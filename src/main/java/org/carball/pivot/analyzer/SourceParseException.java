package org.carball.pivot.analyzer;

import org.carball.pivot.pipeline.PivotException;

/**
 * The source file could not be analyzed. No function list is produced for the file.
 */
public class SourceParseException extends PivotException {

    private final int line;

    public SourceParseException(String message, int line) {
        super("analyze", line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
