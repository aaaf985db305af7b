package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.ArgumentHint;

import java.util.List;

/**
 * A function located by a language front-end, before scoring.
 *
 * @param name        function name
 * @param startLine   1-based line of the definition header
 * @param lineCount   lines spanned including the header
 * @param arguments   parameters with their type hints
 * @param returnHint  declared return type, or {@code any}
 * @param header      sanitized header text (string literals and comments blanked)
 * @param body        sanitized body text
 * @param source      original source text of the whole definition
 */
public record FunctionDescriptor(
        String name,
        int startLine,
        int lineCount,
        List<ArgumentHint> arguments,
        String returnHint,
        String header,
        String body,
        String source
) {
}
