package org.carball.pivot.analyzer;

import java.util.regex.Pattern;

/**
 * Keyword tables one language contributes to scoring.
 *
 * @param branchPattern tokens that add a decision point (branches, loops, exception handlers)
 * @param loopPattern   loop constructs
 * @param ioPattern     calls that perform I/O
 * @param mathPattern   arithmetic operators and math library calls
 */
public record LanguageRules(
        Pattern branchPattern,
        Pattern loopPattern,
        Pattern ioPattern,
        Pattern mathPattern
) {
}
