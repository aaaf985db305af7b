package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.util.List;

/**
 * Turns the source text of one file into scored function specs.
 */
public interface Analyzer {

    SourceLanguage language();

    /**
     * Analyzes a whole file. Either every function is returned or the call fails.
     *
     * @throws SourceParseException if any part of the file cannot be analyzed
     */
    List<FunctionSpec> analyze(String sourceText) throws SourceParseException;
}
