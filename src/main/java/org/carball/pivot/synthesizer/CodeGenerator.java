package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.TargetLanguage;

/**
 * Produces the body of the generated function for one target dialect. The body is placed
 * inside a function whose parameters are named {@code arg0..argN} with the native types
 * from {@link NativeTypes}.
 */
public interface CodeGenerator {

    String name();

    String translateBody(FunctionSpec spec, TargetLanguage target);
}
