package org.carball.pivot.validator;

import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.parity.ParityCertificate;

import java.io.IOException;

/**
 * Compares a legacy implementation with its vessel. A failed comparison is reported in the
 * certificate, never thrown.
 */
public interface Validator {

    String name();

    ParityCertificate validate(FunctionSpec spec, FunctionRunner legacy, FunctionRunner vessel) throws IOException;
}
