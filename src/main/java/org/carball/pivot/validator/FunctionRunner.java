package org.carball.pivot.validator;

import java.util.List;

/**
 * Invokes one implementation of a function. Results are JSON-like values: numbers,
 * strings, booleans, lists and maps.
 */
@FunctionalInterface
public interface FunctionRunner {

    Object invoke(List<Object> arguments) throws Exception;
}
