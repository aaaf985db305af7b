package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.analysis.ValueKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Default generator: the compiled function forwards its arguments to the interpreter shim
 * and decodes the shim's JSON result. Parity holds by construction; a translating
 * generator registered for the target replaces it.
 */
public class ShimBridgeCodeGenerator implements CodeGenerator {

    public static final String NAME = "shim-bridge";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String translateBody(FunctionSpec spec, TargetLanguage target) {
        String resultType = NativeTypes.typeName(ValueKind.forReturn(spec.returnHint()), target);
        int count = spec.arguments().size();
        List<String> converted = new ArrayList<>();

        return switch (target) {
            case COMPILED_CONCURRENT -> {
                for (int i = 0; i < count; i++) {
                    converted.add("fmt.Sprint(" + NativeTypes.argumentName(i) + ")");
                }
                yield "    var result " + resultType + "\n"
                        + "    decodeJSON(runShim(" + String.join(", ", converted) + "), &result)\n"
                        + "    return result";
            }
            case COMPILED_NATIVE -> {
                for (int i = 0; i < count; i++) {
                    converted.add("to_arg(" + NativeTypes.argumentName(i) + ")");
                }
                yield "    " + resultType + " result;\n"
                        + "    decode_json(run_shim({" + String.join(", ", converted) + "}), result);\n"
                        + "    return result;";
            }
            case MEMORY_SAFE_NATIVE -> {
                for (int i = 0; i < count; i++) {
                    converted.add("format!(\"{}\", " + NativeTypes.argumentName(i) + ")");
                }
                yield "    let shim_args: Vec<String> = vec![" + String.join(", ", converted) + "];\n"
                        + "    <" + resultType + " as FromJson>::from_json(&run_shim(&shim_args))";
            }
            case INTERPRETED -> throw new IllegalArgumentException("Interpreted functions have no compiled body");
        };
    }
}
