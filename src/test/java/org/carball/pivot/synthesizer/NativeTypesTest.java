package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.analysis.ValueKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class NativeTypesTest {

    private static final List<ArgumentHint> ARGUMENTS = List.of(
            new ArgumentHint("count", "int"),
            new ArgumentHint("scale", "float"),
            ArgumentHint.untyped("other"));

    @Test
    void shouldMapKindsPerTarget() {
        assertThat(NativeTypes.typeName(ValueKind.INT, TargetLanguage.COMPILED_CONCURRENT)).isEqualTo("int64");
        assertThat(NativeTypes.typeName(ValueKind.FLOAT, TargetLanguage.COMPILED_NATIVE)).isEqualTo("double");
        assertThat(NativeTypes.typeName(ValueKind.STRING, TargetLanguage.MEMORY_SAFE_NATIVE)).isEqualTo("String");
        assertThat(NativeTypes.typeName(ValueKind.DYNAMIC, TargetLanguage.COMPILED_NATIVE)).isEqualTo("RawJson");
    }

    @Test
    void shouldBuildParametersWithUnknownHintsAsIntegers() {
        assertThat(NativeTypes.parameters(ARGUMENTS, TargetLanguage.COMPILED_NATIVE))
                .isEqualTo("long long arg0, double arg1, long long arg2");
        assertThat(NativeTypes.parameters(ARGUMENTS, TargetLanguage.COMPILED_CONCURRENT))
                .isEqualTo("arg0 int64, arg1 float64, arg2 int64");
        assertThat(NativeTypes.parameters(ARGUMENTS, TargetLanguage.MEMORY_SAFE_NATIVE))
                .isEqualTo("arg0: i64, arg1: f64, arg2: i64");
    }

    @Test
    void shouldSanitizeIdentifiers() {
        assertThat(NativeTypes.identifier("zero?")).isEqualTo("zero_");
        assertThat(NativeTypes.identifier("2fast")).isEqualTo("f_2fast");
        assertThat(NativeTypes.identifier("main")).isEqualTo("main_fn");
        assertThat(NativeTypes.identifier("calculate_pi")).isEqualTo("calculate_pi");
    }

    @Test
    void shouldParseArgvPerTarget() {
        assertThat(NativeTypes.argumentParsing(ARGUMENTS.subList(0, 2), TargetLanguage.COMPILED_NATIVE))
                .isEqualTo("    long long arg0 = parse_int(argv[1]);\n    double arg1 = parse_float(argv[2]);");
        assertThat(NativeTypes.argumentParsing(ARGUMENTS.subList(1, 2), TargetLanguage.COMPILED_CONCURRENT))
                .isEqualTo("    arg0 := parseFloat(args[0])");
    }

    @Test
    void shouldEscapeStringLiterals() {
        assertThat(NativeTypes.stringLiterals(List.of("python3", "C:\\shim \"x\".py")))
                .isEqualTo("\"python3\", \"C:\\\\shim \\\"x\\\".py\"");
    }

    @Test
    void shouldBuildShimConverters() {
        assertThat(NativeTypes.shimConverters(ARGUMENTS, SourceLanguage.PYTHON)).isEqualTo("int, float, int");
        assertThat(NativeTypes.callArguments(3)).isEqualTo("arg0, arg1, arg2");
        assertThat(NativeTypes.callArguments(0)).isEmpty();
    }
}
