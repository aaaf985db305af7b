package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PythonAnalyzerTest {

    private PythonAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PythonAnalyzer();
    }

    @Test
    void shouldRecommendNativeTargetForMathHeavyFunction() throws Exception {
        // Given
        String source = fixture("python/slow_math.py");

        // When
        List<FunctionSpec> functions = analyzer.analyze(source);

        // Then
        assertThat(functions).extracting(FunctionSpec::name)
                .containsExactly("calculate_pi", "matrix_multiply");

        FunctionSpec pi = functions.get(0);
        assertThat(pi.startLine()).isEqualTo(4);
        assertThat(pi.complexity()).isEqualTo(3);
        assertThat(pi.hasLoops()).isTrue();
        assertThat(pi.mathHeavy()).isTrue();
        assertThat(pi.hasIo()).isFalse();
        assertThat(pi.recommendedTarget()).isEqualTo(TargetLanguage.COMPILED_NATIVE);
        assertThat(pi.justification()).contains("Math-heavy");
        assertThat(pi.arguments()).containsExactly(ArgumentHint.untyped("iterations"));
        assertThat(pi.source()).startsWith("def calculate_pi(iterations):")
                .contains("return 4.0 * inside / iterations");
    }

    @Test
    void shouldRecommendConcurrentTargetForLoopHeavyFunction() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(fixture("python/slow_math.py"));

        // Then
        FunctionSpec matrix = functions.get(1);
        assertThat(matrix.complexity()).isEqualTo(10);
        assertThat(matrix.hasLoops()).isTrue();
        assertThat(matrix.mathHeavy()).isFalse();
        assertThat(matrix.recommendedTarget()).isEqualTo(TargetLanguage.COMPILED_CONCURRENT);
        assertThat(matrix.justification()).contains("complexity 10");
    }

    @Test
    void shouldKeepSimpleFunctionsInterpreted() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(fixture("python/slow_loops.py"));

        // Then
        assertThat(functions).extracting(FunctionSpec::name)
                .containsExactly("heavy_computation", "nested_loops", "factorial");
        assertThat(functions).allMatch(f -> f.recommendedTarget() == TargetLanguage.INTERPRETED);

        assertThat(functions.get(0).complexity()).isEqualTo(2);
        assertThat(functions.get(1).complexity()).isEqualTo(3);
        assertThat(functions.get(1).lineCount()).isEqualTo(7);
    }

    @Test
    void shouldDetectRecursion() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(fixture("python/slow_loops.py"));

        // Then
        FunctionSpec factorial = functions.get(2);
        assertThat(factorial.hasRecursion()).isTrue();
        assertThat(factorial.hasLoops()).isFalse();
        assertThat(functions.get(0).hasRecursion()).isFalse();
    }

    @Test
    void shouldReadTypeAnnotations() throws Exception {
        // Given
        String source = """
            def scale(self, value: float, times: int = 2) -> float:
                return value * times
            """;

        // When
        FunctionSpec spec = analyzer.analyze(source).get(0);

        // Then
        assertThat(spec.arguments()).containsExactly(
                new ArgumentHint("value", "float"),
                new ArgumentHint("times", "int"));
        assertThat(spec.returnHint()).isEqualTo("float");
    }

    @Test
    void shouldFlagIoFunctions() throws Exception {
        // Given
        String source = """
            def dump(rows):
                for row in rows:
                    if row:
                        print(row)
            """;

        // When
        FunctionSpec spec = analyzer.analyze(source).get(0);

        // Then
        assertThat(spec.hasIo()).isTrue();
        assertThat(spec.recommendedTarget()).isEqualTo(TargetLanguage.INTERPRETED);
        assertThat(spec.justification()).contains("I/O");
    }

    @Test
    void shouldDetectCryptographicFunctions() throws Exception {
        // Given
        String source = """
            def fingerprint(data):
                return hashlib.sha256(data).hexdigest()
            """;

        // When
        FunctionSpec spec = analyzer.analyze(source).get(0);

        // Then
        assertThat(spec.cryptographic()).isTrue();
        assertThat(spec.recommendedTarget()).isEqualTo(TargetLanguage.MEMORY_SAFE_NATIVE);
    }

    @Test
    void shouldIgnoreKeywordsInsideStringsAndComments() throws Exception {
        // Given
        String source = """
            def greet(name):
                # for while if
                return "for " + name + " if while"
            """;

        // When
        FunctionSpec spec = analyzer.analyze(source).get(0);

        // Then
        assertThat(spec.complexity()).isEqualTo(1);
        assertThat(spec.hasLoops()).isFalse();
    }

    @Test
    void shouldReturnEmptyListForSourceWithoutFunctions() throws Exception {
        assertThat(analyzer.analyze("x = 1\nprint(x)\n")).isEmpty();
    }

    @Test
    void shouldFailWholeFileWhenHeaderIsMissingColon() {
        // Given
        String source = """
            def good(a):
                return a

            def broken(a)
                return a
            """;

        // When/Then
        assertThatThrownBy(() -> analyzer.analyze(source))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("line 4")
                .satisfies(e -> assertThat(((SourceParseException) e).line()).isEqualTo(4));
    }

    @Test
    void shouldFailOnUnbalancedBrackets() {
        // Given
        String source = """
            def total(values):
                return sum(values[0:2)
            """;

        // When/Then
        assertThatThrownBy(() -> analyzer.analyze(source))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Mismatched");
    }

    @Test
    void shouldFailOnFunctionWithoutBody() {
        assertThatThrownBy(() -> analyzer.analyze("def empty():\n\nx = 1\n"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("has no body");
    }

    static String fixture(String path) throws IOException {
        try (InputStream in = PythonAnalyzerTest.class.getResourceAsStream("/fixtures/" + path)) {
            if (in == null) {
                throw new IOException("Missing fixture " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
