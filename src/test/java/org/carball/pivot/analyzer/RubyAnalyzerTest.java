package org.carball.pivot.analyzer;

import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RubyAnalyzerTest {

    private RubyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RubyAnalyzer();
    }

    @Test
    void shouldLocateDefinitionsInFixture() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(PythonAnalyzerTest.fixture("ruby/slow_processing.rb"));

        // Then
        assertThat(functions).extracting(FunctionSpec::name)
                .containsExactly("batch_process", "crypto_operation", "io_heavy_task");

        assertThat(functions.get(0).startLine()).isEqualTo(4);
        assertThat(functions.get(0).lineCount()).isEqualTo(4);
        assertThat(functions.get(0).recommendedTarget()).isEqualTo(TargetLanguage.INTERPRETED);
    }

    @Test
    void shouldRecommendMemorySafeTargetForDigestCalls() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(PythonAnalyzerTest.fixture("ruby/slow_processing.rb"));

        // Then
        FunctionSpec crypto = functions.get(1);
        assertThat(crypto.cryptographic()).isTrue();
        assertThat(crypto.recommendedTarget()).isEqualTo(TargetLanguage.MEMORY_SAFE_NATIVE);
    }

    @Test
    void shouldTreatBlockIteratorsAsLoops() throws Exception {
        // When
        List<FunctionSpec> functions = analyzer.analyze(PythonAnalyzerTest.fixture("ruby/slow_processing.rb"));

        // Then
        FunctionSpec task = functions.get(2);
        assertThat(task.hasLoops()).isTrue();
        assertThat(task.complexity()).isEqualTo(2);
        assertThat(task.lineCount()).isEqualTo(8);
    }

    @Test
    void shouldHandleNestedBlocksAndModifiers() throws Exception {
        // Given
        String source = """
            class Counter
              def count_positive(values)
                total = 0
                values.each do |v|
                  total += 1 if v > 0
                end
                while total > 100
                  total -= 1
                end
                total
              end

              def self.zero? = true
            end
            """;

        // When
        List<FunctionSpec> functions = analyzer.analyze(source);

        // Then
        assertThat(functions).extracting(FunctionSpec::name)
                .containsExactly("count_positive", "zero?");
        assertThat(functions.get(0).lineCount()).isEqualTo(10);
        assertThat(functions.get(0).complexity()).isEqualTo(4);
        assertThat(functions.get(1).lineCount()).isEqualTo(1);
    }

    @Test
    void shouldDetectRecursion() throws Exception {
        // Given
        String source = """
            def fib(n)
              return n if n < 2
              fib(n - 1) + fib(n - 2)
            end
            """;

        // When
        FunctionSpec spec = analyzer.analyze(source).get(0);

        // Then
        assertThat(spec.hasRecursion()).isTrue();
        assertThat(spec.argumentNames()).containsExactly("n");
    }

    @Test
    void shouldFailOnMissingEnd() {
        // Given
        String source = """
            def first(a)
              a
            end

            def second(b)
              b.times do |i|
                puts i
              end
            """;

        // When/Then
        assertThatThrownBy(() -> analyzer.analyze(source))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Missing 'end' for def second")
                .hasMessageContaining("line 5");
    }

    @Test
    void shouldFailOnUnexpectedEnd() {
        assertThatThrownBy(() -> analyzer.analyze("def a\n  1\nend\nend\n"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Unexpected 'end'")
                .hasMessageContaining("line 4");
    }
}
