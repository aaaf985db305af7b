package org.carball.pivot.registry;

import org.carball.pivot.analyzer.Analyzer;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.synthesizer.CodeGenerator;
import org.carball.pivot.synthesizer.ShimBridgeCodeGenerator;
import org.carball.pivot.validator.ParityValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ComponentRegistryTest {

    @Test
    void shouldRegisterBuiltInComponents() {
        // When
        ComponentRegistry registry = ComponentRegistry.defaults(new PipelineSettings());

        // Then
        assertThat(registry.analyzerNames()).containsExactly("javascript", "python", "ruby");
        assertThat(registry.codeGeneratorNames())
                .containsExactly("compiled-concurrent", "compiled-native", "memory-safe-native");
        assertThat(registry.validatorNames()).containsExactly(ParityValidator.NAME);
        assertThat(registry.analyzer(SourceLanguage.RUBY).language()).isEqualTo(SourceLanguage.RUBY);
        assertThat(registry.codeGenerator(TargetLanguage.COMPILED_NATIVE).name())
                .isEqualTo(ShimBridgeCodeGenerator.NAME);
    }

    @Test
    void shouldReplaceComponentRegisteredUnderSameName() {
        // Given
        ComponentRegistry registry = ComponentRegistry.defaults(new PipelineSettings());
        Analyzer custom = new Analyzer() {
            @Override
            public SourceLanguage language() {
                return SourceLanguage.PYTHON;
            }

            @Override
            public List<FunctionSpec> analyze(String sourceText) {
                return List.of();
            }
        };
        CodeGenerator translator = new CodeGenerator() {
            @Override
            public String name() {
                return "translator";
            }

            @Override
            public String translateBody(FunctionSpec spec, TargetLanguage target) {
                return "    return 0;";
            }
        };

        // When
        registry.registerAnalyzer(custom).registerCodeGenerator("compiled-native", translator);

        // Then
        assertThat(registry.analyzer("python")).isSameAs(custom);
        assertThat(registry.codeGenerator(TargetLanguage.COMPILED_NATIVE)).isSameAs(translator);
        assertThat(registry.analyzerNames()).hasSize(3);
    }

    @Test
    void shouldListAvailableNamesForUnknownComponent() {
        ComponentRegistry registry = ComponentRegistry.defaults(new PipelineSettings());

        assertThatThrownBy(() -> registry.analyzer("cobol"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown analyzer 'cobol'. Available: [javascript, python, ruby]");
        assertThatThrownBy(() -> registry.validator("fuzz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parity");
    }

    @Test
    void shouldRejectGeneratorForInterpretedOrUnknownTarget() {
        ComponentRegistry registry = new ComponentRegistry();
        ShimBridgeCodeGenerator generator = new ShimBridgeCodeGenerator();

        assertThatThrownBy(() -> registry.registerCodeGenerator("interpreted", generator))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not compiled");
        assertThatThrownBy(() -> registry.registerCodeGenerator("fortran", generator))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.codeGenerator(TargetLanguage.COMPILED_NATIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Available: []");
    }
}
