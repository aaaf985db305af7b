package org.carball.pivot.registry;

import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.analyzer.Analyzer;
import org.carball.pivot.analyzer.JavaScriptAnalyzer;
import org.carball.pivot.analyzer.PythonAnalyzer;
import org.carball.pivot.analyzer.RubyAnalyzer;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.synthesizer.CodeGenerator;
import org.carball.pivot.synthesizer.ShimBridgeCodeGenerator;
import org.carball.pivot.validator.ParityValidator;
import org.carball.pivot.validator.RegressionInputStore;
import org.carball.pivot.validator.Validator;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named analyzers, code generators and validators. Each pipeline builds its own registry,
 * usually through {@link #defaults(PipelineSettings)}, and may replace entries before use.
 */
@Slf4j
public class ComponentRegistry {

    private final Map<String, Analyzer> analyzers = new ConcurrentHashMap<>();
    private final Map<String, CodeGenerator> codeGenerators = new ConcurrentHashMap<>();
    private final Map<String, Validator> validators = new ConcurrentHashMap<>();

    /**
     * Registers the built-in analyzers, the shim-bridge generator for every compiled target
     * and the parity validator.
     */
    public static ComponentRegistry defaults(PipelineSettings settings) {
        int loops = settings.getLoopComplexityThreshold();
        int math = settings.getMathOperationThreshold();

        ComponentRegistry registry = new ComponentRegistry()
                .registerAnalyzer(new PythonAnalyzer(loops, math))
                .registerAnalyzer(new JavaScriptAnalyzer(loops, math))
                .registerAnalyzer(new RubyAnalyzer(loops, math))
                .registerValidator(new ParityValidator(settings.getValidation(),
                        new RegressionInputStore(settings.regressionInputPath())));

        CodeGenerator bridge = new ShimBridgeCodeGenerator();
        for (TargetLanguage target : TargetLanguage.values()) {
            if (target.isCompiled()) {
                registry.registerCodeGenerator(target.getId(), bridge);
            }
        }
        return registry;
    }

    public ComponentRegistry registerAnalyzer(Analyzer analyzer) {
        register(analyzers, "analyzer", analyzer.language().getId(), analyzer);
        return this;
    }

    public ComponentRegistry registerCodeGenerator(String targetId, CodeGenerator generator) {
        TargetLanguage target = TargetLanguage.fromId(targetId);
        if (!target.isCompiled()) {
            throw new IllegalArgumentException("Target " + targetId + " is not compiled and takes no code generator");
        }
        register(codeGenerators, "code generator", target.getId(), generator);
        return this;
    }

    public ComponentRegistry registerValidator(Validator validator) {
        register(validators, "validator", validator.name(), validator);
        return this;
    }

    public Analyzer analyzer(SourceLanguage language) {
        return analyzer(language.getId());
    }

    public Analyzer analyzer(String languageId) {
        return lookup(analyzers, "analyzer", languageId);
    }

    public CodeGenerator codeGenerator(TargetLanguage target) {
        return lookup(codeGenerators, "code generator", target.getId());
    }

    public Validator validator(String name) {
        return lookup(validators, "validator", name);
    }

    public Set<String> analyzerNames() {
        return new TreeMap<>(analyzers).keySet();
    }

    public Set<String> codeGeneratorNames() {
        return new TreeMap<>(codeGenerators).keySet();
    }

    public Set<String> validatorNames() {
        return new TreeMap<>(validators).keySet();
    }

    private static <T> void register(Map<String, T> components, String kind, String name, T component) {
        T previous = components.put(name, component);
        if (previous != null && previous != component) {
            log.info("Replaced {} '{}'", kind, name);
        } else {
            log.debug("Registered {} '{}'", kind, name);
        }
    }

    private static <T> T lookup(Map<String, T> components, String kind, String name) {
        T component = name != null ? components.get(name) : null;
        if (component == null) {
            throw new IllegalArgumentException("Unknown " + kind + " '" + name + "'. Available: "
                    + new TreeMap<>(components).keySet());
        }
        return component;
    }
}
