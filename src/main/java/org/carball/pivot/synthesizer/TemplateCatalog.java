package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Program templates keyed by target and shim templates keyed by source language.
 */
public class TemplateCatalog {

    private final Map<TargetLanguage, String> programs = new EnumMap<>(TargetLanguage.class);
    private final Map<SourceLanguage, String> shims = new EnumMap<>(SourceLanguage.class);

    public static TemplateCatalog defaults() {
        TemplateCatalog catalog = new TemplateCatalog();
        catalog.registerProgram(TargetLanguage.COMPILED_CONCURRENT, VesselTemplate.GO_PROGRAM);
        catalog.registerProgram(TargetLanguage.COMPILED_NATIVE, VesselTemplate.CPP_PROGRAM);
        catalog.registerProgram(TargetLanguage.MEMORY_SAFE_NATIVE, VesselTemplate.RUST_PROGRAM);
        catalog.registerShim(SourceLanguage.PYTHON, VesselTemplate.PYTHON_SHIM);
        catalog.registerShim(SourceLanguage.RUBY, VesselTemplate.RUBY_SHIM);
        catalog.registerShim(SourceLanguage.JAVASCRIPT, VesselTemplate.JAVASCRIPT_SHIM);
        return catalog;
    }

    public TemplateCatalog registerProgram(TargetLanguage target, String template) {
        if (!target.isCompiled()) {
            throw new IllegalArgumentException("Target '" + target.getId() + "' is not compiled");
        }
        programs.put(target, template);
        return this;
    }

    public TemplateCatalog registerShim(SourceLanguage language, String template) {
        shims.put(language, template);
        return this;
    }

    public String programFor(TargetLanguage target) {
        String template = programs.get(target);
        if (template == null) {
            throw new IllegalArgumentException("No program template for target '" + target.getId() +
                    "'. Available targets: " + programs.keySet().stream().map(TargetLanguage::getId).toList());
        }
        return template;
    }

    public String shimFor(SourceLanguage language) {
        String template = shims.get(language);
        if (template == null) {
            throw new IllegalArgumentException("No shim template for language '" + language.getId() + "'");
        }
        return template;
    }
}
