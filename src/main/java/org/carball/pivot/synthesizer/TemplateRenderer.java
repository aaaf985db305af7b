package org.carball.pivot.synthesizer;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${name}} slots. Values are inserted verbatim and never rescanned, so a
 * value containing slot syntax is left alone.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\$\\{(\\w+)}");

    private TemplateRenderer() {
    }

    /**
     * @throws IllegalArgumentException if the template names a slot with no value
     */
    public static String render(String template, Map<String, String> values) {
        Set<String> missing = new TreeSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length() + 256);

        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                missing.add(name);
                matcher.appendReplacement(rendered, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
            }
        }
        matcher.appendTail(rendered);

        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unresolved template placeholders: " + missing);
        }
        return rendered.toString();
    }

    public static Set<String> placeholders(String template) {
        Set<String> names = new TreeSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
