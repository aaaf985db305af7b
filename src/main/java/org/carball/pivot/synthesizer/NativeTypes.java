package org.carball.pivot.synthesizer;

import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.SourceLanguage;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.analysis.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Naming and type mapping shared by templates and code generators.
 */
public final class NativeTypes {

    private static final Set<String> RESERVED = Set.of("main", "fail", "emit", "run_shim", "runShim");

    private NativeTypes() {
    }

    public static String typeName(ValueKind kind, TargetLanguage target) {
        return switch (target) {
            case COMPILED_CONCURRENT -> switch (kind) {
                case INT -> "int64";
                case FLOAT -> "float64";
                case STRING -> "string";
                case BOOL -> "bool";
                case DYNAMIC -> "json.RawMessage";
            };
            case COMPILED_NATIVE -> switch (kind) {
                case INT -> "long long";
                case FLOAT -> "double";
                case STRING -> "std::string";
                case BOOL -> "bool";
                case DYNAMIC -> "RawJson";
            };
            case MEMORY_SAFE_NATIVE -> switch (kind) {
                case INT -> "i64";
                case FLOAT -> "f64";
                case STRING -> "String";
                case BOOL -> "bool";
                case DYNAMIC -> "RawJson";
            };
            case INTERPRETED -> throw new IllegalArgumentException("Interpreted target has no native types");
        };
    }

    public static String argumentName(int index) {
        return "arg" + index;
    }

    /**
     * Function name usable in every target: non-identifier characters become underscores.
     */
    public static String identifier(String functionName) {
        String identifier = functionName.replaceAll("[^A-Za-z0-9_]", "_");
        if (identifier.isEmpty() || Character.isDigit(identifier.charAt(0))) {
            identifier = "f_" + identifier;
        }
        return RESERVED.contains(identifier) ? identifier + "_fn" : identifier;
    }

    public static String parameters(List<ArgumentHint> arguments, TargetLanguage target) {
        List<String> parameters = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            String type = typeName(ValueKind.forArgument(arguments.get(i).typeHint()), target);
            String name = argumentName(i);
            parameters.add(switch (target) {
                case COMPILED_CONCURRENT -> name + " " + type;
                case COMPILED_NATIVE -> type + " " + name;
                default -> name + ": " + type;
            });
        }
        return String.join(", ", parameters);
    }

    public static String callArguments(int count) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            names.add(argumentName(i));
        }
        return String.join(", ", names);
    }

    /**
     * Statements in {@code main} converting command-line strings to typed locals.
     */
    public static String argumentParsing(List<ArgumentHint> arguments, TargetLanguage target) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            ValueKind kind = ValueKind.forArgument(arguments.get(i).typeHint());
            String name = argumentName(i);
            String suffix = switch (kind) {
                case FLOAT -> "float";
                case STRING -> "string";
                case BOOL -> "bool";
                default -> "int";
            };
            lines.add(switch (target) {
                case COMPILED_CONCURRENT -> "    " + name + " := parse"
                        + Character.toUpperCase(suffix.charAt(0)) + suffix.substring(1) + "(args[" + i + "])";
                case COMPILED_NATIVE -> "    " + typeName(kind, target) + " " + name
                        + " = parse_" + suffix + "(argv[" + (i + 1) + "]);";
                default -> "    let " + name + ": " + typeName(kind, target) + " = parse_arg(&args[" + i + "]);";
            });
        }
        return String.join("\n", lines);
    }

    /**
     * Comma-separated string literals, valid in Go, C++ and Rust.
     */
    public static String stringLiterals(List<String> values) {
        return values.stream()
                .map(value -> "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(", "));
    }

    /**
     * Converter expressions turning shim argv strings into interpreter values.
     */
    public static String shimConverters(List<ArgumentHint> arguments, SourceLanguage language) {
        return arguments.stream()
                .map(argument -> converter(ValueKind.forArgument(argument.typeHint()), language))
                .collect(Collectors.joining(", "));
    }

    private static String converter(ValueKind kind, SourceLanguage language) {
        return switch (language) {
            case PYTHON -> switch (kind) {
                case FLOAT -> "float";
                case STRING -> "str";
                case BOOL -> "_to_bool";
                default -> "int";
            };
            case RUBY -> switch (kind) {
                case FLOAT -> "->(s) { Float(s) }";
                case STRING -> "->(s) { s }";
                case BOOL -> "->(s) { %w[1 true yes].include?(s.downcase) }";
                default -> "->(s) { Integer(s) }";
            };
            case JAVASCRIPT -> switch (kind) {
                case FLOAT -> "(s) => parseFloat(s)";
                case STRING -> "(s) => s";
                case BOOL -> "(s) => ['1', 'true', 'yes'].includes(s.toLowerCase())";
                default -> "(s) => parseInt(s, 10)";
            };
        };
    }
}
