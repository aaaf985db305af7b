package org.carball.pivot.model.analysis;

import java.util.Locale;

/**
 * Scalar kinds recognized in type hints. Unknown argument hints are treated as integers;
 * unknown return hints stay dynamic and are passed through as raw JSON.
 */
public enum ValueKind {
    INT,
    FLOAT,
    STRING,
    BOOL,
    DYNAMIC;

    public static ValueKind fromHint(String hint) {
        if (hint == null) {
            return DYNAMIC;
        }
        return switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "int", "integer", "long", "i64" -> INT;
            case "float", "double", "number", "f64", "decimal" -> FLOAT;
            case "str", "string" -> STRING;
            case "bool", "boolean" -> BOOL;
            default -> DYNAMIC;
        };
    }

    public static ValueKind forArgument(String hint) {
        ValueKind kind = fromHint(hint);
        return kind == DYNAMIC ? INT : kind;
    }

    public static ValueKind forReturn(String hint) {
        return fromHint(hint);
    }
}
