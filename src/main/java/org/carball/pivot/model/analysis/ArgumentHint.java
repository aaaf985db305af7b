package org.carball.pivot.model.analysis;

public record ArgumentHint(String name, String typeHint) {

    public static final String UNKNOWN_TYPE = "any";

    public static ArgumentHint untyped(String name) {
        return new ArgumentHint(name, UNKNOWN_TYPE);
    }
}
