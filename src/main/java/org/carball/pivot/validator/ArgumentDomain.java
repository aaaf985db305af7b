package org.carball.pivot.validator;

import org.carball.pivot.config.ValidationSettings;
import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.ValueKind;

/**
 * Value range for one argument. {@code min} and {@code max} apply to numeric kinds only.
 */
public record ArgumentDomain(ValueKind kind, double min, double max) {

    static final int LONG_STRING_LENGTH = 256;

    public ArgumentDomain {
        if (min > max) {
            throw new IllegalArgumentException("Domain minimum " + min + " exceeds maximum " + max);
        }
    }

    public static ArgumentDomain of(ArgumentHint argument, ValidationSettings settings) {
        ValueKind kind = ValueKind.forArgument(argument.typeHint());
        return switch (kind) {
            case FLOAT -> new ArgumentDomain(kind, settings.getFloatDomainMin(), settings.getFloatDomainMax());
            case STRING, BOOL -> new ArgumentDomain(kind, 0, 0);
            default -> new ArgumentDomain(ValueKind.INT, settings.getIntDomainMin(), settings.getIntDomainMax());
        };
    }

    public static ArgumentDomain integers(long min, long max) {
        return new ArgumentDomain(ValueKind.INT, min, max);
    }

    public static ArgumentDomain floats(double min, double max) {
        return new ArgumentDomain(ValueKind.FLOAT, min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
