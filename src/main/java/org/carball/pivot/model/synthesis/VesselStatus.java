package org.carball.pivot.model.synthesis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VesselStatus {
    COMPILED("Compiled"),
    CACHED("Cached"),
    INTERPRETED_FALLBACK("InterpretedFallback"),
    ERROR("Error");

    private final String label;

    VesselStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * True when the vessel has a native binary that can be executed.
     */
    public boolean hasBinary() {
        return this == COMPILED || this == CACHED;
    }

    @JsonCreator
    public static VesselStatus fromLabel(String label) {
        for (VesselStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown vessel status: " + label);
    }
}
