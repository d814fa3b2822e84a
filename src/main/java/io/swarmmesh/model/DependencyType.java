package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyType {
    BLOCKING("blocking"),
    SOFT("soft"),
    DATA("data"),
    RESOURCE("resource");

    private final String wire;

    DependencyType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static DependencyType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOCKING;
        }
        for (DependencyType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown DependencyType: " + raw);
    }
}
