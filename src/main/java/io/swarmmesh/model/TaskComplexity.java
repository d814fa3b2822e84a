package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskComplexity {
    TRIVIAL("trivial"),
    SIMPLE("simple"),
    MODERATE("moderate"),
    COMPLEX("complex"),
    EXPERT("expert");

    private final String wire;

    TaskComplexity(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static TaskComplexity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SIMPLE;
        }
        for (TaskComplexity value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown TaskComplexity: " + raw);
    }
}
