package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReliabilityMode {
    BEST_EFFORT("best-effort"),
    AT_LEAST_ONCE("at-least-once"),
    EXACTLY_ONCE("exactly-once");

    private final String wire;

    ReliabilityMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ReliabilityMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AT_LEAST_ONCE;
        }
        for (ReliabilityMode value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ReliabilityMode: " + raw);
    }
}
