package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RoutingStrategy {
    DIRECT("direct"),
    RELAY("relay"),
    MULTIPATH("multipath"),
    ADAPTIVE("adaptive");

    private final String wire;

    RoutingStrategy(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static RoutingStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ADAPTIVE;
        }
        for (RoutingStrategy value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown RoutingStrategy: " + raw);
    }
}
