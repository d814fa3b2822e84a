package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CoordinationMode {
    CENTRALIZED("centralized"),
    DISTRIBUTED("distributed"),
    HIERARCHICAL("hierarchical"),
    PEER_TO_PEER("peer-to-peer");

    private final String wire;

    CoordinationMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static CoordinationMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CENTRALIZED;
        }
        for (CoordinationMode value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown CoordinationMode: " + raw);
    }
}
