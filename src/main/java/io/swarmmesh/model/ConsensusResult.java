package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConsensusResult {
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String wire;

    ConsensusResult(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ConsensusResult fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return REJECTED;
        }
        for (ConsensusResult value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ConsensusResult: " + raw);
    }
}
