package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProposalType {
    VALUE("value"),
    LEADER("leader"),
    CONFIGURATION("configuration");

    private final String wire;

    ProposalType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ProposalType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return VALUE;
        }
        for (ProposalType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ProposalType: " + raw);
    }
}
