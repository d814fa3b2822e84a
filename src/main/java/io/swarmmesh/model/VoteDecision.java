package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VoteDecision {
    ACCEPT("accept"),
    REJECT("reject"),
    ABSTAIN("abstain");

    private final String wire;

    VoteDecision(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static VoteDecision fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ABSTAIN;
        }
        for (VoteDecision value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown VoteDecision: " + raw);
    }
}
