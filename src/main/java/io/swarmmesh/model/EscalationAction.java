package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationAction {
    REASSIGN("reassign"),
    ADD_AGENTS("add_agents"),
    ESCALATE("escalate"),
    WARN("warn");

    private final String wire;

    EscalationAction(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static EscalationAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return REASSIGN;
        }
        for (EscalationAction value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown EscalationAction: " + raw);
    }
}
