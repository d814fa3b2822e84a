package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CancellationReason {
    USER_REQUEST("user-request"),
    TIMEOUT("timeout"),
    RESOURCE_UNAVAILABLE("resource-unavailable"),
    DEPENDENCY_FAILURE("dependency-failure"),
    PRIORITY_OVERRIDE("priority-override"),
    SYSTEM_SHUTDOWN("system-shutdown"),
    AGENT_FAILURE("agent-failure"),
    TASK_STUCK("task_stuck"),
    NO_PROGRESS("no_progress"),
    AGENT_UNAVAILABLE("agent_unavailable"),
    REBALANCE("rebalance");

    private final String wire;

    CancellationReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static CancellationReason fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER_REQUEST;
        }
        for (CancellationReason value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown CancellationReason: " + raw);
    }
}
