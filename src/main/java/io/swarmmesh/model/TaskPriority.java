package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    CRITICAL("critical", 5, 1.0),
    URGENT("urgent", 4, 0.8),
    HIGH("high", 3, 0.6),
    NORMAL("normal", 2, 0.4),
    LOW("low", 1, 0.2);

    private final String wire;
    private final int queueWeight;
    private final double allocationWeight;

    TaskPriority(String wire, int queueWeight, double allocationWeight) {
        this.wire = wire;
        this.queueWeight = queueWeight;
        this.allocationWeight = allocationWeight;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public int queueWeight() {
        return queueWeight;
    }

    public double allocationWeight() {
        return allocationWeight;
    }

    @JsonCreator
    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (TaskPriority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + raw);
    }
}
