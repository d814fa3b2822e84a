package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AvailabilityStatus {
    AVAILABLE("available"),
    BUSY("busy"),
    MAINTENANCE("maintenance"),
    OFFLINE("offline");

    private final String wire;

    AvailabilityStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static AvailabilityStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AVAILABLE;
        }
        for (AvailabilityStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown AvailabilityStatus: " + raw);
    }
}
