package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    ONLINE,
    DEGRADED,
    OFFLINE;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
