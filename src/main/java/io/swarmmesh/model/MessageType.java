package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    BROADCAST("broadcast"),
    MULTICAST("multicast"),
    UNICAST("unicast"),
    GOSSIP("gossip"),
    HEARTBEAT("heartbeat"),
    CONSENSUS("consensus"),
    ELECTION("election"),
    COORDINATION("coordination"),
    DATA("data"),
    CONTROL("control"),
    EMERGENCY("emergency");

    private final String wire;

    MessageType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DATA;
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown MessageType: " + raw);
    }
}
