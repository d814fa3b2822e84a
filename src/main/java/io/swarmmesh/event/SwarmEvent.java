package io.swarmmesh.event;

public interface SwarmEvent {
    SwarmEventType type();

    String nodeId();
}
