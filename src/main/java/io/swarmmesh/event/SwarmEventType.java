package io.swarmmesh.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SwarmEventType {
    NODE_REGISTERED("node:registered"),
    NODE_CONNECTED("node:connected"),
    NODE_DISCONNECTED("node:disconnected"),
    AGENT_REGISTERED("agent:registered"),
    MESSAGE_SENT("message:sent"),
    MESSAGE_RECEIVED("message:received"),
    MESSAGE_FAILED("message:failed"),
    TASK_SUBMITTED("task:submitted"),
    TASK_ASSIGNED("task:assigned"),
    TASK_PROGRESS("task:progress"),
    TASK_COMPLETED("task:completed"),
    TASK_FAILED("task:failed"),
    TASK_CANCELLED("task:cancelled"),
    TASK_REASSIGNED("task:reassigned"),
    CONSENSUS_INITIATED("consensus:initiated"),
    CONSENSUS_REACHED("consensus:reached"),
    VOTE_CAST("vote:cast"),
    GOSSIP_STARTED("gossip:started"),
    METRICS_UPDATED("metrics:updated"),
    SHUTDOWN("shutdown");

    private final String wire;

    SwarmEventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
