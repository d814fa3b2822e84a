package io.swarmmesh.runtime;

import io.swarmmesh.model.MessagePriority;

import java.util.Map;

public record CommunicationMetrics(
        String nodeId,
        int totalNodes,
        int onlineNodes,
        int degradedNodes,
        int offlineNodes,
        int queuedMessages,
        Map<MessagePriority, Integer> queueDepths,
        int historySize,
        int gossipStates,
        int activeConsensus,
        long messagesSent,
        long messagesReceived,
        long bytesTransferred,
        long errors,
        double networkHealth
) {
    public CommunicationMetrics {
        queueDepths = queueDepths == null ? Map.of() : Map.copyOf(queueDepths);
    }
}
