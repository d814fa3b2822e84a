package io.swarmmesh.routing;

import io.swarmmesh.model.MessagePriority;

import java.util.List;
import java.util.Map;

public record RoutingInfo(
        String nodeId,
        BroadcastTree broadcastTree,
        Map<String, List<String>> routingTable,
        Map<MessagePriority, Integer> queueDepths,
        int historySize
) {
}
