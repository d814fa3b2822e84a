package io.swarmmesh.routing;

import io.swarmmesh.error.RoutingException;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.util.Jsons;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RoutingEngine {
    private static final StructuredLogger LOG = StructuredLogger.of(RoutingEngine.class);

    private final NodeRegistry registry;
    private final MessageTransport transport;

    public RoutingEngine(NodeRegistry registry, MessageTransport transport) {
        this.registry = registry;
        this.transport = transport;
    }

    public void forward(Message message, String targetNodeId, long nowMs) {
        if (!registry.contains(targetNodeId)) {
            throw new RoutingException("Target node " + targetNodeId + " is unknown");
        }
        // Heartbeats are the liveness probe, so they still go to nodes that look offline.
        if (message.type() != MessageType.HEARTBEAT
                && registry.statusOf(targetNodeId, nowMs) == NodeStatus.OFFLINE) {
            registry.recordError(targetNodeId);
            throw new RoutingException("Target node " + targetNodeId + " is offline");
        }
        try {
            transport.deliver(targetNodeId, message);
        } catch (RuntimeException e) {
            registry.recordError(targetNodeId);
            throw e instanceof RoutingException re
                    ? re
                    : new RoutingException("Delivery to " + targetNodeId + " failed: " + e.getMessage(), e);
        }
        registry.recordSent(targetNodeId, sizeOf(message));
    }

    public void broadcast(Message message, BroadcastTree tree, long nowMs) {
        List<String> unreachable = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(tree.root());
        traverse(message, tree, tree.root(), visited, unreachable, nowMs);
        if (!unreachable.isEmpty()) {
            throw new BroadcastException(message.id(), unreachable);
        }
    }

    public void multicast(Message message, long nowMs) {
        List<String> unreachable = new ArrayList<>();
        for (String recipient : message.recipients()) {
            try {
                forward(message, recipient, nowMs);
            } catch (RoutingException e) {
                unreachable.add(recipient);
                LOG.debug("Multicast leg failed", StructuredLogger.fields(
                        "messageId", message.id(),
                        "recipient", recipient,
                        "error", e.getMessage()
                ));
            }
        }
        if (!unreachable.isEmpty()) {
            throw new BroadcastException(message.id(), unreachable);
        }
    }

    public void unicast(Message message, Map<String, List<String>> routingTable, long nowMs) {
        if (message.recipients().size() != 1) {
            throw new ValidationException("Unicast message " + message.id() + " requires exactly one recipient, got "
                    + message.recipients().size());
        }
        routeVia(message, message.recipients().get(0), routingTable, nowMs);
    }

    public void routed(Message message, Map<String, List<String>> routingTable, long nowMs) {
        List<String> unreachable = new ArrayList<>();
        for (String recipient : message.recipients()) {
            try {
                routeVia(message, recipient, routingTable, nowMs);
            } catch (RoutingException e) {
                unreachable.add(recipient);
            }
        }
        if (!unreachable.isEmpty()) {
            throw new BroadcastException(message.id(), unreachable);
        }
    }

    private void routeVia(Message message, String recipient, Map<String, List<String>> routingTable, long nowMs) {
        List<String> route = routingTable.get(recipient);
        if (route == null || route.isEmpty()) {
            throw new RoutingException("No route to " + recipient);
        }
        forward(message, route.get(0), nowMs);
    }

    private void traverse(Message message, BroadcastTree tree, String nodeId, Set<String> visited,
                          List<String> unreachable, long nowMs) {
        for (String child : tree.childrenOf(nodeId)) {
            if (!visited.add(child) || !registry.contains(child)) {
                continue;
            }
            try {
                forward(message, child, nowMs);
            } catch (RoutingException e) {
                unreachable.add(child);
            }
            traverse(message, tree, child, visited, unreachable, nowMs);
        }
    }

    private static long sizeOf(Message message) {
        return Jsons.toCompactJson(message.payload().data()).length();
    }

    public static final class BroadcastException extends RoutingException {
        private final List<String> unreachable;

        public BroadcastException(String messageId, List<String> unreachable) {
            super("Message " + messageId + " could not reach " + unreachable);
            this.unreachable = List.copyOf(unreachable);
        }

        public List<String> unreachable() {
            return unreachable;
        }
    }
}
