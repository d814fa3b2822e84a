package io.swarmmesh.registry;

import io.swarmmesh.error.ValidationException;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.NodeView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class NodeRegistry {
    private final String localNodeId;
    private final long heartbeatIntervalMs;
    private final Map<String, TrackedNode> nodes = new LinkedHashMap<>();

    public NodeRegistry(String localNodeId, long heartbeatIntervalMs) {
        this.localNodeId = localNodeId;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public static NodeStatus deriveStatus(long lastSeenMs, long nowMs, long heartbeatIntervalMs) {
        long elapsed = nowMs - lastSeenMs;
        if (elapsed > 3L * heartbeatIntervalMs) {
            return NodeStatus.OFFLINE;
        }
        if (elapsed > 2L * heartbeatIntervalMs) {
            return NodeStatus.DEGRADED;
        }
        return NodeStatus.ONLINE;
    }

    public String localNodeId() {
        return localNodeId;
    }

    public boolean register(CommunicationNode node, long nowMs) {
        if (node == null || node.id() == null || node.id().isBlank()) {
            throw new ValidationException("node id is required");
        }
        if (node.id().equals(localNodeId)) {
            throw new ValidationException("cannot register the local node " + localNodeId + " as a peer");
        }
        TrackedNode existing = nodes.get(node.id());
        if (existing != null) {
            existing.node = node;
            existing.lastSeenMs = nowMs;
            existing.disconnected = false;
            return false;
        }
        nodes.put(node.id(), new TrackedNode(node, nowMs));
        return true;
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean markSeen(String nodeId, long nowMs) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked == null) {
            return false;
        }
        tracked.lastSeenMs = Math.max(tracked.lastSeenMs, nowMs);
        return true;
    }

    public boolean connect(String nodeId, long nowMs) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked == null) {
            return false;
        }
        tracked.disconnected = false;
        tracked.lastSeenMs = Math.max(tracked.lastSeenMs, nowMs);
        return true;
    }

    public boolean disconnect(String nodeId) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked == null) {
            return false;
        }
        tracked.disconnected = true;
        return true;
    }

    public NodeStatus statusOf(String nodeId, long nowMs) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked == null || tracked.disconnected) {
            return NodeStatus.OFFLINE;
        }
        return deriveStatus(tracked.lastSeenMs, nowMs, heartbeatIntervalMs);
    }

    public Optional<NodeView> find(String nodeId, long nowMs) {
        TrackedNode tracked = nodes.get(nodeId);
        return tracked == null ? Optional.empty() : Optional.of(view(tracked, nowMs));
    }

    public Optional<CommunicationNode> node(String nodeId) {
        TrackedNode tracked = nodes.get(nodeId);
        return tracked == null ? Optional.empty() : Optional.of(tracked.node);
    }

    public List<String> peerIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<String> reachablePeerIds(long nowMs) {
        List<String> out = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (statusOf(id, nowMs) != NodeStatus.OFFLINE) {
                out.add(id);
            }
        }
        return out;
    }

    public List<String> connectedPeerIds() {
        List<String> out = new ArrayList<>();
        for (TrackedNode tracked : nodes.values()) {
            if (!tracked.disconnected) {
                out.add(tracked.node.id());
            }
        }
        return out;
    }

    public void recordSent(String nodeId, long bytes) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked != null) {
            tracked.messagesSent++;
            tracked.bytesTransferred += bytes;
        }
    }

    public void recordReceived(String nodeId, long bytes) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked != null) {
            tracked.messagesReceived++;
            tracked.bytesTransferred += bytes;
        }
    }

    public void recordError(String nodeId) {
        TrackedNode tracked = nodes.get(nodeId);
        if (tracked != null) {
            tracked.errors++;
        }
    }

    public List<NodeView> snapshot(long nowMs) {
        List<NodeView> out = new ArrayList<>(nodes.size());
        for (TrackedNode tracked : nodes.values()) {
            out.add(view(tracked, nowMs));
        }
        return out;
    }

    public double networkHealth(long nowMs) {
        if (nodes.isEmpty()) {
            return 1.0;
        }
        long online = nodes.keySet().stream()
                .filter(id -> statusOf(id, nowMs) == NodeStatus.ONLINE)
                .count();
        return (double) online / nodes.size();
    }

    private NodeView view(TrackedNode tracked, long nowMs) {
        long attempts = tracked.messagesSent + tracked.messagesReceived + tracked.errors;
        double errorRate = attempts == 0L ? 0.0 : (double) tracked.errors / attempts;
        return new NodeView(
                tracked.node.id(),
                tracked.node.address(),
                tracked.node.port(),
                statusOf(tracked.node.id(), nowMs),
                tracked.disconnected,
                tracked.lastSeenMs,
                tracked.messagesSent,
                tracked.messagesReceived,
                tracked.bytesTransferred,
                tracked.errors,
                errorRate
        );
    }

    private static final class TrackedNode {
        private CommunicationNode node;
        private long lastSeenMs;
        private boolean disconnected;
        private long messagesSent;
        private long messagesReceived;
        private long bytesTransferred;
        private long errors;

        private TrackedNode(CommunicationNode node, long lastSeenMs) {
            this.node = node;
            this.lastSeenMs = lastSeenMs;
        }
    }
}
