package io.swarmmesh.runtime;

import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.RoutingException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.Message;
import io.swarmmesh.routing.MessageTransport;
import io.swarmmesh.security.PayloadCrypto;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class InMemoryNetwork implements MessageTransport {
    private final Map<String, SwarmRuntime> members = new LinkedHashMap<>();
    private final Set<String> isolated = new HashSet<>();
    private final PayloadCrypto crypto;
    private long deliveries;
    private long dropped;

    public InMemoryNetwork() {
        this(PayloadCrypto.inMemory());
    }

    public InMemoryNetwork(PayloadCrypto crypto) {
        this.crypto = crypto;
    }

    public SwarmRuntime join(String nodeId, SwarmSettings settings, SwarmPolicies policies, long startMs) {
        if (members.containsKey(nodeId)) {
            throw new IllegalArgumentException("Node " + nodeId + " already joined");
        }
        SwarmRuntime runtime = new SwarmRuntime(nodeId, settings, this, crypto, policies, new SwarmEventBus(), startMs);
        for (SwarmRuntime existing : members.values()) {
            existing.registerNode(CommunicationNode.of(nodeId, SwarmRuntime.DEFAULT_ADDRESS, 0));
            runtime.registerNode(CommunicationNode.of(existing.nodeId(), SwarmRuntime.DEFAULT_ADDRESS, 0));
        }
        members.put(nodeId, runtime);
        return runtime;
    }

    @Override
    public void deliver(String targetNodeId, Message message) {
        SwarmRuntime target = members.get(targetNodeId);
        if (target == null) {
            dropped++;
            throw new RoutingException("No member " + targetNodeId + " in the network");
        }
        if (isolated.contains(targetNodeId) || isolated.contains(message.sender())) {
            dropped++;
            throw new RoutingException("Link between " + message.sender() + " and " + targetNodeId + " is down");
        }
        deliveries++;
        target.receive(message);
    }

    public void isolate(String nodeId) {
        isolated.add(nodeId);
    }

    public void heal(String nodeId) {
        isolated.remove(nodeId);
    }

    public void advanceAll(long nowMs) {
        for (SwarmRuntime runtime : List.copyOf(members.values())) {
            runtime.advance(nowMs);
        }
    }

    public void runUntil(long fromMs, long toMs, long stepMs) {
        long step = Math.max(1L, stepMs);
        for (long t = fromMs; t <= toMs; t += step) {
            advanceAll(t);
        }
    }

    public Optional<SwarmRuntime> member(String nodeId) {
        return Optional.ofNullable(members.get(nodeId));
    }

    public Collection<SwarmRuntime> members() {
        return new ArrayList<>(members.values());
    }

    public PayloadCrypto crypto() {
        return crypto;
    }

    public long deliveries() {
        return deliveries;
    }

    public long dropped() {
        return dropped;
    }

    public void shutdownAll() {
        for (SwarmRuntime runtime : members.values()) {
            runtime.shutdown();
        }
    }
}
