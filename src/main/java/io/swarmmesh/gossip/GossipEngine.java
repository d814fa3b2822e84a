package io.swarmmesh.gossip;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.error.RoutingException;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.GossipState;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageDraft;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.routing.MessageRouter;
import io.swarmmesh.routing.RoutingEngine;
import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.LongSupplier;

public final class GossipEngine {
    private static final StructuredLogger LOG = StructuredLogger.of(GossipEngine.class);
    static final String STATE_UPDATE = "state_update";

    private final String localNodeId;
    private final MessageRouter router;
    private final NodeRegistry registry;
    private final Random random;
    private final int fanout;
    private final SwarmEventBus bus;
    private final LongSupplier clock;
    private final Map<String, GossipState> states = new LinkedHashMap<>();

    public GossipEngine(String localNodeId, MessageRouter router, NodeRegistry registry, Random random, int fanout,
                        SwarmEventBus bus, LongSupplier clock) {
        this.localNodeId = localNodeId;
        this.router = router;
        this.registry = registry;
        this.random = random;
        this.fanout = Math.max(1, fanout);
        this.bus = bus;
        this.clock = clock;
    }

    public GossipState startGossip(String key, Object data) {
        long now = clock.getAsLong();
        GossipState current = states.get(key);
        long version = current == null ? now : Math.max(now, current.version() + 1L);
        return startGossip(key, data, version);
    }

    public GossipState startGossip(String key, Object data, long version) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("gossip key is required");
        }
        GossipState current = states.get(key);
        if (current != null && version <= current.version()) {
            throw new ValidationException("gossip version for " + key + " must exceed " + current.version()
                    + ", got " + version);
        }
        JsonNode tree = Jsons.toTree(data);
        GossipState state = new GossipState(version, tree, clock.getAsLong(), checksumOf(tree));
        states.put(key, state);
        bus.publish(new SwarmEvents.GossipStarted(localNodeId, key, version));
        propagate(key, state, selectTargets());
        return state;
    }

    public int performRound() {
        if (states.isEmpty()) {
            return 0;
        }
        List<String> targets = selectTargets();
        if (targets.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (Map.Entry<String, GossipState> entry : states.entrySet()) {
            sent += propagate(entry.getKey(), entry.getValue(), targets);
        }
        return sent;
    }

    public boolean handleStateUpdate(String key, GossipState incoming) {
        GossipState current = states.get(key);
        if (current != null && incoming.version() <= current.version()) {
            return false;
        }
        states.put(key, incoming);
        LOG.debug("Gossip state adopted", StructuredLogger.fields(
                "gossipKey", key,
                "version", incoming.version()
        ));
        return true;
    }

    public void onMessage(Message message) {
        JsonNode data = message.payload().data();
        if (!STATE_UPDATE.equals(data.path("type").asText(""))) {
            return;
        }
        String key = data.path("key").asText("");
        GossipState incoming;
        try {
            incoming = Jsons.mapper().treeToValue(data.path("state"), GossipState.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Ignoring malformed gossip state", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender(),
                    "error", e.getMessage()
            ));
            return;
        }
        if (key.isBlank() || incoming == null || !checksumOf(incoming.data()).equals(incoming.checksum())) {
            LOG.warn("Ignoring gossip state with bad key or checksum", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender(),
                    "gossipKey", key
            ));
            return;
        }
        handleStateUpdate(key, incoming);
    }

    public void route(Message message, RoutingEngine engine, long nowMs) {
        List<String> unreachable = new ArrayList<>();
        for (String recipient : message.recipients()) {
            try {
                engine.forward(message, recipient, nowMs);
            } catch (RoutingException e) {
                unreachable.add(recipient);
            }
        }
        if (!unreachable.isEmpty()) {
            throw new RoutingEngine.BroadcastException(message.id(), unreachable);
        }
    }

    public Optional<GossipState> get(String key) {
        return Optional.ofNullable(states.get(key));
    }

    public Map<String, GossipState> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public int size() {
        return states.size();
    }

    private int propagate(String key, GossipState state, List<String> targets) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("type", STATE_UPDATE);
        data.put("key", key);
        data.set("state", Jsons.toTree(state));
        int sent = 0;
        for (String target : targets) {
            router.sendMessage(MessageDraft.of(MessageType.GOSSIP, List.of(target), MessagePayload.of(data),
                    MessagePriority.BACKGROUND));
            sent++;
        }
        return sent;
    }

    private List<String> selectTargets() {
        List<String> peers = new ArrayList<>(registry.reachablePeerIds(clock.getAsLong()));
        Collections.shuffle(peers, random);
        return peers.subList(0, Math.min(fanout, peers.size()));
    }

    static String checksumOf(JsonNode data) {
        return Hashing.sha256Hex(Jsons.toCanonicalJson(data));
    }
}
