package io.swarmmesh.routing;

import io.swarmmesh.codec.PayloadCodec;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.ChecksumMismatchException;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageDraft;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.ReliabilityMode;
import io.swarmmesh.model.RoutingStrategy;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.util.Ids;
import io.swarmmesh.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

public final class MessageRouter {
    private static final StructuredLogger LOG = StructuredLogger.of(MessageRouter.class);

    private final String localNodeId;
    private final SwarmSettings settings;
    private final NodeRegistry registry;
    private final RoutingEngine routingEngine;
    private final List<PayloadCodec> codecs;
    private final SwarmEventBus bus;
    private final LongSupplier clock;

    private final Map<MessagePriority, ArrayDeque<Message>> queues = new EnumMap<>(MessagePriority.class);
    private final LinkedHashMap<String, Message> history = new LinkedHashMap<>();
    private final LinkedHashMap<String, Long> seenInbound = new LinkedHashMap<>();
    private final Map<MessageType, List<MessageHandler>> handlers = new EnumMap<>(MessageType.class);
    private final Map<MessageType, List<MessageHandler>> builtInHandlers = new EnumMap<>(MessageType.class);
    private final Map<MessageType, MessageRoute> customRoutes = new EnumMap<>(MessageType.class);

    private BroadcastTree broadcastTree;
    private Map<String, List<String>> routingTable = Map.of();

    public MessageRouter(
            String localNodeId,
            SwarmSettings settings,
            NodeRegistry registry,
            MessageTransport transport,
            List<PayloadCodec> codecs,
            SwarmEventBus bus,
            LongSupplier clock
    ) {
        this.localNodeId = localNodeId;
        this.settings = settings;
        this.registry = registry;
        this.routingEngine = new RoutingEngine(registry, transport);
        this.codecs = List.copyOf(codecs);
        this.bus = bus;
        this.clock = clock;
        for (MessagePriority priority : MessagePriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
        this.broadcastTree = BroadcastTreeBuilder.build(localNodeId, List.of());
    }

    public String sendMessage(MessageDraft draft) {
        validate(draft);
        long now = clock.getAsLong();
        Message.Compression compression = draft.compression() == null ? defaultCompression() : draft.compression();
        Message.Encryption encryption = draft.encryption() == null ? defaultEncryption() : draft.encryption();
        MessagePayload payload = encode(draft.payload() == null ? MessagePayload.of(null) : draft.payload(),
                compression, encryption);
        String sender = localNodeId;
        Message message = new Message(
                Ids.messageId(now),
                draft.type(),
                sender,
                draft.recipients(),
                payload,
                draft.priority() == null ? MessagePriority.NORMAL : draft.priority(),
                now,
                draft.ttlMs() == null ? settings.messageTimeoutMs() : draft.ttlMs(),
                Message.computeChecksum(sender, draft.recipients(), payload, now),
                draft.routing() == null ? defaultRouting() : draft.routing(),
                compression,
                encryption,
                draft.qos() == null ? defaultQos() : draft.qos()
        );
        remember(message);
        queues.get(message.priority()).addLast(message);
        bus.publish(new SwarmEvents.MessageSent(localNodeId, message.id(), message.type(), message.priority(),
                message.recipients()));
        LOG.debug("Message queued", StructuredLogger.fields(
                "messageId", message.id(),
                "type", message.type().wire(),
                "priority", message.priority().wire(),
                "recipients", message.recipients()
        ));
        return message.id();
    }

    public String broadcast(MessagePayload payload, MessagePriority priority) {
        return sendMessage(MessageDraft.of(MessageType.BROADCAST, List.of(), payload, priority));
    }

    public String multicast(List<String> recipients, MessagePayload payload, MessagePriority priority) {
        return sendMessage(MessageDraft.of(MessageType.MULTICAST, recipients, payload, priority));
    }

    public String unicast(String recipient, MessagePayload payload, MessagePriority priority) {
        return sendMessage(MessageDraft.of(MessageType.UNICAST, List.of(recipient), payload, priority));
    }

    public int processQueues(long nowMs) {
        int taken = 0;
        for (MessagePriority priority : MessagePriority.values()) {
            ArrayDeque<Message> queue = queues.get(priority);
            int budget = Math.min(settings.messageBatchPerPriority(), queue.size());
            for (int i = 0; i < budget; i++) {
                Message message = queue.pollFirst();
                taken++;
                if (message.expired(nowMs)) {
                    LOG.debug("Dropping expired message", StructuredLogger.fields(
                            "messageId", message.id(),
                            "ageMs", nowMs - message.timestampMs()
                    ));
                    continue;
                }
                dispatch(message, nowMs);
            }
            if (!queue.isEmpty()) {
                break;
            }
        }
        return taken;
    }

    public boolean receive(Message message) {
        long now = clock.getAsLong();
        if (!message.checksumValid()) {
            ChecksumMismatchException mismatch = new ChecksumMismatchException(
                    message.id(), message.checksum(), message.computeChecksum());
            LOG.warn("Dropping message with invalid checksum", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender(),
                    "error", mismatch.getMessage()
            ));
            registry.recordError(message.sender());
            return false;
        }
        if (message.expired(now)) {
            LOG.debug("Rejecting expired message", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender()
            ));
            return false;
        }
        if (message.qos() != null && message.qos().deduplication() && seenInbound.containsKey(message.id())) {
            LOG.debug("Dropping duplicate message", StructuredLogger.fields("messageId", message.id()));
            return false;
        }
        Message decoded;
        try {
            decoded = message.withPayload(decode(message.payload()));
        } catch (RuntimeException e) {
            LOG.error("Failed to decode inbound message", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender()
            ), e);
            registry.recordError(message.sender());
            bus.publish(new SwarmEvents.MessageFailed(localNodeId, message.id(), message.type(), e.getMessage(), List.of()));
            return false;
        }
        markSeen(message.id(), now);
        registry.recordReceived(message.sender(), Jsons.toCompactJson(message.payload().data()).length());
        registry.markSeen(message.sender(), now);
        runHandlers(handlers.get(decoded.type()), decoded, "user");
        runHandlers(builtInHandlers.get(decoded.type()), decoded, "built-in");
        bus.publish(new SwarmEvents.MessageReceived(localNodeId, decoded.id(), decoded.type(), decoded.sender()));
        return true;
    }

    public void registerHandler(MessageType type, MessageHandler handler) {
        handlers.computeIfAbsent(type, ignored -> new ArrayList<>()).add(handler);
    }

    public void registerBuiltInHandler(MessageType type, MessageHandler handler) {
        builtInHandlers.computeIfAbsent(type, ignored -> new ArrayList<>()).add(handler);
    }

    public void registerRoute(MessageType type, MessageRoute route) {
        customRoutes.put(type, route);
    }

    public void rebuildTopology() {
        List<String> connected = registry.connectedPeerIds();
        broadcastTree = BroadcastTreeBuilder.build(localNodeId, connected);
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (String peer : connected) {
            table.put(peer, List.of(peer));
        }
        routingTable = Collections.unmodifiableMap(table);
        LOG.debug("Topology rebuilt", StructuredLogger.fields(
                "peers", connected.size(),
                "treeDepth", broadcastTree.depth()
        ));
    }

    public int sweep(long nowMs) {
        int removed = 0;
        Iterator<Message> it = history.values().iterator();
        while (it.hasNext()) {
            if (it.next().expired(nowMs)) {
                it.remove();
                removed++;
            }
        }
        seenInbound.values().removeIf(seenAt -> nowMs - seenAt > settings.messageTimeoutMs());
        return removed;
    }

    public Optional<Message> findMessage(String messageId) {
        return Optional.ofNullable(history.get(messageId));
    }

    public int historySize() {
        return history.size();
    }

    public int queuedCount() {
        int total = 0;
        for (ArrayDeque<Message> queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    public Map<MessagePriority, Integer> queueDepths() {
        Map<MessagePriority, Integer> out = new EnumMap<>(MessagePriority.class);
        queues.forEach((priority, queue) -> out.put(priority, queue.size()));
        return out;
    }

    public BroadcastTree broadcastTree() {
        return broadcastTree;
    }

    public RoutingInfo routingInfo() {
        return new RoutingInfo(localNodeId, broadcastTree, routingTable, queueDepths(), history.size());
    }

    private void dispatch(Message message, long nowMs) {
        try {
            MessageRoute custom = customRoutes.get(message.type());
            if (custom != null) {
                custom.route(message, routingEngine, nowMs);
                return;
            }
            switch (message.type()) {
                case BROADCAST, HEARTBEAT -> routingEngine.broadcast(message, broadcastTree, nowMs);
                case MULTICAST -> routingEngine.multicast(message, nowMs);
                case UNICAST -> routingEngine.unicast(message, routingTable, nowMs);
                default -> routingEngine.routed(message, routingTable, nowMs);
            }
        } catch (RuntimeException e) {
            List<String> unreachable = e instanceof RoutingEngine.BroadcastException be ? be.unreachable() : List.of();
            LOG.error("Message routing failed", StructuredLogger.fields(
                    "messageId", message.id(),
                    "type", message.type().wire(),
                    "error", e.getMessage()
            ));
            bus.publish(new SwarmEvents.MessageFailed(localNodeId, message.id(), message.type(), e.getMessage(), unreachable));
        }
    }

    private void validate(MessageDraft draft) {
        if (draft == null || draft.type() == null) {
            throw new ValidationException("message type is required");
        }
        switch (draft.type()) {
            case BROADCAST, HEARTBEAT -> {
                // fan-out targets come from the broadcast tree
            }
            case UNICAST -> {
                if (draft.recipients().size() != 1) {
                    throw new ValidationException("unicast requires exactly one recipient, got " + draft.recipients().size());
                }
            }
            default -> {
                if (draft.recipients().isEmpty()) {
                    throw new ValidationException(draft.type().wire() + " message requires at least one recipient");
                }
            }
        }
        for (String recipient : draft.recipients()) {
            if (recipient == null || recipient.isBlank()) {
                throw new ValidationException("recipient ids must be non-blank");
            }
        }
    }

    private MessagePayload encode(MessagePayload payload, Message.Compression compression, Message.Encryption encryption) {
        MessagePayload current = payload;
        for (PayloadCodec codec : codecs) {
            try {
                current = codec.encode(current, compression, encryption);
            } catch (RuntimeException e) {
                LOG.warn("Payload codec failed, sending without it", StructuredLogger.fields(
                        "codec", codec.name(),
                        "error", e.getMessage()
                ));
            }
        }
        return current;
    }

    private MessagePayload decode(MessagePayload payload) {
        MessagePayload current = payload;
        for (int i = codecs.size() - 1; i >= 0; i--) {
            current = codecs.get(i).decode(current);
        }
        return current;
    }

    private void runHandlers(List<MessageHandler> list, Message message, String kind) {
        if (list == null) {
            return;
        }
        for (MessageHandler handler : list) {
            try {
                handler.handle(message);
            } catch (RuntimeException e) {
                LOG.error("Message handler failed", StructuredLogger.fields(
                        "messageId", message.id(),
                        "type", message.type().wire(),
                        "handler", kind
                ), e);
            }
        }
    }

    private void remember(Message message) {
        history.put(message.id(), message);
        while (history.size() > settings.maxMessageHistory()) {
            Iterator<String> oldest = history.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
    }

    private void markSeen(String messageId, long nowMs) {
        seenInbound.put(messageId, nowMs);
        while (seenInbound.size() > settings.maxMessageHistory()) {
            Iterator<String> oldest = seenInbound.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
    }

    private Message.Compression defaultCompression() {
        return new Message.Compression(true, Message.Compression.GZIP, settings.compressionLevel(),
                settings.compressionThresholdBytes());
    }

    private Message.Encryption defaultEncryption() {
        return settings.encryptionEnabled()
                ? new Message.Encryption(true, Message.Encryption.AES_GCM, null)
                : Message.Encryption.disabled();
    }

    private Message.Routing defaultRouting() {
        return new Message.Routing(RoutingStrategy.ADAPTIVE, settings.maxHops(), ReliabilityMode.AT_LEAST_ONCE,
                false, settings.messageTimeoutMs());
    }

    private Message.Qos defaultQos() {
        return new Message.Qos(0.0, settings.messageTimeoutMs(), settings.defaultReliability(), false, true);
    }
}
