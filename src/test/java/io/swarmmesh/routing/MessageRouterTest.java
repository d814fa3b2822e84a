package io.swarmmesh.routing;

import io.swarmmesh.codec.AesGcmEncryptionCodec;
import io.swarmmesh.codec.GzipCompressionCodec;
import io.swarmmesh.codec.PayloadCodec;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageDraft;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.security.PayloadCrypto;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class MessageRouterTest {

    @Test
    void checksumIsDeterministicAndCoversTimestamp() {
        MessagePayload payload = MessagePayload.of(Map.of("k", 1));
        String first = Message.computeChecksum("a", List.of("b"), payload, 10L);
        String second = Message.computeChecksum("a", List.of("b"), MessagePayload.of(Map.of("k", 1)), 10L);

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(64, first.length());
        Assertions.assertNotEquals(first, Message.computeChecksum("a", List.of("b"), payload, 11L));
        Assertions.assertNotEquals(first, Message.computeChecksum("a", List.of("c"), payload, 10L));
    }

    @Test
    void drainsHigherPriorityFirst() {
        List<Message> delivered = new ArrayList<>();
        MessageRouter router = routerWithPeer(SwarmSettings.defaults(), (target, m) -> delivered.add(m));

        router.unicast("peer", MessagePayload.of("low"), MessagePriority.LOW);
        router.unicast("peer", MessagePayload.of("emergency"), MessagePriority.EMERGENCY);
        router.unicast("peer", MessagePayload.of("normal"), MessagePriority.NORMAL);
        Assertions.assertEquals(3, router.queuedCount());

        Assertions.assertEquals(3, router.processQueues(0L));
        Assertions.assertEquals(List.of("emergency", "normal", "low"),
                delivered.stream().map(m -> m.payload().data().asText()).toList());
        Assertions.assertEquals(0, router.queuedCount());
    }

    @Test
    void lowerPriorityWaitsWhileHigherQueueIsNotEmpty() {
        List<Message> delivered = new ArrayList<>();
        MessageRouter router = routerWithPeer(SwarmSettings.defaults(), (target, m) -> delivered.add(m));
        int batch = SwarmSettings.defaults().messageBatchPerPriority();

        router.unicast("peer", MessagePayload.of("low"), MessagePriority.LOW);
        for (int i = 0; i < batch + 5; i++) {
            router.unicast("peer", MessagePayload.of("high-" + i), MessagePriority.HIGH);
        }

        router.processQueues(0L);
        Assertions.assertEquals(batch, delivered.size());
        Assertions.assertTrue(delivered.stream().allMatch(m -> m.priority() == MessagePriority.HIGH));

        router.processQueues(0L);
        Assertions.assertEquals(batch + 6, delivered.size());
        Assertions.assertEquals("low", delivered.get(delivered.size() - 1).payload().data().asText());
    }

    @Test
    void rejectsMalformedRecipientLists() {
        MessageRouter router = routerWithPeer(SwarmSettings.defaults(), (target, m) -> {
        });
        MessagePayload payload = MessagePayload.of("x");

        Assertions.assertThrows(ValidationException.class,
                () -> router.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of(), payload)));
        Assertions.assertThrows(ValidationException.class,
                () -> router.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of("a", "b"), payload)));
        Assertions.assertThrows(ValidationException.class,
                () -> router.sendMessage(MessageDraft.of(MessageType.MULTICAST, List.of(), payload)));
        Assertions.assertThrows(ValidationException.class,
                () -> router.sendMessage(MessageDraft.of(MessageType.MULTICAST, List.of(" "), payload)));
        Assertions.assertEquals(0, router.queuedCount());
    }

    @Test
    void unicastToUnknownPeerPublishesFailure() {
        SwarmEventBus bus = new SwarmEventBus();
        List<SwarmEvents.MessageFailed> failures = new ArrayList<>();
        bus.subscribe(SwarmEvents.MessageFailed.class, failures::add);
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        MessageRouter router = new MessageRouter("local", SwarmSettings.defaults(), registry, (target, m) -> {
        }, List.of(), bus, () -> 0L);

        router.unicast("ghost", MessagePayload.of("x"), MessagePriority.NORMAL);
        router.processQueues(0L);

        Assertions.assertEquals(1, failures.size());
        Assertions.assertTrue(failures.get(0).error().contains("ghost"));
    }

    @Test
    void compressedAndEncryptedPayloadRoundTrips() {
        PayloadCrypto crypto = PayloadCrypto.inMemory();
        SwarmEventBus bus = new SwarmEventBus();
        List<Message> wire = new ArrayList<>();
        List<Message> handled = new ArrayList<>();

        NodeRegistry receiverRegistry = new NodeRegistry("b", 10_000L);
        receiverRegistry.register(CommunicationNode.of("a", "in-memory", 0), 0L);
        MessageRouter receiver = new MessageRouter("b", SwarmSettings.defaults(), receiverRegistry, (target, m) -> {
        }, codecs(crypto), bus, () -> 0L);
        receiver.registerHandler(MessageType.UNICAST, handled::add);

        NodeRegistry senderRegistry = new NodeRegistry("a", 10_000L);
        senderRegistry.register(CommunicationNode.of("b", "in-memory", 0), 0L);
        MessageRouter sender = new MessageRouter("a", SwarmSettings.defaults(), senderRegistry, (target, m) -> {
            wire.add(m);
            receiver.receive(m);
        }, codecs(crypto), bus, () -> 0L);
        sender.rebuildTopology();

        String text = "swarm ".repeat(1_000);
        sender.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of("b"), MessagePayload.of(Map.of("text", text)))
                .withEncryption(new Message.Encryption(true, Message.Encryption.AES_GCM, null)));
        sender.processQueues(0L);

        Assertions.assertEquals(1, wire.size());
        MessagePayload onWire = wire.get(0).payload();
        Assertions.assertTrue(onWire.flag(GzipCompressionCodec.COMPRESSED));
        Assertions.assertTrue(onWire.flag(AesGcmEncryptionCodec.ENCRYPTED));
        Assertions.assertFalse(onWire.data().asText().contains("swarm"));
        Assertions.assertTrue(wire.get(0).checksumValid());

        Assertions.assertEquals(1, handled.size());
        MessagePayload decoded = handled.get(0).payload();
        Assertions.assertEquals(text, decoded.data().path("text").asText());
        Assertions.assertFalse(decoded.flag(GzipCompressionCodec.COMPRESSED));
        Assertions.assertFalse(decoded.flag(AesGcmEncryptionCodec.ENCRYPTED));
    }

    @Test
    void smallPayloadIsNotCompressed() {
        List<Message> wire = new ArrayList<>();
        MessageRouter router = new MessageRouter("local", SwarmSettings.defaults(), peerRegistry(),
                (target, m) -> wire.add(m), codecs(PayloadCrypto.inMemory()), new SwarmEventBus(), () -> 0L);
        router.rebuildTopology();

        router.unicast("peer", MessagePayload.of(Map.of("k", "v")), MessagePriority.NORMAL);
        router.processQueues(0L);

        Assertions.assertFalse(wire.get(0).payload().flag(GzipCompressionCodec.COMPRESSED));
        Assertions.assertEquals("v", wire.get(0).payload().data().path("k").asText());
    }

    @Test
    void tamperedMessageIsDropped() {
        List<Message> wire = new ArrayList<>();
        MessageRouter sender = routerWithPeer(SwarmSettings.defaults(), (target, m) -> wire.add(m));
        sender.unicast("peer", MessagePayload.of("original"), MessagePriority.NORMAL);
        sender.processQueues(0L);

        List<Message> handled = new ArrayList<>();
        MessageRouter receiver = new MessageRouter("peer", SwarmSettings.defaults(), new NodeRegistry("peer", 10_000L),
                (target, m) -> {
                }, List.of(), new SwarmEventBus(), () -> 0L);
        receiver.registerHandler(MessageType.UNICAST, handled::add);

        Message tampered = wire.get(0).withPayload(MessagePayload.of("forged"));
        Assertions.assertFalse(receiver.receive(tampered));
        Assertions.assertTrue(receiver.receive(wire.get(0)));
        Assertions.assertFalse(receiver.receive(wire.get(0)), "duplicate delivery");
        Assertions.assertEquals(1, handled.size());
    }

    @Test
    void expiredMessagesAreNeitherSentNorAccepted() {
        List<Message> wire = new ArrayList<>();
        long[] now = {0L};
        MessageRouter sender = new MessageRouter("local", SwarmSettings.defaults(), peerRegistry(),
                (target, m) -> wire.add(m), List.of(), new SwarmEventBus(), () -> now[0]);
        sender.rebuildTopology();

        sender.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of("peer"), MessagePayload.of("late"))
                .withTtlMs(100L));
        sender.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of("peer"), MessagePayload.of("fresh"))
                .withTtlMs(100L));
        Assertions.assertEquals(2, sender.processQueues(500L));
        Assertions.assertTrue(wire.isEmpty());
        Assertions.assertEquals(2, sender.sweep(500L));
        Assertions.assertEquals(0, sender.historySize());

        sender.sendMessage(MessageDraft.of(MessageType.UNICAST, List.of("peer"), MessagePayload.of("ok"))
                .withTtlMs(100L));
        sender.processQueues(50L);
        Assertions.assertEquals(1, wire.size());

        long[] receiverNow = {1_000L};
        MessageRouter receiver = new MessageRouter("peer", SwarmSettings.defaults(), new NodeRegistry("peer", 10_000L),
                (target, m) -> {
                }, List.of(), new SwarmEventBus(), () -> receiverNow[0]);
        Assertions.assertFalse(receiver.receive(wire.get(0)));
        receiverNow[0] = 60L;
        Assertions.assertTrue(receiver.receive(wire.get(0)));
    }

    @Test
    void broadcastReachesEveryConnectedPeer() {
        List<String> targets = new ArrayList<>();
        NodeRegistry registry = new NodeRegistry("root", 10_000L);
        for (String id : List.of("a", "b", "c", "d", "e")) {
            registry.register(CommunicationNode.of(id, "in-memory", 0), 0L);
        }
        MessageRouter router = new MessageRouter("root", SwarmSettings.defaults(), registry,
                (target, m) -> targets.add(target), List.of(), new SwarmEventBus(), () -> 0L);
        router.rebuildTopology();

        router.broadcast(MessagePayload.of("hello"), MessagePriority.NORMAL);
        router.processQueues(0L);

        Assertions.assertEquals(List.of("a", "b", "d", "e", "c"), targets);
        Assertions.assertEquals(3, router.routingInfo().broadcastTree().depth());
    }

    private static MessageRouter routerWithPeer(SwarmSettings settings, MessageTransport transport) {
        MessageRouter router = new MessageRouter("local", settings, peerRegistry(), transport, List.of(),
                new SwarmEventBus(), () -> 0L);
        router.rebuildTopology();
        return router;
    }

    private static NodeRegistry peerRegistry() {
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        registry.register(CommunicationNode.of("peer", "in-memory", 0), 0L);
        return registry;
    }

    private static List<PayloadCodec> codecs(PayloadCrypto crypto) {
        return List.of(new GzipCompressionCodec(), new AesGcmEncryptionCodec(crypto));
    }
}
