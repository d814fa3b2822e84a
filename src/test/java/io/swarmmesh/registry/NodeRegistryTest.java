package io.swarmmesh.registry;

import io.swarmmesh.error.ValidationException;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.NodeView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class NodeRegistryTest {

    @Test
    void statusFollowsHeartbeatMultiples() {
        long hb = 10_000L;
        Assertions.assertEquals(NodeStatus.ONLINE, NodeRegistry.deriveStatus(0L, 20_000L, hb));
        Assertions.assertEquals(NodeStatus.DEGRADED, NodeRegistry.deriveStatus(0L, 20_001L, hb));
        Assertions.assertEquals(NodeStatus.DEGRADED, NodeRegistry.deriveStatus(0L, 30_000L, hb));
        Assertions.assertEquals(NodeStatus.OFFLINE, NodeRegistry.deriveStatus(0L, 30_001L, hb));
    }

    @Test
    void disconnectedPeerIsOfflineRegardlessOfLastSeen() {
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        registry.register(CommunicationNode.of("peer", "10.0.0.2", 7000), 1_000L);
        Assertions.assertEquals(NodeStatus.ONLINE, registry.statusOf("peer", 1_000L));

        registry.disconnect("peer");
        Assertions.assertEquals(NodeStatus.OFFLINE, registry.statusOf("peer", 1_000L));
        Assertions.assertEquals(List.of(), registry.connectedPeerIds());

        registry.connect("peer", 2_000L);
        Assertions.assertEquals(NodeStatus.ONLINE, registry.statusOf("peer", 2_000L));
        Assertions.assertEquals(NodeStatus.OFFLINE, registry.statusOf("unknown", 2_000L));
    }

    @Test
    void rejectsLocalAndBlankIds() {
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        Assertions.assertThrows(ValidationException.class,
                () -> registry.register(CommunicationNode.of("local", "127.0.0.1", 1), 0L));
        Assertions.assertThrows(ValidationException.class,
                () -> registry.register(CommunicationNode.of(" ", "127.0.0.1", 1), 0L));
        Assertions.assertEquals(0, registry.size());
    }

    @Test
    void reRegistrationKeepsCountersAndReportsExisting() {
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        Assertions.assertTrue(registry.register(CommunicationNode.of("peer", "a", 1), 0L));
        registry.recordSent("peer", 10L);
        registry.recordReceived("peer", 5L);
        registry.recordError("peer");

        Assertions.assertFalse(registry.register(CommunicationNode.of("peer", "b", 2), 100L));
        NodeView view = registry.find("peer", 100L).orElseThrow();
        Assertions.assertEquals("b", view.address());
        Assertions.assertEquals(1L, view.messagesSent());
        Assertions.assertEquals(1L, view.messagesReceived());
        Assertions.assertEquals(15L, view.bytesTransferred());
        Assertions.assertEquals(1.0 / 3.0, view.errorRate(), 1e-9);
    }

    @Test
    void networkHealthIsOnlineFraction() {
        NodeRegistry registry = new NodeRegistry("local", 1_000L);
        Assertions.assertEquals(1.0, registry.networkHealth(0L));

        registry.register(CommunicationNode.of("a", "a", 1), 0L);
        registry.register(CommunicationNode.of("b", "b", 1), 0L);
        registry.markSeen("a", 5_000L);

        Assertions.assertEquals(0.5, registry.networkHealth(5_000L), 1e-9);
        Assertions.assertEquals(List.of("a"), registry.reachablePeerIds(5_000L));
    }
}
