package io.swarmmesh.runtime;

import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.SwarmException;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.AvailabilityStatus;
import io.swarmmesh.model.ConsensusResult;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskPriority;
import io.swarmmesh.model.TaskStatus;
import io.swarmmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class SwarmRuntimeTest {
    private final SwarmSettings settings = SwarmSettings.defaults();
    private final InMemoryNetwork network = new InMemoryNetwork();

    @Test
    void joiningRegistersMembersBothWays() {
        SwarmRuntime a = join("a");
        SwarmRuntime b = join("b");
        SwarmRuntime c = join("c");

        Assertions.assertEquals(List.of("b", "c"), a.registry().peerIds());
        Assertions.assertEquals(List.of("a", "b"), c.registry().peerIds());
        Assertions.assertEquals(2, b.getRoutingInfo().routingTable().size());
        Assertions.assertEquals(NodeStatus.ONLINE, a.node("c").orElseThrow().status());
    }

    @Test
    void gossipReachesPeerOnNextMessageTick() {
        SwarmRuntime hub = join("hub");
        SwarmRuntime worker = join("worker");

        hub.startGossip("config", Map.of("mode", "fast"), 5L);
        Assertions.assertTrue(worker.gossip().get("config").isEmpty());

        network.advanceAll(settings.messageTickMs());

        Assertions.assertEquals(5L, worker.gossip().get("config").orElseThrow().version());
        Assertions.assertEquals("fast", worker.gossip().get("config").orElseThrow().data().path("mode").asText());
        Assertions.assertEquals(1, worker.getMetrics().gossipStates());
    }

    @Test
    void peersVoteOnProposalAndProposerResolves() {
        SwarmRuntime a = join("a");
        join("b");
        join("c");
        List<SwarmEvents.ConsensusReached> reached = new ArrayList<>();
        a.bus().subscribe(SwarmEvents.ConsensusReached.class, reached::add);

        String id = a.initiateConsensus(ProposalType.CONFIGURATION, Map.of("fanout", 4), List.of());
        Assertions.assertEquals(1, a.getMetrics().activeConsensus());

        network.advanceAll(settings.messageTickMs());

        Assertions.assertEquals(1, reached.size());
        Assertions.assertEquals(id, reached.get(0).proposalId());
        Assertions.assertEquals(ConsensusResult.ACCEPTED, reached.get(0).result());
        Assertions.assertEquals(0, a.getMetrics().activeConsensus());
    }

    @Test
    void remoteAgentCompletesTaskThroughControlMessages() {
        SwarmRuntime hub = join("hub");
        SwarmRuntime worker = join("worker");
        List<String> assignedToWorker = new ArrayList<>();
        worker.registerHandler(MessageType.CONTROL, message -> {
            String kind = message.payload().data().path(ControlMessages.KIND).asText();
            if (ControlMessages.TASK_ASSIGNED.equals(kind)) {
                String taskId = message.payload().data().path(ControlMessages.TASK_ID).asText();
                assignedToWorker.add(taskId);
                worker.sendControl("hub", ControlMessages.taskCompleted(taskId, Jsons.toTree(Map.of("rows", 3))));
            }
        });
        List<SwarmEvents.TaskCompleted> completed = new ArrayList<>();
        hub.bus().subscribe(SwarmEvents.TaskCompleted.class, completed::add);

        hub.registerAgent(AgentCapability.of("worker", List.of("analysis"), 1, 0.9));
        String id = hub.submitTask(TaskDefinition.simple("report", "general", TaskPriority.HIGH, List.of("analysis")));

        network.runUntil(100L, settings.distributionTickMs(), 100L);
        Assertions.assertEquals(TaskStatus.ASSIGNED, hub.getTaskStatus(id).orElseThrow());

        network.advanceAll(settings.distributionTickMs() + 100L);

        Assertions.assertEquals(List.of(id), assignedToWorker);
        Assertions.assertEquals(TaskStatus.COMPLETED, hub.getTaskStatus(id).orElseThrow());
        Assertions.assertEquals(3, completed.get(0).result().path("rows").asInt());
        Assertions.assertEquals(0, hub.distribution().agent("worker").orElseThrow().currentLoad());
    }

    @Test
    void reportFromNodeThatDoesNotHoldTaskIsIgnored() {
        SwarmRuntime hub = join("hub");
        SwarmRuntime intruder = join("intruder");
        hub.registerAgent(AgentCapability.of("local-agent", List.of(), 1, 0.9));
        String id = hub.submitTask(TaskDefinition.simple("t", "general", TaskPriority.NORMAL, List.of()));
        network.runUntil(100L, settings.distributionTickMs(), 100L);

        intruder.sendControl("hub", ControlMessages.taskCompleted(id, null));
        network.advanceAll(settings.distributionTickMs() + 100L);

        Assertions.assertEquals(TaskStatus.ASSIGNED, hub.getTaskStatus(id).orElseThrow());
    }

    @Test
    void silentPeerAgentLosesWorkAndReturnsAfterHealing() {
        SwarmRuntime hub = join("hub");
        join("worker");
        hub.registerAgent(AgentCapability.of("worker", List.of(), 1, 0.9));
        network.isolate("worker");
        String id = hub.submitTask(TaskDefinition.simple("t", "general", TaskPriority.NORMAL, List.of()));

        network.runUntil(100L, 1_000L, 100L);
        Assertions.assertEquals(TaskStatus.ASSIGNED, hub.getTaskStatus(id).orElseThrow());

        network.runUntil(1_100L, 40_000L, 100L);
        Assertions.assertEquals(NodeStatus.OFFLINE, hub.node("worker").orElseThrow().status());
        Assertions.assertEquals(AvailabilityStatus.OFFLINE, hub.distribution().agent("worker").orElseThrow().availability());
        Assertions.assertEquals(TaskStatus.QUEUED, hub.getTaskStatus(id).orElseThrow());
        Assertions.assertTrue(network.dropped() > 0L);

        network.heal("worker");
        network.runUntil(40_100L, 41_000L, 100L);

        Assertions.assertEquals(NodeStatus.ONLINE, hub.node("worker").orElseThrow().status());
        Assertions.assertEquals(TaskStatus.ASSIGNED, hub.getTaskStatus(id).orElseThrow());
    }

    @Test
    void shutdownStopsLoopsAndRejectsCommands() {
        SwarmRuntime a = join("a");
        join("b");
        List<SwarmEvents.Shutdown> events = new ArrayList<>();
        a.bus().subscribe(SwarmEvents.Shutdown.class, events::add);
        a.unicast("b", "queued", MessagePriority.NORMAL);

        a.shutdown();
        a.shutdown();
        network.advanceAll(1_000L);

        Assertions.assertTrue(a.isShutdown());
        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals(0L, network.deliveries());
        Assertions.assertThrows(SwarmException.class, () -> a.broadcast("x", MessagePriority.LOW));
        Assertions.assertThrows(SwarmException.class,
                () -> a.submitTask(TaskDefinition.simple("t", "general", TaskPriority.LOW, List.of())));
    }

    private SwarmRuntime join(String nodeId) {
        return network.join(nodeId, settings, SwarmPolicies.defaults(settings), 0L);
    }
}
