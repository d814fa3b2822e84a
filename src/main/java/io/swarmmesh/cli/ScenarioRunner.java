package io.swarmmesh.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.distribution.DistributionMetrics;
import io.swarmmesh.distribution.TaskView;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.AvailabilityStatus;
import io.swarmmesh.model.GossipState;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.observability.EventJournal;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.runtime.CommunicationMetrics;
import io.swarmmesh.runtime.ControlMessages;
import io.swarmmesh.runtime.InMemoryNetwork;
import io.swarmmesh.runtime.SwarmPolicies;
import io.swarmmesh.runtime.SwarmRuntime;
import io.swarmmesh.util.Jsons;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

public final class ScenarioRunner {
    private static final StructuredLogger LOG = StructuredLogger.of(ScenarioRunner.class);

    private final SwarmSettings settings;
    private final ScenarioFile scenario;
    private final EventJournal journal;
    private final Map<String, ScenarioFile.AgentSpec> agentSpecs = new LinkedHashMap<>();
    private final Map<String, Integer> failuresSoFar = new HashMap<>();
    private final List<Work> pending = new ArrayList<>();
    private final List<SwarmEvents.ConsensusReached> consensusResults = new ArrayList<>();
    private final Map<String, Integer> eventCounts = new TreeMap<>();
    private final List<TimedAction> oneShots = new ArrayList<>();

    private InMemoryNetwork network;
    private SwarmRuntime coordinator;
    private long startMs;
    private long lastMs;

    public ScenarioRunner(SwarmSettings settings, ScenarioFile scenario, EventJournal journal) {
        this.settings = settings;
        this.scenario = scenario;
        this.journal = journal;
        for (ScenarioFile.AgentSpec spec : scenario.agents()) {
            agentSpecs.put(spec.id(), spec);
        }
    }

    public void start(long nowMs) {
        if (network != null) {
            throw new IllegalStateException("Scenario already started");
        }
        if (!scenario.nodes().contains(scenario.coordinator())) {
            throw new IllegalArgumentException("Coordinator " + scenario.coordinator() + " is not one of the scenario nodes");
        }
        startMs = nowMs;
        lastMs = nowMs;
        network = new InMemoryNetwork();
        long seed = scenario.seed() == null ? 0L : scenario.seed();
        int index = 0;
        for (String nodeId : scenario.nodes()) {
            SwarmPolicies policies = SwarmPolicies.defaults(settings).withRandom(new Random(seed + index++));
            SwarmRuntime runtime = network.join(nodeId, settings, policies, nowMs);
            runtime.bus().subscribe(SwarmEvents.ConsensusReached.class, consensusResults::add);
            if (!nodeId.equals(scenario.coordinator()) && agentSpecs.containsKey(nodeId)) {
                runtime.registerHandler(MessageType.CONTROL, message -> onRemoteControl(runtime, message));
            }
        }
        coordinator = network.member(scenario.coordinator()).orElseThrow();
        coordinator.bus().subscribeAll(event -> eventCounts.merge(event.type().wire(), 1, Integer::sum));
        coordinator.bus().subscribe(SwarmEvents.TaskAssigned.class, this::onLocalAssignment);
        coordinator.bus().subscribe(SwarmEvents.TaskReassigned.class, event -> dropWork(event.taskId()));
        coordinator.bus().subscribe(SwarmEvents.TaskCancelled.class, event -> dropWork(event.taskId()));
        if (journal != null) {
            journal.attach(coordinator.bus());
        }
        for (ScenarioFile.AgentSpec spec : scenario.agents()) {
            coordinator.registerAgent(new AgentCapability(
                    spec.id(),
                    spec.capabilities(),
                    0,
                    spec.maxLoad(),
                    AgentCapability.PerformanceProfile.of(spec.successRate(), spec.efficiency()),
                    spec.trustScore(),
                    AvailabilityStatus.AVAILABLE,
                    List.of(),
                    0.0
            ));
        }
        scheduleActions();
        LOG.info("Scenario started", StructuredLogger.fields(
                "nodes", scenario.nodes(),
                "coordinator", scenario.coordinator(),
                "agents", agentSpecs.keySet(),
                "tasks", scenario.tasks().size()
        ));
    }

    public void step(long nowMs) {
        if (network == null) {
            throw new IllegalStateException("Scenario not started");
        }
        lastMs = Math.max(lastMs, nowMs);
        long offset = lastMs - startMs;
        Iterator<TimedAction> it = oneShots.iterator();
        List<TimedAction> due = new ArrayList<>();
        while (it.hasNext()) {
            TimedAction timed = it.next();
            if (timed.atMs() <= offset) {
                due.add(timed);
                it.remove();
            }
        }
        for (TimedAction timed : due) {
            try {
                timed.action().run();
            } catch (RuntimeException e) {
                LOG.error("Scenario action failed", StructuredLogger.fields("offsetMs", offset), e);
            }
        }
        finishDueWork();
        network.advanceAll(lastMs);
    }

    public ScenarioReport simulate(int ticks, long tickMs) {
        start(0L);
        for (int i = 1; i <= ticks; i++) {
            step(i * tickMs);
        }
        return report();
    }

    public ScenarioReport report() {
        Map<String, Map<String, Long>> gossip = new LinkedHashMap<>();
        for (SwarmRuntime member : network.members()) {
            Map<String, Long> versions = new TreeMap<>();
            for (Map.Entry<String, GossipState> entry : member.gossip().snapshot().entrySet()) {
                versions.put(entry.getKey(), entry.getValue().version());
            }
            gossip.put(member.nodeId(), versions);
        }
        return new ScenarioReport(
                coordinator.nodeId(),
                lastMs - startMs,
                scenario.nodes(),
                coordinator.distribution().tasks(),
                coordinator.distributionMetrics(),
                coordinator.getMetrics(),
                gossip,
                List.copyOf(consensusResults),
                new TreeMap<>(eventCounts),
                journal == null ? null : journal.currentHash()
        );
    }

    public SwarmRuntime coordinator() {
        return coordinator;
    }

    public InMemoryNetwork network() {
        return network;
    }

    public void shutdown() {
        if (network != null) {
            network.shutdownAll();
        }
    }

    private void scheduleActions() {
        for (ScenarioFile.TimedTask timed : scenario.tasks()) {
            oneShots.add(new TimedAction(timed.atMs(), () -> coordinator.submitTask(timed.task())));
        }
        for (ScenarioFile.TimedGossip timed : scenario.gossip()) {
            oneShots.add(new TimedAction(timed.atMs(), () -> memberOrCoordinator(timed.node())
                    .startGossip(timed.key(), timed.data())));
        }
        for (ScenarioFile.TimedProposal timed : scenario.proposals()) {
            ProposalType type = timed.type() == null ? ProposalType.VALUE : timed.type();
            oneShots.add(new TimedAction(timed.atMs(), () -> memberOrCoordinator(timed.node())
                    .initiateConsensus(type, timed.value(), null)));
        }
        for (ScenarioFile.TimedNodeAction timed : scenario.isolate()) {
            oneShots.add(new TimedAction(timed.atMs(), () -> network.isolate(timed.node())));
            if (timed.healAtMs() > timed.atMs()) {
                oneShots.add(new TimedAction(timed.healAtMs(), () -> network.heal(timed.node())));
            }
        }
    }

    private SwarmRuntime memberOrCoordinator(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return coordinator;
        }
        return network.member(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown scenario node " + nodeId));
    }

    private void onLocalAssignment(SwarmEvents.TaskAssigned event) {
        if (network.member(event.agentId()).isPresent()) {
            return;
        }
        schedule(event.assignment(), false);
    }

    private void onRemoteControl(SwarmRuntime runtime, Message message) {
        JsonNode body = message.payload().data();
        String kind = body.path(ControlMessages.KIND).asText("");
        String taskId = body.path(ControlMessages.TASK_ID).asText("");
        if (ControlMessages.TASK_ASSIGNED.equals(kind)) {
            try {
                TaskAssignment assignment = Jsons.mapper().treeToValue(body.path("assignment"), TaskAssignment.class);
                schedule(assignment, true);
                runtime.sendControl(message.sender(), ControlMessages.taskProgress(taskId, 0.0, "accepted"));
            } catch (JsonProcessingException e) {
                LOG.warn("Malformed assignment message", StructuredLogger.fields(
                        "node", runtime.nodeId(),
                        "error", e.getMessage()
                ));
            }
        } else if (ControlMessages.TASK_REVOKED.equals(kind)) {
            dropWork(taskId);
        }
    }

    private void schedule(TaskAssignment assignment, boolean remote) {
        ScenarioFile.AgentSpec spec = agentSpecs.get(assignment.agentId());
        long workMs = spec == null ? 1_000L : spec.workMs();
        pending.add(new Work(assignment.taskId(), assignment.agentId(), assignment.assignedAtMs(), lastMs + workMs, remote));
    }

    private void dropWork(String taskId) {
        pending.removeIf(work -> work.taskId().equals(taskId));
    }

    private void finishDueWork() {
        List<Work> due = new ArrayList<>();
        Iterator<Work> it = pending.iterator();
        while (it.hasNext()) {
            Work work = it.next();
            if (work.dueMs() <= lastMs) {
                due.add(work);
                it.remove();
            }
        }
        for (Work work : due) {
            ScenarioFile.AgentSpec spec = agentSpecs.get(work.agentId());
            int failed = failuresSoFar.getOrDefault(work.agentId(), 0);
            boolean fail = spec != null && failed < spec.failAttempts();
            if (fail) {
                failuresSoFar.put(work.agentId(), failed + 1);
            }
            if (work.remote()) {
                SwarmRuntime agentNode = network.member(work.agentId()).orElseThrow();
                ObjectNode body = fail
                        ? ControlMessages.taskFailed(work.taskId(), "simulated failure")
                        : ControlMessages.taskCompleted(work.taskId(), result(work));
                agentNode.sendControl(coordinator.nodeId(), body);
                continue;
            }
            boolean stillHeld = coordinator.distribution().assignment(work.taskId())
                    .map(a -> a.agentId().equals(work.agentId()) && a.assignedAtMs() == work.assignedAtMs())
                    .orElse(false);
            if (!stillHeld) {
                continue;
            }
            if (fail) {
                coordinator.failTask(work.taskId(), "simulated failure");
            } else {
                coordinator.completeTask(work.taskId(), result(work));
            }
        }
    }

    private static JsonNode result(Work work) {
        ObjectNode result = Jsons.mapper().createObjectNode();
        result.put("agent", work.agentId());
        result.put("taskId", work.taskId());
        return result;
    }

    private record Work(String taskId, String agentId, long assignedAtMs, long dueMs, boolean remote) {
    }

    private record TimedAction(long atMs, Runnable action) {
    }

    public record ScenarioReport(
            String coordinator,
            long elapsedMs,
            List<String> nodes,
            List<TaskView> tasks,
            DistributionMetrics distribution,
            CommunicationMetrics communication,
            Map<String, Map<String, Long>> gossipVersions,
            List<SwarmEvents.ConsensusReached> consensus,
            Map<String, Integer> events,
            String journalHash
    ) {
    }
}
