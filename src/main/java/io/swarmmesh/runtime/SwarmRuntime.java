package io.swarmmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.codec.AesGcmEncryptionCodec;
import io.swarmmesh.codec.GzipCompressionCodec;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.consensus.ConsensusEngine;
import io.swarmmesh.distribution.AssignmentNotifier;
import io.swarmmesh.distribution.AssignmentOptimizer;
import io.swarmmesh.distribution.DistributionMetrics;
import io.swarmmesh.distribution.QueueStatus;
import io.swarmmesh.distribution.TaskDistributionEngine;
import io.swarmmesh.distribution.TaskView;
import io.swarmmesh.distribution.WorkloadBalancer;
import io.swarmmesh.error.SwarmException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.gossip.GossipEngine;
import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.AvailabilityStatus;
import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.ConsensusVote;
import io.swarmmesh.model.GossipState;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageDraft;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.NodeView;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskStatus;
import io.swarmmesh.model.VoteDecision;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.routing.MessageHandler;
import io.swarmmesh.routing.MessageRouter;
import io.swarmmesh.routing.MessageTransport;
import io.swarmmesh.routing.RoutingInfo;
import io.swarmmesh.security.PayloadCrypto;
import io.swarmmesh.util.Jsons;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SwarmRuntime {
    private static final StructuredLogger LOG = StructuredLogger.of(SwarmRuntime.class);
    static final String DEFAULT_ADDRESS = "in-memory";

    private final String nodeId;
    private final SwarmSettings settings;
    private final SwarmEventBus bus;
    private final NodeRegistry registry;
    private final MessageRouter router;
    private final GossipEngine gossip;
    private final ConsensusEngine consensus;
    private final TaskDistributionEngine distribution;
    private final Map<String, NodeStatus> lastStatuses = new HashMap<>();

    private long now;
    private long lastMessageTick;
    private long lastGossipRound;
    private long lastHeartbeat;
    private long lastDistributionTick;
    private boolean shutdown;

    public SwarmRuntime(
            String nodeId,
            SwarmSettings settings,
            MessageTransport transport,
            PayloadCrypto crypto,
            SwarmPolicies policies,
            SwarmEventBus bus,
            long startMs
    ) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        this.nodeId = nodeId;
        this.settings = settings;
        this.bus = bus;
        this.now = startMs;
        this.lastMessageTick = startMs;
        this.lastGossipRound = startMs;
        this.lastHeartbeat = startMs;
        this.lastDistributionTick = startMs;

        this.registry = new NodeRegistry(nodeId, settings.heartbeatIntervalMs());
        this.router = new MessageRouter(
                nodeId,
                settings,
                registry,
                transport,
                List.of(new GzipCompressionCodec(), new AesGcmEncryptionCodec(crypto)),
                bus,
                this::now
        );
        this.gossip = new GossipEngine(nodeId, router, registry, policies.random(), settings.gossipFanout(), bus,
                this::now);
        this.consensus = new ConsensusEngine(nodeId, router, registry, policies.evaluator(),
                settings.consensusTimeoutMs(), bus, this::now);
        this.distribution = new TaskDistributionEngine(
                nodeId,
                settings,
                policies.decomposer(),
                new AssignmentOptimizer(policies.scorer(), policies.predictor(), settings.minTrustScore(),
                        settings.noProgressEscalationMs()),
                new WorkloadBalancer(settings.imbalanceDeviation(), settings.rebalanceSeverityThreshold(),
                        policies.rebalanceAction()),
                policies.failurePolicy(),
                new ControlMessageNotifier(),
                bus,
                this::now
        );

        router.registerRoute(MessageType.GOSSIP, gossip::route);
        router.registerBuiltInHandler(MessageType.HEARTBEAT, this::onHeartbeat);
        router.registerBuiltInHandler(MessageType.GOSSIP, gossip::onMessage);
        router.registerBuiltInHandler(MessageType.CONSENSUS, consensus::onMessage);
        router.registerBuiltInHandler(MessageType.ELECTION, message -> LOG.debug("Election message received", StructuredLogger.fields(
                "messageId", message.id(),
                "sender", message.sender()
        )));
        router.registerBuiltInHandler(MessageType.CONTROL, this::onControl);
    }

    public String nodeId() {
        return nodeId;
    }

    public long now() {
        return now;
    }

    public SwarmSettings settings() {
        return settings;
    }

    public SwarmEventBus bus() {
        return bus;
    }

    public NodeRegistry registry() {
        return registry;
    }

    public MessageRouter router() {
        return router;
    }

    public GossipEngine gossip() {
        return gossip;
    }

    public ConsensusEngine consensus() {
        return consensus;
    }

    public TaskDistributionEngine distribution() {
        return distribution;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public void advance(long nowMs) {
        if (shutdown) {
            return;
        }
        now = Math.max(now, nowMs);
        if (now - lastMessageTick >= settings.messageTickMs()) {
            lastMessageTick = now;
            runLoop("message", this::messageTick);
        }
        if (now - lastGossipRound >= settings.gossipIntervalMs()) {
            lastGossipRound = now;
            runLoop("gossip", gossip::performRound);
        }
        if (now - lastHeartbeat >= settings.heartbeatIntervalMs()) {
            lastHeartbeat = now;
            runLoop("heartbeat", this::sendHeartbeat);
        }
        if (now - lastDistributionTick >= settings.distributionTickMs()) {
            lastDistributionTick = now;
            runLoop("distribution", () -> distribution.tick(now));
        }
    }

    public void registerNode(CommunicationNode node) {
        ensureRunning();
        boolean added = registry.register(node, now);
        router.rebuildTopology();
        lastStatuses.put(node.id(), NodeStatus.ONLINE);
        if (added) {
            bus.publish(new SwarmEvents.NodeRegistered(nodeId, node.id(), node.address(), node.port()));
            LOG.info("Node registered", StructuredLogger.fields(
                    "peerId", node.id(),
                    "address", node.address(),
                    "port", node.port()
            ));
        }
    }

    public boolean connectNode(String peerId) {
        ensureRunning();
        if (!registry.connect(peerId, now)) {
            return false;
        }
        router.rebuildTopology();
        bus.publish(new SwarmEvents.NodeConnected(nodeId, peerId));
        return true;
    }

    public boolean disconnectNode(String peerId) {
        ensureRunning();
        if (!registry.disconnect(peerId)) {
            return false;
        }
        router.rebuildTopology();
        bus.publish(new SwarmEvents.NodeDisconnected(nodeId, peerId));
        LOG.warn("Node disconnected", StructuredLogger.fields("peerId", peerId));
        return true;
    }

    public Optional<NodeView> node(String peerId) {
        return registry.find(peerId, now);
    }

    public String sendMessage(MessageDraft draft) {
        ensureRunning();
        return router.sendMessage(draft);
    }

    public String broadcast(Object data, MessagePriority priority) {
        ensureRunning();
        return router.broadcast(MessagePayload.of(data), priority);
    }

    public String multicast(List<String> recipients, Object data, MessagePriority priority) {
        ensureRunning();
        return router.multicast(recipients, MessagePayload.of(data), priority);
    }

    public String unicast(String recipient, Object data, MessagePriority priority) {
        ensureRunning();
        return router.unicast(recipient, MessagePayload.of(data), priority);
    }

    public boolean receive(Message message) {
        if (shutdown) {
            return false;
        }
        return router.receive(message);
    }

    public void registerHandler(MessageType type, MessageHandler handler) {
        router.registerHandler(type, handler);
    }

    public GossipState startGossip(String key, Object data) {
        ensureRunning();
        return gossip.startGossip(key, data);
    }

    public GossipState startGossip(String key, Object data, long version) {
        ensureRunning();
        return gossip.startGossip(key, data, version);
    }

    public String initiateConsensus(ProposalType type, Object value, List<String> participants) {
        ensureRunning();
        return consensus.initiate(type, value, participants);
    }

    public ConsensusVote vote(String proposalId, VoteDecision decision, String reasoning) {
        ensureRunning();
        return consensus.vote(proposalId, decision, reasoning);
    }

    public String submitTask(TaskDefinition definition) {
        ensureRunning();
        return distribution.submitTask(definition);
    }

    public void registerAgent(AgentCapability capability) {
        ensureRunning();
        distribution.registerAgent(capability);
    }

    public boolean cancelTask(String taskId, CancellationReason reason) {
        return distribution.cancelTask(taskId, reason);
    }

    public boolean reassignTask(String taskId, CancellationReason reason) {
        return distribution.reassignTask(taskId, reason);
    }

    public boolean reportProgress(String taskId, double progress, String note) {
        return distribution.reportProgress(taskId, progress, note);
    }

    public boolean completeTask(String taskId, JsonNode result) {
        return distribution.completeTask(taskId, result);
    }

    public boolean failTask(String taskId, String error) {
        return distribution.failTask(taskId, error);
    }

    public List<String> markAgentUnavailable(String agentId) {
        return distribution.markAgentUnavailable(agentId);
    }

    public boolean updateAgentPerformance(String agentId, AgentCapability.PerformanceProfile profile) {
        return distribution.updateAgentPerformance(agentId, profile);
    }

    public boolean updateAgentCapabilities(String agentId, List<String> capabilities) {
        return distribution.updateAgentCapabilities(agentId, capabilities);
    }

    public String sendControl(String targetNodeId, ObjectNode body) {
        ensureRunning();
        return router.sendMessage(MessageDraft.of(MessageType.CONTROL, List.of(targetNodeId), MessagePayload.of(body),
                MessagePriority.HIGH));
    }

    public QueueStatus getQueueStatus() {
        return distribution.getQueueStatus();
    }

    public Optional<TaskStatus> getTaskStatus(String taskId) {
        return distribution.getTaskStatus(taskId);
    }

    public Optional<TaskView> task(String taskId) {
        return distribution.task(taskId);
    }

    public DistributionMetrics distributionMetrics() {
        return distribution.metrics();
    }

    public RoutingInfo getRoutingInfo() {
        return router.routingInfo();
    }

    public CommunicationMetrics getMetrics() {
        List<NodeView> peers = registry.snapshot(now);
        int online = 0;
        int degraded = 0;
        int offline = 0;
        long sent = 0L;
        long received = 0L;
        long bytes = 0L;
        long errors = 0L;
        for (NodeView peer : peers) {
            switch (peer.status()) {
                case ONLINE -> online++;
                case DEGRADED -> degraded++;
                case OFFLINE -> offline++;
            }
            sent += peer.messagesSent();
            received += peer.messagesReceived();
            bytes += peer.bytesTransferred();
            errors += peer.errors();
        }
        return new CommunicationMetrics(
                nodeId,
                peers.size(),
                online,
                degraded,
                offline,
                router.queuedCount(),
                router.queueDepths(),
                router.historySize(),
                gossip.size(),
                consensus.activeCount(),
                sent,
                received,
                bytes,
                errors,
                registry.networkHealth(now)
        );
    }

    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        bus.publish(new SwarmEvents.Shutdown(nodeId, now));
        LOG.info("Swarm runtime shut down", StructuredLogger.fields(
                "nodeId", nodeId,
                "queuedMessages", router.queuedCount(),
                "runningTasks", distribution.getQueueStatus().processing()
        ));
    }

    private void messageTick() {
        router.processQueues(now);
        router.sweep(now);
        consensus.sweep(now);
        trackPeerStatus();
    }

    private void sendHeartbeat() {
        if (registry.size() == 0) {
            return;
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("nodeId", nodeId);
        body.put("timestamp", now);
        body.put("runningTasks", distribution.getQueueStatus().processing());
        router.sendMessage(MessageDraft.of(MessageType.HEARTBEAT, List.of(), MessagePayload.of(body),
                MessagePriority.BACKGROUND));
    }

    private void trackPeerStatus() {
        for (String peerId : registry.peerIds()) {
            NodeStatus current = registry.statusOf(peerId, now);
            NodeStatus previous = lastStatuses.put(peerId, current);
            if (previous == null || previous == current) {
                continue;
            }
            LOG.warn("Peer status changed", StructuredLogger.fields(
                    "peerId", peerId,
                    "from", previous.wire(),
                    "to", current.wire()
            ));
            Optional<AgentCapability> agent = distribution.agent(peerId);
            if (agent.isEmpty()) {
                continue;
            }
            if (current == NodeStatus.OFFLINE) {
                distribution.markAgentUnavailable(peerId);
            } else if (previous == NodeStatus.OFFLINE && agent.get().availability() == AvailabilityStatus.OFFLINE) {
                distribution.setAgentAvailability(peerId, AvailabilityStatus.AVAILABLE);
            }
        }
    }

    private void onHeartbeat(Message message) {
        LOG.debug("Heartbeat received", StructuredLogger.fields(
                "sender", message.sender(),
                "runningTasks", message.payload().data().path("runningTasks").asInt(0)
        ));
    }

    private void onControl(Message message) {
        JsonNode body = message.payload().data();
        String kind = body.path(ControlMessages.KIND).asText("");
        String taskId = body.path(ControlMessages.TASK_ID).asText("");
        if (!kind.equals(ControlMessages.TASK_PROGRESS)
                && !kind.equals(ControlMessages.TASK_COMPLETED)
                && !kind.equals(ControlMessages.TASK_FAILED)) {
            return;
        }
        Optional<TaskAssignment> assignment = distribution.assignment(taskId);
        if (assignment.isEmpty() || !assignment.get().agentId().equals(message.sender())) {
            LOG.warn("Ignoring task report from a node that does not hold the task", StructuredLogger.fields(
                    "taskId", taskId,
                    "sender", message.sender(),
                    "kind", kind
            ));
            return;
        }
        switch (kind) {
            case ControlMessages.TASK_PROGRESS -> distribution.reportProgress(taskId,
                    body.path("progress").asDouble(0.0), body.path("note").asText(null));
            case ControlMessages.TASK_COMPLETED -> distribution.completeTask(taskId, body.get("result"));
            case ControlMessages.TASK_FAILED -> distribution.failTask(taskId, body.path("error").asText("unknown error"));
            default -> {
            }
        }
    }

    private void runLoop(String name, Runnable loop) {
        try {
            loop.run();
        } catch (RuntimeException e) {
            LOG.error("Periodic loop failed", StructuredLogger.fields(
                    "nodeId", nodeId,
                    "loop", name
            ), e);
        }
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new SwarmException("Swarm runtime " + nodeId + " is shut down");
        }
    }

    private final class ControlMessageNotifier implements AssignmentNotifier {
        @Override
        public void assigned(TaskAssignment assignment, TaskDefinition task) {
            if (registry.contains(assignment.agentId())) {
                sendControl(assignment.agentId(), ControlMessages.taskAssigned(assignment, task));
            }
        }

        @Override
        public void revoked(String taskId, String agentId, CancellationReason reason) {
            if (registry.contains(agentId)) {
                sendControl(agentId, ControlMessages.taskRevoked(taskId, reason));
            }
        }
    }
}
