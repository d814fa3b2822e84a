package io.swarmmesh.consensus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.error.SwarmTimeoutException;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.ConsensusProposal;
import io.swarmmesh.model.ConsensusResult;
import io.swarmmesh.model.ConsensusVote;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessageDraft;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.VoteDecision;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.routing.MessageRouter;
import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Ids;
import io.swarmmesh.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

public final class ConsensusEngine {
    private static final StructuredLogger LOG = StructuredLogger.of(ConsensusEngine.class);
    static final String PROPOSAL = "consensus_proposal";
    static final String VOTE = "consensus_vote";

    private final String localNodeId;
    private final MessageRouter router;
    private final NodeRegistry registry;
    private final ProposalEvaluator evaluator;
    private final long timeoutMs;
    private final SwarmEventBus bus;
    private final LongSupplier clock;
    private final Map<String, ConsensusProposal> proposals = new LinkedHashMap<>();
    private final Map<String, Map<String, ConsensusVote>> votes = new LinkedHashMap<>();

    public ConsensusEngine(String localNodeId, MessageRouter router, NodeRegistry registry, ProposalEvaluator evaluator,
                           long timeoutMs, SwarmEventBus bus, LongSupplier clock) {
        this.localNodeId = localNodeId;
        this.router = router;
        this.registry = registry;
        this.evaluator = evaluator;
        this.timeoutMs = timeoutMs;
        this.bus = bus;
        this.clock = clock;
    }

    public static int quorum(int knownNodes) {
        return Math.max(1, (2 * knownNodes) / 3);
    }

    public String initiate(ProposalType type, Object value, List<String> participants) {
        if (type == null) {
            throw new ValidationException("proposal type is required");
        }
        long now = clock.getAsLong();
        List<String> targets = participants == null || participants.isEmpty()
                ? registry.peerIds()
                : List.copyOf(participants);
        String id = Ids.proposalId(now);
        JsonNode tree = Jsons.toTree(value);
        String signature = Hashing.sha256Hex(id + ":" + Jsons.toCanonicalJson(tree) + ":" + localNodeId);
        ConsensusProposal proposal = new ConsensusProposal(id, type, localNodeId, tree, 1, now, targets,
                Map.of(localNodeId, signature));
        proposals.put(id, proposal);
        votes.put(id, new LinkedHashMap<>());
        if (!targets.isEmpty()) {
            ObjectNode data = Jsons.mapper().createObjectNode();
            data.put("type", PROPOSAL);
            data.set("proposal", Jsons.toTree(proposal));
            router.sendMessage(MessageDraft.of(MessageType.CONSENSUS, targets, MessagePayload.of(data), MessagePriority.HIGH));
        }
        bus.publish(new SwarmEvents.ConsensusInitiated(localNodeId, id, type, targets));
        LOG.info("Consensus initiated", StructuredLogger.fields(
                "proposalId", id,
                "type", type.wire(),
                "participants", targets.size(),
                "quorum", quorum(registry.size())
        ));
        return id;
    }

    public ConsensusVote vote(String proposalId, VoteDecision decision, String reasoning) {
        ConsensusProposal proposal = proposals.get(proposalId);
        if (proposal == null) {
            throw new ValidationException("Unknown proposal " + proposalId);
        }
        if (decision == null) {
            throw new ValidationException("vote decision is required");
        }
        long now = clock.getAsLong();
        String signature = Hashing.sha256Hex(proposalId + ":" + decision.wire() + ":" + localNodeId + ":" + now);
        ConsensusVote vote = new ConsensusVote(proposalId, localNodeId, decision, reasoning, now, signature);
        bus.publish(new SwarmEvents.VoteCast(localNodeId, proposalId, localNodeId, decision));
        if (localNodeId.equals(proposal.proposer())) {
            recordVote(vote);
        } else {
            votes.computeIfAbsent(proposalId, ignored -> new LinkedHashMap<>()).putIfAbsent(localNodeId, vote);
            ObjectNode data = Jsons.mapper().createObjectNode();
            data.put("type", VOTE);
            data.set("vote", Jsons.toTree(vote));
            router.sendMessage(MessageDraft.of(MessageType.CONSENSUS, List.of(proposal.proposer()),
                    MessagePayload.of(data), MessagePriority.HIGH));
        }
        return vote;
    }

    public void onMessage(Message message) {
        JsonNode data = message.payload().data();
        String kind = data.path("type").asText("");
        try {
            if (PROPOSAL.equals(kind)) {
                handleProposal(Jsons.mapper().treeToValue(data.path("proposal"), ConsensusProposal.class));
            } else if (VOTE.equals(kind)) {
                handleVote(Jsons.mapper().treeToValue(data.path("vote"), ConsensusVote.class));
            }
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring malformed consensus message", StructuredLogger.fields(
                    "messageId", message.id(),
                    "sender", message.sender(),
                    "error", e.getMessage()
            ));
        }
    }

    void handleProposal(ConsensusProposal proposal) {
        if (proposal == null || proposals.containsKey(proposal.id())) {
            return;
        }
        proposals.put(proposal.id(), proposal);
        VoteDecision decision;
        String reasoning;
        try {
            decision = evaluator.evaluate(proposal);
            reasoning = "evaluated by local policy";
        } catch (RuntimeException e) {
            LOG.error("Proposal evaluator failed, abstaining", StructuredLogger.fields(
                    "proposalId", proposal.id()
            ), e);
            decision = VoteDecision.ABSTAIN;
            reasoning = "evaluator failed: " + e.getMessage();
        }
        vote(proposal.id(), decision == null ? VoteDecision.ABSTAIN : decision, reasoning);
    }

    void handleVote(ConsensusVote vote) {
        if (vote == null) {
            return;
        }
        if (!proposals.containsKey(vote.proposalId())) {
            LOG.debug("Vote for unknown or resolved proposal", StructuredLogger.fields(
                    "proposalId", vote.proposalId(),
                    "voter", vote.voter()
            ));
            return;
        }
        recordVote(vote);
    }

    private void recordVote(ConsensusVote vote) {
        Map<String, ConsensusVote> ballot = votes.computeIfAbsent(vote.proposalId(), ignored -> new LinkedHashMap<>());
        if (ballot.putIfAbsent(vote.voter(), vote) != null) {
            LOG.debug("Ignoring duplicate vote", StructuredLogger.fields(
                    "proposalId", vote.proposalId(),
                    "voter", vote.voter()
            ));
            return;
        }
        checkResult(vote.proposalId());
    }

    private void checkResult(String proposalId) {
        ConsensusProposal proposal = proposals.get(proposalId);
        Map<String, ConsensusVote> ballot = votes.get(proposalId);
        if (proposal == null || ballot == null) {
            return;
        }
        int quorum = quorum(registry.size());
        if (ballot.size() < quorum) {
            return;
        }
        int accepts = (int) ballot.values().stream().filter(v -> v.decision() == VoteDecision.ACCEPT).count();
        ConsensusResult result = accepts >= quorum ? ConsensusResult.ACCEPTED : ConsensusResult.REJECTED;
        proposals.remove(proposalId);
        votes.remove(proposalId);
        bus.publish(new SwarmEvents.ConsensusReached(localNodeId, proposalId, result, accepts, ballot.size(),
                proposal.value()));
        LOG.info("Consensus reached", StructuredLogger.fields(
                "proposalId", proposalId,
                "result", result.wire(),
                "accepts", accepts,
                "votes", ballot.size(),
                "quorum", quorum
        ));
    }

    public int sweep(long nowMs) {
        int dropped = 0;
        Iterator<ConsensusProposal> it = proposals.values().iterator();
        while (it.hasNext()) {
            ConsensusProposal proposal = it.next();
            if (nowMs - proposal.timestampMs() > timeoutMs) {
                it.remove();
                Map<String, ConsensusVote> ballot = votes.remove(proposal.id());
                SwarmTimeoutException timeout = new SwarmTimeoutException("Proposal " + proposal.id()
                        + " timed out after " + timeoutMs + " ms");
                LOG.warn("Consensus proposal expired", StructuredLogger.fields(
                        "proposalId", proposal.id(),
                        "votes", ballot == null ? 0 : ballot.size(),
                        "error", timeout.getMessage()
                ));
                dropped++;
            }
        }
        return dropped;
    }

    public Optional<ConsensusProposal> proposal(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    public List<ConsensusVote> votesFor(String proposalId) {
        Map<String, ConsensusVote> ballot = votes.get(proposalId);
        return ballot == null ? List.of() : new ArrayList<>(ballot.values());
    }

    public Collection<ConsensusProposal> activeProposals() {
        return List.copyOf(proposals.values());
    }

    public int activeCount() {
        return proposals.size();
    }
}
