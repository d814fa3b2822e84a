package io.swarmmesh.consensus;

import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.CommunicationNode;
import io.swarmmesh.model.ConsensusProposal;
import io.swarmmesh.model.ConsensusResult;
import io.swarmmesh.model.ConsensusVote;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.VoteDecision;
import io.swarmmesh.registry.NodeRegistry;
import io.swarmmesh.routing.MessageRouter;
import io.swarmmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ConsensusEngineTest {

    @Test
    void quorumIsTwoThirdsRoundedDown() {
        assertEquals(1, ConsensusEngine.quorum(0));
        assertEquals(1, ConsensusEngine.quorum(1));
        assertEquals(2, ConsensusEngine.quorum(3));
        assertEquals(2, ConsensusEngine.quorum(4));
        assertEquals(6, ConsensusEngine.quorum(9));
    }

    @Test
    void twoAcceptsOutOfThreeKnownNodesReachAgreement() {
        Fixture f = fixture(ProposalEvaluator.alwaysAccept(), "p1", "p2", "p3");
        String id = f.engine().initiate(ProposalType.VALUE, Map.of("limit", 5), List.of());

        f.engine().vote(id, VoteDecision.ACCEPT, "proposer agrees");
        assertTrue(f.reached().isEmpty());
        assertEquals(1, f.engine().votesFor(id).size());

        f.engine().handleVote(vote(id, "p1", VoteDecision.ACCEPT));

        assertEquals(1, f.reached().size());
        SwarmEvents.ConsensusReached reached = f.reached().get(0);
        assertEquals(ConsensusResult.ACCEPTED, reached.result());
        assertEquals(2, reached.acceptVotes());
        assertEquals(5, reached.value().path("limit").asInt());
        assertEquals(0, f.engine().activeCount());
    }

    @Test
    void singleVoteDoesNotResolve() {
        Fixture f = fixture(ProposalEvaluator.alwaysAccept(), "p1", "p2", "p3");
        String id = f.engine().initiate(ProposalType.CONFIGURATION, "x", List.of());

        f.engine().handleVote(vote(id, "p1", VoteDecision.ACCEPT));
        f.engine().handleVote(vote(id, "p1", VoteDecision.ACCEPT));

        assertTrue(f.reached().isEmpty());
        assertEquals(1, f.engine().votesFor(id).size());
        assertEquals(1, f.engine().activeCount());
    }

    @Test
    void quorumOfVotesWithoutQuorumOfAcceptsIsRejected() {
        Fixture f = fixture(ProposalEvaluator.alwaysAccept(), "p1", "p2", "p3");
        String id = f.engine().initiate(ProposalType.LEADER, "p2", List.of());

        f.engine().handleVote(vote(id, "p1", VoteDecision.ACCEPT));
        f.engine().handleVote(vote(id, "p2", VoteDecision.REJECT));

        assertEquals(1, f.reached().size());
        assertEquals(ConsensusResult.REJECTED, f.reached().get(0).result());
        assertEquals(1, f.reached().get(0).acceptVotes());
        assertEquals(2, f.reached().get(0).totalVotes());
    }

    @Test
    void proposalIsMulticastToPeersAndReceiversVoteBack() {
        Fixture f = fixture(ProposalEvaluator.alwaysReject(), "p1", "p2");
        f.engine().initiate(ProposalType.VALUE, 1, List.of());
        assertEquals(1, f.router().queueDepths().get(MessagePriority.HIGH));

        ConsensusProposal remote = new ConsensusProposal("proposal_remote", ProposalType.VALUE, "p1",
                Jsons.toTree(1), 1, 0L, List.of("local"), Map.of());
        f.engine().handleProposal(remote);

        List<ConsensusVote> cast = f.engine().votesFor("proposal_remote");
        assertEquals(1, cast.size());
        assertEquals(VoteDecision.REJECT, cast.get(0).decision());
        assertEquals("local", cast.get(0).voter());
        assertEquals(2, f.router().queueDepths().get(MessagePriority.HIGH));
    }

    @Test
    void failingEvaluatorAbstains() {
        Fixture f = fixture(proposal -> {
            throw new IllegalStateException("boom");
        }, "p1");
        f.engine().handleProposal(new ConsensusProposal("proposal_x", ProposalType.VALUE, "p1",
                Jsons.toTree("v"), 1, 0L, List.of("local"), Map.of()));

        assertEquals(VoteDecision.ABSTAIN, f.engine().votesFor("proposal_x").get(0).decision());
    }

    @Test
    void expiredProposalsAreSweptWithoutResult() {
        Fixture f = fixture(ProposalEvaluator.alwaysAccept(), "p1", "p2", "p3");
        String id = f.engine().initiate(ProposalType.VALUE, 1, List.of());

        assertEquals(0, f.engine().sweep(SwarmSettings.defaults().consensusTimeoutMs()));
        assertEquals(1, f.engine().sweep(SwarmSettings.defaults().consensusTimeoutMs() + 1L));
        assertTrue(f.engine().proposal(id).isEmpty());
        assertTrue(f.reached().isEmpty());
        Assertions.assertThrows(ValidationException.class, () -> f.engine().vote(id, VoteDecision.ACCEPT, null));
    }

    @Test
    void policySettingResolvesEvaluators() {
        ConsensusProposal proposal = new ConsensusProposal("p", ProposalType.VALUE, "x",
                Jsons.toTree(Map.of("score", 0.7)), 1, 0L, List.of(), Map.of());

        assertEquals(VoteDecision.ACCEPT, ProposalEvaluator.fromSetting("accept").evaluate(proposal));
        assertEquals(VoteDecision.REJECT, ProposalEvaluator.fromSetting("reject").evaluate(proposal));
        assertEquals(VoteDecision.ACCEPT, ProposalEvaluator.fromSetting("threshold:score:0.5").evaluate(proposal));
        assertEquals(VoteDecision.REJECT, ProposalEvaluator.fromSetting("threshold:score:0.9").evaluate(proposal));
        assertEquals(VoteDecision.ABSTAIN, ProposalEvaluator.fromSetting("threshold:other:0.1").evaluate(proposal));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ProposalEvaluator.fromSetting("maybe"));
    }

    private static Fixture fixture(ProposalEvaluator evaluator, String... peers) {
        NodeRegistry registry = new NodeRegistry("local", 10_000L);
        for (String peer : peers) {
            registry.register(CommunicationNode.of(peer, "in-memory", 0), 0L);
        }
        SwarmEventBus bus = new SwarmEventBus();
        List<SwarmEvents.ConsensusReached> reached = new ArrayList<>();
        bus.subscribe(SwarmEvents.ConsensusReached.class, reached::add);
        MessageRouter router = new MessageRouter("local", SwarmSettings.defaults(), registry, (target, m) -> {
        }, List.of(), bus, () -> 0L);
        ConsensusEngine engine = new ConsensusEngine("local", router, registry, evaluator,
                SwarmSettings.defaults().consensusTimeoutMs(), bus, () -> 0L);
        return new Fixture(engine, router, reached);
    }

    private static ConsensusVote vote(String proposalId, String voter, VoteDecision decision) {
        return new ConsensusVote(proposalId, voter, decision, null, 0L, "sig");
    }

    private record Fixture(ConsensusEngine engine, MessageRouter router, List<SwarmEvents.ConsensusReached> reached) {
    }
}
