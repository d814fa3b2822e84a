package io.swarmmesh.model;

public record ConsensusVote(
        String proposalId,
        String voter,
        VoteDecision decision,
        String reasoning,
        long timestampMs,
        String signature
) {
}
