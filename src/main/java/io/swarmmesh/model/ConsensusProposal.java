package io.swarmmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record ConsensusProposal(
        String id,
        ProposalType type,
        String proposer,
        JsonNode value,
        int round,
        long timestampMs,
        List<String> participants,
        Map<String, String> signatures
) {
    public ConsensusProposal {
        participants = participants == null ? List.of() : List.copyOf(participants);
        signatures = signatures == null ? Map.of() : Map.copyOf(signatures);
    }
}
