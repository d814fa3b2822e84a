package io.swarmmesh.consensus;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.model.ConsensusProposal;
import io.swarmmesh.model.VoteDecision;

import java.util.Locale;

@FunctionalInterface
public interface ProposalEvaluator {
    VoteDecision evaluate(ConsensusProposal proposal);

    static ProposalEvaluator alwaysAccept() {
        return proposal -> VoteDecision.ACCEPT;
    }

    static ProposalEvaluator alwaysReject() {
        return proposal -> VoteDecision.REJECT;
    }

    static ProposalEvaluator thresholdOnField(String field, double minimum) {
        return proposal -> {
            JsonNode value = proposal.value() == null ? null : proposal.value().get(field);
            if (value == null || !value.isNumber()) {
                return VoteDecision.ABSTAIN;
            }
            return value.asDouble() >= minimum ? VoteDecision.ACCEPT : VoteDecision.REJECT;
        };
    }

    static ProposalEvaluator fromSetting(String policy) {
        String normalized = policy == null ? "accept" : policy.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("accept")) {
            return alwaysAccept();
        }
        if (normalized.equals("reject")) {
            return alwaysReject();
        }
        if (normalized.startsWith("threshold:")) {
            String[] parts = policy.trim().split(":");
            if (parts.length == 3) {
                try {
                    return thresholdOnField(parts[1], Double.parseDouble(parts[2]));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid threshold in consensus policy: " + policy, e);
                }
            }
        }
        throw new IllegalArgumentException("Unknown consensus policy: " + policy);
    }
}
