package io.swarmmesh.model;

import java.util.List;

public record TaskAssignment(
        String taskId,
        String agentId,
        long assignedAtMs,
        long expectedCompletionMs,
        Details details,
        Monitoring monitoring
) {
    public record Details(
            double confidence,
            List<String> reasoning,
            List<String> alternativeAgents,
            ResourceAllocation resourceAllocation,
            QualityExpectation qualityExpectation
    ) {
        public Details {
            reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
            alternativeAgents = alternativeAgents == null ? List.of() : List.copyOf(alternativeAgents);
        }
    }

    public record ResourceAllocation(double cpu, double memory, double network, double storage, double priorityWeight) {
    }

    public record QualityExpectation(double expectedAccuracy, long expectedTimeMs, double confidenceInterval) {
    }

    public record Monitoring(
            long checkIntervalMs,
            boolean progressTracking,
            List<QualityCheck> qualityChecks,
            List<EscalationTrigger> escalationTriggers
    ) {
        public Monitoring {
            qualityChecks = qualityChecks == null ? List.of() : List.copyOf(qualityChecks);
            escalationTriggers = escalationTriggers == null ? List.of() : List.copyOf(escalationTriggers);
        }
    }

    public record QualityCheck(String type, long intervalMs, double threshold, EscalationAction action) {
    }

    public record EscalationTrigger(String condition, double threshold, EscalationAction action) {
    }
}
