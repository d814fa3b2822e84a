package io.swarmmesh.distribution;

import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.observability.StructuredLogger;

import java.util.Comparator;
import java.util.Locale;

@FunctionalInterface
public interface RebalanceAction {
    void rebalance(LoadImbalance imbalance, RebalanceContext context);

    static RebalanceAction logOnly() {
        StructuredLogger log = StructuredLogger.of(RebalanceAction.class);
        return (imbalance, context) -> log.warn("Workload imbalance detected", StructuredLogger.fields(
                "severity", imbalance.severity(),
                "overloaded", imbalance.overloadedAgents(),
                "underloaded", imbalance.underloadedAgents()
        ));
    }

    static RebalanceAction reassignNewest() {
        return (imbalance, context) -> {
            for (String agentId : imbalance.overloadedAgents()) {
                context.assignmentsOf(agentId).stream()
                        .max(Comparator.comparingLong(TaskAssignment::assignedAtMs))
                        .ifPresent(newest -> context.reassign(newest.taskId(), CancellationReason.REBALANCE));
            }
        };
    }

    static RebalanceAction fromSetting(String strategy) {
        String normalized = strategy == null ? "log" : strategy.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "reassign" -> reassignNewest();
            case "log", "" -> logOnly();
            default -> throw new IllegalArgumentException("Unknown rebalance strategy: " + strategy);
        };
    }
}
