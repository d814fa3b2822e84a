package io.swarmmesh.distribution;

import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.observability.StructuredLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class WorkloadBalancer {
    private static final StructuredLogger LOG = StructuredLogger.of(WorkloadBalancer.class);

    private final double deviation;
    private final double severityThreshold;
    private final RebalanceAction action;

    public WorkloadBalancer(double deviation, double severityThreshold, RebalanceAction action) {
        this.deviation = deviation;
        this.severityThreshold = severityThreshold;
        this.action = action;
    }

    public LoadImbalance detect(Collection<AgentCapability> agents) {
        if (agents.isEmpty()) {
            return LoadImbalance.none(0.0);
        }
        double mean = agents.stream().mapToDouble(AgentCapability::utilization).average().orElse(0.0);
        List<String> overloaded = new ArrayList<>();
        List<String> underloaded = new ArrayList<>();
        for (AgentCapability agent : agents) {
            double utilization = agent.utilization();
            if (utilization > mean + deviation) {
                overloaded.add(agent.agentId());
            } else if (utilization < mean - deviation) {
                underloaded.add(agent.agentId());
            }
        }
        double severity = (double) Math.min(overloaded.size(), underloaded.size()) / agents.size();
        return new LoadImbalance(severity, mean, overloaded, underloaded);
    }

    public Optional<LoadImbalance> rebalanceIfNeeded(Collection<AgentCapability> agents, RebalanceContext context) {
        LoadImbalance imbalance = detect(agents);
        if (imbalance.severity() <= severityThreshold) {
            return Optional.empty();
        }
        try {
            action.rebalance(imbalance, context);
        } catch (RuntimeException e) {
            LOG.error("Rebalance action failed", StructuredLogger.fields("severity", imbalance.severity()), e);
        }
        return Optional.of(imbalance);
    }

    public static double loadBalanceScore(Collection<AgentCapability> agents) {
        if (agents.isEmpty()) {
            return 1.0;
        }
        double mean = agents.stream().mapToDouble(AgentCapability::utilization).average().orElse(0.0);
        double variance = agents.stream()
                .mapToDouble(agent -> Math.pow(agent.utilization() - mean, 2))
                .average()
                .orElse(0.0);
        return 1.0 - Math.sqrt(variance);
    }
}
