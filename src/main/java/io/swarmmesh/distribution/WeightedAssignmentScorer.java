package io.swarmmesh.distribution;

import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.TaskDefinition;

import java.util.List;

public final class WeightedAssignmentScorer implements AssignmentScorer {
    static final double CAPABILITY_WEIGHT = 0.3;
    static final double PERFORMANCE_WEIGHT = 0.3;
    static final double LOAD_WEIGHT = 0.2;
    static final double TRUST_WEIGHT = 0.2;

    @Override
    public double score(TaskDefinition task, AgentCapability agent) {
        return CAPABILITY_WEIGHT * capabilityMatch(task, agent)
                + PERFORMANCE_WEIGHT * performanceScore(task, agent)
                + LOAD_WEIGHT * loadAvailability(agent)
                + TRUST_WEIGHT * agent.trustScore();
    }

    public static double capabilityMatch(TaskDefinition task, AgentCapability agent) {
        List<String> required = task.requirements().capabilities();
        if (required.isEmpty()) {
            return 1.0;
        }
        long matched = required.stream().filter(agent.capabilities()::contains).count();
        return (double) matched / required.size();
    }

    public static double performanceScore(TaskDefinition task, AgentCapability agent) {
        AgentCapability.PerformanceMetrics byType = agent.performance().byTaskType().get(task.type());
        if (byType != null) {
            return byType.successRate() * byType.efficiency();
        }
        return agent.performance().overall().successRate();
    }

    public static double loadAvailability(AgentCapability agent) {
        if (agent.maxLoad() <= 0) {
            return 0.0;
        }
        return 1.0 - (double) agent.currentLoad() / agent.maxLoad();
    }
}
