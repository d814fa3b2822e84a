package io.swarmmesh.distribution;

import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.TaskDefinition;

@FunctionalInterface
public interface SuccessPredictor {
    double predict(TaskDefinition task, AgentCapability agent);

    static SuccessPredictor historical() {
        return (task, agent) -> {
            AgentCapability.PerformanceMetrics byType = agent.performance().byTaskType().get(task.type());
            double rate = byType != null ? byType.successRate() : agent.performance().overall().successRate();
            return Math.max(0.0, Math.min(1.0, rate));
        };
    }
}
