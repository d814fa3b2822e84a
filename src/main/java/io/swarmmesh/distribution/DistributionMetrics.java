package io.swarmmesh.distribution;

import java.util.Map;

public record DistributionMetrics(
        long totalTasks,
        int queuedTasks,
        int runningTasks,
        long completedTasks,
        long failedTasks,
        long cancelledTasks,
        long retriedAttempts,
        double averageWaitTimeMs,
        double averageExecutionTimeMs,
        double throughputPerMinute,
        double successRate,
        double loadBalance,
        double resourceEfficiency,
        Map<String, Double> agentUtilization
) {
}
