package io.swarmmesh.distribution;

import java.util.List;
import java.util.Map;

public record QueueStatus(
        List<String> pending,
        int processing,
        Map<String, String> assignments,
        AgentSummary agents
) {
    public record AgentSummary(int available, int busy, int offline, double utilization) {
    }
}
