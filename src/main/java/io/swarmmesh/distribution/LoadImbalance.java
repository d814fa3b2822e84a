package io.swarmmesh.distribution;

import java.util.List;

public record LoadImbalance(
        double severity,
        double meanUtilization,
        List<String> overloadedAgents,
        List<String> underloadedAgents
) {
    public LoadImbalance {
        overloadedAgents = List.copyOf(overloadedAgents);
        underloadedAgents = List.copyOf(underloadedAgents);
    }

    public static LoadImbalance none(double meanUtilization) {
        return new LoadImbalance(0.0, meanUtilization, List.of(), List.of());
    }
}
