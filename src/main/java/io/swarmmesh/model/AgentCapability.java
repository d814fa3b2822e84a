package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCapability(
        String agentId,
        List<String> capabilities,
        int currentLoad,
        int maxLoad,
        PerformanceProfile performance,
        double trustScore,
        AvailabilityStatus availability,
        List<String> specializations,
        double cost
) {
    public AgentCapability {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        performance = performance == null ? PerformanceProfile.unknown() : performance;
        availability = availability == null ? AvailabilityStatus.AVAILABLE : availability;
        specializations = specializations == null ? List.of() : List.copyOf(specializations);
    }

    public static AgentCapability of(String agentId, List<String> capabilities, int maxLoad, double trustScore) {
        return new AgentCapability(agentId, capabilities, 0, maxLoad, null, trustScore,
                AvailabilityStatus.AVAILABLE, null, 0.0);
    }

    public double utilization() {
        return maxLoad <= 0 ? 1.0 : (double) currentLoad / maxLoad;
    }

    public boolean hasHeadroom() {
        return currentLoad < maxLoad;
    }

    public AgentCapability withCurrentLoad(int value) {
        return new AgentCapability(agentId, capabilities, value, maxLoad, performance, trustScore,
                availability, specializations, cost);
    }

    public AgentCapability withAvailability(AvailabilityStatus value) {
        return new AgentCapability(agentId, capabilities, currentLoad, maxLoad, performance, trustScore,
                value, specializations, cost);
    }

    public AgentCapability withPerformance(PerformanceProfile value) {
        return new AgentCapability(agentId, capabilities, currentLoad, maxLoad, value, trustScore,
                availability, specializations, cost);
    }

    public AgentCapability withCapabilities(List<String> value) {
        return new AgentCapability(agentId, value, currentLoad, maxLoad, performance, trustScore,
                availability, specializations, cost);
    }

    public record PerformanceProfile(PerformanceMetrics overall, Map<String, PerformanceMetrics> byTaskType) {
        public PerformanceProfile {
            overall = overall == null ? PerformanceMetrics.unknown() : overall;
            byTaskType = byTaskType == null ? Map.of() : Map.copyOf(byTaskType);
        }

        public static PerformanceProfile unknown() {
            return new PerformanceProfile(PerformanceMetrics.unknown(), Map.of());
        }

        public static PerformanceProfile of(double successRate, double efficiency) {
            return new PerformanceProfile(new PerformanceMetrics(successRate, 0L, successRate, efficiency, successRate, 0), Map.of());
        }
    }

    public record PerformanceMetrics(
            double successRate,
            long averageTimeMs,
            double qualityScore,
            double efficiency,
            double reliability,
            int sampleSize
    ) {
        public static PerformanceMetrics unknown() {
            return new PerformanceMetrics(0.5, 0L, 0.5, 0.5, 0.5, 0);
        }
    }
}
