package io.swarmmesh.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScenarioFile(
        List<String> nodes,
        String coordinator,
        Long seed,
        List<AgentSpec> agents,
        List<TimedTask> tasks,
        List<TimedGossip> gossip,
        List<TimedProposal> proposals,
        List<TimedNodeAction> isolate
) {
    public ScenarioFile {
        nodes = nodes == null || nodes.isEmpty() ? List.of("node-1") : List.copyOf(nodes);
        coordinator = coordinator == null || coordinator.isBlank() ? nodes.get(0) : coordinator;
        agents = agents == null ? List.of() : List.copyOf(agents);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        gossip = gossip == null ? List.of() : List.copyOf(gossip);
        proposals = proposals == null ? List.of() : List.copyOf(proposals);
        isolate = isolate == null ? List.of() : List.copyOf(isolate);
    }

    public static ScenarioFile load(Path file) {
        try {
            return Jsons.mapper().readValue(Files.readString(file), ScenarioFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load scenario: " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AgentSpec(
            String id,
            List<String> capabilities,
            Integer maxLoad,
            Double trustScore,
            Double successRate,
            Double efficiency,
            Long workMs,
            Integer failAttempts
    ) {
        public AgentSpec {
            capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
            maxLoad = maxLoad == null ? 1 : maxLoad;
            trustScore = trustScore == null ? 0.8 : trustScore;
            successRate = successRate == null ? 0.8 : successRate;
            efficiency = efficiency == null ? 0.8 : efficiency;
            workMs = workMs == null ? 1_000L : workMs;
            failAttempts = failAttempts == null ? 0 : failAttempts;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimedTask(long atMs, TaskDefinition task) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimedGossip(long atMs, String node, String key, JsonNode data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimedProposal(long atMs, String node, ProposalType type, JsonNode value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimedNodeAction(long atMs, String node, long healAtMs) {
    }
}
