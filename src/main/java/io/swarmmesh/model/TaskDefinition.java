package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDefinition(
        String id,
        String name,
        String description,
        String type,
        TaskPriority priority,
        TaskComplexity complexity,
        Requirements requirements,
        Constraints constraints,
        List<Dependency> dependencies,
        long estimatedDurationMs,
        Map<String, Object> metadata,
        long createdAtMs,
        String submittedBy
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public TaskDefinition {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        type = type == null || type.isBlank() ? "general" : type;
        priority = priority == null ? TaskPriority.NORMAL : priority;
        complexity = complexity == null ? TaskComplexity.SIMPLE : complexity;
        requirements = requirements == null ? Requirements.none() : requirements;
        constraints = constraints == null ? Constraints.defaults() : constraints;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TaskDefinition simple(String name, String type, TaskPriority priority, List<String> capabilities) {
        return new TaskDefinition(
                null,
                name,
                null,
                type,
                priority,
                TaskComplexity.SIMPLE,
                Requirements.of(capabilities),
                null,
                null,
                0L,
                null,
                0L,
                null
        );
    }

    public boolean needsDecomposition() {
        return complexity == TaskComplexity.COMPLEX || complexity == TaskComplexity.EXPERT;
    }

    public List<Dependency> blockingDependencies() {
        return dependencies.stream().filter(d -> d.type() == DependencyType.BLOCKING).toList();
    }

    public TaskDefinition withId(String value) {
        return new TaskDefinition(value, name, description, type, priority, complexity, requirements,
                constraints, dependencies, estimatedDurationMs, metadata, createdAtMs, submittedBy);
    }

    public TaskDefinition withCreatedAtMs(long value) {
        return new TaskDefinition(id, name, description, type, priority, complexity, requirements,
                constraints, dependencies, estimatedDurationMs, metadata, value, submittedBy);
    }

    public TaskDefinition withComplexity(TaskComplexity value) {
        return new TaskDefinition(id, name, description, type, priority, value, requirements,
                constraints, dependencies, estimatedDurationMs, metadata, createdAtMs, submittedBy);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Requirements(
            List<String> capabilities,
            int minAgents,
            int maxAgents,
            List<String> preferredAgents,
            List<String> excludedAgents,
            Resources resources,
            Quality quality
    ) {
        public Requirements {
            capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
            minAgents = Math.max(1, minAgents);
            maxAgents = Math.max(minAgents, maxAgents);
            preferredAgents = preferredAgents == null ? List.of() : List.copyOf(preferredAgents);
            excludedAgents = excludedAgents == null ? List.of() : List.copyOf(excludedAgents);
            resources = resources == null ? Resources.none() : resources;
            quality = quality == null ? Quality.standard() : quality;
        }

        public static Requirements none() {
            return of(List.of());
        }

        public static Requirements of(List<String> capabilities) {
            return new Requirements(capabilities, 1, 1, null, null, null, null);
        }
    }

    public record Resources(double cpu, double memory, double network, double storage, boolean gpu) {
        public static Resources none() {
            return new Resources(0.0, 0.0, 0.0, 0.0, false);
        }
    }

    public record Quality(double accuracy, double speed, double reliability, double completeness) {
        public static Quality standard() {
            return new Quality(0.8, 0.5, 0.8, 0.9);
        }
    }

    public record Constraints(int maxRetries, long timeoutMs, String isolationLevel, String securityLevel) {
        public static Constraints defaults() {
            return new Constraints(DEFAULT_MAX_RETRIES, 0L, "shared", "standard");
        }

        public static Constraints withRetries(int maxRetries) {
            return new Constraints(maxRetries, 0L, "shared", "standard");
        }
    }

    public record Dependency(String taskId, DependencyType type, double weight) {
        public Dependency {
            type = type == null ? DependencyType.BLOCKING : type;
        }

        public static Dependency blocking(String taskId) {
            return new Dependency(taskId, DependencyType.BLOCKING, 1.0);
        }
    }
}
