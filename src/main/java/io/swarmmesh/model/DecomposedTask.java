package io.swarmmesh.model;

import java.util.List;

public record DecomposedTask(
        String parentTaskId,
        List<SubTask> subtasks,
        ExecutionPlan executionPlan,
        CoordinationStrategy coordination
) {
    public DecomposedTask {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public record SubTask(
            String id,
            String name,
            String description,
            List<String> requiredCapabilities,
            long estimatedDurationMs,
            List<String> dependsOn,
            int order,
            boolean parallelizable,
            boolean criticalPath
    ) {
        public SubTask {
            requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        }
    }

    public record ExecutionPlan(
            String strategy,
            List<Phase> phases,
            List<Checkpoint> checkpoints,
            List<RollbackStep> rollback
    ) {
        public ExecutionPlan {
            phases = phases == null ? List.of() : List.copyOf(phases);
            checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
            rollback = rollback == null ? List.of() : List.copyOf(rollback);
        }
    }

    public record Phase(int index, String name, List<String> subtaskIds, boolean parallel) {
        public Phase {
            subtaskIds = subtaskIds == null ? List.of() : List.copyOf(subtaskIds);
        }
    }

    public record Checkpoint(String afterSubtaskId, String validation) {
    }

    public record RollbackStep(String subtaskId, String action) {
    }

    public record CoordinationStrategy(
            CoordinationMode mode,
            String coordinator,
            String communicationPattern,
            List<String> syncPoints,
            String conflictResolution
    ) {
        public CoordinationStrategy {
            syncPoints = syncPoints == null ? List.of() : List.copyOf(syncPoints);
        }
    }
}
