package io.swarmmesh.distribution;

import io.swarmmesh.model.CoordinationMode;
import io.swarmmesh.model.DecomposedTask;
import io.swarmmesh.model.TaskComplexity;
import io.swarmmesh.model.TaskDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class PhasedTaskDecomposer implements TaskDecomposer {
    static final long DEFAULT_ESTIMATE_MS = 60_000L;

    @Override
    public DecomposedTask decompose(TaskDefinition task) {
        String parentId = task.id();
        long estimate = task.estimatedDurationMs() > 0L ? task.estimatedDurationMs() : DEFAULT_ESTIMATE_MS;
        List<DecomposedTask.SubTask> subtasks = new ArrayList<>();
        int order = 0;

        DecomposedTask.SubTask plan = new DecomposedTask.SubTask(
                parentId + "-" + order + "-plan",
                task.name() + " / plan",
                "Break down the approach for " + task.name(),
                List.of(),
                Math.max(1L, estimate / 10L),
                List.of(),
                order++,
                false,
                true
        );
        subtasks.add(plan);

        List<String> capabilities = task.requirements().capabilities();
        List<String> executionIds = new ArrayList<>();
        List<List<String>> executionCapabilities = new ArrayList<>();
        if (capabilities.isEmpty()) {
            executionCapabilities.add(List.of());
        } else {
            for (String capability : capabilities) {
                executionCapabilities.add(List.of(capability));
            }
        }
        long executionEstimate = Math.max(1L, estimate * 6L / 10L);
        for (List<String> required : executionCapabilities) {
            String label = required.isEmpty() ? "execute" : "execute-" + slug(required.get(0));
            DecomposedTask.SubTask execution = new DecomposedTask.SubTask(
                    parentId + "-" + order + "-" + label,
                    task.name() + " / " + label,
                    required.isEmpty() ? "Carry out " + task.name() : "Carry out the " + required.get(0) + " part",
                    required,
                    executionEstimate,
                    List.of(plan.id()),
                    order++,
                    executionCapabilities.size() > 1,
                    executionCapabilities.size() == 1
            );
            subtasks.add(execution);
            executionIds.add(execution.id());
        }

        DecomposedTask.SubTask integrate = new DecomposedTask.SubTask(
                parentId + "-" + order + "-integrate",
                task.name() + " / integrate",
                "Combine the execution results",
                List.of(),
                Math.max(1L, estimate * 2L / 10L),
                executionIds,
                order++,
                false,
                true
        );
        subtasks.add(integrate);

        DecomposedTask.SubTask review = null;
        if (task.complexity() == TaskComplexity.EXPERT) {
            review = new DecomposedTask.SubTask(
                    parentId + "-" + order + "-review",
                    task.name() + " / review",
                    "Review the integrated result",
                    List.of(),
                    Math.max(1L, estimate / 10L),
                    List.of(integrate.id()),
                    order,
                    false,
                    true
            );
            subtasks.add(review);
        }

        List<DecomposedTask.Phase> phases = new ArrayList<>();
        phases.add(new DecomposedTask.Phase(0, "plan", List.of(plan.id()), false));
        phases.add(new DecomposedTask.Phase(1, "execute", executionIds, executionIds.size() > 1));
        phases.add(new DecomposedTask.Phase(2, "integrate", List.of(integrate.id()), false));
        if (review != null) {
            phases.add(new DecomposedTask.Phase(3, "review", List.of(review.id()), false));
        }
        List<DecomposedTask.Checkpoint> checkpoints = new ArrayList<>();
        checkpoints.add(new DecomposedTask.Checkpoint(plan.id(), "plan-accepted"));
        checkpoints.add(new DecomposedTask.Checkpoint(integrate.id(), "integration-verified"));
        List<DecomposedTask.RollbackStep> rollback = new ArrayList<>();
        for (int i = subtasks.size() - 1; i >= 0; i--) {
            rollback.add(new DecomposedTask.RollbackStep(subtasks.get(i).id(), "discard-output"));
        }
        DecomposedTask.CoordinationStrategy coordination = new DecomposedTask.CoordinationStrategy(
                task.complexity() == TaskComplexity.EXPERT ? CoordinationMode.HIERARCHICAL : CoordinationMode.CENTRALIZED,
                null,
                "hub-and-spoke",
                List.of(integrate.id()),
                "coordinator-decides"
        );
        return new DecomposedTask(
                parentId,
                subtasks,
                new DecomposedTask.ExecutionPlan("phased", phases, checkpoints, rollback),
                coordination
        );
    }

    private static String slug(String raw) {
        String lowered = raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return lowered.replaceAll("^-+|-+$", "");
    }
}
