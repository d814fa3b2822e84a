package io.swarmmesh.distribution;

import io.swarmmesh.model.CoordinationMode;
import io.swarmmesh.model.DecomposedTask;
import io.swarmmesh.model.TaskComplexity;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskPriority;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class PhasedTaskDecomposerTest {
    private final PhasedTaskDecomposer decomposer = new PhasedTaskDecomposer();

    @Test
    void complexTaskGetsOneExecutionSubtaskPerCapability() {
        DecomposedTask out = decomposer.decompose(task(TaskComplexity.COMPLEX, List.of("Data Analysis", "writing"), 10_000L));

        List<String> ids = out.subtasks().stream().map(DecomposedTask.SubTask::id).toList();
        Assertions.assertEquals(List.of("job-0-plan", "job-1-execute-data-analysis", "job-2-execute-writing",
                "job-3-integrate"), ids);

        DecomposedTask.SubTask plan = out.subtasks().get(0);
        DecomposedTask.SubTask analysis = out.subtasks().get(1);
        DecomposedTask.SubTask integrate = out.subtasks().get(3);
        Assertions.assertEquals(1_000L, plan.estimatedDurationMs());
        Assertions.assertEquals(6_000L, analysis.estimatedDurationMs());
        Assertions.assertEquals(2_000L, integrate.estimatedDurationMs());
        Assertions.assertEquals(List.of("job-0-plan"), analysis.dependsOn());
        Assertions.assertEquals(List.of("Data Analysis"), analysis.requiredCapabilities());
        Assertions.assertTrue(analysis.parallelizable());
        Assertions.assertEquals(List.of("job-1-execute-data-analysis", "job-2-execute-writing"), integrate.dependsOn());

        Assertions.assertEquals(3, out.executionPlan().phases().size());
        Assertions.assertTrue(out.executionPlan().phases().get(1).parallel());
        Assertions.assertEquals("job-3-integrate", out.executionPlan().rollback().get(0).subtaskId());
        Assertions.assertEquals(CoordinationMode.CENTRALIZED, out.coordination().mode());
    }

    @Test
    void expertTaskAddsReviewAndDefaultsEstimate() {
        DecomposedTask out = decomposer.decompose(task(TaskComplexity.EXPERT, List.of(), 0L));

        Assertions.assertEquals(4, out.subtasks().size());
        DecomposedTask.SubTask execute = out.subtasks().get(1);
        DecomposedTask.SubTask review = out.subtasks().get(3);
        Assertions.assertEquals("job-1-execute", execute.id());
        Assertions.assertFalse(execute.parallelizable());
        Assertions.assertEquals(PhasedTaskDecomposer.DEFAULT_ESTIMATE_MS * 6L / 10L, execute.estimatedDurationMs());
        Assertions.assertEquals("job-3-review", review.id());
        Assertions.assertEquals(List.of("job-2-integrate"), review.dependsOn());
        Assertions.assertEquals(CoordinationMode.HIERARCHICAL, out.coordination().mode());
    }

    private static TaskDefinition task(TaskComplexity complexity, List<String> capabilities, long estimate) {
        return new TaskDefinition("job", "job", null, null, TaskPriority.NORMAL, complexity,
                TaskDefinition.Requirements.of(capabilities), null, null, estimate, null, 0L, null);
    }
}
