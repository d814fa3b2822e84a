package io.swarmmesh.distribution;

import io.swarmmesh.model.TaskComplexity;
import io.swarmmesh.model.TaskPriority;
import io.swarmmesh.model.TaskStatus;

import java.util.List;

public record TaskView(
        String id,
        String name,
        TaskPriority priority,
        TaskComplexity complexity,
        TaskStatus status,
        int attempts,
        int retriesLeft,
        String parentId,
        List<String> subtaskIds,
        String agentId,
        double progress,
        String lastError
) {
}
