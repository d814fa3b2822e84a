package io.swarmmesh.distribution;

import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;

final class TaskRecord {
    private final TaskDefinition definition;
    private final String parentId;
    private final List<String> subtaskIds = new ArrayList<>();
    TaskStatus status = TaskStatus.PENDING;
    int retriesLeft;
    int attempts;
    long submittedAtMs;
    long queuedAtMs;
    long assignedAtMs;
    long lastProgressMs;
    double progress;
    String agentId;
    String lastError;

    TaskRecord(TaskDefinition definition, String parentId, long submittedAtMs) {
        this.definition = definition;
        this.parentId = parentId;
        this.retriesLeft = Math.max(0, definition.constraints().maxRetries());
        this.submittedAtMs = submittedAtMs;
        this.queuedAtMs = submittedAtMs;
    }

    String id() {
        return definition.id();
    }

    TaskDefinition definition() {
        return definition;
    }

    String parentId() {
        return parentId;
    }

    List<String> subtaskIds() {
        return subtaskIds;
    }

    int retriesLeft() {
        return retriesLeft;
    }

    int attempts() {
        return attempts;
    }

    TaskView toView() {
        return new TaskView(
                definition.id(),
                definition.name(),
                definition.priority(),
                definition.complexity(),
                status,
                attempts,
                retriesLeft,
                parentId,
                List.copyOf(subtaskIds),
                agentId,
                progress,
                lastError
        );
    }
}
