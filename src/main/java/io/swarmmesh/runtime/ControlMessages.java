package io.swarmmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.util.Jsons;

public final class ControlMessages {
    public static final String KIND = "kind";
    public static final String TASK_ID = "taskId";
    public static final String TASK_ASSIGNED = "task_assigned";
    public static final String TASK_REVOKED = "task_revoked";
    public static final String TASK_PROGRESS = "task_progress";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_FAILED = "task_failed";

    private ControlMessages() {
    }

    public static ObjectNode taskAssigned(TaskAssignment assignment, TaskDefinition task) {
        ObjectNode body = base(TASK_ASSIGNED, assignment.taskId());
        body.set("task", Jsons.toTree(task));
        body.set("assignment", Jsons.toTree(assignment));
        return body;
    }

    public static ObjectNode taskRevoked(String taskId, CancellationReason reason) {
        ObjectNode body = base(TASK_REVOKED, taskId);
        body.put("reason", reason == null ? null : reason.wire());
        return body;
    }

    public static ObjectNode taskProgress(String taskId, double progress, String note) {
        ObjectNode body = base(TASK_PROGRESS, taskId);
        body.put("progress", progress);
        body.put("note", note);
        return body;
    }

    public static ObjectNode taskCompleted(String taskId, JsonNode result) {
        ObjectNode body = base(TASK_COMPLETED, taskId);
        body.set("result", result);
        return body;
    }

    public static ObjectNode taskFailed(String taskId, String error) {
        ObjectNode body = base(TASK_FAILED, taskId);
        body.put("error", error);
        return body;
    }

    private static ObjectNode base(String kind, String taskId) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put(KIND, kind);
        body.put(TASK_ID, taskId);
        return body;
    }
}
