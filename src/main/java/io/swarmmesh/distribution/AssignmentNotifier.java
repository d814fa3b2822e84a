package io.swarmmesh.distribution;

import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskDefinition;

public interface AssignmentNotifier {
    void assigned(TaskAssignment assignment, TaskDefinition task);

    void revoked(String taskId, String agentId, CancellationReason reason);

    static AssignmentNotifier none() {
        return new AssignmentNotifier() {
            @Override
            public void assigned(TaskAssignment assignment, TaskDefinition task) {
            }

            @Override
            public void revoked(String taskId, String agentId, CancellationReason reason) {
            }
        };
    }
}
