package io.swarmmesh.distribution;

import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.TaskAssignment;

import java.util.List;

public interface RebalanceContext {
    List<TaskAssignment> assignmentsOf(String agentId);

    boolean reassign(String taskId, CancellationReason reason);
}
