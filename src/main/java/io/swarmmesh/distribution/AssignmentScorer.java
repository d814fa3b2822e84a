package io.swarmmesh.distribution;

import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.TaskDefinition;

@FunctionalInterface
public interface AssignmentScorer {
    double score(TaskDefinition task, AgentCapability agent);

    static AssignmentScorer weighted() {
        return new WeightedAssignmentScorer();
    }
}
