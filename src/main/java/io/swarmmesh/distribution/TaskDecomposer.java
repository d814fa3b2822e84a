package io.swarmmesh.distribution;

import io.swarmmesh.model.DecomposedTask;
import io.swarmmesh.model.TaskDefinition;

@FunctionalInterface
public interface TaskDecomposer {
    DecomposedTask decompose(TaskDefinition task);
}
