package io.swarmmesh.distribution;

import io.swarmmesh.model.TaskDefinition;

@FunctionalInterface
public interface FailurePolicy {
    Decision decide(TaskDefinition task, int retriesLeft, int attempts, String error);

    static FailurePolicy retryBudget() {
        return (task, retriesLeft, attempts, error) -> retriesLeft > 0
                ? Decision.retry(retriesLeft - 1)
                : Decision.permanent();
    }

    static FailurePolicy never() {
        return (task, retriesLeft, attempts, error) -> Decision.permanent();
    }

    record Decision(boolean retry, int retriesLeft) {
        public static Decision retry(int retriesLeft) {
            return new Decision(true, retriesLeft);
        }

        public static Decision permanent() {
            return new Decision(false, 0);
        }
    }
}
