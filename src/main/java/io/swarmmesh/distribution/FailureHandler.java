package io.swarmmesh.distribution;

import io.swarmmesh.error.RetryExhaustedException;
import io.swarmmesh.observability.StructuredLogger;

final class FailureHandler {
    private static final StructuredLogger LOG = StructuredLogger.of(FailureHandler.class);

    private final FailurePolicy policy;

    FailureHandler(FailurePolicy policy) {
        this.policy = policy;
    }

    FailurePolicy.Decision handle(TaskRecord record, String error) {
        FailurePolicy.Decision decision;
        try {
            decision = policy.decide(record.definition(), record.retriesLeft(), record.attempts(), error);
        } catch (RuntimeException e) {
            LOG.error("Failure policy threw, treating failure as permanent", StructuredLogger.fields(
                    "taskId", record.id()
            ), e);
            decision = FailurePolicy.Decision.permanent();
        }
        if (decision.retry()) {
            LOG.warn("Task failed, retrying", StructuredLogger.fields(
                    "taskId", record.id(),
                    "attempts", record.attempts(),
                    "retriesLeft", decision.retriesLeft(),
                    "error", error
            ));
        } else {
            RetryExhaustedException exhausted = new RetryExhaustedException(record.id(), record.attempts(), error);
            LOG.error("Task failed permanently", StructuredLogger.fields(
                    "taskId", record.id(),
                    "attempts", record.attempts(),
                    "error", exhausted.getMessage()
            ));
        }
        return decision;
    }
}
