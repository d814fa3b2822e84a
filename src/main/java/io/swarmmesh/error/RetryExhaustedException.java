package io.swarmmesh.error;

public class RetryExhaustedException extends SwarmException {
    private final String taskId;
    private final int attempts;

    public RetryExhaustedException(String taskId, int attempts, String lastError) {
        super("Task " + taskId + " failed permanently after " + attempts + " attempt(s): " + lastError);
        this.taskId = taskId;
        this.attempts = attempts;
    }

    public String taskId() {
        return taskId;
    }

    public int attempts() {
        return attempts;
    }
}
