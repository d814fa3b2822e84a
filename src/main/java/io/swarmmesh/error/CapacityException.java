package io.swarmmesh.error;

public class CapacityException extends SwarmException {
    private final String taskId;

    public CapacityException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
