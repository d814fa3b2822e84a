package io.swarmmesh.error;

public class ValidationException extends SwarmException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
