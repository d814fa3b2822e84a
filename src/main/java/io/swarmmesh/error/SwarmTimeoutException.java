package io.swarmmesh.error;

public class SwarmTimeoutException extends SwarmException {
    public SwarmTimeoutException(String message) {
        super(message);
    }

    public SwarmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
