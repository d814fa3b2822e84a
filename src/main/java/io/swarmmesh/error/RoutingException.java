package io.swarmmesh.error;

public class RoutingException extends SwarmException {
    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
