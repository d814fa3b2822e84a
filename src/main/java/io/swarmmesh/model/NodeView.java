package io.swarmmesh.model;

public record NodeView(
        String id,
        String address,
        int port,
        NodeStatus status,
        boolean disconnected,
        long lastSeenMs,
        long messagesSent,
        long messagesReceived,
        long bytesTransferred,
        long errors,
        double errorRate
) {
}
