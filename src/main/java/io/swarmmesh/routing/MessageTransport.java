package io.swarmmesh.routing;

import io.swarmmesh.model.Message;

@FunctionalInterface
public interface MessageTransport {
    void deliver(String targetNodeId, Message message);
}
