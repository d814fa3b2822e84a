package io.swarmmesh.routing;

import io.swarmmesh.model.Message;

@FunctionalInterface
public interface MessageHandler {
    void handle(Message message);
}
