package io.swarmmesh.routing;

import io.swarmmesh.model.Message;

@FunctionalInterface
public interface MessageRoute {
    void route(Message message, RoutingEngine engine, long nowMs);
}
