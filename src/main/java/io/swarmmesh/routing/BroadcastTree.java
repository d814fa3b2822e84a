package io.swarmmesh.routing;

import java.util.List;
import java.util.Map;

public record BroadcastTree(String root, Map<String, List<String>> children, int depth, int size) {
    public BroadcastTree {
        children = Map.copyOf(children);
    }

    public List<String> childrenOf(String nodeId) {
        return children.getOrDefault(nodeId, List.of());
    }
}
