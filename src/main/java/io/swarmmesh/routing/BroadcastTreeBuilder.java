package io.swarmmesh.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BroadcastTreeBuilder {
    private BroadcastTreeBuilder() {
    }

    public static BroadcastTree build(String rootId, Collection<String> peerIds) {
        List<String> sorted = peerIds.stream()
                .filter(id -> !id.equals(rootId))
                .distinct()
                .sorted()
                .toList();
        Map<String, List<String>> children = new LinkedHashMap<>();
        int depth = 0;
        for (int i = 0; i < sorted.size(); i++) {
            String parent = i == 0 ? rootId : sorted.get((i - 1) / 2);
            children.computeIfAbsent(parent, ignored -> new ArrayList<>()).add(sorted.get(i));
            depth = Math.max(depth, levelOf(i));
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        children.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new BroadcastTree(rootId, frozen, depth, sorted.size());
    }

    // Index 0 sits at level 1; each heap level below it doubles in width.
    private static int levelOf(int index) {
        int level = 1;
        int n = index + 1;
        while (n > 1) {
            n >>= 1;
            level++;
        }
        return level;
    }
}
