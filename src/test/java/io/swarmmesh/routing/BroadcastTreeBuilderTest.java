package io.swarmmesh.routing;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BroadcastTreeBuilderTest {

    @Test
    void laysSortedPeersOutAsHeap() {
        BroadcastTree tree = BroadcastTreeBuilder.build("root", List.of("e", "c", "a", "d", "b"));

        Assertions.assertEquals(List.of("a"), tree.childrenOf("root"));
        Assertions.assertEquals(List.of("b", "c"), tree.childrenOf("a"));
        Assertions.assertEquals(List.of("d", "e"), tree.childrenOf("b"));
        Assertions.assertEquals(List.of(), tree.childrenOf("c"));
        Assertions.assertEquals(3, tree.depth());
        Assertions.assertEquals(5, tree.size());
    }

    @Test
    void ignoresRootAndDuplicates() {
        BroadcastTree tree = BroadcastTreeBuilder.build("root", List.of("root", "x", "x"));

        Assertions.assertEquals(List.of("x"), tree.childrenOf("root"));
        Assertions.assertEquals(1, tree.size());
        Assertions.assertEquals(1, tree.depth());
    }

    @Test
    void emptyTreeHasNoDepth() {
        BroadcastTree tree = BroadcastTreeBuilder.build("solo", List.of());
        Assertions.assertEquals(0, tree.depth());
        Assertions.assertEquals(0, tree.size());
        Assertions.assertTrue(tree.childrenOf("solo").isEmpty());
    }
}
