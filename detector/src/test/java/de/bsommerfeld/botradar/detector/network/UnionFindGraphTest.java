package de.bsommerfeld.botradar.detector.network;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UnionFindGraphTest {

    @Test
    void connectedComponents_shouldMergeChains() {
        var graph = new UnionFindGraph();
        graph.addEdge("a", "b");
        graph.addEdge("c", "d");
        graph.addEdge("b", "c");
        graph.addNode("e");

        assertEquals(Set.of(Set.of("a", "b", "c", "d"), Set.of("e")),
                new HashSet<>(graph.connectedComponents()));
    }

    @Test
    void addNode_shouldBeIdempotent() {
        var graph = new UnionFindGraph();
        graph.addNode("a");
        graph.addNode("a");
        graph.addEdge("a", "a");

        assertEquals(1, graph.nodeCount());
        assertEquals(List.of(Set.of("a")), graph.connectedComponents());
    }

    @Test
    void addEdge_shouldGrowBeyondInitialCapacity() {
        var graph = new UnionFindGraph();
        for (int i = 0; i < 1000; i++) {
            graph.addEdge("n" + i, "n" + (i + 1));
        }

        assertEquals(1001, graph.nodeCount());
        assertEquals(1, graph.connectedComponents().size());
        assertEquals(1001, graph.connectedComponents().get(0).size());
    }

    @Test
    void connectedComponents_shouldAgreeWithJGraphT() {
        var unionFind = new UnionFindGraph();
        var jgrapht = new JGraphTConnectionGraph();
        String[][] edges = { { "a", "b" }, { "b", "c" }, { "x", "y" }, { "z", "z" }, { "c", "a" } };
        for (String[] edge : edges) {
            unionFind.addEdge(edge[0], edge[1]);
            jgrapht.addEdge(edge[0], edge[1]);
        }
        unionFind.addNode("solo");
        jgrapht.addNode("solo");

        assertEquals(new HashSet<>(jgrapht.connectedComponents()), new HashSet<>(unionFind.connectedComponents()));
        assertEquals(jgrapht.nodeCount(), unionFind.nodeCount());
    }
}
