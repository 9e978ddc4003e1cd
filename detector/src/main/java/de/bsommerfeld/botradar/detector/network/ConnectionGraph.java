package de.bsommerfeld.botradar.detector.network;

import java.util.List;
import java.util.Set;

/**
 * Undirected account graph used by {@link ConnectionClusterDetector}.
 * Implementations are single-use and not thread-safe; one instance is built per
 * detection call.
 */
public interface ConnectionGraph {

    /**
     * Adds an isolated node. Adding an existing node is a no-op.
     */
    void addNode(String id);

    /**
     * Adds an undirected edge, creating missing endpoints. Self-loops only add
     * the node.
     */
    void addEdge(String a, String b);

    int nodeCount();

    /**
     * Maximal sets of mutually reachable nodes. Every node belongs to exactly one
     * component; isolated nodes form singletons.
     */
    List<Set<String>> connectedComponents();
}
