package de.bsommerfeld.botradar.detector.network;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import java.util.List;
import java.util.Set;

/**
 * {@link ConnectionGraph} backed by a JGraphT {@link SimpleGraph}. Slower than
 * {@link UnionFindGraph} but exposes a full graph for further analysis such as
 * community detection.
 */
public final class JGraphTConnectionGraph implements ConnectionGraph {

    private final Graph<String, DefaultEdge> graph = new SimpleGraph<>(DefaultEdge.class);

    @Override
    public void addNode(String id) {
        graph.addVertex(id);
    }

    @Override
    public void addEdge(String a, String b) {
        graph.addVertex(a);
        if (a.equals(b))
            return;
        graph.addVertex(b);
        graph.addEdge(a, b);
    }

    @Override
    public int nodeCount() {
        return graph.vertexSet().size();
    }

    @Override
    public List<Set<String>> connectedComponents() {
        return new ConnectivityInspector<>(graph).connectedSets();
    }

    /**
     * @return the underlying graph, for analyses beyond connected components
     */
    public Graph<String, DefaultEdge> graph() {
        return graph;
    }
}
