package de.bsommerfeld.botradar.detector.network;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.botradar.core.InputFormatException;
import de.bsommerfeld.botradar.core.config.GraphBackend;
import de.bsommerfeld.botradar.core.config.NetworkConfig;
import de.bsommerfeld.botradar.core.domain.AccountCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reports groups of accounts that are connected to each other, directly or
 * transitively, and reach a minimum size.
 *
 * <p>
 * Every listed relation becomes an undirected edge; keys without neighbors are
 * singleton nodes, neighbors that are not keys themselves are added
 * implicitly, self-loops are dropped. The result depends only on the relation,
 * never on map iteration order: members are sorted and clusters are ordered by
 * size (largest first), then by their first member.
 */
@Singleton
public class ConnectionClusterDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionClusterDetector.class);

    static final Comparator<AccountCluster> CLUSTER_ORDER = Comparator
            .comparingInt(AccountCluster::size).reversed()
            .thenComparing((AccountCluster c) -> c.members().get(0));

    private final int clusterThreshold;
    private final GraphBackend backend;

    @Inject
    public ConnectionClusterDetector(NetworkConfig config) {
        config.validate();
        this.clusterThreshold = config.getClusterThreshold();
        this.backend = config.getBackend();
    }

    /**
     * Returns every connected component with at least {@code clusterThreshold}
     * members.
     *
     * @throws InputFormatException if an account or neighbor id is {@code null}
     */
    public List<AccountCluster> detect(Map<String, List<String>> connections) {
        ConnectionGraph graph = buildGraph(connections);
        List<AccountCluster> clusters = graph.connectedComponents().stream()
                .filter(component -> component.size() >= clusterThreshold)
                .map(AccountCluster::of)
                .sorted(CLUSTER_ORDER)
                .toList();
        LOG.info("Network analysis: {} clusters of size >= {} among {} accounts",
                clusters.size(), clusterThreshold, graph.nodeCount());
        return clusters;
    }

    /**
     * Builds the undirected graph for {@code connections} using the configured
     * backend.
     */
    public ConnectionGraph buildGraph(Map<String, List<String>> connections) {
        ConnectionGraph graph = newGraph(backend);
        for (Map.Entry<String, List<String>> entry : connections.entrySet()) {
            String account = entry.getKey();
            if (account == null)
                throw new InputFormatException("Account identifier must not be null");
            graph.addNode(account);

            List<String> neighbors = entry.getValue();
            if (neighbors == null)
                continue;
            for (String neighbor : neighbors) {
                if (neighbor == null) {
                    throw new InputFormatException("Null neighbor for account '" + account + "'",
                            account, null, null);
                }
                graph.addEdge(account, neighbor);
            }
        }
        return graph;
    }

    static ConnectionGraph newGraph(GraphBackend backend) {
        return switch (backend) {
            case UNION_FIND -> new UnionFindGraph();
            case JGRAPHT -> new JGraphTConnectionGraph();
        };
    }
}
