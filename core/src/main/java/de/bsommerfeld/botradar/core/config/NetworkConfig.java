package de.bsommerfeld.botradar.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.botradar.core.ConfigurationException;

/**
 * Connection cluster detector settings.
 */
public class NetworkConfig {

    @JsonProperty("cluster-threshold")
    @JsonPropertyDescription("Minimum connected-component size to report as a suspicious cluster (default: 20)")
    private int clusterThreshold = 20;

    @JsonProperty("backend")
    @JsonPropertyDescription("Graph implementation: UNION_FIND or JGRAPHT (default: UNION_FIND)")
    private GraphBackend backend = GraphBackend.UNION_FIND;

    public int getClusterThreshold() {
        return clusterThreshold;
    }

    public void setClusterThreshold(int clusterThreshold) {
        this.clusterThreshold = clusterThreshold;
    }

    public GraphBackend getBackend() {
        return backend;
    }

    public void setBackend(GraphBackend backend) {
        this.backend = backend;
    }

    public void validate() {
        ConfigChecks.requirePositive("network.cluster-threshold", clusterThreshold);
        if (backend == null)
            throw new ConfigurationException("network.backend must not be null");
    }
}
