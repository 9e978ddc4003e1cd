package de.bsommerfeld.botradar.core.config;

/**
 * Implementation used by the connection cluster detector to compute
 * connected components.
 */
public enum GraphBackend {

    /** In-house disjoint-set forest, no extra dependencies at runtime. */
    UNION_FIND,

    /** JGraphT {@code SimpleGraph} with a {@code ConnectivityInspector}. */
    JGRAPHT
}
