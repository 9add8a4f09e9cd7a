package com.entity.network.algorithm;

/**
 * Node centrality measures offered by {@link MetricsAlgorithm}.
 */
public enum CentralityMeasure {
    /** Distinct neighbors over {@code n - 1}. */
    DEGREE,
    /** Reachable nodes over the summed hop distance to them. */
    CLOSENESS,
    /** Shortest paths passing through the node, each unordered pair counted once. */
    BETWEENNESS,
    /** Principal eigenvector of the adjacency matrix, unit length. */
    EIGENVECTOR
}
