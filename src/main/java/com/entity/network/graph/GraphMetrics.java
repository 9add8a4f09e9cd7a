package com.entity.network.graph;

/**
 * Size and connectivity figures of a {@link Graph}.
 *
 * @param nodeCount     number of nodes
 * @param edgeCount     number of edges (parallel edges counted individually)
 * @param density       edges divided by the maximum possible number of edges
 * @param averageDegree average number of incident edges per node
 */
public record GraphMetrics(int nodeCount, int edgeCount, double density, double averageDegree) {

    public static GraphMetrics empty() {
        return new GraphMetrics(0, 0, 0.0, 0.0);
    }
}
