package com.entity.network.discovery;

import com.entity.network.algorithm.ComponentAlgorithm;
import com.entity.network.algorithm.MetricsAlgorithm;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes {@link NetworkMetrics} for a discovered network.
 */
public class NetworkMetricsCalculator {

    private final ComponentAlgorithm componentAlgorithm;
    private final MetricsAlgorithm metricsAlgorithm;

    public NetworkMetricsCalculator(ComponentAlgorithm componentAlgorithm, MetricsAlgorithm metricsAlgorithm) {
        this.componentAlgorithm = Objects.requireNonNull(componentAlgorithm, "componentAlgorithm is required");
        this.metricsAlgorithm = Objects.requireNonNull(metricsAlgorithm, "metricsAlgorithm is required");
    }

    public NetworkMetrics calculate(Graph network, Collection<String> queryEntities,
                                    Collection<DiscoveredEntity> entities,
                                    List<DirectConnection> directConnections,
                                    int bridgeCount, List<Pathway> pathways) {
        int nodes = network.nodeCount();
        int edges = network.edgeCount();
        if (nodes == 0) {
            return NetworkMetrics.empty();
        }
        int kinship = 0;
        for (GraphEdge edge : network.edges()) {
            if (edge.isKinship()) {
                kinship++;
            }
        }
        return new NetworkMetrics(
                nodes,
                queryEntities.size(),
                nodes - queryEntities.size(),
                edges,
                directConnections.size(),
                bridgeCount,
                density(nodes, edges),
                averagePathLength(directConnections, pathways),
                componentAlgorithm.count(network),
                averageDegree(nodes, edges),
                kinship,
                edges - kinship,
                metricsAlgorithm.diameter(network),
                metricsAlgorithm.radius(network),
                metricsAlgorithm.averageClustering(network),
                distanceDistribution(entities));
    }

    /**
     * Counts entities per distance to their nearest query entity.
     */
    public static SortedMap<Integer, Integer> distanceDistribution(Collection<DiscoveredEntity> entities) {
        SortedMap<Integer, Integer> distribution = new TreeMap<>();
        for (DiscoveredEntity entity : entities) {
            distribution.merge(entity.distance(), 1, Integer::sum);
        }
        return distribution;
    }

    /**
     * Undirected density: edges over n(n-1)/2 possible pairs.
     */
    public static double density(int nodeCount, int edgeCount) {
        if (nodeCount <= 1) {
            return 0.0;
        }
        double possible = (double) nodeCount * (nodeCount - 1) / 2.0;
        return edgeCount / possible;
    }

    public static double averageDegree(int nodeCount, int edgeCount) {
        return nodeCount == 0 ? 0.0 : (2.0 * edgeCount) / nodeCount;
    }

    /**
     * Mean hop length over connected query pairs; a direct connection counts as one hop.
     */
    static double averagePathLength(List<DirectConnection> directConnections, List<Pathway> pathways) {
        int pairs = directConnections.size() + pathways.size();
        if (pairs == 0) {
            return 0.0;
        }
        long total = directConnections.size();
        for (Pathway pathway : pathways) {
            total += pathway.length();
        }
        return (double) total / pairs;
    }
}
