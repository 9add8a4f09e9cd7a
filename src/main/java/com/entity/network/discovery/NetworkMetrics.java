package com.entity.network.discovery;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Figures describing a discovered network, computed on its undirected view.
 *
 * @param averagePathLength    mean hops between connected query pairs
 * @param diameter             longest shortest path inside the network
 * @param radius               smallest node eccentricity inside the network
 * @param averageClustering    mean local clustering coefficient
 * @param distanceDistribution entity count per distance to the nearest query entity
 */
public record NetworkMetrics(
        int totalEntities,
        int queryEntities,
        int discoveredEntities,
        int totalEdges,
        int directConnections,
        int bridgeEntities,
        double density,
        double averagePathLength,
        int components,
        double averageDegree,
        int kinshipEdges,
        int associationEdges,
        int diameter,
        int radius,
        double averageClustering,
        SortedMap<Integer, Integer> distanceDistribution
) {

    public NetworkMetrics {
        distanceDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(distanceDistribution));
    }

    public static NetworkMetrics empty() {
        return new NetworkMetrics(0, 0, 0, 0, 0, 0, 0.0, 0.0, 0, 0.0, 0, 0, 0, 0, 0.0, new TreeMap<>());
    }
}
