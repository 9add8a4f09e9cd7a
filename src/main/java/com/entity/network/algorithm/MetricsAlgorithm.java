package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structural measures over the undirected simple view of a graph: parallel edges count once
 * and orientation is ignored. Distances are hop counts.
 */
public interface MetricsAlgorithm {

    /**
     * Scores every node with the given measure. Keys follow graph node order.
     */
    Map<String, Double> centrality(Graph graph, CentralityMeasure measure);

    /**
     * Longest shortest path between two connected nodes. 0 for graphs without edges.
     */
    int diameter(Graph graph);

    /**
     * Smallest eccentricity, where a node's eccentricity is its longest shortest path to a node
     * it can reach. An isolated node has eccentricity 0.
     */
    int radius(Graph graph);

    /**
     * Mean hop length over connected pairs of distinct nodes. 0 when no such pair exists.
     */
    double averagePathLength(Graph graph);

    // ========== Local measures ==========

    /**
     * Local clustering coefficient per node: linked neighbor pairs over all neighbor pairs.
     * Nodes with fewer than two neighbors score 0.
     */
    default Map<String, Double> clusteringCoefficients(Graph graph) {
        Map<String, Double> coefficients = new LinkedHashMap<>();
        for (String nodeId : graph.nodes()) {
            List<String> neighbors = graph.neighbors(nodeId);
            int k = neighbors.size();
            if (k < 2) {
                coefficients.put(nodeId, 0.0);
                continue;
            }
            int linked = 0;
            for (int i = 0; i < k; i++) {
                for (int j = i + 1; j < k; j++) {
                    if (!graph.edgesBetween(neighbors.get(i), neighbors.get(j)).isEmpty()) {
                        linked++;
                    }
                }
            }
            coefficients.put(nodeId, 2.0 * linked / ((double) k * (k - 1)));
        }
        return coefficients;
    }

    /**
     * Mean of the local clustering coefficients over all nodes.
     */
    default double averageClustering(Graph graph) {
        Map<String, Double> coefficients = clusteringCoefficients(graph);
        if (coefficients.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (double coefficient : coefficients.values()) {
            total += coefficient;
        }
        return total / coefficients.size();
    }

    /**
     * Number of nodes per distinct-neighbor count, by ascending degree.
     */
    default SortedMap<Integer, Integer> degreeDistribution(Graph graph) {
        SortedMap<Integer, Integer> distribution = new TreeMap<>();
        for (String nodeId : graph.nodes()) {
            distribution.merge(graph.neighbors(nodeId).size(), 1, Integer::sum);
        }
        return Collections.unmodifiableSortedMap(distribution);
    }

    /**
     * Up to {@code limit} nodes with the most distinct neighbors, most connected first.
     * Ties keep graph order.
     */
    default List<String> highDegreeNodes(Graph graph, int limit) {
        Map<String, Integer> degrees = new HashMap<>();
        List<String> nodes = new ArrayList<>(graph.nodes());
        for (String nodeId : nodes) {
            degrees.put(nodeId, graph.neighbors(nodeId).size());
        }
        nodes.sort(Comparator.comparingInt((String nodeId) -> degrees.get(nodeId)).reversed());
        return List.copyOf(nodes.subList(0, Math.max(0, Math.min(limit, nodes.size()))));
    }
}
