package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index-based snapshot of a graph's undirected simple view: node {@code i} is
 * {@code nodes.get(i)} and {@code neighbors[i]} holds the indices of its distinct neighbors.
 */
record Adjacency(List<String> nodes, int[][] neighbors) {

    static Adjacency of(Graph graph) {
        List<String> nodes = graph.nodes();
        Map<String, Integer> index = new HashMap<>();
        for (String nodeId : nodes) {
            index.put(nodeId, index.size());
        }
        int[][] neighbors = new int[nodes.size()][];
        for (int i = 0; i < nodes.size(); i++) {
            List<String> adjacent = graph.neighbors(nodes.get(i));
            neighbors[i] = new int[adjacent.size()];
            for (int j = 0; j < adjacent.size(); j++) {
                neighbors[i][j] = index.get(adjacent.get(j));
            }
        }
        return new Adjacency(nodes, neighbors);
    }

    int size() {
        return nodes.size();
    }

    /**
     * Hop distances from {@code source}, -1 for unreachable nodes.
     */
    int[] distancesFrom(int source) {
        int[] distance = new int[size()];
        Arrays.fill(distance, -1);
        int[] queue = new int[size()];
        int head = 0;
        int tail = 0;
        distance[source] = 0;
        queue[tail++] = source;
        while (head < tail) {
            int v = queue[head++];
            for (int w : neighbors[v]) {
                if (distance[w] < 0) {
                    distance[w] = distance[v] + 1;
                    queue[tail++] = w;
                }
            }
        }
        return distance;
    }

    Map<String, Double> toMap(double[] scores) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            result.put(nodes.get(i), scores[i]);
        }
        return result;
    }
}
