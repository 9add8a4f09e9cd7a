package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label propagation: every node starts with its own label and repeatedly adopts the label most
 * common among its neighbors until no label changes. Nodes are visited in graph order; a tie
 * keeps the current label when it is among the most common, otherwise the highest tied label
 * wins. Near-linear per sweep, but usually finds a lower-modularity partition than
 * {@link LouvainCommunities}.
 */
public class LabelPropagationCommunities implements CommunityAlgorithm {

    private static final int MAX_ITERATIONS = 100;

    @Override
    public CommunityStructure detect(Graph graph) {
        Adjacency adjacency = Adjacency.of(graph);
        int n = adjacency.size();
        int[] labels = new int[n];
        for (int v = 0; v < n; v++) {
            labels[v] = v;
        }

        boolean changed = true;
        for (int iteration = 0; changed && iteration < MAX_ITERATIONS; iteration++) {
            changed = false;
            for (int v = 0; v < n; v++) {
                int[] neighbors = adjacency.neighbors()[v];
                if (neighbors.length == 0) {
                    continue;
                }
                int chosen = dominantLabel(labels, neighbors, labels[v]);
                if (chosen != labels[v]) {
                    labels[v] = chosen;
                    changed = true;
                }
            }
        }
        return CommunityStructure.of(adjacency, labels);
    }

    private static int dominantLabel(int[] labels, int[] neighbors, int current) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        int max = 0;
        for (int w : neighbors) {
            max = Math.max(max, counts.merge(labels[w], 1, Integer::sum));
        }
        if (counts.getOrDefault(current, 0) == max) {
            return current;
        }
        int chosen = -1;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == max && entry.getKey() > chosen) {
                chosen = entry.getKey();
            }
        }
        return chosen;
    }
}
