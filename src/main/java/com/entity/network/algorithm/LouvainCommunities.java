package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Louvain modularity optimisation: nodes move greedily to the neighboring community with the
 * best modularity gain, then communities are collapsed into nodes and the process repeats until
 * no move merges anything. Nodes are visited in graph order and ties keep the current
 * community, then the first neighboring one, so results are deterministic. The default
 * implementation.
 */
public class LouvainCommunities implements CommunityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(LouvainCommunities.class);

    private static final int MAX_PASSES = 100;
    private static final double EPSILON = 1e-12;

    private final double resolution;

    public LouvainCommunities() {
        this(1.0);
    }

    /**
     * @param resolution higher values favour more, smaller communities
     */
    public LouvainCommunities(double resolution) {
        if (!(resolution > 0.0)) {
            throw new IllegalArgumentException("resolution must be positive: " + resolution);
        }
        this.resolution = resolution;
    }

    public double getResolution() {
        return resolution;
    }

    @Override
    public CommunityStructure detect(Graph graph) {
        Adjacency adjacency = Adjacency.of(graph);
        int n = adjacency.size();
        int[] membership = new int[n];
        for (int v = 0; v < n; v++) {
            membership[v] = v;
        }

        List<Map<Integer, Double>> level = unitWeights(adjacency);
        int levels = 0;
        while (!level.isEmpty()) {
            int[] assignment = moveNodes(level);
            int communities = renumber(assignment);
            if (communities == level.size()) {
                break;
            }
            for (int v = 0; v < n; v++) {
                membership[v] = assignment[membership[v]];
            }
            level = aggregate(level, assignment, communities);
            levels++;
        }
        log.debug("Louvain settled after {} levels on {} nodes", levels, n);
        return CommunityStructure.of(adjacency, membership);
    }

    private int[] moveNodes(List<Map<Integer, Double>> level) {
        int size = level.size();
        double[] strength = new double[size];
        double total = 0.0;
        int[] community = new int[size];
        for (int v = 0; v < size; v++) {
            for (double weight : level.get(v).values()) {
                strength[v] += weight;
            }
            total += strength[v];
            community[v] = v;
        }
        if (total == 0.0) {
            return community;
        }
        double[] communityStrength = strength.clone();

        boolean moved = true;
        for (int pass = 0; moved && pass < MAX_PASSES; pass++) {
            moved = false;
            for (int v = 0; v < size; v++) {
                int own = community[v];
                communityStrength[own] -= strength[v];

                Map<Integer, Double> links = new LinkedHashMap<>();
                for (Map.Entry<Integer, Double> entry : level.get(v).entrySet()) {
                    if (entry.getKey() != v) {
                        links.merge(community[entry.getKey()], entry.getValue(), Double::sum);
                    }
                }

                int best = own;
                double bestGain = gain(links.getOrDefault(own, 0.0), communityStrength[own], strength[v], total);
                for (Map.Entry<Integer, Double> entry : links.entrySet()) {
                    double candidate = gain(entry.getValue(), communityStrength[entry.getKey()], strength[v], total);
                    if (candidate > bestGain + EPSILON) {
                        best = entry.getKey();
                        bestGain = candidate;
                    }
                }
                community[v] = best;
                communityStrength[best] += strength[v];
                moved |= best != own;
            }
        }
        return community;
    }

    private double gain(double linkWeight, double communityStrength, double nodeStrength, double total) {
        return linkWeight - resolution * communityStrength * nodeStrength / total;
    }

    // ========== Level graphs ==========

    private static List<Map<Integer, Double>> unitWeights(Adjacency adjacency) {
        List<Map<Integer, Double>> level = new ArrayList<>(adjacency.size());
        for (int[] neighbors : adjacency.neighbors()) {
            Map<Integer, Double> weights = new LinkedHashMap<>();
            for (int w : neighbors) {
                weights.put(w, 1.0);
            }
            level.add(weights);
        }
        return level;
    }

    /**
     * Relabels communities 0..k-1 in order of first appearance and returns k.
     */
    private static int renumber(int[] assignment) {
        Map<Integer, Integer> labels = new HashMap<>();
        for (int v = 0; v < assignment.length; v++) {
            Integer label = labels.get(assignment[v]);
            if (label == null) {
                label = labels.size();
                labels.put(assignment[v], label);
            }
            assignment[v] = label;
        }
        return labels.size();
    }

    private static List<Map<Integer, Double>> aggregate(List<Map<Integer, Double>> level, int[] assignment,
                                                        int communities) {
        List<Map<Integer, Double>> collapsed = new ArrayList<>(communities);
        for (int c = 0; c < communities; c++) {
            collapsed.add(new LinkedHashMap<>());
        }
        for (int v = 0; v < level.size(); v++) {
            Map<Integer, Double> weights = collapsed.get(assignment[v]);
            for (Map.Entry<Integer, Double> entry : level.get(v).entrySet()) {
                weights.merge(assignment[entry.getKey()], entry.getValue(), Double::sum);
            }
        }
        return collapsed;
    }
}
