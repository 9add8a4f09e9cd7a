package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint-set union with path halving and union by size. Touches each edge once, which
 * beats repeated traversals on edge-heavy graphs.
 */
public class UnionFindComponents implements ComponentAlgorithm {

    @Override
    public List<Set<String>> components(Graph graph) {
        List<String> nodes = graph.nodes();
        Map<String, Integer> index = new HashMap<>();
        for (String nodeId : nodes) {
            index.put(nodeId, index.size());
        }
        int[] parent = new int[nodes.size()];
        int[] size = new int[nodes.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
            size[i] = 1;
        }

        for (GraphEdge edge : graph.edges()) {
            union(parent, size, index.get(edge.getSource()), index.get(edge.getTarget()));
        }

        Map<Integer, Set<String>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), root -> new LinkedHashSet<>()).add(nodes.get(i));
        }
        List<Set<String>> components = new ArrayList<>(byRoot.size());
        for (Set<String> component : byRoot.values()) {
            components.add(Collections.unmodifiableSet(component));
        }
        return components;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int[] size, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        if (size[rootA] < size[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
    }
}
