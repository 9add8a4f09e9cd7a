package com.entity.network.algorithm;

import com.entity.network.graph.GraphEdge;

import java.util.List;

/**
 * A walk through the graph: {@code nodes} has exactly one more element than {@code edges}.
 */
public record GraphPath(List<String> nodes, List<GraphEdge> edges) {

    public GraphPath {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        if (nodes.isEmpty() || nodes.size() != edges.size() + 1) {
            throw new IllegalArgumentException("A path of " + edges.size() + " edges needs "
                    + (edges.size() + 1) + " nodes, got " + nodes.size());
        }
    }

    public String source() {
        return nodes.get(0);
    }

    public String target() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * Number of hops.
     */
    public int length() {
        return edges.size();
    }

    /**
     * Counts the edges whose relationship type differs from {@code preferredType}.
     */
    public int countOtherThan(String preferredType) {
        if (preferredType == null) {
            return 0;
        }
        int count = 0;
        for (GraphEdge edge : edges) {
            if (!edge.getRelationType().map(preferredType::equalsIgnoreCase).orElse(false)) {
                count++;
            }
        }
        return count;
    }
}
