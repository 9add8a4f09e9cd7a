package com.entity.network.discovery;

import com.entity.network.graph.GraphEdge;
import com.entity.network.graph.RelationKind;

import java.util.List;

/**
 * An indirect route between two query entities.
 *
 * @param from     first query entity
 * @param to       second query entity
 * @param nodes    node sequence from {@code from} to {@code to}
 * @param edges    edges along the route
 * @param pathType kind of the relationships along the route
 * @param strength average per-hop strength; kinship hops and closer relations count more
 */
public record Pathway(String from, String to, List<String> nodes, List<GraphEdge> edges,
                      RelationKind pathType, double strength) {

    public Pathway {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public int length() {
        return edges.size();
    }
}
