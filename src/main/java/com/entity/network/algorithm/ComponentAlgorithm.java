package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

import java.util.List;
import java.util.Set;

/**
 * Connected components of the undirected view of a graph.
 */
public interface ComponentAlgorithm {

    /**
     * Returns the components, ordered by the graph position of their first node.
     * Isolated nodes form singleton components.
     */
    List<Set<String>> components(Graph graph);

    default int count(Graph graph) {
        return components(graph).size();
    }
}
