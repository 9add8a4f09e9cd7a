package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import com.entity.network.graph.TraversalDirection;
import com.entity.network.graph.VisitDecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds components with one breadth-first sweep per unvisited node. The default implementation.
 */
public class BreadthFirstComponents implements ComponentAlgorithm {

    @Override
    public List<Set<String>> components(Graph graph) {
        List<Set<String>> components = new ArrayList<>();
        Set<String> assigned = new HashSet<>();
        for (String nodeId : graph.nodes()) {
            if (assigned.contains(nodeId)) {
                continue;
            }
            Set<String> component = new LinkedHashSet<>();
            graph.breadthFirst(nodeId, TraversalDirection.ALL, Integer.MAX_VALUE, (id, attributes, depth) -> {
                component.add(id);
                return VisitDecision.CONTINUE;
            });
            assigned.addAll(component);
            components.add(Collections.unmodifiableSet(component));
        }
        return components;
    }
}
