package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Linear-time alternative to {@link DijkstraPathfinding}. A breadth-first pass fixes hop
 * distances layer by layer, and each node keeps the cheapest predecessor edge from the layer
 * above. Since a layer is fully processed before the next one is dequeued, a node's penalty is
 * final when it is expanded.
 */
public class LayeredBfsPathfinding implements PathfindingAlgorithm {

    @Override
    public Optional<GraphPath> shortestPath(Graph graph, String source, String target, String preferredType) {
        if (!graph.hasNode(source) || !graph.hasNode(target)) {
            return Optional.empty();
        }
        Map<String, Integer> hops = new HashMap<>();
        Map<String, Integer> penalties = new HashMap<>();
        Map<String, GraphEdge> via = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();

        hops.put(source, 0);
        penalties.put(source, 0);
        queue.add(source);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                return Optional.of(DijkstraPathfinding.rebuild(source, target, via));
            }
            int depth = hops.get(current);
            int penalty = penalties.get(current);
            for (GraphEdge edge : graph.edgesOf(current)) {
                String next = edge.opposite(current);
                int candidate = penalty + PathfindingAlgorithm.penalty(edge, preferredType);
                Integer known = hops.get(next);
                if (known == null) {
                    hops.put(next, depth + 1);
                    penalties.put(next, candidate);
                    via.put(next, edge);
                    queue.add(next);
                } else if (known == depth + 1 && candidate < penalties.get(next)) {
                    penalties.put(next, candidate);
                    via.put(next, edge);
                }
            }
        }
        return Optional.empty();
    }
}
