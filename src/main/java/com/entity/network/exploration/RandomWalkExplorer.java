package com.entity.network.exploration;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Random walk with restart. Every step first draws a teleport back to the start node; otherwise
 * the walker follows a uniformly chosen neighbor with the walk probability, and restarts when it
 * does not move or stands on a dead end. Each arrival, restarts included, is one visit event.
 */
class RandomWalkExplorer {

    private final Graph graph;
    private final String start;
    private final int maxVisits;
    private final double walkProbability;
    private final double teleportProbability;
    private final Random random;

    RandomWalkExplorer(Graph graph, ProgressiveExplorationOptions options) {
        this.graph = graph;
        this.start = options.getStartNode();
        this.maxVisits = options.getMaxNodes();
        this.walkProbability = options.getWalkProbability();
        this.teleportProbability = options.getTeleportProbability();
        this.random = options.getSeed() != null ? new Random(options.getSeed()) : new Random();
    }

    ExplorationResult walk() {
        Map<String, ExploredNode> explored = new LinkedHashMap<>();
        Map<String, Integer> visitCounts = new LinkedHashMap<>();
        Map<String, GraphEdge> traversed = new LinkedHashMap<>();

        String current = start;
        int hops = 0;
        explored.put(start, new ExploredNode(start, 0, null, attributesOf(start)));
        visitCounts.put(start, 1);
        int visits = 1;

        while (visits < maxVisits) {
            String next = null;
            if (random.nextDouble() >= teleportProbability && random.nextDouble() < walkProbability) {
                List<String> neighbors = graph.neighbors(current);
                if (!neighbors.isEmpty()) {
                    next = neighbors.get(random.nextInt(neighbors.size()));
                }
            }
            if (next == null) {
                current = start;
                hops = 0;
            } else {
                GraphEdge edge = graph.edgesBetween(current, next).get(0);
                traversed.putIfAbsent(edge.getKey(), edge);
                hops++;
                if (!explored.containsKey(next)) {
                    explored.put(next, new ExploredNode(next, hops, current, attributesOf(next)));
                }
                current = next;
            }
            visitCounts.merge(current, 1, Integer::sum);
            visits++;
        }

        return ExplorationResult.of(start, explored.values(), List.copyOf(traversed.values()), visitCounts, false);
    }

    private Map<String, Object> attributesOf(String nodeId) {
        return graph.getNodeAttributes(nodeId).orElse(Map.of());
    }
}
