package com.entity.network.exploration;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Greedy exploration that always expands the highest-scoring frontier node.
 * A node is scored once, when first discovered; later paths to it do not change its score.
 */
class BestFirstExplorer {

    private record Candidate(String nodeId, double score, long sequence, int depth, String parent) {}

    private static final Comparator<Candidate> BY_SCORE = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparingLong(Candidate::sequence);

    private final Graph graph;
    private final NodeScorer scorer;
    private final int maxNodes;

    BestFirstExplorer(Graph graph, NodeScorer scorer, int maxNodes) {
        this.graph = graph;
        this.scorer = scorer;
        this.maxNodes = maxNodes;
    }

    ExplorationResult explore(String start) {
        Map<String, ExploredNode> explored = new LinkedHashMap<>();
        Set<String> discovered = new HashSet<>();
        PriorityQueue<Candidate> frontier = new PriorityQueue<>(BY_SCORE);
        long sequence = 0;

        explored.put(start, new ExploredNode(start, 0, null, attributesOf(start)));
        discovered.add(start);
        sequence = enqueueNeighbors(start, 0, discovered, frontier, sequence);

        boolean truncated = false;
        while (!frontier.isEmpty()) {
            if (explored.size() >= maxNodes) {
                truncated = true;
                break;
            }
            Candidate best = frontier.poll();
            explored.put(best.nodeId(), new ExploredNode(best.nodeId(), best.depth(), best.parent(),
                    attributesOf(best.nodeId())));
            sequence = enqueueNeighbors(best.nodeId(), best.depth(), discovered, frontier, sequence);
        }

        List<GraphEdge> edges = NetworkExplorationService.collectEdges(graph, explored.keySet(), null);
        return ExplorationResult.of(start, explored.values(), edges, truncated);
    }

    private long enqueueNeighbors(String nodeId, int depth, Set<String> discovered,
                                  PriorityQueue<Candidate> frontier, long sequence) {
        for (String neighbor : graph.neighbors(nodeId)) {
            if (discovered.add(neighbor)) {
                double score = scorer.score(neighbor, attributesOf(neighbor));
                frontier.add(new Candidate(neighbor, score, sequence++, depth + 1, nodeId));
            }
        }
        return sequence;
    }

    private Map<String, Object> attributesOf(String nodeId) {
        return graph.getNodeAttributes(nodeId).orElse(Map.of());
    }
}
