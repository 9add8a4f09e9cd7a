package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Dijkstra's algorithm with a two-part cost: hops first, then edges of a non-preferred type.
 * The default pathfinding implementation.
 */
public class DijkstraPathfinding implements PathfindingAlgorithm {

    private record Cost(int hops, int penalty) implements Comparable<Cost> {
        Cost plus(int extraPenalty) {
            return new Cost(hops + 1, penalty + extraPenalty);
        }

        @Override
        public int compareTo(Cost other) {
            int byHops = Integer.compare(hops, other.hops);
            return byHops != 0 ? byHops : Integer.compare(penalty, other.penalty);
        }
    }

    private record Entry(String nodeId, Cost cost, long sequence) {}

    private static final Comparator<Entry> ORDER = Comparator
            .comparing(Entry::cost)
            .thenComparingLong(Entry::sequence);

    @Override
    public Optional<GraphPath> shortestPath(Graph graph, String source, String target, String preferredType) {
        if (!graph.hasNode(source) || !graph.hasNode(target)) {
            return Optional.empty();
        }
        Map<String, Cost> best = new HashMap<>();
        Map<String, GraphEdge> via = new HashMap<>();
        PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
        long sequence = 0;

        best.put(source, new Cost(0, 0));
        queue.add(new Entry(source, best.get(source), sequence++));

        while (!queue.isEmpty()) {
            Entry entry = queue.poll();
            if (entry.cost().compareTo(best.get(entry.nodeId())) > 0) {
                continue;
            }
            if (entry.nodeId().equals(target)) {
                return Optional.of(rebuild(source, target, via));
            }
            for (GraphEdge edge : graph.edgesOf(entry.nodeId())) {
                String next = edge.opposite(entry.nodeId());
                Cost candidate = entry.cost().plus(PathfindingAlgorithm.penalty(edge, preferredType));
                Cost known = best.get(next);
                if (known == null || candidate.compareTo(known) < 0) {
                    best.put(next, candidate);
                    via.put(next, edge);
                    queue.add(new Entry(next, candidate, sequence++));
                }
            }
        }
        return Optional.empty();
    }

    static GraphPath rebuild(String source, String target, Map<String, GraphEdge> via) {
        List<String> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        String current = target;
        nodes.add(current);
        while (!current.equals(source)) {
            GraphEdge edge = via.get(current);
            edges.add(edge);
            current = edge.opposite(current);
            nodes.add(current);
        }
        Collections.reverse(nodes);
        Collections.reverse(edges);
        return new GraphPath(nodes, edges);
    }
}
