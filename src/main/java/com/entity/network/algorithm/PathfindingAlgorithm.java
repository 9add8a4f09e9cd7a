package com.entity.network.algorithm;

import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Path search over the undirected view of a graph.
 */
public interface PathfindingAlgorithm {

    /**
     * Finds a path with the fewest hops; among those, the one with the fewest edges whose type
     * differs from {@code preferredType}. A null preferred type makes every edge equal.
     *
     * @return the path, or empty when either node is absent or no path exists
     */
    Optional<GraphPath> shortestPath(Graph graph, String source, String target, String preferredType);

    /**
     * Enumerates the simple paths of at most {@code maxLength} hops, shortest first. Parallel
     * edges do not multiply paths: each hop uses the first edge joining the pair.
     */
    default List<GraphPath> allPaths(Graph graph, String source, String target, int maxLength) {
        List<GraphPath> paths = new ArrayList<>();
        if (!graph.hasNode(source) || !graph.hasNode(target) || source.equals(target)) {
            return paths;
        }
        List<String> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        nodes.add(source);
        onPath.add(source);
        collectPaths(graph, target, maxLength, nodes, edges, onPath, paths);
        paths.sort((a, b) -> Integer.compare(a.length(), b.length()));
        return paths;
    }

    private static void collectPaths(Graph graph, String target, int maxLength, List<String> nodes,
                                     List<GraphEdge> edges, Set<String> onPath, List<GraphPath> paths) {
        String current = nodes.get(nodes.size() - 1);
        if (current.equals(target)) {
            paths.add(new GraphPath(nodes, edges));
            return;
        }
        if (edges.size() >= maxLength) {
            return;
        }
        for (String next : graph.neighbors(current)) {
            if (onPath.contains(next)) {
                continue;
            }
            nodes.add(next);
            edges.add(graph.edgesBetween(current, next).get(0));
            onPath.add(next);
            collectPaths(graph, target, maxLength, nodes, edges, onPath, paths);
            onPath.remove(next);
            edges.remove(edges.size() - 1);
            nodes.remove(nodes.size() - 1);
        }
    }

    /**
     * Returns 0 for an edge of the preferred type, 1 otherwise.
     */
    static int penalty(GraphEdge edge, String preferredType) {
        if (preferredType == null) {
            return 0;
        }
        return edge.getRelationType().map(preferredType::equalsIgnoreCase).orElse(false) ? 0 : 1;
    }
}
