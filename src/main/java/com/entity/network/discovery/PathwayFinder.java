package com.entity.network.discovery;

import com.entity.network.algorithm.GraphPath;
import com.entity.network.algorithm.PathfindingAlgorithm;
import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;
import com.entity.network.graph.RelationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds routes between query entities that are not directly connected.
 */
public class PathwayFinder {

    private final PathfindingAlgorithm pathfinding;

    public PathwayFinder(PathfindingAlgorithm pathfinding) {
        this.pathfinding = Objects.requireNonNull(pathfinding, "pathfinding is required");
    }

    /**
     * Returns one shortest pathway per query pair without a direct connection, preferring
     * kinship edges among equally short routes. Unreachable pairs are left out.
     */
    public List<Pathway> findPathways(Graph network, List<String> queryEntities,
                                      List<DirectConnection> directConnections) {
        List<Pathway> pathways = new ArrayList<>();
        for (int i = 0; i < queryEntities.size(); i++) {
            for (int j = i + 1; j < queryEntities.size(); j++) {
                String from = queryEntities.get(i);
                String to = queryEntities.get(j);
                if (isDirectlyConnected(directConnections, from, to)) {
                    continue;
                }
                findShortestPathway(network, from, to).ifPresent(pathways::add);
            }
        }
        return pathways;
    }

    public Optional<Pathway> findShortestPathway(Graph network, String from, String to) {
        return pathfinding.shortestPath(network, from, to, EdgeAttributes.KINSHIP)
                .map(path -> toPathway(from, to, path));
    }

    /**
     * Returns every simple pathway of at most {@code maxLength} hops, shortest first.
     */
    public List<Pathway> findAllPathways(Graph network, String from, String to, int maxLength) {
        List<Pathway> pathways = new ArrayList<>();
        for (GraphPath path : pathfinding.allPaths(network, from, to, maxLength)) {
            pathways.add(toPathway(from, to, path));
        }
        return pathways;
    }

    /**
     * Per-hop strength averaged over the route: a kinship hop scores 2, any other hop 1,
     * plus 1 / (distance + 1) for the relation's recorded distance (0 when unknown).
     */
    public static double pathStrength(List<GraphEdge> edges) {
        if (edges.isEmpty()) {
            return 0.0;
        }
        double strength = 0.0;
        for (GraphEdge edge : edges) {
            strength += edge.isKinship() ? 2.0 : 1.0;
            double distance = EdgeAttributes.number(edge.getAttributes(), EdgeAttributes.DISTANCE).orElse(0.0);
            strength += 1.0 / (distance + 1.0);
        }
        return strength / edges.size();
    }

    private static Pathway toPathway(String from, String to, GraphPath path) {
        List<String> types = new ArrayList<>();
        for (GraphEdge edge : path.edges()) {
            types.add(edge.getRelationType().orElse(EdgeAttributes.ASSOCIATION));
        }
        return new Pathway(from, to, path.nodes(), path.edges(), RelationKind.ofAll(types),
                pathStrength(path.edges()));
    }

    private static boolean isDirectlyConnected(List<DirectConnection> connections, String a, String b) {
        for (DirectConnection connection : connections) {
            if (connection.connects(a, b)) {
                return true;
            }
        }
        return false;
    }
}
