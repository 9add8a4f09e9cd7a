package com.entity.network.discovery;

import com.entity.network.exploration.ExplorationResult;
import com.entity.network.exploration.ExploredNode;
import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;
import com.entity.network.graph.RelationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects and ranks bridge entities: non-query entities reached from at least two query entities.
 */
public class BridgeAnalyzer {

    private static final double PARALLEL_RELATIONSHIP_BONUS = 0.5;

    /**
     * Scores every bridge in the discovered network, best first. Ties keep discovery order.
     *
     * @param network     the discovered network
     * @param entities    discovered entities in discovery order
     * @param traversals  the per-query traversals the entities were found by
     */
    public List<BridgeEntity> findBridges(Graph network, Map<String, DiscoveredEntity> entities,
                                          Map<String, ExplorationResult> traversals) {
        List<BridgeEntity> bridges = new ArrayList<>();
        Map<String, Integer> discoveryOrder = new HashMap<>();
        for (DiscoveredEntity entity : entities.values()) {
            discoveryOrder.put(entity.nodeId(), discoveryOrder.size());
            if (entity.queryEntity() || entity.reachedFrom().size() < 2) {
                continue;
            }
            bridges.add(toBridge(network, entity, traversals));
        }
        bridges.sort(Comparator.comparingDouble(BridgeEntity::bridgeScore).reversed()
                .thenComparingInt(bridge -> discoveryOrder.get(bridge.nodeId())));
        return bridges;
    }

    /**
     * Number of linked query entities, plus 1/distance for each, plus a bonus for every extra
     * parallel relationship to a directly adjacent query entity.
     */
    public static double bridgeScore(Graph network, String nodeId, Map<String, Integer> distances) {
        double score = distances.size();
        for (Map.Entry<String, Integer> entry : distances.entrySet()) {
            int distance = entry.getValue();
            score += 1.0 / distance;
            if (distance == 1) {
                int parallel = network.edgesBetween(nodeId, entry.getKey()).size();
                if (parallel > 1) {
                    score += PARALLEL_RELATIONSHIP_BONUS * (parallel - 1);
                }
            }
        }
        return score;
    }

    public BridgeStatistics statistics(List<BridgeEntity> bridges) {
        return BridgeStatistics.of(bridges);
    }

    private BridgeEntity toBridge(Graph network, DiscoveredEntity entity, Map<String, ExplorationResult> traversals) {
        Map<String, List<String>> connectionTypes = new LinkedHashMap<>();
        List<String> allTypes = new ArrayList<>();
        for (String query : entity.reachedFrom()) {
            List<String> types = typesAlong(network, pathFrom(traversals.get(query), entity.nodeId()));
            connectionTypes.put(query, types);
            allTypes.addAll(types);
        }
        double score = bridgeScore(network, entity.nodeId(), entity.distances());
        return new BridgeEntity(entity.nodeId(), entity.reachedFrom(), connectionTypes, entity.distances(),
                score, RelationKind.ofAll(allTypes));
    }

    /**
     * Follows discovery parents back to the traversal start; returns the path start first.
     */
    static List<String> pathFrom(ExplorationResult traversal, String nodeId) {
        List<String> path = new ArrayList<>();
        if (traversal == null) {
            return path;
        }
        Optional<ExploredNode> current = traversal.getNode(nodeId);
        while (current.isPresent()) {
            path.add(current.get().nodeId());
            String parent = current.get().parent();
            current = parent != null ? traversal.getNode(parent) : Optional.empty();
        }
        Collections.reverse(path);
        return path;
    }

    private static List<String> typesAlong(Graph network, List<String> path) {
        // first spelling of each type wins
        Map<String, String> types = new LinkedHashMap<>();
        for (int i = 0; i + 1 < path.size(); i++) {
            for (GraphEdge edge : network.edgesBetween(path.get(i), path.get(i + 1))) {
                String type = edge.getRelationType().orElse(EdgeAttributes.ASSOCIATION);
                types.putIfAbsent(EdgeAttributes.normalizeType(type), type);
            }
        }
        return new ArrayList<>(types.values());
    }
}
