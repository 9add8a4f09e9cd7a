package com.entity.network.discovery;

import com.entity.network.algorithm.BreadthFirstComponents;
import com.entity.network.algorithm.BreadthFirstMetrics;
import com.entity.network.algorithm.ComponentAlgorithm;
import com.entity.network.algorithm.DijkstraPathfinding;
import com.entity.network.algorithm.MetricsAlgorithm;
import com.entity.network.algorithm.PathfindingAlgorithm;
import com.entity.network.exploration.DepthExplorationOptions;
import com.entity.network.exploration.EdgeFilter;
import com.entity.network.exploration.ExplorationResult;
import com.entity.network.exploration.ExploredNode;
import com.entity.network.exploration.NetworkExplorationService;
import com.entity.network.exploration.NodeFilter;
import com.entity.network.exploration.UnknownStartNodeException;
import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-entity network discovery: explores around each query entity, then reports how the
 * query entities connect to each other directly, through bridge entities and along pathways.
 */
public class NetworkDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(NetworkDiscoveryService.class);

    private static final double TYPE_DIVERSITY_BONUS = 0.5;

    private final NetworkExplorationService explorationService;
    private final BridgeAnalyzer bridgeAnalyzer;
    private final PathwayFinder pathwayFinder;
    private final NetworkMetricsCalculator metricsCalculator;
    private final int maxDiscoveredEntities;

    public NetworkDiscoveryService() {
        this(new NetworkExplorationService(), new DijkstraPathfinding(), new BreadthFirstComponents());
    }

    public NetworkDiscoveryService(NetworkExplorationService explorationService,
                                   PathfindingAlgorithm pathfinding,
                                   ComponentAlgorithm components) {
        this(explorationService, pathfinding, components, new BreadthFirstMetrics());
    }

    public NetworkDiscoveryService(NetworkExplorationService explorationService,
                                   PathfindingAlgorithm pathfinding,
                                   ComponentAlgorithm components,
                                   MetricsAlgorithm metrics) {
        this.explorationService = Objects.requireNonNull(explorationService, "explorationService is required");
        this.bridgeAnalyzer = new BridgeAnalyzer();
        this.pathwayFinder = new PathwayFinder(pathfinding);
        this.metricsCalculator = new NetworkMetricsCalculator(components, metrics);
        this.maxDiscoveredEntities = explorationService.getConfig().maxDiscoveredEntities();
    }

    public PathwayFinder getPathwayFinder() {
        return pathwayFinder;
    }

    /**
     * Discovers the network around the query entities.
     *
     * @throws InsufficientQueryEntitiesException if fewer than two distinct ids are given
     * @throws UnknownStartNodeException          if a query entity is not in the graph
     */
    public DiscoveryResult discover(Graph graph, DiscoveryQuery query) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(query, "query is required");
        long startNanos = System.nanoTime();

        List<String> queryEntities = query.getQueryEntities();
        if (queryEntities.size() < 2) {
            throw new InsufficientQueryEntitiesException(queryEntities.size());
        }
        for (String entity : queryEntities) {
            if (!graph.hasNode(entity)) {
                throw new UnknownStartNodeException(entity);
            }
        }
        Set<String> querySet = new LinkedHashSet<>(queryEntities);

        // Phase 1: bounded traversal around each query entity
        EdgeFilter edgeFilter = query.getIncludeRelationTypes().isEmpty()
                ? null
                : EdgeFilter.relationTypes(query.getIncludeRelationTypes());
        NodeFilter nodeFilter = query.getFilters().isEmpty()
                ? null
                : query.getFilters().exemptingQueryEntities(querySet);
        Map<String, ExplorationResult> traversals = new LinkedHashMap<>();
        for (String entity : queryEntities) {
            traversals.put(entity, explorationService.exploreByDepth(graph, DepthExplorationOptions.builder(entity)
                    .maxDepth(query.getMaxHopDistance())
                    .maxNodes(Integer.MAX_VALUE)
                    .nodeFilter(nodeFilter)
                    .edgeFilter(edgeFilter)
                    .includeEdges(false)
                    .build()));
        }

        // Phase 2: union, keeping per-query distances
        Map<String, Map<String, Integer>> reach = new LinkedHashMap<>();
        for (String entity : queryEntities) {
            reach.put(entity, new LinkedHashMap<>());
        }
        traversals.forEach((entity, traversal) -> {
            for (ExploredNode node : traversal.getNodes()) {
                reach.computeIfAbsent(node.nodeId(), id -> new LinkedHashMap<>()).put(entity, node.depth());
            }
        });
        Set<String> retained = retain(reach, querySet);
        boolean truncated = retained.size() < reach.size();
        if (truncated) {
            log.debug("Discovered {} entities, truncated to {}", reach.size(), retained.size());
        }

        Graph network = graph.subgraph(retained);
        if (edgeFilter != null) {
            network = network.filterEdges(edgeFilter::test);
        }
        Map<String, DiscoveredEntity> entities = new LinkedHashMap<>();
        for (String nodeId : retained) {
            entities.put(nodeId, toEntity(nodeId, reach.get(nodeId), querySet, traversals,
                    query.isIncludeDiscoveryPaths()));
        }
        log.debug("Discovery network has {} entities and {} edges", network.nodeCount(), network.edgeCount());

        // Phase 3: direct connections
        List<DirectConnection> directConnections = findDirectConnections(network, queryEntities);

        // Phase 4: bridges
        List<BridgeEntity> bridges = bridgeAnalyzer.findBridges(network, entities, traversals);
        BridgeStatistics bridgeStatistics = bridgeAnalyzer.statistics(bridges);
        if (query.getMaxBridgeEntities() > 0 && bridges.size() > query.getMaxBridgeEntities()) {
            bridges = bridges.subList(0, query.getMaxBridgeEntities());
        }

        // Phase 5: pathways for pairs without a direct connection
        List<Pathway> pathways = pathwayFinder.findPathways(network, queryEntities, directConnections);
        log.debug("Found {} direct connections, {} bridges, {} pathways",
                directConnections.size(), bridgeStatistics.total(), pathways.size());

        // Phase 6: metrics
        NetworkMetrics metrics = metricsCalculator.calculate(network, queryEntities, entities.values(),
                directConnections, bridges.size(), pathways);

        return DiscoveryResult.builder()
                .queryEntities(queryEntities)
                .entities(entities)
                .edges(network.edges())
                .directConnections(directConnections)
                .bridgeEntities(bridges)
                .bridgeStatistics(bridgeStatistics)
                .pathways(pathways)
                .metrics(metrics)
                .truncated(truncated)
                .queryTime(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();
    }

    /**
     * Keeps the query entities plus the nearest other entities up to the configured cap,
     * preserving discovery order.
     */
    private Set<String> retain(Map<String, Map<String, Integer>> reach, Set<String> queryEntities) {
        if (reach.size() <= maxDiscoveredEntities) {
            return reach.keySet();
        }
        List<String> others = new ArrayList<>();
        for (String nodeId : reach.keySet()) {
            if (!queryEntities.contains(nodeId)) {
                others.add(nodeId);
            }
        }
        // List.sort is stable, so equally near entities keep discovery order
        others.sort(Comparator.comparingInt(nodeId -> minDistance(reach.get(nodeId))));
        int room = Math.max(0, maxDiscoveredEntities - queryEntities.size());
        Set<String> kept = new HashSet<>(others.subList(0, Math.min(room, others.size())));

        Set<String> retained = new LinkedHashSet<>();
        for (String nodeId : reach.keySet()) {
            if (queryEntities.contains(nodeId) || kept.contains(nodeId)) {
                retained.add(nodeId);
            }
        }
        return retained;
    }

    private DiscoveredEntity toEntity(String nodeId, Map<String, Integer> distances, Set<String> queryEntities,
                                      Map<String, ExplorationResult> traversals, boolean includePath) {
        String nearest = null;
        for (Map.Entry<String, Integer> entry : distances.entrySet()) {
            if (nearest == null || entry.getValue() < distances.get(nearest)) {
                nearest = entry.getKey();
            }
        }
        List<String> path = includePath && nearest != null
                ? BridgeAnalyzer.pathFrom(traversals.get(nearest), nodeId)
                : List.of();
        int distance = nearest != null ? distances.get(nearest) : 0;
        return new DiscoveredEntity(nodeId, distance, distances.keySet(), distances, path,
                queryEntities.contains(nodeId));
    }

    private List<DirectConnection> findDirectConnections(Graph network, List<String> queryEntities) {
        List<DirectConnection> connections = new ArrayList<>();
        for (int i = 0; i < queryEntities.size(); i++) {
            for (int j = i + 1; j < queryEntities.size(); j++) {
                String from = queryEntities.get(i);
                String to = queryEntities.get(j);
                List<GraphEdge> edges = network.edgesBetween(from, to);
                if (edges.isEmpty()) {
                    continue;
                }
                List<RelationshipDetail> details = new ArrayList<>(edges.size());
                Set<String> types = new HashSet<>();
                for (GraphEdge edge : edges) {
                    details.add(RelationshipDetail.of(edge, from));
                    types.add(EdgeAttributes.normalizeType(edge.getRelationType().orElse(EdgeAttributes.ASSOCIATION)));
                }
                connections.add(new DirectConnection(from, to, details, connectionStrength(edges.size(), types.size())));
            }
        }
        return Collections.unmodifiableList(connections);
    }

    /**
     * Relationship count plus a bonus for each distinct type beyond the first.
     */
    public static double connectionStrength(int relationshipCount, int distinctTypes) {
        return relationshipCount + TYPE_DIVERSITY_BONUS * Math.max(0, distinctTypes - 1);
    }

    private static int minDistance(Map<String, Integer> distances) {
        int min = Integer.MAX_VALUE;
        for (int distance : distances.values()) {
            min = Math.min(min, distance);
        }
        return min;
    }
}
