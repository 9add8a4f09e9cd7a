package com.entity.network.discovery;

import com.entity.network.SampleNetworks;
import com.entity.network.algorithm.BreadthFirstComponents;
import com.entity.network.algorithm.DijkstraPathfinding;
import com.entity.network.config.ExplorationConfig;
import com.entity.network.exploration.InvalidBoundException;
import com.entity.network.exploration.NetworkExplorationService;
import com.entity.network.exploration.UnknownStartNodeException;
import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;
import com.entity.network.graph.GraphMode;
import com.entity.network.graph.RelationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NetworkDiscoveryService Tests")
class NetworkDiscoveryServiceTest {

    private NetworkDiscoveryService service;

    @BeforeEach
    void setUp() {
        service = new NetworkDiscoveryService();
    }

    private static Map<String, Object> kinship(String label, int code) {
        return Map.of(EdgeAttributes.TYPE, EdgeAttributes.KINSHIP, EdgeAttributes.LABEL, label,
                EdgeAttributes.CODE, code);
    }

    /**
     * A and B are not related directly; C is a relative of both, D an associate of A only.
     */
    private static Graph sharedRelative() {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.mergeNode("A", Map.of("name", "Su Xun"));
        graph.mergeNode("B", Map.of("name", "Ouyang Xiu"));
        graph.mergeNode("C", Map.of("born", 1050));
        graph.mergeNode("D", Map.of("born", 1200));
        graph.addEdgeWithKey("A-C", "A", "C", SampleNetworks.kinship());
        graph.addEdgeWithKey("C-B", "C", "B", SampleNetworks.kinship());
        graph.addEdgeWithKey("A-D", "A", "D", SampleNetworks.association());
        return graph;
    }

    @Nested
    @DisplayName("Direct connections")
    class DirectConnectionTests {

        @Test
        @DisplayName("Directly related query entities should yield one connection and no bridge")
        void directKinship() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdgeWithKey("A-B", "A", "B", kinship("father", 75));
            graph.addEdgeWithKey("A-X", "A", "X", SampleNetworks.association());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            assertEquals(1, result.getDirectConnections().size());
            assertTrue(result.getBridgeEntities().isEmpty());
            assertTrue(result.getPathways().isEmpty());

            DirectConnection connection = result.getDirectConnections().get(0);
            assertEquals("A", connection.from());
            assertEquals("B", connection.to());
            assertEquals(1.0, connection.strength(), 1e-9);
            RelationshipDetail detail = connection.relationships().get(0);
            assertEquals(EdgeAttributes.KINSHIP, detail.relationType());
            assertEquals("father", detail.label());
            assertEquals(75, detail.code());
            assertEquals(RelationshipDetail.Direction.MUTUAL, detail.direction());
            assertEquals("A-B", detail.edgeKey());
        }

        @Test
        @DisplayName("Several relation types should strengthen a connection")
        void connectionStrength() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdgeWithKey("A-B#1", "A", "B", SampleNetworks.kinship());
            graph.addEdgeWithKey("A-B#2", "A", "B", SampleNetworks.association());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            DirectConnection connection = result.getDirectConnections().get(0);
            assertEquals(2, connection.relationships().size());
            assertEquals(2.5, connection.strength(), 1e-9);
            assertEquals(1.0, NetworkDiscoveryService.connectionStrength(1, 1));
            assertEquals(3.0, NetworkDiscoveryService.connectionStrength(2, 3));
        }

        @Test
        @DisplayName("Relation types differing only in case should count as one type")
        void connectionTypesIgnoreCase() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdgeWithKey("A-B#1", "A", "B", Map.of(EdgeAttributes.TYPE, "kinship"));
            graph.addEdgeWithKey("A-B#2", "A", "B", Map.of(EdgeAttributes.TYPE, "Kinship"));

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            DirectConnection connection = result.getDirectConnections().get(0);
            assertEquals(2, connection.relationships().size());
            assertEquals(2.0, connection.strength(), 1e-9);
        }

        @Test
        @DisplayName("Directed edges should report their orientation")
        void directedOrientation() {
            Graph graph = new Graph(GraphMode.DIRECTED);
            graph.addDirectedEdge("B", "A", kinship("son", 180));

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            RelationshipDetail detail = result.getDirectConnections().get(0).relationships().get(0);
            assertEquals(RelationshipDetail.Direction.REVERSE, detail.direction());
        }

        @Test
        @DisplayName("Hop distance 0 should still see direct connections")
        void zeroHops() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("A", "B", SampleNetworks.kinship());
            graph.addEdge("A", "C", SampleNetworks.kinship());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").maxHopDistance(0).build());

            assertEquals(Set.of("A", "B"), result.getEntities().keySet());
            assertEquals(1, result.getDirectConnections().size());
        }
    }

    @Nested
    @DisplayName("Bridges")
    class BridgeTests {

        @Test
        @DisplayName("An entity adjacent to both query entities should be a bridge")
        void sharedRelativeIsBridge() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B").build());

            assertEquals(1, result.getBridgeEntities().size());
            BridgeEntity bridge = result.getBridgeEntities().get(0);
            assertEquals("C", bridge.nodeId());
            assertEquals(Set.of("A", "B"), bridge.connectsTo());
            assertEquals(Map.of("A", 1, "B", 1), bridge.distances());
            assertEquals(4.0, bridge.bridgeScore(), 1e-9);
            assertEquals(RelationKind.KINSHIP, bridge.bridgeType());
            assertEquals(List.of(EdgeAttributes.KINSHIP), bridge.connectionTypes().get("A"));
            assertTrue(result.getDirectConnections().isEmpty());
        }

        @Test
        @DisplayName("Bridges linked by different relation families should be mixed")
        void mixedBridge() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("A", "C", SampleNetworks.kinship());
            graph.addEdge("C", "B", SampleNetworks.association());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            assertEquals(RelationKind.MIXED, result.getBridgeEntities().get(0).bridgeType());
            assertEquals(1, result.getBridgeStatistics().byType().get(RelationKind.MIXED));
        }

        @Test
        @DisplayName("Bridges should rank by score, parallel relations counting extra")
        void ranking() {
            Graph graph = sharedRelative();
            graph.addEdgeWithKey("D-B", "D", "B", SampleNetworks.association());
            graph.addEdgeWithKey("D-B#2", "D", "B", SampleNetworks.kinship());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            List<String> order = new ArrayList<>();
            result.getBridgeEntities().forEach(bridge -> order.add(bridge.nodeId()));
            assertEquals(List.of("D", "C"), order);
            assertEquals(4.5, result.getBridgeEntities().get(0).bridgeScore(), 1e-9);
        }

        @Test
        @DisplayName("maxBridgeEntities should cut the list but not the statistics")
        void topN() {
            Graph graph = sharedRelative();
            graph.addEdge("D", "B", SampleNetworks.association());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B")
                    .maxBridgeEntities(1)
                    .build());

            assertEquals(1, result.getBridgeEntities().size());
            assertEquals(2, result.getBridgeStatistics().total());
            assertEquals(2.0, result.getBridgeStatistics().averageConnections(), 1e-9);
            assertEquals(2, result.getBridgeStatistics().maxConnections());
            assertEquals(1, result.getMetrics().bridgeEntities());
        }

        @Test
        @DisplayName("Bridge score should add 1/distance per linked query entity")
        void bridgeScoreFormula() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("X", "A", Map.of());
            graph.addEdge("X", "A", Map.of());
            graph.addEdge("X", "A", Map.of());

            double score = BridgeAnalyzer.bridgeScore(graph, "X", Map.of("A", 1, "B", 2));

            // 2 linked + 1/1 + 1/2 + 0.5 * 2 extra parallel edges to A
            assertEquals(4.5, score, 1e-9);
        }
    }

    @Nested
    @DisplayName("Pathways and metrics")
    class PathwayTests {

        @Test
        @DisplayName("Query entities without a direct connection should get a pathway")
        void pathwayThroughBridge() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B").build());

            assertEquals(1, result.getPathways().size());
            Pathway pathway = result.getPathways().get(0);
            assertEquals(List.of("A", "C", "B"), pathway.nodes());
            assertEquals(2, pathway.length());
            assertEquals(RelationKind.KINSHIP, pathway.pathType());
            assertEquals(3.0, pathway.strength(), 1e-9);
        }

        @Test
        @DisplayName("Pathway strength should reward kinship and close relations")
        void pathStrength() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            String kin = graph.addEdge("a", "b", Map.of(EdgeAttributes.TYPE, EdgeAttributes.KINSHIP,
                    EdgeAttributes.DISTANCE, 1));
            String other = graph.addEdge("b", "c", Map.of(EdgeAttributes.TYPE, "political"));
            List<GraphEdge> edges = List.of(graph.getEdge(kin).orElseThrow(), graph.getEdge(other).orElseThrow());

            // (2 + 1/2 + 1 + 1) / 2
            assertEquals(2.25, PathwayFinder.pathStrength(edges), 1e-9);
            assertEquals(0.0, PathwayFinder.pathStrength(List.of()));
        }

        @Test
        @DisplayName("Metrics should describe the discovered network")
        void metrics() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B").build());

            NetworkMetrics metrics = result.getMetrics();
            assertEquals(4, metrics.totalEntities());
            assertEquals(2, metrics.queryEntities());
            assertEquals(2, metrics.discoveredEntities());
            assertEquals(3, metrics.totalEdges());
            assertEquals(0, metrics.directConnections());
            assertEquals(1, metrics.bridgeEntities());
            assertEquals(0.5, metrics.density(), 1e-9);
            assertEquals(2.0, metrics.averagePathLength(), 1e-9);
            assertEquals(1, metrics.components());
            assertEquals(1.5, metrics.averageDegree(), 1e-9);
            assertEquals(2, metrics.kinshipEdges());
            assertEquals(1, metrics.associationEdges());
            assertEquals(3, metrics.diameter());
            assertEquals(2, metrics.radius());
            assertEquals(0.0, metrics.averageClustering(), 1e-9);
            assertEquals(Map.of(0, 2, 1, 2), metrics.distanceDistribution());
        }

        @Test
        @DisplayName("Density should stay a ratio on networks too large for int arithmetic")
        void densityOfLargeNetwork() {
            double density = NetworkMetricsCalculator.density(50_000, 10);

            assertTrue(density > 0.0);
            assertEquals(10 / (50_000.0 * 49_999.0 / 2.0), density, 1e-20);
            assertEquals(1.0, NetworkMetricsCalculator.density(65_536, 2_147_450_880), 1e-12);
        }

        @Test
        @DisplayName("Disconnected query entities should produce no pathway")
        void unreachable() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("A", "X", Map.of());
            graph.addEdge("B", "Y", Map.of());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B").build());

            assertTrue(result.getPathways().isEmpty());
            assertEquals(2, result.getMetrics().components());
            assertEquals(0.0, result.getMetrics().averagePathLength());
        }
    }

    @Nested
    @DisplayName("Entities")
    class EntityTests {

        @Test
        @DisplayName("Entities should carry per-query distances")
        void distances() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B")
                    .maxHopDistance(2)
                    .build());

            DiscoveredEntity a = result.getEntity("A").orElseThrow();
            assertTrue(a.queryEntity());
            assertEquals(0, a.distance());
            assertEquals(Map.of("A", 0, "B", 2), a.distances());

            DiscoveredEntity d = result.getEntity("D").orElseThrow();
            assertFalse(d.queryEntity());
            assertEquals(Set.of("A"), d.reachedFrom());
            assertEquals(1, d.distance());
            assertTrue(d.discoveryPath().isEmpty());
        }

        @Test
        @DisplayName("Discovery paths should lead from the nearest query entity")
        void discoveryPaths() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("A", "x", Map.of());
            graph.addEdge("x", "y", Map.of());
            graph.addEdge("B", "z", Map.of());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B")
                    .maxHopDistance(2)
                    .includeDiscoveryPaths(true)
                    .build());

            assertEquals(List.of("A", "x", "y"), result.getEntity("y").orElseThrow().discoveryPath());
            assertEquals(List.of("B", "z"), result.getEntity("z").orElseThrow().discoveryPath());
            assertEquals(List.of("A"), result.getEntity("A").orElseThrow().discoveryPath());
        }

        @Test
        @DisplayName("Relation type allow-list should limit traversal and returned edges")
        void relationTypes() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            graph.addEdge("A", "C", SampleNetworks.kinship());
            graph.addEdge("C", "B", SampleNetworks.association());

            DiscoveryResult result = service.discover(graph, DiscoveryQuery.of("A", "B")
                    .includeRelationTypes(Set.of(EdgeAttributes.KINSHIP))
                    .build());

            assertTrue(result.getBridgeEntities().isEmpty());
            assertEquals(Set.of("A"), result.getEntity("C").orElseThrow().reachedFrom());
            assertTrue(result.getEdges().stream().allMatch(GraphEdge::isKinship));
        }

        @Test
        @DisplayName("Filters should drop entities but never the query entities")
        void filters() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B")
                    .filters(DiscoveryFilters.builder().numericRange("born", null, 1100.0).build())
                    .build());

            assertEquals(Set.of("A", "B", "C"), result.getEntities().keySet());
        }

        @Test
        @DisplayName("Excluded ids should not be discovered")
        void exclude() {
            DiscoveryResult result = service.discover(sharedRelative(), DiscoveryQuery.of("A", "B")
                    .filters(DiscoveryFilters.builder().exclude("C").build())
                    .build());

            assertFalse(result.getEntities().containsKey("C"));
            assertTrue(result.getBridgeEntities().isEmpty());
            assertTrue(result.getPathways().isEmpty());
        }

        @Test
        @DisplayName("Discovery beyond the entity cap should keep query entities and the nearest others")
        void truncation() {
            Graph graph = new Graph(GraphMode.UNDIRECTED);
            for (String id : List.of("a1", "a2", "a3")) {
                graph.addEdge("A", id, Map.of());
            }
            for (String id : List.of("b1", "b2", "b3")) {
                graph.addEdge("B", id, Map.of());
            }
            graph.addEdge("a1", "far", Map.of());
            NetworkExplorationService exploration = new NetworkExplorationService(
                    ExplorationConfig.defaults().withMaxDiscoveredEntities(4));
            NetworkDiscoveryService capped = new NetworkDiscoveryService(exploration,
                    new DijkstraPathfinding(), new BreadthFirstComponents());

            DiscoveryResult result = capped.discover(graph, DiscoveryQuery.of("A", "B").maxHopDistance(2).build());

            assertTrue(result.isTruncated());
            assertEquals(List.of("A", "B", "a1", "a2"), new ArrayList<>(result.getEntities().keySet()));
            assertEquals(2, result.getEdges().size());
        }

        @Test
        @DisplayName("Results should be stable across runs")
        void deterministic() {
            Graph graph = sharedRelative();
            DiscoveryQuery query = DiscoveryQuery.of("A", "B").maxHopDistance(2).build();

            DiscoveryResult first = service.discover(graph, query);
            DiscoveryResult second = service.discover(graph, query);

            assertEquals(first.getEntities(), second.getEntities());
            assertEquals(first.getBridgeEntities(), second.getBridgeEntities());
            assertEquals(first.getMetrics(), second.getMetrics());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should require at least two distinct query entities")
        void insufficient() {
            InsufficientQueryEntitiesException ex = assertThrows(InsufficientQueryEntitiesException.class,
                    () -> service.discover(sharedRelative(), DiscoveryQuery.of("A", "A").build()));
            assertEquals(1, ex.getSuppliedCount());
            assertThrows(InsufficientQueryEntitiesException.class,
                    () -> service.discover(sharedRelative(), DiscoveryQuery.builder().build()));
        }

        @Test
        @DisplayName("Should fail for a query entity missing from the graph")
        void unknownEntity() {
            UnknownStartNodeException ex = assertThrows(UnknownStartNodeException.class,
                    () -> service.discover(sharedRelative(), DiscoveryQuery.of("A", "Z").build()));
            assertEquals("Z", ex.getNodeId());
        }

        @Test
        @DisplayName("Should reject negative bounds")
        void negativeBounds() {
            assertThrows(InvalidBoundException.class, () -> DiscoveryQuery.of("A", "B").maxHopDistance(-1));
            assertThrows(InvalidBoundException.class, () -> DiscoveryQuery.of("A", "B").maxBridgeEntities(-1));
        }
    }
}
