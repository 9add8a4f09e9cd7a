package com.entity.network.algorithm;

import com.entity.network.SampleNetworks;
import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathfindingAlgorithm Tests")
class PathfindingAlgorithmTest {

    static Stream<Arguments> implementations() {
        return Stream.of(
                Arguments.of(new DijkstraPathfinding()),
                Arguments.of(new LayeredBfsPathfinding()));
    }

    /**
     * Two routes of two hops from a to d: through c over associations (added first) and
     * through b over kinship.
     */
    private static Graph diamond() {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdgeWithKey("a-c", "a", "c", SampleNetworks.association());
        graph.addEdgeWithKey("c-d", "c", "d", SampleNetworks.association());
        graph.addEdgeWithKey("a-b", "a", "b", SampleNetworks.kinship());
        graph.addEdgeWithKey("b-d", "b", "d", SampleNetworks.kinship());
        return graph;
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Should prefer the route made of the preferred relation type")
    void prefersKinship(PathfindingAlgorithm algorithm) {
        GraphPath path = algorithm.shortestPath(diamond(), "a", "d", EdgeAttributes.KINSHIP).orElseThrow();

        assertEquals(List.of("a", "b", "d"), path.nodes());
        assertEquals(2, path.length());
        assertEquals(0, path.countOtherThan(EdgeAttributes.KINSHIP));
        assertEquals("a", path.source());
        assertEquals("d", path.target());
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Fewer hops should win over the preferred relation type")
    void hopsFirst(PathfindingAlgorithm algorithm) {
        Graph graph = diamond();
        graph.addEdgeWithKey("a-d", "a", "d", SampleNetworks.association());

        GraphPath path = algorithm.shortestPath(graph, "a", "d", EdgeAttributes.KINSHIP).orElseThrow();

        assertEquals(List.of("a", "d"), path.nodes());
        assertEquals(1, path.countOtherThan(EdgeAttributes.KINSHIP));
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Both implementations should agree on length and penalty over the family tree")
    void agreeOnTree(PathfindingAlgorithm algorithm) {
        Graph tree = SampleNetworks.familyTree();
        DijkstraPathfinding reference = new DijkstraPathfinding();

        for (String source : tree.nodes()) {
            for (String target : tree.nodes()) {
                Optional<GraphPath> expected = reference.shortestPath(tree, source, target, EdgeAttributes.KINSHIP);
                Optional<GraphPath> actual = algorithm.shortestPath(tree, source, target, EdgeAttributes.KINSHIP);
                assertEquals(expected.isPresent(), actual.isPresent());
                assertEquals(expected.orElseThrow().length(), actual.orElseThrow().length());
                assertEquals(expected.orElseThrow().countOtherThan(EdgeAttributes.KINSHIP),
                        actual.orElseThrow().countOtherThan(EdgeAttributes.KINSHIP));
            }
        }
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Should return empty for unknown or disconnected nodes")
    void noPath(PathfindingAlgorithm algorithm) {
        Graph graph = diamond();
        graph.addNode("island");

        assertTrue(algorithm.shortestPath(graph, "a", "island", null).isEmpty());
        assertTrue(algorithm.shortestPath(graph, "a", "missing", null).isEmpty());
        assertTrue(algorithm.shortestPath(graph, "missing", "a", null).isEmpty());
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Should enumerate every simple path within the hop limit, shortest first")
    void allPaths(PathfindingAlgorithm algorithm) {
        Graph graph = diamond();
        graph.addEdgeWithKey("a-d", "a", "d", SampleNetworks.association());

        List<GraphPath> paths = algorithm.allPaths(graph, "a", "d", 2);
        List<GraphPath> direct = algorithm.allPaths(graph, "a", "d", 1);

        assertEquals(3, paths.size());
        assertEquals(1, paths.get(0).length());
        assertEquals(2, paths.get(2).length());
        assertEquals(1, direct.size());
        assertTrue(algorithm.allPaths(graph, "a", "a", 3).isEmpty());
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("A path from a node to itself should have no edges")
    void selfPath(PathfindingAlgorithm algorithm) {
        GraphPath path = algorithm.shortestPath(diamond(), "a", "a", null).orElseThrow();

        assertEquals(List.of("a"), path.nodes());
        assertEquals(0, path.length());
    }
}
