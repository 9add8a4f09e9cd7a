package com.entity.network.algorithm;

import com.entity.network.SampleNetworks;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsAlgorithm Tests")
class MetricsAlgorithmTest {

    static Stream<Arguments> implementations() {
        return Stream.of(
                Arguments.of(new BreadthFirstMetrics()),
                Arguments.of(new SampledMetrics()));
    }

    private static Graph path() {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdge("a", "b", Map.of());
        graph.addEdge("b", "c", Map.of());
        graph.addEdge("c", "d", Map.of());
        graph.addEdge("d", "e", Map.of());
        return graph;
    }

    private static Graph star() {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdge("hub", "x", Map.of());
        graph.addEdge("hub", "y", Map.of());
        graph.addEdge("hub", "z", Map.of());
        return graph;
    }

    /**
     * A triangle t1-t2-t3 with a pendant p hanging off t3.
     */
    private static Graph triangleWithPendant() {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdge("t1", "t2", Map.of());
        graph.addEdge("t2", "t3", Map.of());
        graph.addEdge("t1", "t3", Map.of());
        graph.addEdge("t3", "p", Map.of());
        return graph;
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Diameter, radius and average path length of a path graph")
    void pathMeasures(MetricsAlgorithm algorithm) {
        Graph graph = path();

        assertEquals(4, algorithm.diameter(graph));
        assertEquals(2, algorithm.radius(graph));
        assertEquals(2.0, algorithm.averagePathLength(graph), 1e-9);
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Betweenness should count each pair routed through a node once")
    void betweenness(MetricsAlgorithm algorithm) {
        Map<String, Double> scores = algorithm.centrality(path(), CentralityMeasure.BETWEENNESS);

        assertEquals(List.of("a", "b", "c", "d", "e"), List.copyOf(scores.keySet()));
        assertEquals(0.0, scores.get("a"), 1e-9);
        assertEquals(3.0, scores.get("b"), 1e-9);
        assertEquals(4.0, scores.get("c"), 1e-9);
        assertEquals(3.0, scores.get("d"), 1e-9);
        assertEquals(3.0, algorithm.centrality(star(), CentralityMeasure.BETWEENNESS).get("hub"), 1e-9);
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Closeness and degree centrality of a path graph")
    void closenessAndDegree(MetricsAlgorithm algorithm) {
        Map<String, Double> closeness = algorithm.centrality(path(), CentralityMeasure.CLOSENESS);
        Map<String, Double> degree = algorithm.centrality(path(), CentralityMeasure.DEGREE);

        assertEquals(4.0 / 6.0, closeness.get("c"), 1e-9);
        assertEquals(0.4, closeness.get("a"), 1e-9);
        assertEquals(0.5, degree.get("b"), 1e-9);
        assertEquals(0.25, degree.get("a"), 1e-9);
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Eigenvector centrality should favour the hub of a star")
    void eigenvector(MetricsAlgorithm algorithm) {
        Map<String, Double> scores = algorithm.centrality(star(), CentralityMeasure.EIGENVECTOR);

        assertEquals(Math.sqrt(0.5), scores.get("hub"), 1e-4);
        assertEquals(1.0 / Math.sqrt(6.0), scores.get("x"), 1e-4);
        assertEquals(scores.get("x"), scores.get("z"), 1e-9);
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Local and average clustering of a triangle with a pendant")
    void clustering(MetricsAlgorithm algorithm) {
        Graph graph = triangleWithPendant();
        Map<String, Double> coefficients = algorithm.clusteringCoefficients(graph);

        assertEquals(1.0, coefficients.get("t1"), 1e-9);
        assertEquals(1.0 / 3.0, coefficients.get("t3"), 1e-9);
        assertEquals(0.0, coefficients.get("p"), 1e-9);
        assertEquals(7.0 / 12.0, algorithm.averageClustering(graph), 1e-9);
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Degree distribution and high-degree nodes")
    void degreeDistribution(MetricsAlgorithm algorithm) {
        Graph graph = triangleWithPendant();

        assertEquals(Map.of(1, 1, 2, 2, 3, 1), algorithm.degreeDistribution(graph));
        assertEquals(List.of("t3", "t1"), algorithm.highDegreeNodes(graph, 2));
        assertEquals(4, algorithm.highDegreeNodes(graph, 10).size());
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Parallel relations should count as a single link")
    void parallelEdges(MetricsAlgorithm algorithm) {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdge("a", "b", SampleNetworks.kinship());
        graph.addEdge("a", "b", SampleNetworks.association());

        assertEquals(1.0, algorithm.centrality(graph, CentralityMeasure.DEGREE).get("a"), 1e-9);
        assertEquals(Map.of(1, 2), algorithm.degreeDistribution(graph));
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("Isolated nodes should have eccentricity 0 and closeness 0")
    void disconnected(MetricsAlgorithm algorithm) {
        Graph graph = new Graph(GraphMode.UNDIRECTED);
        graph.addEdge("a", "b", Map.of());
        graph.addNode("solo");

        assertEquals(1, algorithm.diameter(graph));
        assertEquals(0, algorithm.radius(graph));
        assertEquals(1.0, algorithm.averagePathLength(graph), 1e-9);
        assertEquals(0.0, algorithm.centrality(graph, CentralityMeasure.CLOSENESS).get("solo"));
    }

    @ParameterizedTest
    @MethodSource("implementations")
    @DisplayName("An empty graph should measure zero everywhere")
    void emptyGraph(MetricsAlgorithm algorithm) {
        Graph graph = new Graph();

        assertEquals(0, algorithm.diameter(graph));
        assertEquals(0, algorithm.radius(graph));
        assertEquals(0.0, algorithm.averagePathLength(graph));
        assertEquals(0.0, algorithm.averageClustering(graph));
        assertTrue(algorithm.centrality(graph, CentralityMeasure.EIGENVECTOR).isEmpty());
    }

    @Nested
    @DisplayName("Sampling")
    class SamplingTests {

        @Test
        @DisplayName("A single strided source should bound the radius from above")
        void radiusUpperBound() {
            SampledMetrics sampled = new SampledMetrics(1);

            assertEquals(4, sampled.radius(path()));
            assertEquals(2, new BreadthFirstMetrics().radius(path()));
        }

        @Test
        @DisplayName("Betweenness should be scaled up to the full node count")
        void scaledBetweenness() {
            Map<String, Double> scores = new SampledMetrics(2).centrality(path(), CentralityMeasure.BETWEENNESS);

            // Sources a and c; raw dependencies b=4, c=2, d=2, scaled by 5 / 2 / 2
            assertEquals(5.0, scores.get("b"), 1e-9);
            assertEquals(2.5, scores.get("c"), 1e-9);
            assertEquals(2.5, scores.get("d"), 1e-9);
        }

        @Test
        @DisplayName("Should reject a non-positive sample size")
        void rejectsSampleSize() {
            assertThrows(IllegalArgumentException.class, () -> new SampledMetrics(0));
            assertEquals(SampledMetrics.DEFAULT_SAMPLE_SIZE, new SampledMetrics().getSampleSize());
        }
    }
}
