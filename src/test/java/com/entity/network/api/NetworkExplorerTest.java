package com.entity.network.api;

import com.entity.network.SampleNetworks;
import com.entity.network.algorithm.CentralityMeasure;
import com.entity.network.algorithm.CommunityStructure;
import com.entity.network.algorithm.LabelPropagationCommunities;
import com.entity.network.algorithm.LayeredBfsPathfinding;
import com.entity.network.algorithm.SampledMetrics;
import com.entity.network.algorithm.UnionFindComponents;
import com.entity.network.config.ExplorationConfig;
import com.entity.network.discovery.DiscoveryQuery;
import com.entity.network.discovery.DiscoveryResult;
import com.entity.network.discovery.Pathway;
import com.entity.network.exploration.DegreeExplorationOptions;
import com.entity.network.exploration.DepthExplorationOptions;
import com.entity.network.exploration.ExplorationResult;
import com.entity.network.exploration.ExplorationStrategy;
import com.entity.network.exploration.ProgressiveExplorationOptions;
import com.entity.network.exploration.SubgraphOptions;
import com.entity.network.exploration.UnknownStartNodeException;
import com.entity.network.graph.Graph;
import com.entity.network.logging.LogContext;
import com.entity.network.metrics.MicrometerExplorationMetrics;
import com.entity.network.tracing.Span;
import com.entity.network.tracing.TracingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("NetworkExplorer Tests")
class NetworkExplorerTest {

    private Graph tree;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        tree = SampleNetworks.familyTree();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    private NetworkExplorer explorer() {
        return NetworkExplorer.builder()
                .metrics(new MicrometerExplorationMetrics(registry))
                .build();
    }

    @Nested
    @DisplayName("Delegation")
    class DelegationTests {

        @Test
        @DisplayName("Default builder should explore with the configured defaults")
        void defaults() {
            NetworkExplorer explorer = NetworkExplorer.builder()
                    .config(new ExplorationConfig(5_000, 10, 1, 1_000))
                    .build();

            ExplorationResult result = explorer.exploreByDepth(tree, "1");

            assertEquals(Set.of("1", "2", "3", "4"), result.getNodeIds());
        }

        @Test
        @DisplayName("Should run every exploration flavour")
        void explorations() {
            NetworkExplorer explorer = explorer();

            assertEquals(7, explorer.exploreByDegrees(tree,
                    DegreeExplorationOptions.builder("1", 2).relationTypes(Set.of("kinship")).build()).size());
            assertEquals(4, explorer.exploreProgressive(tree,
                    ProgressiveExplorationOptions.builder("1", ExplorationStrategy.BREADTH).maxNodes(4).build()).size());
            Graph subgraph = explorer.extractSubgraph(tree, SubgraphOptions.builder().around("4", 1).build());
            assertEquals(4, subgraph.nodeCount());
        }

        @Test
        @DisplayName("Should discover and find pathways with the chosen algorithms")
        void discoveryAndPathways() {
            NetworkExplorer explorer = NetworkExplorer.builder()
                    .pathfinding(new LayeredBfsPathfinding())
                    .componentAlgorithm(new UnionFindComponents())
                    .build();

            DiscoveryResult result = explorer.discover(tree, DiscoveryQuery.of("2", "3").build());
            Optional<Pathway> pathway = explorer.findPathway(tree, "5", "10");
            List<Pathway> all = explorer.findAllPathways(tree, "5", "7", 4);

            assertEquals(1, result.getBridgeStatistics().total());
            assertEquals(List.of("5", "2", "1", "4", "10"), pathway.orElseThrow().nodes());
            assertEquals(1, all.size());
            assertEquals(1, explorer.components(tree).size());
        }

        @Test
        @DisplayName("Should measure structure with the chosen algorithms")
        void structure() {
            NetworkExplorer explorer = NetworkExplorer.builder()
                    .metricsAlgorithm(new SampledMetrics())
                    .communityAlgorithm(new LabelPropagationCommunities())
                    .build();

            Map<String, Double> betweenness = explorer.centrality(tree, CentralityMeasure.BETWEENNESS);

            assertEquals(27.0, betweenness.get("1"), 1e-9);
            assertEquals(15.0, betweenness.get("2"), 1e-9);
            assertEquals(4, explorer.diameter(tree));
            assertEquals(0.0, explorer.clusteringCoefficients(tree).get("1"));
            assertEquals(10, explorer.detectCommunities(tree).getMembership().size());
        }

        @Test
        @DisplayName("Builder should reject missing algorithms")
        void builderValidation() {
            assertThrows(IllegalStateException.class, () -> NetworkExplorer.builder().config(null).build());
            assertThrows(IllegalStateException.class, () -> NetworkExplorer.builder().pathfinding(null).build());
            assertThrows(IllegalStateException.class, () -> NetworkExplorer.builder().metricsAlgorithm(null).build());
            assertThrows(IllegalStateException.class, () -> NetworkExplorer.builder().communityAlgorithm(null).build());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should time each call by operation")
        void timesCalls() {
            NetworkExplorer explorer = explorer();

            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("1").maxDepth(1).build());
            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("2").maxDepth(1).build());
            explorer.discover(tree, DiscoveryQuery.of("2", "3").build());

            Timer depth = registry.find("network.exploration.duration").tag("operation", "depth").timer();
            Timer discover = registry.find("network.exploration.duration").tag("operation", "discover").timer();
            assertNotNull(depth);
            assertEquals(2, depth.count());
            assertNotNull(discover);
            assertEquals(1, discover.count());
            assertEquals(3, registry.find("network.exploration.nodes").summary().count());
        }

        @Test
        @DisplayName("Should count truncated results")
        void countsTruncation() {
            NetworkExplorer explorer = explorer();

            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("1").maxDepth(2).maxNodes(3).build());

            Counter truncated = registry.find("network.exploration.truncated").tag("operation", "depth").counter();
            assertNotNull(truncated);
            assertEquals(1.0, truncated.count());
        }

        @Test
        @DisplayName("Should count failures by error type and rethrow")
        void countsFailures() {
            NetworkExplorer explorer = explorer();

            assertThrows(UnknownStartNodeException.class, () ->
                    explorer.exploreByDepth(tree, DepthExplorationOptions.builder("42").build()));

            Counter failures = registry.find("network.exploration.failures")
                    .tag("operation", "depth")
                    .tag("error", "UnknownStartNodeException")
                    .counter();
            assertNotNull(failures);
            assertEquals(1.0, failures.count());
            assertEquals(1, registry.find("network.exploration.duration").tag("operation", "depth").timer().count());
        }
    }

    @Nested
    @DisplayName("Tracing and logging context")
    class ObservationTests {

        private TracingService tracing;
        private Span span;

        @BeforeEach
        void mockTracing() {
            tracing = mock(TracingService.class);
            span = mock(Span.class);
            when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);
        }

        @Test
        @DisplayName("Successful calls should close an OK span named after the operation")
        void successSpan() {
            NetworkExplorer explorer = NetworkExplorer.builder().tracingService(tracing).build();

            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("1").maxDepth(1).build());

            verify(tracing).startSpan(eq("network.depth"), eq(Map.of("network.start_node", "1")));
            verify(span).setAttribute("network.nodes", 4L);
            verify(span).setStatus(Span.SpanStatus.OK);
            verify(span, never()).addEvent("truncated");
            verify(span).close();
        }

        @Test
        @DisplayName("Truncated results should be marked on the span")
        void truncatedSpanEvent() {
            NetworkExplorer explorer = NetworkExplorer.builder().tracingService(tracing).build();

            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("1").maxDepth(2).maxNodes(3).build());

            verify(span).setAttribute("network.truncated", true);
            verify(span).addEvent("truncated");
        }

        @Test
        @DisplayName("Failed calls should record the exception on the span")
        void failureSpan() {
            NetworkExplorer explorer = NetworkExplorer.builder().tracingService(tracing).build();

            assertThrows(UnknownStartNodeException.class, () ->
                    explorer.exploreByDepth(tree, DepthExplorationOptions.builder("42").build()));

            verify(span).recordException(any(UnknownStartNodeException.class));
            verify(span).setStatus(Span.SpanStatus.ERROR);
            verify(span, never()).setStatus(Span.SpanStatus.OK);
            verify(span).close();
        }

        @Test
        @DisplayName("Community detection should be traced with the community count")
        void communitySpan() {
            NetworkExplorer explorer = NetworkExplorer.builder().tracingService(tracing).build();

            CommunityStructure structure = explorer.detectCommunities(tree);

            verify(tracing).startSpan(eq("network.communities"), eq(Map.of("network.nodes", "10")));
            verify(span).setAttribute("network.communities", (long) structure.count());
            verify(span).setAttribute("network.modularity", structure.getModularity());
            verify(span).setStatus(Span.SpanStatus.OK);
            assertEquals(10, structure.getMembership().size());
        }

        @Test
        @DisplayName("Progressive calls should be named after the strategy")
        void progressiveSpanName() {
            NetworkExplorer explorer = NetworkExplorer.builder().tracingService(tracing).build();

            explorer.exploreProgressive(tree,
                    ProgressiveExplorationOptions.builder("1", ExplorationStrategy.RANDOM_WALK).seed(7L).build());

            verify(tracing).startSpan(eq("network.progressive.random_walk"), anyMap());
        }

        @Test
        @DisplayName("MDC should carry the call context during the call and be cleared after")
        void mdcDuringCall() {
            NetworkExplorer explorer = explorer();
            List<String> seen = new ArrayList<>();

            explorer.exploreByDepth(tree, DepthExplorationOptions.builder("1")
                    .maxDepth(1)
                    .nodeFilter((nodeId, attributes) -> {
                        seen.add(MDC.get(LogContext.OPERATION) + "@" + MDC.get(LogContext.START_NODE));
                        return true;
                    })
                    .build());

            assertFalse(seen.isEmpty());
            assertTrue(seen.stream().allMatch("depth@1"::equals));
            assertNull(MDC.get(LogContext.CORRELATION_ID));
            assertNull(MDC.get(LogContext.OPERATION));
        }

        @Test
        @DisplayName("MDC should be cleared after a failed call")
        void mdcClearedAfterFailure() {
            NetworkExplorer explorer = explorer();

            assertThrows(UnknownStartNodeException.class, () ->
                    explorer.exploreByDepth(tree, DepthExplorationOptions.builder("42").build()));

            assertNull(MDC.get(LogContext.CORRELATION_ID));
            assertNull(MDC.get(LogContext.START_NODE));
        }
    }
}
