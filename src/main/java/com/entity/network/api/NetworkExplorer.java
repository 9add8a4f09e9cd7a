package com.entity.network.api;

import com.entity.network.algorithm.BreadthFirstComponents;
import com.entity.network.algorithm.BreadthFirstMetrics;
import com.entity.network.algorithm.CentralityMeasure;
import com.entity.network.algorithm.CommunityAlgorithm;
import com.entity.network.algorithm.CommunityStructure;
import com.entity.network.algorithm.ComponentAlgorithm;
import com.entity.network.algorithm.DijkstraPathfinding;
import com.entity.network.algorithm.LouvainCommunities;
import com.entity.network.algorithm.MetricsAlgorithm;
import com.entity.network.algorithm.PathfindingAlgorithm;
import com.entity.network.config.ExplorationConfig;
import com.entity.network.discovery.DiscoveryQuery;
import com.entity.network.discovery.DiscoveryResult;
import com.entity.network.discovery.NetworkDiscoveryService;
import com.entity.network.discovery.Pathway;
import com.entity.network.exploration.DegreeExplorationOptions;
import com.entity.network.exploration.DepthExplorationOptions;
import com.entity.network.exploration.ExplorationResult;
import com.entity.network.exploration.FilterExplorationOptions;
import com.entity.network.exploration.NetworkExplorationService;
import com.entity.network.exploration.PreFilteredExplorationOptions;
import com.entity.network.exploration.ProgressiveExplorationOptions;
import com.entity.network.exploration.SubgraphOptions;
import com.entity.network.graph.Graph;
import com.entity.network.logging.LogContext;
import com.entity.network.metrics.ExplorationMetrics;
import com.entity.network.metrics.NoOpExplorationMetrics;
import com.entity.network.tracing.NetworkSpans;
import com.entity.network.tracing.NoOpTracingService;
import com.entity.network.tracing.Span;
import com.entity.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Main entry point of the network exploration library. Every call runs inside a logging
 * context and a tracing span and is timed; failures are recorded on the span and counted
 * before being rethrown.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * NetworkExplorer explorer = NetworkExplorer.builder()
 *     .metrics(new MicrometerExplorationMetrics(registry))
 *     .build();
 *
 * Graph graph = new NetworkGraphBuilder()
 *     .relationships(relationshipsFromDatabase)
 *     .build();
 *
 * ExplorationResult around = explorer.exploreByDepth(graph,
 *     DepthExplorationOptions.builder("1762").maxDepth(2).build());
 *
 * DiscoveryResult network = explorer.discover(graph,
 *     DiscoveryQuery.of("1762", "3767").maxHopDistance(2).build());
 * </pre>
 */
public class NetworkExplorer {
    private static final Logger log = LoggerFactory.getLogger(NetworkExplorer.class);

    private final ExplorationConfig config;
    private final NetworkExplorationService explorationService;
    private final NetworkDiscoveryService discoveryService;
    private final ComponentAlgorithm componentAlgorithm;
    private final MetricsAlgorithm metricsAlgorithm;
    private final CommunityAlgorithm communityAlgorithm;
    private final ExplorationMetrics metrics;
    private final TracingService tracingService;

    private NetworkExplorer(Builder builder) {
        this.config = builder.config;
        this.componentAlgorithm = builder.componentAlgorithm;
        this.metricsAlgorithm = builder.metricsAlgorithm;
        this.communityAlgorithm = builder.communityAlgorithm;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpExplorationMetrics();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.explorationService = new NetworkExplorationService(config);
        this.discoveryService = new NetworkDiscoveryService(explorationService, builder.pathfinding,
                builder.componentAlgorithm, builder.metricsAlgorithm);

        log.info("NetworkExplorer initialized: pathfinding={}, components={}, metrics={}, communities={}, "
                        + "maxDiscoveredEntities={}",
                builder.pathfinding.getClass().getSimpleName(),
                builder.componentAlgorithm.getClass().getSimpleName(),
                builder.metricsAlgorithm.getClass().getSimpleName(),
                builder.communityAlgorithm.getClass().getSimpleName(),
                config.maxDiscoveredEntities());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExplorationConfig getConfig() {
        return config;
    }

    // ========== Exploration ==========

    /**
     * Explores around a node with the configured default depth and node cap.
     */
    public ExplorationResult exploreByDepth(Graph graph, String startNode) {
        return exploreByDepth(graph, DepthExplorationOptions.builder(startNode)
                .maxDepth(config.defaultMaxDepth())
                .maxNodes(config.defaultMaxNodes())
                .build());
    }

    public ExplorationResult exploreByDepth(Graph graph, DepthExplorationOptions options) {
        return explore("depth", options.getStartNode(),
                () -> explorationService.exploreByDepth(graph, options));
    }

    public ExplorationResult exploreByDegrees(Graph graph, DegreeExplorationOptions options) {
        return explore("degrees", options.getStartNode(),
                () -> explorationService.exploreByDegrees(graph, options));
    }

    public ExplorationResult explorePreFiltered(Graph graph, PreFilteredExplorationOptions options) {
        return explore("prefiltered", options.getStartNode(),
                () -> explorationService.explorePreFiltered(graph, options));
    }

    public ExplorationResult exploreWithFilter(Graph graph, FilterExplorationOptions options) {
        return explore("filtered", options.getStartNode(),
                () -> explorationService.exploreWithFilter(graph, options));
    }

    public ExplorationResult exploreProgressive(Graph graph, ProgressiveExplorationOptions options) {
        String operation = "progressive." + options.getStrategy().name().toLowerCase(Locale.ROOT);
        return explore(operation, options.getStartNode(),
                () -> explorationService.exploreProgressive(graph, options));
    }

    public Graph extractSubgraph(Graph graph, SubgraphOptions options) {
        String center = options.getCenterNode() != null ? options.getCenterNode() : "";
        return observe("subgraph", LogContext.forExploration(LogContext.generateCorrelationId(), "subgraph", center),
                Map.of(NetworkSpans.CENTER_NODE, center),
                () -> explorationService.extractSubgraph(graph, options),
                (subgraph, span) -> {
                    NetworkSpans.recordSize(span, subgraph.nodeCount(), subgraph.edgeCount());
                    metrics.recordNodesExplored(subgraph.nodeCount());
                });
    }

    // ========== Discovery ==========

    public DiscoveryResult discover(Graph graph, DiscoveryQuery query) {
        int count = query.getQueryEntities().size();
        return observe("discover", LogContext.forDiscovery(LogContext.generateCorrelationId(), count),
                Map.of(NetworkSpans.QUERY_ENTITIES, String.join(",", query.getQueryEntities())),
                () -> discoveryService.discover(graph, query),
                (result, span) -> {
                    span.setAttribute(NetworkSpans.NODES, result.getEntities().size());
                    span.setAttribute(NetworkSpans.DIRECT_CONNECTIONS, result.getDirectConnections().size());
                    span.setAttribute(NetworkSpans.BRIDGES, result.getBridgeEntities().size());
                    span.setAttribute(NetworkSpans.PATHWAYS, result.getPathways().size());
                    NetworkSpans.recordTruncation(span, result.isTruncated());
                    metrics.recordNodesExplored(result.getEntities().size());
                    metrics.recordBridges(result.getBridgeStatistics().total());
                    metrics.recordPathways(result.getPathways().size());
                    if (result.isTruncated()) {
                        metrics.incrementTruncated("discover");
                    }
                    log.debug("Discovery done: entities={} bridges={} pathways={} in {}ms",
                            result.getEntities().size(), result.getBridgeEntities().size(),
                            result.getPathways().size(), result.getQueryTime().toMillis());
                });
    }

    /**
     * Finds the shortest pathway between two entities, preferring kinship relations.
     */
    public Optional<Pathway> findPathway(Graph graph, String from, String to) {
        return discoveryService.getPathwayFinder().findShortestPathway(graph, from, to);
    }

    /**
     * Lists every simple pathway of at most {@code maxLength} hops between two entities.
     */
    public List<Pathway> findAllPathways(Graph graph, String from, String to, int maxLength) {
        return discoveryService.getPathwayFinder().findAllPathways(graph, from, to, maxLength);
    }

    public List<Set<String>> components(Graph graph) {
        return componentAlgorithm.components(graph);
    }

    // ========== Structure ==========

    /**
     * Scores every node of the graph with the given centrality measure.
     */
    public Map<String, Double> centrality(Graph graph, CentralityMeasure measure) {
        return metricsAlgorithm.centrality(graph, measure);
    }

    public Map<String, Double> clusteringCoefficients(Graph graph) {
        return metricsAlgorithm.clusteringCoefficients(graph);
    }

    public int diameter(Graph graph) {
        return metricsAlgorithm.diameter(graph);
    }

    /**
     * Partitions the graph into communities with the configured algorithm.
     */
    public CommunityStructure detectCommunities(Graph graph) {
        Map<String, String> attributes = Map.of(NetworkSpans.NODES, String.valueOf(graph.nodeCount()));
        return observe("communities",
                LogContext.forExploration(LogContext.generateCorrelationId(), "communities", ""),
                attributes,
                () -> communityAlgorithm.detect(graph),
                (structure, span) -> {
                    span.setAttribute(NetworkSpans.COMMUNITIES, structure.count());
                    span.setAttribute(NetworkSpans.COMMUNITY_BRIDGES, structure.getBridges().size());
                    span.setAttribute(NetworkSpans.MODULARITY, structure.getModularity());
                    log.debug("Detected {} communities, modularity={}", structure.count(), structure.getModularity());
                });
    }

    // ========== Observation ==========

    private ExplorationResult explore(String operation, String startNode, Supplier<ExplorationResult> call) {
        return observe(operation, LogContext.forExploration(LogContext.generateCorrelationId(), operation, startNode),
                Map.of(NetworkSpans.START_NODE, startNode),
                call,
                (result, span) -> {
                    NetworkSpans.recordSize(span, result.size(), result.getEdges().size());
                    span.setAttribute(NetworkSpans.MAX_DEPTH, result.getStatistics().maxDepthReached());
                    NetworkSpans.recordTruncation(span, result.isTruncated());
                    metrics.recordNodesExplored(result.size());
                    if (result.isTruncated()) {
                        metrics.incrementTruncated(operation);
                    }
                    log.debug("Exploration done: nodes={} edges={} truncated={}",
                            result.size(), result.getEdges().size(), result.isTruncated());
                });
    }

    private <T> T observe(String operation, LogContext context, Map<String, String> attributes,
                          Supplier<T> call, ResultRecorder<T> recorder) {
        long start = System.nanoTime();
        try (LogContext ctx = context;
             Span span = tracingService.startSpan(NetworkSpans.name(operation), attributes)) {
            try {
                T result = call.get();
                recorder.record(result, span);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                NetworkSpans.recordFailure(span, e);
                metrics.incrementFailure(operation, e);
                log.debug("{} failed: {}", operation, e.getMessage());
                throw e;
            } finally {
                metrics.recordDuration(operation, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    @FunctionalInterface
    private interface ResultRecorder<T> {
        void record(T result, Span span);
    }

    // ========== Builder ==========

    public static class Builder {
        private ExplorationConfig config = ExplorationConfig.defaults();
        private PathfindingAlgorithm pathfinding = new DijkstraPathfinding();
        private ComponentAlgorithm componentAlgorithm = new BreadthFirstComponents();
        private MetricsAlgorithm metricsAlgorithm = new BreadthFirstMetrics();
        private CommunityAlgorithm communityAlgorithm = new LouvainCommunities();
        private ExplorationMetrics metrics;
        private TracingService tracingService;

        /**
         * Sets engine-wide limits.
         */
        public Builder config(ExplorationConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the pathfinding implementation used for pathways.
         */
        public Builder pathfinding(PathfindingAlgorithm pathfinding) {
            this.pathfinding = pathfinding;
            return this;
        }

        /**
         * Sets the connected-component implementation used for network metrics.
         */
        public Builder componentAlgorithm(ComponentAlgorithm componentAlgorithm) {
            this.componentAlgorithm = componentAlgorithm;
            return this;
        }

        /**
         * Sets the implementation behind centrality, clustering and diameter figures.
         */
        public Builder metricsAlgorithm(MetricsAlgorithm metricsAlgorithm) {
            this.metricsAlgorithm = metricsAlgorithm;
            return this;
        }

        public Builder communityAlgorithm(CommunityAlgorithm communityAlgorithm) {
            this.communityAlgorithm = communityAlgorithm;
            return this;
        }

        public Builder metrics(ExplorationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public NetworkExplorer build() {
            if (config == null) {
                throw new IllegalStateException("Exploration config is required");
            }
            if (pathfinding == null || componentAlgorithm == null) {
                throw new IllegalStateException("Pathfinding and component algorithms are required");
            }
            if (metricsAlgorithm == null || communityAlgorithm == null) {
                throw new IllegalStateException("Metrics and community algorithms are required");
            }
            return new NetworkExplorer(this);
        }
    }
}
