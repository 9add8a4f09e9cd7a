package com.entity.network.exploration;

import com.entity.network.config.ExplorationConfig;
import com.entity.network.graph.Graph;
import com.entity.network.graph.GraphEdge;
import com.entity.network.graph.TraversalDirection;
import com.entity.network.graph.VisitDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded traversals over a {@link Graph}: depth-limited breadth-first exploration with
 * pluggable filters, social-distance exploration, progressive exploration and subgraph
 * extraction. Stateless; the graph is read and never retained.
 */
public class NetworkExplorationService {
    private static final Logger log = LoggerFactory.getLogger(NetworkExplorationService.class);

    private final ExplorationConfig config;

    public NetworkExplorationService() {
        this(ExplorationConfig.defaults());
    }

    public NetworkExplorationService(ExplorationConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public ExplorationConfig getConfig() {
        return config;
    }

    // ========== Depth-bounded exploration ==========

    /**
     * Breadth-first exploration from the start node up to {@code maxDepth} hops.
     * Each candidate node and edge is tested once, on first encounter. The start node is always
     * part of the result; filters and early termination only apply to the nodes it leads to.
     *
     * @throws UnknownStartNodeException if the start node is not in the graph
     */
    public ExplorationResult exploreByDepth(Graph graph, DepthExplorationOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");
        requireNode(graph, options.getStartNode());

        Traversal traversal = traverse(graph, options.getStartNode(), options.getMaxDepth(),
                options.getMaxNodes(), options.getNodeFilter(), options.getEdgeFilter(),
                options.getEarlyTermination(), options.getDirection());

        List<GraphEdge> edges = options.isIncludeEdges()
                ? collectEdges(graph, traversal.explored().keySet(), options.getEdgeFilter())
                : List.of();
        log.debug("Explored {} nodes from '{}' (maxDepth={}, truncated={})",
                traversal.explored().size(), options.getStartNode(), options.getMaxDepth(), traversal.truncated());
        return ExplorationResult.of(options.getStartNode(), traversal.explored().values(), edges, traversal.truncated());
    }

    /**
     * Social-distance exploration: nodes within {@code degrees} hops over relationships of the
     * allowed types whose weight meets the threshold. With {@code bidirectionalOnly}, a reached
     * node is kept only if it has both an outgoing and an incoming edge to another reached node.
     */
    public ExplorationResult exploreByDegrees(Graph graph, DegreeExplorationOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");
        requireNode(graph, options.getStartNode());

        EdgeFilter edgeFilter = options.toEdgeFilter();
        Traversal traversal = traverse(graph, options.getStartNode(), options.getDegrees(),
                options.getMaxNodes(), null, edgeFilter, null, TraversalDirection.ALL);

        Map<String, ExploredNode> kept = traversal.explored();
        if (options.isBidirectionalOnly()) {
            kept = keepBidirectional(graph, kept, options.getStartNode(), edgeFilter);
        }
        List<GraphEdge> edges = collectEdges(graph, kept.keySet(), edgeFilter);
        return ExplorationResult.of(options.getStartNode(), kept.values(), edges, traversal.truncated());
    }

    /**
     * Same contract as {@link #exploreByDepth} over a graph that already holds only the edges to
     * follow, running on the graph's native breadth-first primitive. Given a graph produced by
     * {@link Graph#filterEdges} with the same predicate, both methods reach the same nodes and edges.
     */
    public ExplorationResult explorePreFiltered(Graph graph, PreFilteredExplorationOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");
        String start = options.getStartNode();
        requireNode(graph, start);

        NodeFilter nodeFilter = options.getNodeFilter();
        EarlyTermination earlyTermination = options.getEarlyTermination();
        int maxNodes = options.getMaxNodes();
        Map<String, Integer> depths = new LinkedHashMap<>();
        Map<String, Map<String, Object>> attributes = new HashMap<>();
        boolean[] truncated = {false};

        graph.breadthFirst(start, options.getDirection(), options.getMaxDepth(), (nodeId, attrs, depth) -> {
            if (depth == 0) {
                depths.put(nodeId, 0);
                attributes.put(nodeId, attrs);
                return VisitDecision.CONTINUE;
            }
            if (depths.size() >= maxNodes) {
                truncated[0] = true;
                return VisitDecision.STOP;
            }
            if (nodeFilter != null && !nodeFilter.test(nodeId, attrs)) {
                return VisitDecision.SKIP;
            }
            if (earlyTermination != null && earlyTermination.shouldStop(nodeId, depth)) {
                return VisitDecision.STOP;
            }
            depths.put(nodeId, depth);
            attributes.put(nodeId, attrs);
            return VisitDecision.CONTINUE;
        });

        Map<String, String> parents = breadthFirstParents(graph, depths, options.getDirection());
        List<ExploredNode> nodes = new ArrayList<>(depths.size());
        depths.forEach((nodeId, depth) ->
                nodes.add(new ExploredNode(nodeId, depth, parents.get(nodeId), attributes.get(nodeId))));

        List<GraphEdge> edges = options.isIncludeEdges()
                ? collectEdges(graph, depths.keySet(), null)
                : List.of();
        return ExplorationResult.of(start, nodes, edges, truncated[0]);
    }

    /**
     * Breadth- or depth-first exploration pruned by a depth-aware filter. A rejected node is
     * neither included nor expanded. For depth-first traversal, depth is the depth in the
     * depth-first tree. The optional edge filter only selects which collected edges are returned.
     */
    public ExplorationResult exploreWithFilter(Graph graph, FilterExplorationOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");
        String start = options.getStartNode();
        requireNode(graph, start);

        DepthAwareNodeFilter filter = options.getNodeFilter();
        int maxDepth = options.getMaxDepth();
        Map<String, ExploredNode> explored = new LinkedHashMap<>();

        if (options.getStrategy() == ExplorationStrategy.DEPTH) {
            Map<Integer, String> lastAtDepth = new HashMap<>();
            graph.depthFirst(start, TraversalDirection.ALL, (nodeId, attrs, depth) -> {
                if (depth > 0 && (depth > maxDepth || !filter.test(nodeId, attrs, depth))) {
                    return VisitDecision.SKIP;
                }
                explored.put(nodeId, new ExploredNode(nodeId, depth, lastAtDepth.get(depth - 1), attrs));
                lastAtDepth.put(depth, nodeId);
                return VisitDecision.CONTINUE;
            });
        } else {
            Map<String, Integer> depths = new LinkedHashMap<>();
            Map<String, Map<String, Object>> attributes = new HashMap<>();
            graph.breadthFirst(start, TraversalDirection.ALL, maxDepth, (nodeId, attrs, depth) -> {
                if (depth > 0 && !filter.test(nodeId, attrs, depth)) {
                    return VisitDecision.SKIP;
                }
                depths.put(nodeId, depth);
                attributes.put(nodeId, attrs);
                return VisitDecision.CONTINUE;
            });
            Map<String, String> parents = breadthFirstParents(graph, depths, TraversalDirection.ALL);
            depths.forEach((nodeId, depth) ->
                    explored.put(nodeId, new ExploredNode(nodeId, depth, parents.get(nodeId), attributes.get(nodeId))));
        }

        List<GraphEdge> edges = collectEdges(graph, explored.keySet(), options.getEdgeFilter());
        return ExplorationResult.of(start, explored.values(), edges, false);
    }

    // ========== Progressive exploration ==========

    /**
     * Grows the explored set node by node with the chosen strategy until {@code maxNodes}
     * distinct nodes (or, for random walks, visit events) are reached.
     */
    public ExplorationResult exploreProgressive(Graph graph, ProgressiveExplorationOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");
        requireNode(graph, options.getStartNode());

        return switch (options.getStrategy()) {
            case BREADTH -> exploreByDepth(graph, DepthExplorationOptions.builder(options.getStartNode())
                    .maxDepth(config.progressiveDepthLimit())
                    .maxNodes(options.getMaxNodes())
                    .build());
            case DEPTH -> exploreDepthFirst(graph, options.getStartNode(), options.getMaxNodes());
            case BEST_FIRST -> new BestFirstExplorer(graph, options.getScoring(), options.getMaxNodes())
                    .explore(options.getStartNode());
            case RANDOM_WALK -> new RandomWalkExplorer(graph, options).walk();
        };
    }

    private ExplorationResult exploreDepthFirst(Graph graph, String start, int maxNodes) {
        Map<String, ExploredNode> explored = new LinkedHashMap<>();
        Map<Integer, String> lastAtDepth = new HashMap<>();
        boolean[] truncated = {false};

        graph.depthFirst(start, TraversalDirection.ALL, (nodeId, attrs, depth) -> {
            if (explored.size() >= maxNodes) {
                truncated[0] = true;
                return VisitDecision.STOP;
            }
            explored.put(nodeId, new ExploredNode(nodeId, depth, lastAtDepth.get(depth - 1), attrs));
            lastAtDepth.put(depth, nodeId);
            return VisitDecision.CONTINUE;
        });

        List<GraphEdge> edges = collectEdges(graph, explored.keySet(), null);
        return ExplorationResult.of(start, explored.values(), edges, truncated[0]);
    }

    // ========== Subgraph extraction ==========

    /**
     * Extracts an induced subgraph. Node-selecting criteria intersect; degree bounds are
     * measured on the full graph; the edge-type allow-list is applied last. With no criteria
     * the result is a copy of the whole graph.
     *
     * @throws UnknownStartNodeException if a center node is given but absent from the graph
     */
    public Graph extractSubgraph(Graph graph, SubgraphOptions options) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(options, "options are required");

        Set<String> selected = new LinkedHashSet<>(graph.nodes());
        if (options.getNodes() != null) {
            selected.retainAll(options.getNodes());
        }
        if (options.getCenterNode() != null) {
            requireNode(graph, options.getCenterNode());
            int radius = options.getRadius() != null ? options.getRadius() : 0;
            Set<String> around = new HashSet<>();
            graph.breadthFirst(options.getCenterNode(), TraversalDirection.ALL, radius, (nodeId, attrs, depth) -> {
                around.add(nodeId);
                return VisitDecision.CONTINUE;
            });
            selected.retainAll(around);
        }
        if (options.getMinDegree() != null) {
            int min = options.getMinDegree();
            selected.removeIf(nodeId -> graph.degree(nodeId) < min);
        }
        if (options.getMaxDegree() != null) {
            int max = options.getMaxDegree();
            selected.removeIf(nodeId -> graph.degree(nodeId) > max);
        }

        Graph subgraph = graph.subgraph(selected);
        Set<String> edgeTypes = options.getPreserveEdgeTypes();
        if (!edgeTypes.isEmpty()) {
            subgraph = subgraph.filterEdges(EdgeFilter.relationTypes(edgeTypes)::test);
        }
        log.debug("Extracted subgraph with {} nodes and {} edges", subgraph.nodeCount(), subgraph.edgeCount());
        return subgraph;
    }

    // ========== Traversal core ==========

    private record Traversal(Map<String, ExploredNode> explored, boolean truncated) {}

    private Traversal traverse(Graph graph, String start, int maxDepth, int maxNodes,
                               NodeFilter nodeFilter, EdgeFilter edgeFilter,
                               EarlyTermination earlyTermination, TraversalDirection direction) {
        Map<String, ExploredNode> explored = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        Map<String, Boolean> edgeVerdicts = new HashMap<>();
        Deque<ExploredNode> queue = new ArrayDeque<>();

        ExploredNode root = new ExploredNode(start, 0, null, graph.getNodeAttributes(start).orElse(Map.of()));
        explored.put(start, root);
        seen.add(start);
        queue.add(root);
        boolean truncated = false;

        traversal:
        while (!queue.isEmpty()) {
            ExploredNode current = queue.poll();
            if (current.depth() >= maxDepth) {
                continue;
            }
            for (GraphEdge edge : graph.edgesOf(current.nodeId())) {
                if (!edge.traversableFrom(current.nodeId(), direction)) {
                    continue;
                }
                String next = edge.opposite(current.nodeId());
                if (seen.contains(next)) {
                    continue;
                }
                if (edgeFilter != null && !edgeVerdicts.computeIfAbsent(edge.getKey(), k -> edgeFilter.test(edge))) {
                    continue;
                }
                if (explored.size() >= maxNodes) {
                    truncated = true;
                    break traversal;
                }
                seen.add(next);
                Map<String, Object> attributes = graph.getNodeAttributes(next).orElse(Map.of());
                if (nodeFilter != null && !nodeFilter.test(next, attributes)) {
                    continue;
                }
                int depth = current.depth() + 1;
                if (earlyTermination != null && earlyTermination.shouldStop(next, depth)) {
                    break traversal;
                }
                ExploredNode node = new ExploredNode(next, depth, current.nodeId(), attributes);
                explored.put(next, node);
                queue.add(node);
            }
        }
        return new Traversal(explored, truncated);
    }

    /**
     * Collects the distinct edges joining two explored nodes, in exploration order.
     */
    static List<GraphEdge> collectEdges(Graph graph, Collection<String> nodeIds, EdgeFilter edgeFilter) {
        Set<String> members = new HashSet<>(nodeIds);
        Map<String, GraphEdge> collected = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            for (GraphEdge edge : graph.edgesOf(nodeId)) {
                if (collected.containsKey(edge.getKey()) || !members.contains(edge.opposite(nodeId))) {
                    continue;
                }
                if (edgeFilter == null || edgeFilter.test(edge)) {
                    collected.put(edge.getKey(), edge);
                }
            }
        }
        return new ArrayList<>(collected.values());
    }

    /**
     * Rebuilds breadth-first parents: the first explored node one layer up with an edge
     * leading to the node.
     */
    private static Map<String, String> breadthFirstParents(Graph graph, Map<String, Integer> depths,
                                                           TraversalDirection direction) {
        Map<String, Integer> order = new HashMap<>();
        for (String nodeId : depths.keySet()) {
            order.put(nodeId, order.size());
        }
        Map<String, String> parents = new HashMap<>();
        depths.forEach((nodeId, depth) -> {
            if (depth == 0) {
                return;
            }
            String parent = null;
            for (GraphEdge edge : graph.edgesOf(nodeId)) {
                String candidate = edge.opposite(nodeId);
                Integer candidateDepth = depths.get(candidate);
                if (candidateDepth == null || candidateDepth != depth - 1
                        || !edge.traversableFrom(candidate, direction)) {
                    continue;
                }
                if (parent == null || order.get(candidate) < order.get(parent)) {
                    parent = candidate;
                }
            }
            parents.put(nodeId, parent);
        });
        return parents;
    }

    private Map<String, ExploredNode> keepBidirectional(Graph graph, Map<String, ExploredNode> explored,
                                                        String start, EdgeFilter edgeFilter) {
        Map<String, ExploredNode> kept = new LinkedHashMap<>();
        for (ExploredNode node : explored.values()) {
            if (node.nodeId().equals(start)) {
                kept.put(node.nodeId(), node);
                continue;
            }
            boolean outgoing = false;
            boolean incoming = false;
            for (GraphEdge edge : graph.edgesOf(node.nodeId())) {
                String other = edge.opposite(node.nodeId());
                if (!explored.containsKey(other) || !edgeFilter.test(edge)) {
                    continue;
                }
                if (!edge.isDirected()) {
                    outgoing = true;
                    incoming = true;
                } else if (edge.getSource().equals(node.nodeId())) {
                    outgoing = true;
                } else {
                    incoming = true;
                }
            }
            if (outgoing && incoming) {
                kept.put(node.nodeId(), node);
            }
        }
        return kept;
    }

    static void requireNode(Graph graph, String nodeId) {
        if (!graph.hasNode(nodeId)) {
            throw new UnknownStartNodeException(nodeId);
        }
    }
}
