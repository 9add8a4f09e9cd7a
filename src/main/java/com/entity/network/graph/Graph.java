package com.entity.network.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory multigraph holding nodes and edges with arbitrary attribute maps.
 *
 * <p>Lookups never throw for unknown ids: absence is reported as an empty collection,
 * {@link Optional#empty()} or zero. Only structural misuse (self-loops, duplicate edge keys,
 * an edge orientation the {@link GraphMode} does not allow) is rejected.</p>
 *
 * <p>Not thread-safe. A graph is built by one caller and then read by the exploration
 * services, which never mutate it.</p>
 */
public class Graph {

    private final GraphMode mode;
    private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    // node id -> keys of incident edges in insertion order
    private final Map<String, List<String>> incidence = new HashMap<>();

    public Graph() {
        this(GraphMode.MIXED);
    }

    public Graph(GraphMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode is required");
    }

    public GraphMode getMode() {
        return mode;
    }

    // ========== Nodes ==========

    /**
     * Adds a node, or merges the attributes into an existing node.
     */
    public Graph addNode(String nodeId) {
        return mergeNode(nodeId, Map.of());
    }

    /**
     * Adds a node, or merges the attributes into an existing node. Incoming keys override.
     */
    public Graph mergeNode(String nodeId, Map<String, Object> attributes) {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Map<String, Object> current = nodes.computeIfAbsent(nodeId, id -> {
            incidence.put(id, new ArrayList<>());
            return new LinkedHashMap<>();
        });
        if (attributes != null) {
            current.putAll(attributes);
        }
        return this;
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public Optional<Map<String, Object>> getNodeAttributes(String nodeId) {
        Map<String, Object> attributes = nodeId != null ? nodes.get(nodeId) : null;
        return attributes != null
                ? Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)))
                : Optional.empty();
    }

    /**
     * Returns node ids in insertion order.
     */
    public List<String> nodes() {
        return List.copyOf(nodes.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Removes a node and all of its incident edges. No-op for an unknown node.
     */
    public boolean removeNode(String nodeId) {
        if (!hasNode(nodeId)) {
            return false;
        }
        for (String edgeKey : new ArrayList<>(incidence.get(nodeId))) {
            removeEdge(edgeKey);
        }
        nodes.remove(nodeId);
        incidence.remove(nodeId);
        return true;
    }

    // ========== Edges ==========

    /**
     * Adds an edge using the graph's default orientation: undirected for
     * {@link GraphMode#UNDIRECTED} graphs, directed otherwise. Missing endpoints are created.
     *
     * @return the generated edge key
     */
    public String addEdge(String source, String target, Map<String, Object> attributes) {
        return insertEdge(null, source, target, mode != GraphMode.UNDIRECTED, attributes);
    }

    public String addDirectedEdge(String source, String target, Map<String, Object> attributes) {
        if (mode == GraphMode.UNDIRECTED) {
            throw new IllegalStateException("Cannot add a directed edge to an undirected graph");
        }
        return insertEdge(null, source, target, true, attributes);
    }

    public String addUndirectedEdge(String source, String target, Map<String, Object> attributes) {
        if (mode == GraphMode.DIRECTED) {
            throw new IllegalStateException("Cannot add an undirected edge to a directed graph");
        }
        return insertEdge(null, source, target, false, attributes);
    }

    /**
     * Adds an edge under an explicit key.
     *
     * @throws IllegalStateException if the key is already used
     */
    public String addEdgeWithKey(String key, String source, String target, Map<String, Object> attributes) {
        Objects.requireNonNull(key, "key is required");
        return insertEdge(key, source, target, mode != GraphMode.UNDIRECTED, attributes);
    }

    /**
     * Merges the attributes into the first edge joining source and target (respecting
     * orientation for directed edges), or adds a new edge when there is none.
     *
     * @return the key of the merged or created edge
     */
    public String mergeEdge(String source, String target, Map<String, Object> attributes) {
        boolean directed = mode != GraphMode.UNDIRECTED;
        for (GraphEdge edge : edgesOf(source)) {
            boolean sameOrientation = edge.getSource().equals(source) && edge.getTarget().equals(target);
            boolean matches = edge.isDirected() == directed
                    && (sameOrientation || (!directed && edge.connects(source, target)));
            if (matches) {
                edges.put(edge.getKey(), edge.withMergedAttributes(attributes));
                return edge.getKey();
            }
        }
        return insertEdge(null, source, target, directed, attributes);
    }

    /**
     * Merges the attributes into the edge with the given key, or adds it.
     */
    public String mergeEdgeWithKey(String key, String source, String target, boolean directed,
                                   Map<String, Object> attributes) {
        GraphEdge existing = edges.get(key);
        if (existing != null) {
            edges.put(key, existing.withMergedAttributes(attributes));
            return key;
        }
        return insertEdge(key, source, target, directed, attributes);
    }

    private String insertEdge(String key, String source, String target, boolean directed,
                              Map<String, Object> attributes) {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        if (source.equals(target)) {
            throw new IllegalArgumentException("Self-loops are not allowed: " + source);
        }
        if (directed && mode == GraphMode.UNDIRECTED) {
            throw new IllegalStateException("Cannot add a directed edge to an undirected graph");
        }
        if (!directed && mode == GraphMode.DIRECTED) {
            throw new IllegalStateException("Cannot add an undirected edge to a directed graph");
        }
        String edgeKey = key != null ? key : nextEdgeKey(source, target);
        if (edges.containsKey(edgeKey)) {
            throw new IllegalStateException("Edge key already in use: " + edgeKey);
        }
        addNode(source);
        addNode(target);
        edges.put(edgeKey, new GraphEdge(edgeKey, source, target, directed, attributes));
        incidence.get(source).add(edgeKey);
        incidence.get(target).add(edgeKey);
        return edgeKey;
    }

    private String nextEdgeKey(String source, String target) {
        String prefix = source + "->" + target + "#";
        int ordinal = 0;
        while (edges.containsKey(prefix + ordinal)) {
            ordinal++;
        }
        return prefix + ordinal;
    }

    public boolean hasEdge(String key) {
        return key != null && edges.containsKey(key);
    }

    /**
     * Returns whether an edge can be followed from source to target: a directed edge
     * source -> target, or an undirected edge between the two.
     */
    public boolean hasEdge(String source, String target) {
        for (GraphEdge edge : edgesOf(source)) {
            if (edge.connects(source, target) && (!edge.isDirected() || edge.getSource().equals(source))) {
                return true;
            }
        }
        return false;
    }

    public Optional<GraphEdge> getEdge(String key) {
        return key != null ? Optional.ofNullable(edges.get(key)) : Optional.empty();
    }

    public Optional<Map<String, Object>> getEdgeAttributes(String key) {
        return getEdge(key).map(GraphEdge::getAttributes);
    }

    /**
     * Returns all edges in insertion order.
     */
    public List<GraphEdge> edges() {
        return List.copyOf(edges.values());
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the edges incident to a node in insertion order, empty for an unknown node.
     */
    public List<GraphEdge> edgesOf(String nodeId) {
        List<String> keys = nodeId != null ? incidence.get(nodeId) : null;
        if (keys == null) {
            return List.of();
        }
        List<GraphEdge> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(edges.get(key));
        }
        return result;
    }

    /**
     * Returns every edge joining the two nodes, in either orientation.
     */
    public List<GraphEdge> edgesBetween(String a, String b) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edgesOf(a)) {
            if (edge.connects(a, b)) {
                result.add(edge);
            }
        }
        return result;
    }

    public boolean removeEdge(String key) {
        GraphEdge edge = key != null ? edges.remove(key) : null;
        if (edge == null) {
            return false;
        }
        incidence.get(edge.getSource()).remove(key);
        incidence.get(edge.getTarget()).remove(key);
        return true;
    }

    // ========== Neighborhood ==========

    /**
     * Returns distinct neighbors across edges of any orientation.
     */
    public List<String> neighbors(String nodeId) {
        return neighbors(nodeId, TraversalDirection.ALL);
    }

    public List<String> outNeighbors(String nodeId) {
        return neighbors(nodeId, TraversalDirection.FORWARD);
    }

    public List<String> inNeighbors(String nodeId) {
        return neighbors(nodeId, TraversalDirection.BACKWARD);
    }

    /**
     * Returns distinct neighbors reachable over one edge in the given direction,
     * in edge insertion order. Empty for an unknown node.
     */
    public List<String> neighbors(String nodeId, TraversalDirection direction) {
        Set<String> result = new LinkedHashSet<>();
        for (GraphEdge edge : edgesOf(nodeId)) {
            if (edge.traversableFrom(nodeId, direction)) {
                result.add(edge.opposite(nodeId));
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns the number of incident edges, parallel edges included. Zero for an unknown node.
     */
    public int degree(String nodeId) {
        List<String> keys = nodeId != null ? incidence.get(nodeId) : null;
        return keys != null ? keys.size() : 0;
    }

    // ========== Native traversal primitives ==========

    /**
     * Breadth-first traversal from {@code start}. Nodes are visited in discovery order;
     * neighbors beyond {@code maxDepth} are never enqueued. A node answered with
     * {@link VisitDecision#SKIP} stays marked as seen and is not reached again by another path.
     * Does nothing for an unknown start node.
     */
    public void breadthFirst(String start, TraversalDirection direction, int maxDepth, GraphVisitor visitor) {
        if (!hasNode(start)) {
            return;
        }
        Set<String> seen = new HashSet<>();
        Deque<Frame> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(new Frame(start, 0));

        while (!queue.isEmpty()) {
            Frame frame = queue.poll();
            VisitDecision decision = visitor.visit(frame.nodeId(), attributeView(frame.nodeId()), frame.depth());
            if (decision == VisitDecision.STOP) {
                return;
            }
            if (decision == VisitDecision.SKIP || frame.depth() >= maxDepth) {
                continue;
            }
            for (String edgeKey : incidence.get(frame.nodeId())) {
                GraphEdge edge = edges.get(edgeKey);
                if (!edge.traversableFrom(frame.nodeId(), direction)) {
                    continue;
                }
                String next = edge.opposite(frame.nodeId());
                if (seen.add(next)) {
                    queue.add(new Frame(next, frame.depth() + 1));
                }
            }
        }
    }

    /**
     * Depth-first (pre-order) traversal from {@code start}. The depth passed to the visitor
     * is the node's depth in the depth-first tree. A node answered with {@link VisitDecision#SKIP}
     * is offered again when a later path reaches it at a smaller depth. Does nothing for an
     * unknown start node.
     */
    public void depthFirst(String start, TraversalDirection direction, GraphVisitor visitor) {
        if (!hasNode(start)) {
            return;
        }
        Set<String> expanded = new HashSet<>();
        Map<String, Integer> skippedAt = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (expanded.contains(frame.nodeId()) || !shallowerThanSkip(skippedAt, frame.nodeId(), frame.depth())) {
                continue;
            }
            VisitDecision decision = visitor.visit(frame.nodeId(), attributeView(frame.nodeId()), frame.depth());
            if (decision == VisitDecision.STOP) {
                return;
            }
            if (decision == VisitDecision.SKIP) {
                skippedAt.put(frame.nodeId(), frame.depth());
                continue;
            }
            expanded.add(frame.nodeId());
            skippedAt.remove(frame.nodeId());
            List<String> next = neighbors(frame.nodeId(), direction);
            int nextDepth = frame.depth() + 1;
            // Push in reverse so the first neighbor is explored first
            for (int i = next.size() - 1; i >= 0; i--) {
                String nodeId = next.get(i);
                if (!expanded.contains(nodeId) && shallowerThanSkip(skippedAt, nodeId, nextDepth)) {
                    stack.push(new Frame(nodeId, nextDepth));
                }
            }
        }
    }

    private static boolean shallowerThanSkip(Map<String, Integer> skippedAt, String nodeId, int depth) {
        Integer skipped = skippedAt.get(nodeId);
        return skipped == null || depth < skipped;
    }

    private Map<String, Object> attributeView(String nodeId) {
        return Collections.unmodifiableMap(nodes.get(nodeId));
    }

    private record Frame(String nodeId, int depth) {}

    // ========== Derived graphs ==========

    /**
     * Computes node count, edge count, density and average degree.
     * Density counts an undirected edge as two directed slots, so it reduces to
     * m / (n(n-1)/2) for undirected and m / (n(n-1)) for directed graphs.
     */
    public GraphMetrics metrics() {
        int n = nodes.size();
        int m = edges.size();
        if (n == 0) {
            return GraphMetrics.empty();
        }
        double density = 0.0;
        if (n > 1) {
            long slots = 0;
            for (GraphEdge edge : edges.values()) {
                slots += edge.isDirected() ? 1 : 2;
            }
            density = slots / ((double) n * (n - 1));
        }
        return new GraphMetrics(n, m, density, (2.0 * m) / n);
    }

    /**
     * Returns a new graph restricted to the given nodes. Unknown ids are ignored; an edge is
     * kept only if both of its endpoints are selected. Keys and attributes are preserved.
     */
    public Graph subgraph(Collection<String> nodeIds) {
        Graph result = new Graph(mode);
        Set<String> selected = new HashSet<>();
        for (String nodeId : nodeIds) {
            if (hasNode(nodeId)) {
                selected.add(nodeId);
            }
        }
        // Keep the parent graph's node order
        for (Map.Entry<String, Map<String, Object>> node : nodes.entrySet()) {
            if (selected.contains(node.getKey())) {
                result.mergeNode(node.getKey(), node.getValue());
            }
        }
        for (GraphEdge edge : edges.values()) {
            if (selected.contains(edge.getSource()) && selected.contains(edge.getTarget())) {
                result.insertEdge(edge.getKey(), edge.getSource(), edge.getTarget(),
                        edge.isDirected(), edge.getAttributes());
            }
        }
        return result;
    }

    /**
     * Returns a copy keeping every node and only the edges matching the predicate.
     */
    public Graph filterEdges(Predicate<GraphEdge> predicate) {
        Graph result = new Graph(mode);
        nodes.forEach(result::mergeNode);
        for (GraphEdge edge : edges.values()) {
            if (predicate.test(edge)) {
                result.insertEdge(edge.getKey(), edge.getSource(), edge.getTarget(),
                        edge.isDirected(), edge.getAttributes());
            }
        }
        return result;
    }

    public Graph copy() {
        return filterEdges(edge -> true);
    }

    /**
     * Returns the union of two graphs. Nodes are matched by id and edges by key; where both
     * graphs define an attribute, the value from {@code second} wins. The result is
     * {@link GraphMode#MIXED} unless both inputs share a mode.
     */
    public static Graph merge(Graph first, Graph second) {
        GraphMode mode = first.mode == second.mode ? first.mode : GraphMode.MIXED;
        Graph result = new Graph(mode);
        for (Graph source : List.of(first, second)) {
            source.nodes.forEach(result::mergeNode);
            for (GraphEdge edge : source.edges.values()) {
                result.mergeEdgeWithKey(edge.getKey(), edge.getSource(), edge.getTarget(),
                        edge.isDirected(), edge.getAttributes());
            }
        }
        return result;
    }

    /**
     * Removes every node and edge.
     */
    public void clear() {
        nodes.clear();
        edges.clear();
        incidence.clear();
    }

    @Override
    public String toString() {
        return "Graph{" +
                "mode=" + mode +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                '}';
    }
}
