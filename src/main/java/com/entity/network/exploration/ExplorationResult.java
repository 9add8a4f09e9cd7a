package com.entity.network.exploration;

import com.entity.network.graph.GraphEdge;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable outcome of an exploration: the reached nodes grouped by depth, the edges among them,
 * visit counts for random walks and summary statistics.
 */
public final class ExplorationResult {

    private final String startNode;
    private final Map<String, ExploredNode> nodes;
    private final SortedMap<Integer, Set<String>> nodesByDepth;
    private final List<GraphEdge> edges;
    private final Map<String, Integer> visitCounts;
    private final ExplorationStatistics statistics;
    private final boolean truncated;

    private ExplorationResult(String startNode, Map<String, ExploredNode> nodes, List<GraphEdge> edges,
                              Map<String, Integer> visitCounts, boolean truncated) {
        this.startNode = startNode;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.visitCounts = Collections.unmodifiableMap(new LinkedHashMap<>(visitCounts));
        this.truncated = truncated;

        TreeMap<Integer, Set<String>> byDepth = new TreeMap<>();
        for (ExploredNode node : nodes.values()) {
            byDepth.computeIfAbsent(node.depth(), d -> new LinkedHashSet<>()).add(node.nodeId());
        }
        byDepth.replaceAll((depth, ids) -> Collections.unmodifiableSet(ids));
        this.nodesByDepth = Collections.unmodifiableSortedMap(byDepth);

        int maxDepth = byDepth.isEmpty() ? 0 : byDepth.lastKey();
        this.statistics = ExplorationStatistics.of(nodes.size(), edges.size(), maxDepth);
    }

    static ExplorationResult of(String startNode, Collection<ExploredNode> nodes, List<GraphEdge> edges,
                                boolean truncated) {
        return of(startNode, nodes, edges, Map.of(), truncated);
    }

    static ExplorationResult of(String startNode, Collection<ExploredNode> nodes, List<GraphEdge> edges,
                                Map<String, Integer> visitCounts, boolean truncated) {
        Map<String, ExploredNode> byId = new LinkedHashMap<>();
        for (ExploredNode node : nodes) {
            byId.put(node.nodeId(), node);
        }
        return new ExplorationResult(startNode, byId, edges, visitCounts, truncated);
    }

    public String getStartNode() {
        return startNode;
    }

    /**
     * Returns the explored nodes in discovery order.
     */
    public Collection<ExploredNode> getNodes() {
        return nodes.values();
    }

    /**
     * Returns the explored node ids in discovery order.
     */
    public Set<String> getNodeIds() {
        return nodes.keySet();
    }

    public Optional<ExploredNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public SortedMap<Integer, Set<String>> getNodesByDepth() {
        return nodesByDepth;
    }

    public Set<String> nodesAtDepth(int depth) {
        return nodesByDepth.getOrDefault(depth, Set.of());
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    /**
     * Returns visit counts per node. Only random walks populate it.
     */
    public Map<String, Integer> getVisitCounts() {
        return visitCounts;
    }

    public ExplorationStatistics getStatistics() {
        return statistics;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return "ExplorationResult{" +
                "startNode='" + startNode + '\'' +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", maxDepth=" + statistics.maxDepthReached() +
                ", truncated=" + truncated +
                '}';
    }
}
