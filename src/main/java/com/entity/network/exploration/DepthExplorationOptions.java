package com.entity.network.exploration;

import com.entity.network.graph.TraversalDirection;

import java.util.Objects;

/**
 * Options for {@link NetworkExplorationService#exploreByDepth}.
 */
public class DepthExplorationOptions {

    static final int DEFAULT_MAX_DEPTH = 3;
    static final int DEFAULT_MAX_NODES = 1000;

    private final String startNode;
    private final int maxDepth;
    private final int maxNodes;
    private final NodeFilter nodeFilter;
    private final EdgeFilter edgeFilter;
    private final EarlyTermination earlyTermination;
    private final TraversalDirection direction;
    private final boolean includeEdges;

    private DepthExplorationOptions(Builder builder) {
        this.startNode = builder.startNode;
        this.maxDepth = builder.maxDepth;
        this.maxNodes = builder.maxNodes;
        this.nodeFilter = builder.nodeFilter;
        this.edgeFilter = builder.edgeFilter;
        this.earlyTermination = builder.earlyTermination;
        this.direction = builder.direction;
        this.includeEdges = builder.includeEdges;
    }

    public String getStartNode() {
        return startNode;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    /**
     * Returns the node filter, or null when every node is accepted.
     */
    public NodeFilter getNodeFilter() {
        return nodeFilter;
    }

    /**
     * Returns the edge filter, or null when every edge is followed.
     */
    public EdgeFilter getEdgeFilter() {
        return edgeFilter;
    }

    public EarlyTermination getEarlyTermination() {
        return earlyTermination;
    }

    public TraversalDirection getDirection() {
        return direction;
    }

    public boolean isIncludeEdges() {
        return includeEdges;
    }

    public static Builder builder(String startNode) {
        return new Builder().startNode(startNode);
    }

    public static class Builder {
        private String startNode;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxNodes = DEFAULT_MAX_NODES;
        private NodeFilter nodeFilter;
        private EdgeFilter edgeFilter;
        private EarlyTermination earlyTermination;
        private TraversalDirection direction = TraversalDirection.ALL;
        private boolean includeEdges = true;

        public Builder startNode(String startNode) {
            this.startNode = startNode;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = InvalidBoundException.requireNonNegative("maxDepth", maxDepth);
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = InvalidBoundException.requirePositive("maxNodes", maxNodes);
            return this;
        }

        public Builder nodeFilter(NodeFilter nodeFilter) {
            this.nodeFilter = nodeFilter;
            return this;
        }

        public Builder edgeFilter(EdgeFilter edgeFilter) {
            this.edgeFilter = edgeFilter;
            return this;
        }

        public Builder earlyTermination(EarlyTermination earlyTermination) {
            this.earlyTermination = earlyTermination;
            return this;
        }

        public Builder direction(TraversalDirection direction) {
            this.direction = Objects.requireNonNull(direction, "direction is required");
            return this;
        }

        public Builder includeEdges(boolean includeEdges) {
            this.includeEdges = includeEdges;
            return this;
        }

        public DepthExplorationOptions build() {
            Objects.requireNonNull(startNode, "startNode is required");
            return new DepthExplorationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "DepthExplorationOptions{" +
                "startNode='" + startNode + '\'' +
                ", maxDepth=" + maxDepth +
                ", maxNodes=" + maxNodes +
                ", direction=" + direction +
                ", nodeFilter=" + (nodeFilter != null) +
                ", edgeFilter=" + (edgeFilter != null) +
                '}';
    }
}
