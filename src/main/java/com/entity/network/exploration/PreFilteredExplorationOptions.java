package com.entity.network.exploration;

import com.entity.network.graph.TraversalDirection;

import java.util.Objects;

/**
 * Options for {@link NetworkExplorationService#explorePreFiltered}. There is no edge filter:
 * the graph handed in must already contain only the edges to follow.
 */
public class PreFilteredExplorationOptions {

    private static final int DEFAULT_MAX_DEPTH = 10;

    private final String startNode;
    private final int maxDepth;
    private final int maxNodes;
    private final NodeFilter nodeFilter;
    private final EarlyTermination earlyTermination;
    private final TraversalDirection direction;
    private final boolean includeEdges;

    private PreFilteredExplorationOptions(Builder builder) {
        this.startNode = builder.startNode;
        this.maxDepth = builder.maxDepth;
        this.maxNodes = builder.maxNodes;
        this.nodeFilter = builder.nodeFilter;
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

    public NodeFilter getNodeFilter() {
        return nodeFilter;
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
        private int maxNodes = Integer.MAX_VALUE;
        private NodeFilter nodeFilter;
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

        public PreFilteredExplorationOptions build() {
            Objects.requireNonNull(startNode, "startNode is required");
            return new PreFilteredExplorationOptions(this);
        }
    }
}
