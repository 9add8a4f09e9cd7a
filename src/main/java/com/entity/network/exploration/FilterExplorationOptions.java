package com.entity.network.exploration;

import java.util.Objects;

/**
 * Options for {@link NetworkExplorationService#exploreWithFilter}: breadth- or depth-first
 * traversal pruned by a depth-aware node filter.
 */
public class FilterExplorationOptions {

    private static final int DEFAULT_MAX_DEPTH = 10;

    private final String startNode;
    private final DepthAwareNodeFilter nodeFilter;
    private final EdgeFilter edgeFilter;
    private final int maxDepth;
    private final ExplorationStrategy strategy;

    private FilterExplorationOptions(Builder builder) {
        this.startNode = builder.startNode;
        this.nodeFilter = builder.nodeFilter;
        this.edgeFilter = builder.edgeFilter;
        this.maxDepth = builder.maxDepth;
        this.strategy = builder.strategy;
    }

    public String getStartNode() {
        return startNode;
    }

    public DepthAwareNodeFilter getNodeFilter() {
        return nodeFilter;
    }

    /**
     * Returns the filter applied to collected edges, or null to keep them all.
     */
    public EdgeFilter getEdgeFilter() {
        return edgeFilter;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public ExplorationStrategy getStrategy() {
        return strategy;
    }

    public static Builder builder(String startNode) {
        return new Builder().startNode(startNode);
    }

    public static class Builder {
        private String startNode;
        private DepthAwareNodeFilter nodeFilter = (nodeId, attributes, depth) -> true;
        private EdgeFilter edgeFilter;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private ExplorationStrategy strategy = ExplorationStrategy.BREADTH;

        public Builder startNode(String startNode) {
            this.startNode = startNode;
            return this;
        }

        public Builder nodeFilter(DepthAwareNodeFilter nodeFilter) {
            this.nodeFilter = Objects.requireNonNull(nodeFilter, "nodeFilter is required");
            return this;
        }

        public Builder edgeFilter(EdgeFilter edgeFilter) {
            this.edgeFilter = edgeFilter;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = InvalidBoundException.requireNonNegative("maxDepth", maxDepth);
            return this;
        }

        public Builder strategy(ExplorationStrategy strategy) {
            if (strategy != ExplorationStrategy.BREADTH && strategy != ExplorationStrategy.DEPTH) {
                throw new IllegalArgumentException("Filtered exploration supports BREADTH or DEPTH, got " + strategy);
            }
            this.strategy = strategy;
            return this;
        }

        public FilterExplorationOptions build() {
            Objects.requireNonNull(startNode, "startNode is required");
            return new FilterExplorationOptions(this);
        }
    }
}
