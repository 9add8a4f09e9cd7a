package com.entity.network.exploration;

import java.util.Objects;
import java.util.Set;

/**
 * Options for {@link NetworkExplorationService#exploreByDegrees}: social-distance exploration
 * restricted to relationship types and/or a minimum edge weight.
 */
public class DegreeExplorationOptions {

    private final String startNode;
    private final int degrees;
    private final Set<String> relationTypes;
    private final Double weightThreshold;
    private final boolean bidirectionalOnly;
    private final int maxNodes;

    private DegreeExplorationOptions(Builder builder) {
        this.startNode = builder.startNode;
        this.degrees = builder.degrees;
        this.relationTypes = builder.relationTypes;
        this.weightThreshold = builder.weightThreshold;
        this.bidirectionalOnly = builder.bidirectionalOnly;
        this.maxNodes = builder.maxNodes;
    }

    public String getStartNode() {
        return startNode;
    }

    public int getDegrees() {
        return degrees;
    }

    /**
     * Returns the allowed relationship types; empty means every type.
     */
    public Set<String> getRelationTypes() {
        return relationTypes;
    }

    /**
     * Returns the minimum edge weight, or null when weights are not checked.
     */
    public Double getWeightThreshold() {
        return weightThreshold;
    }

    public boolean isBidirectionalOnly() {
        return bidirectionalOnly;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    /**
     * Derives the edge filter the traversal core applies.
     */
    EdgeFilter toEdgeFilter() {
        EdgeFilter filter = EdgeFilter.relationTypes(relationTypes);
        if (weightThreshold != null) {
            filter = filter.and(EdgeFilter.minWeight(weightThreshold));
        }
        return filter;
    }

    public static Builder builder(String startNode, int degrees) {
        return new Builder().startNode(startNode).degrees(degrees);
    }

    public static class Builder {
        private String startNode;
        private int degrees = 1;
        private Set<String> relationTypes = Set.of();
        private Double weightThreshold;
        private boolean bidirectionalOnly = false;
        private int maxNodes = DepthExplorationOptions.DEFAULT_MAX_NODES;

        public Builder startNode(String startNode) {
            this.startNode = startNode;
            return this;
        }

        public Builder degrees(int degrees) {
            this.degrees = InvalidBoundException.requireNonNegative("degrees", degrees);
            return this;
        }

        public Builder relationTypes(Set<String> relationTypes) {
            this.relationTypes = relationTypes != null ? Set.copyOf(relationTypes) : Set.of();
            return this;
        }

        public Builder weightThreshold(Double weightThreshold) {
            this.weightThreshold = weightThreshold;
            return this;
        }

        public Builder bidirectionalOnly(boolean bidirectionalOnly) {
            this.bidirectionalOnly = bidirectionalOnly;
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = InvalidBoundException.requirePositive("maxNodes", maxNodes);
            return this;
        }

        public DegreeExplorationOptions build() {
            Objects.requireNonNull(startNode, "startNode is required");
            return new DegreeExplorationOptions(this);
        }
    }
}
