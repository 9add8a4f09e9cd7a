package com.entity.network.exploration;

import java.util.Set;

/**
 * Selection criteria for {@link NetworkExplorationService#extractSubgraph}.
 * Node-selecting criteria intersect when combined; the edge-type allow-list is applied
 * after node selection.
 */
public class SubgraphOptions {

    private final Set<String> nodes;
    private final String centerNode;
    private final Integer radius;
    private final Integer minDegree;
    private final Integer maxDegree;
    private final Set<String> preserveEdgeTypes;

    private SubgraphOptions(Builder builder) {
        this.nodes = builder.nodes;
        this.centerNode = builder.centerNode;
        this.radius = builder.radius;
        this.minDegree = builder.minDegree;
        this.maxDegree = builder.maxDegree;
        this.preserveEdgeTypes = builder.preserveEdgeTypes;
    }

    /**
     * Returns the explicit node set, or null when not selecting by node set.
     */
    public Set<String> getNodes() {
        return nodes;
    }

    public String getCenterNode() {
        return centerNode;
    }

    public Integer getRadius() {
        return radius;
    }

    public Integer getMinDegree() {
        return minDegree;
    }

    public Integer getMaxDegree() {
        return maxDegree;
    }

    public Set<String> getPreserveEdgeTypes() {
        return preserveEdgeTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<String> nodes;
        private String centerNode;
        private Integer radius;
        private Integer minDegree;
        private Integer maxDegree;
        private Set<String> preserveEdgeTypes = Set.of();

        public Builder nodes(Set<String> nodes) {
            this.nodes = nodes != null ? Set.copyOf(nodes) : null;
            return this;
        }

        public Builder around(String centerNode, int radius) {
            this.centerNode = centerNode;
            this.radius = InvalidBoundException.requireNonNegative("radius", radius);
            return this;
        }

        public Builder minDegree(int minDegree) {
            this.minDegree = InvalidBoundException.requireNonNegative("minDegree", minDegree);
            return this;
        }

        public Builder maxDegree(int maxDegree) {
            this.maxDegree = InvalidBoundException.requireNonNegative("maxDegree", maxDegree);
            return this;
        }

        public Builder preserveEdgeTypes(Set<String> preserveEdgeTypes) {
            this.preserveEdgeTypes = preserveEdgeTypes != null ? Set.copyOf(preserveEdgeTypes) : Set.of();
            return this;
        }

        public SubgraphOptions build() {
            return new SubgraphOptions(this);
        }
    }
}
