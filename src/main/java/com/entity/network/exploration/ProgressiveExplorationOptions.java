package com.entity.network.exploration;

import java.util.Objects;

/**
 * Options for {@link NetworkExplorationService#exploreProgressive}.
 */
public class ProgressiveExplorationOptions {

    private static final int DEFAULT_MAX_NODES = 100;
    private static final double DEFAULT_WALK_PROBABILITY = 0.85;
    private static final double DEFAULT_TELEPORT_PROBABILITY = 0.15;

    private final String startNode;
    private final ExplorationStrategy strategy;
    private final int maxNodes;
    private final NodeScorer scoring;
    private final double walkProbability;
    private final double teleportProbability;
    private final Long seed;

    private ProgressiveExplorationOptions(Builder builder) {
        this.startNode = builder.startNode;
        this.strategy = builder.strategy;
        this.maxNodes = builder.maxNodes;
        this.scoring = builder.scoring;
        this.walkProbability = builder.walkProbability;
        this.teleportProbability = builder.teleportProbability;
        this.seed = builder.seed;
    }

    public String getStartNode() {
        return startNode;
    }

    public ExplorationStrategy getStrategy() {
        return strategy;
    }

    /**
     * Hard cap on distinct nodes, or on visit events for {@link ExplorationStrategy#RANDOM_WALK}.
     */
    public int getMaxNodes() {
        return maxNodes;
    }

    public NodeScorer getScoring() {
        return scoring;
    }

    public double getWalkProbability() {
        return walkProbability;
    }

    public double getTeleportProbability() {
        return teleportProbability;
    }

    /**
     * Returns the random seed for walks, or null for a fresh random source per call.
     */
    public Long getSeed() {
        return seed;
    }

    public static Builder builder(String startNode, ExplorationStrategy strategy) {
        return new Builder().startNode(startNode).strategy(strategy);
    }

    public static class Builder {
        private String startNode;
        private ExplorationStrategy strategy = ExplorationStrategy.BREADTH;
        private int maxNodes = DEFAULT_MAX_NODES;
        private NodeScorer scoring;
        private double walkProbability = DEFAULT_WALK_PROBABILITY;
        private double teleportProbability = DEFAULT_TELEPORT_PROBABILITY;
        private Long seed;

        public Builder startNode(String startNode) {
            this.startNode = startNode;
            return this;
        }

        public Builder strategy(ExplorationStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy is required");
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = InvalidBoundException.requirePositive("maxNodes", maxNodes);
            return this;
        }

        public Builder scoring(NodeScorer scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder walkProbability(double walkProbability) {
            this.walkProbability = InvalidBoundException.requireProbability("walkProbability", walkProbability);
            return this;
        }

        public Builder teleportProbability(double teleportProbability) {
            this.teleportProbability = InvalidBoundException.requireProbability("teleportProbability", teleportProbability);
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public ProgressiveExplorationOptions build() {
            Objects.requireNonNull(startNode, "startNode is required");
            if (strategy == ExplorationStrategy.BEST_FIRST && scoring == null) {
                throw new IllegalArgumentException("BEST_FIRST exploration requires a scoring function");
            }
            return new ProgressiveExplorationOptions(this);
        }
    }
}
