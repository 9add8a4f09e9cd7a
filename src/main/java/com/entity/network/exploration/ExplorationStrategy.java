package com.entity.network.exploration;

/**
 * Expansion order used by progressive and filtered exploration.
 */
public enum ExplorationStrategy {
    BREADTH,
    DEPTH,
    BEST_FIRST,
    RANDOM_WALK
}
