package com.entity.network.config;

/**
 * Engine-wide limits for exploration and discovery.
 *
 * @param maxDiscoveredEntities cap on the nodes a discovery keeps before truncating
 * @param progressiveDepthLimit depth limit used by breadth-first progressive exploration
 * @param defaultMaxDepth       depth used by the facade when a caller gives none
 * @param defaultMaxNodes       node cap used by the facade when a caller gives none
 */
public record ExplorationConfig(int maxDiscoveredEntities, int progressiveDepthLimit,
                                int defaultMaxDepth, int defaultMaxNodes) {

    public ExplorationConfig {
        if (maxDiscoveredEntities <= 0) {
            throw new IllegalArgumentException("maxDiscoveredEntities must be > 0");
        }
        if (progressiveDepthLimit < 0) {
            throw new IllegalArgumentException("progressiveDepthLimit must be >= 0");
        }
        if (defaultMaxDepth < 0) {
            throw new IllegalArgumentException("defaultMaxDepth must be >= 0");
        }
        if (defaultMaxNodes <= 0) {
            throw new IllegalArgumentException("defaultMaxNodes must be > 0");
        }
    }

    /**
     * Default limits: 5,000 discovered entities, progressive depth 10, depth 3, 1,000 nodes.
     */
    public static ExplorationConfig defaults() {
        return new ExplorationConfig(5_000, 10, 3, 1_000);
    }

    public ExplorationConfig withMaxDiscoveredEntities(int maxDiscoveredEntities) {
        return new ExplorationConfig(maxDiscoveredEntities, progressiveDepthLimit, defaultMaxDepth, defaultMaxNodes);
    }
}
