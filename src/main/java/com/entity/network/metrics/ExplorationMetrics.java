package com.entity.network.metrics;

import java.time.Duration;

/**
 * Records how explorations and discoveries behave. {@link NoOpExplorationMetrics} keeps the
 * engine usable without Micrometer on the classpath.
 */
public interface ExplorationMetrics {

    /**
     * Records the wall time of one facade operation, e.g. {@code depth} or {@code discover}.
     */
    void recordDuration(String operation, Duration duration);

    void recordNodesExplored(int nodes);

    void incrementTruncated(String operation);

    void incrementFailure(String operation, Throwable error);

    void recordBridges(int bridges);

    void recordPathways(int pathways);
}
