package com.entity.network.metrics;

import java.time.Duration;

/**
 * Metrics sink that drops every measurement.
 */
public class NoOpExplorationMetrics implements ExplorationMetrics {

    @Override
    public void recordDuration(String operation, Duration duration) {
    }

    @Override
    public void recordNodesExplored(int nodes) {
    }

    @Override
    public void incrementTruncated(String operation) {
    }

    @Override
    public void incrementFailure(String operation, Throwable error) {
    }

    @Override
    public void recordBridges(int bridges) {
    }

    @Override
    public void recordPathways(int pathways) {
    }
}
