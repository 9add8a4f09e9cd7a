package com.entity.network.exploration;

/**
 * Summary figures of an exploration result.
 */
public record ExplorationStatistics(int totalNodes, int totalEdges, int maxDepthReached, double averageDegree) {

    static ExplorationStatistics of(int totalNodes, int totalEdges, int maxDepthReached) {
        double averageDegree = totalNodes > 0 ? (2.0 * totalEdges) / totalNodes : 0.0;
        return new ExplorationStatistics(totalNodes, totalEdges, maxDepthReached, averageDegree);
    }
}
