package com.entity.network.exploration;

/**
 * Halts a traversal as soon as it returns true for a newly discovered node.
 * The triggering node is not added; nodes discovered before it are kept.
 */
@FunctionalInterface
public interface EarlyTermination {

    boolean shouldStop(String nodeId, int depth);
}
