package com.entity.network.graph;

/**
 * Outcome returned by a {@link GraphVisitor} for each visited node.
 */
public enum VisitDecision {
    /** Keep the node and expand its neighbors. */
    CONTINUE,
    /** Do not expand the node's neighbors. The node stays marked as seen. */
    SKIP,
    /** Abort the whole traversal. */
    STOP
}
