package com.entity.network.graph;

import java.util.Map;

/**
 * Callback for the native traversal primitives of {@link Graph}.
 */
@FunctionalInterface
public interface GraphVisitor {

    /**
     * Visits a node.
     *
     * @param nodeId     the node id
     * @param attributes read-only view of the node attributes
     * @param depth      hop distance from the traversal start
     * @return how the traversal should proceed
     */
    VisitDecision visit(String nodeId, Map<String, Object> attributes, int depth);
}
