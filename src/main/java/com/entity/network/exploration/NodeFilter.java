package com.entity.network.exploration;

import java.util.Map;

/**
 * Decides whether a discovered node joins an exploration. Must be pure and deterministic.
 */
@FunctionalInterface
public interface NodeFilter {

    boolean test(String nodeId, Map<String, Object> attributes);

    default NodeFilter and(NodeFilter other) {
        return (nodeId, attributes) -> test(nodeId, attributes) && other.test(nodeId, attributes);
    }

    static NodeFilter acceptAll() {
        return (nodeId, attributes) -> true;
    }
}
