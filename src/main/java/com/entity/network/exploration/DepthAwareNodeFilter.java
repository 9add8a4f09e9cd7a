package com.entity.network.exploration;

import java.util.Map;

/**
 * Node filter that also sees the hop distance at which the node was reached.
 */
@FunctionalInterface
public interface DepthAwareNodeFilter {

    boolean test(String nodeId, Map<String, Object> attributes, int depth);
}
