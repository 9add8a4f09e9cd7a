package com.entity.network.exploration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node reached by an exploration.
 *
 * @param nodeId     the node id
 * @param depth      hops from the start node
 * @param parent     the node it was discovered from, null for the start node
 * @param attributes snapshot of the node attributes at discovery time
 */
public record ExploredNode(String nodeId, int depth, String parent, Map<String, Object> attributes) {

    public ExploredNode {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public boolean isStart() {
        return parent == null;
    }
}
