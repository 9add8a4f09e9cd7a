package com.entity.network.exploration;

import java.util.Map;

/**
 * Priority of a frontier node in best-first exploration. Higher scores expand first.
 */
@FunctionalInterface
public interface NodeScorer {

    double score(String nodeId, Map<String, Object> attributes);
}
