package com.entity.network.exploration;

import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.GraphEdge;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a traversal may follow an edge. Must be pure and deterministic.
 */
@FunctionalInterface
public interface EdgeFilter {

    boolean test(GraphEdge edge);

    default EdgeFilter and(EdgeFilter other) {
        return edge -> test(edge) && other.test(edge);
    }

    /**
     * Accepts edges whose relationship type is in the allow-list, ignoring case. An empty list accepts all.
     */
    static EdgeFilter relationTypes(Collection<String> relationTypes) {
        if (relationTypes == null || relationTypes.isEmpty()) {
            return edge -> true;
        }
        Set<String> allowed = relationTypes.stream()
                .map(EdgeAttributes::normalizeType)
                .collect(Collectors.toUnmodifiableSet());
        return edge -> edge.getRelationType()
                .map(EdgeAttributes::normalizeType)
                .map(allowed::contains)
                .orElse(false);
    }

    /**
     * Accepts edges whose weight meets or exceeds the threshold.
     */
    static EdgeFilter minWeight(double threshold) {
        return edge -> edge.getWeight() >= threshold;
    }
}
