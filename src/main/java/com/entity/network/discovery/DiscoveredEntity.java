package com.entity.network.discovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An entity present in a discovered network.
 *
 * @param nodeId        the entity id
 * @param distance      fewest hops to any query entity, 0 for query entities
 * @param reachedFrom   query entities whose traversal reached it, in query order
 * @param distances     hops from each query entity in {@code reachedFrom}
 * @param discoveryPath path from the nearest query entity, empty unless requested
 * @param queryEntity   whether the entity is one of the query entities
 */
public record DiscoveredEntity(String nodeId, int distance, Set<String> reachedFrom,
                               Map<String, Integer> distances, List<String> discoveryPath,
                               boolean queryEntity) {

    public DiscoveredEntity {
        reachedFrom = Collections.unmodifiableSet(new LinkedHashSet<>(reachedFrom));
        distances = Collections.unmodifiableMap(new LinkedHashMap<>(distances));
        discoveryPath = List.copyOf(discoveryPath);
    }
}
