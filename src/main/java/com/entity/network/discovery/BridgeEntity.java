package com.entity.network.discovery;

import com.entity.network.graph.RelationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A non-query entity reached from two or more query entities.
 *
 * @param nodeId          the entity id
 * @param connectsTo      the query entities it links, in query order
 * @param connectionTypes relationship types on the path from each linked query entity
 * @param distances       hops from each linked query entity
 * @param bridgeScore     importance; higher for more links and shorter paths
 * @param bridgeType      kind of the relationships involved
 */
public record BridgeEntity(String nodeId, Set<String> connectsTo, Map<String, List<String>> connectionTypes,
                           Map<String, Integer> distances, double bridgeScore, RelationKind bridgeType) {

    public BridgeEntity {
        connectsTo = Collections.unmodifiableSet(new LinkedHashSet<>(connectsTo));
        Map<String, List<String>> types = new LinkedHashMap<>();
        connectionTypes.forEach((query, list) -> types.put(query, List.copyOf(list)));
        connectionTypes = Collections.unmodifiableMap(types);
        distances = Collections.unmodifiableMap(new LinkedHashMap<>(distances));
    }
}
