package com.entity.network.discovery;

import com.entity.network.graph.RelationKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of the bridge entities found by a discovery.
 */
public record BridgeStatistics(int total, Map<RelationKind, Integer> byType,
                               double averageConnections, int maxConnections) {

    static BridgeStatistics of(Collection<BridgeEntity> bridges) {
        Map<RelationKind, Integer> byType = new EnumMap<>(RelationKind.class);
        for (RelationKind kind : RelationKind.values()) {
            byType.put(kind, 0);
        }
        int totalConnections = 0;
        int max = 0;
        for (BridgeEntity bridge : bridges) {
            byType.merge(bridge.bridgeType(), 1, Integer::sum);
            totalConnections += bridge.connectsTo().size();
            max = Math.max(max, bridge.connectsTo().size());
        }
        double average = bridges.isEmpty() ? 0.0 : (double) totalConnections / bridges.size();
        return new BridgeStatistics(bridges.size(), Collections.unmodifiableMap(byType), average, max);
    }
}
