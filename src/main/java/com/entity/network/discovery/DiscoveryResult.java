package com.entity.network.discovery;

import com.entity.network.graph.GraphEdge;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable outcome of a multi-entity discovery.
 */
public final class DiscoveryResult {

    private final List<String> queryEntities;
    private final Map<String, DiscoveredEntity> entities;
    private final List<GraphEdge> edges;
    private final List<DirectConnection> directConnections;
    private final List<BridgeEntity> bridgeEntities;
    private final BridgeStatistics bridgeStatistics;
    private final List<Pathway> pathways;
    private final NetworkMetrics metrics;
    private final boolean truncated;
    private final Duration queryTime;

    private DiscoveryResult(Builder builder) {
        this.queryEntities = List.copyOf(builder.queryEntities);
        this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entities));
        this.edges = List.copyOf(builder.edges);
        this.directConnections = List.copyOf(builder.directConnections);
        this.bridgeEntities = List.copyOf(builder.bridgeEntities);
        this.bridgeStatistics = builder.bridgeStatistics;
        this.pathways = List.copyOf(builder.pathways);
        this.metrics = builder.metrics;
        this.truncated = builder.truncated;
        this.queryTime = builder.queryTime;
    }

    public List<String> getQueryEntities() {
        return queryEntities;
    }

    /**
     * Returns every entity of the discovered network, query entities included, in discovery order.
     */
    public Map<String, DiscoveredEntity> getEntities() {
        return entities;
    }

    public Optional<DiscoveredEntity> getEntity(String nodeId) {
        return Optional.ofNullable(entities.get(nodeId));
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public List<DirectConnection> getDirectConnections() {
        return directConnections;
    }

    public List<BridgeEntity> getBridgeEntities() {
        return bridgeEntities;
    }

    /**
     * Statistics over every detected bridge, before any top-N cut.
     */
    public BridgeStatistics getBridgeStatistics() {
        return bridgeStatistics;
    }

    public List<Pathway> getPathways() {
        return pathways;
    }

    public NetworkMetrics getMetrics() {
        return metrics;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public Duration getQueryTime() {
        return queryTime;
    }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private List<String> queryEntities = List.of();
        private Map<String, DiscoveredEntity> entities = Map.of();
        private List<GraphEdge> edges = List.of();
        private List<DirectConnection> directConnections = List.of();
        private List<BridgeEntity> bridgeEntities = List.of();
        private BridgeStatistics bridgeStatistics = BridgeStatistics.of(List.of());
        private List<Pathway> pathways = List.of();
        private NetworkMetrics metrics = NetworkMetrics.empty();
        private boolean truncated;
        private Duration queryTime = Duration.ZERO;

        Builder queryEntities(List<String> queryEntities) {
            this.queryEntities = queryEntities;
            return this;
        }

        Builder entities(Map<String, DiscoveredEntity> entities) {
            this.entities = entities;
            return this;
        }

        Builder edges(List<GraphEdge> edges) {
            this.edges = edges;
            return this;
        }

        Builder directConnections(List<DirectConnection> directConnections) {
            this.directConnections = directConnections;
            return this;
        }

        Builder bridgeEntities(List<BridgeEntity> bridgeEntities) {
            this.bridgeEntities = bridgeEntities;
            return this;
        }

        Builder bridgeStatistics(BridgeStatistics bridgeStatistics) {
            this.bridgeStatistics = bridgeStatistics;
            return this;
        }

        Builder pathways(List<Pathway> pathways) {
            this.pathways = pathways;
            return this;
        }

        Builder metrics(NetworkMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder truncated(boolean truncated) {
            this.truncated = truncated;
            return this;
        }

        Builder queryTime(Duration queryTime) {
            this.queryTime = queryTime;
            return this;
        }

        DiscoveryResult build() {
            return new DiscoveryResult(this);
        }
    }

    @Override
    public String toString() {
        return "DiscoveryResult{" +
                "queryEntities=" + queryEntities +
                ", entities=" + entities.size() +
                ", edges=" + edges.size() +
                ", directConnections=" + directConnections.size() +
                ", bridges=" + bridgeEntities.size() +
                ", pathways=" + pathways.size() +
                ", truncated=" + truncated +
                '}';
    }
}
