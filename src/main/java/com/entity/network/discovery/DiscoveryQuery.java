package com.entity.network.discovery;

import com.entity.network.exploration.InvalidBoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A multi-entity discovery request.
 */
public class DiscoveryQuery {

    private static final int DEFAULT_MAX_HOP_DISTANCE = 1;

    private final List<String> queryEntities;
    private final int maxHopDistance;
    private final Set<String> includeRelationTypes;
    private final DiscoveryFilters filters;
    private final int maxBridgeEntities;
    private final boolean includeDiscoveryPaths;

    private DiscoveryQuery(Builder builder) {
        this.queryEntities = List.copyOf(builder.queryEntities);
        this.maxHopDistance = builder.maxHopDistance;
        this.includeRelationTypes = builder.includeRelationTypes;
        this.filters = builder.filters;
        this.maxBridgeEntities = builder.maxBridgeEntities;
        this.includeDiscoveryPaths = builder.includeDiscoveryPaths;
    }

    /**
     * Returns the distinct query entity ids in the order first given.
     */
    public List<String> getQueryEntities() {
        return queryEntities;
    }

    /**
     * Hops explored around each query entity; 0 looks at direct connections only.
     */
    public int getMaxHopDistance() {
        return maxHopDistance;
    }

    /**
     * Relationship types to follow; empty means every type.
     */
    public Set<String> getIncludeRelationTypes() {
        return includeRelationTypes;
    }

    public DiscoveryFilters getFilters() {
        return filters;
    }

    /**
     * Cap on returned bridge entities; 0 returns them all.
     */
    public int getMaxBridgeEntities() {
        return maxBridgeEntities;
    }

    public boolean isIncludeDiscoveryPaths() {
        return includeDiscoveryPaths;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder of(String... queryEntities) {
        return new Builder().queryEntities(List.of(queryEntities));
    }

    public static class Builder {
        private final Set<String> queryEntities = new LinkedHashSet<>();
        private int maxHopDistance = DEFAULT_MAX_HOP_DISTANCE;
        private Set<String> includeRelationTypes = Set.of();
        private DiscoveryFilters filters = DiscoveryFilters.none();
        private int maxBridgeEntities = 0;
        private boolean includeDiscoveryPaths = false;

        public Builder queryEntities(Collection<String> ids) {
            for (String id : ids) {
                queryEntities.add(Objects.requireNonNull(id, "query entity id must not be null"));
            }
            return this;
        }

        public Builder queryEntity(String id) {
            return queryEntities(List.of(id));
        }

        public Builder maxHopDistance(int maxHopDistance) {
            this.maxHopDistance = InvalidBoundException.requireNonNegative("maxHopDistance", maxHopDistance);
            return this;
        }

        public Builder includeRelationTypes(Set<String> includeRelationTypes) {
            this.includeRelationTypes = includeRelationTypes != null ? Set.copyOf(includeRelationTypes) : Set.of();
            return this;
        }

        public Builder filters(DiscoveryFilters filters) {
            this.filters = filters != null ? filters : DiscoveryFilters.none();
            return this;
        }

        public Builder maxBridgeEntities(int maxBridgeEntities) {
            this.maxBridgeEntities = InvalidBoundException.requireNonNegative("maxBridgeEntities", maxBridgeEntities);
            return this;
        }

        public Builder includeDiscoveryPaths(boolean includeDiscoveryPaths) {
            this.includeDiscoveryPaths = includeDiscoveryPaths;
            return this;
        }

        public DiscoveryQuery build() {
            return new DiscoveryQuery(this);
        }
    }

    @Override
    public String toString() {
        return "DiscoveryQuery{" +
                "queryEntities=" + new ArrayList<>(queryEntities) +
                ", maxHopDistance=" + maxHopDistance +
                ", includeRelationTypes=" + includeRelationTypes +
                ", maxBridgeEntities=" + maxBridgeEntities +
                '}';
    }
}
