package com.entity.network.discovery;

import com.entity.network.exploration.NodeFilter;
import com.entity.network.graph.EdgeAttributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node restrictions for a discovery. A node passes when it is not excluded, every ranged
 * attribute is numeric and inside its range, every constrained attribute holds an allowed
 * value, and the custom filter accepts it. Nodes lacking a constrained attribute are rejected.
 * Query entities are never subject to these filters.
 */
public final class DiscoveryFilters {

    /**
     * Inclusive numeric range; a null bound is open.
     */
    public record Range(Double min, Double max) {
        public Range {
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
            }
        }

        boolean contains(double value) {
            return (min == null || value >= min) && (max == null || value <= max);
        }
    }

    private static final DiscoveryFilters NONE = builder().build();

    private final Set<String> excludedIds;
    private final Map<String, Range> numericRanges;
    private final Map<String, Set<Object>> allowedValues;
    private final NodeFilter customFilter;

    private DiscoveryFilters(Builder builder) {
        this.excludedIds = Set.copyOf(builder.excludedIds);
        this.numericRanges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.numericRanges));
        this.allowedValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.allowedValues));
        this.customFilter = builder.customFilter;
    }

    public static DiscoveryFilters none() {
        return NONE;
    }

    public Set<String> getExcludedIds() {
        return excludedIds;
    }

    public Map<String, Range> getNumericRanges() {
        return numericRanges;
    }

    public Map<String, Set<Object>> getAllowedValues() {
        return allowedValues;
    }

    public NodeFilter getCustomFilter() {
        return customFilter;
    }

    public boolean isEmpty() {
        return excludedIds.isEmpty() && numericRanges.isEmpty() && allowedValues.isEmpty() && customFilter == null;
    }

    public boolean accepts(String nodeId, Map<String, Object> attributes) {
        if (excludedIds.contains(nodeId)) {
            return false;
        }
        for (Map.Entry<String, Range> range : numericRanges.entrySet()) {
            boolean inRange = EdgeAttributes.number(attributes, range.getKey())
                    .map(value -> range.getValue().contains(value))
                    .orElse(false);
            if (!inRange) {
                return false;
            }
        }
        for (Map.Entry<String, Set<Object>> allowed : allowedValues.entrySet()) {
            Object value = attributes != null ? attributes.get(allowed.getKey()) : null;
            if (value == null || !allowed.getValue().contains(value)) {
                return false;
            }
        }
        return customFilter == null || customFilter.test(nodeId, attributes);
    }

    /**
     * Returns a node filter that lets the given query entities through unconditionally.
     */
    NodeFilter exemptingQueryEntities(Set<String> queryEntities) {
        return (nodeId, attributes) -> queryEntities.contains(nodeId) || accepts(nodeId, attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> excludedIds = new LinkedHashSet<>();
        private final Map<String, Range> numericRanges = new LinkedHashMap<>();
        private final Map<String, Set<Object>> allowedValues = new LinkedHashMap<>();
        private NodeFilter customFilter;

        public Builder exclude(String... nodeIds) {
            excludedIds.addAll(List.of(nodeIds));
            return this;
        }

        public Builder numericRange(String attribute, Double min, Double max) {
            numericRanges.put(attribute, new Range(min, max));
            return this;
        }

        public Builder allowedValues(String attribute, Set<?> values) {
            allowedValues.put(attribute, Set.copyOf(values));
            return this;
        }

        public Builder customFilter(NodeFilter customFilter) {
            this.customFilter = customFilter;
            return this;
        }

        public DiscoveryFilters build() {
            return new DiscoveryFilters(this);
        }
    }
}
