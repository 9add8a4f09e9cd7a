package com.entity.network.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An edge of a {@link Graph}: an ordered (source, target) pair with an attribute map.
 *
 * Instances are immutable; merging attributes into an edge replaces the instance held by
 * the graph. Equality is by key.
 */
public final class GraphEdge {

    private final String key;
    private final String source;
    private final String target;
    private final boolean directed;
    private final Map<String, Object> attributes;

    GraphEdge(String key, String source, String target, boolean directed, Map<String, Object> attributes) {
        this.key = Objects.requireNonNull(key, "key is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.target = Objects.requireNonNull(target, "target is required");
        this.directed = directed;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public String getKey() {
        return key;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public boolean isDirected() {
        return directed;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<String> getRelationType() {
        return EdgeAttributes.relationType(attributes);
    }

    public double getWeight() {
        return EdgeAttributes.weight(attributes);
    }

    public boolean isKinship() {
        return getRelationType().map(EdgeAttributes::isKinship).orElse(false);
    }

    /**
     * Returns the endpoint opposite to {@code nodeId}.
     */
    public String opposite(String nodeId) {
        return source.equals(nodeId) ? target : source;
    }

    /**
     * Returns whether this edge joins the two nodes, in either orientation.
     */
    public boolean connects(String a, String b) {
        return (source.equals(a) && target.equals(b)) || (source.equals(b) && target.equals(a));
    }

    /**
     * Returns whether a traversal standing on {@code nodeId} may cross this edge.
     */
    public boolean traversableFrom(String nodeId, TraversalDirection direction) {
        if (!directed || direction == TraversalDirection.ALL) {
            return true;
        }
        return direction == TraversalDirection.FORWARD ? source.equals(nodeId) : target.equals(nodeId);
    }

    GraphEdge withMergedAttributes(Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        if (incoming != null) {
            merged.putAll(incoming);
        }
        return new GraphEdge(key, source, target, directed, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return "GraphEdge{" +
                "key='" + key + '\'' +
                ", source='" + source + '\'' +
                ", target='" + target + '\'' +
                ", directed=" + directed +
                ", type=" + getRelationType().orElse(null) +
                '}';
    }
}
