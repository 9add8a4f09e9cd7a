package com.entity.network.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Assembles a {@link Graph} from entity attributes and {@link Relationship} records loaded
 * by the data-access layer.
 *
 * <p>Each relationship becomes one edge carrying {@code type}, {@code label}, {@code code},
 * {@code distance} and {@code weight} attributes plus its free-form properties. Closer
 * relationships weigh more: weight = 1 / (distance + 1), or 1 when the distance is unknown.
 * Records repeating the same (source, target, type, code) are collapsed.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * Graph graph = new NetworkGraphBuilder(GraphMode.UNDIRECTED)
 *     .entity("1762", Map.of("name", "Wang Anshi"))
 *     .relationships(relationshipsFromDatabase)
 *     .build();
 * </pre>
 */
public class NetworkGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(NetworkGraphBuilder.class);

    private final GraphMode mode;
    private final Map<String, Map<String, Object>> entities = new LinkedHashMap<>();
    private final Set<Relationship> relationships = new LinkedHashSet<>();

    public NetworkGraphBuilder() {
        this(GraphMode.UNDIRECTED);
    }

    public NetworkGraphBuilder(GraphMode mode) {
        this.mode = mode;
    }

    /**
     * Registers an entity with its attributes. Repeated calls merge attributes.
     */
    public NetworkGraphBuilder entity(String entityId, Map<String, Object> attributes) {
        entities.computeIfAbsent(entityId, id -> new LinkedHashMap<>()).putAll(attributes);
        return this;
    }

    public NetworkGraphBuilder relationship(Relationship relationship) {
        relationships.add(relationship);
        return this;
    }

    public NetworkGraphBuilder relationships(Collection<Relationship> batch) {
        relationships.addAll(batch);
        return this;
    }

    /**
     * Builds a fresh graph. The builder can be reused; every call returns a new instance.
     */
    public Graph build() {
        Graph graph = new Graph(mode);
        entities.forEach(graph::mergeNode);

        int skipped = 0;
        for (Relationship relationship : relationships) {
            if (relationship.getSourceEntityId().equals(relationship.getTargetEntityId())) {
                skipped++;
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>(relationship.getProperties());
            attributes.put(EdgeAttributes.TYPE, relationship.getRelationshipType());
            attributes.put(EdgeAttributes.WEIGHT, weightOf(relationship.getDistance()));
            if (relationship.getLabel() != null) {
                attributes.put(EdgeAttributes.LABEL, relationship.getLabel());
            }
            if (relationship.getCode() != null) {
                attributes.put(EdgeAttributes.CODE, relationship.getCode());
            }
            if (relationship.getDistance() != null) {
                attributes.put(EdgeAttributes.DISTANCE, relationship.getDistance());
            }
            graph.addEdgeWithKey(edgeKey(relationship), relationship.getSourceEntityId(),
                    relationship.getTargetEntityId(), attributes);
        }

        if (skipped > 0) {
            log.debug("Skipped {} self-referencing relationships", skipped);
        }
        log.debug("Built graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    static double weightOf(Integer distance) {
        return distance != null && distance >= 0 ? 1.0 / (distance + 1) : 1.0;
    }

    private static String edgeKey(Relationship relationship) {
        return relationship.getSourceEntityId() + "->" + relationship.getTargetEntityId()
                + "#" + relationship.getRelationshipType()
                + (relationship.getCode() != null ? ":" + relationship.getCode() : "");
    }
}
