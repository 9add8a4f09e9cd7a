package com.entity.network.discovery;

import com.entity.network.graph.EdgeAttributes;
import com.entity.network.graph.GraphEdge;

/**
 * One relationship joining two query entities.
 *
 * @param relationType the relationship type tag, null when untyped
 * @param label        human-readable label, if any
 * @param code         relationship code, if any
 * @param direction    orientation relative to the (from, to) order of the connection
 * @param edgeKey      key of the underlying edge
 */
public record RelationshipDetail(String relationType, String label, Integer code,
                                 Direction direction, String edgeKey) {

    public enum Direction {
        FORWARD,
        REVERSE,
        MUTUAL
    }

    static RelationshipDetail of(GraphEdge edge, String from) {
        Direction direction;
        if (!edge.isDirected()) {
            direction = Direction.MUTUAL;
        } else {
            direction = edge.getSource().equals(from) ? Direction.FORWARD : Direction.REVERSE;
        }
        return new RelationshipDetail(
                edge.getRelationType().orElse(null),
                EdgeAttributes.text(edge.getAttributes(), EdgeAttributes.LABEL).orElse(null),
                EdgeAttributes.number(edge.getAttributes(), EdgeAttributes.CODE).map(Double::intValue).orElse(null),
                direction,
                edge.getKey());
    }
}
