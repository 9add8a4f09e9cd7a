package com.entity.network.discovery;

import java.util.List;

/**
 * Query entities joined by at least one relationship.
 *
 * @param from          first query entity, in query order
 * @param to            second query entity
 * @param relationships every included relationship between them
 * @param strength      relationship count plus 0.5 per additional distinct type
 */
public record DirectConnection(String from, String to, List<RelationshipDetail> relationships, double strength) {

    public DirectConnection {
        relationships = List.copyOf(relationships);
    }

    public boolean connects(String a, String b) {
        return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
    }
}
