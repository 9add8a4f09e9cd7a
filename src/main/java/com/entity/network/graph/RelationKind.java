package com.entity.network.graph;

import java.util.Collection;

/**
 * Coarse classification of relationships. Kinship relations are tagged {@code kinship};
 * every other relation type counts as an association.
 */
public enum RelationKind {
    KINSHIP("kinship"),
    ASSOCIATION("association"),
    MIXED("mixed");

    private final String label;

    RelationKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Classifies a single relation type tag.
     */
    public static RelationKind of(String relationType) {
        return EdgeAttributes.isKinship(relationType) ? KINSHIP : ASSOCIATION;
    }

    /**
     * Classifies a group of relation type tags. An empty group counts as association.
     */
    public static RelationKind ofAll(Collection<String> relationTypes) {
        boolean kinship = false;
        boolean association = false;
        for (String type : relationTypes) {
            if (EdgeAttributes.isKinship(type)) {
                kinship = true;
            } else {
                association = true;
            }
        }
        if (kinship && association) {
            return MIXED;
        }
        return kinship ? KINSHIP : ASSOCIATION;
    }
}
