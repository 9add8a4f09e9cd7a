package com.entity.network.graph;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known edge attribute keys and typed accessors for them.
 * All other attributes are opaque to the engine.
 */
public final class EdgeAttributes {

    public static final String TYPE = "type";
    public static final String WEIGHT = "weight";
    public static final String LABEL = "label";
    public static final String CODE = "code";
    public static final String DISTANCE = "distance";

    public static final String KINSHIP = "kinship";
    public static final String ASSOCIATION = "association";

    // Older data loaders tag the relation under one of these keys
    private static final String[] TYPE_FALLBACKS = {"edgeType", "relationType"};

    private static final double DEFAULT_WEIGHT = 1.0;

    private EdgeAttributes() {
    }

    /**
     * Returns the relationship-type tag of an edge, if any.
     */
    public static Optional<String> relationType(Map<String, Object> attributes) {
        if (attributes == null) {
            return Optional.empty();
        }
        Object type = attributes.get(TYPE);
        for (int i = 0; type == null && i < TYPE_FALLBACKS.length; i++) {
            type = attributes.get(TYPE_FALLBACKS[i]);
        }
        return Optional.ofNullable(type).map(Object::toString);
    }

    /**
     * Returns the numeric weight of an edge, 1.0 when absent or not numeric.
     */
    public static double weight(Map<String, Object> attributes) {
        return number(attributes, WEIGHT).orElse(DEFAULT_WEIGHT);
    }

    /**
     * Returns a numeric attribute as a double.
     */
    public static Optional<Double> number(Map<String, Object> attributes, String key) {
        if (attributes == null) {
            return Optional.empty();
        }
        Object value = attributes.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        return Optional.empty();
    }

    /**
     * Returns a string attribute, converting non-string values with {@code toString()}.
     */
    public static Optional<String> text(Map<String, Object> attributes, String key) {
        if (attributes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(attributes.get(key)).map(Object::toString);
    }

    /**
     * Canonical form used whenever relation types are compared. Tags match case-insensitively.
     */
    public static String normalizeType(String relationType) {
        return relationType == null ? null : relationType.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isKinship(String relationType) {
        return KINSHIP.equals(normalizeType(relationType));
    }
}
