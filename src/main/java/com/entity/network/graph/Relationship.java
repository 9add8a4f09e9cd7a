package com.entity.network.graph;

import java.util.Map;
import java.util.Objects;

/**
 * Typed relationship between two entities as handed over by the data-access layer.
 *
 * The type tag is the coarse relation family ({@code kinship}, {@code association}, ...);
 * label and code carry the fine-grained relation as stored in the source database.
 */
public final class Relationship {

    private final String sourceEntityId;
    private final String targetEntityId;
    private final String relationshipType;
    private final String label;
    private final Integer code;
    private final Integer distance;
    private final Map<String, Object> properties;

    private Relationship(Builder builder) {
        this.sourceEntityId = Objects.requireNonNull(builder.sourceEntityId, "sourceEntityId is required");
        this.targetEntityId = Objects.requireNonNull(builder.targetEntityId, "targetEntityId is required");
        this.relationshipType = Objects.requireNonNull(builder.relationshipType, "relationshipType is required");
        this.label = builder.label;
        this.code = builder.code;
        this.distance = builder.distance;
        this.properties = builder.properties != null ? Map.copyOf(builder.properties) : Map.of();
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public String getLabel() {
        return label;
    }

    public Integer getCode() {
        return code;
    }

    /**
     * Hop distance of this relationship from the entities it was loaded for, if known.
     */
    public Integer getDistance() {
        return distance;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(sourceEntityId, that.sourceEntityId)
                && Objects.equals(targetEntityId, that.targetEntityId)
                && Objects.equals(relationshipType, that.relationshipType)
                && Objects.equals(code, that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceEntityId, targetEntityId, relationshipType, code);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "sourceEntityId='" + sourceEntityId + '\'' +
                ", targetEntityId='" + targetEntityId + '\'' +
                ", type='" + relationshipType + '\'' +
                ", label='" + label + '\'' +
                ", code=" + code +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceEntityId;
        private String targetEntityId;
        private String relationshipType;
        private String label;
        private Integer code;
        private Integer distance;
        private Map<String, Object> properties;

        public Builder sourceEntityId(String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder code(Integer code) {
            this.code = code;
            return this;
        }

        public Builder distance(Integer distance) {
            this.distance = distance;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
