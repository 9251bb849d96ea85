package com.ssot.notify;

import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Normalized subscription filter.
 *
 * <p>A pattern takes exactly one of two forms:
 * <ul>
 *   <li>{@link Custom} - a caller-supplied predicate which is the sole matching decision.
 *       Structural fields do not exist on this form, so they cannot be combined by mistake.</li>
 *   <li>{@link Structural} - equality-or-wildcard tests on the event fields, an optional
 *       glob on the attribute name and relation-only endpoint constraints.</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>{@code
 * // every attribute of one entity
 * SubscriptionPattern.builder().entityId("cliente-123").build();
 *
 * // address fields of any entity
 * SubscriptionPattern.builder().attributeNamePattern("indirizzo_*").build();
 *
 * // numeric values above a threshold, whatever the entity
 * SubscriptionPattern.custom(e -> e.getNewValue() instanceof Number
 *     && ((Number) e.getNewValue()).doubleValue() > 100);
 * }</pre>
 *
 * @see PatternMatcher
 */
public abstract class SubscriptionPattern {

    /** Wildcard value for the string fields of a structural pattern. */
    public static final String WILDCARD = "*";

    private static final SubscriptionPattern ALL = new Structural(new Builder().anyType());

    private SubscriptionPattern() {
    }

    /**
     * Pattern of the legacy bare-callback subscription: every event type, every field wildcarded.
     */
    public static SubscriptionPattern all() {
        return ALL;
    }

    public static SubscriptionPattern custom(@Nonnull Predicate<ChangeEvent> predicate) {
        return new Custom(predicate);
    }

    /**
     * Starts a structural pattern. Every field defaults to its wildcard except the event type,
     * which defaults to {@link EventType#ENTITY}; call {@link Builder#anyType()} to widen it.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Predicate-only pattern.
     */
    public static final class Custom extends SubscriptionPattern {
        private final Predicate<ChangeEvent> predicate;

        private Custom(Predicate<ChangeEvent> predicate) {
            this.predicate = Objects.requireNonNull(predicate, "Custom predicate must not be null");
        }

        public Predicate<ChangeEvent> getPredicate() {
            return predicate;
        }

        @Override
        public String toString() {
            return "Custom{" + predicate + "}";
        }
    }

    /**
     * Field-by-field pattern. A {@code null} type or change type means "any";
     * {@code "*"} is the wildcard of the string fields.
     */
    public static final class Structural extends SubscriptionPattern {
        private final EventType type;
        private final String entityType;
        private final String entityId;
        private final String attributeName;
        private final ChangeType changeType;
        private final String relationType;
        private final String attributeNamePattern;
        private final String sourceEntityType;
        private final String targetEntityType;

        private Structural(Builder builder) {
            this.type = builder.type;
            this.entityType = builder.entityType;
            this.entityId = builder.entityId;
            this.attributeName = builder.attributeName;
            this.changeType = builder.changeType;
            this.relationType = builder.relationType;
            this.attributeNamePattern = builder.attributeNamePattern;
            this.sourceEntityType = builder.sourceEntityType;
            this.targetEntityType = builder.targetEntityType;
        }

        /**
         * @return the required event type, or {@code null} when every type matches
         */
        @Nullable
        public EventType getType() {
            return type;
        }

        public String getEntityType() {
            return entityType;
        }

        public String getEntityId() {
            return entityId;
        }

        public String getAttributeName() {
            return attributeName;
        }

        @Nullable
        public ChangeType getChangeType() {
            return changeType;
        }

        public String getRelationType() {
            return relationType;
        }

        @Nullable
        public String getAttributeNamePattern() {
            return attributeNamePattern;
        }

        @Nullable
        public String getSourceEntityType() {
            return sourceEntityType;
        }

        @Nullable
        public String getTargetEntityType() {
            return targetEntityType;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("Structural{type=")
                .append(type == null ? "all" : type.wireName())
                .append(", entityType=").append(entityType)
                .append(", entityId=").append(entityId)
                .append(", attributeName=").append(attributeName)
                .append(", changeType=").append(changeType == null ? WILDCARD : changeType.wireName())
                .append(", relationType=").append(relationType);
            if (attributeNamePattern != null) sb.append(", attributeNamePattern=").append(attributeNamePattern);
            if (sourceEntityType != null) sb.append(", sourceEntityType=").append(sourceEntityType);
            if (targetEntityType != null) sb.append(", targetEntityType=").append(targetEntityType);
            return sb.append('}').toString();
        }
    }

    /**
     * Builder for {@link Structural} patterns. Passing {@code null} or an empty string to a
     * string field removes its constraint.
     */
    public static final class Builder {
        private EventType type = EventType.ENTITY;
        private String entityType = WILDCARD;
        private String entityId = WILDCARD;
        private String attributeName = WILDCARD;
        private ChangeType changeType;
        private String relationType = WILDCARD;
        private String attributeNamePattern;
        private String sourceEntityType;
        private String targetEntityType;

        private Builder() {
        }

        public Builder type(@Nullable EventType type) {
            this.type = type;
            return this;
        }

        /**
         * Matches entity, relation and schema events alike.
         */
        public Builder anyType() {
            this.type = null;
            return this;
        }

        public Builder entityType(@Nullable String entityType) {
            this.entityType = orWildcard(entityType);
            return this;
        }

        public Builder entityId(@Nullable String entityId) {
            this.entityId = orWildcard(entityId);
            return this;
        }

        public Builder attributeName(@Nullable String attributeName) {
            this.attributeName = orWildcard(attributeName);
            return this;
        }

        public Builder changeType(@Nullable ChangeType changeType) {
            this.changeType = changeType;
            return this;
        }

        public Builder relationType(@Nullable String relationType) {
            this.relationType = orWildcard(relationType);
            return this;
        }

        /**
         * Case-insensitive glob on the attribute name: {@code *} matches any run of
         * characters, {@code ?} exactly one.
         */
        public Builder attributeNamePattern(@Nullable String attributeNamePattern) {
            this.attributeNamePattern = orNull(attributeNamePattern);
            return this;
        }

        public Builder sourceEntityType(@Nullable String sourceEntityType) {
            this.sourceEntityType = orNull(sourceEntityType);
            return this;
        }

        public Builder targetEntityType(@Nullable String targetEntityType) {
            this.targetEntityType = orNull(targetEntityType);
            return this;
        }

        public SubscriptionPattern build() {
            return new Structural(this);
        }

        private static String orWildcard(String value) {
            return value == null || value.isEmpty() ? WILDCARD : value;
        }

        // Empty means no constraint
        private static String orNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
