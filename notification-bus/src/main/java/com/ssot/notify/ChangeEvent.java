package com.ssot.notify;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One mutation fact flowing through the {@link NotificationBus}.
 *
 * <p>Instances are immutable. Producers usually fill only the fields they know
 * (an entity id, an attribute name and the new value) and let the bus complete
 * the rest when the event is published:
 * <ul>
 *   <li>{@code timestamp} is taken from the bus clock unless already set</li>
 *   <li>{@code changeType} is inferred from the presence of the old and new values</li>
 *   <li>{@code type} becomes {@link EventType#RELATION} when a relation type is present,
 *       {@link EventType#ENTITY} otherwise</li>
 * </ul>
 *
 * <p>A {@code null} field means "absent". {@code batchCount} is only present on events
 * that were coalesced in a batch window and reports how many raw events were merged.
 *
 * <pre>{@code
 * ChangeEvent event = ChangeEvent.builder()
 *     .entityType("Cliente")
 *     .entityId("cliente-123")
 *     .attributeName("email")
 *     .newValue("mario@rossi.it")
 *     .build();
 * }</pre>
 */
public final class ChangeEvent {

    private final EventType type;
    private final String entityType;
    private final String entityId;
    private final String attributeName;
    private final String relationType;
    private final String sourceEntityType;
    private final String targetEntityType;
    private final String sourceEntityId;
    private final String targetEntityId;
    private final ChangeType changeType;
    private final Object oldValue;
    private final Object newValue;
    private final Long timestamp;
    private final Integer batchCount;

    private ChangeEvent(Builder builder) {
        this.type = builder.type;
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.attributeName = builder.attributeName;
        this.relationType = builder.relationType;
        this.sourceEntityType = builder.sourceEntityType;
        this.targetEntityType = builder.targetEntityType;
        this.sourceEntityId = builder.sourceEntityId;
        this.targetEntityId = builder.targetEntityId;
        this.changeType = builder.changeType;
        this.oldValue = builder.oldValue;
        this.newValue = builder.newValue;
        this.timestamp = builder.timestamp;
        this.batchCount = builder.batchCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this event
     */
    public Builder toBuilder() {
        return new Builder()
            .type(type)
            .entityType(entityType)
            .entityId(entityId)
            .attributeName(attributeName)
            .relationType(relationType)
            .sourceEntityType(sourceEntityType)
            .targetEntityType(targetEntityType)
            .sourceEntityId(sourceEntityId)
            .targetEntityId(targetEntityId)
            .changeType(changeType)
            .oldValue(oldValue)
            .newValue(newValue)
            .timestamp(timestamp)
            .batchCount(batchCount);
    }

    /**
     * Infers the change type from the presence of the old and new values.
     *
     * @return {@code CREATE} when only the new value is present, {@code DELETE} when only
     *         the old value is present, {@code UPDATE} otherwise (including when neither is)
     */
    public ChangeType inferChangeType() {
        if (newValue != null && oldValue == null) {
            return ChangeType.CREATE;
        }
        if (newValue == null && oldValue != null) {
            return ChangeType.DELETE;
        }
        return ChangeType.UPDATE;
    }

    /**
     * Completes the fields a producer may leave out. Fields already set are kept.
     *
     * @param nowMillis timestamp to use when none was supplied
     * @return an event whose {@code type}, {@code changeType} and {@code timestamp} are set
     */
    public ChangeEvent enrich(long nowMillis) {
        if (isEnriched()) {
            return this;
        }
        return toBuilder()
            .timestamp(timestamp != null ? timestamp : nowMillis)
            .changeType(changeType != null ? changeType : inferChangeType())
            .type(type != null ? type : (relationType != null ? EventType.RELATION : EventType.ENTITY))
            .build();
    }

    public boolean isEnriched() {
        return type != null && changeType != null && timestamp != null;
    }

    /**
     * Shallow merge used by batching: every field present on {@code later} overwrites
     * the same field of this event.
     *
     * @param later the event that arrived after this one
     * @return the merged event, with {@code batchCount} unchanged
     */
    ChangeEvent mergedWith(@Nonnull ChangeEvent later) {
        Builder merged = toBuilder();
        if (later.type != null) merged.type(later.type);
        if (later.entityType != null) merged.entityType(later.entityType);
        if (later.entityId != null) merged.entityId(later.entityId);
        if (later.attributeName != null) merged.attributeName(later.attributeName);
        if (later.relationType != null) merged.relationType(later.relationType);
        if (later.sourceEntityType != null) merged.sourceEntityType(later.sourceEntityType);
        if (later.targetEntityType != null) merged.targetEntityType(later.targetEntityType);
        if (later.sourceEntityId != null) merged.sourceEntityId(later.sourceEntityId);
        if (later.targetEntityId != null) merged.targetEntityId(later.targetEntityId);
        if (later.changeType != null) merged.changeType(later.changeType);
        if (later.oldValue != null) merged.oldValue(later.oldValue);
        if (later.newValue != null) merged.newValue(later.newValue);
        if (later.timestamp != null) merged.timestamp(later.timestamp);
        return merged.build();
    }

    ChangeEvent withBatchCount(int count) {
        return toBuilder().batchCount(count).build();
    }

    @Nullable
    public EventType getType() {
        return type;
    }

    @Nullable
    public String getEntityType() {
        return entityType;
    }

    @Nullable
    public String getEntityId() {
        return entityId;
    }

    @Nullable
    public String getAttributeName() {
        return attributeName;
    }

    @Nullable
    public String getRelationType() {
        return relationType;
    }

    @Nullable
    public String getSourceEntityType() {
        return sourceEntityType;
    }

    @Nullable
    public String getTargetEntityType() {
        return targetEntityType;
    }

    @Nullable
    public String getSourceEntityId() {
        return sourceEntityId;
    }

    @Nullable
    public String getTargetEntityId() {
        return targetEntityId;
    }

    @Nullable
    public ChangeType getChangeType() {
        return changeType;
    }

    @Nullable
    public Object getOldValue() {
        return oldValue;
    }

    @Nullable
    public Object getNewValue() {
        return newValue;
    }

    /**
     * @return epoch millis set at enrichment time, or {@code null} before publication
     */
    @Nullable
    public Long getTimestamp() {
        return timestamp;
    }

    /**
     * @return number of raw events merged into this one, or {@code null} if it was never batched
     */
    @Nullable
    public Integer getBatchCount() {
        return batchCount;
    }

    public boolean isBatched() {
        return batchCount != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChangeEvent that = (ChangeEvent) o;
        return type == that.type
            && changeType == that.changeType
            && Objects.equals(entityType, that.entityType)
            && Objects.equals(entityId, that.entityId)
            && Objects.equals(attributeName, that.attributeName)
            && Objects.equals(relationType, that.relationType)
            && Objects.equals(sourceEntityType, that.sourceEntityType)
            && Objects.equals(targetEntityType, that.targetEntityType)
            && Objects.equals(sourceEntityId, that.sourceEntityId)
            && Objects.equals(targetEntityId, that.targetEntityId)
            && Objects.equals(oldValue, that.oldValue)
            && Objects.equals(newValue, that.newValue)
            && Objects.equals(timestamp, that.timestamp)
            && Objects.equals(batchCount, that.batchCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, entityType, entityId, attributeName, relationType, sourceEntityType,
            targetEntityType, sourceEntityId, targetEntityId, changeType, oldValue, newValue, timestamp, batchCount);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ChangeEvent{type=").append(type);
        if (entityType != null) sb.append(", entityType=").append(entityType);
        if (entityId != null) sb.append(", entityId=").append(entityId);
        if (attributeName != null) sb.append(", attributeName=").append(attributeName);
        if (relationType != null) sb.append(", relationType=").append(relationType);
        sb.append(", changeType=").append(changeType);
        if (batchCount != null) sb.append(", batchCount=").append(batchCount);
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link ChangeEvent}. Every field is optional.
     */
    public static final class Builder {
        private EventType type;
        private String entityType;
        private String entityId;
        private String attributeName;
        private String relationType;
        private String sourceEntityType;
        private String targetEntityType;
        private String sourceEntityId;
        private String targetEntityId;
        private ChangeType changeType;
        private Object oldValue;
        private Object newValue;
        private Long timestamp;
        private Integer batchCount;

        private Builder() {
        }

        public Builder type(@Nullable EventType type) {
            this.type = type;
            return this;
        }

        public Builder entityType(@Nullable String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(@Nullable String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder attributeName(@Nullable String attributeName) {
            this.attributeName = attributeName;
            return this;
        }

        public Builder relationType(@Nullable String relationType) {
            this.relationType = relationType;
            return this;
        }

        public Builder sourceEntityType(@Nullable String sourceEntityType) {
            this.sourceEntityType = sourceEntityType;
            return this;
        }

        public Builder targetEntityType(@Nullable String targetEntityType) {
            this.targetEntityType = targetEntityType;
            return this;
        }

        public Builder sourceEntityId(@Nullable String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(@Nullable String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder changeType(@Nullable ChangeType changeType) {
            this.changeType = changeType;
            return this;
        }

        public Builder oldValue(@Nullable Object oldValue) {
            this.oldValue = oldValue;
            return this;
        }

        public Builder newValue(@Nullable Object newValue) {
            this.newValue = newValue;
            return this;
        }

        public Builder timestamp(@Nullable Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        Builder batchCount(@Nullable Integer batchCount) {
            this.batchCount = batchCount;
            return this;
        }

        public ChangeEvent build() {
            return new ChangeEvent(this);
        }
    }
}
