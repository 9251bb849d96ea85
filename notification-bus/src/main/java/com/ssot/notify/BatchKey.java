package com.ssot.notify;

import java.util.Objects;

/**
 * Coalescing key of the batch window: {@code (type, entityId, attributeName)}.
 * A missing entity id becomes {@code "unknown"} and a missing attribute name {@code "all"}.
 */
final class BatchKey {

    static final String UNKNOWN_ENTITY = "unknown";
    static final String ALL_ATTRIBUTES = "all";

    private final EventType type;
    private final String entityId;
    private final String attributeName;

    private BatchKey(EventType type, String entityId, String attributeName) {
        this.type = type;
        this.entityId = entityId;
        this.attributeName = attributeName;
    }

    static BatchKey of(ChangeEvent event) {
        return new BatchKey(
            event.getType() != null ? event.getType() : EventType.ENTITY,
            event.getEntityId() != null ? event.getEntityId() : UNKNOWN_ENTITY,
            event.getAttributeName() != null ? event.getAttributeName() : ALL_ATTRIBUTES);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatchKey)) return false;
        BatchKey that = (BatchKey) o;
        return type == that.type
            && entityId.equals(that.entityId)
            && attributeName.equals(that.attributeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, entityId, attributeName);
    }

    @Override
    public String toString() {
        return type.wireName() + "_" + entityId + "_" + attributeName;
    }
}
