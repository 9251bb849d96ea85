package com.ssot.broadcast;

import com.ssot.notify.ChangeEvent;
import com.ssot.notify.EventType;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Envelope sent to remote clients for one change:
 * <pre>{@code
 * {"type":"attributeChange","data":{"type":"entity","entityId":"cliente-123",...},"timestamp":"2024-01-15T10:00:00Z"}
 * }</pre>
 *
 * <p>The message type follows the event type: {@code attributeChange} for entity events,
 * {@code relationChange} for relation events and {@code schemaChange} for schema events.
 * Absent event fields are left out of {@code data}.
 */
public final class ChangeMessage {

    public static final String ATTRIBUTE_CHANGE = "attributeChange";
    public static final String RELATION_CHANGE = "relationChange";
    public static final String SCHEMA_CHANGE = "schemaChange";

    private final String type;
    private final Map<String, Object> data;
    private final Instant timestamp;

    private ChangeMessage(String type, Map<String, Object> data, Instant timestamp) {
        this.type = type;
        this.data = Collections.unmodifiableMap(data);
        this.timestamp = timestamp;
    }

    /**
     * @param event the delivered event
     * @param sentAt the time the message is built
     */
    public static ChangeMessage of(@Nonnull ChangeEvent event, @Nonnull Instant sentAt) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(sentAt, "sentAt");
        return new ChangeMessage(messageType(event.getType()), toData(event), sentAt);
    }

    static String messageType(EventType type) {
        if (type == EventType.RELATION) {
            return RELATION_CHANGE;
        }
        if (type == EventType.SCHEMA) {
            return SCHEMA_CHANGE;
        }
        return ATTRIBUTE_CHANGE;
    }

    private static Map<String, Object> toData(ChangeEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        put(data, "type", event.getType() == null ? null : event.getType().wireName());
        put(data, "entityType", event.getEntityType());
        put(data, "entityId", event.getEntityId());
        put(data, "attributeName", event.getAttributeName());
        put(data, "relationType", event.getRelationType());
        put(data, "sourceEntityType", event.getSourceEntityType());
        put(data, "targetEntityType", event.getTargetEntityType());
        put(data, "sourceEntityId", event.getSourceEntityId());
        put(data, "targetEntityId", event.getTargetEntityId());
        put(data, "changeType", event.getChangeType() == null ? null : event.getChangeType().wireName());
        put(data, "oldValue", event.getOldValue());
        put(data, "newValue", event.getNewValue());
        put(data, "timestamp", event.getTimestamp());
        put(data, "batchCount", event.getBatchCount());
        return data;
    }

    private static void put(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ChangeMessage{type=" + type + ", data=" + data + ", timestamp=" + timestamp + '}';
    }
}
