package com.ssot.broadcast;

import com.ssot.notify.ChangeEvent;
import com.ssot.notify.NotificationBus;
import com.ssot.notify.SubscriptionPattern;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an audit line for every entity change touching a sensitive attribute.
 *
 * <p>Attributes are selected by a glob on their name, {@value #DEFAULT_ATTRIBUTE_GLOB} by default.
 * Lines go to the {@value #AUDIT_LOGGER} logger so they can be routed apart from application logs.
 * Values are never written.
 */
public class SensitiveAttributeAudit implements AutoCloseable {

    public static final String DEFAULT_ATTRIBUTE_GLOB = "*password*";
    public static final String AUDIT_LOGGER = "audit.sensitive-attributes";

    private static final Logger AUDIT = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final NotificationBus bus;
    private final String attributeGlob;
    private final AtomicLong auditedChanges = new AtomicLong(0);

    private String subscriptionId;

    public SensitiveAttributeAudit(@Nonnull NotificationBus bus) {
        this(bus, DEFAULT_ATTRIBUTE_GLOB);
    }

    public SensitiveAttributeAudit(@Nonnull NotificationBus bus, @Nonnull String attributeGlob) {
        this.bus = Objects.requireNonNull(bus, "bus");
        if (attributeGlob == null || attributeGlob.isEmpty()) {
            throw new IllegalArgumentException("attributeGlob must not be empty");
        }
        this.attributeGlob = attributeGlob;
    }

    public synchronized void start() {
        if (subscriptionId != null) {
            return;
        }
        subscriptionId = bus.subscribe(
            SubscriptionPattern.builder().attributeNamePattern(attributeGlob).build(), this::audit);
    }

    private void audit(ChangeEvent event) {
        auditedChanges.incrementAndGet();
        AUDIT.info("{} of sensitive attribute {} on {} {}",
            event.getChangeType(), event.getAttributeName(), event.getEntityType(), event.getEntityId());
    }

    public long getAuditedChanges() {
        return auditedChanges.get();
    }

    public String getAttributeGlob() {
        return attributeGlob;
    }

    @Override
    public synchronized void close() {
        if (subscriptionId != null) {
            bus.unsubscribe(subscriptionId);
            subscriptionId = null;
        }
    }
}
