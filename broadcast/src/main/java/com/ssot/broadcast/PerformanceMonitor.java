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
 * Reports changes that are likely to weigh on performance: batches that coalesced more than
 * {@value #DEFAULT_BATCH_THRESHOLD} events, and changes to computed attributes (names starting
 * with {@value #COMPUTED_PREFIX}), which trigger recomputation chains.
 *
 * <p>Lines go to the {@value #PERFORMANCE_LOGGER} logger.
 */
public class PerformanceMonitor implements AutoCloseable {

    public static final int DEFAULT_BATCH_THRESHOLD = 5;
    public static final String COMPUTED_PREFIX = "computed_";
    public static final String PERFORMANCE_LOGGER = "performance.changes";

    private static final Logger PERFORMANCE = LoggerFactory.getLogger(PERFORMANCE_LOGGER);

    private final NotificationBus bus;
    private final int batchThreshold;
    private final AtomicLong largeBatches = new AtomicLong(0);
    private final AtomicLong computedChanges = new AtomicLong(0);

    private String subscriptionId;

    public PerformanceMonitor(@Nonnull NotificationBus bus) {
        this(bus, DEFAULT_BATCH_THRESHOLD);
    }

    /**
     * @param batchThreshold batches with more merged events than this are reported
     */
    public PerformanceMonitor(@Nonnull NotificationBus bus, int batchThreshold) {
        this.bus = Objects.requireNonNull(bus, "bus");
        if (batchThreshold < 1) {
            throw new IllegalArgumentException("batchThreshold must be positive");
        }
        this.batchThreshold = batchThreshold;
    }

    public synchronized void start() {
        if (subscriptionId != null) {
            return;
        }
        subscriptionId = bus.subscribe(SubscriptionPattern.custom(this::isCostly), this::report);
    }

    private boolean isCostly(ChangeEvent event) {
        return isLargeBatch(event) || isComputed(event);
    }

    private boolean isLargeBatch(ChangeEvent event) {
        return event.getBatchCount() != null && event.getBatchCount() > batchThreshold;
    }

    private static boolean isComputed(ChangeEvent event) {
        return event.getAttributeName() != null && event.getAttributeName().startsWith(COMPUTED_PREFIX);
    }

    private void report(ChangeEvent event) {
        if (isLargeBatch(event)) {
            largeBatches.incrementAndGet();
        }
        if (isComputed(event)) {
            computedChanges.incrementAndGet();
        }
        PERFORMANCE.info("Costly change of {} on {}: {} merged event(s)",
            event.getAttributeName(), event.getEntityId(), event.getBatchCount() == null ? 1 : event.getBatchCount());
    }

    public long getLargeBatches() {
        return largeBatches.get();
    }

    public long getComputedChanges() {
        return computedChanges.get();
    }

    public int getBatchThreshold() {
        return batchThreshold;
    }

    @Override
    public synchronized void close() {
        if (subscriptionId != null) {
            bus.unsubscribe(subscriptionId);
            subscriptionId = null;
        }
    }
}
