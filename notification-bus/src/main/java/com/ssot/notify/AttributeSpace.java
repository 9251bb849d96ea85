package com.ssot.notify;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link NotificationBus} of the attribute space.
 *
 * <p>Each publish goes through three stages:
 * <ol>
 *   <li><b>Loop detection</b> - while a dispatch is running and the nesting depth already
 *       exceeds {@code maxLoopDetection}, the event is dropped and counted.</li>
 *   <li><b>Enrichment</b> - timestamp, change type and event type are completed.</li>
 *   <li><b>Delivery</b> - batched through the {@link BatchScheduler} when batching is enabled,
 *       dispatched immediately otherwise.</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> all state is owned by this instance and mutated only while holding its
 * monitor, which the batch timer also takes before flushing. Publishers on other threads therefore
 * wait for a running dispatch to finish. The monitor is reentrant, so a callback publishing on the
 * dispatching thread is bounded by loop detection rather than blocked. Callbacks run on the
 * publishing thread for unbatched events and on the timer thread (or the caller of
 * {@link #flush()}) for batched ones; they must not block.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (AttributeSpace bus = new AttributeSpace()) {
 *     bus.subscribe(SubscriptionPattern.builder().entityId("cliente-123").build(),
 *         event -> view.refresh(event.getAttributeName(), event.getNewValue()));
 *
 *     bus.publish(ChangeEvent.builder()
 *         .entityId("cliente-123")
 *         .attributeName("email")
 *         .newValue("mario@rossi.it")
 *         .build());
 * }
 * }</pre>
 */
public class AttributeSpace implements NotificationBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttributeSpace.class);

    private static final long TERMINATION_TIMEOUT_MS = 500;

    private final Object lock = new Object();
    private final NotificationBusConfig config;
    private final Clock clock;
    private final boolean logging;
    private final PatternMatcher matcher = new PatternMatcher();
    private final SubscriptionRegistry registry;
    private final BatchScheduler batchScheduler;
    private final ReentrancyGuard guard;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private long totalNotifications = 0;
    private long droppedNotifications = 0;
    private long callbackFailures = 0;
    private boolean closed = false;

    /**
     * Creates a bus with the default configuration.
     */
    public AttributeSpace() {
        this(NotificationBusConfig.defaults());
    }

    public AttributeSpace(@Nonnull NotificationBusConfig config) {
        this(config, Clock.systemUTC(), createDefaultScheduler(), true);
    }

    /**
     * Creates a bus with a specific clock and batch scheduler, mainly for testing purposes.
     * The scheduler is not shut down by {@link #shutdown()}.
     *
     * @param config bus configuration
     * @param clock clock used for event timestamps and subscription creation times
     * @param scheduler scheduler running the batch timer
     */
    public AttributeSpace(@Nonnull NotificationBusConfig config, @Nonnull Clock clock,
                          @Nonnull ScheduledExecutorService scheduler) {
        this(config, clock, scheduler, false);
    }

    private AttributeSpace(NotificationBusConfig config, Clock clock, ScheduledExecutorService scheduler,
                           boolean ownsScheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.logging = config.isLoggingEnabled();
        this.registry = new SubscriptionRegistry(matcher, clock, logging);
        this.guard = new ReentrancyGuard(config.getMaxLoopDetection());
        this.batchScheduler = new BatchScheduler(scheduler, config.getBatchDelay().toMillis(), lock,
            this::dispatch, logging);

        if (logging) {
            LOGGER.info("AttributeSpace initialised with {}", config);
        }
    }

    @Override
    public void publish(@Nonnull ChangeEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        synchronized (lock) {
            ensureNotClosed();

            if (guard.shouldDrop()) {
                droppedNotifications++;
                if (logging) {
                    LOGGER.debug("Loop detected at depth {}, dropping {}", guard.getDepth(), event);
                }
                return;
            }

            totalNotifications++;
            ChangeEvent enriched = event.enrich(clock.millis());

            if (config.isBatchingEnabled()) {
                batchScheduler.add(enriched);
            } else {
                dispatch(enriched);
            }
        }
    }

    /**
     * Delivers one event to every matching subscription. Runs with the monitor held.
     */
    private void dispatch(ChangeEvent event) {
        guard.enter();
        try {
            List<Subscription> matching = registry.findMatching(event);
            if (logging) {
                LOGGER.debug("{} subscription(s) matched {}", matching.size(), event);
            }
            for (Subscription subscription : matching) {
                // An earlier callback may have removed it
                if (!registry.isActive(subscription.getId())) {
                    continue;
                }
                if (!subscription.invoke(event)) {
                    callbackFailures++;
                }
            }
        } finally {
            guard.exit();
        }
    }

    @Override
    public String subscribe(SubscriptionPattern pattern, Consumer<ChangeEvent> callback) {
        synchronized (lock) {
            ensureNotClosed();
            return registry.subscribe(pattern, callback);
        }
    }

    @Override
    public boolean unsubscribe(String subscriptionId) {
        synchronized (lock) {
            return registry.unsubscribe(subscriptionId);
        }
    }

    @Override
    public void flush() {
        synchronized (lock) {
            batchScheduler.forceFlush();
        }
    }

    @Override
    public int clear() {
        synchronized (lock) {
            int removed = registry.clear();
            batchScheduler.forceFlush();
            if (logging) {
                LOGGER.info("Removed all subscriptions ({})", removed);
            }
            return removed;
        }
    }

    @Override
    public NotificationStats stats() {
        synchronized (lock) {
            return new NotificationStats(
                registry.getTotalSubscriptions(),
                totalNotifications,
                batchScheduler.getBatchedNotifications(),
                droppedNotifications,
                callbackFailures,
                matcher.getPredicateFailures(),
                registry.size(),
                batchScheduler.pendingCount(),
                guard.isDispatching());
        }
    }

    @Override
    public List<SubscriptionInfo> activeSubscriptions() {
        synchronized (lock) {
            return registry.snapshot();
        }
    }

    public NotificationBusConfig getConfig() {
        return config;
    }

    @Override
    public void shutdown() {
        synchronized (lock) {
            if (closed) {
                if (logging) {
                    LOGGER.debug("AttributeSpace already shut down");
                }
                return;
            }
            batchScheduler.forceFlush();
            clear();
            closed = true;
            if (logging) {
                LOGGER.info("AttributeSpace shut down - {}", stats());
            }
        }
        // Outside the monitor: a timer task may be waiting for it
        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("AttributeSpace has been shut down");
        }
    }

    private static ScheduledExecutorService createDefaultScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "notification-bus-batch");
            t.setDaemon(true);
            return t;
        });
    }
}
