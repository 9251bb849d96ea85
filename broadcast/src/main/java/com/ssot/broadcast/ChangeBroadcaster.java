package com.ssot.broadcast;

import com.ssot.notify.ChangeEvent;
import com.ssot.notify.EventType;
import com.ssot.notify.NotificationBus;
import com.ssot.notify.SubscriptionPattern;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every entity, relation and schema change of a {@link NotificationBus} to the
 * connected {@link MessageSink}s.
 *
 * <p>The message is built and serialized on the bus dispatch thread, then handed to a delivery
 * executor so that slow or failing clients never hold up the bus. Each open sink receives each
 * message once; a sink that throws is logged and counted and the remaining sinks still get the
 * message. Nothing is serialized while no sink is connected.
 *
 * <p><b>Thread Safety:</b> sinks can be added and removed from any thread.
 */
public class ChangeBroadcaster implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeBroadcaster.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final NotificationBus bus;
    private final ChangeMessageSerializer serializer;
    private final ExecutorService deliveryExecutor;
    private final boolean ownsExecutor;
    private final Clock clock;

    private final Set<MessageSink> sinks = new CopyOnWriteArraySet<>();
    private final List<String> subscriptionIds = new ArrayList<>();

    private final AtomicLong sentMessages = new AtomicLong(0);
    private final AtomicLong failedDeliveries = new AtomicLong(0);
    private final AtomicLong serializationFailures = new AtomicLong(0);

    private boolean started = false;
    private boolean closed = false;

    /**
     * Creates a broadcaster delivering on its own daemon thread.
     */
    public ChangeBroadcaster(@Nonnull NotificationBus bus) {
        this(bus, new ChangeMessageSerializer(), createDefaultExecutor(), Clock.systemUTC(), true);
    }

    /**
     * Creates a broadcaster with a specific executor, mainly for testing purposes.
     * The executor is not shut down by {@link #close()}.
     */
    public ChangeBroadcaster(@Nonnull NotificationBus bus, @Nonnull ChangeMessageSerializer serializer,
                             @Nonnull ExecutorService deliveryExecutor, @Nonnull Clock clock) {
        this(bus, serializer, deliveryExecutor, clock, false);
    }

    private ChangeBroadcaster(NotificationBus bus, ChangeMessageSerializer serializer,
                              ExecutorService deliveryExecutor, Clock clock, boolean ownsExecutor) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Subscribes to entity, relation and schema changes. Calling it again has no effect.
     *
     * @throws IllegalStateException if the broadcaster has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ChangeBroadcaster has been closed");
        }
        if (started) {
            return;
        }
        for (EventType type : EventType.values()) {
            subscriptionIds.add(bus.subscribe(SubscriptionPattern.builder().type(type).build(), this::onChange));
        }
        started = true;
        LOGGER.info("ChangeBroadcaster started with {} subscription(s)", subscriptionIds.size());
    }

    public void addSink(@Nonnull MessageSink sink) {
        Objects.requireNonNull(sink, "sink");
        if (sinks.add(sink)) {
            LOGGER.debug("Sink connected, {} connected", sinks.size());
        }
    }

    public boolean removeSink(MessageSink sink) {
        boolean removed = sink != null && sinks.remove(sink);
        if (removed) {
            LOGGER.debug("Sink disconnected, {} connected", sinks.size());
        }
        return removed;
    }

    public int sinkCount() {
        return sinks.size();
    }

    private void onChange(ChangeEvent event) {
        if (sinks.isEmpty()) {
            return;
        }
        String payload;
        try {
            payload = serializer.serialize(ChangeMessage.of(event, clock.instant()));
        } catch (BroadcastException e) {
            serializationFailures.incrementAndGet();
            LOGGER.warn("Dropping change that could not be serialized: {}", event, e);
            return;
        }
        try {
            deliveryExecutor.execute(() -> deliver(payload));
        } catch (RejectedExecutionException e) {
            failedDeliveries.incrementAndGet();
            LOGGER.warn("Delivery executor rejected message for {}", event, e);
        }
    }

    private void deliver(String payload) {
        for (MessageSink sink : sinks) {
            if (!sink.isOpen()) {
                continue;
            }
            try {
                sink.send(payload);
                sentMessages.incrementAndGet();
            } catch (RuntimeException e) {
                failedDeliveries.incrementAndGet();
                LOGGER.warn("Failed to deliver message to sink {}", sink, e);
            }
        }
    }

    /**
     * @return messages successfully handed to a sink, counted once per sink
     */
    public long getSentMessages() {
        return sentMessages.get();
    }

    public long getFailedDeliveries() {
        return failedDeliveries.get();
    }

    public long getSerializationFailures() {
        return serializationFailures.get();
    }

    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("connectedSinks", sinks.size());
        metrics.put("sentMessages", sentMessages.get());
        metrics.put("failedDeliveries", failedDeliveries.get());
        metrics.put("serializationFailures", serializationFailures.get());
        return metrics;
    }

    /**
     * Unsubscribes from the bus and stops delivering. Messages already queued on an owned
     * executor get a grace period to be delivered.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            for (String id : subscriptionIds) {
                bus.unsubscribe(id);
            }
            subscriptionIds.clear();
        }

        if (ownsExecutor && !deliveryExecutor.isShutdown()) {
            deliveryExecutor.shutdown();
            try {
                if (!deliveryExecutor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    deliveryExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                deliveryExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("ChangeBroadcaster closed - {}", getMetrics());
    }

    private static ExecutorService createDefaultExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "change-broadcaster");
            t.setDaemon(true);
            return t;
        });
    }
}
