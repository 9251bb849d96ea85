package com.ssot.notify;

import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * In-process bus routing every mutation fact from writers to readers.
 *
 * <p>Writers (entity engine, relation engine, schema manager) publish after their change is
 * committed. Readers subscribe with a {@link SubscriptionPattern} and receive each matching
 * {@link ChangeEvent} through a {@link Consumer} callback.
 *
 * <p>Delivery semantics:
 * <ul>
 *   <li>Unbatched events reach every matching subscriber, in subscription order, before
 *       {@code publish} returns.</li>
 *   <li>Batched events are coalesced per (type, entity, attribute) and delivered once the batch
 *       window closes, carrying the number of merged events.</li>
 *   <li>Subscriber failures never reach the publisher; they are logged and counted.</li>
 * </ul>
 *
 * @see AttributeSpace
 */
public interface NotificationBus extends AutoCloseable {

    /**
     * Publishes a change. Missing {@code type}, {@code changeType} and {@code timestamp} are filled in.
     *
     * @param event the change to publish
     * @throws NullPointerException if event is null
     * @throws IllegalStateException if the bus has been shut down
     */
    void publish(@Nonnull ChangeEvent event);

    /**
     * Publishes a relation change, stamping its type as {@link EventType#RELATION}.
     */
    default void publishRelationChange(@Nonnull ChangeEvent event) {
        publish(event.toBuilder().type(EventType.RELATION).build());
    }

    /**
     * Publishes a schema change, stamping its type as {@link EventType#SCHEMA}.
     */
    default void publishSchemaChange(@Nonnull ChangeEvent event) {
        publish(event.toBuilder().type(EventType.SCHEMA).build());
    }

    /**
     * Registers a callback for the events matching a pattern.
     *
     * @param pattern which events to receive
     * @param callback invoked once per matching event
     * @return the subscription id, to pass to {@link #unsubscribe(String)}
     * @throws IllegalArgumentException if pattern or callback is null
     */
    String subscribe(SubscriptionPattern pattern, Consumer<ChangeEvent> callback);

    /**
     * Registers a callback receiving every event, of every type.
     */
    default String subscribeAll(Consumer<ChangeEvent> callback) {
        return subscribe(SubscriptionPattern.all(), callback);
    }

    /**
     * Removes a subscription. Unknown or already removed ids are ignored.
     *
     * @return true if a subscription was removed
     */
    boolean unsubscribe(String subscriptionId);

    /**
     * Delivers any pending batch now instead of waiting for the batch window to close.
     */
    void flush();

    NotificationStats stats();

    List<SubscriptionInfo> activeSubscriptions();

    /**
     * Removes all subscriptions, then flushes any pending batch.
     *
     * @return the number of subscriptions removed
     */
    int clear();

    /**
     * Flushes pending batches, removes every subscription and stops accepting events.
     * Calling it again has no effect.
     */
    void shutdown();

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    void close();
}
