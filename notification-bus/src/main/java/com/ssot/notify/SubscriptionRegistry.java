package com.ssot.notify;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the active subscriptions of one bus.
 *
 * <p>Subscriptions are kept in insertion order, which is also the order in which
 * {@link #findMatching(ChangeEvent)} reports them. There is no prioritization.
 *
 * <p><b>Thread Safety:</b> this class is NOT thread-safe. The owning {@link NotificationBus}
 * confines every call to its own monitor.
 */
class SubscriptionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private static final String ID_PREFIX = "sub_";

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
    private final PatternMatcher matcher;
    private final Clock clock;
    private final boolean logging;

    private long idCounter = 0;
    private long totalSubscriptions = 0;

    SubscriptionRegistry(PatternMatcher matcher, Clock clock, boolean logging) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logging = logging;
    }

    /**
     * Registers a subscription.
     *
     * @param pattern the normalized pattern
     * @param callback invoked with each matching event
     * @return a new, process-unique subscription id
     * @throws IllegalArgumentException if pattern or callback is null
     */
    String subscribe(SubscriptionPattern pattern, Consumer<ChangeEvent> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Subscription callback must not be null");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("Subscription pattern must not be null");
        }
        String id = ID_PREFIX + (++idCounter);
        subscriptions.put(id, new Subscription(id, pattern, callback, clock.instant()));
        totalSubscriptions++;

        if (logging) {
            LOGGER.debug("Registered subscription {} with {}", id, pattern);
        }
        return id;
    }

    /**
     * Removes a subscription. Unknown ids are ignored.
     *
     * @return true if a subscription was removed
     */
    boolean unsubscribe(String id) {
        if (id == null) {
            return false;
        }
        boolean removed = subscriptions.remove(id) != null;
        if (removed && logging) {
            LOGGER.debug("Removed subscription {}", id);
        }
        return removed;
    }

    /**
     * Returns the subscriptions whose pattern matches the event, in insertion order.
     * The returned list is a copy, so callbacks may subscribe or unsubscribe while it is iterated.
     */
    List<Subscription> findMatching(ChangeEvent event) {
        if (subscriptions.isEmpty()) {
            return Collections.emptyList();
        }
        List<Subscription> matching = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            if (matcher.matches(event, subscription.getPattern())) {
                matching.add(subscription);
            }
        }
        return matching;
    }

    boolean isActive(String id) {
        return subscriptions.containsKey(id);
    }

    /**
     * Removes every subscription.
     *
     * @return the number removed
     */
    int clear() {
        int count = subscriptions.size();
        subscriptions.clear();
        return count;
    }

    int size() {
        return subscriptions.size();
    }

    /**
     * @return lifetime number of subscriptions created; never decreases
     */
    long getTotalSubscriptions() {
        return totalSubscriptions;
    }

    List<SubscriptionInfo> snapshot() {
        List<SubscriptionInfo> infos = new ArrayList<>(subscriptions.size());
        for (Subscription subscription : subscriptions.values()) {
            infos.add(subscription.toInfo());
        }
        return Collections.unmodifiableList(infos);
    }
}
