package com.ssot.notify;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A live subscription, owned by the {@link SubscriptionRegistry}.
 *
 * <p>Callers never hold instances of this class; they see the subscription id and
 * {@link SubscriptionInfo} snapshots. Callback failures are isolated here so one
 * misbehaving subscriber cannot affect the others or the publisher.
 */
final class Subscription {

    private static final Logger LOGGER = LoggerFactory.getLogger(Subscription.class);

    private final String id;
    private final SubscriptionPattern pattern;
    private final Consumer<ChangeEvent> callback;
    private final Instant created;
    private long matchCount = 0;
    private long failureCount = 0;

    Subscription(String id, SubscriptionPattern pattern, Consumer<ChangeEvent> callback, Instant created) {
        this.id = Objects.requireNonNull(id);
        this.pattern = Objects.requireNonNull(pattern);
        this.callback = Objects.requireNonNull(callback);
        this.created = Objects.requireNonNull(created);
    }

    /**
     * Invokes the callback, capturing its outcome instead of letting it escape.
     *
     * @param event the matched event
     * @return true if the callback completed normally, false if it threw
     */
    boolean invoke(ChangeEvent event) {
        matchCount++;
        try {
            callback.accept(event);
            return true;
        } catch (RuntimeException e) {
            failureCount++;
            LOGGER.warn("Subscription '{}' threw while handling {}", id, event, e);
            return false;
        } catch (Error e) {
            failureCount++;
            LOGGER.error("Subscription '{}' threw Error while handling {}", id, event, e);
            throw e;
        }
    }

    String getId() {
        return id;
    }

    SubscriptionPattern getPattern() {
        return pattern;
    }

    Instant getCreated() {
        return created;
    }

    long getMatchCount() {
        return matchCount;
    }

    long getFailureCount() {
        return failureCount;
    }

    SubscriptionInfo toInfo() {
        return new SubscriptionInfo(id, pattern, created, matchCount, failureCount);
    }
}
