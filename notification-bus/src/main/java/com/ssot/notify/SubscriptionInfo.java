package com.ssot.notify;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of a subscription, for debugging and monitoring.
 */
public final class SubscriptionInfo {

    private final String id;
    private final SubscriptionPattern pattern;
    private final Instant created;
    private final long matchCount;
    private final long failureCount;

    SubscriptionInfo(String id, SubscriptionPattern pattern, Instant created, long matchCount, long failureCount) {
        this.id = Objects.requireNonNull(id);
        this.pattern = Objects.requireNonNull(pattern);
        this.created = Objects.requireNonNull(created);
        this.matchCount = matchCount;
        this.failureCount = failureCount;
    }

    public String getId() {
        return id;
    }

    public SubscriptionPattern getPattern() {
        return pattern;
    }

    public Instant getCreated() {
        return created;
    }

    /**
     * @return how many times the callback has been invoked
     */
    public long getMatchCount() {
        return matchCount;
    }

    /**
     * @return how many of those invocations threw
     */
    public long getFailureCount() {
        return failureCount;
    }

    @Override
    public String toString() {
        return "SubscriptionInfo{" +
                "id=" + id +
                ", pattern=" + pattern +
                ", created=" + created +
                ", matchCount=" + matchCount +
                ", failureCount=" + failureCount +
                '}';
    }
}
