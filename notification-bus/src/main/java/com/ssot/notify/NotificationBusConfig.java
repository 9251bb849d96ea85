package com.ssot.notify;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Immutable configuration of an {@link AttributeSpace}.
 *
 * <p>Defaults: batching enabled with a 50 ms window, loop detection bound of 10 nested
 * dispatches, logging enabled.
 */
public final class NotificationBusConfig {

    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofMillis(50);
    public static final int DEFAULT_MAX_LOOP_DETECTION = 10;

    private static final NotificationBusConfig DEFAULTS = builder().build();

    private final boolean enableBatching;
    private final Duration batchDelay;
    private final int maxLoopDetection;
    private final boolean enableLogging;

    private NotificationBusConfig(Builder builder) {
        this.enableBatching = builder.enableBatching;
        this.batchDelay = builder.batchDelay;
        this.maxLoopDetection = builder.maxLoopDetection;
        this.enableLogging = builder.enableLogging;
    }

    public static NotificationBusConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBatchingEnabled() {
        return enableBatching;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public int getMaxLoopDetection() {
        return maxLoopDetection;
    }

    public boolean isLoggingEnabled() {
        return enableLogging;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotificationBusConfig that = (NotificationBusConfig) o;
        return enableBatching == that.enableBatching
            && maxLoopDetection == that.maxLoopDetection
            && enableLogging == that.enableLogging
            && batchDelay.equals(that.batchDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enableBatching, batchDelay, maxLoopDetection, enableLogging);
    }

    @Override
    public String toString() {
        return "NotificationBusConfig{" +
                "enableBatching=" + enableBatching +
                ", batchDelay=" + batchDelay.toMillis() + "ms" +
                ", maxLoopDetection=" + maxLoopDetection +
                ", enableLogging=" + enableLogging +
                '}';
    }

    public static final class Builder {
        private boolean enableBatching = true;
        private Duration batchDelay = DEFAULT_BATCH_DELAY;
        private int maxLoopDetection = DEFAULT_MAX_LOOP_DETECTION;
        private boolean enableLogging = true;

        private Builder() {
        }

        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        public Builder batchDelay(@Nonnull Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder maxLoopDetection(int maxLoopDetection) {
            this.maxLoopDetection = maxLoopDetection;
            return this;
        }

        public Builder enableLogging(boolean enableLogging) {
            this.enableLogging = enableLogging;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the batch delay is not positive or the loop bound is negative
         */
        public NotificationBusConfig build() {
            if (batchDelay == null || batchDelay.isZero() || batchDelay.isNegative()) {
                throw new IllegalArgumentException("batchDelay must be positive");
            }
            if (maxLoopDetection < 0) {
                throw new IllegalArgumentException("maxLoopDetection must not be negative");
            }
            return new NotificationBusConfig(this);
        }
    }
}
