package com.ssot.notify;

/**
 * Point-in-time statistics of a bus. Lifetime counters never decrease.
 */
public final class NotificationStats {

    private final long totalSubscriptions;
    private final long totalNotifications;
    private final long batchedNotifications;
    private final long droppedNotifications;
    private final long callbackFailures;
    private final long predicateFailures;
    private final int activeSubscriptions;
    private final int pendingNotifications;
    private final boolean dispatching;

    NotificationStats(long totalSubscriptions, long totalNotifications, long batchedNotifications,
                      long droppedNotifications, long callbackFailures, long predicateFailures,
                      int activeSubscriptions, int pendingNotifications, boolean dispatching) {
        this.totalSubscriptions = totalSubscriptions;
        this.totalNotifications = totalNotifications;
        this.batchedNotifications = batchedNotifications;
        this.droppedNotifications = droppedNotifications;
        this.callbackFailures = callbackFailures;
        this.predicateFailures = predicateFailures;
        this.activeSubscriptions = activeSubscriptions;
        this.pendingNotifications = pendingNotifications;
        this.dispatching = dispatching;
    }

    /** Subscriptions ever created, including removed ones. */
    public long getTotalSubscriptions() {
        return totalSubscriptions;
    }

    /** Events accepted by {@code publish}; dropped events are not included. */
    public long getTotalNotifications() {
        return totalNotifications;
    }

    /** Merged events dispatched by batch flushes. */
    public long getBatchedNotifications() {
        return batchedNotifications;
    }

    /** Events discarded by loop detection. */
    public long getDroppedNotifications() {
        return droppedNotifications;
    }

    public long getCallbackFailures() {
        return callbackFailures;
    }

    public long getPredicateFailures() {
        return predicateFailures;
    }

    public int getActiveSubscriptions() {
        return activeSubscriptions;
    }

    /** Batch entries waiting for the timer. */
    public int getPendingNotifications() {
        return pendingNotifications;
    }

    public boolean isDispatching() {
        return dispatching;
    }

    @Override
    public String toString() {
        return "NotificationStats{" +
                "totalSubscriptions=" + totalSubscriptions +
                ", totalNotifications=" + totalNotifications +
                ", batchedNotifications=" + batchedNotifications +
                ", droppedNotifications=" + droppedNotifications +
                ", callbackFailures=" + callbackFailures +
                ", predicateFailures=" + predicateFailures +
                ", activeSubscriptions=" + activeSubscriptions +
                ", pendingNotifications=" + pendingNotifications +
                ", dispatching=" + dispatching +
                '}';
    }
}
