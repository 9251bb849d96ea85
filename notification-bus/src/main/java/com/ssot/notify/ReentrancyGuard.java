package com.ssot.notify;

/**
 * Bounds notification-triggered notifications.
 *
 * <p>Depth and the dispatching flag are shared by every event of the bus: any publish made
 * from inside a callback counts as one more level of the same recursion, whatever entity
 * or subscriber it concerns.
 */
final class ReentrancyGuard {

    private final int maxDepth;
    private int depth = 0;
    private boolean dispatching = false;

    ReentrancyGuard(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * @return true if an event published now must be dropped
     */
    boolean shouldDrop() {
        return dispatching && depth > maxDepth;
    }

    void enter() {
        dispatching = true;
        depth++;
    }

    void exit() {
        depth--;
        if (depth <= 0) {
            depth = 0;
            dispatching = false;
        }
    }

    int getDepth() {
        return depth;
    }

    boolean isDispatching() {
        return dispatching;
    }
}
