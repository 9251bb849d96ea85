package com.ssot.notify;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single outstanding timer of a batch window.
 *
 * <p>{@link #arm()} schedules the fire task unless one is already pending, {@link #cancel()}
 * withdraws it. When the task runs it takes the bus monitor and invokes the fire action, unless
 * the timer was cancelled or re-armed in the meantime: each arming gets a new generation and a
 * stale task is ignored.
 */
final class BatchTimer {

    private final ScheduledExecutorService scheduler;
    private final long delayMillis;
    private final Object lock;
    private final Runnable onFire;

    private ScheduledFuture<?> pending;
    private long generation = 0;

    BatchTimer(ScheduledExecutorService scheduler, long delayMillis, Object lock, Runnable onFire) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delayMillis = delayMillis;
        this.lock = Objects.requireNonNull(lock, "lock");
        this.onFire = Objects.requireNonNull(onFire, "onFire");
    }

    boolean isArmed() {
        return pending != null;
    }

    /**
     * Schedules the fire task if no task is pending. Never resets a running window.
     *
     * @throws NotificationBusException if the scheduler rejects the task
     */
    void arm() {
        if (pending != null) {
            return;
        }
        final long armedGeneration = ++generation;
        try {
            pending = scheduler.schedule(() -> fire(armedGeneration), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new NotificationBusException("Batch timer could not be scheduled", e);
        }
    }

    /**
     * Withdraws the pending task.
     *
     * @return true if a task was pending
     */
    boolean cancel() {
        if (pending == null) {
            return false;
        }
        pending.cancel(false);
        pending = null;
        generation++;
        return true;
    }

    private void fire(long armedGeneration) {
        synchronized (lock) {
            if (pending == null || armedGeneration != generation) {
                return;
            }
            pending = null;
            onFire.run();
        }
    }
}
