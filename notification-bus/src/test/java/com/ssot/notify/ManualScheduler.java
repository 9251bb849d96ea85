package com.ssot.notify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;

/**
 * Deterministic {@link ScheduledExecutorService} driven by a {@link MutableClock}.
 * Scheduled tasks run only when the test advances time; {@code execute} runs inline.
 */
public final class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {

    private final MutableClock clock;
    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>();
    private boolean shutdown;

    public ManualScheduler(MutableClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MutableClock clock() {
        return clock;
    }

    /**
     * Moves the clock forward and runs every task that became due, including tasks
     * scheduled by the tasks being run.
     */
    public void advance(Duration duration) {
        clock.advance(duration);
        runDueTasks();
    }

    public void runDueTasks() {
        boolean executed;
        do {
            executed = false;
            long now = clock.millis();
            while (!tasks.isEmpty() && tasks.peek().isDue(now)) {
                ScheduledTask task = tasks.poll();
                task.run();
                executed = true;
            }
        } while (executed);
    }

    public int queuedTaskCount() {
        return tasks.size();
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown = true;
        List<Runnable> remaining = new ArrayList<>();
        for (ScheduledTask task : tasks) {
            remaining.add(task.command);
        }
        tasks.clear();
        return remaining;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return shutdown && tasks.isEmpty();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return isTerminated();
    }

    @Override
    public void execute(@Nonnull Runnable command) {
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        command.run();
    }

    @Override
    public ScheduledFuture<?> schedule(@Nonnull Runnable command, long delay, TimeUnit unit) {
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        Objects.requireNonNull(command, "command");
        long runAt = clock.millis() + Math.max(0L, unit.toMillis(delay));
        ScheduledTask task = new ScheduledTask(command, runAt);
        tasks.add(task);
        return task;
    }

    @Override
    public <V> ScheduledFuture<V> schedule(@Nonnull Callable<V> callable, long delay, TimeUnit unit) {
        throw new UnsupportedOperationException("Callable scheduling not required for tests");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(@Nonnull Runnable command, long initialDelay, long period,
                                                  TimeUnit unit) {
        throw new UnsupportedOperationException("Fixed-rate scheduling not required for tests");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(@Nonnull Runnable command, long initialDelay, long delay,
                                                     TimeUnit unit) {
        throw new UnsupportedOperationException("Fixed-delay scheduling not required for tests");
    }

    private final class ScheduledTask implements ScheduledFuture<Void> {

        private final Runnable command;
        private final long runAtMillis;
        private boolean cancelled;
        private boolean done;

        private ScheduledTask(Runnable command, long runAtMillis) {
            this.command = command;
            this.runAtMillis = runAtMillis;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(runAtMillis - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(@Nonnull Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            tasks.remove(this);
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public Void get() {
            throw new UnsupportedOperationException("get not supported");
        }

        @Override
        public Void get(long timeout, TimeUnit unit) {
            throw new UnsupportedOperationException("get not supported");
        }

        private boolean isDue(long now) {
            return !cancelled && runAtMillis <= now;
        }

        private void run() {
            if (cancelled) {
                return;
            }
            try {
                command.run();
            } finally {
                done = true;
            }
        }
    }

    /**
     * Clock that only moves when told to.
     */
    public static final class MutableClock extends Clock {

        private long currentMillis;
        private final ZoneId zone;

        public MutableClock(long startMillis) {
            this(startMillis, ZoneOffset.UTC);
        }

        private MutableClock(long startMillis, ZoneId zone) {
            this.currentMillis = startMillis;
            this.zone = zone;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(currentMillis, Objects.requireNonNull(zone, "zone"));
        }

        @Override
        public long millis() {
            return currentMillis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(currentMillis);
        }

        public void advance(Duration duration) {
            currentMillis += duration.toMillis();
        }
    }
}
