package com.ssot.notify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces bursts of events sharing a {@link BatchKey} into one merged event per key.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>{@link #add(ChangeEvent)} folds the event into the pending entry for its key. Fields
 *       present on the newer event overwrite those of the entry and the entry's batch count
 *       grows by one. The first event of a window arms the shared timer.</li>
 *   <li>When the timer fires, {@link #flushDue()} takes every pending entry, empties the map and
 *       dispatches each entry as a standalone event carrying its {@code batchCount}.</li>
 *   <li>{@link #forceFlush()} cancels the timer and runs the same flush synchronously. It does
 *       nothing when no entry is pending.</li>
 * </ol>
 *
 * <p>Only one timer is outstanding at any time, however many keys are pending; events arriving
 * while it is armed do not extend the window.
 *
 * <p><b>Thread Safety:</b> NOT thread-safe on its own. Callers hold the bus monitor, which the
 * timer task also acquires before flushing.
 */
final class BatchScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);

    private final Map<BatchKey, BatchEntry> pending = new LinkedHashMap<>();
    private final BatchTimer timer;
    private final Consumer<ChangeEvent> dispatcher;
    private final boolean logging;

    private long batchedNotifications = 0;

    BatchScheduler(ScheduledExecutorService scheduler, long delayMillis, Object lock,
                   Consumer<ChangeEvent> dispatcher, boolean logging) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.timer = new BatchTimer(scheduler, delayMillis, lock, this::flushDue);
        this.logging = logging;
    }

    void add(ChangeEvent event) {
        BatchKey key = BatchKey.of(event);
        BatchEntry entry = pending.get(key);
        if (entry == null) {
            pending.put(key, new BatchEntry(event));
        } else {
            entry.merge(event);
        }
        timer.arm();
    }

    /**
     * Dispatches every pending entry. Runs on the timer, or from {@link #forceFlush()}.
     */
    void flushDue() {
        if (pending.isEmpty()) {
            return;
        }
        List<BatchEntry> due = new ArrayList<>(pending.values());
        pending.clear();
        batchedNotifications += due.size();

        if (logging) {
            LOGGER.debug("Flushing batch of {} notification(s)", due.size());
        }
        for (BatchEntry entry : due) {
            dispatcher.accept(entry.toEvent());
        }
    }

    /**
     * Delivers whatever is pending, including entries left behind by a timer that could not be armed.
     */
    void forceFlush() {
        timer.cancel();
        flushDue();
    }

    boolean isArmed() {
        return timer.isArmed();
    }

    int pendingCount() {
        return pending.size();
    }

    long getBatchedNotifications() {
        return batchedNotifications;
    }

    /**
     * Merged state of one key inside an open window.
     */
    private static final class BatchEntry {
        private ChangeEvent merged;
        private int batchCount = 1;

        BatchEntry(ChangeEvent first) {
            this.merged = first;
        }

        void merge(ChangeEvent later) {
            merged = merged.mergedWith(later);
            batchCount++;
        }

        ChangeEvent toEvent() {
            return merged.withBatchCount(batchCount);
        }
    }
}
