package com.questrail.janus.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Conversion</h2>
 * <p>Deadlines are converted to relative delays at arming time using the
 * supplied {@link MonotonicClock}; callers must compute their deadlines from the
 * same clock. A deadline already in the past fires immediately.</p>
 *
 * <h2>Ownership</h2>
 * <p>The executor is not owned here. The composition roots create it and shut
 * it down.</p>
 *
 * <h2>After shutdown</h2>
 * <p>Arming a timer on a shut-down executor throws the executor's
 * {@link java.util.concurrent.RejectedExecutionException}.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // A timer body that already started runs to completion.
            return future.cancel(false);
        }
    }
}
