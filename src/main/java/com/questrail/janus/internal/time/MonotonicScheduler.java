package com.questrail.janus.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Arms one-shot timers against a {@link MonotonicClock}.
 *
 * <p>Deadlines are monotonic nanoseconds, never wall-clock instants.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos monotonic deadline, as read from {@link MonotonicClock#nowNanos()}
     * @param task          timer body
     * @return handle that disarms the timer
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
