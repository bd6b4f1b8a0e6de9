package com.questrail.janus.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}; unaffected by
 * wall-clock adjustments. Tests use a manual clock instead.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
