package com.questrail.janus.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for request deadlines and elapsed-time statistics.
 *
 * <h2>Rule</h2>
 * Every timeout decision (client pending-request expiry, server handler
 * deadline) is computed from this clock. Envelope timestamps use
 * {@link WallClock}; they never decide an outcome.
 */
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds. Only differences between two readings are
     * meaningful.
     */
    long nowNanos();
}
