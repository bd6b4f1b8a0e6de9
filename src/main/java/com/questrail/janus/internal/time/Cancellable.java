package com.questrail.janus.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned by {@link MonotonicScheduler} for a pending timer.
 *
 * <p>Request deadlines on both sides of the socket are armed through this
 * handle and disarmed when the request resolves by some other route.</p>
 */
public interface Cancellable
{
    /**
     * Disarm the timer.
     *
     * @return {@code true} if the timer had not yet fired and will now never
     *         fire; {@code false} if it already ran or was cancelled before.
     */
    boolean cancel();
}
