package com.questrail.janus.client;

/**
 * Client-side state of one request.
 *
 * <p>{@link #PENDING} is the only non-terminal state. A request leaves it
 * exactly once.</p>
 */
public enum RequestStatus
{
    PENDING,
    COMPLETED,
    TIMED_OUT,
    CANCELLED,
    /** The request could not be sent (local transport or target failure). */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
