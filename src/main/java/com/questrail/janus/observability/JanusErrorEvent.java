package com.questrail.janus.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside the client or server.
 */
public record JanusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
