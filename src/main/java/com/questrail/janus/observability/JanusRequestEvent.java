package com.questrail.janus.observability;

import com.questrail.janus.api.StructuredError;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lifecycle step of one request, observed on either side of the socket.
 *
 * @param timestamp wall-clock time of the observation
 * @param kind      lifecycle step
 * @param requestId request identifier
 * @param command   command name, when known
 * @param elapsed   time since the request was sent or received, when meaningful
 * @param error     the structured error carried by a failing step, if any
 */
public record JanusRequestEvent(
    Instant timestamp,
    Kind kind,
    String requestId,
    String command,
    Duration elapsed,
    StructuredError error
) {
    public enum Kind {
        // client side
        SENT,
        COMPLETED,
        TIMED_OUT,
        CANCELLED,
        FAILED,
        LATE_RESPONSE_DISCARDED,
        PROTOCOL_MISMATCH,
        // server side
        RECEIVED,
        DISPATCHED,
        HANDLER_TIMED_OUT,
        REJECTED,
        RESPONDED
    }

    public static JanusRequestEvent of(Instant timestamp, Kind kind, String requestId, String command) {
        return new JanusRequestEvent(timestamp, kind, requestId, command, null, null);
    }

    public Optional<Duration> elapsedOpt() {
        return Optional.ofNullable(elapsed);
    }

    public Optional<StructuredError> errorOpt() {
        return Optional.ofNullable(error);
    }
}
