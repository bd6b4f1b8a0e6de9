package com.questrail.janus.observability;

import java.time.Instant;

/**
 * Transport lifecycle change or datagram-level anomaly.
 *
 * @param timestamp wall-clock time of the observation
 * @param kind      what happened
 * @param address   local or remote socket path involved, may be {@code null}
 * @param detail    short human-readable detail, may be {@code null}
 * @param cause     underlying failure, may be {@code null}
 */
public record JanusTransportEvent(
    Instant timestamp,
    Kind kind,
    String address,
    String detail,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN,
        /** An inbound datagram was discarded (malformed, unsafe, oversized). */
        DATAGRAM_DROPPED,
        /** An outbound datagram could not be delivered. */
        DELIVERY_FAILED
    }
}
