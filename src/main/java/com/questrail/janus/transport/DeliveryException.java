package com.questrail.janus.transport;

import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.Objects;

/**
 * An outbound datagram could not be handed to the operating system.
 *
 * <p>The transport adapters normalise their native failures into a
 * {@link Reason} so callers can react without knowing the transport.</p>
 */
public final class DeliveryException extends RuntimeException
{
    public enum Reason {
        /** No socket file exists at the destination path. */
        NO_SUCH_ADDRESS,
        /** A socket file exists but nothing is bound to it. */
        CONNECTION_REFUSED,
        /** The payload exceeds what the socket accepts in one datagram. */
        MESSAGE_TOO_LARGE,
        /** The local endpoint is not started or already stopped. */
        TRANSPORT_DOWN,
        OTHER
    }

    private final Reason reason;
    private final transient SocketAddress remote;

    public DeliveryException(Reason reason, SocketAddress remote, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.remote = remote;
    }

    public DeliveryException(Reason reason, SocketAddress remote, String message) {
        this(reason, remote, message, null);
    }

    public Reason reason() {
        return reason;
    }

    public SocketAddress remote() {
        return remote;
    }

    /**
     * True when the destination has no live receiver: the path does not exist,
     * or exists without a bound socket.
     */
    public boolean isTargetMissing() {
        return reason == Reason.NO_SUCH_ADDRESS || reason == Reason.CONNECTION_REFUSED;
    }

    /**
     * Classify an arbitrary send failure by its type and message.
     */
    public static DeliveryException classify(SocketAddress remote, Throwable cause) {
        if (cause instanceof DeliveryException) {
            return (DeliveryException) cause;
        }
        if (cause instanceof ClosedChannelException) {
            return new DeliveryException(Reason.TRANSPORT_DOWN, remote, "endpoint closed", cause);
        }
        String msg = cause == null || cause.getMessage() == null ? "" : cause.getMessage();
        String lower = msg.toLowerCase(Locale.ROOT);

        Reason reason;
        if (lower.contains("no such file or directory")) {
            reason = Reason.NO_SUCH_ADDRESS;
        } else if (lower.contains("connection refused")) {
            reason = Reason.CONNECTION_REFUSED;
        } else if (lower.contains("message too long")) {
            reason = Reason.MESSAGE_TOO_LARGE;
        } else {
            reason = Reason.OTHER;
        }
        return new DeliveryException(reason, remote, msg.isEmpty() ? reason.name() : msg, cause);
    }
}
