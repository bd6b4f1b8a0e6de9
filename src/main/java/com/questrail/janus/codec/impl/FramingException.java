package com.questrail.janus.codec.impl;

import java.util.Objects;

/**
 * Raised by {@link LengthPrefixedFraming} when a stream buffer cannot yield a
 * message. The {@link Kind} is stable and matches the error codes used by the
 * other Janus implementations.
 */
public final class FramingException extends RuntimeException
{
    public enum Kind
    {
        INCOMPLETE_LENGTH_PREFIX,
        MESSAGE_TOO_LARGE,
        ZERO_LENGTH_MESSAGE,
        INCOMPLETE_MESSAGE,
        INVALID_JSON_ENVELOPE,
        MISSING_ENVELOPE_FIELDS,
        INVALID_MESSAGE_TYPE,
        INVALID_PAYLOAD_JSON;

        /** More bytes may complete the message; not an error on a live stream. */
        public boolean isIncomplete() {
            return this == INCOMPLETE_LENGTH_PREFIX || this == INCOMPLETE_MESSAGE;
        }
    }

    private final Kind kind;

    public FramingException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FramingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}
