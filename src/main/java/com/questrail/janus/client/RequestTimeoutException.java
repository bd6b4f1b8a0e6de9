package com.questrail.janus.client;

import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;

import java.time.Duration;
import java.util.Objects;

/**
 * No correlated response arrived before the request's deadline.
 */
public final class RequestTimeoutException extends JanusException
{
    private final String requestId;
    private final Duration timeout;

    public RequestTimeoutException(String requestId, Duration timeout) {
        super(ErrorCode.HANDLER_TIMEOUT,
                "Request '" + requestId + "' timed out after " + timeout.toMillis() + "ms");
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.timeout = timeout;
    }

    public String requestId() {
        return requestId;
    }

    /** The timeout that was exceeded. */
    public Duration timeout() {
        return timeout;
    }
}
