package com.questrail.janus.client;

import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;

/**
 * The caller cancelled the request before a response arrived. Any response
 * that arrives later is discarded.
 */
public final class RequestCancelledException extends JanusException
{
    private final String requestId;

    public RequestCancelledException(String requestId) {
        super(ErrorCode.SERVER_ERROR, "Request '" + requestId + "' was cancelled");
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
