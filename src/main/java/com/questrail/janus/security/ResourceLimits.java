package com.questrail.janus.security;

import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;

/**
 * Upper bounds on the resources a client or server will commit.
 *
 * <p>Each {@code check*} method throws a {@link JanusException} carrying
 * {@link ErrorCode#RESOURCE_LIMIT_EXCEEDED} when admitting one more unit would
 * exceed the limit.</p>
 *
 * @param maxActiveHandlers  handlers running at once (server)
 * @param maxHandlers        registered handlers (server)
 * @param maxPendingRequests outstanding requests (client)
 */
public record ResourceLimits(int maxActiveHandlers, int maxHandlers, int maxPendingRequests)
{
    public static final int DEFAULT_MAX_ACTIVE_HANDLERS = 100;
    public static final int DEFAULT_MAX_HANDLERS = 50;
    public static final int DEFAULT_MAX_PENDING_REQUESTS = 1000;

    public static final ResourceLimits DEFAULTS = new ResourceLimits(
            DEFAULT_MAX_ACTIVE_HANDLERS, DEFAULT_MAX_HANDLERS, DEFAULT_MAX_PENDING_REQUESTS);

    public ResourceLimits {
        if (maxActiveHandlers <= 0 || maxHandlers <= 0 || maxPendingRequests <= 0) {
            throw new IllegalArgumentException("resource limits must be > 0");
        }
    }

    /** @param current handlers already registered */
    public void checkHandlers(int current) {
        if (current >= maxHandlers) {
            throw exceeded("Handler limit reached (" + maxHandlers + ")");
        }
    }

    /** @param current requests already outstanding */
    public void checkPendingRequests(int current) {
        if (current >= maxPendingRequests) {
            throw exceeded("Pending request limit reached (" + maxPendingRequests + ")");
        }
    }

    private static JanusException exceeded(String details) {
        return new JanusException(ErrorCode.RESOURCE_LIMIT_EXCEEDED, details);
    }
}
