package com.questrail.janus.server;

import com.questrail.janus.api.JanusRequest;

/**
 * Application logic for one command.
 *
 * <p>Handlers run on a worker thread and are raced against the request's
 * deadline. A handler that loses the race is interrupted and its result is
 * discarded, so long-running handlers should respond to interruption.</p>
 *
 * <p>Throwing a {@link com.questrail.janus.api.JanusException} answers with
 * its structured error; any other exception answers with
 * {@code INTERNAL_ERROR} carrying the exception message.</p>
 */
@FunctionalInterface
public interface RequestHandler
{
    HandlerResult handle(JanusRequest request) throws Exception;
}
