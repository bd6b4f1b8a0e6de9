package com.questrail.janus.client;

import com.questrail.janus.api.JanusResponse;
import com.questrail.janus.internal.time.Cancellable;
import com.questrail.janus.transport.DatagramEndpoint;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One outstanding request and the resources it holds: its reply endpoint and
 * its deadline timer.
 *
 * <p>Resources are attached after registration and detached exactly once when
 * the request resolves. Attaching to an already resolved request fails, so the
 * caller releases what it tried to attach.</p>
 */
final class PendingRequest
{
    private final String id;
    private final String command;
    private final Path replyPath;
    private final long createdAtNanos;
    private volatile Duration timeout;
    private final CompletableFuture<JanusResponse> future;
    private final RequestHandle handle;

    private DatagramEndpoint endpoint;
    private Cancellable timer;
    private boolean detached;

    PendingRequest(String id,
                   String command,
                   Path replyPath,
                   long createdAtNanos,
                   Duration timeout,
                   CompletableFuture<JanusResponse> future,
                   RequestHandle handle) {
        this.id = Objects.requireNonNull(id, "id");
        this.command = Objects.requireNonNull(command, "command");
        this.replyPath = Objects.requireNonNull(replyPath, "replyPath");
        this.createdAtNanos = createdAtNanos;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.future = Objects.requireNonNull(future, "future");
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    String id() {
        return id;
    }

    String command() {
        return command;
    }

    Path replyPath() {
        return replyPath;
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    Duration timeout() {
        return timeout;
    }

    CompletableFuture<JanusResponse> future() {
        return future;
    }

    RequestHandle handle() {
        return handle;
    }

    synchronized boolean attachTimer(Cancellable timer) {
        if (detached) {
            return false;
        }
        this.timer = timer;
        return true;
    }

    /**
     * Swap in a later deadline timer. The previous timer is cancelled.
     *
     * @return {@code false} if the request has already resolved
     */
    boolean replaceTimer(Cancellable replacement, Duration extendedTimeout) {
        Cancellable previous;
        synchronized (this) {
            if (detached) {
                return false;
            }
            previous = timer;
            timer = replacement;
            timeout = extendedTimeout;
        }
        if (previous != null) {
            previous.cancel();
        }
        return true;
    }

    synchronized boolean attachEndpoint(DatagramEndpoint endpoint) {
        if (detached) {
            return false;
        }
        this.endpoint = endpoint;
        return true;
    }

    /**
     * Release the timer and endpoint. Subsequent attach calls fail.
     *
     * @return the endpoint that was attached, or {@code null}
     */
    DatagramEndpoint detach() {
        Cancellable t;
        DatagramEndpoint e;
        synchronized (this) {
            detached = true;
            t = timer;
            e = endpoint;
            timer = null;
            endpoint = null;
        }
        if (t != null) {
            t.cancel();
        }
        return e;
    }
}
