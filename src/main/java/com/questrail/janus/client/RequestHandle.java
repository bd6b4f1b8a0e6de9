package com.questrail.janus.client;

import com.questrail.janus.api.JanusResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * RequestHandle
 * =============================================================================
 * Caller's capability to observe and cancel one outstanding request.
 *
 * <p>The client keeps the authoritative pending state; the handle only records
 * the outcome it was resolved with. {@link #response()} completes:</p>
 * <ul>
 *   <li>normally with the {@link JanusResponse}, which may itself carry a
 *       structured error;</li>
 *   <li>exceptionally with {@link RequestTimeoutException} on timeout;</li>
 *   <li>exceptionally with {@link RequestCancelledException} on cancellation;</li>
 *   <li>exceptionally with a {@link com.questrail.janus.api.JanusException}
 *       if the request could not be sent.</li>
 * </ul>
 */
public final class RequestHandle
{
    private final String requestId;
    private final String command;
    private final Instant createdAt;
    private final CompletableFuture<JanusResponse> response;
    private final Predicate<RequestHandle> canceller;
    private final BiPredicate<RequestHandle, Duration> extender;

    private volatile RequestStatus status = RequestStatus.PENDING;

    RequestHandle(String requestId,
                  String command,
                  Instant createdAt,
                  CompletableFuture<JanusResponse> response,
                  Predicate<RequestHandle> canceller,
                  BiPredicate<RequestHandle, Duration> extender) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.command = Objects.requireNonNull(command, "command");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.response = Objects.requireNonNull(response, "response");
        this.canceller = Objects.requireNonNull(canceller, "canceller");
        this.extender = Objects.requireNonNull(extender, "extender");
    }

    String internalId() {
        return requestId;
    }

    public String command() {
        return command;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public CompletableFuture<JanusResponse> response() {
        return response;
    }

    public RequestStatus status() {
        return status;
    }

    public boolean isCancelled() {
        return status == RequestStatus.CANCELLED;
    }

    /**
     * Cancel the request. A no-op returning {@code false} if the request has
     * already reached a terminal state.
     */
    public boolean cancel() {
        return canceller.test(this);
    }

    /**
     * Give the request {@code additional} time before it times out.
     *
     * @return {@code false} if the request has already reached a terminal state
     */
    public boolean extendTimeout(Duration additional) {
        return extender.test(this, additional);
    }

    void resolved(RequestStatus terminal) {
        this.status = terminal;
    }

    @Override
    public String toString() {
        return "RequestHandle[" + command + ", " + status + "]";
    }
}
