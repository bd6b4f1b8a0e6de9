package com.questrail.janus.client;

import com.questrail.janus.security.ResourceLimits;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PendingRequestTable
 * =============================================================================
 * The client's outstanding requests, keyed by request id.
 *
 * <h2>Resolution rule</h2>
 * A request is resolved by whoever removes it from the table. The response
 * path, the deadline timer and cancellation all race through
 * {@link #remove(String)}; only the winner completes the caller's future, and
 * it does so outside the table lock.
 *
 * <p>Outcome counters are kept under the same lock so a statistics snapshot is
 * consistent with the pending count.</p>
 */
final class PendingRequestTable
{
    private final ResourceLimits limits;
    private final Map<String, PendingRequest> pending = new HashMap<>();

    private long completed;
    private long failed;
    private long timedOut;
    private long cancelled;
    private long totalResponseNanos;

    PendingRequestTable(ResourceLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * @throws com.questrail.janus.api.JanusException with
     *         {@code RESOURCE_LIMIT_EXCEEDED} when the table is full
     */
    synchronized void register(PendingRequest request) {
        limits.checkPendingRequests(pending.size());
        if (pending.putIfAbsent(request.id(), request) != null) {
            throw new IllegalStateException("duplicate request id " + request.id());
        }
    }

    synchronized Optional<PendingRequest> remove(String id) {
        return Optional.ofNullable(pending.remove(id));
    }

    synchronized Optional<PendingRequest> get(String id) {
        return Optional.ofNullable(pending.get(id));
    }

    synchronized boolean contains(String id) {
        return pending.containsKey(id);
    }

    synchronized int size() {
        return pending.size();
    }

    synchronized List<PendingRequest> snapshot() {
        return new ArrayList<>(pending.values());
    }

    synchronized void recordOutcome(RequestStatus status, long elapsedNanos) {
        switch (status) {
            case COMPLETED -> {
                completed++;
                totalResponseNanos += elapsedNanos;
            }
            case FAILED -> failed++;
            case TIMED_OUT -> timedOut++;
            case CANCELLED -> cancelled++;
            case PENDING -> throw new IllegalArgumentException("not a terminal status");
        }
    }

    synchronized PendingRequestStatistics statistics(long nowNanos) {
        Duration average = completed == 0
                ? Duration.ZERO
                : Duration.ofNanos(totalResponseNanos / completed);
        long oldest = 0;
        for (PendingRequest p : pending.values()) {
            oldest = Math.max(oldest, nowNanos - p.createdAtNanos());
        }
        return new PendingRequestStatistics(
                pending.size(), completed, failed, timedOut, cancelled, average, Duration.ofNanos(oldest));
    }
}
