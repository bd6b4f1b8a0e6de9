package com.questrail.janus.client;

import java.time.Duration;

/**
 * Snapshot of a client's request bookkeeping.
 *
 * @param pending             requests currently awaiting an outcome
 * @param completed           requests that received a correlated response
 * @param failed              requests that could not be sent
 * @param timedOut            requests whose deadline elapsed
 * @param cancelled           requests cancelled by the caller
 * @param averageResponseTime mean send-to-response time of completed requests
 * @param oldestPendingAge    age of the oldest pending request, zero when none
 */
public record PendingRequestStatistics(
    int pending,
    long completed,
    long failed,
    long timedOut,
    long cancelled,
    Duration averageResponseTime,
    Duration oldestPendingAge
) {
}
