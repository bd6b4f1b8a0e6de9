package com.questrail.janus.server;

/**
 * Snapshot of a server's dispatch counters.
 *
 * @param requestsReceived    requests that decoded and passed screening
 * @param responsesSent       responses handed to the transport
 * @param datagramsDropped    datagrams discarded without an answer
 * @param handlerTimeouts     handlers that lost the race against their deadline
 * @param rejections          requests refused because no handler permit was free
 * @param deliveryFailures    responses the transport could not deliver
 * @param activeHandlers      handlers holding a permit right now
 * @param registeredHandlers  handlers in the registry
 */
public record ServerStatistics(
    long requestsReceived,
    long responsesSent,
    long datagramsDropped,
    long handlerTimeouts,
    long rejections,
    long deliveryFailures,
    int activeHandlers,
    int registeredHandlers
) {
}
