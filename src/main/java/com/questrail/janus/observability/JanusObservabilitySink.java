package com.questrail.janus.observability;

/**
 * Receives Janus observability events from the client and server engines.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive concurrently from event-loop, worker and timer
 * threads. Implementations must be thread-safe and must not block.</p>
 */
public interface JanusObservabilitySink {
    /**
     * A request moved through its lifecycle (sent, completed, timed out, ...).
     * @param event the lifecycle event
     */
    void onRequestEvent(JanusRequestEvent event);

    /**
     * Transport-level change or datagram-level anomaly.
     * @param event the transport event
     */
    void onTransportEvent(JanusTransportEvent event);

    /**
     * Manifest validation rejected arguments or a result.
     * @param event the validation event
     */
    void onValidationEvent(JanusValidationEvent event);

    /**
     * Unexpected failure inside the engines.
     * @param event the error event
     */
    void onError(JanusErrorEvent event);
}
