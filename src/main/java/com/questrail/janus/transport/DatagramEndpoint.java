package com.questrail.janus.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport.
 *
 * <p>An endpoint is either <em>bound</em> to a local address, in which case it
 * receives datagrams and peers can reply to it, or <em>unbound</em>, in which
 * case it can only send. The Janus server binds one endpoint at its socket
 * path; the client binds one short-lived endpoint per outstanding request at
 * the request's reply address and keeps one unbound endpoint for
 * fire-and-forget sends.</p>
 *
 * <p>Implementations may be backed by Netty, a test harness or an in-memory
 * network. Each payload is one whole datagram; there is no framing at this
 * boundary.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once. If the
     * endpoint cannot be activated (address in use, permission denied) it
     * notifies {@link DatagramEndpointListener#onTransportDown(Throwable)} with
     * the cause instead.</p>
     *
     * @throws IllegalStateException if no listener is set or the endpoint was
     *                               already started
     */
    void start();

    /**
     * Stop the endpoint and release its transport resources. The socket file of
     * a bound endpoint is left for its owner to remove.
     *
     * <p>The listener receives {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * at most once per transition. Safe to call more than once and from a
     * listener callback.</p>
     *
     * @return completes once a bind still in flight has settled and the
     *         channel is closed; only then is the socket file's existence
     *         final. Never completes exceptionally.
     */
    CompletableFuture<Void> stop();

    /**
     * Send one datagram.
     *
     * <p>Never blocks. The returned future completes when the datagram has been
     * handed to the operating system, or exceptionally with a
     * {@link DeliveryException} describing why it could not be.</p>
     *
     * @param remote  destination address
     * @param payload datagram payload
     */
    CompletableFuture<Void> send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
