package com.questrail.janus.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks for one endpoint are delivered serially. Netty-backed endpoints
 * deliver them on the channel's event loop, so listeners must hand any blocking
 * work to another thread.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The endpoint is usable: bound (and receiving) or, for an unbound
     * endpoint, ready to send.
     */
    void onTransportUp();

    /**
     * The endpoint is no longer usable, or could not be activated.
     *
     * @param cause the failure, or {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);

    /**
     * A datagram was received.
     *
     * <p>The payload is a private copy of exactly the bytes received; the
     * listener may keep it.</p>
     *
     * @param remote  sender address; an unbound sender has an empty path
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
