package com.questrail.janus.transport;

import java.net.SocketAddress;

/**
 * Creates {@link DatagramEndpoint}s that share the factory's I/O resources.
 *
 * <p>Closing the factory releases those shared resources; endpoints created by
 * it must be stopped first.</p>
 */
public interface DatagramEndpointFactory extends AutoCloseable
{
    /**
     * @param bindAddress local address to bind, or {@code null} for a send-only
     *                    endpoint
     */
    DatagramEndpoint create(SocketAddress bindAddress);

    /**
     * Largest datagram payload endpoints from this factory can receive.
     */
    int maxDatagramSize();

    @Override
    void close();
}
