/**
 * Janus Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete datagram implementation
 * (Netty epoll Unix domain sockets, an in-memory test network) and the Janus
 * client and server engines.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>addresses as standard {@link java.net.SocketAddress}, in practice
 *       {@link java.net.UnixDomainSocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 *   <li>send outcomes as {@code CompletableFuture<Void>} failing with
 *       {@link com.questrail.janus.transport.DeliveryException}</li>
 * </ul>
 *
 * <p>Adapters perform I/O only. They do not decode envelopes, validate
 * requests or arm timers.</p>
 */
package com.questrail.janus.transport;
