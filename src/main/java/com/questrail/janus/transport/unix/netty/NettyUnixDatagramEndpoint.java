package com.questrail.janus.transport.unix.netty;

import com.questrail.janus.transport.DatagramEndpoint;
import com.questrail.janus.transport.DatagramEndpointListener;
import com.questrail.janus.transport.DeliveryException;
import com.questrail.janus.transport.unix.ReplyAddresses;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.epoll.EpollDomainDatagramChannel;
import io.netty.channel.unix.DomainDatagramPacket;
import io.netty.channel.unix.DomainSocketAddress;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUnixDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the Janus {@link DatagramEndpoint} port over
 * Unix domain datagram sockets ({@code SOCK_DGRAM}, native epoll).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It does not:
 * <ul>
 *   <li>decode envelopes</li>
 *   <li>validate requests</li>
 *   <li>arm timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf},
 * {@code DomainSocketAddress}) do not escape this package. Addresses cross the
 * port as {@link UnixDomainSocketAddress}; inbound payloads are copied into
 * {@code byte[]} and all reference-counted buffers are released internally.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the socket file (or registers an unbound channel)
 *   and notifies the listener asynchronously.
 * - {@link #stop()} closes the channel. A stop that races the bind waits for
 *   the bind to settle, so the returned future completes only once the socket
 *   file can no longer appear. The file stays on disk; its owner removes it.
 *   The event loop group belongs to the factory and is not shut down here.
 */
public final class NettyUnixDatagramEndpoint implements DatagramEndpoint
{
    private final Path bindPath;
    private final Bootstrap bootstrap;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;
    private ChannelFuture startFuture;
    private boolean stopped;

    /**
     * @param group           shared event loop group (epoll)
     * @param bindPath        socket file to bind, or {@code null} for a send-only endpoint
     * @param maxDatagramSize receive buffer size; larger datagrams are truncated by the kernel
     */
    NettyUnixDatagramEndpoint(EventLoopGroup group, Path bindPath, int maxDatagramSize)
    {
        Objects.requireNonNull(group, "group");
        if (maxDatagramSize <= 0) {
            throw new IllegalArgumentException("maxDatagramSize must be > 0");
        }
        this.bindPath = bindPath;

        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(EpollDomainDatagramChannel.class)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramSize))
                .handler(new ChannelInitializer<EpollDomainDatagramChannel>() {
                    @Override
                    protected void initChannel(EpollDomainDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
        if (bindPath == null) {
            // An unbound datagram channel never becomes active on its own.
            bootstrap.option(ChannelOption.DATAGRAM_CHANNEL_ACTIVE_ON_REGISTRATION, true);
        }
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("endpoint already started");
        }

        ChannelFuture f;
        synchronized (this) {
            if (stopped) {
                throw new IllegalStateException("endpoint already stopped");
            }
            f = bindPath == null
                    ? bootstrap.register()
                    : bootstrap.bind(new DomainSocketAddress(bindPath.toString()));
            startFuture = f;
        }
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                if (down.get()) {
                    // stop() raced the bind
                    future.channel().close();
                    return;
                }
                channel = future.channel();
                l.onTransportUp();
            }
            else {
                future.channel().close();
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public CompletableFuture<Void> stop()
    {
        ChannelFuture f;
        synchronized (this) {
            stopped = true;
            f = startFuture;
        }
        channel = null;
        notifyDown(null);
        if (f == null) {
            terminated.complete(null);
            return terminated;
        }
        // Fires once the bind or registration has settled, even if it is still in flight.
        f.addListener((ChannelFutureListener) settled ->
                settled.channel().close().addListener((ChannelFutureListener) closed -> terminated.complete(null)));
        return terminated;
    }

    @Override
    public CompletableFuture<Void> send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new DeliveryException(
                    DeliveryException.Reason.TRANSPORT_DOWN, remote, "endpoint is not started"));
        }

        DomainSocketAddress recipient = new DomainSocketAddress(ReplyAddresses.pathOf(remote));
        ByteBuf buf = Unpooled.wrappedBuffer(payload);

        CompletableFuture<Void> result = new CompletableFuture<>();
        ch.writeAndFlush(new DomainDatagramPacket(buf, recipient)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(DeliveryException.classify(remote, future.cause()));
            }
        });
        return result;
    }

    /** Bound socket path, or {@code null} for a send-only endpoint. */
    public Path bindPath()
    {
        return bindPath;
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        if (!down.compareAndSet(false, true)) {
            return;
        }
        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DomainDatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DomainDatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DomainDatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            DomainSocketAddress sender = packet.sender();
            String senderPath = sender == null || sender.path() == null ? "" : sender.path();
            l.onDatagram(UnixDomainSocketAddress.of(senderPath), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
