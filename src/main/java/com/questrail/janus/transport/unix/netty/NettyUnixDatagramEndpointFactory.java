package com.questrail.janus.transport.unix.netty;

import com.questrail.janus.transport.DatagramEndpoint;
import com.questrail.janus.transport.DatagramEndpointFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * NettyUnixDatagramEndpointFactory
 * =============================================================================
 * Creates {@link NettyUnixDatagramEndpoint}s sharing one epoll event loop group.
 *
 * <p>A client creates one endpoint per outstanding request; sharing the group
 * keeps that cheap. Requires the Netty native epoll transport (Linux).</p>
 */
public final class NettyUnixDatagramEndpointFactory implements DatagramEndpointFactory
{
    private final EventLoopGroup group;
    private final int maxDatagramSize;

    public NettyUnixDatagramEndpointFactory(int maxDatagramSize)
    {
        this(maxDatagramSize, 1);
    }

    public NettyUnixDatagramEndpointFactory(int maxDatagramSize, int ioThreads)
    {
        if (!Epoll.isAvailable()) {
            throw new IllegalStateException("native epoll transport unavailable", Epoll.unavailabilityCause());
        }
        if (maxDatagramSize <= 0) {
            throw new IllegalArgumentException("maxDatagramSize must be > 0");
        }
        if (ioThreads <= 0) {
            throw new IllegalArgumentException("ioThreads must be > 0");
        }
        this.maxDatagramSize = maxDatagramSize;
        this.group = new EpollEventLoopGroup(ioThreads, new DefaultThreadFactory("janus-io", true));
    }

    /** Whether the native transport can be used on this host. */
    public static boolean isAvailable()
    {
        return Epoll.isAvailable();
    }

    @Override
    public DatagramEndpoint create(SocketAddress bindAddress)
    {
        if (bindAddress == null) {
            return new NettyUnixDatagramEndpoint(group, null, maxDatagramSize);
        }
        if (!(bindAddress instanceof UnixDomainSocketAddress unix)) {
            throw new IllegalArgumentException("not a Unix domain socket address: " + bindAddress);
        }
        return new NettyUnixDatagramEndpoint(group, unix.getPath(), maxDatagramSize);
    }

    @Override
    public int maxDatagramSize()
    {
        return maxDatagramSize;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
