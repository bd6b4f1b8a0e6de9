package com.questrail.janus.runtime;

import com.questrail.janus.codec.EnvelopeCodec;
import com.questrail.janus.codec.impl.JacksonEnvelopeCodec;
import com.questrail.janus.config.ServerConfig;
import com.questrail.janus.internal.time.MonotonicClock;
import com.questrail.janus.internal.time.MonotonicScheduler;
import com.questrail.janus.internal.time.ScheduledExecutorScheduler;
import com.questrail.janus.internal.time.SystemMonotonicClock;
import com.questrail.janus.internal.time.SystemWallClock;
import com.questrail.janus.manifest.Manifest;
import com.questrail.janus.observability.JanusObservabilitySink;
import com.questrail.janus.observability.NullObservabilitySink;
import com.questrail.janus.server.JanusServer;
import com.questrail.janus.server.RequestHandler;
import com.questrail.janus.server.ServerStatistics;
import com.questrail.janus.transport.DatagramEndpointFactory;
import com.questrail.janus.transport.unix.netty.NettyUnixDatagramEndpointFactory;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JanusServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a Janus server.
 *
 * <p>Wires the epoll datagram transport, the envelope codec, the deadline
 * scheduler, the worker pool and the observability sink around a
 * {@link JanusServer}. {@link #stop()} stops the server first, then drains
 * the worker pool and the scheduler, then releases the transport.</p>
 */
public final class JanusServerRuntime {
    private final JanusServer server;
    private final ExecutorService workers;
    private final ScheduledExecutorService schedulerExecutor;
    private final DatagramEndpointFactory endpoints;
    private final boolean ownsEndpoints;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private JanusServerRuntime(
            JanusServer server,
            ExecutorService workers,
            ScheduledExecutorService schedulerExecutor,
            DatagramEndpointFactory endpoints,
            boolean ownsEndpoints) {
        this.server = server;
        this.workers = workers;
        this.schedulerExecutor = schedulerExecutor;
        this.endpoints = endpoints;
        this.ownsEndpoints = ownsEndpoints;
    }

    /**
     * Bind the socket and begin serving.
     *
     * @throws com.questrail.janus.api.JanusException with {@code SOCKET_ERROR}
     *         if the socket cannot be bound
     */
    public void start() {
        server.start();
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        server.stop();
        RuntimeExecutors.shutdown(workers);
        RuntimeExecutors.shutdown(schedulerExecutor);
        if (ownsEndpoints) {
            endpoints.close();
        }
    }

    public JanusServer server() {
        return server;
    }

    public void registerHandler(String command, RequestHandler handler) {
        server.registerHandler(command, handler);
    }

    public ServerStatistics statistics() {
        return server.statistics();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerConfig config;
        private Manifest manifest;
        private JanusObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private EnvelopeCodec codec = new JacksonEnvelopeCodec();
        private DatagramEndpointFactory endpoints;
        private int workerThreads = 0;

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withManifest(Manifest manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder withObservabilitySink(JanusObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withCodec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Use a caller-owned transport instead of the native epoll one. The
         * runtime does not close it.
         */
        public Builder withEndpointFactory(DatagramEndpointFactory endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        /**
         * Fixed worker pool size; {@code 0} (the default) uses an unbounded
         * pool, since handler concurrency is already capped by the server.
         */
        public Builder withWorkerThreads(int workerThreads) {
            if (workerThreads < 0) {
                throw new IllegalArgumentException("workerThreads must be >= 0");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public JanusServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(codec, "codec");

            // 1. Transport
            boolean ownsEndpoints = endpoints == null;
            DatagramEndpointFactory factory = ownsEndpoints
                    ? new NettyUnixDatagramEndpointFactory(config.maxMessageSize())
                    : endpoints;

            // 2. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("janus-timer", true));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 3. Workers
            DefaultThreadFactory workerThreadFactory = new DefaultThreadFactory("janus-worker", true);
            ExecutorService workers = workerThreads == 0
                    ? Executors.newCachedThreadPool(workerThreadFactory)
                    : Executors.newFixedThreadPool(workerThreads, workerThreadFactory);

            // 4. Server
            JanusServer server = new JanusServer(
                    config,
                    manifest,
                    factory,
                    codec,
                    workers,
                    scheduler,
                    clock,
                    SystemWallClock.INSTANCE,
                    observabilitySink);

            return new JanusServerRuntime(server, workers, schedulerExec, factory, ownsEndpoints);
        }
    }
}
