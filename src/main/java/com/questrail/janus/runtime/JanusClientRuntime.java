package com.questrail.janus.runtime;

import com.questrail.janus.codec.EnvelopeCodec;
import com.questrail.janus.codec.impl.JacksonEnvelopeCodec;
import com.questrail.janus.client.JanusClient;
import com.questrail.janus.config.ClientConfig;
import com.questrail.janus.internal.time.MonotonicClock;
import com.questrail.janus.internal.time.ScheduledExecutorScheduler;
import com.questrail.janus.internal.time.SystemMonotonicClock;
import com.questrail.janus.internal.time.SystemWallClock;
import com.questrail.janus.manifest.Manifest;
import com.questrail.janus.observability.JanusObservabilitySink;
import com.questrail.janus.observability.NullObservabilitySink;
import com.questrail.janus.transport.DatagramEndpointFactory;
import com.questrail.janus.transport.unix.netty.NettyUnixDatagramEndpointFactory;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JanusClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a Janus client.
 *
 * <p>{@link #close()} closes the client (cancelling what is still pending),
 * then drains the timer thread and releases the transport.</p>
 */
public final class JanusClientRuntime implements AutoCloseable {
    private final JanusClient client;
    private final ScheduledExecutorService schedulerExecutor;
    private final DatagramEndpointFactory endpoints;
    private final boolean ownsEndpoints;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private JanusClientRuntime(
            JanusClient client,
            ScheduledExecutorService schedulerExecutor,
            DatagramEndpointFactory endpoints,
            boolean ownsEndpoints) {
        this.client = client;
        this.schedulerExecutor = schedulerExecutor;
        this.endpoints = endpoints;
        this.ownsEndpoints = ownsEndpoints;
    }

    public JanusClient client() {
        return client;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        client.close();
        RuntimeExecutors.shutdown(schedulerExecutor);
        if (ownsEndpoints) {
            endpoints.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ClientConfig config;
        private Manifest manifest;
        private JanusObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private EnvelopeCodec codec = new JacksonEnvelopeCodec();
        private DatagramEndpointFactory endpoints;

        public Builder withConfig(ClientConfig config) {
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

        public JanusClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(codec, "codec");

            boolean ownsEndpoints = endpoints == null;
            DatagramEndpointFactory factory = ownsEndpoints
                    ? new NettyUnixDatagramEndpointFactory(config.maxMessageSize())
                    : endpoints;

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("janus-client-timer", true));

            JanusClient client = new JanusClient(
                    config,
                    manifest,
                    factory,
                    codec,
                    clock,
                    SystemWallClock.INSTANCE,
                    new ScheduledExecutorScheduler(schedulerExec, clock),
                    observabilitySink);

            return new JanusClientRuntime(client, schedulerExec, factory, ownsEndpoints);
        }
    }
}
