package com.questrail.janus.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;
import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.api.JanusResponse;
import com.questrail.janus.api.StructuredError;
import com.questrail.janus.codec.EnvelopeCodec;
import com.questrail.janus.config.ClientConfig;
import com.questrail.janus.internal.time.Cancellable;
import com.questrail.janus.internal.time.MonotonicClock;
import com.questrail.janus.internal.time.MonotonicScheduler;
import com.questrail.janus.internal.time.WallClock;
import com.questrail.janus.manifest.ArgumentValidator;
import com.questrail.janus.manifest.Manifest;
import com.questrail.janus.manifest.ManifestValidator;
import com.questrail.janus.manifest.ValidationResult;
import com.questrail.janus.observability.JanusErrorEvent;
import com.questrail.janus.observability.JanusObservabilitySink;
import com.questrail.janus.observability.JanusRequestEvent;
import com.questrail.janus.observability.JanusTransportEvent;
import com.questrail.janus.observability.JanusValidationEvent;
import com.questrail.janus.security.SecurityValidator;
import com.questrail.janus.transport.DatagramEndpoint;
import com.questrail.janus.transport.DatagramEndpointFactory;
import com.questrail.janus.transport.DatagramEndpointListener;
import com.questrail.janus.transport.DeliveryException;
import com.questrail.janus.transport.unix.ReplyAddresses;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * JanusClient
 * =============================================================================
 * Sends requests to one Janus server and correlates the answers.
 *
 * <h2>Per-request reply sockets</h2>
 * Every request that expects an answer binds its own reply socket at a fresh
 * path from {@link ReplyAddresses} and names it in {@code reply_to}. A
 * response arriving on that socket can only belong to that request; its
 * {@code request_id} is still checked and a mismatch is discarded.
 *
 * <h2>Exactly one outcome</h2>
 * A request ends in one of {@link RequestStatus#COMPLETED},
 * {@link RequestStatus#TIMED_OUT}, {@link RequestStatus#CANCELLED} or
 * {@link RequestStatus#FAILED}. The response path, the deadline timer and
 * cancellation all race through {@link PendingRequestTable#remove(String)};
 * the loser's outcome is dropped. Resolution releases the timer and stops the
 * reply endpoint. The reply socket file is removed once the endpoint reports
 * that it has stopped.
 *
 * <h2>Threading</h2>
 * All public methods are thread-safe and never block on the network. Futures
 * complete on transport, timer or caller threads.
 */
public final class JanusClient implements AutoCloseable
{
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(5);

    private final ClientConfig config;
    private final ArgumentValidator argumentValidator;
    private final DatagramEndpointFactory endpoints;
    private final EnvelopeCodec codec;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final JanusObservabilitySink sink;

    private final SecurityValidator security;
    private final ReplyAddresses replyAddresses;
    private final SocketAddress serverAddress;
    private final PendingRequestTable table;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object senderLock = new Object();
    private DatagramEndpoint sender;
    private CompletableFuture<DatagramEndpoint> senderReady;

    private volatile BiConsumer<String, Duration> timeoutListener = (id, timeout) -> {};

    /**
     * @param config    client configuration
     * @param manifest  manifest used for pre-send validation, or {@code null}
     * @param endpoints creates the per-request reply endpoints and the sender
     * @param codec     envelope codec
     * @param clock     deadline and elapsed-time source
     * @param wallClock envelope timestamp source
     * @param scheduler deadline timers
     * @param sink      observability sink
     * @throws JanusException with {@code SECURITY_VIOLATION} if the server or
     *                        reply socket location is unacceptable
     */
    public JanusClient(ClientConfig config,
                       Manifest manifest,
                       DatagramEndpointFactory endpoints,
                       EnvelopeCodec codec,
                       MonotonicClock clock,
                       WallClock wallClock,
                       MonotonicScheduler scheduler,
                       JanusObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.argumentValidator = manifest == null ? null : new ArgumentValidator(manifest);
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.security = new SecurityValidator(config.allowedSocketDirectories(), new ObjectMapper());
        security.validateSocketPath(config.serverSocketPath());

        this.replyAddresses = ReplyAddresses.forCurrentProcess(
                Path.of(config.replySocketDirectory()), config.replySocketPrefix());
        // Reply paths differ only in their random suffix, so one sample covers them all.
        security.validateSocketPath(replyAddresses.next().toString());

        this.serverAddress = ReplyAddresses.address(config.serverSocketPath());
        this.table = new PendingRequestTable(config.resourceLimits());
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Callback invoked with the request id and timeout whenever a request times
     * out. Runs on the timer thread.
     */
    public void setTimeoutListener(BiConsumer<String, Duration> listener) {
        this.timeoutListener = Objects.requireNonNull(listener, "listener");
    }

    // -------------------------------------------------------------------------
    // Request/response
    // -------------------------------------------------------------------------

    public CompletableFuture<JanusResponse> sendRequest(String command, Map<String, JsonNode> args) {
        return sendRequestWithHandle(command, args, null).response();
    }

    public CompletableFuture<JanusResponse> sendRequest(String command, Map<String, JsonNode> args, Duration timeout) {
        return sendRequestWithHandle(command, args, timeout).response();
    }

    /**
     * Send a request and return a handle for observing or cancelling it.
     *
     * <p>Validation and admission failures are thrown synchronously; anything
     * that happens after the request is registered completes the handle's
     * future.</p>
     *
     * @param timeout request deadline, or {@code null} for the configured default
     * @throws JanusException if the client is closed, the request fails
     *                        security or manifest validation, the encoded
     *                        request is too large, or too many requests are
     *                        pending
     */
    public RequestHandle sendRequestWithHandle(String command, Map<String, JsonNode> args, Duration timeout) {
        Map<String, JsonNode> effectiveArgs = admit(command, args);
        if (timeout != null) {
            security.validateTimeout(timeout);
        }
        Duration deadline = timeout != null ? timeout : config.defaultTimeout();

        Path replyPath = replyAddresses.next();
        JanusRequest request = JanusRequest.create(
                command, effectiveArgs, deadline, replyPath.toString(), wallClock.now());
        byte[] payload = encode(request);

        CompletableFuture<JanusResponse> future = new CompletableFuture<>();
        RequestHandle handle = new RequestHandle(request.id(), command, request.timestamp(), future,
                this::cancelRequest, this::extendTimeout);
        PendingRequest pending = new PendingRequest(
                request.id(), command, replyPath, clock.nowNanos(), deadline, future, handle);
        table.register(pending);

        Cancellable timer = scheduler.scheduleAfter(deadline, clock, () -> onDeadline(pending));
        if (!pending.attachTimer(timer)) {
            timer.cancel();
            return handle;
        }

        DatagramEndpoint endpoint;
        try {
            endpoint = endpoints.create(ReplyAddresses.address(replyPath));
        } catch (RuntimeException e) {
            resolve(pending, RequestStatus.FAILED, null,
                    new JanusException(ErrorCode.SOCKET_ERROR, "Failed to create reply socket: " + e.getMessage(), e));
            return handle;
        }
        endpoint.setListener(new ReplyListener(pending, endpoint, payload));
        if (!pending.attachEndpoint(endpoint)) {
            // Already resolved (deadline shorter than setup); never bind.
            return handle;
        }
        try {
            endpoint.start();
        } catch (RuntimeException e) {
            resolve(pending, RequestStatus.FAILED, null,
                    new JanusException(ErrorCode.SOCKET_ERROR, "Failed to bind reply socket: " + e.getMessage(), e));
        }
        return handle;
    }

    /**
     * Send a request without a reply address. The server runs the handler but
     * never answers.
     *
     * @return completes once the datagram has been handed to the operating
     *         system, or exceptionally with a {@link JanusException}
     */
    public CompletableFuture<Void> sendRequestNoResponse(String command, Map<String, JsonNode> args) {
        Map<String, JsonNode> effectiveArgs = admit(command, args);
        JanusRequest request = JanusRequest.create(command, effectiveArgs, null, null, wallClock.now());
        byte[] payload = encode(request);

        return sender()
                .thenCompose(ep -> ep.send(serverAddress, payload))
                .handle((ok, failure) -> {
                    if (failure != null) {
                        throw new CompletionException(toSendError(failure));
                    }
                    emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.SENT, request.id(), command));
                    return null;
                });
    }

    /**
     * Cancel an outstanding request. Idempotent: cancelling a request that has
     * already resolved returns {@code false} and changes nothing.
     */
    public boolean cancelRequest(RequestHandle handle) {
        Objects.requireNonNull(handle, "handle");
        Optional<PendingRequest> pending = table.remove(handle.internalId());
        if (pending.isEmpty()) {
            return false;
        }
        finish(pending.get(), RequestStatus.CANCELLED, null, new RequestCancelledException(handle.internalId()));
        return true;
    }

    /**
     * @return the number of requests cancelled
     */
    public int cancelAllRequests() {
        int n = 0;
        for (PendingRequest p : table.snapshot()) {
            if (cancelRequest(p.handle())) {
                n++;
            }
        }
        return n;
    }

    /**
     * Push a pending request's deadline back by {@code additional}. The new
     * deadline is measured from when the request was sent, so the request's
     * total timeout grows by exactly that amount.
     *
     * @return {@code false} if the request has already resolved
     * @throws IllegalArgumentException if {@code additional} is not positive
     * @throws JanusException with {@code SECURITY_VIOLATION} if the extended
     *                        timeout exceeds the allowed maximum
     */
    public boolean extendTimeout(RequestHandle handle, Duration additional) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(additional, "additional");
        if (additional.isZero() || additional.isNegative()) {
            throw new IllegalArgumentException("additional must be > 0");
        }
        Optional<PendingRequest> found = table.get(handle.internalId());
        if (found.isEmpty()) {
            return false;
        }
        PendingRequest pending = found.get();
        Duration extended = pending.timeout().plus(additional);
        security.validateTimeout(extended);

        long remainingNanos = pending.createdAtNanos() + extended.toNanos() - clock.nowNanos();
        Cancellable timer = scheduler.scheduleAfter(
                Duration.ofNanos(Math.max(0, remainingNanos)), clock, () -> onDeadline(pending));
        if (!pending.replaceTimer(timer, extended)) {
            timer.cancel();
            return false;
        }
        return true;
    }

    public RequestStatus requestStatus(RequestHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return table.contains(handle.internalId()) ? RequestStatus.PENDING : handle.status();
    }

    public List<RequestHandle> pendingRequests() {
        List<RequestHandle> out = new ArrayList<>();
        for (PendingRequest p : table.snapshot()) {
            out.add(p.handle());
        }
        return out;
    }

    public PendingRequestStatistics statistics() {
        return table.statistics(clock.nowNanos());
    }

    /**
     * Send the built-in {@code ping} command.
     */
    public CompletableFuture<JanusResponse> ping() {
        return sendRequest("ping", Map.of(), PING_TIMEOUT);
    }

    /**
     * @return completes with {@code true} iff a ping succeeds; never exceptionally
     */
    public CompletableFuture<Boolean> testConnection() {
        try {
            return ping().handle((response, failure) -> failure == null && response.success());
        } catch (JanusException e) {
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * Cancel all outstanding requests and release the sender endpoint. The
     * endpoint factory belongs to the caller and stays open.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancelAllRequests();
        DatagramEndpoint s;
        synchronized (senderLock) {
            s = sender;
            sender = null;
            senderReady = null;
        }
        if (s != null) {
            s.stop();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Map<String, JsonNode> admit(String command, Map<String, JsonNode> args) {
        Objects.requireNonNull(command, "command");
        Map<String, JsonNode> a = args == null ? Map.of() : args;
        if (closed.get()) {
            throw new JanusException(ErrorCode.SERVICE_UNAVAILABLE, "Client is closed");
        }
        security.validateCommandName(command);
        security.validateArgs(a);

        if (argumentValidator != null
                && config.validateBeforeSend()
                && !ManifestValidator.RESERVED_COMMANDS.contains(command)) {
            ValidationResult result = argumentValidator.validate(command, a);
            if (!result.isValid()) {
                StructuredError error = result.error().orElseThrow();
                sink.onValidationEvent(new JanusValidationEvent(
                        wallClock.now(), JanusValidationEvent.Stage.ARGUMENTS, null, command, error));
                throw new JanusException(error);
            }
            return result.effectiveArgs();
        }
        return a;
    }

    private byte[] encode(JanusRequest request) {
        byte[] payload = codec.encodeRequest(request);
        if (payload.length > config.maxMessageSize()) {
            throw new JanusException(ErrorCode.RESOURCE_LIMIT_EXCEEDED,
                    "Request size " + payload.length + " exceeds maximum message size " + config.maxMessageSize());
        }
        return payload;
    }

    private CompletableFuture<DatagramEndpoint> sender() {
        synchronized (senderLock) {
            if (closed.get()) {
                return CompletableFuture.failedFuture(
                        new JanusException(ErrorCode.SERVICE_UNAVAILABLE, "Client is closed"));
            }
            if (senderReady != null) {
                return senderReady;
            }
            DatagramEndpoint ep = endpoints.create(null);
            CompletableFuture<DatagramEndpoint> ready = new CompletableFuture<>();
            ep.setListener(new SenderListener(ep, ready));
            sender = ep;
            senderReady = ready;
            ep.start();
            return ready;
        }
    }

    private void onDeadline(PendingRequest pending) {
        RequestTimeoutException timeout = new RequestTimeoutException(pending.id(), pending.timeout());
        if (resolve(pending, RequestStatus.TIMED_OUT, null, timeout)) {
            try {
                timeoutListener.accept(pending.id(), pending.timeout());
            } catch (RuntimeException e) {
                sink.onError(new JanusErrorEvent(wallClock.now(), "Timeout listener failed", e));
            }
        }
    }

    /**
     * Resolve {@code pending} if it is still outstanding.
     *
     * @return {@code true} if this call won the resolution
     */
    private boolean resolve(PendingRequest pending, RequestStatus status, JanusResponse response, Throwable failure) {
        Optional<PendingRequest> removed = table.remove(pending.id());
        if (removed.isEmpty()) {
            return false;
        }
        finish(removed.get(), status, response, failure);
        return true;
    }

    private void finish(PendingRequest pending, RequestStatus status, JanusResponse response, Throwable failure) {
        DatagramEndpoint endpoint = pending.detach();
        if (endpoint != null) {
            // A bind still in flight may create the file after this point.
            endpoint.stop().whenComplete((ok, ignored) -> deleteReplySocket(pending.replyPath()));
        }
        else {
            deleteReplySocket(pending.replyPath());
        }

        long elapsedNanos = clock.nowNanos() - pending.createdAtNanos();
        table.recordOutcome(status, elapsedNanos);
        pending.handle().resolved(status);

        StructuredError error = failure == null ? null : JanusException.toStructuredError(failure);
        emit(new JanusRequestEvent(wallClock.now(), kindOf(status), pending.id(), pending.command(),
                Duration.ofNanos(elapsedNanos), error));

        if (status == RequestStatus.COMPLETED) {
            pending.future().complete(response);
        }
        else {
            pending.future().completeExceptionally(failure);
        }
    }

    private void deleteReplySocket(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            sink.onError(new JanusErrorEvent(wallClock.now(), "Failed to remove reply socket " + path, e));
        }
    }

    private JanusException toSendError(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof JanusException je) {
            return je;
        }
        if (t instanceof DeliveryException d) {
            if (d.isTargetMissing()) {
                return new JanusException(ErrorCode.SERVER_ERROR,
                        "target socket does not exist: " + config.serverSocketPath(), d);
            }
            if (d.reason() == DeliveryException.Reason.MESSAGE_TOO_LARGE) {
                return new JanusException(ErrorCode.RESOURCE_LIMIT_EXCEEDED,
                        "Datagram rejected as too large by the transport", d);
            }
        }
        return new JanusException(ErrorCode.SOCKET_ERROR, "Failed to send request: " + t.getMessage(), t);
    }

    private static JanusRequestEvent.Kind kindOf(RequestStatus status) {
        return switch (status) {
            case COMPLETED -> JanusRequestEvent.Kind.COMPLETED;
            case TIMED_OUT -> JanusRequestEvent.Kind.TIMED_OUT;
            case CANCELLED -> JanusRequestEvent.Kind.CANCELLED;
            case FAILED -> JanusRequestEvent.Kind.FAILED;
            case PENDING -> throw new IllegalArgumentException("not a terminal status");
        };
    }

    private void emit(JanusRequestEvent event) {
        sink.onRequestEvent(event);
    }

    /**
     * Listener of one request's reply endpoint: sends the request once the
     * reply socket is bound, then waits for the correlated response.
     */
    private final class ReplyListener implements DatagramEndpointListener
    {
        private final PendingRequest pending;
        private final DatagramEndpoint endpoint;
        private final byte[] payload;

        ReplyListener(PendingRequest pending, DatagramEndpoint endpoint, byte[] payload) {
            this.pending = pending;
            this.endpoint = endpoint;
            this.payload = payload;
        }

        @Override
        public void onTransportUp() {
            if (!table.contains(pending.id())) {
                return;
            }
            emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.SENT, pending.id(), pending.command()));
            endpoint.send(serverAddress, payload).whenComplete((ok, failure) -> {
                if (failure != null) {
                    resolve(pending, RequestStatus.FAILED, null, toSendError(failure));
                }
            });
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (cause != null) {
                sink.onTransportEvent(new JanusTransportEvent(wallClock.now(), JanusTransportEvent.Kind.DOWN,
                        pending.replyPath().toString(), "reply socket failed", cause));
                resolve(pending, RequestStatus.FAILED, null,
                        new JanusException(ErrorCode.SOCKET_ERROR,
                                "Reply socket " + pending.replyPath() + " failed: " + cause.getMessage(), cause));
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] bytes) {
            Optional<JanusResponse> decoded = codec.decodeResponse(bytes);
            if (decoded.isEmpty()) {
                sink.onTransportEvent(new JanusTransportEvent(wallClock.now(),
                        JanusTransportEvent.Kind.DATAGRAM_DROPPED, pending.replyPath().toString(),
                        "malformed response", null));
                return;
            }
            JanusResponse response = decoded.get();
            if (!response.requestId().equals(pending.id())) {
                emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.PROTOCOL_MISMATCH,
                        response.requestId(), pending.command()));
                return;
            }
            if (!resolve(pending, RequestStatus.COMPLETED, response, null)) {
                emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.LATE_RESPONSE_DISCARDED,
                        response.requestId(), pending.command()));
            }
        }
    }

    /**
     * Listener of the shared fire-and-forget sender. Inbound datagrams are
     * unexpected on an unbound socket and ignored.
     */
    private final class SenderListener implements DatagramEndpointListener
    {
        private final DatagramEndpoint endpoint;
        private final CompletableFuture<DatagramEndpoint> ready;

        SenderListener(DatagramEndpoint endpoint, CompletableFuture<DatagramEndpoint> ready) {
            this.endpoint = endpoint;
            this.ready = ready;
        }

        @Override
        public void onTransportUp() {
            ready.complete(endpoint);
        }

        @Override
        public void onTransportDown(Throwable cause) {
            synchronized (senderLock) {
                if (sender == endpoint) {
                    sender = null;
                    senderReady = null;
                }
            }
            ready.completeExceptionally(new JanusException(ErrorCode.SOCKET_ERROR,
                    "Sender socket is down", cause));
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            // unbound; nothing is addressed here
        }
    }
}
