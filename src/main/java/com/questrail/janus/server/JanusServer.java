package com.questrail.janus.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;
import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.api.JanusResponse;
import com.questrail.janus.api.StructuredError;
import com.questrail.janus.codec.EnvelopeCodec;
import com.questrail.janus.config.ServerConfig;
import com.questrail.janus.internal.exec.DeadlineRace;
import com.questrail.janus.internal.time.MonotonicClock;
import com.questrail.janus.internal.time.MonotonicScheduler;
import com.questrail.janus.internal.time.WallClock;
import com.questrail.janus.manifest.ArgumentValidator;
import com.questrail.janus.manifest.Manifest;
import com.questrail.janus.manifest.ResponseValidator;
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
import com.questrail.janus.transport.unix.ReplyAddresses;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JanusServer
 * =============================================================================
 * Binds one socket path and answers Janus requests.
 *
 * <h2>Dispatch pipeline</h2>
 * Each datagram is handed off the transport thread to the worker pool and then
 * goes through, in order:
 * <ol>
 *   <li>payload screening and envelope decoding: failures are dropped, or
 *       answered with {@code PARSE_ERROR} when configured and a reply address
 *       can be recovered</li>
 *   <li>request screening ({@link SecurityValidator}): failures answer
 *       {@code SECURITY_VIOLATION}; a request whose reply address is itself
 *       unsafe is dropped</li>
 *   <li>handler lookup: registered handlers first, then built-ins;
 *       otherwise {@code METHOD_NOT_FOUND}</li>
 *   <li>argument validation against the manifest, which also applies
 *       declared defaults</li>
 *   <li>concurrency admission: no free permit answers
 *       {@code RESOURCE_LIMIT_EXCEEDED} without running the handler</li>
 *   <li>the handler, raced against the request's deadline
 *       ({@link DeadlineRace}); the deadline answers {@code HANDLER_TIMEOUT}</li>
 *   <li>advisory response validation</li>
 * </ol>
 *
 * <h2>Replies</h2>
 * A request with a reply address gets exactly one response; a request without
 * one gets none. Delivery failures are counted and reported, never thrown.
 *
 * <h2>Threading</h2>
 * The transport thread never blocks. The worker pool and the scheduler belong
 * to the caller (see {@code JanusServerRuntime}), which shuts them down.
 */
public final class JanusServer
{
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(5);

    private final ServerConfig config;
    private final Manifest manifest;
    private final ArgumentValidator argumentValidator;
    private final ResponseValidator responseValidator;
    private final DatagramEndpointFactory endpoints;
    private final EnvelopeCodec codec;
    private final ExecutorService workers;
    private final WallClock wallClock;
    private final JanusObservabilitySink sink;

    private final SecurityValidator security;
    private final HandlerRegistry registry;
    private final BuiltinHandlers builtins;
    private final DeadlineRace race;
    private final Semaphore permits;
    private final Path socketPath;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile DatagramEndpoint endpoint;

    private final AtomicLong requestsReceived = new AtomicLong();
    private final AtomicLong responsesSent = new AtomicLong();
    private final AtomicLong datagramsDropped = new AtomicLong();
    private final AtomicLong handlerTimeouts = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();

    /**
     * @param config    server configuration
     * @param manifest  manifest for argument and response validation, or {@code null}
     * @param endpoints creates the server's bound endpoint
     * @param codec     envelope codec
     * @param workers   runs datagram processing and handlers
     * @param scheduler handler deadline timers
     * @param clock     deadline source
     * @param wallClock envelope timestamp source
     * @param sink      observability sink
     * @throws JanusException with {@code SECURITY_VIOLATION} if the socket path is unacceptable
     */
    public JanusServer(ServerConfig config,
                       Manifest manifest,
                       DatagramEndpointFactory endpoints,
                       EnvelopeCodec codec,
                       ExecutorService workers,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       WallClock wallClock,
                       JanusObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.manifest = manifest;
        this.argumentValidator = manifest == null ? null : new ArgumentValidator(manifest);
        this.responseValidator = manifest == null ? null : new ResponseValidator(manifest);
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        ObjectMapper mapper = new ObjectMapper();
        this.security = new SecurityValidator(config.allowedSocketDirectories(), mapper);
        security.validateSocketPath(config.socketPath());

        this.registry = new HandlerRegistry(config.resourceLimits());
        this.builtins = new BuiltinHandlers(mapper, wallClock, manifest, this::statistics);
        this.race = new DeadlineRace(workers, scheduler, clock);
        this.permits = new Semaphore(config.maxConcurrentHandlers());
        this.socketPath = Path.of(config.socketPath());
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Bind the socket and begin serving. Blocks until the socket is bound.
     *
     * @throws JanusException with {@code SOCKET_ERROR} if the socket cannot be bound
     * @throws IllegalStateException if the server is already running
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }

        if (config.cleanupOnStart()) {
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException e) {
                running.set(false);
                throw new JanusException(ErrorCode.SOCKET_ERROR,
                        "Failed to remove stale socket " + socketPath + ": " + e.getMessage(), e);
            }
        }

        CompletableFuture<Void> up = new CompletableFuture<>();
        DatagramEndpoint ep = endpoints.create(ReplyAddresses.address(socketPath));
        ep.setListener(new ServerListener(up));
        endpoint = ep;
        ep.start();

        try {
            up.get(BIND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            abortStart(ep);
            Throwable cause = e.getCause();
            throw new JanusException(ErrorCode.SOCKET_ERROR,
                    "Failed to bind " + socketPath + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            abortStart(ep);
            throw new JanusException(ErrorCode.SOCKET_ERROR, "Timed out binding " + socketPath, e);
        } catch (InterruptedException e) {
            abortStart(ep);
            Thread.currentThread().interrupt();
            throw new JanusException(ErrorCode.SOCKET_ERROR, "Interrupted while binding " + socketPath, e);
        }
    }

    /**
     * Stop receiving and close the socket. Handlers already running finish on
     * the worker pool, but their responses can no longer be sent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        DatagramEndpoint ep = endpoint;
        endpoint = null;
        if (ep != null) {
            ep.stop();
        }
        if (config.cleanupOnShutdown()) {
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException e) {
                sink.onError(new JanusErrorEvent(wallClock.now(), "Failed to remove socket " + socketPath, e));
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Path socketPath() {
        return socketPath;
    }

    private void abortStart(DatagramEndpoint ep) {
        endpoint = null;
        ep.stop();
        running.set(false);
    }

    // -------------------------------------------------------------------------
    // Handlers
    // -------------------------------------------------------------------------

    public void registerHandler(String command, RequestHandler handler) {
        registry.register(command, handler);
    }

    public boolean unregisterHandler(String command) {
        return registry.unregister(command);
    }

    /** Names of the registered (non built-in) handlers. */
    public Set<String> handlers() {
        return registry.commands();
    }

    public ServerStatistics statistics() {
        return new ServerStatistics(
                requestsReceived.get(),
                responsesSent.get(),
                datagramsDropped.get(),
                handlerTimeouts.get(),
                rejections.get(),
                deliveryFailures.get(),
                config.maxConcurrentHandlers() - permits.availablePermits(),
                registry.size());
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    private void processSafely(byte[] payload) {
        try {
            process(payload);
        } catch (RuntimeException e) {
            sink.onError(new JanusErrorEvent(wallClock.now(), "Failed to process datagram", e));
        }
    }

    private void process(byte[] payload) {
        Optional<JanusRequest> decoded;
        try {
            security.validatePayload(payload);
            decoded = codec.decodeRequest(payload);
        } catch (JanusException e) {
            decoded = Optional.empty();
        }
        if (decoded.isEmpty()) {
            onMalformed(payload);
            return;
        }
        JanusRequest request = decoded.get();

        if (request.expectsReply() && !isSafeReplyAddress(request.replyTo())) {
            drop("unsafe reply address " + request.replyTo(), null);
            return;
        }
        try {
            security.validateRequest(request);
        } catch (JanusException e) {
            if (request.expectsReply()) {
                respond(request, e.error());
            }
            else {
                drop("request failed screening", e);
            }
            return;
        }

        requestsReceived.incrementAndGet();
        emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.RECEIVED, request.id(), request.command()));

        Optional<RequestHandler> handler = registry.lookup(request.command());
        if (handler.isEmpty() && config.builtinCommands()) {
            handler = builtins.lookup(request.command());
        }
        if (handler.isEmpty()) {
            respond(request, StructuredError.of(ErrorCode.METHOD_NOT_FOUND,
                    "Command '" + request.command() + "' not found"));
            return;
        }

        if (argumentValidator != null && manifest.hasCommand(request.command())) {
            ValidationResult result = argumentValidator.validate(request.command(), request.args());
            if (!result.isValid()) {
                StructuredError error = result.error().orElseThrow();
                sink.onValidationEvent(new JanusValidationEvent(wallClock.now(),
                        JanusValidationEvent.Stage.ARGUMENTS, request.id(), request.command(), error));
                respond(request, error);
                return;
            }
            request = request.withArgs(result.effectiveArgs());
        }

        if (!permits.tryAcquire()) {
            rejections.incrementAndGet();
            StructuredError error = StructuredError.of(ErrorCode.RESOURCE_LIMIT_EXCEEDED,
                    "Too many concurrent handlers (max " + config.maxConcurrentHandlers() + ")");
            emit(new JanusRequestEvent(wallClock.now(), JanusRequestEvent.Kind.REJECTED,
                    request.id(), request.command(), null, error));
            respond(request, error);
            return;
        }

        dispatch(request, handler.get());
    }

    private void dispatch(JanusRequest request, RequestHandler handler) {
        Duration deadline = request.timeoutOpt().orElse(config.defaultTimeout());
        emit(JanusRequestEvent.of(wallClock.now(), JanusRequestEvent.Kind.DISPATCHED, request.id(), request.command()));

        DeadlineRace.Race<HandlerResult> r;
        try {
            r = race.run(() -> handler.handle(request), deadline);
        } catch (RuntimeException e) {
            // the scheduler refused the deadline timer
            permits.release();
            respond(request, StructuredError.of(ErrorCode.SERVICE_UNAVAILABLE, "Server is shutting down"));
            return;
        }
        r.settled().whenComplete((v, t) -> permits.release());
        r.outcome().thenAccept(outcome -> complete(request, deadline, outcome));
    }

    private void complete(JanusRequest request, Duration deadline, DeadlineRace.Outcome<HandlerResult> outcome) {
        if (outcome.timedOut()) {
            handlerTimeouts.incrementAndGet();
            StructuredError error = StructuredError.of(ErrorCode.HANDLER_TIMEOUT,
                    "Handler for '" + request.command() + "' timed out after " + deadline.toMillis() + "ms");
            emit(new JanusRequestEvent(wallClock.now(), JanusRequestEvent.Kind.HANDLER_TIMED_OUT,
                    request.id(), request.command(), deadline, error));
            respond(request, error);
            return;
        }
        if (outcome.failed()) {
            respond(request, handlerFailure(outcome.failure()));
            return;
        }

        HandlerResult result = outcome.value();
        if (result instanceof HandlerResult.Failure f) {
            respond(request, f.error());
        }
        else if (result instanceof HandlerResult.Success s) {
            validateResult(request, s.value());
            respond(request, JanusResponse.success(request.id(), s.value(), wallClock.now()));
        }
        else {
            respond(request, StructuredError.of(ErrorCode.INTERNAL_ERROR,
                    "Handler for '" + request.command() + "' returned no result"));
        }
    }

    private static StructuredError handlerFailure(Throwable failure) {
        if (failure instanceof JanusException je) {
            return je.error();
        }
        if (failure instanceof RejectedExecutionException) {
            return StructuredError.of(ErrorCode.SERVICE_UNAVAILABLE, "Server is shutting down");
        }
        String details = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return StructuredError.of(ErrorCode.INTERNAL_ERROR, details);
    }

    private void validateResult(JanusRequest request, JsonNode value) {
        if (responseValidator == null || !config.validateResponses()) {
            return;
        }
        ValidationResult result = responseValidator.validate(request.command(), value);
        result.error().ifPresent(error -> sink.onValidationEvent(new JanusValidationEvent(
                wallClock.now(), JanusValidationEvent.Stage.RESPONSE, request.id(), request.command(), error)));
    }

    private void onMalformed(byte[] payload) {
        if (config.replyToMalformedRequests()) {
            Optional<String> replyTo = codec.peekReplyTo(payload).filter(this::isSafeReplyAddress);
            if (replyTo.isPresent()) {
                String id = codec.peekId(payload).filter(this::isSafeRequestId).orElse("unknown");
                JanusResponse response = JanusResponse.failure(id,
                        StructuredError.of(ErrorCode.PARSE_ERROR, "Failed to parse request"), wallClock.now());
                send(replyTo.get(), response, id, null);
                return;
            }
        }
        drop("malformed request", null);
    }

    private void respond(JanusRequest request, StructuredError error) {
        respond(request, JanusResponse.failure(request.id(), error, wallClock.now()));
    }

    private void respond(JanusRequest request, JanusResponse response) {
        if (!request.expectsReply()) {
            return;
        }
        send(request.replyTo(), response, request.id(), request.command());
    }

    private void send(String replyTo, JanusResponse response, String requestId, String command) {
        byte[] bytes = codec.encodeResponse(response);
        if (bytes.length > config.maxMessageSize()) {
            JanusResponse tooLarge = JanusResponse.failure(response.requestId(),
                    StructuredError.of(ErrorCode.RESOURCE_LIMIT_EXCEEDED,
                            "Response size " + bytes.length + " exceeds maximum message size " + config.maxMessageSize()),
                    wallClock.now());
            bytes = codec.encodeResponse(tooLarge);
        }

        DatagramEndpoint ep = endpoint;
        CompletableFuture<Void> sent = ep == null
                ? CompletableFuture.failedFuture(new IllegalStateException("server is stopped"))
                : ep.send(ReplyAddresses.address(replyTo), bytes);
        sent.whenComplete((ok, failure) -> {
            if (failure != null) {
                deliveryFailures.incrementAndGet();
                sink.onTransportEvent(new JanusTransportEvent(wallClock.now(),
                        JanusTransportEvent.Kind.DELIVERY_FAILED, replyTo,
                        "response to " + requestId + " not delivered", failure));
            }
            else {
                responsesSent.incrementAndGet();
                emit(new JanusRequestEvent(wallClock.now(), JanusRequestEvent.Kind.RESPONDED,
                        requestId, command, null, response.error()));
            }
        });
    }

    private boolean isSafeReplyAddress(String path) {
        try {
            security.validateSocketPath(path);
            return true;
        } catch (JanusException e) {
            return false;
        }
    }

    private boolean isSafeRequestId(String id) {
        try {
            security.validateRequestId(id);
            return true;
        } catch (JanusException e) {
            return false;
        }
    }

    private void drop(String detail, Throwable cause) {
        datagramsDropped.incrementAndGet();
        sink.onTransportEvent(new JanusTransportEvent(wallClock.now(),
                JanusTransportEvent.Kind.DATAGRAM_DROPPED, socketPath.toString(), detail, cause));
    }

    private void emit(JanusRequestEvent event) {
        sink.onRequestEvent(event);
    }

    /**
     * Listener of the server's bound endpoint. Runs on the transport thread and
     * only hands datagrams to the worker pool.
     */
    private final class ServerListener implements DatagramEndpointListener
    {
        private final CompletableFuture<Void> up;

        ServerListener(CompletableFuture<Void> up) {
            this.up = up;
        }

        @Override
        public void onTransportUp() {
            up.complete(null);
            sink.onTransportEvent(new JanusTransportEvent(wallClock.now(),
                    JanusTransportEvent.Kind.UP, socketPath.toString(), null, null));
        }

        @Override
        public void onTransportDown(Throwable cause) {
            up.completeExceptionally(cause != null ? cause : new IllegalStateException("endpoint stopped"));
            sink.onTransportEvent(new JanusTransportEvent(wallClock.now(),
                    JanusTransportEvent.Kind.DOWN, socketPath.toString(), null, cause));
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            if (payload.length > config.maxMessageSize()) {
                drop("datagram of " + payload.length + " bytes exceeds maximum message size", null);
                return;
            }
            try {
                workers.execute(() -> processSafely(payload));
            } catch (RejectedExecutionException e) {
                drop("worker pool rejected datagram", e);
            }
        }
    }
}
