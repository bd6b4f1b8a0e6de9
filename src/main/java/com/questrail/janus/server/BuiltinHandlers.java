package com.questrail.janus.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.codec.impl.JanusTimestamps;
import com.questrail.janus.internal.time.WallClock;
import com.questrail.janus.manifest.Manifest;
import com.questrail.janus.manifest.ManifestParser;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * BuiltinHandlers
 * =============================================================================
 * Commands every Janus server answers without registration.
 *
 * <ul>
 *   <li>{@code ping}: {@code {pong: true, timestamp}}</li>
 *   <li>{@code echo}: the {@code message} argument, or all arguments when none is given</li>
 *   <li>{@code get_info}: implementation, version and protocol</li>
 *   <li>{@code validate}: whether the {@code message} argument parses as JSON</li>
 *   <li>{@code slow_process}: sleeps, then answers; used to exercise deadlines</li>
 *   <li>{@code manifest}: the loaded manifest, or {@code RESOURCE_NOT_FOUND}</li>
 *   <li>{@code server_stats}: a {@link ServerStatistics} snapshot</li>
 * </ul>
 *
 * The names match {@link com.questrail.janus.manifest.ManifestValidator#RESERVED_COMMANDS}.
 */
public final class BuiltinHandlers
{
    public static final String IMPLEMENTATION = "Janus Java";
    public static final String VERSION = "1.0.0";
    public static final String PROTOCOL = "SOCK_DGRAM";
    public static final Duration SLOW_PROCESS_DELAY = Duration.ofSeconds(2);

    private final ObjectMapper mapper;
    private final WallClock wallClock;
    private final Manifest manifest;
    private final Supplier<ServerStatistics> statistics;
    private final Duration slowProcessDelay;
    private final Map<String, RequestHandler> handlers;

    /**
     * @param manifest   manifest served by {@code manifest}, or {@code null}
     * @param statistics source of {@code server_stats} snapshots
     */
    public BuiltinHandlers(ObjectMapper mapper, WallClock wallClock, Manifest manifest, Supplier<ServerStatistics> statistics) {
        this(mapper, wallClock, manifest, statistics, SLOW_PROCESS_DELAY);
    }

    BuiltinHandlers(ObjectMapper mapper,
                    WallClock wallClock,
                    Manifest manifest,
                    Supplier<ServerStatistics> statistics,
                    Duration slowProcessDelay) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.manifest = manifest;
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.slowProcessDelay = Objects.requireNonNull(slowProcessDelay, "slowProcessDelay");
        this.handlers = Map.of(
                "ping", this::ping,
                "echo", this::echo,
                "get_info", this::getInfo,
                "validate", this::validate,
                "slow_process", this::slowProcess,
                "manifest", this::manifest,
                "server_stats", this::serverStats);
    }

    public Optional<RequestHandler> lookup(String command) {
        return Optional.ofNullable(handlers.get(command));
    }

    public Set<String> commands() {
        return handlers.keySet();
    }

    private HandlerResult ping(JanusRequest request) {
        ObjectNode out = stamped();
        out.put("pong", true);
        return HandlerResult.success(out);
    }

    private HandlerResult echo(JanusRequest request) {
        ObjectNode out = stamped();
        Optional<JsonNode> message = request.arg("message");
        if (message.isPresent()) {
            out.set("echo", message.get());
        }
        else {
            ObjectNode all = out.putObject("echo");
            request.args().forEach(all::set);
        }
        return HandlerResult.success(out);
    }

    private HandlerResult getInfo(JanusRequest request) {
        ObjectNode out = stamped();
        out.put("implementation", IMPLEMENTATION);
        out.put("version", VERSION);
        out.put("protocol", PROTOCOL);
        return HandlerResult.success(out);
    }

    private HandlerResult validate(JanusRequest request) {
        ObjectNode out = stamped();
        Optional<JsonNode> message = request.arg("message");
        if (message.isEmpty() || !message.get().isTextual()) {
            out.put("valid", false);
            out.put("error", "No message provided for validation");
            return HandlerResult.success(out);
        }
        try {
            mapper.readTree(message.get().textValue());
            out.put("valid", true);
            out.put("message", "Valid JSON");
        } catch (JsonProcessingException e) {
            out.put("valid", false);
            out.put("error", "Invalid JSON: " + e.getOriginalMessage());
        }
        return HandlerResult.success(out);
    }

    private HandlerResult slowProcess(JanusRequest request) throws InterruptedException {
        Thread.sleep(slowProcessDelay.toMillis());
        ObjectNode out = stamped();
        out.put("processed", true);
        out.put("delay", slowProcessDelay.toMillis() + "ms");
        request.arg("message").ifPresent(m -> out.set("message", m));
        return HandlerResult.success(out);
    }

    private HandlerResult manifest(JanusRequest request) {
        if (manifest == null) {
            return HandlerResult.error(ErrorCode.RESOURCE_NOT_FOUND, "No manifest loaded");
        }
        return HandlerResult.success(new ManifestParser().toJsonNode(manifest));
    }

    private HandlerResult serverStats(JanusRequest request) {
        return HandlerResult.success(mapper.valueToTree(statistics.get()));
    }

    private ObjectNode stamped() {
        ObjectNode out = mapper.createObjectNode();
        out.put("timestamp", JanusTimestamps.format(wallClock.now()));
        return out;
    }
}
