package com.questrail.janus.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JanusRequest
 * =============================================================================
 * One self-describing request, carried in exactly one datagram.
 *
 * <h2>Addressing</h2>
 * A request that expects an answer names the socket path it is listening on in
 * {@code replyTo}. A request without a reply address is fire-and-forget: the
 * server runs the handler and never answers.
 *
 * <h2>Immutability</h2>
 * Argument values are deep-copied on construction; the map itself is
 * unmodifiable and keeps insertion order.
 *
 * @param id        unique request identifier, never reused
 * @param command   command name used for routing
 * @param args      argument mapping, possibly empty
 * @param timeout   declared timeout, or {@code null} for the receiver's default
 * @param replyTo   reply socket path, or {@code null} for fire-and-forget
 * @param timestamp creation time
 */
public record JanusRequest(
    String id,
    String command,
    Map<String, JsonNode> args,
    Duration timeout,
    String replyTo,
    Instant timestamp
) {
    public JanusRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timestamp, "timestamp");
        args = copyArgs(args);
        timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Create a request with a freshly generated identifier.
     */
    public static JanusRequest create(String command,
                                      Map<String, JsonNode> args,
                                      Duration timeout,
                                      String replyTo,
                                      Instant timestamp) {
        return new JanusRequest(newId(), command, args, timeout, replyTo, timestamp);
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public Optional<Duration> timeoutOpt() {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> replyToOpt() {
        return Optional.ofNullable(replyTo);
    }

    public boolean expectsReply() {
        return replyTo != null;
    }

    public Optional<JsonNode> arg(String name) {
        return Optional.ofNullable(args.get(name));
    }

    /** Same request with a different argument map (e.g. after defaults were applied). */
    public JanusRequest withArgs(Map<String, JsonNode> newArgs) {
        return new JanusRequest(id, command, newArgs, timeout, replyTo, timestamp);
    }

    private static Map<String, JsonNode> copyArgs(Map<String, JsonNode> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(
                Objects.requireNonNull(k, "arg name"),
                v == null ? NullNode.getInstance() : v.deepCopy()));
        return Collections.unmodifiableMap(out);
    }
}
