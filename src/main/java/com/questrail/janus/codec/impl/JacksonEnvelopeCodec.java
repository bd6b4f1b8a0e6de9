package com.questrail.janus.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.janus.api.ErrorContext;
import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.api.JanusResponse;
import com.questrail.janus.api.StructuredError;
import com.questrail.janus.codec.EnvelopeCodec;
import com.questrail.janus.codec.JanusDecodeException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JacksonEnvelopeCodec
 * -----------------------------------------------------------------------------
 * Concrete {@link EnvelopeCodec} writing the Janus JSON envelopes with Jackson.
 *
 * <p>Request envelope:</p>
 * <pre>
 *   { "id", "method", "command", "args"?, "reply_to"?, "timeout"?, "timestamp" }
 * </pre>
 * <p>{@code command} and {@code method} carry the same value; readers accept
 * either. {@code timeout} is a number of seconds.</p>
 *
 * <p>Response envelope:</p>
 * <pre>
 *   { "request_id", "command_id", "success", "result"?, "error"?, "id", "timestamp" }
 * </pre>
 * <p>{@code request_id} and {@code command_id} carry the same value. {@code error}
 * is {@code {code, message, data?}}.</p>
 *
 * <p>Absent optional values are omitted, never written as {@code null}; the
 * exception is a successful {@code result}, which is always written.</p>
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec
{
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final ObjectMapper mapper;

    public JacksonEnvelopeCodec() {
        this(new ObjectMapper());
    }

    public JacksonEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // -------------------------------------------------------------------------
    // Requests
    // -------------------------------------------------------------------------

    @Override
    public byte[] encodeRequest(JanusRequest request) {
        Objects.requireNonNull(request, "request");

        ObjectNode root = mapper.createObjectNode();
        root.put("id", request.id());
        root.put("method", request.command());
        root.put("command", request.command());
        if (!request.args().isEmpty()) {
            ObjectNode args = root.putObject("args");
            request.args().forEach(args::set);
        }
        if (request.replyTo() != null) {
            root.put("reply_to", request.replyTo());
        }
        if (request.timeout() != null) {
            root.put("timeout", request.timeout().toNanos() / NANOS_PER_SECOND);
        }
        root.put("timestamp", JanusTimestamps.format(request.timestamp()));
        return write(root);
    }

    @Override
    public Optional<JanusRequest> decodeRequest(byte[] payload) {
        try {
            return Optional.of(parseRequest(payload));
        } catch (JanusDecodeException e) {
            // Malformed envelope -> drop
            return Optional.empty();
        }
    }

    /**
     * Strict variant of {@link #decodeRequest(byte[])} that reports why a
     * payload was rejected.
     *
     * @throws JanusDecodeException if the payload is not a valid request envelope
     */
    public JanusRequest parseRequest(byte[] payload) {
        ObjectNode root = readObject(payload);

        String id = requireText(root, "id");
        String command = textOrNull(root, "command");
        if (command == null) {
            command = textOrNull(root, "method");
        }
        if (command == null) {
            throw new JanusDecodeException("missing 'command'/'method'");
        }

        Map<String, JsonNode> args = new LinkedHashMap<>();
        JsonNode argsNode = root.get("args");
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isObject()) {
                throw new JanusDecodeException("'args' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = argsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                args.put(e.getKey(), e.getValue());
            }
        }

        String replyTo = textOrNull(root, "reply_to");

        Duration timeout = null;
        JsonNode timeoutNode = root.get("timeout");
        if (timeoutNode != null && !timeoutNode.isNull()) {
            if (!timeoutNode.isNumber()) {
                throw new JanusDecodeException("'timeout' must be a number of seconds");
            }
            double seconds = timeoutNode.asDouble();
            if (!(seconds > 0) || Double.isInfinite(seconds)) {
                throw new JanusDecodeException("'timeout' must be > 0");
            }
            timeout = Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
        }

        Instant timestamp = readTimestamp(root);

        try {
            return new JanusRequest(id, command, args, timeout, replyTo, timestamp);
        } catch (IllegalArgumentException e) {
            throw new JanusDecodeException("invalid request envelope: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Responses
    // -------------------------------------------------------------------------

    @Override
    public byte[] encodeResponse(JanusResponse response) {
        Objects.requireNonNull(response, "response");

        ObjectNode root = mapper.createObjectNode();
        root.put("request_id", response.requestId());
        root.put("command_id", response.requestId());
        root.put("success", response.success());
        if (response.success()) {
            root.set("result", response.result());
        } else {
            root.set("error", encodeError(response.error()));
        }
        root.put("id", response.id());
        root.put("timestamp", JanusTimestamps.format(response.timestamp()));
        return write(root);
    }

    @Override
    public Optional<JanusResponse> decodeResponse(byte[] payload) {
        try {
            return Optional.of(parseResponse(payload));
        } catch (JanusDecodeException e) {
            return Optional.empty();
        }
    }

    /**
     * Strict variant of {@link #decodeResponse(byte[])}.
     *
     * @throws JanusDecodeException if the payload is not a valid response envelope
     */
    public JanusResponse parseResponse(byte[] payload) {
        ObjectNode root = readObject(payload);

        String requestId = textOrNull(root, "request_id");
        if (requestId == null) {
            requestId = textOrNull(root, "command_id");
        }
        if (requestId == null) {
            throw new JanusDecodeException("missing 'request_id'/'command_id'");
        }

        JsonNode successNode = root.get("success");
        if (successNode == null || !successNode.isBoolean()) {
            throw new JanusDecodeException("'success' must be a boolean");
        }
        boolean success = successNode.booleanValue();

        String id = textOrNull(root, "id");
        if (id == null) {
            id = requestId;
        }
        Instant timestamp = readTimestamp(root);

        if (success) {
            JsonNode result = root.get("result");
            return new JanusResponse(requestId, true, result == null ? NullNode.getInstance() : result,
                    null, id, timestamp);
        }

        JsonNode errorNode = root.get("error");
        if (errorNode == null || !errorNode.isObject()) {
            throw new JanusDecodeException("failed response must carry an 'error' object");
        }
        return new JanusResponse(requestId, false, null, decodeError(errorNode), id, timestamp);
    }

    @Override
    public Optional<String> peekReplyTo(byte[] payload) {
        return peekText(payload, "reply_to");
    }

    @Override
    public Optional<String> peekId(byte[] payload) {
        return peekText(payload, "id");
    }

    private Optional<String> peekText(byte[] payload, String field) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            // Not JSON at all; nothing to recover.
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    // -------------------------------------------------------------------------
    // Errors
    // -------------------------------------------------------------------------

    private ObjectNode encodeError(StructuredError error) {
        ObjectNode node = mapper.createObjectNode();
        node.put("code", error.code());
        node.put("message", error.message());

        ErrorContext data = error.data();
        if (data != null) {
            ObjectNode d = node.putObject("data");
            if (data.details() != null) {
                d.put("details", data.details());
            }
            if (data.field() != null) {
                d.put("field", data.field());
            }
            if (data.value() != null) {
                d.set("value", data.value());
            }
            if (!data.constraints().isEmpty()) {
                ObjectNode c = d.putObject("constraints");
                data.constraints().forEach(c::set);
            }
            if (!data.context().isEmpty()) {
                ObjectNode c = d.putObject("context");
                data.context().forEach(c::set);
            }
        }
        return node;
    }

    private StructuredError decodeError(JsonNode node) {
        JsonNode code = node.get("code");
        if (code == null || !code.isIntegralNumber()) {
            throw new JanusDecodeException("'error.code' must be an integer");
        }
        String message = textOrNull(node, "message");
        if (message == null) {
            throw new JanusDecodeException("missing 'error.message'");
        }

        ErrorContext context = null;
        JsonNode data = node.get("data");
        if (data != null && data.isObject()) {
            context = new ErrorContext(
                    textOrNull(data, "details"),
                    textOrNull(data, "field"),
                    data.get("value"),
                    objectEntries(data.get("constraints")),
                    objectEntries(data.get("context")));
        }
        return new StructuredError(code.intValue(), message, context);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private ObjectNode readObject(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new JanusDecodeException("empty payload");
        }
        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new JanusDecodeException("payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new JanusDecodeException("payload is not a JSON object");
        }
        return (ObjectNode) root;
    }

    private Instant readTimestamp(ObjectNode root) {
        JsonNode ts = root.get("timestamp");
        if (ts == null || ts.isNull()) {
            throw new JanusDecodeException("missing 'timestamp'");
        }
        if (ts.isNumber()) {
            return JanusTimestamps.fromEpochSeconds(ts.asDouble());
        }
        if (!ts.isTextual()) {
            throw new JanusDecodeException("'timestamp' must be a string");
        }
        try {
            return JanusTimestamps.parse(ts.asText());
        } catch (DateTimeParseException e) {
            throw new JanusDecodeException("unparseable 'timestamp': " + ts.asText(), e);
        }
    }

    private static String requireText(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new JanusDecodeException("missing '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new JanusDecodeException("'" + field + "' must be a string");
        }
        return v.asText();
    }

    private static Map<String, JsonNode> objectEntries(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    private byte[] write(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // Tree nodes built here are always serializable.
            throw new IllegalStateException("failed to encode envelope", e);
        }
    }
}
