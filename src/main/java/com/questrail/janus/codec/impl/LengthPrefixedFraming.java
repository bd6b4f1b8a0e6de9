package com.questrail.janus.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.janus.codec.JanusDecodeException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * LengthPrefixedFraming
 * -----------------------------------------------------------------------------
 * Framing for the stream-oriented fallback transport, where datagram boundaries
 * are not preserved.
 *
 * <p>Each message on the stream is:</p>
 * <pre>
 *   +----------------------+-------------------------------------------+
 *   | length (u32, BE)     | envelope JSON ({@code length} bytes)       |
 *   +----------------------+-------------------------------------------+
 *
 *   envelope = { "type": "command" | "response", "payload": "&lt;envelope JSON as string&gt;" }
 * </pre>
 *
 * <p>The payload is the same JSON written by {@link JacksonEnvelopeCodec} for
 * datagrams. The "direct" variants skip the outer envelope and frame the
 * request/response JSON as-is.</p>
 *
 * <p>This class holds no buffer state. Callers keep the remainder returned by
 * {@link #decode(byte[])} / {@link #extractMessages(byte[])} and prepend it to
 * the next read.</p>
 */
public final class LengthPrefixedFraming
{
    public static final int LENGTH_PREFIX_SIZE = 4;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 10 * 1024 * 1024;

    public record Decoded(FramedMessage message, byte[] remaining) {}

    public record Extracted(List<FramedMessage> messages, byte[] remaining) {}

    private final JacksonEnvelopeCodec codec;
    private final ObjectMapper mapper;
    private final int maxMessageSize;

    public LengthPrefixedFraming() {
        this(new ObjectMapper(), DEFAULT_MAX_MESSAGE_SIZE);
    }

    public LengthPrefixedFraming(ObjectMapper mapper, int maxMessageSize) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codec = new JacksonEnvelopeCodec(mapper);
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        this.maxMessageSize = maxMessageSize;
    }

    // -------------------------------------------------------------------------
    // Enveloped framing
    // -------------------------------------------------------------------------

    public byte[] encode(FramedMessage message) {
        Objects.requireNonNull(message, "message");

        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", message.envelopeType());
        envelope.put("payload", new String(encodePayload(message), StandardCharsets.UTF_8));

        final byte[] body;
        try {
            body = mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode framing envelope", e);
        }
        return prefix(body);
    }

    /**
     * Decode the first complete message in {@code buffer}.
     *
     * @throws FramingException if no complete, valid message is available
     */
    public Decoded decode(byte[] buffer) {
        Objects.requireNonNull(buffer, "buffer");

        int length = readLength(buffer);
        if (length == 0) {
            throw new FramingException(FramingException.Kind.ZERO_LENGTH_MESSAGE, "Message length cannot be zero");
        }
        byte[] body = readBody(buffer, length);
        byte[] remaining = Arrays.copyOfRange(buffer, LENGTH_PREFIX_SIZE + length, buffer.length);

        final JsonNode envelope;
        try {
            envelope = mapper.readTree(body);
        } catch (IOException e) {
            throw new FramingException(FramingException.Kind.INVALID_JSON_ENVELOPE,
                    "Failed to parse message envelope JSON", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new FramingException(FramingException.Kind.INVALID_JSON_ENVELOPE, "Envelope is not a JSON object");
        }

        JsonNode type = envelope.get("type");
        JsonNode payload = envelope.get("payload");
        if (type == null || !type.isTextual() || type.asText().isEmpty()
                || payload == null || !payload.isTextual() || payload.asText().isEmpty()) {
            throw new FramingException(FramingException.Kind.MISSING_ENVELOPE_FIELDS,
                    "Message envelope missing required fields (type, payload)");
        }

        byte[] payloadBytes = payload.asText().getBytes(StandardCharsets.UTF_8);
        FramedMessage message;
        switch (type.asText()) {
            case "command":
            case "request":
                message = parse(() -> new FramedMessage.Request(codec.parseRequest(payloadBytes)));
                break;
            case "response":
                message = parse(() -> new FramedMessage.Response(codec.parseResponse(payloadBytes)));
                break;
            default:
                throw new FramingException(FramingException.Kind.INVALID_MESSAGE_TYPE,
                        "Invalid message type: " + type.asText());
        }
        return new Decoded(message, remaining);
    }

    /**
     * Decode every complete message in {@code buffer}. A trailing partial
     * message is returned as the remainder; any other framing error is thrown.
     */
    public Extracted extractMessages(byte[] buffer) {
        Objects.requireNonNull(buffer, "buffer");

        List<FramedMessage> messages = new ArrayList<>();
        byte[] current = buffer;
        while (current.length > 0) {
            try {
                Decoded d = decode(current);
                messages.add(d.message());
                current = d.remaining();
            } catch (FramingException e) {
                if (e.kind().isIncomplete()) {
                    break;
                }
                throw e;
            }
        }
        return new Extracted(List.copyOf(messages), current);
    }

    public int framedSize(FramedMessage message) {
        return encode(message).length;
    }

    // -------------------------------------------------------------------------
    // Direct framing (no outer envelope)
    // -------------------------------------------------------------------------

    public byte[] encodeDirect(FramedMessage message) {
        Objects.requireNonNull(message, "message");
        return prefix(encodePayload(message));
    }

    public Decoded decodeDirect(byte[] buffer) {
        Objects.requireNonNull(buffer, "buffer");

        int length = readLength(buffer);
        byte[] body = readBody(buffer, length);
        byte[] remaining = Arrays.copyOfRange(buffer, LENGTH_PREFIX_SIZE + length, buffer.length);

        final JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new FramingException(FramingException.Kind.INVALID_PAYLOAD_JSON, "Failed to parse message JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new FramingException(FramingException.Kind.INVALID_PAYLOAD_JSON, "Message is not a JSON object");
        }

        if (root.has("command") || root.has("method")) {
            return new Decoded(parse(() -> new FramedMessage.Request(codec.parseRequest(body))), remaining);
        }
        if (root.has("request_id") || root.has("command_id")) {
            return new Decoded(parse(() -> new FramedMessage.Response(codec.parseResponse(body))), remaining);
        }
        throw new FramingException(FramingException.Kind.INVALID_MESSAGE_TYPE, "Cannot determine message type");
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private byte[] encodePayload(FramedMessage message) {
        if (message instanceof FramedMessage.Request r) {
            return codec.encodeRequest(r.request());
        }
        return codec.encodeResponse(((FramedMessage.Response) message).response());
    }

    private byte[] prefix(byte[] body) {
        if (body.length > maxMessageSize) {
            throw new FramingException(FramingException.Kind.MESSAGE_TOO_LARGE,
                    "Message size " + body.length + " exceeds maximum " + maxMessageSize);
        }
        return ByteBuffer.allocate(LENGTH_PREFIX_SIZE + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }

    private int readLength(byte[] buffer) {
        if (buffer.length < LENGTH_PREFIX_SIZE) {
            throw new FramingException(FramingException.Kind.INCOMPLETE_LENGTH_PREFIX,
                    "Buffer too small for length prefix: " + buffer.length + " < " + LENGTH_PREFIX_SIZE);
        }
        long length = ByteBuffer.wrap(buffer, 0, LENGTH_PREFIX_SIZE).getInt() & 0xFFFF_FFFFL;
        if (length > maxMessageSize) {
            throw new FramingException(FramingException.Kind.MESSAGE_TOO_LARGE,
                    "Message length " + length + " exceeds maximum " + maxMessageSize);
        }
        return (int) length;
    }

    private static byte[] readBody(byte[] buffer, int length) {
        int required = LENGTH_PREFIX_SIZE + length;
        if (buffer.length < required) {
            throw new FramingException(FramingException.Kind.INCOMPLETE_MESSAGE,
                    "Buffer too small for complete message: " + buffer.length + " < " + required);
        }
        return Arrays.copyOfRange(buffer, LENGTH_PREFIX_SIZE, required);
    }

    private static FramedMessage parse(PayloadParser parser) {
        try {
            return parser.parse();
        } catch (JanusDecodeException e) {
            throw new FramingException(FramingException.Kind.INVALID_PAYLOAD_JSON,
                    "Failed to parse payload: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface PayloadParser
    {
        FramedMessage parse();
    }
}
