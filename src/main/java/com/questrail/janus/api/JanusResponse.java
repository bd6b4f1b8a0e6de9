package com.questrail.janus.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JanusResponse
 * =============================================================================
 * The correlated answer to a {@link JanusRequest}.
 *
 * <h2>Exclusivity</h2>
 * A successful response has a result and no error; a failed one has an error
 * and no result. A successful handler that produced no value carries a JSON
 * {@code null} result. Any other combination is rejected at construction.
 *
 * @param requestId identifier of the originating request
 * @param success   outcome flag
 * @param result    handler result, present iff {@code success}
 * @param error     structured error, present iff not {@code success}
 * @param id        the response's own identifier
 * @param timestamp creation time
 */
public record JanusResponse(
    String requestId,
    boolean success,
    JsonNode result,
    StructuredError error,
    String id,
    Instant timestamp
) {
    public JanusResponse {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
        if (success) {
            if (error != null) {
                throw new IllegalArgumentException("successful response must not carry an error");
            }
            result = result == null ? NullNode.getInstance() : result.deepCopy();
        } else {
            if (error == null) {
                throw new IllegalArgumentException("failed response must carry an error");
            }
            if (result != null) {
                throw new IllegalArgumentException("failed response must not carry a result");
            }
        }
    }

    public static JanusResponse success(String requestId, JsonNode result, Instant timestamp) {
        return new JanusResponse(requestId, true, result, null, UUID.randomUUID().toString(), timestamp);
    }

    public static JanusResponse failure(String requestId, StructuredError error, Instant timestamp) {
        return new JanusResponse(requestId, false, null, error, UUID.randomUUID().toString(), timestamp);
    }

    public Optional<JsonNode> resultOpt() {
        return Optional.ofNullable(result);
    }

    public Optional<StructuredError> errorOpt() {
        return Optional.ofNullable(error);
    }

    /**
     * Return the result, or throw the carried error as a {@link JanusException}.
     */
    public JsonNode resultOrThrow() {
        if (!success) {
            throw new JanusException(error);
        }
        return result;
    }
}
