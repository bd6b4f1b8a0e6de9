package com.questrail.janus.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;

import java.util.Objects;

/**
 * What a {@link RequestHandler} produced: a JSON value or a structured error.
 */
public sealed interface HandlerResult permits HandlerResult.Success, HandlerResult.Failure
{
    record Success(JsonNode value) implements HandlerResult {
        public Success {
            value = value == null ? NullNode.getInstance() : value;
        }
    }

    record Failure(StructuredError error) implements HandlerResult {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static HandlerResult success(JsonNode value) {
        return new Success(value);
    }

    static HandlerResult error(StructuredError error) {
        return new Failure(error);
    }

    static HandlerResult error(ErrorCode code, String details) {
        return new Failure(StructuredError.of(code, details));
    }
}
