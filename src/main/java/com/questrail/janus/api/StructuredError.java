package com.questrail.janus.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StructuredError
 * =============================================================================
 * The single failure shape visible to Janus callers, on either side of the
 * socket.
 *
 * <p>A structured error carries a numeric code drawn from {@link ErrorCode}, a
 * human-readable message and an optional {@link ErrorContext}. Codes that are
 * not part of {@link ErrorCode} are preserved as received so newer peers remain
 * readable.</p>
 */
public record StructuredError(int code, String message, ErrorContext data)
{
    public StructuredError {
        Objects.requireNonNull(message, "message");
        if (data != null && data.isEmpty()) {
            data = null;
        }
    }

    public static StructuredError of(ErrorCode code) {
        Objects.requireNonNull(code, "code");
        return new StructuredError(code.code(), code.message(), null);
    }

    public static StructuredError of(ErrorCode code, String details) {
        Objects.requireNonNull(code, "code");
        return new StructuredError(code.code(), code.message(), ErrorContext.ofDetails(details));
    }

    /**
     * Validation failure naming the offending field, value and violated constraints.
     */
    public static StructuredError validation(ErrorCode code,
                                             String details,
                                             String field,
                                             JsonNode value,
                                             Map<String, JsonNode> constraints) {
        Objects.requireNonNull(code, "code");
        return new StructuredError(code.code(), code.message(),
                new ErrorContext(details, field, value, constraints, null));
    }

    public StructuredError withDetails(String details) {
        ErrorContext d = data;
        return new StructuredError(code, message, d == null
                ? ErrorContext.ofDetails(details)
                : new ErrorContext(details, d.field(), d.value(), d.constraints(), d.context()));
    }

    public StructuredError withContext(Map<String, JsonNode> context) {
        ErrorContext d = data;
        return new StructuredError(code, message, d == null
                ? new ErrorContext(null, null, null, null, context)
                : new ErrorContext(d.details(), d.field(), d.value(), d.constraints(), context));
    }

    public Optional<ErrorCode> errorCode() {
        return ErrorCode.fromCode(code);
    }

    public boolean is(ErrorCode errorCode) {
        return errorCode != null && errorCode.code() == code;
    }

    public Optional<ErrorContext> dataOpt() {
        return Optional.ofNullable(data);
    }

    public Optional<String> details() {
        return data == null ? Optional.empty() : data.detailsOpt();
    }

    public Optional<String> field() {
        return data == null ? Optional.empty() : data.fieldOpt();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("JSON-RPC Error ")
                .append(code).append(": ").append(message);
        details().ifPresent(d -> sb.append(" - ").append(d));
        return sb.toString();
    }
}
