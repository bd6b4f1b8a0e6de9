package com.questrail.janus.api;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * ErrorCode
 * =============================================================================
 * Fixed numeric error code space shared by every Janus implementation.
 *
 * <h2>Ranges</h2>
 * <ul>
 *   <li>{@code -32700 .. -32600}: standard protocol errors</li>
 *   <li>{@code -32000 .. -32099}: implementation-defined server errors</li>
 * </ul>
 *
 * <p>Each code carries exactly one canonical message. The numeric value is what
 * crosses the wire; {@link #name()} is the stable string form used in manifests
 * ({@code errorCodes}) and logs.</p>
 */
public enum ErrorCode
{
    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid Request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),

    SERVER_ERROR(-32000, "Server error"),
    SERVICE_UNAVAILABLE(-32001, "Service unavailable"),
    AUTHENTICATION_FAILED(-32002, "Authentication failed"),
    RATE_LIMIT_EXCEEDED(-32003, "Rate limit exceeded"),
    RESOURCE_NOT_FOUND(-32004, "Resource not found"),
    VALIDATION_FAILED(-32005, "Validation failed"),
    HANDLER_TIMEOUT(-32006, "Handler timeout"),
    SOCKET_ERROR(-32007, "Socket error"),
    CONFIGURATION_ERROR(-32008, "Configuration error"),
    SECURITY_VIOLATION(-32009, "Security violation"),
    RESOURCE_LIMIT_EXCEEDED(-32010, "Resource limit exceeded");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int code() {
        return code;
    }

    /** Canonical human-readable message for this code. */
    public String message() {
        return message;
    }

    public boolean isStandardProtocolError() {
        return code <= -32600 && code >= -32700;
    }

    public boolean isServerError() {
        return code <= -32000 && code >= -32099;
    }

    public static Optional<ErrorCode> fromCode(int code) {
        for (ErrorCode c : values()) {
            if (c.code == code) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a code from its string name, accepting either {@code PARSE_ERROR}
     * or {@code parse_error} spellings.
     */
    public static Optional<ErrorCode> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Map an arbitrary failure onto the code space.
     *
     * <p>A {@link JanusException} keeps its own code. Anything else is
     * classified by type first and then by message keywords; unmatched failures
     * become {@link #INTERNAL_ERROR}.</p>
     */
    public static ErrorCode fromThrowable(Throwable t) {
        if (t instanceof JanusException je) {
            return je.error().errorCode().orElse(INTERNAL_ERROR);
        }
        if (t instanceof JsonProcessingException) {
            return PARSE_ERROR;
        }
        if (t instanceof TimeoutException) {
            return HANDLER_TIMEOUT;
        }
        if (t instanceof IllegalArgumentException) {
            return INVALID_PARAMS;
        }
        if (t instanceof SecurityException) {
            return SECURITY_VIOLATION;
        }

        String m = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
        if (m.contains("validation")) {
            return VALIDATION_FAILED;
        } else if (m.contains("timeout")) {
            return HANDLER_TIMEOUT;
        } else if (m.contains("not found")) {
            return RESOURCE_NOT_FOUND;
        } else if (m.contains("limit")) {
            return RESOURCE_LIMIT_EXCEEDED;
        }
        return INTERNAL_ERROR;
    }
}
