package com.questrail.janus.observability;

import com.questrail.janus.api.StructuredError;

import java.time.Instant;

/**
 * Manifest validation rejected something.
 *
 * <p>{@link Stage#ARGUMENTS} rejections are also returned to the caller;
 * {@link Stage#RESPONSE} rejections are advisory only and the response is
 * delivered regardless.</p>
 */
public record JanusValidationEvent(
    Instant timestamp,
    Stage stage,
    String requestId,
    String command,
    StructuredError error
) {
    public enum Stage {
        ARGUMENTS,
        RESPONSE
    }
}
