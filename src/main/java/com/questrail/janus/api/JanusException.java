package com.questrail.janus.api;

import java.util.Objects;

/**
 * Unchecked exception carrying a {@link StructuredError}.
 *
 * <p>This is the only failure type the client and server surface to their
 * callers. Whatever the cause, what crosses the wire is the structured error,
 * never the exception itself.</p>
 */
public class JanusException extends RuntimeException
{
    private final StructuredError error;

    public JanusException(StructuredError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public JanusException(StructuredError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").toString(), cause);
        this.error = error;
    }

    public JanusException(ErrorCode code, String details) {
        this(StructuredError.of(code, details));
    }

    public JanusException(ErrorCode code, String details, Throwable cause) {
        this(StructuredError.of(code, details), cause);
    }

    public StructuredError error() {
        return error;
    }

    public int code() {
        return error.code();
    }

    /**
     * Convert any failure into a structured error, preserving the one carried by
     * a {@link JanusException}.
     */
    public static StructuredError toStructuredError(Throwable t) {
        Objects.requireNonNull(t, "t");
        if (t instanceof JanusException je) {
            return je.error();
        }
        String details = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return StructuredError.of(ErrorCode.fromThrowable(t), details);
    }
}
