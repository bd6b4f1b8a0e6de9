package com.questrail.janus.codec;

/**
 * Indicates that a datagram payload could not be translated into a valid
 * Janus envelope.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not a JSON object</li>
 *   <li>A missing or mistyped mandatory field</li>
 *   <li>An unparseable timestamp or a non-positive timeout</li>
 * </ul>
 */
public final class JanusDecodeException extends RuntimeException
{
    public JanusDecodeException(String message) {
        super(message);
    }

    public JanusDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
