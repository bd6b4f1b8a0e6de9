package com.questrail.janus.codec;

import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.api.JanusResponse;

import java.util.Optional;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * Byte-level codec for the Janus request and response envelopes.
 *
 * <p>This interface is the boundary between raw datagram payloads and the
 * typed {@link JanusRequest} / {@link JanusResponse} values. Each call handles
 * exactly one complete datagram; accumulation across calls is not allowed.</p>
 *
 * <p>Decoders return {@link Optional#empty()} for anything malformed. A
 * malformed payload is a transport defect from an unauthenticated local peer
 * and carries no protocol meaning of its own.</p>
 *
 * <p>Readers ignore unknown fields so that newer peers can add fields without
 * breaking older ones.</p>
 */
public interface EnvelopeCodec
{
    byte[] encodeRequest(JanusRequest request);

    /**
     * @return the decoded request, or empty if the payload is not a valid request envelope
     */
    Optional<JanusRequest> decodeRequest(byte[] payload);

    byte[] encodeResponse(JanusResponse response);

    /**
     * @return the decoded response, or empty if the payload is not a valid response envelope
     */
    Optional<JanusResponse> decodeResponse(byte[] payload);

    /**
     * Best-effort recovery of the {@code reply_to} field from a payload that
     * failed full request decoding.
     *
     * @return the reply path if the payload is a JSON object carrying one
     */
    Optional<String> peekReplyTo(byte[] payload);

    /**
     * Best-effort recovery of the request {@code id} from a payload that failed
     * full request decoding.
     */
    Optional<String> peekId(byte[] payload);
}
