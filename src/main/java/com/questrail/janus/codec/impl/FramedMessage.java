package com.questrail.janus.codec.impl;

import com.questrail.janus.api.JanusRequest;
import com.questrail.janus.api.JanusResponse;

import java.util.Objects;

/**
 * A request or response carried over the length-prefixed stream transport.
 */
public sealed interface FramedMessage
{
    /** Envelope {@code type} written for this message. */
    String envelopeType();

    record Request(JanusRequest request) implements FramedMessage {
        public Request {
            Objects.requireNonNull(request, "request");
        }

        @Override
        public String envelopeType() {
            return "command";
        }
    }

    record Response(JanusResponse response) implements FramedMessage {
        public Response {
            Objects.requireNonNull(response, "response");
        }

        @Override
        public String envelopeType() {
            return "response";
        }
    }
}
