package com.questrail.janus.api;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JanusResponseTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30.123456Z");

    @Test
    void successWithoutResultCarriesJsonNull() {
        JanusResponse r = JanusResponse.success("req-1", null, NOW);
        assertTrue(r.success());
        assertEquals(NullNode.getInstance(), r.result());
        assertNull(r.error());
    }

    @Test
    void failureRequiresErrorAndForbidsResult() {
        assertThrows(IllegalArgumentException.class,
                () -> new JanusResponse("req-1", false, null, null, "id", NOW));
        assertThrows(IllegalArgumentException.class,
                () -> new JanusResponse("req-1", false, IntNode.valueOf(1),
                        StructuredError.of(ErrorCode.INTERNAL_ERROR), "id", NOW));
        assertThrows(IllegalArgumentException.class,
                () -> new JanusResponse("req-1", true, null,
                        StructuredError.of(ErrorCode.INTERNAL_ERROR), "id", NOW));
    }

    @Test
    void resultOrThrowRaisesCarriedError() {
        JanusResponse r = JanusResponse.failure("req-1",
                StructuredError.of(ErrorCode.RESOURCE_NOT_FOUND, "No manifest loaded"), NOW);

        JanusException e = assertThrows(JanusException.class, r::resultOrThrow);
        assertEquals(ErrorCode.RESOURCE_NOT_FOUND.code(), e.code());
    }

    @Test
    void timestampsAreTruncatedToMillis() {
        assertEquals(Instant.parse("2025-03-01T10:15:30.123Z"), JanusResponse.success("r", null, NOW).timestamp());

        JanusRequest req = JanusRequest.create("ping", Map.of(), null, null, NOW);
        assertEquals(Instant.parse("2025-03-01T10:15:30.123Z"), req.timestamp());
    }

    @Test
    void requestRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> JanusRequest.create("ping", Map.of(), Duration.ZERO, null, NOW));
        assertThrows(IllegalArgumentException.class,
                () -> JanusRequest.create("ping", Map.of(), Duration.ofSeconds(-1), null, NOW));
    }

    @Test
    void requestWithoutReplyAddressExpectsNoReply() {
        JanusRequest req = JanusRequest.create("echo", Map.of("message", TextNode.valueOf("hi")), null, null, NOW);

        assertFalse(req.expectsReply());
        assertTrue(req.replyToOpt().isEmpty());
        assertEquals(TextNode.valueOf("hi"), req.arg("message").orElseThrow());
        assertTrue(req.arg("missing").isEmpty());
    }

    @Test
    void generatedIdsAreDistinct() {
        assertNotEquals(JanusRequest.newId(), JanusRequest.newId());
    }
}
