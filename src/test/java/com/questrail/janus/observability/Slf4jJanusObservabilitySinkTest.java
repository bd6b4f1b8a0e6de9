package com.questrail.janus.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jJanusObservabilitySinkTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    private final Slf4jJanusObservabilitySink sink = new Slf4jJanusObservabilitySink();
    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jJanusObservabilitySink.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    private ILoggingEvent only() {
        assertEquals(1, appender.list.size(), () -> "events: " + appender.list);
        return appender.list.get(0);
    }

    @Test
    void requestLifecycleLogsAtDebugWithElapsedTime() {
        sink.onRequestEvent(new JanusRequestEvent(NOW, JanusRequestEvent.Kind.COMPLETED, "r1", "ping",
                Duration.ofMillis(12), null));

        ILoggingEvent e = only();
        assertEquals(Level.DEBUG, e.getLevel());
        assertEquals("Janus request r1 [ping] COMPLETED after 12 ms", e.getFormattedMessage());
    }

    @Test
    void requestErrorIsIncluded() {
        sink.onRequestEvent(new JanusRequestEvent(NOW, JanusRequestEvent.Kind.TIMED_OUT, "r1", "slow",
                Duration.ofMillis(100), StructuredError.of(ErrorCode.HANDLER_TIMEOUT, "late")));

        assertEquals("Janus request r1 [slow] TIMED_OUT: JSON-RPC Error -32006: Handler timeout - late",
                only().getFormattedMessage());
    }

    @Test
    void requestEventsAreSkippedWhenDebugIsOff() {
        logger.setLevel(Level.INFO);

        sink.onRequestEvent(JanusRequestEvent.of(NOW, JanusRequestEvent.Kind.SENT, "r1", "ping"));

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void transportEventsUseKindSpecificLevels() {
        sink.onTransportEvent(new JanusTransportEvent(NOW, JanusTransportEvent.Kind.UP, "/tmp/s.sock", null, null));
        sink.onTransportEvent(new JanusTransportEvent(NOW, JanusTransportEvent.Kind.DELIVERY_FAILED, "/tmp/r.sock",
                "response to r1 not delivered", new IOException("No such file or directory")));
        sink.onTransportEvent(new JanusTransportEvent(NOW, JanusTransportEvent.Kind.DATAGRAM_DROPPED, "/tmp/s.sock",
                "malformed request", null));

        assertEquals(3, appender.list.size());
        assertEquals(Level.INFO, appender.list.get(0).getLevel());
        assertEquals("Janus transport UP on /tmp/s.sock", appender.list.get(0).getFormattedMessage());
        assertEquals(Level.WARN, appender.list.get(1).getLevel());
        assertEquals("Janus delivery to /tmp/r.sock failed: response to r1 not delivered",
                appender.list.get(1).getFormattedMessage());
        assertEquals(Level.DEBUG, appender.list.get(2).getLevel());
    }

    @Test
    void responseValidationFailuresWarnAndArgumentRejectionsDebug() {
        StructuredError error = StructuredError.of(ErrorCode.VALIDATION_FAILED, "Missing required field: id");
        sink.onValidationEvent(new JanusValidationEvent(NOW, JanusValidationEvent.Stage.RESPONSE, "r1", "create", error));
        sink.onValidationEvent(new JanusValidationEvent(NOW, JanusValidationEvent.Stage.ARGUMENTS, "r2", "create", error));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertTrue(appender.list.get(0).getFormattedMessage().startsWith("Janus response validation failed for r1 [create]"));
        assertEquals(Level.DEBUG, appender.list.get(1).getLevel());
    }

    @Test
    void errorsLogWithThrowable() {
        IllegalStateException cause = new IllegalStateException("boom");

        sink.onError(new JanusErrorEvent(NOW, "Failed to process datagram", cause));

        ILoggingEvent e = only();
        assertEquals(Level.ERROR, e.getLevel());
        assertEquals("Janus error: Failed to process datagram", e.getFormattedMessage());
        assertNotNull(e.getThrowableProxy());
        assertEquals("boom", e.getThrowableProxy().getMessage());
    }
}
