package com.questrail.janus.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of JanusObservabilitySink that emits logs via SLF4J.
 *
 * <p>Levels: request lifecycle at DEBUG; transport up/down at INFO; dropped
 * datagrams at DEBUG; delivery failures at WARN; response validation failures
 * at WARN (argument rejections at DEBUG, the caller already receives them);
 * errors at ERROR.</p>
 */
public final class Slf4jJanusObservabilitySink implements JanusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jJanusObservabilitySink.class);

    @Override
    public void onRequestEvent(JanusRequestEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (event.error() != null) {
            log.debug("Janus request {} [{}] {}: {}", event.requestId(), event.command(), event.kind(), event.error());
        } else if (event.elapsed() != null) {
            log.debug("Janus request {} [{}] {} after {} ms",
                event.requestId(), event.command(), event.kind(), event.elapsed().toMillis());
        } else {
            log.debug("Janus request {} [{}] {}", event.requestId(), event.command(), event.kind());
        }
    }

    @Override
    public void onTransportEvent(JanusTransportEvent event) {
        switch (event.kind()) {
            case UP:
            case DOWN:
                log.info("Janus transport {} on {}", event.kind(), event.address());
                break;
            case DELIVERY_FAILED:
                log.warn("Janus delivery to {} failed: {}", event.address(), event.detail());
                break;
            case DATAGRAM_DROPPED:
            default:
                log.debug("Janus datagram dropped on {}: {}", event.address(), event.detail());
                break;
        }
    }

    @Override
    public void onValidationEvent(JanusValidationEvent event) {
        if (event.stage() == JanusValidationEvent.Stage.RESPONSE) {
            log.warn("Janus response validation failed for {} [{}]: {}",
                event.requestId(), event.command(), event.error());
        } else {
            log.debug("Janus arguments rejected for {} [{}]: {}",
                event.requestId(), event.command(), event.error());
        }
    }

    @Override
    public void onError(JanusErrorEvent event) {
        log.error("Janus error: {}", event.message(), event.cause());
    }
}
