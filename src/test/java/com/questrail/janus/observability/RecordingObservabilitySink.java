package com.questrail.janus.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements JanusObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onRequestEvent(JanusRequestEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(JanusTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onValidationEvent(JanusValidationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(JanusErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<JanusRequestEvent> requestEvents(JanusRequestEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof JanusRequestEvent)
            .map(e -> (JanusRequestEvent) e)
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<JanusTransportEvent> transportEvents(JanusTransportEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof JanusTransportEvent)
            .map(e -> (JanusTransportEvent) e)
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<JanusValidationEvent> validationEvents() {
        return events.stream()
            .filter(e -> e instanceof JanusValidationEvent)
            .map(e -> (JanusValidationEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasRequestEvent(JanusRequestEvent.Kind kind) {
        return !requestEvents(kind).isEmpty();
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
