package com.questrail.janus.observability;

/**
 * No-op implementation of JanusObservabilitySink.
 */
public final class NullObservabilitySink implements JanusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRequestEvent(JanusRequestEvent event) {}

    @Override
    public void onTransportEvent(JanusTransportEvent event) {}

    @Override
    public void onValidationEvent(JanusValidationEvent event) {}

    @Override
    public void onError(JanusErrorEvent event) {}
}
