package com.questrail.pype.observability;

/**
 * No-op implementation of PypeObservabilitySink.
 */
public final class NullObservabilitySink implements PypeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProtocolEvent(PypeProtocolEvent event) {}

    @Override
    public void onTransportEvent(PypeTransportEvent event) {}

    @Override
    public void onError(PypeErrorEvent event) {}
}
