package com.questrail.pype.observability;

/**
 * Main interface for receiving pype observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PypeObservabilitySink {
    /**
     * Called when a directory, session, or drop event occurs.
     * @param event the protocol event
     */
    void onProtocolEvent(PypeProtocolEvent event);

    /**
     * Called when a connection comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(PypeTransportEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(PypeErrorEvent event);
}
