package com.questrail.pype.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PypeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Integrity and decode drops are logged at DEBUG only; nothing about them is
 * ever signaled back to the sender.</p>
 */
public final class Slf4jPypeObservabilitySink implements PypeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPypeObservabilitySink.class);

    @Override
    public void onProtocolEvent(PypeProtocolEvent event) {
        switch (event.category()) {
            case DIRECTORY:
            case SESSION:
                log.info("[{}] {}: {}", event.category(), event.subject(), event.description());
                break;
            case TASK_DROP:
                log.warn("Dropped task for {}: {}", event.subject(), event.description());
                break;
            default:
                log.debug("[{}] {}: {}", event.category(), event.subject(), event.description());
                break;
        }
    }

    @Override
    public void onTransportEvent(PypeTransportEvent event) {
        if (event.up()) {
            log.info("Connection {} up", event.connectionId());
        } else if (event.cause() != null) {
            log.warn("Connection {} down: {}", event.connectionId(), event.cause().toString());
        } else {
            log.info("Connection {} closed", event.connectionId());
        }
    }

    @Override
    public void onError(PypeErrorEvent event) {
        log.error("pype error: {}", event.message(), event.cause());
    }
}
