package com.questrail.pype.observability;

import java.time.Instant;

/**
 * Record representing a connection coming up or going down.
 */
public record PypeTransportEvent(
    Instant timestamp,
    String connectionId,
    boolean up,
    Throwable cause
) {
}
