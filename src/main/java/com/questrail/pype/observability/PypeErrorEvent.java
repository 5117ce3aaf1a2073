package com.questrail.pype.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the pype stack.
 */
public record PypeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
