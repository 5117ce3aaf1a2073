package com.questrail.pype.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a protocol-level happening in a pype process.
 */
public record PypeProtocolEvent(
    Instant timestamp,
    Category category,
    String subject,
    String description
) {
    public enum Category {
        /** Directory membership or call roster change. */
        DIRECTORY,
        /** Local call session lifecycle: start, key installed, master change, teardown. */
        SESSION,
        /** Inbound unit dropped by the nonce, sequence-window or replay checks. */
        INTEGRITY_DROP,
        /** Inbound bytes that did not decode into a message. */
        DECODE_DROP,
        /** Queued outbound task discarded without being sent. */
        TASK_DROP
    }

    public PypeProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(description, "description");
    }
}
