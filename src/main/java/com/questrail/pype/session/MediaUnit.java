package com.questrail.pype.session;

import com.questrail.pype.protocol.model.Medium;

import java.util.Objects;

/**
 * Plaintext of one media unit before encryption.
 *
 * @param timestamp sender wall clock, seconds since the epoch
 */
public record MediaUnit(
        Medium medium,
        long sequence,
        long sessionNonce,
        long packetNonce,
        String source,
        double timestamp,
        byte[] payload
) {
    public MediaUnit {
        Objects.requireNonNull(medium, "medium");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(payload, "payload");
    }
}
