package com.questrail.pype.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for timestamps that travel between peers.
 *
 * <p>Latency is measured as the difference between the local wall clock and the
 * sender's embedded timestamp. Synchronizing clocks between hosts is the job of
 * an external collaborator; this stack only reads the local clock.</p>
 */
public interface WallClock
{
    Instant now();

    /**
     * Current time as fractional seconds since the epoch, the unit used on the wire.
     */
    default double epochSeconds()
    {
        Instant now = now();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }
}
