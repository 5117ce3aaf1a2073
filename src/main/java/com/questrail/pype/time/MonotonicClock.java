package com.questrail.pype.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every cadence decision in the stack: statistics flush windows,
 * rate limiting, task time-to-live and media pacing.
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time decisions MUST use this clock. Wall-clock time ({@link WallClock})
 * is only used where a timestamp crosses the wire (media unit send time).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
