package com.questrail.pype.loop;

import com.questrail.pype.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * RateLimiter
 * -----------------------------------------------------------------------------
 * "At most N times per second" gate on a monotonic clock.
 *
 * <p>Periodic paths (rate feedback, statistics refresh) are called on every
 * loop tick and on every callback; the limiter decides whether this call is
 * the one that actually runs, so loop speed never changes their frequency.
 * Media senders use {@link #tryAcquire(double)} to pace at a rate that changes
 * over time.</p>
 *
 * <p>Not thread-safe. Each limiter belongs to one thread.</p>
 */
public final class RateLimiter
{
    private final MonotonicClock clock;
    private final long defaultIntervalNanos;

    private long lastNanos;
    private boolean fired;

    public RateLimiter(MonotonicClock clock, double callsPerSecond)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultIntervalNanos = intervalNanos(callsPerSecond);
    }

    public static RateLimiter every(MonotonicClock clock, Duration interval)
    {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return new RateLimiter(clock, 1_000_000_000.0 / interval.toNanos());
    }

    /**
     * @return {@code true} if the configured interval has elapsed since the last
     *         successful acquisition (or this is the first call)
     */
    public boolean tryAcquire()
    {
        return tryAcquireInterval(defaultIntervalNanos);
    }

    /**
     * Variant with a caller-supplied rate for this call.
     */
    public boolean tryAcquire(double callsPerSecond)
    {
        return tryAcquireInterval(intervalNanos(callsPerSecond));
    }

    /**
     * Forget the last acquisition so the next call succeeds.
     */
    public void reset()
    {
        fired = false;
    }

    private boolean tryAcquireInterval(long intervalNanos)
    {
        long now = clock.nowNanos();
        if (fired && now - lastNanos < intervalNanos) {
            return false;
        }
        fired = true;
        lastNanos = now;
        return true;
    }

    private static long intervalNanos(double callsPerSecond)
    {
        if (!(callsPerSecond > 0)) {
            throw new IllegalArgumentException("callsPerSecond must be > 0");
        }
        return (long) (1_000_000_000.0 / callsPerSecond);
    }
}
