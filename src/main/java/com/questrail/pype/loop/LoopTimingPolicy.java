package com.questrail.pype.loop;

import java.time.Duration;
import java.util.Objects;

/**
 * LoopTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the event loop and its task queue.
 *
 * <p>This is deliberately <em>operational only</em>. It controls scheduling and
 * give-up limits; it does not encode protocol semantics.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b>: Period of the loop's housekeeping tick. Each tick
 *       drains the task queue and runs the periodic hooks (rate feedback,
 *       statistics refresh). The hooks keep their own cadence regardless of
 *       this value.</li>
 *   <li><b>taskTimeToLive</b>: A queued task whose destination has not become
 *       writable within this window is dropped.</li>
 *   <li><b>maxSendAttempts</b>: A task whose send has failed this many times is
 *       dropped.</li>
 * </ul>
 */
public record LoopTimingPolicy(
        Duration tickInterval,
        Duration taskTimeToLive,
        int maxSendAttempts
) {
    /**
     * Canonical constructor with validation.
     */
    public LoopTimingPolicy {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(taskTimeToLive, "taskTimeToLive");

        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (taskTimeToLive.isNegative() || taskTimeToLive.isZero()) {
            throw new IllegalArgumentException("taskTimeToLive must be positive");
        }
        if (maxSendAttempts < 1) {
            throw new IllegalArgumentException("maxSendAttempts must be >= 1");
        }
    }

    /**
     * Creates a policy with defaults suitable for interactive calls.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>tickInterval: 20ms</li>
     *   <li>taskTimeToLive: 30s</li>
     *   <li>maxSendAttempts: 3</li>
     * </ul>
     */
    public static LoopTimingPolicy defaults() {
        return new LoopTimingPolicy(
                Duration.ofMillis(20),
                Duration.ofSeconds(30),
                3
        );
    }
}
