package com.questrail.pype.stats;

import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.WallClock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Tracker
 * =============================================================================
 * Rolling estimator for the units one remote participant sends on one medium.
 *
 * <h2>Integrity check</h2>
 * {@link #admit(long, long)} is the gatekeeper. A unit is rejected when its
 * sequence trails the expected pointer by more than {@value #MAX_TRAIL}, or when
 * its packet nonce equals one of the last {@value #WINDOW} accepted nonces.
 *
 * <h2>Estimators</h2>
 * <ul>
 *   <li><b>latency</b>: local wall clock minus the sender's timestamp, blended on
 *       every unit</li>
 *   <li><b>framerate / bitrate</b>: unit and byte counts, flushed into their
 *       averages once at least {@value #FLUSH_SECONDS}s have passed</li>
 *   <li><b>framedrop</b>: sequences missing between the pointer and an arrival go
 *       into a pending ledger with no strikes. Every processed unit, the one that
 *       revealed the gap included, adds a strike to every other pending entry,
 *       and an entry with {@value #STRIKES_TO_LOSS} strikes counts as lost.
 *       The ratio lost / (lost + received) is flushed on the same cadence as
 *       framerate.</li>
 * </ul>
 * All averages use {@link AdaptiveAverage}.
 *
 * <h2>Sequence pointer</h2>
 * The expected pointer advances by exactly one per processed unit and never
 * jumps. Gap detection is limited to sequences above the highest one ever
 * observed, so a pointer that lags behind after losses never re-reports
 * sequences that have already been settled.
 *
 * <h2>Threading</h2>
 * Receive workers update a tracker while the event loop reads it for rate
 * feedback, so every public method is synchronized.
 */
public final class Tracker
{
    static final int WINDOW = 3;
    static final int MAX_TRAIL = 3;
    static final int STRIKES_TO_LOSS = 2;
    static final double FLUSH_SECONDS = 0.5;

    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final double rateConstant;

    // integrity
    private final Deque<Long> acceptedNonces = new ArrayDeque<>(WINDOW);
    private long expected;

    // framedrop
    private final Map<Long, Integer> pending = new TreeMap<>();
    private final Deque<Long> recentlyArrived = new ArrayDeque<>(WINDOW);
    private long highestSeen = -1;
    private boolean primed;

    // window counters since the last flush
    private int windowUnits;
    private long windowBytes;
    private int windowLost;
    private long lastFlushNanos;
    private long lastUnitNanos;
    private boolean sawUnit;

    private final AdaptiveAverage latency = new AdaptiveAverage();
    private final AdaptiveAverage framerate = new AdaptiveAverage();
    private final AdaptiveAverage bitrate = new AdaptiveAverage();
    private final AdaptiveAverage framedrop = new AdaptiveAverage();

    /**
     * @param rateConstant numerator of {@link #optimalSendingRate()}
     */
    public Tracker(MonotonicClock clock, WallClock wallClock, double rateConstant)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (!(rateConstant > 0)) {
            throw new IllegalArgumentException("rateConstant must be > 0");
        }
        this.rateConstant = rateConstant;
        this.lastFlushNanos = clock.nowNanos();
    }

    /**
     * Integrity check then statistics update.
     *
     * @param sequence      sender's per-medium sequence number
     * @param packetNonce   sender's per-unit random nonce
     * @param sentAtSeconds sender's wall-clock timestamp, seconds since the epoch
     * @param payloadBytes  payload size used for the bitrate estimate
     * @return {@code false} if the unit was rejected and must be dropped
     */
    public synchronized boolean process(long sequence, long packetNonce, double sentAtSeconds, int payloadBytes)
    {
        if (!admit(sequence, packetNonce)) {
            return false;
        }
        update(sequence, sentAtSeconds, payloadBytes);
        return true;
    }

    /**
     * Gatekeeper. Records the nonce of an accepted unit.
     */
    public synchronized boolean admit(long sequence, long packetNonce)
    {
        prime(sequence);
        if (sequence < expected - MAX_TRAIL) {
            return false;
        }
        if (acceptedNonces.contains(packetNonce)) {
            return false;
        }
        if (acceptedNonces.size() == WINDOW) {
            acceptedNonces.removeFirst();
        }
        acceptedNonces.addLast(packetNonce);
        return true;
    }

    /**
     * Feeds an admitted unit to the estimators.
     */
    public synchronized void update(long sequence, double sentAtSeconds, int payloadBytes)
    {
        long now = clock.nowNanos();

        double sinceLastUnit = sawUnit ? (now - lastUnitNanos) / 1_000_000_000.0 : 0.0;
        latency.update(wallClock.epochSeconds() - sentAtSeconds, sinceLastUnit);
        lastUnitNanos = now;
        sawUnit = true;

        trackDrops(sequence);

        windowUnits++;
        windowBytes += payloadBytes;

        double sinceFlush = (now - lastFlushNanos) / 1_000_000_000.0;
        if (sinceFlush >= FLUSH_SECONDS) {
            flush(sinceFlush, now);
        }
    }

    /**
     * The first unit ever seen anchors the pointer, so joining a stream midway
     * does not report everything before it as lost.
     */
    private void prime(long sequence)
    {
        if (!primed) {
            primed = true;
            expected = sequence;
            highestSeen = sequence - 1;
        }
    }

    private void trackDrops(long sequence)
    {
        prime(sequence);
        long gapStart = Math.max(expected, highestSeen + 1);
        for (long s = gapStart; s < sequence; s++) {
            if (!pending.containsKey(s) && !recentlyArrived.contains(s)) {
                pending.put(s, 0);
            }
        }

        pending.remove(sequence);
        if (recentlyArrived.size() == WINDOW) {
            recentlyArrived.removeFirst();
        }
        recentlyArrived.addLast(sequence);

        Iterator<Map.Entry<Long, Integer>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, Integer> entry = it.next();
            int strikes = entry.getValue() + 1;
            if (strikes >= STRIKES_TO_LOSS) {
                it.remove();
                windowLost++;
            } else {
                entry.setValue(strikes);
            }
        }

        highestSeen = Math.max(highestSeen, sequence);
        expected++;
    }

    private void flush(double elapsedSeconds, long now)
    {
        framerate.update(windowUnits / elapsedSeconds, elapsedSeconds);
        bitrate.update(windowBytes * 8.0 / elapsedSeconds, elapsedSeconds);

        int outcomes = windowLost + windowUnits;
        framedrop.update(outcomes == 0 ? 0.0 : (double) windowLost / outcomes, elapsedSeconds);

        windowUnits = 0;
        windowBytes = 0;
        windowLost = 0;
        lastFlushNanos = now;
    }

    /**
     * {@code round(rateConstant / latency)}, or empty while no positive latency
     * estimate exists.
     */
    public synchronized OptionalInt optimalSendingRate()
    {
        double l = latency.value();
        if (!latency.seeded() || l <= 0) {
            return OptionalInt.empty();
        }
        long rate = Math.round(rateConstant / l);
        return OptionalInt.of((int) Math.min(Integer.MAX_VALUE, rate));
    }

    public synchronized TrackerSnapshot snapshot()
    {
        return new TrackerSnapshot(latency.value(), framerate.value(), bitrate.value(), framedrop.value());
    }

    synchronized long expectedSequence()
    {
        return expected;
    }

    synchronized int pendingCount()
    {
        return pending.size();
    }
}
