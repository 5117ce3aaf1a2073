package com.questrail.pype.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * LatestValueChannel
 * -----------------------------------------------------------------------------
 * Depth-1 hand-off between a capture producer and a media sender.
 *
 * <p>{@link #offer} replaces whatever value is waiting, so the consumer always
 * gets the most recent frame and never a backlog. {@link #take} waits for a
 * value that has not been taken yet.</p>
 */
public final class LatestValueChannel<T>
{
    private T value;
    private boolean closed;

    public synchronized void offer(T next)
    {
        Objects.requireNonNull(next, "next");
        if (closed) {
            return;
        }
        value = next;
        notifyAll();
    }

    /**
     * Wait up to {@code timeout} for a fresh value.
     *
     * @return the latest value, or empty on timeout, interrupt or close
     */
    public synchronized Optional<T> take(Duration timeout)
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (value == null && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                wait(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
        T taken = value;
        value = null;
        return Optional.ofNullable(taken);
    }

    public synchronized void close()
    {
        closed = true;
        value = null;
        notifyAll();
    }
}
