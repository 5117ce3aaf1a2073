package com.questrail.pype.loop;

import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.SystemWallClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.TransportException;

import java.net.SocketAddress;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * TaskQueue
 * =============================================================================
 * Outbound queue shared by the event loop and the media workers.
 *
 * <h2>Threading Model</h2>
 * Any thread may {@link #enqueue}; only the event loop thread calls
 * {@link #drain()}. The backing queue is a lock-free concurrent queue.
 *
 * <h2>Drain semantics</h2>
 * One drain scans the queue once:
 * <ul>
 *   <li>a task whose destination is writable is sent and removed</li>
 *   <li>a task whose destination is not writable stays queued, and so does every
 *       later task for the same destination, preserving per-destination order</li>
 *   <li>a task whose destination is closed, whose age exceeds the time-to-live,
 *       or whose send failed {@code maxSendAttempts} times is dropped and reported</li>
 * </ul>
 */
public final class TaskQueue {

    private final Queue<Task> tasks = new ConcurrentLinkedQueue<>();
    private final MonotonicClock clock;
    private final LoopTimingPolicy timingPolicy;
    private final PypeObservabilitySink observabilitySink;

    public TaskQueue(MonotonicClock clock, LoopTimingPolicy timingPolicy, PypeObservabilitySink observabilitySink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Queue a payload for the connection's remote peer or default target.
     */
    public void enqueue(Connection destination, byte[] payload) {
        enqueue(destination, null, payload);
    }

    /**
     * Queue a datagram for an explicit address; {@code address} may be {@code null}.
     */
    public void enqueue(Connection destination, SocketAddress address, byte[] payload) {
        tasks.offer(new Task(destination, address, payload, clock.nowNanos(), 0));
    }

    /**
     * Scan the queue once, sending every task whose destination is writable.
     *
     * @return number of tasks sent
     */
    public int drain() {
        int sent = 0;
        int budget = tasks.size();
        long now = clock.nowNanos();
        long ttl = timingPolicy.taskTimeToLive().toNanos();
        Set<Connection> blocked = new HashSet<>();

        Iterator<Task> it = tasks.iterator();
        while (it.hasNext() && budget-- > 0) {
            Task task = it.next();
            Connection destination = task.destination();

            if (!destination.isOpen()) {
                it.remove();
                reportDrop(task, "destination closed");
                continue;
            }
            if (now - task.enqueuedAtNanos() > ttl) {
                it.remove();
                reportDrop(task, "not writable within " + timingPolicy.taskTimeToLive());
                continue;
            }
            if (blocked.contains(destination) || !destination.isWritable()) {
                blocked.add(destination);
                continue;
            }

            it.remove();
            try {
                task.sendNow();
                sent++;
            } catch (TransportException e) {
                Task retry = task.failedOnce();
                if (retry.attempts() >= timingPolicy.maxSendAttempts()) {
                    reportDrop(retry, "send failed " + retry.attempts() + " times: " + e.getMessage());
                } else {
                    tasks.offer(retry);
                    blocked.add(destination);
                }
            }
        }
        return sent;
    }

    /**
     * Drop every queued task addressed to {@code destination}.
     */
    public void discard(Connection destination) {
        tasks.removeIf(t -> t.destination() == destination);
    }

    public int size() {
        return tasks.size();
    }

    private void reportDrop(Task task, String reason) {
        observabilitySink.onProtocolEvent(new PypeProtocolEvent(
                SystemWallClock.INSTANCE.now(),
                PypeProtocolEvent.Category.TASK_DROP,
                task.destination().id(),
                reason));
    }
}
