package com.questrail.pype.loop;

import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeErrorEvent;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.observability.PypeTransportEvent;
import com.questrail.pype.protocol.codec.PypeDecodeException;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.time.Cancellable;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.MonotonicScheduler;
import com.questrail.pype.time.SystemWallClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.ConnectionListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PypeEventLoop
 * =============================================================================
 * Serialized coordinator between the transport, the protocol dispatcher and the
 * outbound task queue.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Decodes every inbound message object and hands it to the
 *       {@link MessageDispatcher} (one message at a time)</li>
 *   <li>Drains the {@link TaskQueue} after every callback and on every tick</li>
 *   <li>Runs the dispatcher's periodic hook on a fixed tick</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * The loop itself owns no thread. It is the {@link ConnectionListener} of every
 * watched connection and arms its tick on a {@link MonotonicScheduler} that runs
 * on the transport's readiness thread, so all of its work is serialized there.
 * That makes the dispatcher the sole mutator of registry and session state.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()   → arms the periodic tick
 *   loop.stop()    → cancels the tick; queued tasks are abandoned
 * </pre>
 */
public final class PypeEventLoop implements ConnectionListener, Outbox {

    private final PypeMessageDecoder decoder;
    private final PypeMessageEncoder encoder;
    private final TaskQueue taskQueue;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final LoopTimingPolicy timingPolicy;
    private final PypeObservabilitySink observabilitySink;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile MessageDispatcher dispatcher;
    private volatile Cancellable scheduledTick;

    public PypeEventLoop(PypeMessageDecoder decoder,
                         PypeMessageEncoder encoder,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         LoopTimingPolicy timingPolicy,
                         PypeObservabilitySink observabilitySink)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.taskQueue = new TaskQueue(clock, timingPolicy, this.observabilitySink);
    }

    /**
     * Installs the protocol dispatcher. Must be called before {@link #start()}.
     */
    public void setDispatcher(MessageDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Arms the periodic tick. Idempotent.
     */
    public void start() {
        requireDispatcher();
        if (running.compareAndSet(false, true)) {
            armTick();
        }
    }

    /**
     * Cancels the periodic tick. Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable tick = scheduledTick;
            if (tick != null) {
                tick.cancel();
                scheduledTick = null;
            }
        }
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    // ---------------------------------------------------------------------
    // Outbox
    // ---------------------------------------------------------------------

    @Override
    public void send(Connection destination, PypeMessage message) {
        taskQueue.enqueue(destination, encoder.encode(message));
    }

    @Override
    public void sendTo(Connection destination, SocketAddress address, PypeMessage message) {
        taskQueue.enqueue(destination, address, encoder.encode(message));
    }

    // ---------------------------------------------------------------------
    // ConnectionListener
    // ---------------------------------------------------------------------

    @Override
    public void onConnected(Connection connection) {
        observabilitySink.onTransportEvent(new PypeTransportEvent(
                SystemWallClock.INSTANCE.now(), connection.id(), true, null));
        guarded(() -> requireDispatcher().onConnected(connection));
        taskQueue.drain();
    }

    @Override
    public void onMessage(Connection connection, SocketAddress sender, byte[] payload) {
        final PypeMessage message;
        try {
            message = decoder.decode(payload);
        } catch (PypeDecodeException e) {
            observabilitySink.onProtocolEvent(new PypeProtocolEvent(
                    SystemWallClock.INSTANCE.now(),
                    PypeProtocolEvent.Category.DECODE_DROP,
                    connection.id(),
                    e.getMessage()));
            return;
        }

        guarded(() -> requireDispatcher().dispatch(connection, sender, message));
        taskQueue.drain();
    }

    @Override
    public void onDisconnected(Connection connection, Throwable cause) {
        observabilitySink.onTransportEvent(new PypeTransportEvent(
                SystemWallClock.INSTANCE.now(), connection.id(), false, cause));
        guarded(() -> requireDispatcher().onDisconnected(connection, cause));
        taskQueue.discard(connection);
        taskQueue.drain();
    }

    /**
     * One housekeeping pass: periodic dispatcher hook, then a queue drain.
     * Runs on the scheduler's thread; exposed for deterministic tests.
     */
    public void tick() {
        guarded(() -> requireDispatcher().onTick());
        taskQueue.drain();
    }

    // ---------------------------------------------------------------------

    private void armTick() {
        if (!running.get()) {
            return;
        }
        scheduledTick = scheduler.scheduleAfter(timingPolicy.tickInterval(), clock, () -> {
            if (running.get()) {
                tick();
                armTick();
            }
        });
    }

    private void guarded(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            observabilitySink.onError(new PypeErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Event processing error",
                    e));
        }
    }

    private MessageDispatcher requireDispatcher() {
        MessageDispatcher d = dispatcher;
        if (d == null) {
            throw new IllegalStateException("MessageDispatcher must be set before start()");
        }
        return d;
    }
}
