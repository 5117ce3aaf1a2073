package com.questrail.pype.transport.netty;

import com.questrail.pype.time.Cancellable;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.MonotonicScheduler;

import io.netty.channel.EventLoop;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link MonotonicScheduler} that runs tasks on the transport's event loop, the
 * same thread that delivers every connection callback.
 */
final class NettyLoopScheduler implements MonotonicScheduler
{
    private final EventLoop loop;
    private final MonotonicClock clock;

    NettyLoopScheduler(EventLoop loop, MonotonicClock clock)
    {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delay = Math.max(0L, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = loop.schedule(task, delay, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
