package com.questrail.pype.server;

import com.questrail.pype.config.PypeServerConfig;
import com.questrail.pype.directory.CallRegistry;
import com.questrail.pype.directory.MulticastAddressPool;
import com.questrail.pype.loop.PypeEventLoop;
import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.time.SystemMonotonicClock;
import com.questrail.pype.time.SystemWallClock;
import com.questrail.pype.transport.ListenerHandle;
import com.questrail.pype.transport.PypeTransport;
import com.questrail.pype.transport.netty.NettyPypeTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PypeServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner of the directory server.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   stream listener → PypeEventLoop → DirectoryDispatcher → CallRegistry
 *                          ↑                    │
 *                          └──── Outbox ←───────┘
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the listener and blocks until it is bound, so bind
 * failures surface to the caller. {@link #stop()} closes the transport, which
 * drops every client connection.
 */
public final class PypeServerRuntime
{
    private static final Logger log = LoggerFactory.getLogger(PypeServerRuntime.class);
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(5);

    private final PypeServerConfig config;
    private final PypeTransport transport;
    private final PypeEventLoop loop;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ListenerHandle listener;

    private PypeServerRuntime(PypeServerConfig config,
                              PypeTransport transport,
                              PypeEventLoop loop)
    {
        this.config = config;
        this.transport = transport;
        this.loop = loop;
    }

    public void start()
    {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        loop.start();
        listener = transport.listenStream(config.bindAddress(), loop);
        InetSocketAddress bound = listener.awaitBound(BIND_TIMEOUT);
        log.info("Directory server listening on {}", bound);
    }

    public void stop()
    {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ListenerHandle l = listener;
        if (l != null) {
            l.close();
        }
        loop.stop();
        transport.close();
        log.info("Directory server stopped");
    }

    /**
     * Address the listener is bound to, or {@code null} before {@link #start()}.
     */
    public InetSocketAddress boundAddress()
    {
        ListenerHandle l = listener;
        return l == null ? null : l.localAddress();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private PypeServerConfig config = PypeServerConfig.builder().build();
        private PypeTransport transport;
        private PypeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(PypeServerConfig config)
        {
            this.config = config;
            return this;
        }

        /** Defaults to a {@link NettyPypeTransport}. */
        public Builder withTransport(PypeTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(PypeObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public PypeServerRuntime build()
        {
            Objects.requireNonNull(config, "config");
            PypeTransport t = transport != null ? transport : new NettyPypeTransport();

            PypeEventLoop loop = new PypeEventLoop(
                    new PypeMessageDecoder(),
                    new PypeMessageEncoder(),
                    SystemMonotonicClock.INSTANCE,
                    t.scheduler(),
                    config.loopTiming(),
                    observabilitySink);

            CallRegistry registry = new CallRegistry(new MulticastAddressPool(config.multicastBase()));
            loop.setDispatcher(new DirectoryDispatcher(
                    registry, loop, SystemWallClock.INSTANCE, observabilitySink));

            return new PypeServerRuntime(config, t, loop);
        }
    }
}
