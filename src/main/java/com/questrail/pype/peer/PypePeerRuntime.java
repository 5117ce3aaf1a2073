package com.questrail.pype.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.api.CaptureDevice;
import com.questrail.pype.api.PlaybackDevice;
import com.questrail.pype.api.PresentationListener;
import com.questrail.pype.config.PypePeerConfig;
import com.questrail.pype.loop.PypeEventLoop;
import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.protocol.model.LocalCommand;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.SystemMonotonicClock;
import com.questrail.pype.time.SystemWallClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.PypeTransport;
import com.questrail.pype.transport.TransportException;
import com.questrail.pype.transport.netty.NettyPypeTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PypePeerRuntime
 * =============================================================================
 * Composition root and lifecycle owner of one client peer.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   server stream ─┐
 *   local ingress ─┼→ PypeEventLoop → PeerDispatcher(PeerContext) → PresentationListener
 *   call sockets  ─┘        ↑                  │
 *                           └──── Outbox ←─────┘
 *
 *   MediaWorkers (own threads) ↔ media multicast channels, capture and playback devices
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} opens the server connection and the local ingress endpoint on
 * the loop thread and waits until the ingress is bound; its address is then
 * available from {@link #ingressAddress()} for the presentation layer.
 * {@link #stop()} ends any call, then closes the transport.
 */
public final class PypePeerRuntime
{
    private static final Logger log = LoggerFactory.getLogger(PypePeerRuntime.class);
    private static final Duration START_TIMEOUT = Duration.ofSeconds(5);

    private final PypePeerConfig config;
    private final PypeTransport transport;
    private final PypeEventLoop loop;
    private final PeerContext context;
    private final PeerDispatcher dispatcher;
    private final PypeMessageEncoder encoder;
    private final MonotonicClock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private PypePeerRuntime(PypePeerConfig config,
                            PypeTransport transport,
                            PypeEventLoop loop,
                            PeerContext context,
                            PeerDispatcher dispatcher,
                            PypeMessageEncoder encoder,
                            MonotonicClock clock)
    {
        this.config = config;
        this.transport = transport;
        this.loop = loop;
        this.context = context;
        this.dispatcher = dispatcher;
        this.encoder = encoder;
        this.clock = clock;
    }

    public void start()
    {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        loop.start();
        onLoop(() -> {
            context.ingressConnection(transport.openDatagram(config.ingressBind(), loop));
            context.serverConnection(transport.connectStream(config.serverAddress(), loop));
            return null;
        });
        InetSocketAddress ingress = awaitIngress();
        log.info("Peer ingress bound on {}, directory server {}", ingress, config.serverAddress());
    }

    public void stop()
    {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        onLoop(() -> {
            dispatcher.shutdown();
            Connection server = context.serverConnection();
            if (server != null) {
                server.close();
            }
            return null;
        });
        loop.stop();
        transport.close();
        log.info("Peer stopped");
    }

    /**
     * Local endpoint the presentation layer sends {@link LocalCommand}s to.
     */
    public InetSocketAddress ingressAddress()
    {
        Connection ingress = onLoop(context::ingressConnection);
        SocketAddress local = ingress == null ? null : ingress.localAddress();
        return (InetSocketAddress) local;
    }

    /**
     * Hands a command to the loop exactly as if it had arrived on the ingress
     * endpoint. For presentation layers running in the same process.
     */
    public void submit(LocalCommand command)
    {
        Objects.requireNonNull(command, "command");
        byte[] payload = encoder.encode(command);
        transport.scheduler().scheduleAfter(Duration.ZERO, clock, () -> {
            Connection ingress = context.ingressConnection();
            if (ingress != null) {
                loop.onMessage(ingress, null, payload);
            }
        });
    }

    // ---------------------------------------------------------------------

    private InetSocketAddress awaitIngress()
    {
        long deadline = clock.nowNanos() + START_TIMEOUT.toNanos();
        while (clock.nowNanos() < deadline) {
            InetSocketAddress bound = ingressAddress();
            if (bound != null) {
                return bound;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        throw new TransportException("Local ingress did not bind to " + config.ingressBind());
    }

    private <T> T onLoop(Callable<T> action)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        transport.scheduler().scheduleAfter(Duration.ZERO, clock, () -> {
            try {
                result.complete(action.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get(START_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted waiting for the event loop", e);
        } catch (ExecutionException e) {
            throw new TransportException("Event loop action failed", e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Event loop did not respond", e);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private PypePeerConfig config = PypePeerConfig.builder().build();
        private PypeTransport transport;
        private PresentationListener presentation;
        private CaptureDevice microphone;
        private CaptureDevice camera;
        private PlaybackDevice speaker;
        private SecureRandom random;
        private PypeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(PypePeerConfig config)
        {
            this.config = config;
            return this;
        }

        /** Defaults to a {@link NettyPypeTransport} on the configured multicast interface. */
        public Builder withTransport(PypeTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withPresentation(PresentationListener presentation)
        {
            this.presentation = presentation;
            return this;
        }

        public Builder withMicrophone(CaptureDevice microphone)
        {
            this.microphone = microphone;
            return this;
        }

        public Builder withCamera(CaptureDevice camera)
        {
            this.camera = camera;
            return this;
        }

        public Builder withSpeaker(PlaybackDevice speaker)
        {
            this.speaker = speaker;
            return this;
        }

        public Builder withRandom(SecureRandom random)
        {
            this.random = random;
            return this;
        }

        public Builder withObservabilitySink(PypeObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public PypePeerRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(presentation, "presentation");
            Objects.requireNonNull(microphone, "microphone");
            Objects.requireNonNull(camera, "camera");
            Objects.requireNonNull(speaker, "speaker");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            PypeTransport t = transport != null
                    ? transport
                    : new NettyPypeTransport(clock, config.multicastInterface());

            ObjectMapper mapper = new ObjectMapper();
            PypeMessageDecoder decoder = new PypeMessageDecoder(mapper);
            PypeMessageEncoder encoder = new PypeMessageEncoder(mapper);

            PypeEventLoop loop = new PypeEventLoop(
                    decoder, encoder, clock, t.scheduler(), config.loopTiming(), observabilitySink);

            PeerContext context = PeerContext.builder()
                    .withConfig(config)
                    .withTransport(t)
                    .withOutbox(loop)
                    .withLoopListener(loop)
                    .withPresentation(presentation)
                    .withMicrophone(microphone)
                    .withCamera(camera)
                    .withSpeaker(speaker)
                    .withClock(clock)
                    .withWallClock(SystemWallClock.INSTANCE)
                    .withRandom(random != null ? random : new SecureRandom())
                    .withMapper(mapper)
                    .withDecoder(decoder)
                    .withEncoder(encoder)
                    .withObservabilitySink(observabilitySink)
                    .build();
            PeerDispatcher dispatcher = new PeerDispatcher(context);
            loop.setDispatcher(dispatcher);

            return new PypePeerRuntime(config, t, loop, context, dispatcher, encoder, clock);
        }
    }
}
