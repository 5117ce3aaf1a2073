package com.questrail.pype.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.api.CaptureDevice;
import com.questrail.pype.api.PlaybackDevice;
import com.questrail.pype.api.PresentationListener;
import com.questrail.pype.config.PypePeerConfig;
import com.questrail.pype.loop.Outbox;
import com.questrail.pype.loop.RateLimiter;
import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.session.CallSession;
import com.questrail.pype.session.KeyExchange;
import com.questrail.pype.session.MediaWorkers;
import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.WallClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.ConnectionListener;
import com.questrail.pype.transport.ListenerHandle;
import com.questrail.pype.transport.PypeTransport;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerContext
 * =============================================================================
 * Everything one peer process knows and owns, passed explicitly to the code
 * that acts on it.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>collaborators: configuration, transport, outbox, presentation layer,
 *       capture and playback devices, clocks, randomness, codecs</li>
 *   <li>directory state: our registered name and the {@link DirectoryView}</li>
 *   <li>call state: the {@link CallSession}, its watched chat and control
 *       sockets, key-distribution listener or in-flight handshake, and the
 *       {@link MediaWorkers}</li>
 *   <li>cadence limiters for feedback, statistics and handshake retries</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Mutable state is owned by the event loop thread. Nothing here is locked.
 */
public final class PeerContext
{
    private final PypePeerConfig config;
    private final PypeTransport transport;
    private final Outbox outbox;
    private final ConnectionListener loopListener;
    private final PresentationListener presentation;
    private final CaptureDevice microphone;
    private final CaptureDevice camera;
    private final PlaybackDevice speaker;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SecureRandom random;
    private final ObjectMapper mapper;
    private final PypeMessageDecoder decoder;
    private final PypeMessageEncoder encoder;
    private final PypeObservabilitySink observabilitySink;

    private final DirectoryView directory = new DirectoryView();
    private final RateLimiter feedbackLimiter;
    private final RateLimiter statisticsLimiter;
    private final RateLimiter handshakeLimiter;

    private Connection serverConnection;
    private Connection ingressConnection;
    private String self;
    private String pendingName;

    private CallSession session;
    private Connection chatConnection;
    private Connection controlConnection;
    private ListenerHandle keyListener;
    private Connection keyConnection;
    private KeyExchange pendingExchange;
    private MediaWorkers mediaWorkers;

    private PeerContext(Builder b)
    {
        this.config = Objects.requireNonNull(b.config, "config");
        this.transport = Objects.requireNonNull(b.transport, "transport");
        this.outbox = Objects.requireNonNull(b.outbox, "outbox");
        this.loopListener = Objects.requireNonNull(b.loopListener, "loopListener");
        this.presentation = Objects.requireNonNull(b.presentation, "presentation");
        this.microphone = Objects.requireNonNull(b.microphone, "microphone");
        this.camera = Objects.requireNonNull(b.camera, "camera");
        this.speaker = Objects.requireNonNull(b.speaker, "speaker");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.random = Objects.requireNonNull(b.random, "random");
        this.mapper = Objects.requireNonNull(b.mapper, "mapper");
        this.decoder = Objects.requireNonNull(b.decoder, "decoder");
        this.encoder = Objects.requireNonNull(b.encoder, "encoder");
        this.observabilitySink = Objects.requireNonNullElse(b.observabilitySink, NullObservabilitySink.INSTANCE);

        this.feedbackLimiter = RateLimiter.every(clock, config.feedbackInterval());
        this.statisticsLimiter = RateLimiter.every(clock, config.statisticsInterval());
        this.handshakeLimiter = RateLimiter.every(clock, config.handshakeRetryInterval());
    }

    // ---------------------------------------------------------------------
    // Collaborators
    // ---------------------------------------------------------------------

    public PypePeerConfig config() { return config; }
    public PypeTransport transport() { return transport; }
    public Outbox outbox() { return outbox; }
    public ConnectionListener loopListener() { return loopListener; }
    public PresentationListener presentation() { return presentation; }
    public CaptureDevice microphone() { return microphone; }
    public CaptureDevice camera() { return camera; }
    public PlaybackDevice speaker() { return speaker; }
    public MonotonicClock clock() { return clock; }
    public WallClock wallClock() { return wallClock; }
    public SecureRandom random() { return random; }
    public ObjectMapper mapper() { return mapper; }
    public PypeMessageDecoder decoder() { return decoder; }
    public PypeMessageEncoder encoder() { return encoder; }
    public PypeObservabilitySink observabilitySink() { return observabilitySink; }

    public DirectoryView directory() { return directory; }
    RateLimiter feedbackLimiter() { return feedbackLimiter; }
    RateLimiter statisticsLimiter() { return statisticsLimiter; }
    RateLimiter handshakeLimiter() { return handshakeLimiter; }

    // ---------------------------------------------------------------------
    // Directory state
    // ---------------------------------------------------------------------

    Connection serverConnection() { return serverConnection; }
    void serverConnection(Connection c) { this.serverConnection = c; }

    Connection ingressConnection() { return ingressConnection; }
    void ingressConnection(Connection c) { this.ingressConnection = c; }

    /**
     * Our registered name, once the directory accepted it.
     */
    public Optional<String> self() { return Optional.ofNullable(self); }
    void self(String name) { this.self = name; }

    String pendingName() { return pendingName; }
    void pendingName(String name) { this.pendingName = name; }

    // ---------------------------------------------------------------------
    // Call state
    // ---------------------------------------------------------------------

    public Optional<CallSession> session() { return Optional.ofNullable(session); }
    void session(CallSession s) { this.session = s; }

    Connection chatConnection() { return chatConnection; }
    void chatConnection(Connection c) { this.chatConnection = c; }

    Connection controlConnection() { return controlConnection; }
    void controlConnection(Connection c) { this.controlConnection = c; }

    ListenerHandle keyListener() { return keyListener; }
    void keyListener(ListenerHandle h) { this.keyListener = h; }

    Connection keyConnection() { return keyConnection; }
    void keyConnection(Connection c) { this.keyConnection = c; }

    KeyExchange pendingExchange() { return pendingExchange; }
    void pendingExchange(KeyExchange e) { this.pendingExchange = e; }

    MediaWorkers mediaWorkers() { return mediaWorkers; }
    void mediaWorkers(MediaWorkers w) { this.mediaWorkers = w; }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private PypePeerConfig config;
        private PypeTransport transport;
        private Outbox outbox;
        private ConnectionListener loopListener;
        private PresentationListener presentation;
        private CaptureDevice microphone;
        private CaptureDevice camera;
        private PlaybackDevice speaker;
        private MonotonicClock clock;
        private WallClock wallClock;
        private SecureRandom random;
        private ObjectMapper mapper;
        private PypeMessageDecoder decoder;
        private PypeMessageEncoder encoder;
        private PypeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(PypePeerConfig config) { this.config = config; return this; }
        public Builder withTransport(PypeTransport transport) { this.transport = transport; return this; }
        public Builder withOutbox(Outbox outbox) { this.outbox = outbox; return this; }
        public Builder withLoopListener(ConnectionListener listener) { this.loopListener = listener; return this; }
        public Builder withPresentation(PresentationListener presentation) { this.presentation = presentation; return this; }
        public Builder withMicrophone(CaptureDevice microphone) { this.microphone = microphone; return this; }
        public Builder withCamera(CaptureDevice camera) { this.camera = camera; return this; }
        public Builder withSpeaker(PlaybackDevice speaker) { this.speaker = speaker; return this; }
        public Builder withClock(MonotonicClock clock) { this.clock = clock; return this; }
        public Builder withWallClock(WallClock wallClock) { this.wallClock = wallClock; return this; }
        public Builder withRandom(SecureRandom random) { this.random = random; return this; }
        public Builder withMapper(ObjectMapper mapper) { this.mapper = mapper; return this; }
        public Builder withDecoder(PypeMessageDecoder decoder) { this.decoder = decoder; return this; }
        public Builder withEncoder(PypeMessageEncoder encoder) { this.encoder = encoder; return this; }
        public Builder withObservabilitySink(PypeObservabilitySink sink) { this.observabilitySink = sink; return this; }

        public PeerContext build()
        {
            return new PeerContext(this);
        }
    }
}
