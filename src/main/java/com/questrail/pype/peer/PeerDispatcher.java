package com.questrail.pype.peer;

import com.questrail.pype.loop.MessageDispatcher;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.LocalCommand;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.protocol.model.UserUpdate;
import com.questrail.pype.session.CallSession;
import com.questrail.pype.session.KeyExchange;
import com.questrail.pype.session.KeyMaterial;
import com.questrail.pype.session.MediaUnit;
import com.questrail.pype.session.MediaWorkers;
import com.questrail.pype.session.SessionCryptoException;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.MediaChannel;
import com.questrail.pype.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerDispatcher
 * =============================================================================
 * Peer-side protocol handler. Every decision about what a peer does in response
 * to the directory, to other participants and to its own user is made here, on
 * the event loop thread, against an explicit {@link PeerContext}.
 *
 * <h2>Inputs</h2>
 * <ul>
 *   <li>directory server: join responses, user and call updates, invitations,
 *       relayed rejections</li>
 *   <li>local ingress: {@link LocalCommand}s from the presentation layer</li>
 *   <li>call sockets: chat content, rate feedback, medium state notices</li>
 *   <li>key distribution: public key offers (master) and key info (others)</li>
 * </ul>
 *
 * <h2>Session lifecycle</h2>
 * <pre>
 *   call_add / user_join naming us   → session created, sockets opened
 *     master                         → key generated, key listener opened, workers started
 *     other                          → handshake with the master; workers start on key info
 *   user_join / user_leave           → roster updated; master migration handled
 *   call_remove, or a roster without us, or local leave, or server loss → teardown
 * </pre>
 *
 * <h2>Periodic work</h2>
 * On every tick while in a call: handshake retries, CLR feedback and statistics,
 * each gated by its own {@link com.questrail.pype.loop.RateLimiter}.
 */
public final class PeerDispatcher implements MessageDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(PeerDispatcher.class);

    private final PeerContext ctx;

    public PeerDispatcher(PeerContext ctx)
    {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void dispatch(Connection source, SocketAddress sender, PypeMessage message)
    {
        if (message instanceof LocalCommand command) {
            if (source == ctx.ingressConnection()) {
                onLocalCommand(command);
            }
        } else if (message instanceof JoinMessage.Response response) {
            onJoinResponse(response);
        } else if (message instanceof UserUpdate update) {
            if (ctx.directory().apply(update)) {
                ctx.presentation().onDirectoryChanged(ctx.directory().users());
            }
        } else if (message instanceof CallMessage.Participate participate) {
            ctx.presentation().onCallPrompt(participate.caller());
        } else if (message instanceof CallMessage.CalleeResponse response) {
            if (!response.accepted()) {
                ctx.presentation().onCallRejected(response.callee() != null ? response.callee() : response.caller());
            }
        } else if (message instanceof CallUpdate update) {
            onCallUpdate(update);
        } else if (message instanceof SessionMessage.Content content) {
            onChatContent(source, content);
        } else if (message instanceof SessionMessage.PublicKeyOffer offer) {
            onPublicKeyOffer(source, offer);
        } else if (message instanceof SessionMessage.KeyInfo info) {
            onKeyInfo(source, info);
        } else if (message instanceof SessionMessage.Feedback feedback) {
            onFeedback(feedback);
        } else if (message instanceof SessionMessage.StateNotice notice) {
            onStateNotice(notice);
        } else {
            log.debug("Ignoring {} on {}", message.getClass().getSimpleName(), source.id());
        }
    }

    @Override
    public void onDisconnected(Connection connection, Throwable cause)
    {
        if (connection == ctx.serverConnection()) {
            endCall();
            ctx.self(null);
            ctx.pendingName(null);
            ctx.directory().clear();
            ctx.presentation().onDisconnected();
        } else if (connection == ctx.keyConnection()) {
            // Master not reachable (yet); the next tick retries.
            ctx.keyConnection(null);
            ctx.pendingExchange(null);
        }
    }

    @Override
    public void onTick()
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty()) {
            return;
        }
        CallSession session = active.get();

        if (!session.isMaster() && !session.hasKey() && ctx.keyConnection() == null
                && ctx.handshakeLimiter().tryAcquire()) {
            beginHandshake(session);
        }

        if (ctx.feedbackLimiter().tryAcquire()) {
            sendFeedback(session);
        }

        if (ctx.statisticsLimiter().tryAcquire()) {
            ctx.presentation().onStatistics(session.statistics());
        }
    }

    /**
     * Ends any active call before the process shuts down.
     */
    public void shutdown()
    {
        endCall();
    }

    // =========================================================================
    // Local commands
    // =========================================================================

    private void onLocalCommand(LocalCommand command)
    {
        if (command instanceof LocalCommand.Join join) {
            if (ctx.self().isEmpty() && ctx.pendingName() == null) {
                ctx.pendingName(join.name());
                sendToServer(new JoinMessage.Request(join.name()));
            }
            return;
        }
        if (ctx.self().isEmpty()) {
            log.debug("Ignoring {} before join", command.getClass().getSimpleName());
            return;
        }

        if (command instanceof LocalCommand.Call call) {
            if (ctx.session().isEmpty()) {
                sendToServer(new CallMessage.Request(call.callee()));
            }
        } else if (command instanceof LocalCommand.Respond respond) {
            sendToServer(new CallMessage.CalleeResponse(respond.caller(), null, respond.accept()));
        } else if (command instanceof LocalCommand.Leave) {
            if (ctx.session().isPresent()) {
                sendToServer(new SessionMessage.Leave());
                endCall();
            }
        } else if (command instanceof LocalCommand.Chat chat) {
            sendChat(chat.text());
        } else if (command instanceof LocalCommand.ToggleMedium toggle) {
            toggleMedium(toggle.medium(), toggle.enabled());
        }
    }

    private void sendChat(String text)
    {
        Optional<CallSession> active = ctx.session().filter(CallSession::hasKey);
        if (active.isEmpty() || ctx.chatConnection() == null) {
            return;
        }
        CallSession session = active.get();
        if (!session.isSendEnabled(Medium.CHAT)) {
            return;
        }
        ctx.outbox().send(ctx.chatConnection(),
                session.seal(Medium.CHAT, text.getBytes(StandardCharsets.UTF_8)));
        // Our own multicast loops back and is skipped, so echo locally.
        ctx.presentation().onChatMessage(session.self(), text);
    }

    private void toggleMedium(Medium medium, boolean enabled)
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty()) {
            return;
        }
        CallSession session = active.get();
        session.setSendEnabled(medium, enabled);
        ctx.outbox().sendTo(ctx.controlConnection(),
                new InetSocketAddress(group(session.call(), Medium.CHAT), ctx.config().controlPort()),
                new SessionMessage.StateNotice(session.self(), medium, enabled));
    }

    // =========================================================================
    // Directory
    // =========================================================================

    private void onJoinResponse(JoinMessage.Response response)
    {
        if (ctx.self().isPresent()) {
            return;
        }
        ctx.pendingName(null);
        if (!response.accepted()) {
            ctx.presentation().onJoinRejected(response.name());
            return;
        }
        ctx.self(response.name());
        ctx.directory().reset(response.name(), response.users(), response.calls());
        report(response.name(), "joined directory");
        ctx.presentation().onJoinAccepted(response.name(), ctx.directory().users(), ctx.directory().calls());
    }

    private void onCallUpdate(CallUpdate update)
    {
        ctx.directory().apply(update);
        ctx.presentation().onCallRosterChanged(ctx.directory().calls());

        Optional<String> self = ctx.self();
        if (self.isEmpty()) {
            return;
        }
        Optional<CallSession> active = ctx.session();

        if (active.isEmpty()) {
            if (update.kind() != CallUpdate.Kind.CALL_REMOVE && update.info().includes(self.get())) {
                startCall(self.get(), update.info());
            }
            return;
        }

        CallSession session = active.get();
        if (!update.callKey().equals(session.callKey())) {
            return;
        }
        if (update.kind() == CallUpdate.Kind.CALL_REMOVE || !update.info().includes(self.get())) {
            endCall();
            return;
        }

        String previousMaster = session.call().master();
        List<String> departed = session.update(update.info());
        MediaWorkers workers = ctx.mediaWorkers();
        for (String p : departed) {
            if (workers != null) {
                workers.removeParticipant(p);
            }
        }
        if (!previousMaster.equals(update.info().master())) {
            onMasterChanged(session);
        }
    }

    // =========================================================================
    // Session lifecycle
    // =========================================================================

    private void startCall(String self, CallInfo call)
    {
        CallSession session = new CallSession(
                self, call, ctx.config(), ctx.clock(), ctx.wallClock(), ctx.random(), ctx.mapper());
        ctx.session(session);

        int contentPort = ctx.config().contentPort();
        ctx.chatConnection(ctx.transport().openMulticast(group(call, Medium.CHAT), contentPort, ctx.loopListener()));
        ctx.controlConnection(ctx.transport().openMulticast(
                group(call, Medium.CHAT), ctx.config().controlPort(), ctx.loopListener()));

        int depth = ctx.config().mediaQueueDepth();
        MediaChannel audio = ctx.transport().openMediaChannel(group(call, Medium.AUDIO), contentPort, depth);
        MediaChannel video = ctx.transport().openMediaChannel(group(call, Medium.VIDEO), contentPort, depth);
        ctx.mediaWorkers(new MediaWorkers(
                session, audio, video,
                ctx.microphone(), ctx.camera(), ctx.speaker(), ctx.presentation(),
                ctx.decoder(), ctx.encoder(), ctx.clock(),
                ctx.config().workerPollTimeout(), ctx.config().playbackQueueDepth(),
                ctx.observabilitySink()));

        ctx.feedbackLimiter().reset();
        ctx.statisticsLimiter().reset();
        report(self, "call started with master " + call.master());
        ctx.presentation().onCallStarted(call);

        if (session.isMaster()) {
            becomeKeyMaster(session);
        } else {
            beginHandshake(session);
        }
    }

    private void onMasterChanged(CallSession session)
    {
        report(session.self(), "master is now " + session.call().master());
        abandonHandshake();
        if (session.isMaster()) {
            becomeKeyMaster(session);
        } else {
            closeKeyListener();
            if (!session.hasKey()) {
                ctx.handshakeLimiter().reset();
            }
        }
    }

    /**
     * Tears down the local session, if any. Blocks until the media workers exit.
     */
    private void endCall()
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty()) {
            return;
        }
        CallSession session = active.get();
        session.stop();

        MediaWorkers workers = ctx.mediaWorkers();
        if (workers != null) {
            workers.stop();
        }
        abandonHandshake();
        closeKeyListener();
        closeQuietly(ctx.chatConnection());
        closeQuietly(ctx.controlConnection());

        ctx.mediaWorkers(null);
        ctx.chatConnection(null);
        ctx.controlConnection(null);
        ctx.session(null);

        report(session.self(), "call ended");
        ctx.presentation().onCallEnded();
    }

    // =========================================================================
    // Key distribution
    // =========================================================================

    private void becomeKeyMaster(CallSession session)
    {
        if (!session.hasKey()) {
            session.generateKeyMaterial();
        }
        if (ctx.keyListener() == null) {
            ctx.keyListener(ctx.transport().listenStream(
                    new InetSocketAddress(ctx.config().keyPort()), ctx.loopListener()));
        }
        startWorkers();
    }

    private void beginHandshake(CallSession session)
    {
        abandonHandshake();
        ctx.handshakeLimiter().tryAcquire();

        KeyExchange exchange = KeyExchange.begin(session.random());
        InetSocketAddress master = new InetSocketAddress(session.call().masterHost(), ctx.config().keyPort());
        Connection connection = ctx.transport().connectStream(master, ctx.loopListener());
        ctx.pendingExchange(exchange);
        ctx.keyConnection(connection);
        ctx.outbox().send(connection, exchange.offer(session.self()));
        log.debug("{} offered its public key to {}", session.self(), master);
    }

    private void onPublicKeyOffer(Connection source, SessionMessage.PublicKeyOffer offer)
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty() || !active.get().isMaster()) {
            return;
        }
        Optional<KeyMaterial> material = active.get().keyMaterial();
        if (material.isEmpty()) {
            return;
        }
        try {
            ctx.outbox().send(source, KeyExchange.answer(offer, material.get()));
            report(offer.source(), "key distributed");
        } catch (SessionCryptoException e) {
            drop(offer.source(), "unusable public key: " + e.getMessage());
            source.close();
        }
    }

    private void onKeyInfo(Connection source, SessionMessage.KeyInfo info)
    {
        KeyExchange exchange = ctx.pendingExchange();
        Optional<CallSession> active = ctx.session();
        if (exchange == null || source != ctx.keyConnection() || active.isEmpty()) {
            return;
        }
        CallSession session = active.get();
        final KeyMaterial material;
        try {
            material = exchange.complete(info);
        } catch (SessionCryptoException e) {
            drop(session.call().master(), "key info did not unwrap: " + e.getMessage());
            abandonHandshake();
            return;
        }
        session.installKey(material);
        abandonHandshake();
        report(session.self(), "key received from " + session.call().master());
        startWorkers();
    }

    private void abandonHandshake()
    {
        Connection connection = ctx.keyConnection();
        ctx.keyConnection(null);
        ctx.pendingExchange(null);
        closeQuietly(connection);
    }

    private void closeKeyListener()
    {
        if (ctx.keyListener() != null) {
            ctx.keyListener().close();
            ctx.keyListener(null);
        }
    }

    private void startWorkers()
    {
        MediaWorkers workers = ctx.mediaWorkers();
        if (workers != null && !workers.isStarted()) {
            workers.start();
        }
    }

    // =========================================================================
    // In-call traffic
    // =========================================================================

    private void onChatContent(Connection source, SessionMessage.Content content)
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty() || source != ctx.chatConnection() || content.medium() != Medium.CHAT) {
            return;
        }
        CallSession session = active.get();
        Optional<MediaUnit> unit = session.open(content);
        if (unit.isEmpty()) {
            drop(Medium.CHAT.wireName(), "undecryptable or foreign chat unit");
            return;
        }
        if (unit.get().source().equals(session.self())) {
            return;
        }
        if (!session.track(unit.get())) {
            drop(unit.get().source(), "replayed or stale chat unit");
            return;
        }
        ctx.presentation().onChatMessage(unit.get().source(), new String(unit.get().payload(), StandardCharsets.UTF_8));
    }

    private void onFeedback(SessionMessage.Feedback feedback)
    {
        ctx.session()
                .filter(CallSession::isMaster)
                .ifPresent(session -> applyFeedback(session, feedback));
    }

    private void onStateNotice(SessionMessage.StateNotice notice)
    {
        Optional<CallSession> active = ctx.session();
        if (active.isEmpty() || notice.source().equals(active.get().self())) {
            return;
        }
        ctx.presentation().onPeerMediumState(notice.source(), notice.medium(), notice.enabled());
    }

    private void sendFeedback(CallSession session)
    {
        for (SessionMessage.Feedback feedback : session.feedback()) {
            if (session.isMaster()) {
                applyFeedback(session, feedback);
            } else {
                ctx.outbox().sendTo(ctx.controlConnection(),
                        new InetSocketAddress(session.call().masterHost(), ctx.config().controlPort()),
                        feedback);
            }
        }
    }

    private void applyFeedback(CallSession session, SessionMessage.Feedback feedback)
    {
        if (session.rateController().onFeedback(feedback.source(), feedback.rate())) {
            log.debug("Video rate {} after feedback {} from {}",
                    session.videoRate(), feedback.rate(), feedback.source());
        }
    }

    // ---------------------------------------------------------------------

    private void sendToServer(PypeMessage message)
    {
        Connection server = ctx.serverConnection();
        if (server != null) {
            ctx.outbox().send(server, message);
        }
    }

    private static InetAddress group(CallInfo call, Medium medium)
    {
        String address = call.addresses().forMedium(medium);
        try {
            return InetAddress.getByName(address);
        } catch (UnknownHostException e) {
            throw new TransportException("Bad multicast address " + address, e);
        }
    }

    private static void closeQuietly(Connection connection)
    {
        if (connection != null) {
            connection.close();
        }
    }

    private void report(String subject, String description)
    {
        ctx.observabilitySink().onProtocolEvent(new PypeProtocolEvent(
                ctx.wallClock().now(), PypeProtocolEvent.Category.SESSION, subject, description));
    }

    private void drop(String subject, String description)
    {
        ctx.observabilitySink().onProtocolEvent(new PypeProtocolEvent(
                ctx.wallClock().now(), PypeProtocolEvent.Category.INTEGRITY_DROP, subject, description));
    }
}
