package com.questrail.pype.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.api.FakeCaptureDevice;
import com.questrail.pype.api.RecordingPlaybackDevice;
import com.questrail.pype.api.RecordingPresentationListener;
import com.questrail.pype.config.PypePeerConfig;
import com.questrail.pype.loop.PypeEventLoop;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.observability.RecordingObservabilitySink;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.LocalCommand;
import com.questrail.pype.protocol.model.MediaAddresses;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.protocol.model.UserUpdate;
import com.questrail.pype.session.CallSession;
import com.questrail.pype.session.KeyExchange;
import com.questrail.pype.session.KeyMaterial;
import com.questrail.pype.time.DeterministicScheduler;
import com.questrail.pype.time.ManualMonotonicClock;
import com.questrail.pype.time.ManualWallClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.FakeConnection;
import com.questrail.pype.transport.FakeMediaChannel;
import com.questrail.pype.transport.FakePypeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PeerDispatcherTest
 * -----------------------------------------------------------------------------
 * Peer protocol behaviour against a fake transport: directory membership, call
 * setup and teardown, key distribution, master migration and in-call control
 * traffic. Everything runs on the test thread except the media workers.
 */
class PeerDispatcherTest {

    private static final MediaAddresses ADDRESSES =
            new MediaAddresses("239.255.0.1", "239.255.0.2", "239.255.0.3");

    private final PypeMessageEncoder encoder = new PypeMessageEncoder();
    private final PypeMessageDecoder decoder = new PypeMessageDecoder();
    private final SecureRandom random = new SecureRandom();

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private FakePypeTransport transport;
    private PypeEventLoop loop;
    private RecordingPresentationListener presentation;
    private RecordingObservabilitySink sink;
    private PypePeerConfig config;
    private PeerContext ctx;
    private PeerDispatcher dispatcher;
    private FakeConnection server;
    private FakeConnection ingress;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        transport = new FakePypeTransport(scheduler);
        presentation = new RecordingPresentationListener();
        sink = new RecordingObservabilitySink();
        config = PypePeerConfig.builder()
                .withWorkerPollTimeout(Duration.ofMillis(20))
                .build();

        loop = new PypeEventLoop(decoder, encoder, clock, scheduler, config.loopTiming(), sink);
        ctx = PeerContext.builder()
                .withConfig(config)
                .withTransport(transport)
                .withOutbox(loop)
                .withLoopListener(loop)
                .withPresentation(presentation)
                .withMicrophone(new FakeCaptureDevice())
                .withCamera(new FakeCaptureDevice())
                .withSpeaker(new RecordingPlaybackDevice())
                .withClock(clock)
                .withWallClock(wallClock)
                .withRandom(random)
                .withMapper(new ObjectMapper())
                .withDecoder(decoder)
                .withEncoder(encoder)
                .withObservabilitySink(sink)
                .build();
        dispatcher = new PeerDispatcher(ctx);
        loop.setDispatcher(dispatcher);

        server = new FakeConnection("server");
        ingress = new FakeConnection("ingress", null);
        ctx.serverConnection(server);
        ctx.ingressConnection(ingress);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    // ---------------------------------------------------------------------
    // Directory membership
    // ---------------------------------------------------------------------

    @Test
    void localJoinIsSentToServerOnce() {
        command(new LocalCommand.Join("alice"));
        command(new LocalCommand.Join("alice"));

        assertEquals(List.of(new JoinMessage.Request("alice")), received(server));
    }

    @Test
    void localCommandFromOtherConnectionIsIgnored() {
        loop.onMessage(new FakeConnection("stranger"), null, encoder.encode(new LocalCommand.Join("alice")));

        assertTrue(server.sent().isEmpty());
    }

    @Test
    void acceptedJoinPopulatesDirectory() {
        join("alice", new UserInfo("bob", UserStatus.AVAILABLE));

        assertEquals("alice", ctx.self().orElseThrow());
        assertEquals(List.of("joinAccepted:alice"), presentation.calls());
        assertEquals(List.of(new UserInfo("bob", UserStatus.AVAILABLE)), presentation.users());
        assertEquals(1, sink.protocolEvents(PypeProtocolEvent.Category.SESSION).size());
    }

    @Test
    void rejectedJoinAllowsAnotherAttempt() {
        command(new LocalCommand.Join("alice"));
        fromServer(JoinMessage.Response.rejected("alice"));

        assertTrue(ctx.self().isEmpty());
        assertEquals(List.of("joinRejected:alice"), presentation.calls());

        command(new LocalCommand.Join("alice2"));
        assertEquals(new JoinMessage.Request("alice2"), last(received(server)));
    }

    @Test
    void commandsBeforeJoinAreIgnored() {
        command(new LocalCommand.Call("bob"));
        command(new LocalCommand.Chat("hi"));

        assertTrue(server.sent().isEmpty());
    }

    @Test
    void userUpdatesChangeDirectoryExceptOwn() {
        join("alice");

        fromServer(new UserUpdate(UserUpdate.Kind.JOIN, "bob", UserStatus.AVAILABLE));
        fromServer(new UserUpdate(UserUpdate.Kind.STATUS, "alice", UserStatus.IN_CALL));

        assertEquals(List.of("joinAccepted:alice", "directoryChanged"), presentation.calls());
        assertEquals(List.of(new UserInfo("bob", UserStatus.AVAILABLE)), presentation.users());
    }

    @Test
    void invitationIsPromptedAndAnswered() {
        join("bob");

        fromServer(new CallMessage.Participate("alice"));
        command(new LocalCommand.Respond("alice", true));

        assertTrue(presentation.calls().contains("callPrompt:alice"));
        assertEquals(new CallMessage.CalleeResponse("alice", null, true), last(received(server)));
    }

    @Test
    void calleeRejectionIsReported() {
        join("alice");
        command(new LocalCommand.Call("bob"));
        assertEquals(new CallMessage.Request("bob"), last(received(server)));

        fromServer(new CallMessage.CalleeResponse("alice", "bob", false));

        assertEquals("callRejected:bob", last(presentation.calls()));
    }

    @Test
    void serverLossEndsCallAndForgetsIdentity() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        loop.onDisconnected(server, null);

        assertTrue(ctx.self().isEmpty());
        assertTrue(ctx.session().isEmpty());
        assertTrue(ctx.directory().users().isEmpty());
        List<String> calls = presentation.calls();
        assertEquals("disconnected", last(calls));
        assertTrue(calls.contains("callEnded"));
    }

    // ---------------------------------------------------------------------
    // Call lifecycle
    // ---------------------------------------------------------------------

    @Test
    void callUpdateWithoutUsOnlyChangesRoster() {
        join("carol");

        fromServer(new CallUpdate(CallUpdate.Kind.CALL_ADD, "alice", "bob", call("alice", "alice", "bob")));

        assertTrue(ctx.session().isEmpty());
        assertEquals("callRosterChanged", last(presentation.calls()));
        assertEquals(1, presentation.callRoster().size());
    }

    @Test
    void masterStartsCallWithKeyListenerAndWorkers() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        CallSession session = ctx.session().orElseThrow();
        assertTrue(session.isMaster());
        assertTrue(session.hasKey());
        assertTrue(ctx.mediaWorkers().isStarted());
        assertEquals(1, transport.listeners().size());
        assertEquals(config.keyPort(), transport.listeners().get(0).localAddress().getPort());
        assertEquals(2, transport.opened("multicast").size());
        assertEquals(2, transport.mediaChannels().size());
        assertTrue(presentation.calls().contains("callStarted:alice"));
    }

    @Test
    void participantHandshakesWithMasterAndStartsWorkersOnKey() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));

        CallSession session = ctx.session().orElseThrow();
        assertFalse(session.hasKey());
        assertFalse(ctx.mediaWorkers().isStarted());

        FakePypeTransport.Opened stream = only(transport.opened("stream"));
        assertEquals(new InetSocketAddress("10.0.0.5", config.keyPort()), stream.address());
        FakeConnection keyConnection = (FakeConnection) stream.connection();
        SessionMessage.PublicKeyOffer offer =
                assertInstanceOf(SessionMessage.PublicKeyOffer.class, only(received(keyConnection)));
        assertEquals("bob", offer.source());

        KeyMaterial material = KeyMaterial.generate(random);
        loop.onMessage(keyConnection, null, encoder.encode(KeyExchange.answer(offer, material)));

        assertTrue(session.hasKey());
        KeyMaterial installed = session.keyMaterial().orElseThrow();
        assertArrayEquals(material.key(), installed.key());
        assertEquals(material.sessionNonce(), installed.sessionNonce());
        assertFalse(keyConnection.isOpen());
        assertTrue(ctx.mediaWorkers().isStarted());
    }

    @Test
    void keyInfoFromUnexpectedConnectionIsIgnored() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));
        FakeConnection keyConnection = (FakeConnection) only(transport.opened("stream")).connection();
        SessionMessage.PublicKeyOffer offer =
                (SessionMessage.PublicKeyOffer) only(received(keyConnection));

        loop.onMessage(new FakeConnection("impostor"), null,
                encoder.encode(KeyExchange.answer(offer, KeyMaterial.generate(random))));

        assertFalse(ctx.session().orElseThrow().hasKey());
    }

    @Test
    void failedHandshakeIsRetriedOnTick() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));
        Connection first = only(transport.opened("stream")).connection();

        loop.onDisconnected(first, new IOException("refused"));
        loop.tick();
        assertEquals(1, transport.opened("stream").size(), "retry waits for the retry interval");

        clock.advanceSeconds(1.0);
        loop.tick();

        assertEquals(2, transport.opened("stream").size());
        FakeConnection second = (FakeConnection) transport.opened("stream").get(1).connection();
        assertInstanceOf(SessionMessage.PublicKeyOffer.class, only(received(second)));
    }

    @Test
    void masterAnswersPublicKeyOffer() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        KeyMaterial material = ctx.session().orElseThrow().keyMaterial().orElseThrow();
        FakeConnection accepted = new FakeConnection("key-peer");
        KeyExchange exchange = KeyExchange.begin(random);

        loop.onMessage(accepted, null, encoder.encode(exchange.offer("bob")));

        SessionMessage.KeyInfo info = assertInstanceOf(SessionMessage.KeyInfo.class, only(received(accepted)));
        KeyMaterial unwrapped = exchange.complete(info);
        assertArrayEquals(material.key(), unwrapped.key());
        assertArrayEquals(material.iv(), unwrapped.iv());
        assertEquals(material.sessionNonce(), unwrapped.sessionNonce());
    }

    @Test
    void unusablePublicKeyIsDroppedAndConnectionClosed() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        FakeConnection accepted = new FakeConnection("key-peer");

        loop.onMessage(accepted, null, encoder.encode(new SessionMessage.PublicKeyOffer("mallory", new byte[]{1, 2, 3})));

        assertTrue(accepted.sent().isEmpty());
        assertFalse(accepted.isOpen());
        assertEquals(1, sink.protocolEvents(PypeProtocolEvent.Category.INTEGRITY_DROP).size());
    }

    @Test
    void callRemoveTearsDownSession() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        Connection chat = chatConnection();
        Connection control = controlConnection();

        fromServer(new CallUpdate(CallUpdate.Kind.CALL_REMOVE, "alice", "bob", call("alice", "alice", "bob")));

        assertTrue(ctx.session().isEmpty());
        assertNull(ctx.mediaWorkers());
        assertFalse(chat.isOpen());
        assertFalse(control.isOpen());
        assertTrue(transport.listeners().get(0).isClosed());
        for (FakeMediaChannel channel : transport.mediaChannels()) {
            assertTrue(channel.isClosed());
        }
        assertEquals("callEnded", last(presentation.calls()));
    }

    @Test
    void updateForAnotherCallIsIgnoredInCall() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        fromServer(new CallUpdate(CallUpdate.Kind.CALL_REMOVE, "carol", "dave", call("carol", "carol", "dave")));

        assertTrue(ctx.session().isPresent());
    }

    @Test
    void localLeaveNotifiesServerAndEndsCall() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));

        command(new LocalCommand.Leave());

        assertEquals(new SessionMessage.Leave(), last(received(server)));
        assertTrue(ctx.session().isEmpty());
        assertTrue(presentation.calls().contains("callEnded"));
    }

    @Test
    void rosterWithoutUsEndsCall() {
        joinAndEnterCall("bob", call("alice", "alice", "bob", "carol"));

        fromServer(new CallUpdate(CallUpdate.Kind.USER_LEAVE, "alice", "bob", call("alice", "alice", "carol")));

        assertTrue(ctx.session().isEmpty());
    }

    @Test
    void participantBecomesKeyMasterAfterMigration() {
        joinAndEnterCall("bob", call("alice", "alice", "bob", "carol"));
        Connection handshake = only(transport.opened("stream")).connection();

        fromServer(new CallUpdate(CallUpdate.Kind.USER_LEAVE, "alice", "alice",
                new CallInfo("bob", "10.0.0.6", List.of("bob", "carol"), ADDRESSES)));

        CallSession session = ctx.session().orElseThrow();
        assertTrue(session.isMaster());
        assertEquals("bob", session.callKey());
        assertTrue(session.hasKey(), "new master without a key generates one");
        assertFalse(handshake.isOpen());
        assertEquals(1, transport.listeners().size());
        assertTrue(ctx.mediaWorkers().isStarted());
    }

    @Test
    void keylessParticipantHandshakesWithNewMaster() {
        joinAndEnterCall("carol", call("alice", "alice", "bob", "carol"));

        fromServer(new CallUpdate(CallUpdate.Kind.USER_LEAVE, "alice", "alice",
                new CallInfo("bob", "10.0.0.6", List.of("bob", "carol"), ADDRESSES)));
        loop.tick();

        List<FakePypeTransport.Opened> streams = transport.opened("stream");
        assertEquals(2, streams.size());
        assertEquals(new InetSocketAddress("10.0.0.6", config.keyPort()), streams.get(1).address());
    }

    // ---------------------------------------------------------------------
    // In-call traffic
    // ---------------------------------------------------------------------

    @Test
    void chatIsSealedToGroupAndEchoedLocally() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        command(new LocalCommand.Chat("hello"));

        FakeConnection chat = chatConnection();
        SessionMessage.Content content = assertInstanceOf(SessionMessage.Content.class, only(received(chat)));
        assertEquals(Medium.CHAT, content.medium());
        assertEquals(List.of("alice: hello"), presentation.chat());
    }

    @Test
    void remoteChatIsOpenedAndDelivered() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        CallSession bob = remoteSession("bob", call("alice", "alice", "bob"));
        byte[] unit = encoder.encode(bob.seal(Medium.CHAT, "hi alice".getBytes(StandardCharsets.UTF_8)));

        loop.onMessage(chatConnection(), null, unit);
        loop.onMessage(controlConnection(), null, unit);
        loop.onMessage(chatConnection(), null, unit);

        assertEquals(List.of("bob: hi alice"), presentation.chat());
        assertEquals(1, sink.protocolEvents(PypeProtocolEvent.Category.INTEGRITY_DROP).size(), "replay is dropped");
    }

    @Test
    void ownLoopedBackChatIsSkipped() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        command(new LocalCommand.Chat("echo"));
        byte[] own = chatConnection().payloads().get(0);

        loop.onMessage(chatConnection(), null, own);

        assertEquals(List.of("alice: echo"), presentation.chat());
    }

    @Test
    void toggleMediumDisablesSendingAndNotifiesGroup() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        command(new LocalCommand.ToggleMedium(Medium.VIDEO, false));

        assertFalse(ctx.session().orElseThrow().isSendEnabled(Medium.VIDEO));
        FakeConnection.Sent sent = only(controlConnection().sent());
        assertEquals(new InetSocketAddress("239.255.0.3", config.controlPort()), sent.remote());
        assertEquals(new SessionMessage.StateNotice("alice", Medium.VIDEO, false), decoder.decode(sent.payload()));
    }

    @Test
    void disabledChatIsNotSent() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        command(new LocalCommand.ToggleMedium(Medium.CHAT, false));

        command(new LocalCommand.Chat("quiet"));

        assertTrue(chatConnection().sent().isEmpty());
        assertTrue(presentation.chat().isEmpty());
    }

    @Test
    void remoteStateNoticeIsPresented() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));

        loop.onMessage(controlConnection(), null, encoder.encode(new SessionMessage.StateNotice("bob", Medium.AUDIO, false)));
        loop.onMessage(controlConnection(), null, encoder.encode(new SessionMessage.StateNotice("alice", Medium.AUDIO, false)));

        assertEquals("mediumState:bob:audio:false", last(presentation.calls()));
    }

    @Test
    void masterAppliesFeedbackToVideoRate() {
        joinAndEnterCall("alice", call("alice", "alice", "bob"));
        double before = ctx.session().orElseThrow().videoRate();

        loop.onMessage(controlConnection(), null, encoder.encode(new SessionMessage.Feedback("bob", 5)));

        assertTrue(ctx.session().orElseThrow().videoRate() < before);
    }

    @Test
    void participantIgnoresFeedback() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));
        double before = ctx.session().orElseThrow().videoRate();

        loop.onMessage(controlConnection(), null, encoder.encode(new SessionMessage.Feedback("carol", 1)));

        assertEquals(before, ctx.session().orElseThrow().videoRate());
    }

    @Test
    void participantSendsFeedbackToMasterOnTick() {
        joinAndEnterCall("bob", call("alice", "alice", "bob"));
        ctx.session().orElseThrow().tracker("alice", Medium.VIDEO)
                .process(0, 1, wallClock.epochSeconds() - 0.1, 10);

        loop.tick();

        FakeConnection.Sent sent = only(controlConnection().sent());
        assertEquals(new InetSocketAddress("10.0.0.5", config.controlPort()), sent.remote());
        assertEquals(new SessionMessage.Feedback("bob", 10), decoder.decode(sent.payload()));
        assertNotNull(presentation.statistics());
    }

    // ---------------------------------------------------------------------

    private void command(LocalCommand command) {
        loop.onMessage(ingress, null, encoder.encode(command));
    }

    private void fromServer(PypeMessage message) {
        loop.onMessage(server, null, encoder.encode(message));
    }

    private void join(String name, UserInfo... others) {
        command(new LocalCommand.Join(name));
        fromServer(new JoinMessage.Response(JoinMessage.Status.OK, name, List.of(others), List.of()));
    }

    private void joinAndEnterCall(String self, CallInfo call) {
        join(self);
        fromServer(new CallUpdate(CallUpdate.Kind.CALL_ADD, call.master(), self, call));
        assertTrue(ctx.session().isPresent(), "call started");
    }

    private static CallInfo call(String master, String... participants) {
        return new CallInfo(master, "10.0.0.5", List.of(participants), ADDRESSES);
    }

    private CallSession remoteSession(String self, CallInfo call) {
        CallSession remote = new CallSession(self, call, config, clock, wallClock, random, new ObjectMapper());
        remote.installKey(ctx.session().orElseThrow().keyMaterial().orElseThrow());
        return remote;
    }

    private FakeConnection chatConnection() {
        return multicastOnPort(config.contentPort());
    }

    private FakeConnection controlConnection() {
        return multicastOnPort(config.controlPort());
    }

    private FakeConnection multicastOnPort(int port) {
        FakePypeTransport.Opened match = null;
        for (FakePypeTransport.Opened o : transport.opened("multicast")) {
            if (o.address().getPort() == port) {
                match = o;
            }
        }
        assertNotNull(match, "no multicast socket on port " + port);
        return (FakeConnection) match.connection();
    }

    private List<PypeMessage> received(FakeConnection connection) {
        List<PypeMessage> out = new ArrayList<>();
        for (byte[] payload : connection.payloads()) {
            out.add(decoder.decode(payload));
        }
        return out;
    }

    private static <T> T only(List<T> items) {
        assertEquals(1, items.size(), "expected exactly one element in " + items);
        return items.get(0);
    }

    private static <T> T last(List<T> items) {
        assertFalse(items.isEmpty());
        return items.get(items.size() - 1);
    }
}
