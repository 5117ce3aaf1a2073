package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.protocol.model.UserUpdate;
import com.questrail.pype.transport.FakeConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallRegistryTest
 * -----------------------------------------------------------------------------
 * Directory and call formation behavior of the server-side registry.
 */
class CallRegistryTest {

    private MulticastAddressPool pool;
    private CallRegistry registry;

    private FakeConnection alice;
    private FakeConnection bob;
    private FakeConnection carol;

    @BeforeEach
    void setUp() {
        pool = new MulticastAddressPool();
        registry = new CallRegistry(pool);
        alice = new FakeConnection("alice", new InetSocketAddress("10.0.0.1", 40001));
        bob = new FakeConnection("bob", new InetSocketAddress("10.0.0.2", 40002));
        carol = new FakeConnection("carol", new InetSocketAddress("10.0.0.3", 40003));
    }

    // ---------------------------------------------------------------------
    // Join / disconnect
    // ---------------------------------------------------------------------

    @Test
    void firstJoinGetsEmptyRosters() {
        List<Delivery> out = registry.join(alice, "alice");

        assertEquals(1, out.size());
        JoinMessage.Response response = (JoinMessage.Response) out.get(0).message();
        assertTrue(response.accepted());
        assertEquals("alice", response.name());
        assertTrue(response.users().isEmpty());
        assertTrue(response.calls().isEmpty());
        assertEquals(1, registry.userCount());
    }

    @Test
    void secondJoinIsAnnouncedToExistingUsers() {
        registry.join(alice, "alice");
        List<Delivery> out = registry.join(bob, "bob");

        JoinMessage.Response response = (JoinMessage.Response) messagesTo(out, bob).get(0);
        assertEquals(List.of(new UserInfo("alice", UserStatus.AVAILABLE)), response.users());

        List<PypeMessage> toAlice = messagesTo(out, alice);
        assertEquals(List.of(new UserUpdate(UserUpdate.Kind.JOIN, "bob", UserStatus.AVAILABLE)), toAlice);
        assertTrue(messagesTo(out, bob).stream().noneMatch(m -> m instanceof UserUpdate));
    }

    @Test
    void duplicateNameIsRejectedWithStatus() {
        registry.join(alice, "alice");
        List<Delivery> out = registry.join(bob, "alice");

        assertEquals(1, out.size());
        assertSame(bob, out.get(0).connection());
        JoinMessage.Response response = (JoinMessage.Response) out.get(0).message();
        assertFalse(response.accepted());
        assertEquals(1, registry.userCount());
    }

    @Test
    void connectionCannotRegisterTwoNames() {
        registry.join(alice, "alice");
        List<Delivery> out = registry.join(alice, "alice2");

        assertFalse(((JoinMessage.Response) out.get(0).message()).accepted());
        assertTrue(registry.user("alice2").isEmpty());
    }

    @Test
    void disconnectRemovesUserAndBroadcastsLeave() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");

        List<Delivery> out = registry.disconnect(alice);

        assertEquals(1, registry.userCount());
        assertEquals(List.of(new UserUpdate(UserUpdate.Kind.LEAVE, "alice", UserStatus.AVAILABLE)),
                messagesTo(out, bob));
        assertTrue(registry.disconnect(alice).isEmpty(), "second disconnect is a no-op");
    }

    @Test
    void userCountTracksJoinsMinusLeaves() {
        FakeConnection[] conns = new FakeConnection[6];
        for (int i = 0; i < conns.length; i++) {
            conns[i] = new FakeConnection("c" + i);
            registry.join(conns[i], "user" + i);
        }
        registry.join(new FakeConnection("dup"), "user3");
        registry.disconnect(conns[1]);
        registry.disconnect(conns[4]);

        assertEquals(4, registry.userCount());
        Set<String> names = new HashSet<>();
        for (int i = 0; i < conns.length; i++) {
            registry.userNameOf(conns[i]).ifPresent(names::add);
        }
        assertEquals(Set.of("user0", "user2", "user3", "user5"), names);
    }

    // ---------------------------------------------------------------------
    // Call formation
    // ---------------------------------------------------------------------

    @Test
    void callRequestMarksBothInCallAndInvitesCallee() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");

        List<Delivery> out = registry.callRequest(alice, "bob");

        assertEquals(UserStatus.IN_CALL, registry.user("alice").orElseThrow().status());
        assertEquals(UserStatus.IN_CALL, registry.user("bob").orElseThrow().status());
        assertTrue(messagesTo(out, bob).contains(new CallMessage.Participate("alice")));
        assertTrue(registry.activeCalls().isEmpty(), "no call until the callee accepts");
    }

    @Test
    void acceptCreatesCallAnnouncedToWholeDirectory() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");
        registry.join(carol, "carol");
        registry.callRequest(alice, "bob");

        List<Delivery> out = registry.calleeResponse(bob, "alice", true);

        List<CallUpdate> adds = updates(out, CallUpdate.Kind.CALL_ADD);
        assertEquals(3, adds.size(), "alice, bob and idle carol all see the call");
        Set<Object> targets = out.stream().map(Delivery::connection).collect(Collectors.toSet());
        assertTrue(targets.contains(carol));

        CallInfo info = adds.get(0).info();
        assertEquals("alice", info.master());
        assertEquals("10.0.0.1", info.masterHost());
        assertEquals(List.of("alice", "bob"), info.participants());
        assertEquals(3, pool.inUse());
        assertEquals(info, registry.callOf("bob").orElseThrow());
    }

    @Test
    void rejectRevertsBothAndTellsCaller() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");
        registry.callRequest(alice, "bob");

        List<Delivery> out = registry.calleeResponse(bob, "alice", false);

        assertEquals(UserStatus.AVAILABLE, registry.user("alice").orElseThrow().status());
        assertEquals(UserStatus.AVAILABLE, registry.user("bob").orElseThrow().status());
        assertTrue(messagesTo(out, alice).contains(new CallMessage.CalleeResponse("alice", "bob", false)));
        assertTrue(registry.activeCalls().isEmpty());
    }

    @Test
    void responseWithoutInvitationIsIgnored() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");

        assertTrue(registry.calleeResponse(bob, "alice", true).isEmpty());
        assertTrue(registry.activeCalls().isEmpty());
    }

    @Test
    void requestsForUnknownUsersAreIgnored() {
        registry.join(alice, "alice");

        assertTrue(registry.callRequest(alice, "nobody").isEmpty());
        assertTrue(registry.callRequest(alice, "alice").isEmpty());
        assertTrue(registry.callRequest(new FakeConnection("stranger"), "alice").isEmpty());
        assertTrue(registry.leave(alice).isEmpty());
    }

    @Test
    void busyCalleeIsReportedToCaller() {
        formCall(alice, "alice", bob, "bob");
        registry.join(carol, "carol");

        List<Delivery> out = registry.callRequest(carol, "bob");

        assertEquals(List.of(new CallMessage.CalleeResponse("carol", "bob", false)), messagesTo(out, carol));
        assertEquals(UserStatus.AVAILABLE, registry.user("carol").orElseThrow().status());
    }

    @Test
    void pendingCalleeCannotStartAnotherCall() {
        FakeConnection dave = new FakeConnection("dave", new InetSocketAddress("10.0.0.4", 40004));
        formCall(alice, "alice", dave, "dave");
        registry.join(bob, "bob");
        registry.join(carol, "carol");
        registry.callRequest(alice, "bob");

        List<Delivery> out = registry.callRequest(bob, "carol");

        assertEquals(List.of(new CallMessage.CalleeResponse("bob", "carol", false)), messagesTo(out, bob));
        assertTrue(messagesTo(out, carol).isEmpty());
        assertEquals(UserStatus.AVAILABLE, registry.user("carol").orElseThrow().status());
        assertTrue(registry.calleeResponse(carol, "bob", true).isEmpty(), "no invitation was recorded");

        registry.calleeResponse(bob, "alice", true);
        assertEquals(List.of("alice", "dave", "bob"), registry.callOf("bob").orElseThrow().participants());
        assertEquals(1, registry.activeCalls().size());
        assertEquals(3, pool.inUse());

        registry.leave(bob);
        assertTrue(registry.callOf("bob").isEmpty());
        assertEquals(List.of("alice", "dave"), registry.callOf("alice").orElseThrow().participants());
        assertEquals(1, registry.activeCalls().size());
    }

    @Test
    void invitingFromInsideACallAddsToThatCall() {
        formCall(alice, "alice", bob, "bob");
        registry.join(carol, "carol");

        registry.callRequest(bob, "carol");
        List<Delivery> out = registry.calleeResponse(carol, "bob", true);

        List<CallUpdate> joins = updates(out, CallUpdate.Kind.USER_JOIN);
        assertFalse(joins.isEmpty());
        assertEquals("alice", joins.get(0).callKey());
        assertEquals("carol", joins.get(0).user());
        assertEquals(List.of("alice", "bob", "carol"), joins.get(0).info().participants());
        assertEquals(1, registry.activeCalls().size());
        assertEquals(3, pool.inUse());
    }

    // ---------------------------------------------------------------------
    // Leave / dissolution / migration
    // ---------------------------------------------------------------------

    @Test
    void leavingTwoPersonCallDissolvesIt() {
        formCall(alice, "alice", bob, "bob");

        List<Delivery> out = registry.leave(alice);

        List<CallUpdate> removes = updates(out, CallUpdate.Kind.CALL_REMOVE);
        assertEquals(2, removes.size());
        assertEquals("alice", removes.get(0).callKey());
        assertEquals(UserStatus.AVAILABLE, registry.user("bob").orElseThrow().status());
        assertEquals(UserStatus.AVAILABLE, registry.user("alice").orElseThrow().status());
        assertTrue(registry.activeCalls().isEmpty());
        assertEquals(0, pool.inUse());
    }

    @Test
    void masterLeavingPromotesEarliestRemainingParticipant() {
        CallInfo formed = formCall(alice, "alice", bob, "bob");
        registry.join(carol, "carol");
        registry.callRequest(alice, "carol");
        registry.calleeResponse(carol, "alice", true);

        List<Delivery> out = registry.leave(alice);

        List<CallUpdate> leaves = updates(out, CallUpdate.Kind.USER_LEAVE);
        assertFalse(leaves.isEmpty());
        CallUpdate leave = leaves.get(0);
        assertEquals("alice", leave.callKey(), "old key identifies the call");
        assertEquals("bob", leave.info().master());
        assertEquals(List.of("bob", "carol"), leave.info().participants());
        assertEquals(formed.addresses(), leave.info().addresses());

        CallInfo now = registry.callOf("carol").orElseThrow();
        assertEquals("bob", now.master());
        assertEquals("10.0.0.2", now.masterHost());
        assertEquals(1, registry.activeCalls().size());
    }

    @Test
    void disconnectInCallRunsLeaveHandling() {
        formCall(alice, "alice", bob, "bob");

        List<Delivery> out = registry.disconnect(bob);

        assertEquals(1, updates(out, CallUpdate.Kind.CALL_REMOVE).size(), "only alice remains to hear it");
        assertTrue(registry.activeCalls().isEmpty());
        assertEquals(UserStatus.AVAILABLE, registry.user("alice").orElseThrow().status());
    }

    @Test
    void disconnectOfInvitedCalleeRevertsCaller() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");
        registry.callRequest(alice, "bob");

        List<Delivery> out = registry.disconnect(bob);

        assertEquals(UserStatus.AVAILABLE, registry.user("alice").orElseThrow().status());
        assertTrue(messagesTo(out, alice).contains(new CallMessage.CalleeResponse("alice", "bob", false)));
    }

    @Test
    void disconnectOfCallerRevertsInvitedCallee() {
        registry.join(alice, "alice");
        registry.join(bob, "bob");
        registry.callRequest(alice, "bob");

        registry.disconnect(alice);

        assertEquals(UserStatus.AVAILABLE, registry.user("bob").orElseThrow().status());
        assertTrue(registry.calleeResponse(bob, "alice", true).isEmpty());
    }

    @Test
    void liveCallsNeverShareAddresses() {
        FakeConnection[] conns = new FakeConnection[6];
        for (int i = 0; i < conns.length; i++) {
            conns[i] = new FakeConnection("c" + i);
            registry.join(conns[i], "u" + i);
        }
        for (int i = 0; i < conns.length; i += 2) {
            registry.callRequest(conns[i], "u" + (i + 1));
            registry.calleeResponse(conns[i + 1], "u" + i, true);
        }
        registry.leave(conns[2]);
        registry.callRequest(conns[2], "u3");
        registry.calleeResponse(conns[3], "u2", true);

        Set<String> seen = new HashSet<>();
        for (CallInfo call : registry.activeCalls()) {
            assertTrue(seen.add(call.addresses().audio()));
            assertTrue(seen.add(call.addresses().video()));
            assertTrue(seen.add(call.addresses().chat()));
        }
        assertEquals(9, seen.size());
        assertEquals(9, pool.inUse());
    }

    @Test
    void joinSnapshotIncludesActiveCalls() {
        CallInfo formed = formCall(alice, "alice", bob, "bob");

        List<Delivery> out = registry.join(carol, "carol");

        JoinMessage.Response response = (JoinMessage.Response) messagesTo(out, carol).get(0);
        assertEquals(List.of(formed), response.calls());
        assertEquals(List.of(
                new UserInfo("alice", UserStatus.IN_CALL),
                new UserInfo("bob", UserStatus.IN_CALL)), response.users());
    }

    // ---------------------------------------------------------------------

    private CallInfo formCall(FakeConnection caller, String callerName, FakeConnection callee, String calleeName) {
        registry.join(caller, callerName);
        registry.join(callee, calleeName);
        registry.callRequest(caller, calleeName);
        registry.calleeResponse(callee, callerName, true);
        return registry.callOf(callerName).orElseThrow();
    }

    private static List<PypeMessage> messagesTo(List<Delivery> out, FakeConnection target) {
        return out.stream()
                .filter(d -> d.connection() == target)
                .map(Delivery::message)
                .collect(Collectors.toList());
    }

    private static List<CallUpdate> updates(List<Delivery> out, CallUpdate.Kind kind) {
        return out.stream()
                .map(Delivery::message)
                .filter(m -> m instanceof CallUpdate)
                .map(m -> (CallUpdate) m)
                .filter(u -> u.kind() == kind)
                .collect(Collectors.toList());
    }
}
