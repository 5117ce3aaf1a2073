package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.protocol.model.UserUpdate;
import com.questrail.pype.transport.Connection;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CallRegistry
 * =============================================================================
 * Server-side directory of connected users and live calls.
 *
 * <h2>Ownership</h2>
 * The registry exclusively owns every {@link User} (keyed by name) and every
 * {@link Call} (keyed by its master's name). Cross references are keys, so a
 * master migration re-keys the call and rewrites each participant's key.
 *
 * <h2>Purity</h2>
 * Operations mutate registry state and return the messages that must go out as
 * a list of {@link Delivery}. The registry performs no I/O; the caller queues
 * the deliveries in order.
 *
 * <h2>Threading</h2>
 * Not thread-safe. The event loop is the sole mutator; it processes one inbound
 * event at a time.
 *
 * <h2>Failure semantics</h2>
 * Messages that reference an unknown connection, user, call or invitation are
 * ignored and produce no deliveries. Protocol rejections (duplicate name, busy
 * callee) are reported as status fields in the returned messages.
 */
public final class CallRegistry
{
    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Call> calls = new LinkedHashMap<>();
    private final ConnectionIndex connections = new ConnectionIndex();
    /** callee name -> caller name */
    private final Map<String, String> invitations = new HashMap<>();
    private final MulticastAddressPool addressPool;

    public CallRegistry(MulticastAddressPool addressPool)
    {
        this.addressPool = Objects.requireNonNull(addressPool, "addressPool");
    }

    // =========================================================================
    // Operations
    // =========================================================================

    /**
     * Registers {@code name} for {@code connection}.
     *
     * <p>Rejected if the name is taken or the connection already carries a user.
     * On success the joining user receives the directory as of this instant and
     * every other user receives a join notification.</p>
     */
    public List<Delivery> join(Connection connection, String name)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(name, "name");

        if (users.containsKey(name) || connections.contains(connection)) {
            return List.of(new Delivery(connection, JoinMessage.Response.rejected(name)));
        }

        List<Delivery> out = new ArrayList<>();
        out.add(new Delivery(connection, new JoinMessage.Response(
                JoinMessage.Status.OK, name, userInfos(), callInfos())));

        User user = new User(name, connection, hostOf(connection.remoteAddress()));
        broadcast(out, new UserUpdate(UserUpdate.Kind.JOIN, name, user.status()));

        users.put(name, user);
        connections.put(connection, name);
        return out;
    }

    /**
     * Removes the user bound to {@code connection}, then runs call-leave and
     * invitation cleanup for it.
     */
    public List<Delivery> disconnect(Connection connection)
    {
        String name = connections.removeConnection(connection);
        if (name == null) {
            return List.of();
        }
        User user = users.remove(name);

        List<Delivery> out = new ArrayList<>();
        broadcast(out, new UserUpdate(UserUpdate.Kind.LEAVE, name, UserStatus.AVAILABLE));

        if (user.inCall()) {
            leaveCall(user, out);
        }
        dropInvitations(name, out);
        return out;
    }

    /**
     * Invites {@code callee} on behalf of the user bound to {@code connection}.
     *
     * <p>Both parties are marked in-call and the callee is asked to participate.
     * No call exists until the callee accepts. A callee that is already in a call
     * or has an outstanding invitation is busy, and so is a caller that is itself
     * still answering an invitation; either way the caller gets a rejection.</p>
     */
    public List<Delivery> callRequest(Connection connection, String callee)
    {
        User caller = userOf(connection);
        User target = users.get(callee);
        if (caller == null || target == null || caller == target) {
            return List.of();
        }

        List<Delivery> out = new ArrayList<>();
        if (target.status() == UserStatus.IN_CALL
                || invitations.containsKey(callee)
                || invitations.containsKey(caller.name())) {
            out.add(new Delivery(caller.connection(),
                    new CallMessage.CalleeResponse(caller.name(), callee, false)));
            return out;
        }

        setStatus(caller, UserStatus.IN_CALL, out);
        setStatus(target, UserStatus.IN_CALL, out);
        invitations.put(callee, caller.name());
        out.add(new Delivery(target.connection(), new CallMessage.Participate(caller.name())));
        return out;
    }

    /**
     * Applies the answer of the user bound to {@code connection} to the
     * invitation from {@code callerName}.
     *
     * <p>On accept, if either party is already in a call the other one joins it;
     * otherwise a new call is created with the caller as master and three fresh
     * multicast addresses. The change is broadcast to the whole directory.
     * An accept between members of two different calls is treated as a reject,
     * since a user belongs to at most one call.
     * On reject, whichever party is not in a call reverts to available and the
     * caller is told.</p>
     */
    public List<Delivery> calleeResponse(Connection connection, String callerName, boolean accepted)
    {
        User callee = userOf(connection);
        if (callee == null || !Objects.equals(invitations.get(callee.name()), callerName)) {
            return List.of();
        }
        invitations.remove(callee.name());

        List<Delivery> out = new ArrayList<>();
        User caller = users.get(callerName);
        if (caller == null) {
            if (!callee.inCall()) {
                setStatus(callee, UserStatus.AVAILABLE, out);
            }
            return out;
        }

        boolean inDifferentCalls = caller.inCall() && callee.inCall()
                && !caller.callKey().equals(callee.callKey());
        if (!accepted || inDifferentCalls) {
            if (!caller.inCall()) {
                setStatus(caller, UserStatus.AVAILABLE, out);
            }
            if (!callee.inCall()) {
                setStatus(callee, UserStatus.AVAILABLE, out);
            }
            out.add(new Delivery(caller.connection(),
                    new CallMessage.CalleeResponse(caller.name(), callee.name(), false)));
            return out;
        }

        if (caller.inCall()) {
            joinCall(calls.get(caller.callKey()), callee, out);
        } else if (callee.inCall()) {
            joinCall(calls.get(callee.callKey()), caller, out);
        } else {
            Call call = new Call(caller.name(), addressPool.allocate());
            call.add(callee.name());
            calls.put(call.master(), call);
            caller.callKey(call.master());
            callee.callKey(call.master());
            broadcast(out, new CallUpdate(CallUpdate.Kind.CALL_ADD, call.master(), callee.name(), toInfo(call)));
        }
        return out;
    }

    /**
     * Removes the user bound to {@code connection} from its call.
     */
    public List<Delivery> leave(Connection connection)
    {
        User user = userOf(connection);
        if (user == null || !user.inCall()) {
            return List.of();
        }
        List<Delivery> out = new ArrayList<>();
        leaveCall(user, out);
        return out;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public int userCount()
    {
        return users.size();
    }

    public Optional<UserInfo> user(String name)
    {
        return Optional.ofNullable(users.get(name)).map(User::toInfo);
    }

    public Optional<String> userNameOf(Connection connection)
    {
        return Optional.ofNullable(connections.nameOf(connection));
    }

    /**
     * The call {@code name} participates in, if any.
     */
    public Optional<CallInfo> callOf(String name)
    {
        User user = users.get(name);
        if (user == null || !user.inCall()) {
            return Optional.empty();
        }
        return Optional.of(toInfo(calls.get(user.callKey())));
    }

    public List<CallInfo> activeCalls()
    {
        return Collections.unmodifiableList(callInfos());
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private void joinCall(Call call, User joiner, List<Delivery> out)
    {
        call.add(joiner.name());
        joiner.callKey(call.master());
        broadcast(out, new CallUpdate(CallUpdate.Kind.USER_JOIN, call.master(), joiner.name(), toInfo(call)));
    }

    private void leaveCall(User user, List<Delivery> out)
    {
        String oldKey = user.callKey();
        Call call = calls.get(oldKey);
        user.callKey(null);
        if (users.containsKey(user.name())) {
            setStatus(user, UserStatus.AVAILABLE, out);
        }
        if (call == null) {
            return;
        }

        boolean migrated = call.remove(user.name());

        if (call.size() <= 1) {
            calls.remove(oldKey);
            addressPool.release(call.addresses());
            for (String remaining : call.participants()) {
                User last = users.get(remaining);
                if (last != null) {
                    last.callKey(null);
                    setStatus(last, UserStatus.AVAILABLE, out);
                }
            }
            broadcast(out, new CallUpdate(CallUpdate.Kind.CALL_REMOVE, oldKey, user.name(), toInfo(call)));
            return;
        }

        if (migrated) {
            calls.remove(oldKey);
            calls.put(call.master(), call);
            for (String participant : call.participants()) {
                User p = users.get(participant);
                if (p != null) {
                    p.callKey(call.master());
                }
            }
        }
        broadcast(out, new CallUpdate(CallUpdate.Kind.USER_LEAVE, oldKey, user.name(), toInfo(call)));
    }

    /**
     * Clears invitations that involve {@code name}, reverting the other side
     * when it is not in a call.
     */
    private void dropInvitations(String name, List<Delivery> out)
    {
        String caller = invitations.remove(name);
        if (caller != null) {
            User c = users.get(caller);
            if (c != null) {
                if (!c.inCall()) {
                    setStatus(c, UserStatus.AVAILABLE, out);
                }
                out.add(new Delivery(c.connection(), new CallMessage.CalleeResponse(caller, name, false)));
            }
        }

        List<String> orphaned = new ArrayList<>();
        for (Map.Entry<String, String> e : invitations.entrySet()) {
            if (e.getValue().equals(name)) {
                orphaned.add(e.getKey());
            }
        }
        for (String callee : orphaned) {
            invitations.remove(callee);
            User c = users.get(callee);
            if (c != null && !c.inCall()) {
                setStatus(c, UserStatus.AVAILABLE, out);
            }
        }
    }

    private void setStatus(User user, UserStatus status, List<Delivery> out)
    {
        if (user.status() == status) {
            return;
        }
        user.status(status);
        broadcast(out, new UserUpdate(UserUpdate.Kind.STATUS, user.name(), status));
    }

    private void broadcast(List<Delivery> out, PypeMessage message)
    {
        for (User u : users.values()) {
            out.add(new Delivery(u.connection(), message));
        }
    }

    private User userOf(Connection connection)
    {
        String name = connections.nameOf(connection);
        return name == null ? null : users.get(name);
    }

    private CallInfo toInfo(Call call)
    {
        User master = users.get(call.master());
        String host = master == null ? "" : master.host();
        return new CallInfo(call.master(), host, call.participants(), call.addresses());
    }

    private List<UserInfo> userInfos()
    {
        List<UserInfo> infos = new ArrayList<>(users.size());
        for (User u : users.values()) {
            infos.add(u.toInfo());
        }
        return infos;
    }

    private List<CallInfo> callInfos()
    {
        List<CallInfo> infos = new ArrayList<>(calls.size());
        for (Call c : calls.values()) {
            infos.add(toInfo(c));
        }
        return infos;
    }

    static String hostOf(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString();
        }
        return "";
    }
}
