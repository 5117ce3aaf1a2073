package com.questrail.pype.peer;

import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserUpdate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A peer's copy of the directory: every other registered user and every live
 * call, rebuilt from the join snapshot and kept current from broadcasts.
 *
 * <p>Loop thread only.</p>
 */
public final class DirectoryView
{
    private final Map<String, UserInfo> users = new LinkedHashMap<>();
    private final Map<String, CallInfo> calls = new LinkedHashMap<>();
    private String self;

    void reset(String self, List<UserInfo> snapshotUsers, List<CallInfo> snapshotCalls)
    {
        this.self = Objects.requireNonNull(self, "self");
        users.clear();
        calls.clear();
        for (UserInfo u : snapshotUsers) {
            if (!u.name().equals(self)) {
                users.put(u.name(), u);
            }
        }
        for (CallInfo c : snapshotCalls) {
            calls.put(c.master(), c);
        }
    }

    void clear()
    {
        self = null;
        users.clear();
        calls.clear();
    }

    /**
     * @return {@code true} if the visible user roster changed
     */
    boolean apply(UserUpdate update)
    {
        if (update.name().equals(self)) {
            return false;
        }
        switch (update.kind()) {
            case JOIN:
            case STATUS:
                users.put(update.name(), new UserInfo(update.name(), update.status()));
                return true;
            case LEAVE:
                return users.remove(update.name()) != null;
            default:
                throw new IllegalArgumentException("Unhandled user update: " + update.kind());
        }
    }

    void apply(CallUpdate update)
    {
        calls.remove(update.callKey());
        if (update.kind() != CallUpdate.Kind.CALL_REMOVE) {
            calls.put(update.info().master(), update.info());
        }
    }

    public List<UserInfo> users()
    {
        return List.copyOf(users.values());
    }

    public List<CallInfo> calls()
    {
        return List.copyOf(calls.values());
    }
}
