package com.questrail.pype.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * CallInfo
 * -----------------------------------------------------------------------------
 * Published view of a registered call.
 *
 * <p>{@code masterHost} is the master's host as seen by the directory server. Peers
 * use it to reach the master's key-distribution listener and to address rate
 * feedback. {@code participants} is ordered by join time; the master is always
 * one of them.</p>
 */
public record CallInfo(
        String master,
        String masterHost,
        List<String> participants,
        MediaAddresses addresses
) {
    public CallInfo {
        Objects.requireNonNull(master, "master");
        Objects.requireNonNull(masterHost, "masterHost");
        Objects.requireNonNull(addresses, "addresses");
        participants = List.copyOf(Objects.requireNonNull(participants, "participants"));

        if (!participants.contains(master)) {
            throw new IllegalArgumentException("master " + master + " is not a participant");
        }
    }

    public boolean includes(String name) {
        return participants.contains(name);
    }
}
