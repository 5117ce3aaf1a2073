package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.MediaAddresses;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registry-owned record of a live call. Participants are kept in join order,
 * which decides the successor when the master leaves.
 */
final class Call
{
    private String master;
    private final List<String> participants = new ArrayList<>();
    private final MediaAddresses addresses;

    Call(String master, MediaAddresses addresses)
    {
        this.master = Objects.requireNonNull(master, "master");
        this.addresses = Objects.requireNonNull(addresses, "addresses");
        participants.add(master);
    }

    String master()
    {
        return master;
    }

    List<String> participants()
    {
        return List.copyOf(participants);
    }

    MediaAddresses addresses()
    {
        return addresses;
    }

    int size()
    {
        return participants.size();
    }

    void add(String name)
    {
        if (!participants.contains(name)) {
            participants.add(name);
        }
    }

    /**
     * Removes {@code name}; if it was the master, the earliest-joined remaining
     * participant takes over.
     *
     * @return {@code true} if the master changed
     */
    boolean remove(String name)
    {
        participants.remove(name);
        if (name.equals(master) && !participants.isEmpty()) {
            master = participants.get(0);
            return true;
        }
        return false;
    }
}
