package com.questrail.pype.loop;

import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.transport.Connection;

import java.net.SocketAddress;

/**
 * MessageDispatcher
 * -----------------------------------------------------------------------------
 * Protocol side of the event loop: receives decoded messages and connection
 * lifecycle changes, one at a time, on the loop thread.
 *
 * <p>The server installs a dispatcher that feeds the call registry; a peer
 * installs one that drives its directory view and call session.</p>
 */
public interface MessageDispatcher
{
    /**
     * A decoded message arrived on {@code source}.
     */
    void dispatch(Connection source, SocketAddress sender, PypeMessage message);

    default void onConnected(Connection connection) {
    }

    /**
     * {@code connection} closed or failed; {@code cause} is {@code null} for an orderly close.
     */
    void onDisconnected(Connection connection, Throwable cause);

    /**
     * Periodic housekeeping, called once per loop tick.
     */
    default void onTick() {
    }
}
