package com.questrail.pype.loop;

import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.transport.Connection;

import java.net.SocketAddress;

/**
 * Outbound surface handed to dispatchers: messages are encoded and queued as
 * tasks, never written directly.
 */
public interface Outbox
{
    void send(Connection destination, PypeMessage message);

    void sendTo(Connection destination, SocketAddress address, PypeMessage message);
}
