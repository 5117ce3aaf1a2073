package com.questrail.pype.transport;

import java.net.SocketAddress;

/**
 * ConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for every {@link Connection} watched by one event loop.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner on the
 * owning loop's thread. The Netty transport serializes them on its single
 * event loop.</p>
 */
public interface ConnectionListener
{
    /**
     * A stream connection became active (accepted by a listener, or an outbound
     * connect completed), or a datagram endpoint was bound.
     */
    void onConnected(Connection connection);

    /**
     * One complete message object arrived.
     *
     * <p>For stream connections the transport has already split the byte stream
     * into whole JSON objects; any incomplete remainder stays buffered. For
     * datagram connections the payload is one whole datagram.</p>
     *
     * @param connection connection the message arrived on
     * @param sender     remote sender; for stream connections the peer address
     * @param payload    raw bytes of one message object
     */
    void onMessage(Connection connection, SocketAddress sender, byte[] payload);

    /**
     * The connection closed or failed. Delivered at most once per connection.
     *
     * @param cause failure cause, or {@code null} for an orderly close
     */
    void onDisconnected(Connection connection, Throwable cause);
}
