package com.questrail.pype.transport;

import java.net.SocketAddress;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * Framework-neutral handle for one watched endpoint of the event loop: an
 * accepted or outbound stream connection, the local ingress datagram endpoint,
 * or a multicast socket.
 *
 * <p>Higher layers never write to a connection directly. Outbound bytes are
 * queued as tasks and sent only when {@link #isWritable()} reports readiness.</p>
 *
 * <p>Implementations may be backed by Netty or by a test fake.</p>
 */
public interface Connection
{
    /**
     * Stable identifier, for logs and diagnostics.
     */
    String id();

    /**
     * {@code true} until the connection has been closed by either side.
     */
    boolean isOpen();

    /**
     * {@code true} if a send issued now would be accepted without blocking.
     */
    boolean isWritable();

    /**
     * Remote peer of a stream connection, or the default target of a datagram
     * connection. May be {@code null} for an unconnected datagram endpoint.
     */
    SocketAddress remoteAddress();

    /**
     * Bound local address, or {@code null} while the bind or connect is in progress.
     */
    SocketAddress localAddress();

    /**
     * Send to the connection's remote peer (stream) or default target (datagram).
     *
     * @throws TransportException if the connection cannot accept the payload
     */
    void send(byte[] payload);

    /**
     * Send one datagram to an explicit address.
     *
     * @throws TransportException if this is a stream connection or the send fails
     */
    void sendTo(SocketAddress remote, byte[] payload);

    /**
     * Close the connection. Idempotent.
     */
    void close();
}
