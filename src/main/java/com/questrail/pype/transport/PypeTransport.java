package com.questrail.pype.transport;

import com.questrail.pype.time.MonotonicScheduler;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * PypeTransport
 * =============================================================================
 * Factory for every socket a pype process opens, plus the scheduler of the
 * process's event loop.
 *
 * <h2>Binding invariant</h2>
 * Callbacks for every {@link Connection} created here, and every task run by
 * {@link #scheduler()}, execute on one and the same thread. Handlers above this
 * port rely on that to mutate registry and session state without locks.
 *
 * <h2>Non-blocking</h2>
 * Every factory method returns immediately. Binds and connects complete in the
 * background and are reported through {@link ConnectionListener#onConnected} or
 * {@link ConnectionListener#onDisconnected}; until then the returned connection
 * reports {@link Connection#isWritable()} as {@code false} and queued tasks wait.
 */
public interface PypeTransport extends AutoCloseable
{
    /**
     * Listen for stream connections. Each accepted connection is reported to
     * {@code listener} and carries concatenated JSON objects.
     */
    ListenerHandle listenStream(InetSocketAddress bindAddress, ConnectionListener listener);

    /**
     * Open an outbound stream connection.
     */
    Connection connectStream(InetSocketAddress remote, ConnectionListener listener);

    /**
     * Bind a unicast datagram endpoint. Port 0 selects an ephemeral port.
     */
    Connection openDatagram(InetSocketAddress bindAddress, ConnectionListener listener);

    /**
     * Bind {@code port} with address reuse and join {@code group}. The returned
     * connection's default target is {@code (group, port)}.
     */
    Connection openMulticast(InetAddress group, int port, ConnectionListener listener);

    /**
     * Open a worker-owned multicast channel on {@code (group, port)}.
     *
     * @param queueDepth datagrams buffered before the oldest pending one is dropped
     */
    MediaChannel openMediaChannel(InetAddress group, int port, int queueDepth);

    /**
     * Scheduler whose tasks run on the event loop thread.
     */
    MonotonicScheduler scheduler();

    /**
     * Close every socket and stop the event loop.
     */
    @Override
    void close();
}
