package com.questrail.pype.transport;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Handle for a stream listener opened by {@link PypeTransport#listenStream}.
 */
public interface ListenerHandle
{
    /**
     * Bound local address, or {@code null} while the bind is still in progress.
     */
    InetSocketAddress localAddress();

    /**
     * Block until the listener is bound. Must not be called on the event loop thread.
     *
     * @throws TransportException if the bind failed or did not finish in time
     */
    InetSocketAddress awaitBound(Duration timeout);

    /**
     * Stop accepting connections. Already accepted connections stay open.
     */
    void close();
}
