package com.questrail.pype.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * MediaChannel
 * -----------------------------------------------------------------------------
 * Blocking-style multicast socket owned by one media worker thread.
 *
 * <p>Unlike {@link Connection}, a media channel is not watched by the event
 * loop. Its owner polls {@link #receive(Duration)} with a short timeout so that
 * it notices when it should stop.</p>
 */
public interface MediaChannel extends AutoCloseable
{
    /**
     * Send one datagram to the channel's multicast group.
     */
    void send(byte[] payload);

    /**
     * Wait up to {@code timeout} for the next datagram.
     *
     * @return the datagram, or empty on timeout or after {@link #close()}
     */
    Optional<byte[]> receive(Duration timeout);

    @Override
    void close();
}
