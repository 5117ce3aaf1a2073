package com.questrail.pype.loop;

import com.questrail.pype.transport.Connection;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * A queued outbound message: destination plus serialized payload.
 *
 * <p>{@code address} is {@code null} for stream destinations and for datagram
 * destinations that use the connection's default target. {@code attempts}
 * counts failed sends.</p>
 */
public record Task(
        Connection destination,
        SocketAddress address,
        byte[] payload,
        long enqueuedAtNanos,
        int attempts
) {
    public Task {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(payload, "payload");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    /**
     * Copy of this task with one more failed attempt recorded.
     */
    Task failedOnce() {
        return new Task(destination, address, payload, enqueuedAtNanos, attempts + 1);
    }

    void sendNow() {
        if (address == null) {
            destination.send(payload);
        } else {
            destination.sendTo(address, payload);
        }
    }
}
