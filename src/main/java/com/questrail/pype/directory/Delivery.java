package com.questrail.pype.directory;

import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.transport.Connection;

import java.util.Objects;

/**
 * One outbound message produced by a registry operation. The registry never
 * performs I/O; its caller queues deliveries.
 */
public record Delivery(Connection connection, PypeMessage message) {
    public Delivery {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");
    }
}
