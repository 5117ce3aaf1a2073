package com.questrail.pype.server;

import com.questrail.pype.directory.CallRegistry;
import com.questrail.pype.directory.Delivery;
import com.questrail.pype.loop.MessageDispatcher;
import com.questrail.pype.loop.Outbox;
import com.questrail.pype.observability.NullObservabilitySink;
import com.questrail.pype.observability.PypeObservabilitySink;
import com.questrail.pype.observability.PypeProtocolEvent;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.time.WallClock;
import com.questrail.pype.transport.Connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;

/**
 * DirectoryDispatcher
 * -----------------------------------------------------------------------------
 * Server-side protocol handler: routes decoded client messages to the
 * {@link CallRegistry} and queues the registry's deliveries on the
 * {@link Outbox}, in order.
 *
 * <p>Anything a client should never send the server (responses, updates,
 * session content) is ignored. A closed control connection is a disconnect of
 * the user bound to it.</p>
 */
public final class DirectoryDispatcher implements MessageDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(DirectoryDispatcher.class);

    private final CallRegistry registry;
    private final Outbox outbox;
    private final WallClock wallClock;
    private final PypeObservabilitySink observabilitySink;

    public DirectoryDispatcher(CallRegistry registry,
                               Outbox outbox,
                               WallClock wallClock,
                               PypeObservabilitySink observabilitySink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void dispatch(Connection source, SocketAddress sender, PypeMessage message)
    {
        if (message instanceof JoinMessage.Request request) {
            List<Delivery> out = registry.join(source, request.name());
            report(request.name(), joined(out, source) ? "joined" : "join rejected (name taken)");
            deliver(out);
        } else if (message instanceof CallMessage.Request request) {
            deliver(registry.callRequest(source, request.callee()));
        } else if (message instanceof CallMessage.CalleeResponse response) {
            deliver(registry.calleeResponse(source, response.caller(), response.accepted()));
        } else if (message instanceof SessionMessage.Leave) {
            registry.userNameOf(source).ifPresent(name -> report(name, "left call"));
            deliver(registry.leave(source));
        } else {
            log.debug("Ignoring {} from {}", message.getClass().getSimpleName(), source.id());
        }
    }

    @Override
    public void onDisconnected(Connection connection, Throwable cause)
    {
        registry.userNameOf(connection).ifPresent(name -> report(name, "disconnected"));
        deliver(registry.disconnect(connection));
    }

    // ---------------------------------------------------------------------

    private void deliver(List<Delivery> deliveries)
    {
        for (Delivery d : deliveries) {
            outbox.send(d.connection(), d.message());
        }
    }

    private static boolean joined(List<Delivery> deliveries, Connection source)
    {
        for (Delivery d : deliveries) {
            if (d.connection() == source && d.message() instanceof JoinMessage.Response response) {
                return response.accepted();
            }
        }
        return false;
    }

    private void report(String subject, String description)
    {
        observabilitySink.onProtocolEvent(new PypeProtocolEvent(
                wallClock.now(), PypeProtocolEvent.Category.DIRECTORY, subject, description));
    }
}
