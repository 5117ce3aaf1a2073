package com.questrail.pype.transport;

import com.questrail.pype.time.MonotonicScheduler;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FakePypeTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link PypeTransport}. Every socket it opens is a fake that the test
 * can inspect; nothing touches the network and nothing completes on its own.
 */
public final class FakePypeTransport implements PypeTransport {

    public record Opened(String kind, InetSocketAddress address, Connection connection, ConnectionListener listener) {}

    public static final class FakeListenerHandle implements ListenerHandle {
        private final InetSocketAddress address;
        private boolean closed;

        FakeListenerHandle(InetSocketAddress address) {
            this.address = address;
        }

        @Override
        public InetSocketAddress localAddress() {
            return address;
        }

        @Override
        public InetSocketAddress awaitBound(Duration timeout) {
            return address;
        }

        @Override
        public void close() {
            closed = true;
        }

        public boolean isClosed() {
            return closed;
        }
    }

    private final MonotonicScheduler scheduler;
    private final List<Opened> opened = new ArrayList<>();
    private final List<FakeListenerHandle> listeners = new ArrayList<>();
    private final List<FakeMediaChannel> mediaChannels = new ArrayList<>();
    private boolean closed;
    private int ids;

    public FakePypeTransport(MonotonicScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public ListenerHandle listenStream(InetSocketAddress bindAddress, ConnectionListener listener) {
        FakeListenerHandle handle = new FakeListenerHandle(bindAddress);
        listeners.add(handle);
        return handle;
    }

    @Override
    public Connection connectStream(InetSocketAddress remote, ConnectionListener listener) {
        return record("stream", remote, new FakeConnection("stream-" + (++ids), remote), listener);
    }

    @Override
    public Connection openDatagram(InetSocketAddress bindAddress, ConnectionListener listener) {
        return record("datagram", bindAddress, new FakeConnection("datagram-" + (++ids), null), listener);
    }

    @Override
    public Connection openMulticast(InetAddress group, int port, ConnectionListener listener) {
        InetSocketAddress target = new InetSocketAddress(group, port);
        return record("multicast", target, new FakeConnection("multicast-" + (++ids), target), listener);
    }

    @Override
    public MediaChannel openMediaChannel(InetAddress group, int port, int queueDepth) {
        FakeMediaChannel channel = new FakeMediaChannel();
        mediaChannels.add(channel);
        return channel;
    }

    @Override
    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        closed = true;
    }

    private Connection record(String kind, InetSocketAddress address, FakeConnection connection, ConnectionListener listener) {
        opened.add(new Opened(kind, address, connection, listener));
        return connection;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public List<Opened> opened() {
        return List.copyOf(opened);
    }

    public List<Opened> opened(String kind) {
        List<Opened> out = new ArrayList<>();
        for (Opened o : opened) {
            if (o.kind().equals(kind)) {
                out.add(o);
            }
        }
        return out;
    }

    public List<FakeListenerHandle> listeners() {
        return List.copyOf(listeners);
    }

    public List<FakeMediaChannel> mediaChannels() {
        return List.copyOf(mediaChannels);
    }

    public boolean isClosed() {
        return closed;
    }
}
