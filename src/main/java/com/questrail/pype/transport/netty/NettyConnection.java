package com.questrail.pype.transport.netty;

import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.ConnectionListener;
import com.questrail.pype.transport.TransportException;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.socket.DatagramPacket;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty-backed {@link Connection}.
 *
 * <p>The underlying {@link Channel} is attached once the bind or connect completes;
 * until then the connection is open but not writable.</p>
 */
final class NettyConnection implements Connection
{
    private final String id;
    private final boolean datagram;
    private final SocketAddress defaultTarget;
    private final ConnectionListener listener;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean disconnectReported = new AtomicBoolean(false);

    private volatile Channel channel;

    NettyConnection(String id, boolean datagram, SocketAddress defaultTarget, ConnectionListener listener)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.datagram = datagram;
        this.defaultTarget = defaultTarget;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    void attach(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    ConnectionListener listener()
    {
        return listener;
    }

    /**
     * Reports the disconnect to the listener exactly once.
     */
    void reportDisconnected(Throwable cause)
    {
        closed.set(true);
        if (disconnectReported.compareAndSet(false, true)) {
            listener.onDisconnected(this, cause);
        }
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public boolean isOpen()
    {
        if (closed.get()) {
            return false;
        }
        Channel ch = channel;
        return ch == null || ch.isOpen();
    }

    @Override
    public boolean isWritable()
    {
        Channel ch = channel;
        return !closed.get() && ch != null && ch.isActive() && ch.isWritable();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        if (datagram) {
            return defaultTarget;
        }
        Channel ch = channel;
        SocketAddress remote = ch == null ? null : ch.remoteAddress();
        return remote != null ? remote : defaultTarget;
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null || !ch.isActive() ? null : ch.localAddress();
    }

    @Override
    public void send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (datagram) {
            if (defaultTarget == null) {
                throw new TransportException(id + " has no default datagram target");
            }
            sendTo(defaultTarget, payload);
            return;
        }
        requireChannel().writeAndFlush(Unpooled.wrappedBuffer(payload));
    }

    @Override
    public void sendTo(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (!datagram) {
            throw new TransportException(id + " is a stream connection; explicit addressing is not supported");
        }
        requireChannel().writeAndFlush(
                new DatagramPacket(Unpooled.wrappedBuffer(payload), (InetSocketAddress) remote));
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            Channel ch = channel;
            if (ch != null) {
                ch.close();
            }
        }
    }

    private Channel requireChannel()
    {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new TransportException(id + " is not active");
        }
        return ch;
    }

    @Override
    public String toString()
    {
        return id;
    }
}
