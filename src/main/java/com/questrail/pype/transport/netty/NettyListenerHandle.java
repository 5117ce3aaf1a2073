package com.questrail.pype.transport.netty;

import com.questrail.pype.transport.ListenerHandle;
import com.questrail.pype.transport.TransportException;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

final class NettyListenerHandle implements ListenerHandle
{
    private final ChannelFuture bindFuture;

    NettyListenerHandle(ChannelFuture bindFuture)
    {
        this.bindFuture = Objects.requireNonNull(bindFuture, "bindFuture");
    }

    @Override
    public InetSocketAddress localAddress()
    {
        if (!bindFuture.isDone() || !bindFuture.isSuccess()) {
            return null;
        }
        return (InetSocketAddress) bindFuture.channel().localAddress();
    }

    @Override
    public InetSocketAddress awaitBound(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        boolean done = bindFuture.awaitUninterruptibly(timeout.toMillis());
        if (!done) {
            throw new TransportException("Listener bind did not complete within " + timeout);
        }
        if (!bindFuture.isSuccess()) {
            throw new TransportException("Listener bind failed", bindFuture.cause());
        }
        return (InetSocketAddress) bindFuture.channel().localAddress();
    }

    @Override
    public void close()
    {
        Channel ch = bindFuture.channel();
        ch.close();
    }
}
