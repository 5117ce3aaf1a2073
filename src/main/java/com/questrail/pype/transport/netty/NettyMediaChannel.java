package com.questrail.pype.transport.netty;

import com.questrail.pype.transport.MediaChannel;
import com.questrail.pype.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyMediaChannel
 * =============================================================================
 * Worker-owned multicast channel. The bind completes in the background; sends
 * fail with {@link TransportException} until it has. Datagrams are read on the event loop and
 * handed to the owning worker through a bounded queue; when the worker falls
 * behind, the oldest pending datagram is discarded. Media delivery is lossy by
 * nature and the statistics tracker accounts for the gap.
 */
final class NettyMediaChannel implements MediaChannel
{
    private final InetSocketAddress target;
    private final BlockingQueue<byte[]> inbound;

    private volatile Channel channel;
    private volatile boolean closed;

    NettyMediaChannel(InetSocketAddress target, int queueDepth)
    {
        this.target = Objects.requireNonNull(target, "target");
        if (queueDepth <= 0) {
            throw new IllegalArgumentException("queueDepth must be > 0");
        }
        this.inbound = new ArrayBlockingQueue<>(queueDepth);
    }

    void attach(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        if (closed) {
            channel.close();
        }
    }

    SimpleChannelInboundHandler<DatagramPacket> inboundHandler()
    {
        return new SimpleChannelInboundHandler<>() {
            @Override
            protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
            {
                ByteBuf content = packet.content();
                byte[] bytes = new byte[content.readableBytes()];
                content.getBytes(content.readerIndex(), bytes);

                while (!inbound.offer(bytes)) {
                    inbound.poll();
                }
            }
        };
    }

    @Override
    public void send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        Channel ch = channel;
        if (closed || ch == null || !ch.isActive()) {
            throw new TransportException("Media channel " + target + " is not active");
        }
        ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), target));
    }

    @Override
    public Optional<byte[]> receive(Duration timeout)
    {
        if (closed) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void close()
    {
        closed = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        inbound.clear();
    }
}
