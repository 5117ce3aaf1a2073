package com.questrail.pype.transport.netty;

import com.questrail.pype.time.MonotonicClock;
import com.questrail.pype.time.MonotonicScheduler;
import com.questrail.pype.time.SystemMonotonicClock;
import com.questrail.pype.transport.Connection;
import com.questrail.pype.transport.ConnectionListener;
import com.questrail.pype.transport.ListenerHandle;
import com.questrail.pype.transport.MediaChannel;
import com.questrail.pype.transport.PypeTransport;
import com.questrail.pype.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.json.JsonObjectDecoder;
import io.netty.util.NetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyPypeTransport
 * =============================================================================
 * Netty-backed implementation of the {@link PypeTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * pype messages, interpret protocol semantics or invent outbound traffic.
 *
 * <h2>Readiness multiplexing</h2>
 * All channels are registered with one single-threaded {@link NioEventLoopGroup}.
 * Its selector is the process's readiness wait: every readable connection is
 * drained on that thread, callbacks are serialized there, and scheduled ticks
 * run there too.
 *
 * <h2>Stream framing</h2>
 * Stream connections carry concatenated JSON objects. A {@link JsonObjectDecoder}
 * extracts one complete object at a time and keeps any partial remainder
 * buffered for the next read.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 */
public final class NettyPypeTransport implements PypeTransport
{
    /** Upper bound for one JSON object on a stream connection. */
    static final int MAX_OBJECT_LENGTH = 1 << 20;

    private static final Logger log = LoggerFactory.getLogger(NettyPypeTransport.class);

    private final EventLoopGroup loopGroup;
    private final NettyLoopScheduler scheduler;
    private final NetworkInterface multicastInterface;
    private final AtomicLong ids = new AtomicLong();

    public NettyPypeTransport()
    {
        this(SystemMonotonicClock.INSTANCE, null);
    }

    /**
     * @param clock                  clock used to convert scheduler deadlines into delays
     * @param multicastInterfaceName interface for multicast membership, or {@code null}
     *                               to pick the first multicast-capable interface
     */
    public NettyPypeTransport(MonotonicClock clock, String multicastInterfaceName)
    {
        Objects.requireNonNull(clock, "clock");
        this.loopGroup = new NioEventLoopGroup(1);
        this.scheduler = new NettyLoopScheduler(loopGroup.next(), clock);
        this.multicastInterface = selectInterface(multicastInterfaceName);
    }

    @Override
    public ListenerHandle listenStream(InetSocketAddress bindAddress, ConnectionListener listener)
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(listener, "listener");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(loopGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyConnection connection = new NettyConnection(
                                nextId("stream-in"), false, null, listener);
                        connection.attach(ch);
                        ch.pipeline().addLast(
                                new JsonObjectDecoder(MAX_OBJECT_LENGTH),
                                new InboundMessageHandler(connection));
                    }
                });

        return new NettyListenerHandle(bootstrap.bind(bindAddress));
    }

    @Override
    public Connection connectStream(InetSocketAddress remote, ConnectionListener listener)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(listener, "listener");

        NettyConnection connection = new NettyConnection(nextId("stream-out"), false, remote, listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(loopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(
                                new JsonObjectDecoder(MAX_OBJECT_LENGTH),
                                new InboundMessageHandler(connection));
                    }
                });

        ChannelFuture f = bootstrap.connect(remote);
        connection.attach(f.channel());
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                connection.reportDisconnected(future.cause());
            }
        });
        return connection;
    }

    @Override
    public Connection openDatagram(InetSocketAddress bindAddress, ConnectionListener listener)
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(listener, "listener");

        NettyConnection connection = new NettyConnection(nextId("datagram"), true, null, listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(loopGroup)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundMessageHandler(connection));
                    }
                });

        bindDatagram(bootstrap, bindAddress, connection);
        return connection;
    }

    @Override
    public Connection openMulticast(InetAddress group, int port, ConnectionListener listener)
    {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(listener, "listener");

        InetSocketAddress target = new InetSocketAddress(group, port);
        NettyConnection connection = new NettyConnection(nextId("multicast"), true, target, listener);

        Bootstrap bootstrap = multicastBootstrap()
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundMessageHandler(connection));
                    }
                });

        ChannelFuture f = bootstrap.bind(port);
        connection.attach(f.channel());
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                joinGroup(future.channel(), target);
            } else {
                connection.reportDisconnected(future.cause());
            }
        });
        return connection;
    }

    @Override
    public MediaChannel openMediaChannel(InetAddress group, int port, int queueDepth)
    {
        Objects.requireNonNull(group, "group");

        InetSocketAddress target = new InetSocketAddress(group, port);
        NettyMediaChannel channel = new NettyMediaChannel(target, queueDepth);

        Bootstrap bootstrap = multicastBootstrap()
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(channel.inboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.bind(port);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel.attach(future.channel());
                joinGroup(future.channel(), target);
            } else {
                log.error("Failed to bind media channel {}", target, future.cause());
                channel.close();
            }
        });
        return channel;
    }

    @Override
    public MonotonicScheduler scheduler()
    {
        return scheduler;
    }

    @Override
    public void close()
    {
        loopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    // ---------------------------------------------------------------------

    private Bootstrap multicastBootstrap()
    {
        return new Bootstrap()
                .group(loopGroup)
                .channelFactory((ChannelFactory<NioDatagramChannel>) () ->
                        new NioDatagramChannel(InternetProtocolFamily.IPv4))
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.IP_MULTICAST_IF, multicastInterface);
    }

    private void bindDatagram(Bootstrap bootstrap, InetSocketAddress bindAddress, NettyConnection connection)
    {
        ChannelFuture f = bootstrap.bind(bindAddress);
        connection.attach(f.channel());
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                connection.reportDisconnected(future.cause());
            }
        });
    }

    private void joinGroup(Channel channel, InetSocketAddress target)
    {
        ((DatagramChannel) channel).joinGroup(target, multicastInterface)
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        future.channel().pipeline().fireExceptionCaught(
                                new TransportException("Failed to join " + target, future.cause()));
                    }
                });
    }

    private String nextId(String kind)
    {
        return kind + "-" + ids.incrementAndGet();
    }

    static NetworkInterface selectInterface(String name)
    {
        try {
            if (name != null) {
                NetworkInterface named = NetworkInterface.getByName(name);
                if (named == null) {
                    throw new TransportException("No such network interface: " + name);
                }
                return named;
            }
            for (NetworkInterface candidate : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (candidate.isUp() && candidate.supportsMulticast() && !candidate.isLoopback()) {
                    return candidate;
                }
            }
        } catch (SocketException e) {
            throw new TransportException("Failed to enumerate network interfaces", e);
        }
        return NetUtil.LOOPBACK_IF;
    }
}
