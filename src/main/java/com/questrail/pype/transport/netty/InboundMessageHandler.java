package com.questrail.pype.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;

/**
 * InboundMessageHandler
 * -------------------------------------------------------------------------
 * Last inbound handler of every pype pipeline. Copies each complete message
 * object into a plain {@code byte[]} and forwards it to the connection's
 * listener. Reference-counted buffers are released by the superclass.
 */
final class InboundMessageHandler extends SimpleChannelInboundHandler<Object>
{
    private final NettyConnection connection;

    InboundMessageHandler(NettyConnection connection)
    {
        this.connection = connection;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        connection.listener().onConnected(connection);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg)
    {
        if (msg instanceof DatagramPacket packet) {
            connection.listener().onMessage(connection, packet.sender(), copy(packet.content()));
        } else if (msg instanceof ByteBuf buf) {
            connection.listener().onMessage(connection, ctx.channel().remoteAddress(), copy(buf));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        connection.reportDisconnected(null);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        connection.reportDisconnected(cause);
        ctx.close();
    }

    private static byte[] copy(ByteBuf content)
    {
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        return bytes;
    }
}
