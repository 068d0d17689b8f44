package com.questrail.coverage.transport.udp.netty;

import com.questrail.coverage.transport.DatagramEndpoint;
import com.questrail.coverage.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural role</h2>
 * This class is a pure transport adapter. It does not parse ping replies, match
 * sequence numbers or arm timeouts.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]}; the
 * reference-counted buffers are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Receive path</h2>
 * The channel has exactly one inbound handler, so there is never more than one
 * outstanding receive per endpoint no matter how many pings are in flight.
 * Closing the channel resolves the receive path with
 * {@link DatagramEndpointListener#onTransportDown(Throwable)}.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    /**
     * Endpoint bound to an ephemeral port on the wildcard address of the given
     * family.
     *
     * @param ipv6 {@code true} for the IPv6 wildcard, {@code false} for IPv4
     */
    public static NettyUdpDatagramEndpoint ephemeral(boolean ipv6)
    {
        try {
            InetAddress wildcard = InetAddress.getByName(ipv6 ? "::" : "0.0.0.0");
            return new NettyUdpDatagramEndpoint(new InetSocketAddress(wildcard, 0));
        } catch (UnknownHostException e) {
            throw new IllegalStateException("wildcard address not resolvable", e);
        }
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onTransportUp();
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public CompletableFuture<Void> send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new IllegalStateException("UDP channel is not active"));
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
                .addListener((ChannelFutureListener) future -> {
                    if (future.isSuccess()) {
                        written.complete(null);
                    }
                    else {
                        written.completeExceptionally(future.cause());
                    }
                });
        return written;
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * Forwards inbound datagram payloads to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
