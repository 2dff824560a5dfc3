package com.questrail.consolelink.protocol.smartglass.transport.udp.netty;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.transport.DatagramEndpoint;
import com.questrail.consolelink.protocol.smartglass.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode or decrypt console messages</li>
 *   <li>Correlate replies or schedule timeouts</li>
 *   <li>Retry sends</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener on the single event loop thread, which serializes them. All
 * reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket and waits for the bind to finish,
 *   because the handshake sends immediately afterwards.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct a Netty UDP endpoint binding to the specified local address.
     *
     * <p>Each endpoint owns a single-threaded {@link NioEventLoopGroup}; a
     * console connection opens one endpoint for the handshake and one for the
     * session.</p>
     */
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
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
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

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            l.onTransportDown(f.cause());
            group.shutdownGracefully();
            throw new ConsoleLinkException("Failed to bind UDP endpoint to " + bindAddress, f.cause());
        }

        channel = f.channel();
        l.onTransportUp();
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || stopped.get()) {
            throw new IllegalStateException("UDP endpoint is not bound");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ch.writeAndFlush(pkt);
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
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

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
