package com.questrail.debuglink.transport.bus.netty;

import com.questrail.debuglink.transport.bus.BusChannel;
import com.questrail.debuglink.transport.bus.BusChannelFactory;
import com.questrail.debuglink.transport.bus.BusChannelListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * NettyMulticastBus
 * =============================================================================
 * Same-host {@link BusChannelFactory} over UDP multicast on the loopback
 * interface, so that a debugger and an emulator in different processes on one
 * machine share named channels.
 *
 * <h2>Delivery rules</h2>
 * <ul>
 *   <li>A post is delivered directly to the other local handles of the same
 *       channel and multicast once for other processes.</li>
 *   <li>Datagrams carrying this instance's origin id are ours looped back by
 *       the kernel and are dropped.</li>
 *   <li>Only {@code String} messages can cross a process boundary, and only
 *       while the encoded envelope fits one datagram
 *       ({@value #MAX_DATAGRAM_SIZE} bytes); larger posts are rejected.</li>
 *   <li>Datagrams that do not decode as a {@link BusEnvelope} are dropped.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package; listeners see plain strings.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the socket and joins the group; {@link #stop()} closes
 * every open handle, leaves the group and shuts the event loop group down.
 */
public final class NettyMulticastBus implements BusChannelFactory
{
    public static final InetSocketAddress DEFAULT_GROUP = new InetSocketAddress("239.255.42.99", 47999);

    /** Largest UDP payload over IPv4. */
    public static final int MAX_DATAGRAM_SIZE = 65507;

    private static final int RECEIVE_BUFFER_SIZE = 65535;

    private static final Logger log = LoggerFactory.getLogger(NettyMulticastBus.class);

    private final InetSocketAddress group;
    private final String origin = UUID.randomUUID().toString();
    private final BusDatagramCodec codec = new BusDatagramCodec();
    private final Map<String, Set<Handle>> channels = new ConcurrentHashMap<>();

    private final EventLoopGroup eventLoop;
    private final Bootstrap bootstrap;
    private final NetworkInterface loopback;

    private volatile DatagramChannel socket;

    public NettyMulticastBus()
    {
        this(DEFAULT_GROUP);
    }

    public NettyMulticastBus(InetSocketAddress group)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.loopback = loopbackInterface();

        this.eventLoop = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(eventLoop)
                .channelFactory((ChannelFactory<NioDatagramChannel>) () -> new NioDatagramChannel(InternetProtocolFamily.IPv4))
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.IP_MULTICAST_IF, loopback)
                .option(ChannelOption.IP_MULTICAST_LOOP_DISABLED, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(RECEIVE_BUFFER_SIZE))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    /**
     * Bind the group port and join the group. Blocks until both complete.
     */
    public void start()
    {
        try {
            DatagramChannel ch = (DatagramChannel) bootstrap.bind(new InetSocketAddress(group.getPort())).sync().channel();
            ch.joinGroup(group, loopback).sync();
            socket = ch;
            log.info("Multicast bus joined {} on {}", group, loopback.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting multicast bus", e);
        }
    }

    public void stop()
    {
        for (Set<Handle> handles : channels.values()) {
            for (Handle handle : handles) {
                handle.close();
            }
        }
        channels.clear();

        DatagramChannel ch = socket;
        socket = null;
        if (ch != null) {
            ch.leaveGroup(group, loopback);
            ch.close();
        }
        eventLoop.shutdownGracefully();
    }

    @Override
    public BusChannel open(String name, BusChannelListener listener)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(listener, "listener");

        if (socket == null) {
            throw new IllegalStateException("Multicast bus is not started");
        }

        Handle handle = new Handle(name, listener);
        channels.computeIfAbsent(name, n -> new CopyOnWriteArraySet<>()).add(handle);
        return handle;
    }

    private void publish(Handle from, String data)
    {
        DatagramChannel ch = socket;
        if (ch == null) {
            throw new IllegalStateException("Multicast bus is stopped");
        }
        byte[] bytes = codec.encode(new BusEnvelope(origin, from.name, data));
        if (bytes.length > MAX_DATAGRAM_SIZE) {
            throw new IllegalArgumentException("Bus message on '" + from.name + "' encodes to "
                    + bytes.length + " bytes; the limit is " + MAX_DATAGRAM_SIZE);
        }

        Set<Handle> handles = channels.get(from.name);
        if (handles != null) {
            for (Handle to : handles) {
                if (to != from) {
                    to.receive(data);
                }
            }
        }

        ChannelFuture write = ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(bytes), group));
        write.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to send bus datagram on '{}'", from.name, f.cause());
            }
        });
    }

    private static NetworkInterface loopbackInterface()
    {
        try {
            NetworkInterface ni = NetworkInterface.getByInetAddress(InetAddress.getLoopbackAddress());
            if (ni == null) {
                throw new IllegalStateException("No loopback network interface");
            }
            return ni;
        } catch (SocketException e) {
            throw new UncheckedIOException(e);
        }
    }

    private final class Handle implements BusChannel
    {
        private final String name;
        private final BusChannelListener listener;
        private volatile boolean closed;

        private Handle(String name, BusChannelListener listener)
        {
            this.name = name;
            this.listener = listener;
        }

        @Override
        public String name()
        {
            return name;
        }

        @Override
        public void post(Object message)
        {
            Objects.requireNonNull(message, "message");
            if (closed) {
                throw new IllegalStateException("Channel '" + name + "' is closed");
            }
            if (!(message instanceof String data)) {
                throw new IllegalArgumentException("Multicast bus carries only strings, got " + message.getClass().getName());
            }
            publish(this, data);
        }

        @Override
        public void close()
        {
            if (closed) {
                return;
            }
            closed = true;
            channels.computeIfPresent(name, (n, handles) -> {
                handles.remove(this);
                return handles.isEmpty() ? null : handles;
            });
        }

        private void receive(String data)
        {
            if (closed) {
                return;
            }
            try {
                listener.onMessage(data);
            } catch (RuntimeException e) {
                log.warn("Listener on bus channel '{}' failed", name, e);
            }
        }

        private void error(Throwable cause)
        {
            if (!closed) {
                listener.onMessageError(cause);
            }
        }
    }

    /**
     * Copies each datagram out of its {@link ByteBuf}, decodes the envelope and
     * fans the payload out to the local handles of its channel.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            Optional<BusEnvelope> decoded = codec.decode(bytes);
            if (decoded.isEmpty()) {
                log.debug("Dropping malformed bus datagram from {}", packet.sender());
                return;
            }

            BusEnvelope envelope = decoded.get();
            if (origin.equals(envelope.origin())) {
                return;
            }

            Set<Handle> handles = channels.get(envelope.channel());
            if (handles == null) {
                return;
            }
            for (Handle handle : handles) {
                handle.receive(envelope.data());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Multicast bus socket error", cause);
            IOException wrapped = cause instanceof IOException io ? io : new IOException(cause);
            for (Set<Handle> handles : channels.values()) {
                for (Handle handle : handles) {
                    handle.error(wrapped);
                }
            }
        }
    }
}
