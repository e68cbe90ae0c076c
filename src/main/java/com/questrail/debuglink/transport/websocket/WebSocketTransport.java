package com.questrail.debuglink.transport.websocket;

import com.questrail.debuglink.transport.AbstractTransport;
import com.questrail.debuglink.transport.TransportKind;
import com.questrail.debuglink.transport.TransportNotConnectedException;
import com.questrail.debuglink.transport.TransportOptions;
import com.questrail.debuglink.transport.TransportState;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * WebSocketTransport
 * =============================================================================
 * {@link com.questrail.debuglink.transport.Transport} over one WebSocket
 * connection to a fixed {@code ws://} or {@code wss://} endpoint, built on Netty.
 *
 * <h2>Readiness</h2>
 * {@link #connect} completes only after the WebSocket handshake. Frames are
 * forwarded to payload handlers only once the handshake has completed, so no
 * payload handler runs before the state is {@code OPEN}.
 *
 * <h2>Failure</h2>
 * <ul>
 *   <li>Connect refusal, handshake rejection or handshake timeout: the connect
 *       future fails with the cause and {@code CLOSED} is broadcast.</li>
 *   <li>Peer closure after {@code OPEN}: {@code CLOSED} is broadcast once.
 *       There is no reconnect.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Channel callbacks run on the injected {@link EventLoopGroup}, which is owned
 * by the caller. Each connection attempt is fenced by its {@link Channel}:
 * callbacks from a channel this transport no longer holds are ignored.
 *
 * <p>Every state transition re-checks its precondition and broadcasts while
 * holding {@code transitionLock}, so handlers observe transitions in the order
 * they took effect even when the caller and the event loop race.</p>
 */
public final class WebSocketTransport extends AbstractTransport
{
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private static final int NORMAL_CLOSURE = 1000;
    private static final int MAX_FRAME_SIZE = 16 * 1024 * 1024;

    private final EventLoopGroup eventLoop;

    private final Object transitionLock = new Object();
    private final Object lock = new Object();
    private Channel channel;
    private CompletableFuture<Void> pendingConnect;
    private boolean open;

    public WebSocketTransport(EventLoopGroup eventLoop)
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.WEBSOCKET;
    }

    @Override
    public CompletableFuture<Void> connect(String endpoint, TransportOptions options)
    {
        requireEndpoint(endpoint);
        Objects.requireNonNull(options, "options");

        CompletableFuture<Void> ready;
        synchronized (transitionLock) {
            synchronized (lock) {
                if (channel != null && open) {
                    return CompletableFuture.completedFuture(null);
                }
                if (pendingConnect != null) {
                    return pendingConnect;
                }
                ready = new CompletableFuture<>();
                pendingConnect = ready;
            }
            broadcastState(TransportState.CONNECTING, null);
        }

        final Target target;
        try {
            target = Target.parse(endpoint);
        } catch (IllegalArgumentException e) {
            failConnect(null, ready, e);
            return ready;
        }

        final SslContext ssl;
        try {
            ssl = target.secure() ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            failConnect(null, ready, e);
            return ready;
        }

        String subprotocols = options.protocols().isEmpty() ? null : String.join(",", options.protocols());
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                target.uri(), WebSocketVersion.V13, subprotocols, true, new DefaultHttpHeaders(), MAX_FRAME_SIZE);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoop)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        if (!attach(ch, ready)) {
                            ch.close();
                            return;
                        }
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), target.host(), target.port()));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_SIZE));
                        p.addLast(new FrameHandler(ready));
                    }
                });

        bootstrap.connect(target.host(), target.port()).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                failConnect(f.channel(), ready, f.cause());
            }
        });

        return ready;
    }

    @Override
    public void disconnect(Integer code, String reason)
    {
        synchronized (transitionLock) {
            disconnectLocked(code, reason);
        }
    }

    private void disconnectLocked(Integer code, String reason)
    {
        Channel closing;
        CompletableFuture<Void> pending;
        boolean wasOpen;
        synchronized (lock) {
            closing = channel;
            pending = pendingConnect;
            wasOpen = open;
            channel = null;
            pendingConnect = null;
            open = false;
        }
        if (closing == null && pending == null) {
            return;
        }

        if (closing != null) {
            if (wasOpen && closing.isActive()) {
                CloseWebSocketFrame frame = new CloseWebSocketFrame(
                        code != null ? code : NORMAL_CLOSURE,
                        reason != null ? reason : "");
                closing.writeAndFlush(frame).addListener(ChannelFutureListener.CLOSE);
            } else {
                closing.close();
            }
        }
        if (pending != null) {
            pending.completeExceptionally(new IllegalStateException("Disconnected before the handshake completed"));
        }

        broadcastState(TransportState.CLOSED, null);
    }

    @Override
    public void send(String payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel target;
        synchronized (lock) {
            target = open ? channel : null;
        }
        if (target == null || !target.isActive() || state() != TransportState.OPEN) {
            throw new TransportNotConnectedException();
        }
        target.writeAndFlush(new TextWebSocketFrame(payload));
    }

    // -------------------------------------------------------------------------
    // Attempt bookkeeping
    // -------------------------------------------------------------------------

    private boolean attach(Channel ch, CompletableFuture<Void> ready)
    {
        synchronized (lock) {
            if (pendingConnect != ready) {
                return false;
            }
            channel = ch;
            return true;
        }
    }

    private void onHandshakeComplete(Channel ch, CompletableFuture<Void> ready)
    {
        synchronized (transitionLock) {
            synchronized (lock) {
                if (channel != ch || pendingConnect != ready) {
                    return;
                }
                pendingConnect = null;
                open = true;
            }
            broadcastState(TransportState.OPEN, null);
            ready.complete(null);
        }
    }

    private void failConnect(Channel ch, CompletableFuture<Void> ready, Throwable cause)
    {
        synchronized (transitionLock) {
            synchronized (lock) {
                if (pendingConnect != ready) {
                    return;
                }
                pendingConnect = null;
                if (ch == null || channel == ch) {
                    channel = null;
                }
            }
            if (ch != null) {
                ch.close();
            }
            log.warn("WebSocket connect failed: {}", cause.toString());
            broadcastState(TransportState.CLOSED, cause);
            ready.completeExceptionally(cause);
        }
    }

    private void onPeerClosed(Channel ch, Throwable cause)
    {
        synchronized (transitionLock) {
            synchronized (lock) {
                if (channel != ch || !open) {
                    return;
                }
                channel = null;
                open = false;
            }
            log.info("WebSocket closed by peer");
            broadcastState(TransportState.CLOSED, cause);
        }
    }

    private boolean isOpen(Channel ch)
    {
        synchronized (lock) {
            return open && channel == ch;
        }
    }

    /**
     * Handshake events, inbound frames and closure for one connection attempt.
     */
    private final class FrameHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        private final CompletableFuture<Void> ready;

        private FrameHandler(CompletableFuture<Void> ready)
        {
            this.ready = ready;
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                onHandshakeComplete(ctx.channel(), ready);
            } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                failConnect(ctx.channel(), ready, new WebSocketHandshakeException("WebSocket handshake timed out"));
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (!isOpen(ctx.channel())) {
                return;
            }
            if (frame instanceof TextWebSocketFrame text) {
                broadcastMessage(text.text());
            } else if (frame instanceof BinaryWebSocketFrame binary) {
                broadcastMessage(binary.content().toString(StandardCharsets.UTF_8));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            if (!ready.isDone()) {
                failConnect(ctx.channel(), ready, new WebSocketHandshakeException("Connection closed during handshake"));
            } else {
                onPeerClosed(ctx.channel(), null);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (!ready.isDone()) {
                failConnect(ctx.channel(), ready, cause);
                return;
            }
            log.warn("WebSocket error", cause);
            onPeerClosed(ctx.channel(), cause);
            ctx.close();
        }
    }

    /**
     * Parsed endpoint.
     */
    private record Target(URI uri, String host, int port, boolean secure)
    {
        static Target parse(String endpoint)
        {
            final URI uri;
            try {
                uri = new URI(endpoint);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Malformed WebSocket endpoint: " + endpoint, e);
            }

            String scheme = uri.getScheme();
            boolean secure;
            if ("ws".equalsIgnoreCase(scheme)) {
                secure = false;
            } else if ("wss".equalsIgnoreCase(scheme)) {
                secure = true;
            } else {
                throw new IllegalArgumentException("Unsupported WebSocket scheme: " + scheme);
            }

            String host = uri.getHost();
            if (host == null) {
                throw new IllegalArgumentException("WebSocket endpoint has no host: " + endpoint);
            }
            int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
            return new Target(uri, host, port, secure);
        }
    }
}
