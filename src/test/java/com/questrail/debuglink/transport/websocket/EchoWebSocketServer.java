package com.questrail.debuglink.transport.websocket;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Loopback WebSocket server for transport tests, serving {@code /ws}.
 *
 * <ul>
 *   <li>text frames are echoed</li>
 *   <li>{@code "binary"} is answered with a binary frame</li>
 *   <li>{@code "close-me"} makes the server close the connection</li>
 *   <li>plain HTTP requests on any other path get a 404</li>
 * </ul>
 */
final class EchoWebSocketServer implements AutoCloseable {

    static final String SUBPROTOCOL = "debug.v1";

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final Channel serverChannel;

    EchoWebSocketServer() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler("/ws", SUBPROTOCOL));
                        ch.pipeline().addLast(new ServerHandler());
                    }
                });
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
    }

    int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    String url(String path) {
        return "ws://127.0.0.1:" + port() + path;
    }

    @Override
    public void close() throws InterruptedException {
        serverChannel.close().sync();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private static final class ServerHandler extends SimpleChannelInboundHandler<Object> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest) {
                DefaultFullHttpResponse notFound = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1, HttpResponseStatus.NOT_FOUND, Unpooled.EMPTY_BUFFER);
                notFound.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
                ctx.writeAndFlush(notFound).addListener(ChannelFutureListener.CLOSE);
                return;
            }
            if (msg instanceof TextWebSocketFrame text) {
                String payload = text.text();
                if ("close-me".equals(payload)) {
                    ctx.writeAndFlush(new CloseWebSocketFrame(1001, "going away"))
                            .addListener(ChannelFutureListener.CLOSE);
                } else if ("binary".equals(payload)) {
                    ctx.writeAndFlush(new BinaryWebSocketFrame(
                            Unpooled.copiedBuffer("bin-payload", StandardCharsets.UTF_8)));
                } else {
                    ctx.writeAndFlush(new TextWebSocketFrame(payload));
                }
            }
        }
    }
}
