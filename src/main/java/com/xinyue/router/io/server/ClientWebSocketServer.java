package com.xinyue.router.io.server;

import com.xinyue.router.hub.SubscriptionHub;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 面向客户端的 WebSocket 服务端（默认 ws://0.0.0.0:8765/ws）。
 */
public final class ClientWebSocketServer {

    private static final Logger LOG = LoggerFactory.getLogger(ClientWebSocketServer.class);

    private final int port;
    private final String path;
    private final SubscriptionHub hub;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ClientWebSocketServer(int port, String path, SubscriptionHub hub) {
        this.port = port;
        this.path = path;
        this.hub = hub;
    }

    public synchronized void start() {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(256 * 1024, 1024 * 1024))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(65536),
                                new WebSocketServerCompressionHandler(),
                                new WebSocketServerProtocolHandler(path, null, true),
                                new ClientFrameHandler(hub)
                        );
                    }
                });
        serverChannel = bootstrap.bind(port).syncUninterruptibly().channel();
        LOG.info("客户端 WebSocket 服务已启动: ws://0.0.0.0:{}{}", port, path);
    }

    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            bossGroup = null;
            workerGroup = null;
        }
    }
}
