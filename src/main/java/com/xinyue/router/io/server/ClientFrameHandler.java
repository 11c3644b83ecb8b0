package com.xinyue.router.io.server;

import com.xinyue.router.hub.ClientSession;
import com.xinyue.router.hub.SubscriptionHub;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 客户端 WebSocket 帧处理器，每个连接一个实例。
 * 握手、ping/pong、close 由 {@link WebSocketServerProtocolHandler} 处理，这里只处理文本帧。
 */
final class ClientFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger LOG = LoggerFactory.getLogger(ClientFrameHandler.class);

    private final SubscriptionHub hub;
    private ClientSession session;

    ClientFrameHandler(SubscriptionHub hub) {
        this.hub = hub;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            session = hub.onConnect(new NettySessionTransport(ctx.channel()));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (session == null) {
            return;
        }
        if (frame instanceof TextWebSocketFrame text) {
            hub.onFrame(session, text.text());
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (session != null && ctx.channel().isWritable()) {
            session.scheduleDrain();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            hub.onDisconnect(session);
            session = null;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("客户端连接异常，关闭 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
