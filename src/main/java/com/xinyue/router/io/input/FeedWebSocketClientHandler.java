package com.xinyue.router.io.input;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 交易所行情 WebSocket 客户端处理器，所有交易所共用，差异由 {@link WebSocketFeedConnector} 子类提供。
 */
final class FeedWebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOG = LoggerFactory.getLogger(FeedWebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final WebSocketFeedConnector connector;

    FeedWebSocketClientHandler(WebSocketClientHandshaker handshaker, WebSocketFeedConnector connector) {
        this.handshaker = handshaker;
        this.connector = connector;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        connector.connectionLost(handshaker.isHandshakeComplete() ? "channel closed" : "closed before handshake");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                connector.handshakeComplete(ch);
            } catch (WebSocketHandshakeException e) {
                LOG.warn("{} 握手失败: {}", connector.exchange().wireName(), e.getMessage());
                ch.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                    "意外的 FullHttpResponse: " + response.status() + ", body=" + response.content().toString(CharsetUtil.UTF_8)
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame textFrame) {
            connector.onText(textFrame.text());
        } else if (frame instanceof PingWebSocketFrame pingFrame) {
            // payload 需保持一致
            ch.writeAndFlush(new PongWebSocketFrame(pingFrame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame) {
            ch.close();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle) {
            if (idle.state() == IdleState.READER_IDLE) {
                LOG.warn("{} 长时间没有收到数据，主动断开", connector.exchange().wireName());
                ctx.close();
            } else if (idle.state() == IdleState.WRITER_IDLE && handshaker.isHandshakeComplete()) {
                String keepalive = connector.keepaliveText();
                if (keepalive != null) {
                    ctx.writeAndFlush(new TextWebSocketFrame(keepalive));
                }
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.error("{} 行情连接异常", connector.exchange().wireName(), cause);
        ctx.close();
    }
}
