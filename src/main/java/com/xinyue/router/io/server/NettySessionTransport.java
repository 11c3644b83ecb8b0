package com.xinyue.router.io.server;

import com.xinyue.router.hub.SessionTransport;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

/**
 * 基于 Netty Channel 的会话写通道，所有写操作都在 Channel 所属的 EventLoop 上执行。
 */
final class NettySessionTransport implements SessionTransport {

    private final Channel channel;

    NettySessionTransport(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void execute(Runnable task) {
        channel.eventLoop().execute(task);
    }

    @Override
    public void write(String text) {
        channel.write(new TextWebSocketFrame(text));
    }

    @Override
    public void flush() {
        channel.flush();
    }

    @Override
    public boolean isWritable() {
        return channel.isActive() && channel.isWritable();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }
}
