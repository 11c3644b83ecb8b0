package com.xinyue.router.io.input;

import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.MarketDataConnector;
import com.xinyue.router.io.Normalizer;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * 交易所 WebSocket 行情连接器的公共部分：Netty 连接、握手、断线重连、空闲检测。
 * <p>
 * 每个连接器独占一个单线程 EventLoop，收包、解析、发布和重连调度都在这个线程上，
 * 所以同一交易所的 tick 按接收顺序进入 RingBuffer。
 */
public abstract class WebSocketFeedConnector implements MarketDataConnector {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketFeedConnector.class);

    protected final Normalizer normalizer;
    protected final MetricsService metricsService;
    private final ReconnectBackoff backoff;
    private final int idleSeconds;
    private final int keepaliveSeconds;

    private EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile boolean running;
    private volatile boolean connected;

    protected WebSocketFeedConnector(Normalizer normalizer,
                                     MetricsService metricsService,
                                     ReconnectBackoff backoff,
                                     int idleSeconds,
                                     int keepaliveSeconds) {
        this.normalizer = normalizer;
        this.metricsService = metricsService;
        this.backoff = backoff;
        this.idleSeconds = idleSeconds;
        this.keepaliveSeconds = keepaliveSeconds;
    }

    /**
     * 连接地址（可以带订阅参数）。
     */
    protected abstract URI endpoint();

    /**
     * 握手完成后发送订阅请求，不需要时什么都不做。
     */
    protected abstract void onHandshakeComplete(Channel ch);

    /**
     * 应用层心跳内容，null 表示只依赖 WebSocket 协议层 ping。
     */
    protected String keepaliveText() {
        return null;
    }

    /**
     * 心跳回复之类不需要交给解析器的文本。
     */
    protected boolean isControlText(String text) {
        return false;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        eventLoopGroup = new NioEventLoopGroup(1);
        connect(eventLoopGroup);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    private void connect(EventLoopGroup group) {
        URI uri = endpoint();
        String scheme = uri.getScheme();
        String host = uri.getHost();
        boolean ssl = "wss".equalsIgnoreCase(scheme);
        int port = uri.getPort() == -1 ? (ssl ? 443 : 80) : uri.getPort();
        SslContext sslCtx;
        try {
            sslCtx = ssl ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            throw new IllegalStateException("初始化 " + exchange().wireName() + " TLS 失败", e);
        }

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri,
                WebSocketVersion.V13,
                null,
                true,
                new DefaultHttpHeaders(),
                1 << 20
        );
        FeedWebSocketClientHandler handler = new FeedWebSocketClientHandler(handshaker, this);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslCtx != null) {
                            pipeline.addLast(sslCtx.newHandler(ch.alloc(), host, port));
                        }
                        pipeline.addLast(
                                new HttpClientCodec(),
                                new HttpObjectAggregator(1 << 20),
                                WebSocketClientCompressionHandler.INSTANCE,
                                new IdleStateHandler(idleSeconds, keepaliveSeconds, 0, TimeUnit.SECONDS),
                                handler
                        );
                    }
                });

        LOG.info("连接 {} 行情: {}", exchange().wireName(), uri);
        ChannelFuture future = bootstrap.connect(host, port);
        channel = future.channel();
        future.addListener(f -> {
            if (!f.isSuccess()) {
                LOG.warn("{} 连接失败: {}", exchange().wireName(), f.cause() == null ? "unknown" : f.cause().getMessage());
                scheduleReconnect();
            }
        });
    }

    // ==================== 由 FeedWebSocketClientHandler 在 EventLoop 线程上回调 ====================

    void handshakeComplete(Channel ch) {
        connected = true;
        backoff.reset();
        LOG.info("{} 行情握手完成", exchange().wireName());
        onHandshakeComplete(ch);
    }

    void onText(String text) {
        if (isControlText(text)) {
            return;
        }
        normalizer.onJsonMessage(exchange(), text, System.currentTimeMillis());
    }

    void connectionLost(String reason) {
        boolean wasConnected = connected;
        connected = false;
        LOG.warn("{} 行情连接断开: {}", exchange().wireName(), reason);
        if (wasConnected) {
            normalizer.onDisconnect(exchange());
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        EventLoopGroup group = eventLoopGroup;
        if (!running || group == null || group.isShuttingDown()) {
            return;
        }
        long delay = backoff.nextDelayMs();
        metricsService.recordReconnect(exchange());
        LOG.info("{} 将在 {} ms 后重连（第 {} 次）", exchange().wireName(), delay, backoff.attempts());
        group.schedule(() -> {
            if (running && !group.isShuttingDown()) {
                connect(group);
            }
        }, delay, TimeUnit.MILLISECONDS);
    }
}
