package com.xinyue.router.io.input.okx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.Normalizer;
import com.xinyue.router.io.input.ReconnectBackoff;
import com.xinyue.router.io.input.WebSocketFeedConnector;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.net.URI;

/**
 * OKX v5 公共频道连接器：握手后订阅 tickers + trades。
 * OKX 30 秒内没有数据会断开连接，需要定时发送文本 "ping"，服务端回复 "pong"。
 */
public final class OkxMarketDataConnector extends WebSocketFeedConnector {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final String subscribePayload;

    public OkxMarketDataConnector(String url,
                                  SymbolRegistry symbolRegistry,
                                  Normalizer normalizer,
                                  MetricsService metricsService,
                                  ReconnectBackoff backoff,
                                  int idleSeconds,
                                  int keepaliveSeconds) {
        super(normalizer, metricsService, backoff, idleSeconds, keepaliveSeconds);
        this.endpoint = URI.create(url);
        this.subscribePayload = subscribePayload(symbolRegistry);
    }

    static String subscribePayload(SymbolRegistry symbolRegistry) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("op", "subscribe");
        ArrayNode args = root.putArray("args");
        for (SymbolRegistry.SymbolInfo info : symbolRegistry.all()) {
            String instId = OkxFeedParser.toInstId(info);
            args.addObject().put("channel", "tickers").put("instId", instId);
            args.addObject().put("channel", "trades").put("instId", instId);
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("构造 OKX 订阅请求失败", e);
        }
    }

    @Override
    public Exchange exchange() {
        return Exchange.OKX;
    }

    @Override
    protected URI endpoint() {
        return endpoint;
    }

    @Override
    protected void onHandshakeComplete(Channel ch) {
        ch.writeAndFlush(new TextWebSocketFrame(subscribePayload));
    }

    @Override
    protected String keepaliveText() {
        return "ping";
    }

    @Override
    protected boolean isControlText(String text) {
        return "pong".equals(text);
    }
}
