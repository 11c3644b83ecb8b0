package com.xinyue.router.io.input.binance;

import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.Normalizer;
import com.xinyue.router.io.input.ReconnectBackoff;
import com.xinyue.router.io.input.WebSocketFeedConnector;
import io.netty.channel.Channel;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance 行情连接器。使用组合流，订阅写在 URL 里，握手后不需要再发订阅请求。
 */
public final class BinanceMarketDataConnector extends WebSocketFeedConnector {

    private final URI endpoint;

    public BinanceMarketDataConnector(String baseUrl,
                                      SymbolRegistry symbolRegistry,
                                      Normalizer normalizer,
                                      MetricsService metricsService,
                                      ReconnectBackoff backoff,
                                      int idleSeconds,
                                      int keepaliveSeconds) {
        super(normalizer, metricsService, backoff, idleSeconds, keepaliveSeconds);
        this.endpoint = URI.create(baseUrl + "?streams=" + String.join("/", streams(symbolRegistry)));
    }

    /**
     * 每个交易对订阅 bookTicker 和 trade 两个流。
     */
    static List<String> streams(SymbolRegistry symbolRegistry) {
        List<String> streams = new ArrayList<>();
        for (SymbolRegistry.SymbolInfo info : symbolRegistry.all()) {
            String lower = info.symbol().toLowerCase();
            streams.add(lower + "@bookTicker");
            streams.add(lower + "@trade");
        }
        return streams;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BINANCE;
    }

    @Override
    protected URI endpoint() {
        return endpoint;
    }

    @Override
    protected void onHandshakeComplete(Channel ch) {
        // 组合流的订阅已经在 URL 中
    }
}
