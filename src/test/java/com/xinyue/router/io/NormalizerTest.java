package com.xinyue.router.io;

import com.lmax.disruptor.RingBuffer;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.CoreEventType;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.CoreEventFactory;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.input.binance.BinanceFeedParser;
import com.xinyue.router.io.input.okx.OkxFeedParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("行情标准化测试")
class NormalizerTest {

    private RingBuffer<CoreEvent> ringBuffer;
    private MetricsService metrics;
    private Normalizer normalizer;
    private SymbolRegistry symbols;

    @BeforeEach
    void setUp() {
        ringBuffer = RingBuffer.createMultiProducer(new CoreEventFactory(), 64);
        metrics = new MetricsService();
        symbols = new SymbolRegistry(List.of("BTCUSDT"));
        normalizer = new Normalizer(ringBuffer, metrics)
                .register(new BinanceFeedParser(symbols))
                .register(new OkxFeedParser(symbols));
    }

    @Test
    @DisplayName("合法成交写入 RingBuffer")
    void testTradePublished() {
        int n = normalizer.onJsonMessage(Exchange.BINANCE,
                "{\"stream\":\"btcusdt@trade\",\"data\":{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"100\",\"q\":\"2\",\"T\":5}}", 9L);

        assertEquals(1, n);
        assertEquals(0, ringBuffer.getCursor());
        CoreEvent event = ringBuffer.get(0);
        assertEquals(CoreEventType.TRADE_TICK, event.type);
        assertEquals(Exchange.BINANCE.id(), event.exchangeId);
        assertEquals(symbols.get("BTCUSDT"), event.symbolId);
        assertEquals(10_000_000_000L, event.tradePriceE8);
        assertEquals(5L, event.timestamp);
        assertEquals(1, metrics.ticks());
    }

    @Test
    @DisplayName("格式错误的消息计数后丢弃，不发布任何事件")
    void testMalformedCounted() {
        assertEquals(0, normalizer.onJsonMessage(Exchange.OKX, "{broken", 1L));
        assertEquals(0, normalizer.onJsonMessage(Exchange.OKX,
                "{\"arg\":{\"channel\":\"trades\"},\"data\":[{\"instId\":\"BTC-USDT\",\"px\":\"-1\",\"sz\":\"1\",\"ts\":\"1\"}]}", 1L));

        assertEquals(2, metrics.malformedCount(Exchange.OKX));
        assertEquals(0, metrics.malformedCount(Exchange.BINANCE));
        assertEquals(-1, ringBuffer.getCursor());
    }

    @Test
    @DisplayName("断线发布 FEED_STALE 事件")
    void testDisconnectPublishesStale() {
        normalizer.onDisconnect(Exchange.OKX);

        CoreEvent event = ringBuffer.get(ringBuffer.getCursor());
        assertEquals(CoreEventType.FEED_STALE, event.type);
        assertEquals(Exchange.OKX.id(), event.exchangeId);
        assertEquals(0, event.symbolId);
    }
}
