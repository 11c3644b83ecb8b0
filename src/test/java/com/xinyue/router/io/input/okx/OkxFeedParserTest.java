package com.xinyue.router.io.input.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.io.input.MalformedMessageException;
import com.xinyue.router.io.input.RecordingTickSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OKX 消息解析测试")
class OkxFeedParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private SymbolRegistry symbols;
    private OkxFeedParser parser;
    private RecordingTickSink sink;

    @BeforeEach
    void setUp() {
        symbols = new SymbolRegistry(List.of("BTCUSDT", "ETHUSDT"));
        parser = new OkxFeedParser(symbols);
        sink = new RecordingTickSink();
    }

    private int parse(String json) throws Exception {
        return parser.parse(mapper.readTree(json), 1L, sink);
    }

    @Test
    @DisplayName("tickers 频道产生报价，时间戳取 ts")
    void testTickers() throws Exception {
        int n = parse("{\"arg\":{\"channel\":\"tickers\",\"instId\":\"BTC-USDT\"},\"data\":[{\"instId\":\"BTC-USDT\","
                + "\"bidPx\":\"50000.1\",\"bidSz\":\"1\",\"askPx\":\"50000.2\",\"askSz\":\"2\",\"ts\":\"1700000000000\"}]}");

        assertEquals(1, n);
        long[] q = sink.quotes.get(0);
        assertEquals(symbols.get("BTCUSDT"), q[0]);
        assertEquals(200_000_000L, q[4]);
        assertEquals(1_700_000_000_000L, q[5]);
    }

    @Test
    @DisplayName("trades 频道一条消息可以带多笔成交")
    void testTrades_MultipleItems() throws Exception {
        int n = parse("{\"arg\":{\"channel\":\"trades\",\"instId\":\"ETH-USDT\"},\"data\":["
                + "{\"instId\":\"ETH-USDT\",\"px\":\"3000\",\"sz\":\"0.1\",\"ts\":\"1700000000001\"},"
                + "{\"instId\":\"ETH-USDT\",\"px\":\"3001\",\"sz\":\"0.2\",\"ts\":\"1700000000002\"}]}");

        assertEquals(2, n);
        assertEquals(300_100_000_000L, sink.trades.get(1)[1]);
        assertEquals(1_700_000_000_002L, sink.trades.get(1)[3]);
    }

    @Test
    @DisplayName("任意一条 data 不合法时整条消息都不发布")
    void testPartialMalformed_NothingPublished() {
        assertThrows(MalformedMessageException.class, () -> parse(
                "{\"arg\":{\"channel\":\"trades\",\"instId\":\"ETH-USDT\"},\"data\":["
                        + "{\"instId\":\"ETH-USDT\",\"px\":\"3000\",\"sz\":\"0.1\",\"ts\":\"1\"},"
                        + "{\"instId\":\"ETH-USDT\",\"px\":\"oops\",\"sz\":\"0.2\",\"ts\":\"2\"}]}"));

        assertTrue(sink.trades.isEmpty());
    }

    @Test
    @DisplayName("订阅事件和错误事件不产生 tick")
    void testEvents() throws Exception {
        assertEquals(0, parse("{\"event\":\"subscribe\",\"arg\":{\"channel\":\"tickers\",\"instId\":\"BTC-USDT\"}}"));
        assertEquals(0, parse("{\"event\":\"error\",\"code\":\"60012\",\"msg\":\"Invalid request\"}"));
        assertThrows(MalformedMessageException.class, () -> parse("{\"arg\":{\"channel\":\"books\"},\"data\":[]}"));
        assertThrows(MalformedMessageException.class, () -> parse("{\"arg\":{\"channel\":\"tickers\"}}"));
    }

    @Test
    @DisplayName("订阅请求包含每个交易对的 tickers 和 trades")
    void testSubscribePayload() throws Exception {
        JsonNode root = mapper.readTree(OkxMarketDataConnector.subscribePayload(symbols));

        assertEquals("subscribe", root.get("op").asText());
        assertEquals(4, root.get("args").size());
        assertEquals("BTC-USDT", root.get("args").get(0).get("instId").asText());
        assertEquals("trades", root.get("args").get(1).get("channel").asText());
        assertEquals("ETH-USDT", OkxFeedParser.toInstId(symbols.info("ETHUSDT")));
    }
}
