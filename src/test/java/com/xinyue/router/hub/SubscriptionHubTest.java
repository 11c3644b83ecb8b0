package com.xinyue.router.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.Side;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.error.UnauthorizedException;
import com.xinyue.router.core.market.BestTouch;
import com.xinyue.router.core.market.EwmaKey;
import com.xinyue.router.core.market.EwmaRegistry;
import com.xinyue.router.core.market.EwmaUpdate;
import com.xinyue.router.core.market.KlineBucket;
import com.xinyue.router.core.market.KlineInterval;
import com.xinyue.router.core.market.TradePrint;
import com.xinyue.router.core.oms.OrderSnapshot;
import com.xinyue.router.core.oms.OrderStatus;
import com.xinyue.router.infra.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("订阅中心测试")
class SubscriptionHubTest {

    private static final long E8 = 100_000_000L;

    private final ObjectMapper mapper = new ObjectMapper();
    private EwmaRegistry ewmaRegistry;
    private MetricsService metrics;
    private SubscriptionHub hub;

    @BeforeEach
    void setUp() {
        ewmaRegistry = new EwmaRegistry();
        metrics = new MetricsService();
        TokenAuthenticator authenticator = token -> {
            if (token.startsWith("valid-")) {
                return token.substring("valid-".length());
            }
            throw new UnauthorizedException("invalid or expired token");
        };
        hub = new SubscriptionHub(new SymbolRegistry(List.of("BTCUSDT", "ETHUSDT")),
                EnumSet.allOf(Exchange.class), ewmaRegistry, authenticator, metrics, 16);
    }

    private JsonNode last(FakeTransport transport) throws Exception {
        return mapper.readTree(transport.written.get(transport.written.size() - 1));
    }

    private ClientSession authed(FakeTransport transport, String user) {
        ClientSession session = hub.onConnect(transport);
        hub.onFrame(session, "{\"action\":\"auth\",\"token\":\"valid-" + user + "\"}");
        return session;
    }

    private static BestTouch touch(String scope) {
        return new BestTouch("BTCUSDT", scope, 100 * E8, E8, 101 * E8, E8, "binance", "binance", 1L, false);
    }

    @Test
    @DisplayName("认证成功返回用户名，失败返回错误但不断开连接")
    void testAuth() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = hub.onConnect(transport);

        hub.onFrame(session, "{\"action\":\"auth\",\"token\":\"bad\"}");
        JsonNode error = last(transport);
        assertEquals("error", error.get("type").asText());
        assertEquals("UNAUTHORIZED", error.get("code").asText());
        assertFalse(transport.closed);
        assertFalse(session.isAuthenticated());

        hub.onFrame(session, "{\"action\":\"auth\",\"token\":\"valid-alice\"}");
        JsonNode ok = last(transport);
        assertEquals("auth", ok.get("type").asText());
        assertEquals("ok", ok.get("status").asText());
        assertEquals("alice", ok.get("user").asText());
        assertEquals("alice", session.userId());
    }

    @Test
    @DisplayName("未认证的订阅被拒绝")
    void testSubscribe_Unauthorized() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = hub.onConnect(transport);

        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\"}");

        assertEquals("UNAUTHORIZED", last(transport).get("code").asText());
        assertEquals(0, session.subscriptionCount());
        assertFalse(transport.closed);
    }

    @Test
    @DisplayName("非法订阅参数返回 INVALID_SUBSCRIPTION")
    void testSubscribe_Invalid() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = authed(transport, "alice");

        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"depth\",\"symbol\":\"BTCUSDT\"}");
        assertEquals("INVALID_SUBSCRIPTION", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"trades\",\"symbol\":\"DOGEUSDT\"}");
        assertEquals("INVALID_SUBSCRIPTION", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"trades\",\"symbol\":\"BTCUSDT\",\"exchange\":\"kraken\"}");
        assertEquals("INVALID_SUBSCRIPTION", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"klines\",\"symbol\":\"BTCUSDT\",\"interval\":\"2m\"}");
        assertEquals("INVALID_SUBSCRIPTION", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":-1}");
        assertEquals("INVALID_SUBSCRIPTION", last(transport).get("code").asText());

        assertEquals(0, session.subscriptionCount());
    }

    @Test
    @DisplayName("格式错误和未知 action 返回对应错误码")
    void testMalformedAndUnknownAction() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = hub.onConnect(transport);

        hub.onFrame(session, "not json");
        assertEquals("MALFORMED", last(transport).get("code").asText());
        hub.onFrame(session, "[1]");
        assertEquals("MALFORMED", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"dance\"}");
        assertEquals("UNKNOWN_ACTION", last(transport).get("code").asText());
        hub.onFrame(session, "{\"action\":\"ping\"}");
        assertEquals("pong", last(transport).get("type").asText());

        assertEquals(2, metrics.malformedClientFrames());
    }

    @Test
    @DisplayName("all 订阅只收合并盘口，交易所订阅只收该交易所")
    void testRouting_ScopeIsExact() throws Exception {
        FakeTransport allTransport = new FakeTransport();
        ClientSession all = authed(allTransport, "alice");
        hub.onFrame(all, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"btcusdt\"}");

        FakeTransport binanceTransport = new FakeTransport();
        ClientSession binance = authed(binanceTransport, "bob");
        hub.onFrame(binance, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\",\"exchange\":\"binance\"}");

        int allBefore = allTransport.written.size();
        int binanceBefore = binanceTransport.written.size();

        hub.onBestTouch(touch("binance"));
        hub.onBestTouch(touch("okx"));
        hub.onBestTouch(touch("all"));

        assertEquals(allBefore + 1, allTransport.written.size());
        assertEquals("all", last(allTransport).get("data").get("exchange").asText());
        assertEquals(binanceBefore + 1, binanceTransport.written.size());
        JsonNode data = last(binanceTransport).get("data");
        assertEquals("best_touch", last(binanceTransport).get("type").asText());
        assertEquals("binance", data.get("exchange").asText());
        assertEquals(100, data.get("best_bid").asDouble());
    }

    @Test
    @DisplayName("成交、K 线和 EWMA 按参数精确路由")
    void testRouting_TradesKlinesEwma() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = authed(transport, "alice");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"trades\",\"symbol\":\"BTCUSDT\",\"exchange\":\"okx\"}");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"klines\",\"symbol\":\"BTCUSDT\",\"interval\":\"1m\"}");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":30}");
        assertEquals(3, session.subscriptionCount());
        assertTrue(ewmaRegistry.isRegistered(new EwmaKey("BTCUSDT", "all", 30.0)));
        int before = transport.written.size();

        hub.onTrade(new TradePrint("BTCUSDT", "okx", "okx", 100 * E8, E8, 1L));
        hub.onTrade(new TradePrint("BTCUSDT", "all", "okx", 100 * E8, E8, 1L));
        hub.onKline(new KlineBucket("BTCUSDT", "all", KlineInterval.M1, E8, E8, E8, E8, 0, 0, 60_000, true));
        hub.onKline(new KlineBucket("BTCUSDT", "all", KlineInterval.S1, E8, E8, E8, E8, 0, 0, 1_000, true));
        hub.onEwma(new EwmaUpdate(new EwmaKey("BTCUSDT", "all", 30.0), 100.0, 1L));
        hub.onEwma(new EwmaUpdate(new EwmaKey("BTCUSDT", "all", 10.0), 100.0, 1L));

        assertEquals(before + 3, transport.written.size());
        assertEquals("trades", mapper.readTree(transport.written.get(before)).get("type").asText());
        assertEquals("1m", mapper.readTree(transport.written.get(before + 1)).get("data").get("interval").asText());
        assertEquals(30.0, last(transport).get("data").get("half_life").asDouble());
    }

    @Test
    @DisplayName("取消订阅后不再收到事件，并释放 EWMA 登记")
    void testUnsubscribe() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = authed(transport, "alice");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":30}");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":60}");

        hub.onFrame(session, "{\"action\":\"unsubscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":30}");

        JsonNode reply = last(transport);
        assertEquals("unsubscribed", reply.get("type").asText());
        assertEquals(1, reply.get("removed").asInt());
        assertFalse(ewmaRegistry.isRegistered(new EwmaKey("BTCUSDT", "all", 30.0)));
        assertTrue(ewmaRegistry.isRegistered(new EwmaKey("BTCUSDT", "all", 60.0)));

        hub.onFrame(session, "{\"action\":\"unsubscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\"}");
        assertEquals(1, last(transport).get("removed").asInt());
        assertEquals(0, session.subscriptionCount());
    }

    @Test
    @DisplayName("取消订阅时交易所名称和交易对大小写与订阅时一样归一化")
    void testUnsubscribe_NormalizesExchangeCase() throws Exception {
        FakeTransport transport = new FakeTransport();
        ClientSession session = authed(transport, "alice");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"klines\",\"symbol\":\"btcusdt\",\"exchange\":\"Binance\",\"interval\":\"1m\"}");
        hub.onFrame(session, "{\"action\":\"subscribe\",\"stream\":\"klines\",\"symbol\":\"BTCUSDT\",\"exchange\":\"okx\",\"interval\":\"1m\"}");
        assertEquals(2, session.subscriptionCount());

        hub.onFrame(session, "{\"action\":\"unsubscribe\",\"stream\":\"klines\",\"symbol\":\"BtcUsdt\",\"exchange\":\"BINANCE\",\"interval\":\"1m\"}");

        assertEquals(1, last(transport).get("removed").asInt());
        assertEquals(1, session.subscriptionCount());
        assertEquals(0, hub.subscriberCount(new StreamTopic(StreamKind.KLINES, "BTCUSDT", "binance", "1m")));
    }

    @Test
    @DisplayName("断开连接移除所有订阅，其他连接不受影响")
    void testDisconnect_CleansUp() {
        FakeTransport t1 = new FakeTransport();
        ClientSession s1 = authed(t1, "alice");
        FakeTransport t2 = new FakeTransport();
        ClientSession s2 = authed(t2, "bob");
        hub.onFrame(s1, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\"}");
        hub.onFrame(s2, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\"}");
        hub.onFrame(s1, "{\"action\":\"subscribe\",\"stream\":\"ewma\",\"symbol\":\"BTCUSDT\",\"half_life\":5}");
        StreamTopic topic = StreamTopic.of(StreamKind.BEST_TOUCH, "BTCUSDT", "all");
        assertEquals(2, hub.subscriberCount(topic));

        hub.onDisconnect(s1);

        assertEquals(1, hub.subscriberCount(topic));
        assertEquals(1, hub.sessionCount());
        assertFalse(ewmaRegistry.isRegistered(new EwmaKey("BTCUSDT", "all", 5.0)));
        int before = t2.written.size();
        hub.onBestTouch(touch("all"));
        assertEquals(before + 1, t2.written.size());
    }

    @Test
    @DisplayName("订单更新推送给该用户的所有连接")
    void testOrderUpdate_ToOwnerSessions() throws Exception {
        FakeTransport a1 = new FakeTransport();
        authed(a1, "alice");
        FakeTransport a2 = new FakeTransport();
        authed(a2, "alice");
        FakeTransport b = new FakeTransport();
        authed(b, "bob");
        int bobBefore = b.written.size();

        hub.onOrderUpdate(new OrderSnapshot(1, null, "alice", "BTCUSDT", Side.BUY,
                100 * E8, E8, E8, 0, OrderStatus.FILLED, 1L, 2L));

        assertEquals("order", last(a1).get("type").asText());
        assertEquals("filled", last(a2).get("data").get("status").asText());
        assertEquals(bobBefore, b.written.size());
    }

    @Test
    @DisplayName("慢连接只丢自己的消息")
    void testSlowConsumer_DropsOnlyOwnMessages() {
        FakeTransport slow = new FakeTransport();
        ClientSession slowSession = authed(slow, "alice");
        FakeTransport fast = new FakeTransport();
        ClientSession fastSession = authed(fast, "bob");
        hub.onFrame(slowSession, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\"}");
        hub.onFrame(fastSession, "{\"action\":\"subscribe\",\"stream\":\"best_touch\",\"symbol\":\"BTCUSDT\"}");
        slow.writable = false;
        int fastBefore = fast.written.size();

        for (int i = 0; i < 20; i++) {
            hub.onBestTouch(touch("all"));
        }

        assertEquals(fastBefore + 20, fast.written.size());
        assertEquals(16, slowSession.pendingCount());
        assertEquals(4, slowSession.droppedCount());
        assertEquals(4, metrics.droppedOutbound());
    }
}
