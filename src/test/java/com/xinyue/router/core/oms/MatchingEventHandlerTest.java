package com.xinyue.router.core.oms;

import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.CoreEventType;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.Side;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.position.PositionManager;
import com.xinyue.router.infra.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("撮合消费者测试")
class MatchingEventHandlerTest {

    private static final long E8 = 100_000_000L;

    private SymbolRegistry symbols;
    private OrderManagementSystem oms;
    private MatchingEventHandler handler;
    private short btc;

    @BeforeEach
    void setUp() {
        symbols = new SymbolRegistry(List.of("BTCUSDT"));
        oms = new OrderManagementSystem(symbols, new PositionManager(), new MetricsService());
        handler = new MatchingEventHandler(symbols, oms);
        btc = symbols.get("BTCUSDT");
        oms.deposit("alice", "USDT", 10_000 * E8);
    }

    private void quote(Exchange exchange, long bid, long ask, long qty) {
        CoreEvent event = new CoreEvent();
        event.reset();
        event.exchangeId = exchange.id();
        event.symbolId = btc;
        event.setQuote(bid, qty, ask, qty);
        handler.onEvent(event, 0, true);
    }

    @Test
    @DisplayName("用跨交易所合并后的最优卖价撮合买单")
    void testConsolidatedAsk_FillsBuy() {
        OrderSnapshot order = oms.submitOrder("alice", "BTCUSDT", Side.BUY, 100 * E8, E8);

        quote(Exchange.BINANCE, 98 * E8, 101 * E8, E8);
        assertEquals(OrderStatus.OPEN, oms.getOrder("alice", order.orderId()).status());

        quote(Exchange.OKX, 99 * E8, 100 * E8, E8);
        assertEquals(OrderStatus.FILLED, oms.getOrder("alice", order.orderId()).status());
    }

    @Test
    @DisplayName("交易所断线后其报价不再用于成交")
    void testFeedStale_RemovesLiquidity() {
        quote(Exchange.OKX, 99 * E8, 100 * E8, 10 * E8);
        quote(Exchange.BINANCE, 98 * E8, 105 * E8, 10 * E8);

        CoreEvent stale = new CoreEvent();
        stale.reset();
        stale.type = CoreEventType.FEED_STALE;
        stale.exchangeId = Exchange.OKX.id();
        handler.onEvent(stale, 1, true);

        OrderSnapshot order = oms.submitOrder("alice", "BTCUSDT", Side.BUY, 100 * E8, E8);
        assertEquals(OrderStatus.OPEN, order.status());
    }
}
