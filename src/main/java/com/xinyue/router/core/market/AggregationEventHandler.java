package com.xinyue.router.core.market;

import com.lmax.disruptor.EventHandler;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.ScaleConstants;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.infra.MetricsService;
import org.agrona.collections.IntArrayList;
import org.agrona.collections.Long2LongHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 聚合引擎：Disruptor 上的第一个独立消费者。
 * <p>
 * 维护最优买卖价、K 线桶和 EWMA，并把派生事件交给 {@link MarketEventListener}。
 * 所有状态只在本消费线程里修改，同一交易对的 tick 严格按 RingBuffer 顺序应用。
 */
public final class AggregationEventHandler implements EventHandler<CoreEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEventHandler.class);

    private static final short ALL_SCOPE_ID = 0;

    private final SymbolRegistry symbolRegistry;
    private final EwmaRegistry ewmaRegistry;
    private final MetricsService metricsService;
    private final MarketEventListener listener;

    private final BestTouchBook book = new BestTouchBook();
    private final KlineAggregator klines;
    private final Map<EwmaKey, EwmaState> ewmaStates = new HashMap<>();
    // (symbolId, scopeId) -> 该范围最近一笔被接受的成交时间
    private final Long2LongHashMap lastTradeTs = new Long2LongHashMap(Long.MIN_VALUE);

    public AggregationEventHandler(SymbolRegistry symbolRegistry,
                                   EwmaRegistry ewmaRegistry,
                                   MetricsService metricsService,
                                   MarketEventListener listener,
                                   long klineCloseGraceMs) {
        this.symbolRegistry = symbolRegistry;
        this.ewmaRegistry = ewmaRegistry;
        this.metricsService = metricsService;
        this.listener = listener;
        this.klines = new KlineAggregator(klineCloseGraceMs);
    }

    @Override
    public void onEvent(CoreEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.type) {
                case QUOTE_TICK -> onQuote(event);
                case TRADE_TICK -> onTrade(event);
                case FEED_STALE -> onFeedStale(Exchange.fromId(event.exchangeId));
                case TIMER -> onClock(event.timestamp);
                default -> {
                }
            }
        } catch (Throwable t) {
            LOG.error("聚合引擎处理事件失败: {}", event, t);
        }
    }

    private void onQuote(CoreEvent event) {
        String symbol = symbolRegistry.getSymbol(event.symbolId);
        if (symbol == null) {
            return;
        }
        Exchange exchange = Exchange.fromId(event.exchangeId);
        BestTouch before = book.consolidated(event.symbolId);
        BestTouch touch = book.applyQuote(event.symbolId, symbol, exchange,
                event.bidPriceE8, event.bidQtyE8, event.askPriceE8, event.askQtyE8, event.timestamp);
        listener.onBestTouch(touch);

        BestTouch consolidated = book.consolidated(event.symbolId);
        if (!consolidated.samePrices(before)) {
            listener.onBestTouch(consolidated);
        }
    }

    private void onTrade(CoreEvent event) {
        String symbol = symbolRegistry.getSymbol(event.symbolId);
        if (symbol == null) {
            return;
        }
        Exchange exchange = Exchange.fromId(event.exchangeId);
        listener.onTrade(new TradePrint(symbol, exchange.wireName(), exchange.wireName(),
                event.tradePriceE8, event.tradeQtyE8, event.timestamp));
        listener.onTrade(new TradePrint(symbol, Exchange.ALL_SCOPE, exchange.wireName(),
                event.tradePriceE8, event.tradeQtyE8, event.timestamp));

        applyTrade(event, symbol, exchange.id(), exchange.wireName());
        applyTrade(event, symbol, ALL_SCOPE_ID, Exchange.ALL_SCOPE);
    }

    private void applyTrade(CoreEvent event, String symbol, short scopeId, String scope) {
        long scopeKey = ((long) event.symbolId << 16) | (scopeId & 0xFFFF);
        long last = lastTradeTs.get(scopeKey);
        if (event.timestamp <= last) {
            // 乱序或重复：对 K 线 / EWMA 忽略，不报错
            metricsService.recordIgnoredTrade();
            return;
        }
        lastTradeTs.put(scopeKey, event.timestamp);

        int late = klines.onTrade(event.symbolId, symbol, scopeId, scope,
                event.tradePriceE8, event.tradeQtyE8, event.timestamp, listener);
        if (late > 0) {
            metricsService.recordLateKlineTrade(scope);
            LOG.debug("{} {} 成交迟到超过宽限期，{} 个周期未计入: ts={}", scope, symbol, late, event.timestamp);
        }

        double price = ScaleConstants.toDouble(event.tradePriceE8);
        for (Double halfLife : ewmaRegistry.halfLives(symbol, scope)) {
            EwmaKey key = new EwmaKey(symbol, scope, halfLife);
            EwmaState state = ewmaStates.computeIfAbsent(key, k -> new EwmaState(k.halfLifeSeconds()));
            double value = state.update(price, event.timestamp);
            listener.onEwma(new EwmaUpdate(key, value, event.timestamp));
        }
    }

    private void onFeedStale(Exchange exchange) {
        IntArrayList affected = book.markStale(exchange);
        for (int i = 0; i < affected.size(); i++) {
            short symbolId = (short) affected.getInt(i);
            listener.onBestTouch(book.exchangeTouch(symbolId, exchange));
            listener.onBestTouch(book.consolidated(symbolId));
        }
        LOG.info("{} 行情中断，{} 个交易对标记为 stale", exchange.wireName(), affected.size());
    }

    private void onClock(long now) {
        klines.onClock(now, listener);
        // 最后一个订阅者离开后丢弃对应的 EWMA 状态
        Iterator<EwmaKey> it = ewmaStates.keySet().iterator();
        while (it.hasNext()) {
            if (!ewmaRegistry.isRegistered(it.next())) {
                it.remove();
            }
        }
    }

    /**
     * 测试和诊断使用：当前合并盘口。
     */
    BestTouch consolidated(short symbolId) {
        return book.consolidated(symbolId);
    }

    KlineAggregator klines() {
        return klines;
    }
}
