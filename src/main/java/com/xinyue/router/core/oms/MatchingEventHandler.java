package com.xinyue.router.core.oms;

import com.lmax.disruptor.EventHandler;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.market.BestTouchBook;
import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 撮合引擎在 Disruptor 上的消费者，与聚合引擎并行读取同一个 RingBuffer。
 * 自己维护一份合并盘口，不依赖聚合引擎的任何状态。
 */
public final class MatchingEventHandler implements EventHandler<CoreEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(MatchingEventHandler.class);

    private final SymbolRegistry symbolRegistry;
    private final OrderManagementSystem oms;
    private final BestTouchBook book = new BestTouchBook();

    public MatchingEventHandler(SymbolRegistry symbolRegistry, OrderManagementSystem oms) {
        this.symbolRegistry = symbolRegistry;
        this.oms = oms;
    }

    @Override
    public void onEvent(CoreEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.type) {
                case QUOTE_TICK -> {
                    String symbol = symbolRegistry.getSymbol(event.symbolId);
                    if (symbol == null) {
                        return;
                    }
                    book.applyQuote(event.symbolId, symbol, Exchange.fromId(event.exchangeId),
                            event.bidPriceE8, event.bidQtyE8, event.askPriceE8, event.askQtyE8, event.timestamp);
                    oms.onTouch(event.symbolId, book.consolidated(event.symbolId));
                }
                case FEED_STALE -> {
                    IntArrayList affected = book.markStale(Exchange.fromId(event.exchangeId));
                    for (int i = 0; i < affected.size(); i++) {
                        short symbolId = (short) affected.getInt(i);
                        oms.onTouch(symbolId, book.consolidated(symbolId));
                    }
                }
                default -> {
                }
            }
        } catch (Throwable t) {
            LOG.error("撮合引擎处理事件失败: {}", event, t);
        }
    }
}
