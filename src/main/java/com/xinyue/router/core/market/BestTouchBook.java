package com.xinyue.router.core.market;

import com.xinyue.router.common.Exchange;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.IntArrayList;

/**
 * 维护每个交易对、每个交易所的最优报价，并计算跨交易所的合并盘口。
 * <p>
 * 合并盘口：所有「已知且未 stale」交易所中的最高买价和最低卖价，两侧独立选取（可以来自不同交易所）；
 * 同价位的多家交易所数量相加。从未收到过报价的交易所不参与计算。
 * <p>
 * 非线程安全：聚合引擎和撮合引擎各自持有一份，只在各自的消费线程里访问。
 */
public final class BestTouchBook {

    private final Int2ObjectHashMap<SymbolQuotes> bySymbol = new Int2ObjectHashMap<>();

    /**
     * 应用一笔报价，返回该交易所范围的新快照。
     */
    public BestTouch applyQuote(short symbolId, String symbol, Exchange exchange,
                                long bidE8, long bidQtyE8, long askE8, long askQtyE8, long timestamp) {
        SymbolQuotes quotes = bySymbol.computeIfAbsent(symbolId, k -> new SymbolQuotes(symbolId, symbol));
        ExchangeQuote quote = quotes.quotes[exchange.id()];
        if (quote == null) {
            quote = new ExchangeQuote();
            quotes.quotes[exchange.id()] = quote;
        }
        quote.known = true;
        quote.stale = false;
        quote.bidE8 = bidE8 > 0 ? bidE8 : 0;
        quote.bidQtyE8 = bidE8 > 0 ? bidQtyE8 : 0;
        quote.askE8 = askE8 > 0 ? askE8 : 0;
        quote.askQtyE8 = askE8 > 0 ? askQtyE8 : 0;
        quote.updatedAt = timestamp;
        return snapshot(symbol, exchange, quote);
    }

    /**
     * 标记某交易所所有交易对为 stale，返回受影响的 symbolId。
     */
    public IntArrayList markStale(Exchange exchange) {
        IntArrayList affected = new IntArrayList();
        for (SymbolQuotes quotes : bySymbol.values()) {
            ExchangeQuote quote = quotes.quotes[exchange.id()];
            if (quote != null && quote.known && !quote.stale) {
                quote.stale = true;
                affected.addInt(quotes.symbolId);
            }
        }
        return affected;
    }

    /**
     * 返回某交易所范围的快照，没有收到过报价时返回 null。
     */
    public BestTouch exchangeTouch(short symbolId, Exchange exchange) {
        SymbolQuotes quotes = bySymbol.get(symbolId);
        if (quotes == null) {
            return null;
        }
        ExchangeQuote quote = quotes.quotes[exchange.id()];
        return quote == null || !quote.known ? null : snapshot(quotes.symbol, exchange, quote);
    }

    /**
     * 计算合并盘口，没有任何交易所报价时返回 null。
     */
    public BestTouch consolidated(short symbolId) {
        SymbolQuotes quotes = bySymbol.get(symbolId);
        if (quotes == null) {
            return null;
        }
        long bestBid = 0;
        long bestBidQty = 0;
        String bidExchange = null;
        long bestAsk = 0;
        long bestAskQty = 0;
        String askExchange = null;
        long updatedAt = 0;
        boolean anyLive = false;

        for (Exchange exchange : Exchange.values()) {
            ExchangeQuote quote = quotes.quotes[exchange.id()];
            if (quote == null || !quote.known || quote.stale) {
                continue;
            }
            anyLive = true;
            updatedAt = Math.max(updatedAt, quote.updatedAt);
            if (quote.bidE8 > 0) {
                if (quote.bidE8 > bestBid) {
                    bestBid = quote.bidE8;
                    bestBidQty = quote.bidQtyE8;
                    bidExchange = exchange.wireName();
                } else if (quote.bidE8 == bestBid) {
                    bestBidQty += quote.bidQtyE8;
                }
            }
            if (quote.askE8 > 0) {
                if (bestAsk == 0 || quote.askE8 < bestAsk) {
                    bestAsk = quote.askE8;
                    bestAskQty = quote.askQtyE8;
                    askExchange = exchange.wireName();
                } else if (quote.askE8 == bestAsk) {
                    bestAskQty += quote.askQtyE8;
                }
            }
        }
        if (!anyLive) {
            // 所有交易所都断开：对外保留一个空的 stale 快照
            return new BestTouch(quotes.symbol, Exchange.ALL_SCOPE, 0, 0, 0, 0, null, null, 0, true);
        }
        return new BestTouch(quotes.symbol, Exchange.ALL_SCOPE,
                bestBid, bestBidQty, bestAsk, bestAskQty, bidExchange, askExchange, updatedAt, false);
    }

    private static BestTouch snapshot(String symbol, Exchange exchange, ExchangeQuote quote) {
        return new BestTouch(symbol, exchange.wireName(),
                quote.bidE8, quote.bidQtyE8, quote.askE8, quote.askQtyE8,
                exchange.wireName(), exchange.wireName(), quote.updatedAt, quote.stale);
    }

    private static final class SymbolQuotes {
        final short symbolId;
        final String symbol;
        final ExchangeQuote[] quotes = new ExchangeQuote[Exchange.values().length + 1];

        SymbolQuotes(short symbolId, String symbol) {
            this.symbolId = symbolId;
            this.symbol = symbol;
        }
    }

    private static final class ExchangeQuote {
        boolean known;
        boolean stale;
        long bidE8;
        long bidQtyE8;
        long askE8;
        long askQtyE8;
        long updatedAt;
    }
}
