package com.xinyue.router.core.market;

/**
 * 透传给订阅者的逐笔成交。scope 为 "all" 时是所有交易所成交的合并流。
 */
public record TradePrint(String symbol,
                         String scope,
                         String exchange,
                         long priceE8,
                         long qtyE8,
                         long timestamp) {
}
