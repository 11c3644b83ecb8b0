package com.xinyue.router.common;

public enum CoreEventType {
    NONE,
    QUOTE_TICK,          // 最优买卖价更新（bookTicker / tickers）
    TRADE_TICK,          // 逐笔成交
    FEED_STALE,          // 交易所连接断开，该交易所行情进入 stale 状态
    TIMER                // 每秒时钟，用于推进 K 线边界
}
