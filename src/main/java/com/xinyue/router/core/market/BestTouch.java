package com.xinyue.router.core.market;

/**
 * 某个交易对在某个范围（单个交易所或跨交易所 "all"）的最优买卖价快照，不可变。
 * 价格 / 数量为 0 表示该侧当前没有报价。
 *
 * @param bidExchange 最优买价来自的交易所（单交易所范围即自身）
 * @param askExchange 最优卖价来自的交易所
 * @param stale       行情连接中断后、重连收到第一笔报价前为 true
 */
public record BestTouch(String symbol,
                        String scope,
                        long bidE8,
                        long bidQtyE8,
                        long askE8,
                        long askQtyE8,
                        String bidExchange,
                        String askExchange,
                        long updatedAt,
                        boolean stale) {

    public boolean hasBid() {
        return bidE8 > 0;
    }

    public boolean hasAsk() {
        return askE8 > 0;
    }

    /**
     * 价格、数量和 stale 状态是否一致（忽略更新时间）。
     */
    public boolean samePrices(BestTouch other) {
        return other != null
                && bidE8 == other.bidE8
                && bidQtyE8 == other.bidQtyE8
                && askE8 == other.askE8
                && askQtyE8 == other.askQtyE8
                && stale == other.stale;
    }
}
