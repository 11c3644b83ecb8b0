package com.xinyue.router.core.oms;

import it.unimi.dsi.fastutil.longs.Long2ObjectRBTreeMap;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个交易对的撮合状态：按订单 ID 升序排列的挂单队列 + 当前合并盘口的剩余可成交量。
 * <p>
 * 所有字段只能在持有 {@link #lock} 时访问。
 * 每个报价 tick 刷新盘口价格和数量；同一 tick 的数量按订单 ID 顺序被消耗，直到下一个 tick 到来。
 */
final class SymbolMatchingState {

    final short symbolId;
    final String symbol;
    final String baseAsset;
    final String quoteAsset;
    final ReentrantLock lock = new ReentrantLock();

    // orderId -> Order，RBTree 保证升序遍历即提交顺序
    final Long2ObjectRBTreeMap<Order> resting = new Long2ObjectRBTreeMap<>();

    long bidE8;
    long bidQtyLeftE8;
    long askE8;
    long askQtyLeftE8;

    SymbolMatchingState(short symbolId, String symbol, String baseAsset, String quoteAsset) {
        this.symbolId = symbolId;
        this.symbol = symbol;
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
    }

    void refillTouch(long bidE8, long bidQtyE8, long askE8, long askQtyE8) {
        this.bidE8 = bidE8;
        this.bidQtyLeftE8 = bidE8 > 0 ? bidQtyE8 : 0;
        this.askE8 = askE8;
        this.askQtyLeftE8 = askE8 > 0 ? askQtyE8 : 0;
    }

    /**
     * 计算订单在当前盘口下可成交的数量，0 表示不可成交。
     */
    long executableQty(Order order) {
        long remaining = order.getRemainingQtyE8();
        if (remaining <= 0) {
            return 0;
        }
        return switch (order.side) {
            case BUY -> askE8 > 0 && order.priceE8 >= askE8 ? Math.min(remaining, askQtyLeftE8) : 0;
            case SELL -> bidE8 > 0 && order.priceE8 <= bidE8 ? Math.min(remaining, bidQtyLeftE8) : 0;
        };
    }

    void consume(Order order, long qtyE8) {
        switch (order.side) {
            case BUY -> askQtyLeftE8 -= qtyE8;
            case SELL -> bidQtyLeftE8 -= qtyE8;
        }
    }

    boolean hasLiquidity() {
        return bidQtyLeftE8 > 0 || askQtyLeftE8 > 0;
    }
}
