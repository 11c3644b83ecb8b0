package com.xinyue.router.common;

/**
 * 热路径中流转的核心事件载体，即归一化之后的 Tick。
 * <p>
 * 特性：
 * 1. 预分配内存，RingBuffer 槽位复用
 * 2. 联合体模式: 一个对象复用于报价、成交和控制事件
 * 3. 公有字段: 减少方法调用开销
 * <p>
 * 生产者（L1）在 publish 之前写入一次，之后聚合引擎和撮合引擎两个消费者只读，不允许修改。
 */
public final class CoreEvent {

    // === 元数据 ===
    public long timestamp;      // 事件发生时间 (Exchange TS, epoch ms)
    public long recvTime;       // 网关接收时间 (Local TS, epoch ms)
    public CoreEventType type;

    // === 路由信息 ===
    public short exchangeId;    // 交易所 ID
    public short symbolId;      // 交易对 ID（控制事件为 0）

    // === 报价 (QUOTE_TICK) ===
    public long bidPriceE8;
    public long bidQtyE8;
    public long askPriceE8;
    public long askQtyE8;

    // === 成交 (TRADE_TICK) ===
    public long tradePriceE8;
    public long tradeQtyE8;

    /**
     * 在 Producer (L1) 写入前必须调用，防止脏数据污染
     */
    public void reset() {
        type = CoreEventType.NONE;
        timestamp = 0;
        recvTime = 0;
        exchangeId = 0;
        symbolId = 0;
        bidPriceE8 = 0;
        bidQtyE8 = 0;
        askPriceE8 = 0;
        askQtyE8 = 0;
        tradePriceE8 = 0;
        tradeQtyE8 = 0;
    }

    public void setQuote(long bidPriceE8, long bidQtyE8, long askPriceE8, long askQtyE8) {
        this.type = CoreEventType.QUOTE_TICK;
        this.bidPriceE8 = bidPriceE8;
        this.bidQtyE8 = bidQtyE8;
        this.askPriceE8 = askPriceE8;
        this.askQtyE8 = askQtyE8;
    }

    public void setTrade(long priceE8, long qtyE8) {
        this.type = CoreEventType.TRADE_TICK;
        this.tradePriceE8 = priceE8;
        this.tradeQtyE8 = qtyE8;
    }

    @Override
    public String toString() {
        return "CoreEvent{type=" + type
                + ", exchangeId=" + exchangeId
                + ", symbolId=" + symbolId
                + ", ts=" + timestamp
                + ", bid=" + bidPriceE8 + "x" + bidQtyE8
                + ", ask=" + askPriceE8 + "x" + askQtyE8
                + ", trade=" + tradePriceE8 + "x" + tradeQtyE8
                + '}';
    }
}
