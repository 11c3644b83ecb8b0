package com.xinyue.router.core.oms;

import com.xinyue.router.common.Side;

/**
 * 订单对象，追踪订单全生命周期。
 * <p>
 * 可变字段（filledQtyE8 / reservedE8 / status / updateTime）只能在持有所属用户分片锁时修改，
 * 对外一律通过 {@link #snapshot()} 输出不可变快照。
 */
public final class Order {

    // === 身份标识 ===
    public final long orderId;          // 引擎分配，单调递增，也是撮合优先级
    public final String clientOrderId;  // 客户端自带 ID，可为空，同一用户内唯一
    public final String userId;
    public final short symbolId;
    public final String symbol;

    // === 订单属性 ===
    public final Side side;
    public final long priceE8;
    public final long qtyE8;
    public long filledQtyE8;
    public long reservedE8;             // 剩余冻结：买单为报价资产，卖单为基础资产
    public OrderStatus status = OrderStatus.OPEN;

    // === 时间戳 ===
    public final long createTime;
    public long updateTime;

    public Order(long orderId, String clientOrderId, String userId, short symbolId, String symbol,
                 Side side, long priceE8, long qtyE8, long reservedE8, long createTime) {
        this.orderId = orderId;
        this.clientOrderId = clientOrderId;
        this.userId = userId;
        this.symbolId = symbolId;
        this.symbol = symbol;
        this.side = side;
        this.priceE8 = priceE8;
        this.qtyE8 = qtyE8;
        this.reservedE8 = reservedE8;
        this.createTime = createTime;
        this.updateTime = createTime;
    }

    /**
     * 是否还可以成交或撤销。
     */
    public boolean isActive() {
        return !status.isTerminal();
    }

    public long getRemainingQtyE8() {
        return qtyE8 - filledQtyE8;
    }

    public OrderSnapshot snapshot() {
        return new OrderSnapshot(orderId, clientOrderId, userId, symbol, side,
                priceE8, qtyE8, filledQtyE8, reservedE8, status, createTime, updateTime);
    }
}
