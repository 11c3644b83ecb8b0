package com.xinyue.router.core.oms;

/**
 * 订单状态变化回调（新建、部分成交、完全成交、撤销）。
 * 在撮合锁内同步调用，实现方不能阻塞。
 */
public interface OrderEventListener {

    OrderEventListener NOOP = order -> {
    };

    void onOrderUpdate(OrderSnapshot order);
}
