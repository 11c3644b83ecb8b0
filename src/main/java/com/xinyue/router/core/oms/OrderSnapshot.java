package com.xinyue.router.core.oms;

import com.xinyue.router.common.Side;

/**
 * 订单的不可变快照：REST 返回、推送和持久化都用它。
 */
public record OrderSnapshot(long orderId,
                            String clientOrderId,
                            String userId,
                            String symbol,
                            Side side,
                            long priceE8,
                            long quantityE8,
                            long filledQuantityE8,
                            long reservedE8,
                            OrderStatus status,
                            long createdAt,
                            long updatedAt) {
}
