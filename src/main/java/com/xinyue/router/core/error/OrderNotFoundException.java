package com.xinyue.router.core.error;

/**
 * 订单不存在或不属于当前用户
 */
public class OrderNotFoundException extends TradingException {
    public OrderNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
