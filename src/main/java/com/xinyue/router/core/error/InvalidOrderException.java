package com.xinyue.router.core.error;

/**
 * 下单参数不合法
 */
public class InvalidOrderException extends TradingException {
    public InvalidOrderException(String message) {
        super(ErrorCode.INVALID_ORDER, message);
    }
}
