package com.xinyue.router.core.error;

/**
 * 订单已是终态（已成交或已撤销）
 */
public class AlreadyTerminalException extends TradingException {
    public AlreadyTerminalException(String message) {
        super(ErrorCode.ALREADY_TERMINAL, message);
    }
}
