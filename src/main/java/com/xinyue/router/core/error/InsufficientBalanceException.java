package com.xinyue.router.core.error;

/**
 * 可用余额不足
 */
public class InsufficientBalanceException extends TradingException {
    public InsufficientBalanceException(String message) {
        super(ErrorCode.INSUFFICIENT_BALANCE, message);
    }
}
