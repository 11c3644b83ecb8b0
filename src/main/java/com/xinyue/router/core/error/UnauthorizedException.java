package com.xinyue.router.core.error;

/**
 * 未认证或凭证无效
 */
public class UnauthorizedException extends TradingException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
