package com.xinyue.router.core.error;

/**
 * 交易相关的业务异常基类，携带错误码。
 */
public class TradingException extends RuntimeException {

    private final ErrorCode code;

    public TradingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
