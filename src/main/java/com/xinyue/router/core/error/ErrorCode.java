package com.xinyue.router.core.error;

/**
 * 对外暴露的错误码，REST 与 WebSocket 使用同一套。
 */
public enum ErrorCode {
    INVALID_ORDER(400),
    INSUFFICIENT_BALANCE(400),
    UNAUTHORIZED(401),
    NOT_FOUND(404),
    ALREADY_TERMINAL(409);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
