package com.xinyue.router.io.input;

/**
 * 交易所消息缺字段、字段格式错误或交易对未知。
 */
public class MalformedMessageException extends RuntimeException {
    public MalformedMessageException(String message) {
        super(message);
    }
}
