package com.xinyue.router.hub;

/**
 * 路由键。订阅时由 {@link StreamSpec} 解析一次，事件侧按同样的规则构造后直接查表。
 *
 * @param param K 线为周期标签，EWMA 为半衰期，其余为空串
 */
public record StreamTopic(StreamKind kind, String symbol, String scope, String param) {

    public static StreamTopic of(StreamKind kind, String symbol, String scope) {
        return new StreamTopic(kind, symbol, scope, "");
    }

    public static String halfLifeParam(double halfLifeSeconds) {
        return Double.toString(halfLifeSeconds);
    }
}
