package com.xinyue.router.hub;

import com.xinyue.router.core.market.EwmaKey;
import com.xinyue.router.core.market.KlineInterval;

/**
 * 一条已校验的订阅：流类型 + 交易对 + 范围，K 线带周期，EWMA 带半衰期。
 */
public record StreamSpec(StreamKind kind, String symbol, String scope, KlineInterval interval, double halfLifeSeconds) {

    public static StreamSpec bestTouch(String symbol, String scope) {
        return new StreamSpec(StreamKind.BEST_TOUCH, symbol, scope, null, 0);
    }

    public static StreamSpec trades(String symbol, String scope) {
        return new StreamSpec(StreamKind.TRADES, symbol, scope, null, 0);
    }

    public static StreamSpec klines(String symbol, String scope, KlineInterval interval) {
        return new StreamSpec(StreamKind.KLINES, symbol, scope, interval, 0);
    }

    public static StreamSpec ewma(String symbol, String scope, double halfLifeSeconds) {
        return new StreamSpec(StreamKind.EWMA, symbol, scope, null, halfLifeSeconds);
    }

    public StreamTopic topic() {
        return switch (kind) {
            case BEST_TOUCH, TRADES -> StreamTopic.of(kind, symbol, scope);
            case KLINES -> new StreamTopic(kind, symbol, scope, interval.label());
            case EWMA -> new StreamTopic(kind, symbol, scope, StreamTopic.halfLifeParam(halfLifeSeconds));
        };
    }

    /**
     * 只对 EWMA 订阅有意义。
     */
    public EwmaKey ewmaKey() {
        return new EwmaKey(symbol, scope, halfLifeSeconds);
    }
}
