package com.xinyue.router.core.market;

/**
 * 一条 EWMA 序列的计算键：交易对 + 范围 + 半衰期（秒）。
 * 订阅时解析一次，之后按键路由，不再逐事件解析订阅参数。
 */
public record EwmaKey(String symbol, String scope, double halfLifeSeconds) {
}
