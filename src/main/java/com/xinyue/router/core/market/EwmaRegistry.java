package com.xinyue.router.core.market;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 订阅方请求的 EWMA 半衰期登记表（引用计数）。
 * <p>
 * 半衰期是订阅参数而不是全局配置：订阅中心在 subscribe / 断开时登记和注销，
 * 聚合引擎在每笔成交时读取当前登记的半衰期集合，各自独立计算。
 * 线程模型：登记在 IO 线程，读取在聚合线程，使用并发容器，读取为弱一致。
 */
public final class EwmaRegistry {

    private final ConcurrentHashMap<String, ConcurrentHashMap<Double, Integer>> halfLivesByScope =
            new ConcurrentHashMap<>();

    public void register(EwmaKey key) {
        halfLivesByScope
                .computeIfAbsent(scopeKey(key.symbol(), key.scope()), k -> new ConcurrentHashMap<>())
                .merge(key.halfLifeSeconds(), 1, Integer::sum);
    }

    public void unregister(EwmaKey key) {
        ConcurrentHashMap<Double, Integer> halfLives = halfLivesByScope.get(scopeKey(key.symbol(), key.scope()));
        if (halfLives == null) {
            return;
        }
        halfLives.computeIfPresent(key.halfLifeSeconds(), (h, count) -> count <= 1 ? null : count - 1);
    }

    public boolean isRegistered(EwmaKey key) {
        ConcurrentHashMap<Double, Integer> halfLives = halfLivesByScope.get(scopeKey(key.symbol(), key.scope()));
        return halfLives != null && halfLives.containsKey(key.halfLifeSeconds());
    }

    /**
     * 某交易对 + 范围当前登记的所有半衰期。
     */
    public Set<Double> halfLives(String symbol, String scope) {
        ConcurrentHashMap<Double, Integer> halfLives = halfLivesByScope.get(scopeKey(symbol, scope));
        return halfLives == null ? Collections.emptySet() : halfLives.keySet();
    }

    private static String scopeKey(String symbol, String scope) {
        return symbol + '|' + scope;
    }
}
