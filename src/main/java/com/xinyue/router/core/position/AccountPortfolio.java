package com.xinyue.router.core.position;

import java.util.Map;
import java.util.TreeMap;

/**
 * 单个用户的资产账本。只能在持有该用户分片锁时读写。
 */
public final class AccountPortfolio {
    public final String userId;

    // 资产名 -> Asset，按名称排序便于输出
    private final Map<String, Asset> assets = new TreeMap<>();

    public AccountPortfolio(String userId) {
        this.userId = userId;
    }

    /**
     * 获取资产对象，没有时自动创建一个空的（避免空指针）。
     */
    public Asset getAsset(String asset) {
        return assets.computeIfAbsent(asset, k -> new Asset());
    }

    public Asset peekAsset(String asset) {
        return assets.get(asset);
    }

    public Map<String, Asset> assets() {
        return assets;
    }
}
