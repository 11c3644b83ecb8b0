package com.xinyue.router.core.position;

/**
 * 对外返回的余额快照。
 */
public record Balance(String asset, long totalE8, long availableE8) {

    public static Balance empty(String asset) {
        return new Balance(asset, 0, 0);
    }
}
