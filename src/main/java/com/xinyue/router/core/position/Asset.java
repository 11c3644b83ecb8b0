package com.xinyue.router.core.position;

/**
 * 单个资产的余额，放大 1e8 存储（例如 1.5 BTC = 150_000_000）。
 * total = available + locked，locked 为挂单冻结部分。
 */
public final class Asset {
    public long available;
    public long locked;

    public long total() {
        return available + locked;
    }
}
