package com.xinyue.router.core.market;

/**
 * K 线桶快照（OHLCV），窗口为 [bucketStart, bucketEnd)。
 * closed=false 表示当前正在累积的桶（KlineUpdated），true 表示已经封闭（KlineClosed）。
 */
public record KlineBucket(String symbol,
                          String scope,
                          KlineInterval interval,
                          long openE8,
                          long highE8,
                          long lowE8,
                          long closeE8,
                          long volumeE8,
                          long bucketStart,
                          long bucketEnd,
                          boolean closed) {
}
