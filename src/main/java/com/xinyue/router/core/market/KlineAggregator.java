package com.xinyue.router.core.market;

import org.agrona.collections.Long2ObjectHashMap;

/**
 * 按 (交易对, 范围, 周期) 维护唯一一个正在累积的 K 线桶。
 * <p>
 * 规则：
 * 1. 桶边界按 epoch 对齐；
 * 2. 成交时间落在当前窗口内则更新当前桶，否则封闭当前桶并开启下一个；
 * 3. 中间没有成交的窗口用上一根收盘价生成零成交量的平桶，保证同一序列在时间上无缝、无重叠；
 * 4. 时钟事件在没有成交时也推进边界，但只推进到 now - closeGraceMs：
 *    成交带的是交易所时间，时钟是本机时间，留出网络延迟和时钟偏差的余量。
 * <p>
 * 非线程安全，只在聚合引擎的消费线程里访问。
 */
public final class KlineAggregator {

    private static final KlineInterval[] INTERVALS = KlineInterval.values();

    private final Long2ObjectHashMap<OpenBucket> buckets = new Long2ObjectHashMap<>();
    private final long closeGraceMs;

    public KlineAggregator(long closeGraceMs) {
        if (closeGraceMs < 0) {
            throw new IllegalArgumentException("closeGraceMs 不能为负数: " + closeGraceMs);
        }
        this.closeGraceMs = closeGraceMs;
    }

    /**
     * 用一笔成交更新该范围下所有周期的桶。
     *
     * @param scopeId 0 表示跨交易所 "all"，否则为交易所 id
     * @return 因为桶已被时钟封闭而没有计入的周期数，0 表示全部计入
     */
    public int onTrade(short symbolId, String symbol, short scopeId, String scope,
                       long priceE8, long qtyE8, long timestamp, MarketEventListener listener) {
        int late = 0;
        for (KlineInterval interval : INTERVALS) {
            long key = seriesKey(symbolId, scopeId, interval);
            OpenBucket bucket = buckets.get(key);
            if (bucket == null) {
                bucket = new OpenBucket(symbol, scope, interval, interval.bucketStart(timestamp), priceE8);
                buckets.put(key, bucket);
            } else if (timestamp >= bucket.end) {
                roll(bucket, timestamp, listener);
            } else if (timestamp < bucket.start) {
                // 超过宽限期才到达，所属的桶已经发布为 closed，不再回写
                late++;
                continue;
            }
            bucket.apply(priceE8, qtyE8);
            listener.onKline(bucket.snapshot(false));
        }
        return late;
    }

    /**
     * 时钟推进：结束时间不晚于 now - closeGraceMs 的桶封闭并开启新桶。
     */
    public void onClock(long now, MarketEventListener listener) {
        long cutoff = now - closeGraceMs;
        for (OpenBucket bucket : buckets.values()) {
            if (cutoff >= bucket.end) {
                roll(bucket, cutoff, listener);
                listener.onKline(bucket.snapshot(false));
            }
        }
    }

    public long closeGraceMs() {
        return closeGraceMs;
    }

    /**
     * 返回当前正在累积的桶，测试和诊断使用。
     */
    public KlineBucket openBucket(short symbolId, short scopeId, KlineInterval interval) {
        OpenBucket bucket = buckets.get(seriesKey(symbolId, scopeId, interval));
        return bucket == null ? null : bucket.snapshot(false);
    }

    private static void roll(OpenBucket bucket, long target, MarketEventListener listener) {
        while (target >= bucket.end) {
            listener.onKline(bucket.snapshot(true));
            bucket.resetFlat(bucket.end);
        }
    }

    private static long seriesKey(short symbolId, short scopeId, KlineInterval interval) {
        return ((long) symbolId << 24) | ((long) (scopeId & 0xFFFF) << 8) | interval.ordinal();
    }

    private static final class OpenBucket {
        final String symbol;
        final String scope;
        final KlineInterval interval;
        long start;
        long end;
        long open;
        long high;
        long low;
        long close;
        long volume;

        OpenBucket(String symbol, String scope, KlineInterval interval, long start, long firstPriceE8) {
            this.symbol = symbol;
            this.scope = scope;
            this.interval = interval;
            this.start = start;
            this.end = start + interval.millis();
            this.open = firstPriceE8;
            this.high = firstPriceE8;
            this.low = firstPriceE8;
            this.close = firstPriceE8;
        }

        void apply(long priceE8, long qtyE8) {
            if (priceE8 > high) {
                high = priceE8;
            }
            if (priceE8 < low) {
                low = priceE8;
            }
            close = priceE8;
            volume += qtyE8;
        }

        void resetFlat(long newStart) {
            start = newStart;
            end = newStart + interval.millis();
            open = close;
            high = close;
            low = close;
            volume = 0;
        }

        KlineBucket snapshot(boolean closed) {
            return new KlineBucket(symbol, scope, interval, open, high, low, close, volume, start, end, closed);
        }
    }
}
