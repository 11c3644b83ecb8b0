package com.xinyue.router.core.market;

/**
 * 支持的 K 线周期。桶边界按 epoch 对齐，不依赖第一笔成交时间。
 */
public enum KlineInterval {
    S1("1s", 1_000L),
    S10("10s", 10_000L),
    M1("1m", 60_000L),
    M5("5m", 300_000L);

    private final String label;
    private final long millis;

    KlineInterval(String label, long millis) {
        this.label = label;
        this.millis = millis;
    }

    public String label() {
        return label;
    }

    public long millis() {
        return millis;
    }

    /**
     * 返回包含 timestamp 的桶起点。
     */
    public long bucketStart(long timestamp) {
        return timestamp - Math.floorMod(timestamp, millis);
    }

    public static KlineInterval fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (KlineInterval interval : values()) {
            if (interval.label.equals(label)) {
                return interval;
            }
        }
        return null;
    }
}
