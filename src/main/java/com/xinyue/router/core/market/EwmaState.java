package com.xinyue.router.core.market;

/**
 * 单条 EWMA 序列的状态。按时间衰减而不是按笔数衰减：
 * <pre>
 *     α  = 2^(-(t - t0) / h)
 *     v' = α * v + (1 - α) * p
 * </pre>
 * 第一笔成交直接初始化 v = p。
 */
public final class EwmaState {

    private final double halfLifeSeconds;
    private double value;
    private long lastTimestamp;
    private boolean initialized;

    public EwmaState(double halfLifeSeconds) {
        if (!(halfLifeSeconds > 0)) {
            throw new IllegalArgumentException("halfLife 必须大于 0: " + halfLifeSeconds);
        }
        this.halfLifeSeconds = halfLifeSeconds;
    }

    /**
     * 计算经过 elapsedMs 之后旧值保留的权重。
     */
    public static double decayFactor(long elapsedMs, double halfLifeSeconds) {
        if (elapsedMs <= 0) {
            return 1.0;
        }
        return Math.pow(2.0, -(elapsedMs / 1000.0) / halfLifeSeconds);
    }

    /**
     * 用一笔成交更新，返回新值。调用方保证 timestamp 严格递增。
     */
    public double update(double price, long timestamp) {
        if (!initialized) {
            value = price;
            initialized = true;
        } else {
            double alpha = decayFactor(timestamp - lastTimestamp, halfLifeSeconds);
            value = alpha * value + (1.0 - alpha) * price;
        }
        lastTimestamp = timestamp;
        return value;
    }

    public boolean initialized() {
        return initialized;
    }

    public double value() {
        return value;
    }

    public long lastTimestamp() {
        return lastTimestamp;
    }

    public double halfLifeSeconds() {
        return halfLifeSeconds;
    }
}
