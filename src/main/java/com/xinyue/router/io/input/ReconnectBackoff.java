package com.xinyue.router.io.input;

/**
 * 指数退避：每次失败延迟翻倍，直到上限；握手成功后归零。
 * 只在连接器自己的 EventLoop 线程里访问。
 */
public final class ReconnectBackoff {

    private final long initialMs;
    private final long maxMs;
    private int attempts;

    public ReconnectBackoff(long initialMs, long maxMs) {
        if (initialMs <= 0 || maxMs < initialMs) {
            throw new IllegalArgumentException("invalid backoff " + initialMs + "/" + maxMs);
        }
        this.initialMs = initialMs;
        this.maxMs = maxMs;
    }

    public long nextDelayMs() {
        long delay = initialMs;
        for (int i = 0; i < attempts && delay < maxMs; i++) {
            delay <<= 1;
        }
        attempts++;
        return Math.min(delay, maxMs);
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }
}
