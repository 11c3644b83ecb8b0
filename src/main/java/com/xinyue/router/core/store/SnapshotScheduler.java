package com.xinyue.router.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 定时保存状态，{@link #stop()} 时再保存最后一次。
 * 不自己注册 shutdown hook，由应用上下文在停止行情管道之后调用 stop。
 */
public final class SnapshotScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotScheduler.class);

    private final StateStore store;
    private final Supplier<StateSnapshot> snapshotSupplier;
    private final long intervalSeconds;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService timer;

    public SnapshotScheduler(StateStore store, Supplier<StateSnapshot> snapshotSupplier, long intervalSeconds) {
        this.store = store;
        this.snapshotSupplier = snapshotSupplier;
        this.intervalSeconds = intervalSeconds;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "state-snapshot");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(this::saveQuietly, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("状态快照已启动（每 {} 秒）", intervalSeconds);
    }

    /**
     * 停止定时任务，等正在进行的保存结束后做最后一次保存。重复调用无效果。
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        timer.shutdown();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("定时快照任务 5 秒内未结束");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        saveQuietly();
        LOG.info("状态快照已停止，最终状态已保存");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 立即保存一次，失败时抛出 {@link StateStoreException}。
     */
    public void saveNow() {
        store.save(snapshotSupplier.get());
    }

    private void saveQuietly() {
        try {
            saveNow();
        } catch (Exception e) {
            // 定时任务里抛出异常会终止后续调度
            LOG.error("保存状态失败", e);
        }
    }
}
