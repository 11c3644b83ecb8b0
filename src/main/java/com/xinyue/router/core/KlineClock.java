package com.xinyue.router.core;

import com.lmax.disruptor.RingBuffer;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.CoreEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 全局时钟事件源：每秒向 RingBuffer 发布一个 TIMER 事件。
 * K 线在没有成交时也要按时封闭，EWMA 状态的清理也挂在这个节拍上。
 */
public final class KlineClock {

    private static final Logger LOG = LoggerFactory.getLogger(KlineClock.class);

    private final RingBuffer<CoreEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService timer;

    public KlineClock(RingBuffer<CoreEvent> ringBuffer) {
        this.ringBuffer = ringBuffer;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kline-clock");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(this::tick, 1, 1, TimeUnit.SECONDS);
        LOG.info("全局时钟已启动（每秒一次 TIMER 事件）");
    }

    public synchronized void stop() {
        if (running.compareAndSet(true, false) && timer != null) {
            timer.shutdown();
        }
    }

    void tick() {
        try {
            long sequence = ringBuffer.next();
            try {
                CoreEvent event = ringBuffer.get(sequence);
                event.reset();
                event.type = CoreEventType.TIMER;
                event.timestamp = System.currentTimeMillis();
                event.recvTime = event.timestamp;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (Exception e) {
            LOG.error("全局时钟发送事件失败", e);
        }
    }
}
