package com.xinyue.router.core;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.io.input.AccessLayerCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 负责将 Disruptor 事件流水线与接入层组件对接。
 * <p>
 * 生产者：每个交易所连接的 IO 线程 + 全局时钟（多生产者）。
 * 消费者：聚合引擎和撮合引擎，两者并行、互不等待，各自按序列号顺序看到同一份 tick 日志。
 */
public final class CoreEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CoreEngine.class);

    private final Disruptor<CoreEvent> disruptor;
    private final AccessLayerCoordinator accessLayerCoordinator;
    private final KlineClock klineClock;

    public CoreEngine(Disruptor<CoreEvent> disruptor, AccessLayerCoordinator accessLayerCoordinator) {
        this.disruptor = disruptor;
        this.accessLayerCoordinator = accessLayerCoordinator;
        this.klineClock = new KlineClock(disruptor.getRingBuffer());
    }

    public void start() {
        disruptor.start();
        klineClock.start();
        accessLayerCoordinator.startAll();
        LOG.info("核心引擎已启动，RingBuffer 大小 {}", disruptor.getRingBuffer().getBufferSize());
    }

    public void stop() {
        accessLayerCoordinator.stopAll();
        klineClock.stop();
        disruptor.shutdown();
        LOG.info("核心引擎已停止");
    }

    public RingBuffer<CoreEvent> ringBuffer() {
        return disruptor.getRingBuffer();
    }

    @SafeVarargs
    public static Disruptor<CoreEvent> bootstrapDisruptor(CoreEventFactory factory,
                                                          int ringBufferSize,
                                                          EventHandler<CoreEvent>... handlers) {
        Disruptor<CoreEvent> disruptor = new Disruptor<>(factory, ringBufferSize, namedThreadFactory("core-consumer"),
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(handlers);
        return disruptor;
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
