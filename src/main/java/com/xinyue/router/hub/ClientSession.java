package com.xinyue.router.hub;

import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一个客户端连接。
 * <p>
 * 出站消息先进入有界 MPSC 队列（聚合线程、撮合线程、IO 线程都可能是生产者），
 * 再由底层通道所在的线程单独写出，保证同一连接上的帧不会交错。
 * 队列满时丢弃最新的消息并计数，生产者永远不会阻塞。
 */
public final class ClientSession {

    private final String id;
    private final SessionTransport transport;
    private final ManyToOneConcurrentArrayQueue<String> outbound;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final Map<StreamTopic, StreamSpec> subscriptions = new ConcurrentHashMap<>();
    private volatile String userId;
    private volatile boolean closed;

    public ClientSession(String id, SessionTransport transport, int queueCapacity) {
        this.id = id;
        this.transport = transport;
        this.outbound = new ManyToOneConcurrentArrayQueue<>(queueCapacity);
    }

    /**
     * 非阻塞投递。
     *
     * @return false 表示队列已满或连接已关闭，消息被丢弃
     */
    public boolean offer(String message) {
        if (closed) {
            return false;
        }
        if (!outbound.offer(message)) {
            dropped.incrementAndGet();
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * 通道重新可写时也会调用。
     */
    public void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            transport.execute(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        if (closed) {
            outbound.clear();
            return;
        }
        int written = 0;
        String message;
        while (transport.isWritable() && (message = outbound.poll()) != null) {
            transport.write(message);
            written++;
        }
        if (written > 0) {
            transport.flush();
        }
        // 通道不可写时留在队列里，等可写事件再触发
        if (!outbound.isEmpty() && transport.isWritable()) {
            scheduleDrain();
        }
    }

    void markClosed() {
        closed = true;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    void authenticate(String userId) {
        this.userId = userId;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    Map<StreamTopic, StreamSpec> subscriptions() {
        return subscriptions;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pendingCount() {
        return outbound.size();
    }

    public boolean isClosed() {
        return closed;
    }

    SessionTransport transport() {
        return transport;
    }
}
