package com.xinyue.router.hub;

/**
 * 会话底层的写通道。execute 提交的任务在同一个线程上串行执行，write / flush 只会在这些任务里调用。
 */
public interface SessionTransport {

    void execute(Runnable task);

    void write(String text);

    void flush();

    boolean isWritable();

    void close();

    String remoteAddress();
}
