package com.xinyue.router.core.position;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 固定大小的锁分片：按 key 的哈希取锁。
 * 同一个用户永远落在同一把锁上，不同用户之间大多数情况下互不阻塞。
 */
public final class ShardedLocks {

    private final ReentrantLock[] locks;
    private final int mask;

    public ShardedLocks(int shards) {
        int size = Integer.highestOneBit(Math.max(1, shards - 1)) << 1;
        this.locks = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            locks[i] = new ReentrantLock();
        }
        this.mask = size - 1;
    }

    public ReentrantLock forKey(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return locks[h & mask];
    }

    public int size() {
        return locks.length;
    }
}
