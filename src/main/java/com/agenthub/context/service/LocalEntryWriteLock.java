package com.agenthub.context.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内分段写锁
 * 只在本实例内串行同 Key 写入，跨实例由持久层 _id + version 条件保证不丢更新
 */
public class LocalEntryWriteLock implements EntryWriteLock {

    private final ReentrantLock[] stripes;

    public LocalEntryWriteLock(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public <T> T withLock(String fullKey, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(fullKey.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
