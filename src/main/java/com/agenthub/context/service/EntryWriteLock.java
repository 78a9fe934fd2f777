package com.agenthub.context.service;

import java.util.function.Supplier;

/**
 * 同一 full key 的写入串行化
 */
public interface EntryWriteLock {

    /**
     * 持锁执行 action；获取锁失败时抛出 BackendUnavailableException，action 不会执行
     */
    <T> T withLock(String fullKey, Supplier<T> action);
}
