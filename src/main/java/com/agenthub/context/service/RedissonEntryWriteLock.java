package com.agenthub.context.service;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.exception.BackendUnavailableException;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于 Redisson 的 full key 写锁
 * 多实例部署时同 Key 写入全局串行，不同 Key 互不阻塞
 * 锁只用于减少冲突：租期到期或 Redis 不可用时，由持久层版本条件兜底，不会丢失更新
 */
@Component
public class RedissonEntryWriteLock implements EntryWriteLock {

    private static final Logger log = LoggerFactory.getLogger(RedissonEntryWriteLock.class);

    private final RedissonClient redissonClient;
    private final String lockPrefix;
    private final long waitMillis;
    private final long leaseMillis;
    private final LocalEntryWriteLock localLock;

    public RedissonEntryWriteLock(RedissonClient redissonClient, AgentContextProperties properties) {
        this.redissonClient = redissonClient;
        AgentContextProperties.LockConfig config = properties.getLock();
        this.lockPrefix = config.getPrefix();
        this.waitMillis = config.getWaitTime().toMillis();
        this.leaseMillis = config.getLeaseTime().toMillis();
        this.localLock = new LocalEntryWriteLock(config.getLocalStripes());
    }

    @Override
    public <T> T withLock(String fullKey, Supplier<T> action) {
        String lockKey = lockPrefix + fullKey;
        RLock lock;
        boolean acquired;
        try {
            lock = redissonClient.getLock(lockKey);
            acquired = lock.tryLock(waitMillis, leaseMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(ContextConstants.BACKEND_REDIS,
                "interrupted while acquiring write lock: " + fullKey, e);
        } catch (RuntimeException e) {
            // Redis 故障不影响写入可用性，退化为进程内锁
            log.warn("Distributed write lock unavailable, falling back to local lock: key={}, error={}",
                lockKey, e.getMessage());
            return localLock.withLock(fullKey, action);
        }
        if (!acquired) {
            log.warn("Write lock not acquired within {}ms: key={}", waitMillis, lockKey);
            throw new BackendUnavailableException(ContextConstants.BACKEND_REDIS,
                "write lock busy: " + fullKey);
        }
        try {
            return action.get();
        } finally {
            release(lock, lockKey);
        }
    }

    private void release(RLock lock, String lockKey) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            } else {
                // 租期已过，锁已自动释放
                log.warn("Write lock lease expired before release: key={}", lockKey);
            }
        } catch (RuntimeException e) {
            log.warn("Write lock release failed, lease will expire: key={}", lockKey, e);
        }
    }
}
