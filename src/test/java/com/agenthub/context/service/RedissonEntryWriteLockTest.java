package com.agenthub.context.service;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.exception.BackendUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Redisson 写锁单元测试
 */
@ExtendWith(MockitoExtension.class)
class RedissonEntryWriteLockTest {

    private static final String FULL_KEY = "workflow:deploy_plan";
    private static final String LOCK_KEY = "context:lock:" + FULL_KEY;

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    private RedissonEntryWriteLock writeLock;

    @BeforeEach
    void setUp() {
        writeLock = new RedissonEntryWriteLock(redissonClient, new AgentContextProperties());
    }

    private void lockResolves() {
        when(redissonClient.getLock(LOCK_KEY)).thenReturn(lock);
    }

    @Test
    @DisplayName("获取锁后执行并释放")
    void testAcquireRunRelease() throws Exception {
        lockResolves();
        when(lock.tryLock(3000L, 10000L, TimeUnit.MILLISECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        String result = writeLock.withLock(FULL_KEY, () -> "done");

        assertEquals("done", result);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("获取锁超时 - 不执行写入")
    void testLockBusy() throws Exception {
        lockResolves();
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(false);

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
            () -> writeLock.withLock(FULL_KEY, () -> fail("action should not run")));

        assertTrue(e.getMessage().contains("write lock busy"));
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("执行失败也会释放锁")
    void testReleaseOnFailure() throws Exception {
        lockResolves();
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> writeLock.withLock(FULL_KEY, () -> {
            throw new IllegalStateException("boom");
        }));

        verify(lock).unlock();
    }

    @Test
    @DisplayName("租期已过 - 不再解锁")
    void testLeaseExpired() throws Exception {
        lockResolves();
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(false);

        assertEquals(1, writeLock.withLock(FULL_KEY, () -> 1));

        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("tryLock 时 Redis 异常 - 退化为本地锁继续写入")
    void testTryLockFailureFallsBackToLocalLock() throws Exception {
        lockResolves();
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class)))
            .thenThrow(new IllegalStateException("redis down"));

        assertEquals(1, writeLock.withLock(FULL_KEY, () -> 1));

        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("getLock 时 Redis 异常 - 退化为本地锁继续写入")
    void testGetLockFailureFallsBackToLocalLock() {
        when(redissonClient.getLock(LOCK_KEY)).thenThrow(new IllegalStateException("connection refused"));

        assertEquals("done", writeLock.withLock(FULL_KEY, () -> "done"));
    }

    @Test
    @DisplayName("退化为本地锁时写入异常原样抛出")
    void testFallbackPropagatesActionFailure() {
        when(redissonClient.getLock(LOCK_KEY)).thenThrow(new IllegalStateException("connection refused"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> writeLock.withLock(FULL_KEY, () -> {
                throw new IllegalArgumentException("bad value");
            }));

        assertEquals("bad value", e.getMessage());
    }

    @Test
    @DisplayName("获取锁被中断 - 映射为后端不可用")
    void testInterruptedMapped() throws Exception {
        lockResolves();
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class)))
            .thenThrow(new InterruptedException("interrupted"));

        assertThrows(BackendUnavailableException.class,
            () -> writeLock.withLock(FULL_KEY, () -> fail("action should not run")));

        assertTrue(Thread.interrupted());
    }
}
