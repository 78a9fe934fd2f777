package com.agenthub.context.service.cache;

import com.agenthub.context.model.AccessLevel;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextScope;
import com.agenthub.context.model.DataType;
import com.agenthub.context.support.MutableClock;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 多级缓存服务单元测试
 */
@ExtendWith(MockitoExtension.class)
class ContextCacheServiceTest {

    private static final String KEY = "global:feature_flags";

    @Mock
    private L2RedisContextCache l2Cache;

    @Mock
    private CacheInvalidationBroadcaster broadcaster;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private L1ContextCache l1Cache;
    private ContextCacheService cacheService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T08:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        l1Cache = new L1ContextCache(Caffeine.newBuilder()
            .maximumSize(100)
            .expireAfter(new ContextEntryExpiry(Duration.ofMinutes(5), clock))
            .buildAsync());
        cacheService = new ContextCacheService(l1Cache, l2Cache, broadcaster, clock, meterRegistry);
    }

    @Test
    @DisplayName("L1 命中 - 不访问 L2 和持久层")
    void testGet_L1Hit() {
        l1Cache.put(entry(3, null));

        Optional<ContextEntry> result = cacheService.get(KEY, key -> fail("store should not be called"));

        assertEquals(3, result.orElseThrow().getVersion());
        verifyNoInteractions(l2Cache);
        assertEquals(1.0, meterRegistry.counter("context.cache.hit", "layer", "l1").count());
    }

    @Test
    @DisplayName("L1 未命中，L2 命中 - 不回源持久层并回填 L1")
    void testGet_L2Hit() {
        when(l2Cache.get(KEY)).thenReturn(Optional.of(entry(4, null)));

        Optional<ContextEntry> result = cacheService.get(KEY, key -> fail("store should not be called"));

        assertEquals(4, result.orElseThrow().getVersion());
        assertEquals(4, l1Cache.getIfPresent(KEY).orElseThrow().getVersion());
        assertEquals(1.0, meterRegistry.counter("context.cache.miss", "layer", "l1").count());
        assertEquals(1.0, meterRegistry.counter("context.cache.hit", "layer", "l2").count());
    }

    @Test
    @DisplayName("L2 中的过期条目视为未命中，回源持久层")
    void testGet_L2ExpiredFallsThrough() {
        when(l2Cache.get(KEY)).thenReturn(Optional.of(entry(4, clock.instant().minusSeconds(1))));
        AtomicInteger storeLoads = new AtomicInteger();

        Optional<ContextEntry> result = cacheService.get(KEY, key -> {
            storeLoads.incrementAndGet();
            return Optional.of(entry(5, null));
        });

        assertEquals(5, result.orElseThrow().getVersion());
        assertEquals(1, storeLoads.get());
        assertEquals(1.0, meterRegistry.counter("context.cache.miss", "layer", "l2").count());
    }

    @Test
    @DisplayName("全部未命中 - 返回空且不缓存")
    void testGet_AllMiss() {
        when(l2Cache.get(KEY)).thenReturn(Optional.empty());

        assertEquals(Optional.empty(), cacheService.get(KEY, key -> Optional.empty()));
        assertEquals(Optional.empty(), cacheService.get(KEY, key -> Optional.empty()));

        verify(l2Cache, times(2)).get(KEY);
        assertEquals(0, cacheService.localSize());
    }

    @Test
    @DisplayName("写入 - 先 L2 后 L1，再广播")
    void testPut() {
        ContextEntry written = entry(6, null);

        cacheService.put(written);

        InOrder inOrder = inOrder(l2Cache, broadcaster);
        inOrder.verify(l2Cache).put(written);
        inOrder.verify(broadcaster).broadcast(List.of(KEY));
        assertEquals(6, l1Cache.getIfPresent(KEY).orElseThrow().getVersion());
    }

    @Test
    @DisplayName("evict 只清本实例两级缓存，不广播")
    void testEvict() {
        l1Cache.put(entry(1, null));

        cacheService.evict(KEY);

        assertEquals(Optional.empty(), l1Cache.getIfPresent(KEY));
        verify(l2Cache).delete(KEY);
        verifyNoInteractions(broadcaster);
    }

    @Test
    @DisplayName("invalidate 清除两级缓存并广播")
    void testInvalidate() {
        l1Cache.put(entry(1, null));

        cacheService.invalidate(KEY);

        assertEquals(Optional.empty(), l1Cache.getIfPresent(KEY));
        verify(l2Cache).delete(KEY);
        verify(broadcaster).broadcast(List.of(KEY));
    }

    @Test
    @DisplayName("invalidateLocal 只清 L1")
    void testInvalidateLocal() {
        l1Cache.put(entry(1, null));

        cacheService.invalidateLocal(KEY);

        assertEquals(Optional.empty(), l1Cache.getIfPresent(KEY));
        verifyNoInteractions(l2Cache, broadcaster);
    }

    @Test
    @DisplayName("过期清理返回清理数量")
    void testSweepExpired() {
        l1Cache.put(entry(1, clock.instant().plusSeconds(5)));
        clock.advance(Duration.ofSeconds(5));

        assertEquals(1, cacheService.sweepExpired());
        assertEquals(0, cacheService.sweepExpired());
    }

    private static ContextEntry entry(long version, Instant expiresAt) {
        return ContextEntry.builder()
            .id(KEY)
            .key("feature_flags")
            .value(List.of("dark_mode"))
            .scope(ContextScope.GLOBAL)
            .dataType(DataType.CONFIGURATION)
            .accessLevel(AccessLevel.PUBLIC)
            .ownerAgent("intent_router")
            .version(version)
            .expiresAt(expiresAt)
            .build();
    }
}
