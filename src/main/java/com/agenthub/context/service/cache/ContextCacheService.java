package com.agenthub.context.service.cache;

import com.agenthub.context.model.ContextEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 多级缓存服务
 * 读取顺序：L1 Caffeine -> L2 Redis -> 持久层
 * 缓存不是权威数据源，返回前仍需调用方做鉴权，过期判断在每次读取时进行
 */
@Service
public class ContextCacheService {

    private static final Logger log = LoggerFactory.getLogger(ContextCacheService.class);

    private final L1ContextCache l1Cache;
    private final L2RedisContextCache l2Cache;
    private final CacheInvalidationBroadcaster broadcaster;
    private final Clock clock;

    private final Counter l1Hit;
    private final Counter l1Miss;
    private final Counter l2Hit;
    private final Counter l2Miss;

    public ContextCacheService(L1ContextCache l1Cache,
                               L2RedisContextCache l2Cache,
                               CacheInvalidationBroadcaster broadcaster,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.l1Cache = l1Cache;
        this.l2Cache = l2Cache;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.l1Hit = meterRegistry.counter("context.cache.hit", "layer", "l1");
        this.l1Miss = meterRegistry.counter("context.cache.miss", "layer", "l1");
        this.l2Hit = meterRegistry.counter("context.cache.hit", "layer", "l2");
        this.l2Miss = meterRegistry.counter("context.cache.miss", "layer", "l2");
    }

    /**
     * 读取未过期条目
     *
     * @param fullKey     full key
     * @param storeLoader 持久层加载函数，需自行过滤过期条目
     */
    public Optional<ContextEntry> get(String fullKey, Function<String, Optional<ContextEntry>> storeLoader) {
        Instant now = clock.instant();
        boolean[] loaded = {false};
        Optional<ContextEntry> entry = l1Cache.get(fullKey, now, key -> {
            loaded[0] = true;
            return loadFromL2OrStore(key, now, storeLoader);
        });
        if (!loaded[0]) {
            l1Hit.increment();
        }
        return entry.filter(e -> !e.isExpired(now));
    }

    private Optional<ContextEntry> loadFromL2OrStore(String fullKey, Instant now,
                                                     Function<String, Optional<ContextEntry>> storeLoader) {
        l1Miss.increment();
        Optional<ContextEntry> remote = l2Cache.get(fullKey).filter(e -> !e.isExpired(now));
        if (remote.isPresent()) {
            l2Hit.increment();
            return remote;
        }
        l2Miss.increment();
        return storeLoader.apply(fullKey);
    }

    /**
     * 写入成功后调用（持有写锁）：更新 L2、L1 并通知其他实例
     */
    public void put(ContextEntry entry) {
        l2Cache.put(entry);
        l1Cache.put(entry);
        broadcaster.broadcast(List.of(entry.getId()));
    }

    /**
     * 写入前调用（持有写锁）：清除本实例 L1 和 L2
     * 写入失败或结果未知时，后续读取直接回源
     */
    public void evict(String fullKey) {
        l1Cache.invalidate(fullKey);
        l2Cache.delete(fullKey);
    }

    /**
     * 删除后调用：清除所有层级并广播
     */
    public void invalidate(String fullKey) {
        evict(fullKey);
        broadcaster.broadcast(List.of(fullKey));
    }

    /**
     * 收到其他实例广播时调用，只清本地
     */
    public void invalidateLocal(String fullKey) {
        l1Cache.invalidate(fullKey);
    }

    /**
     * 用持久层的最新读取结果刷新本地缓存，不覆盖更新的版本
     */
    public void refreshLocal(ContextEntry entry) {
        l1Cache.refresh(entry);
    }

    public int sweepExpired() {
        int removed = l1Cache.sweepExpired(clock.instant());
        if (removed > 0) {
            log.debug("Expired cache entries swept: count={}", removed);
        }
        return removed;
    }

    public String pingRemote() {
        return l2Cache.ping();
    }

    public long localSize() {
        return l1Cache.size();
    }
}
