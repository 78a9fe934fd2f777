package com.agenthub.context.service.cache;

import com.agenthub.context.model.ContextEntry;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * L1 本地缓存服务
 * 基于 Caffeine AsyncCache：
 * 1. 同 Key 并发加载只回源一次
 * 2. 加载过程中被失效或覆盖，加载结果不会写回缓存
 * 3. 加载结果为空不缓存
 */
@Component
public class L1ContextCache {

    private static final Logger log = LoggerFactory.getLogger(L1ContextCache.class);

    private final AsyncCache<String, ContextEntry> cache;

    public L1ContextCache(@Qualifier("contextEntryLocalCache") AsyncCache<String, ContextEntry> cache) {
        this.cache = cache;
    }

    /**
     * 读取缓存，未命中时由当前线程调用 loader 加载
     * 已缓存但在 now 时刻逻辑过期的条目视为未命中
     */
    public Optional<ContextEntry> get(String fullKey, Instant now,
                                      Function<String, Optional<ContextEntry>> loader) {
        ConcurrentMap<String, CompletableFuture<ContextEntry>> map = cache.asMap();
        CompletableFuture<ContextEntry> cached = map.get(fullKey);
        if (cached != null) {
            ContextEntry entry = await(cached);
            if (entry != null && !entry.isExpired(now)) {
                return Optional.of(entry);
            }
            map.remove(fullKey, cached);
        }

        CompletableFuture<ContextEntry> loading = new CompletableFuture<>();
        CompletableFuture<ContextEntry> prior = map.putIfAbsent(fullKey, loading);
        if (prior != null) {
            // 其他线程正在加载
            return Optional.ofNullable(await(prior)).filter(entry -> !entry.isExpired(now));
        }
        try {
            Optional<ContextEntry> loaded = loader.apply(fullKey);
            loading.complete(loaded.orElse(null));
            if (loaded.isEmpty()) {
                map.remove(fullKey, loading);
            }
            return loaded;
        } catch (RuntimeException e) {
            map.remove(fullKey, loading);
            loading.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * 仅查看已完成加载的条目，不触发加载
     */
    public Optional<ContextEntry> getIfPresent(String fullKey) {
        return Optional.ofNullable(cache.synchronous().getIfPresent(fullKey));
    }

    public void put(ContextEntry entry) {
        cache.put(entry.getId(), CompletableFuture.completedFuture(entry));
    }

    /**
     * 仅当缓存中没有更新的版本时写入
     */
    public void refresh(ContextEntry entry) {
        cache.asMap().compute(entry.getId(), (key, current) -> {
            if (current != null && current.isDone() && !current.isCompletedExceptionally()) {
                ContextEntry cached = current.getNow(null);
                if (cached != null && cached.getVersion() > entry.getVersion()) {
                    return current;
                }
            }
            return CompletableFuture.completedFuture(entry);
        });
    }

    public void invalidate(String fullKey) {
        cache.synchronous().invalidate(fullKey);
    }

    /**
     * 清理逻辑已过期的条目，返回清理数量
     */
    public int sweepExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, ContextEntry>> iterator = cache.synchronous().asMap().entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, ContextEntry> entry = iterator.next();
            if (entry.getValue().isExpired(now)
                && cache.synchronous().asMap().remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        cache.synchronous().cleanUp();
        if (removed > 0) {
            log.debug("L1 sweep removed expired entries: count={}", removed);
        }
        return removed;
    }

    public long size() {
        return cache.synchronous().estimatedSize();
    }

    public CacheStats stats() {
        return cache.synchronous().stats();
    }

    private static ContextEntry await(CompletableFuture<ContextEntry> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
