package com.agenthub.context.config;

import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.service.cache.ContextEntryExpiry;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 本地缓存配置
 * 采用 W-TinyLFU 淘汰策略，单条目过期时间跟随 expiresAt
 */
@Configuration
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    /**
     * 上下文条目本地缓存
     * 使用 AsyncCache：同 Key 并发加载合并，加载中被失效的值不会回填
     */
    @Bean("contextEntryLocalCache")
    public AsyncCache<String, ContextEntry> contextEntryLocalCache(AgentContextProperties properties,
                                                                   MeterRegistry meterRegistry) {
        AgentContextProperties.CacheConfig config = properties.getCache();
        AsyncCache<String, ContextEntry> cache = Caffeine.newBuilder()
            .initialCapacity(1000)
            .maximumSize(config.getL1MaxSize())
            .expireAfter(new ContextEntryExpiry(config.getL1MaxTtl()))
            .recordStats()
            // 移除监听器，用于日志
            .removalListener((String key, ContextEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Context entry evicted due to size: key={}", key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Context entry expired in L1: key={}", key);
                }
            })
            .buildAsync();

        // 注册 Micrometer 指标
        CaffeineCacheMetrics.monitor(meterRegistry, cache.synchronous(), "context_entry_local_cache");

        log.info("Context entry local cache initialized: maximumSize={}, maxTtl={}",
            config.getL1MaxSize(), config.getL1MaxTtl());

        return cache;
    }
}
