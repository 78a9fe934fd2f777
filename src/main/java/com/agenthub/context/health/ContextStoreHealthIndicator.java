package com.agenthub.context.health;

import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.repository.ContextEntryStore;
import com.agenthub.context.service.BackendGuard;
import com.agenthub.context.service.cache.ContextCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 上下文存储健康检查
 * MongoDB 不可用为 DOWN；Redis 不可用时读路径可降级，但写锁与通知不可用，同样为 DOWN
 */
@Slf4j
@Component("contextStoreHealthIndicator")
@RequiredArgsConstructor
public class ContextStoreHealthIndicator implements HealthIndicator {

    private final ContextEntryStore entryStore;
    private final ContextCacheService cacheService;
    private final BackendGuard backendGuard;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allHealthy = true;

        // 1. MongoDB
        try {
            backendGuard.read(ContextConstants.BACKEND_MONGO, () -> {
                entryStore.ping();
                return Boolean.TRUE;
            });
            details.put("mongo", "UP");
        } catch (RuntimeException e) {
            log.error("MongoDB health check failed", e);
            details.put("mongo", "DOWN");
            details.put("mongo_error", e.getMessage());
            allHealthy = false;
        }
        details.put("mongo_circuit", backendGuard.state(ContextConstants.BACKEND_MONGO).name());

        // 2. Redis
        try {
            cacheService.pingRemote();
            details.put("redis", "UP");
        } catch (RuntimeException e) {
            log.error("Redis health check failed", e);
            details.put("redis", "DOWN");
            details.put("redis_error", e.getMessage());
            allHealthy = false;
        }
        details.put("redis_circuit", backendGuard.state(ContextConstants.BACKEND_REDIS).name());

        // 3. L1
        details.put("l1_size", cacheService.localSize());

        if (allHealthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }
}
