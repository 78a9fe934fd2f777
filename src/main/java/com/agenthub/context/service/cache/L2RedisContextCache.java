package com.agenthub.context.service.cache;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.exception.ContextStoreException;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.service.BackendGuard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * L2 Redis 缓存服务
 * 只在写路径（持有写锁时）写入，读路径不回填；
 * 读失败降级为未命中，持久层才是权威数据源
 */
@Component
public class L2RedisContextCache {

    private static final Logger log = LoggerFactory.getLogger(L2RedisContextCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final BackendGuard backendGuard;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration maxTtl;

    public L2RedisContextCache(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               BackendGuard backendGuard,
                               Clock clock,
                               AgentContextProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.backendGuard = backendGuard;
        this.clock = clock;
        this.keyPrefix = properties.getCache().getL2KeyPrefix();
        this.maxTtl = properties.getCache().getL2MaxTtl();
    }

    public Optional<ContextEntry> get(String fullKey) {
        String redisKey = keyPrefix + fullKey;
        try {
            String json = backendGuard.read(ContextConstants.BACKEND_REDIS,
                () -> redisTemplate.opsForValue().get(redisKey));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ContextEntry.class));
        } catch (ContextStoreException e) {
            log.warn("Redis get failed, falling back to store: key={}, error={}", redisKey, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Corrupted L2 entry, dropping: key={}", redisKey, e);
            delete(fullKey);
            return Optional.empty();
        }
    }

    /**
     * 写入，TTL 取 expiresAt 剩余时间与上限中较小者；已过期则直接删除
     */
    public void put(ContextEntry entry) {
        Duration ttl = ttlOf(entry);
        if (ttl.isZero() || ttl.isNegative()) {
            delete(entry.getId());
            return;
        }
        String redisKey = keyPrefix + entry.getId();
        try {
            String json = objectMapper.writeValueAsString(entry);
            backendGuard.runWrite(ContextConstants.BACKEND_REDIS,
                () -> redisTemplate.opsForValue().set(redisKey, json, ttl));
        } catch (ContextStoreException | JsonProcessingException e) {
            log.warn("Redis set failed: key={}, error={}", redisKey, e.getMessage());
        }
    }

    public void delete(String fullKey) {
        String redisKey = keyPrefix + fullKey;
        try {
            backendGuard.runWrite(ContextConstants.BACKEND_REDIS, () -> redisTemplate.delete(redisKey));
        } catch (ContextStoreException e) {
            log.warn("Redis delete failed: key={}, error={}", redisKey, e.getMessage());
        }
    }

    /**
     * 连通性检查，失败时抛出 BackendUnavailableException
     */
    public String ping() {
        return backendGuard.read(ContextConstants.BACKEND_REDIS,
            () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    Duration ttlOf(ContextEntry entry) {
        if (entry.getExpiresAt() == null) {
            return maxTtl;
        }
        Duration remaining = Duration.between(clock.instant(), entry.getExpiresAt());
        return remaining.compareTo(maxTtl) < 0 ? remaining : maxTtl;
    }
}
