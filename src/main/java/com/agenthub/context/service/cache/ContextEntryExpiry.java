package com.agenthub.context.service.cache;

import com.agenthub.context.model.ContextEntry;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * L1 单条目过期策略
 * 过期时间取 expiresAt 与上限两者中较早的一个，读不续期
 */
public class ContextEntryExpiry implements Expiry<String, ContextEntry> {

    private final Duration maxTtl;
    private final Clock clock;

    public ContextEntryExpiry(Duration maxTtl) {
        this(maxTtl, Clock.systemUTC());
    }

    public ContextEntryExpiry(Duration maxTtl, Clock clock) {
        this.maxTtl = maxTtl;
        this.clock = clock;
    }

    @Override
    public long expireAfterCreate(String key, ContextEntry value, long currentTime) {
        return nanosToLive(value);
    }

    @Override
    public long expireAfterUpdate(String key, ContextEntry value, long currentTime, long currentDuration) {
        return nanosToLive(value);
    }

    @Override
    public long expireAfterRead(String key, ContextEntry value, long currentTime, long currentDuration) {
        return currentDuration;
    }

    long nanosToLive(ContextEntry value) {
        Instant expiresAt = value.getExpiresAt();
        if (expiresAt == null) {
            return maxTtl.toNanos();
        }
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (remaining.isNegative()) {
            return 0L;
        }
        return remaining.compareTo(maxTtl) < 0 ? remaining.toNanos() : maxTtl.toNanos();
    }
}
