package com.agenthub.context.service.cache;

import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * L1 过期策略单元测试
 */
class ContextEntryExpiryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T08:00:00Z"));
    private final ContextEntryExpiry expiry = new ContextEntryExpiry(Duration.ofMinutes(5), clock);

    @Test
    @DisplayName("过期时间跟随 expiresAt，不超过上限")
    void testFollowsExpiresAtWithCap() {
        assertEquals(Duration.ofSeconds(30).toNanos(),
            expiry.nanosToLive(entry(clock.instant().plusSeconds(30))));
        assertEquals(Duration.ofMinutes(5).toNanos(),
            expiry.nanosToLive(entry(clock.instant().plus(Duration.ofDays(365 * 100)))));
        assertEquals(Duration.ofMinutes(5).toNanos(), expiry.nanosToLive(entry(null)));
    }

    @Test
    @DisplayName("已过期条目立即过期")
    void testAlreadyExpired() {
        assertEquals(0L, expiry.nanosToLive(entry(clock.instant().minusSeconds(1))));
    }

    private static ContextEntry entry(Instant expiresAt) {
        return ContextEntry.builder().id("user:k").key("k").expiresAt(expiresAt).build();
    }
}
