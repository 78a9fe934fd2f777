package com.agenthub.context.service.cache;

import com.agenthub.context.config.AgentContextProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 本地缓存过期清理任务
 * 仅为性能优化：读路径自行判断过期，任务延迟或停止不影响正确性
 */
@Component
public class CacheSweepTask {

    private static final Logger log = LoggerFactory.getLogger(CacheSweepTask.class);

    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final ContextCacheService cacheService;
    private final Duration interval;
    private final Counter sweptCounter;

    private ScheduledExecutorService scheduler;

    public CacheSweepTask(ContextCacheService cacheService,
                          AgentContextProperties properties,
                          MeterRegistry meterRegistry) {
        this.cacheService = cacheService;
        this.interval = properties.getCache().getSweepInterval();
        this.sweptCounter = meterRegistry.counter("context.cache.swept");
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "context-cache-sweep");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Cache sweep task started: interval={}", interval);
    }

    /**
     * 停止并等待正在执行的清理结束
     */
    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Cache sweep task stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    void sweepOnce() {
        try {
            int removed = cacheService.sweepExpired();
            sweptCounter.increment(removed);
        } catch (RuntimeException e) {
            // 异常会终止后续调度，这里只记录
            log.error("Cache sweep failed", e);
        }
    }
}
