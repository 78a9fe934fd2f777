package com.agenthub.context.service;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.exception.BackendUnavailableException;
import com.agenthub.context.exception.ContextStoreException;
import com.agenthub.context.exception.WriteOutcomeUnknownException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 后端调用保护
 * 每个后端（mongo / redis）一个熔断器；读、写各一个超时器
 * 读超时 -> BackendUnavailableException，写超时 -> WriteOutcomeUnknownException
 */
@Component
public class BackendGuard {

    private static final Logger log = LoggerFactory.getLogger(BackendGuard.class);

    private static final List<String> BACKENDS = List.of(ContextConstants.BACKEND_MONGO, ContextConstants.BACKEND_REDIS);

    private final ExecutorService ioExecutor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiter readLimiter;
    private final TimeLimiter writeLimiter;

    public BackendGuard(AgentContextProperties properties,
                        @Qualifier("contextIoExecutor") ExecutorService ioExecutor,
                        MeterRegistry meterRegistry) {
        this.ioExecutor = ioExecutor;
        AgentContextProperties.ResilienceConfig config = properties.getResilience();

        CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(config.getFailureRateThreshold())
            .minimumNumberOfCalls(config.getMinimumNumberOfCalls())
            .waitDurationInOpenState(config.getWaitDurationInOpenState())
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(config.getSlidingWindowSize())
            // 业务异常不算后端故障
            .ignoreExceptions(IllegalArgumentException.class)
            .build();
        this.circuitBreakerRegistry = CircuitBreakerRegistry.of(circuitBreakerConfig);
        this.readLimiter = TimeLimiter.of("read", timeLimiterConfig(config.getReadTimeout()));
        this.writeLimiter = TimeLimiter.of("write", timeLimiterConfig(config.getWriteTimeout()));

        for (String backend : BACKENDS) {
            CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(backend);
            circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                    log.warn("Circuit breaker [{}] state changed: {} -> {}", backend,
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()));
            Gauge.builder("context.backend.circuit.state", circuitBreaker, cb -> cb.getState().getOrder())
                .tag("backend", backend)
                .description("Circuit breaker state order (0=closed, 1=open, 2=half_open)")
                .register(meterRegistry);
        }
        log.info("Backend guard initialized: readTimeout={}, writeTimeout={}",
            config.getReadTimeout(), config.getWriteTimeout());
    }

    /**
     * 读调用：超时表示后端不可用，绝不等同于未找到
     */
    public <T> T read(String backend, Supplier<T> call) {
        return execute(backend, call, readLimiter, false);
    }

    /**
     * 写调用：超时后结果未知，调用方需重新读取确认
     */
    public <T> T write(String backend, Supplier<T> call) {
        return execute(backend, call, writeLimiter, true);
    }

    public void runWrite(String backend, Runnable call) {
        execute(backend, () -> {
            call.run();
            return null;
        }, writeLimiter, true);
    }

    public CircuitBreaker.State state(String backend) {
        return circuitBreakerRegistry.circuitBreaker(backend).getState();
    }

    private <T> T execute(String backend, Supplier<T> call, TimeLimiter limiter, boolean write) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(backend);
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(limiter,
            () -> CompletableFuture.supplyAsync(call, ioExecutor));
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);
        try {
            return guarded.call();
        } catch (CallNotPermittedException e) {
            throw new BackendUnavailableException(backend, "circuit breaker is open", e);
        } catch (TimeoutException e) {
            if (write) {
                throw new WriteOutcomeUnknownException(backend, "write timed out, outcome unknown", e);
            }
            throw new BackendUnavailableException(backend, "read timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(backend, "interrupted while waiting for backend", e);
        } catch (ContextStoreException | IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new BackendUnavailableException(backend, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static TimeLimiterConfig timeLimiterConfig(Duration timeout) {
        return TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build();
    }
}
