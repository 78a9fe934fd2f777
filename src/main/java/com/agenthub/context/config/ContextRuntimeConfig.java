package com.agenthub.context.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 运行时配置：访问策略、时钟、执行器
 */
@Configuration
public class ContextRuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(ContextRuntimeConfig.class);

    @Bean
    public AccessPolicy accessPolicy(AgentContextProperties properties) {
        AccessPolicy policy = AccessPolicy.from(properties);
        log.info("Access policy loaded: agents={}, validator={}, protectedWriteMaxRank={}",
            policy.priorities().size(), policy.validatorAgent(), policy.protectedWriteMaxRank());
        return policy;
    }

    @Bean
    public Clock contextClock() {
        return Clock.systemUTC();
    }

    /**
     * Facade 操作执行器
     */
    @Bean("contextTaskExecutor")
    public ThreadPoolTaskExecutor contextTaskExecutor(AgentContextProperties properties) {
        AgentContextProperties.ExecutorConfig config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("context-op-");
        // 队列满时由调用线程执行，形成背压
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * 后端 I/O 执行器，配合 TimeLimiter 实现超时
     */
    @Bean(name = "contextIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService contextIoExecutor(AgentContextProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getIoPoolSize(), namedThreadFactory("context-io-"));
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
