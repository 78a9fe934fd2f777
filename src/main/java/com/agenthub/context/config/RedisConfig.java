package com.agenthub.context.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Duration;

/**
 * Redis 配置
 * Lettuce 用于 L2 缓存与发布订阅，Redisson 用于分布式写锁
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Lettuce 客户端选项：自动重连 + 命令超时
     */
    @Bean
    public LettuceClientConfigurationBuilderCustomizer lettuceClientCustomizer(RedisProperties redisProperties) {
        Duration commandTimeout = redisProperties.getTimeout() != null
            ? redisProperties.getTimeout() : DEFAULT_COMMAND_TIMEOUT;
        return builder -> builder
            .commandTimeout(commandTimeout)
            .clientOptions(ClientOptions.builder()
                .autoReconnect(true)
                // 断线期间拒绝命令，立即失败而不是排队等待
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
                .build());
    }

    /**
     * 发布订阅监听容器
     * 使用同步执行器，消息按到达顺序交给 ChangeNotifier 分发
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(new SyncTaskExecutor());
        return container;
    }

    /**
     * Redisson 客户端（单节点）
     */
    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        String address = "redis://" + redisProperties.getHost() + ":" + redisProperties.getPort();
        SingleServerConfig serverConfig = config.useSingleServer()
            .setAddress(address)
            .setDatabase(redisProperties.getDatabase());
        if (redisProperties.getPassword() != null && !redisProperties.getPassword().isEmpty()) {
            serverConfig.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            serverConfig.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        log.info("Redisson client configured: address={}, database={}", address, redisProperties.getDatabase());
        return Redisson.create(config);
    }
}
