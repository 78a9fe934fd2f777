package com.agenthub.context.config;

import com.agenthub.context.service.cache.CacheInvalidationBroadcaster;
import com.agenthub.context.service.cache.NoOpCacheInvalidationBroadcaster;
import com.agenthub.context.service.cache.RocketMQCacheInvalidationBroadcaster;
import org.apache.rocketmq.spring.core.RocketMQTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * 本地缓存失效广播配置
 * 多实例部署时开启，保证各实例 L1 一致
 */
@Configuration
public class CacheBroadcastConfig {

    @Bean
    @ConditionalOnProperty(name = "agent-context.cache.broadcast.enabled", havingValue = "true")
    public CacheInvalidationBroadcaster rocketMQCacheInvalidationBroadcaster(
            RocketMQTemplate rocketMQTemplate,
            AgentContextProperties properties,
            @Value("${spring.application.name:agent-context-store}") String applicationName) {
        // 实例 ID 需全局唯一，同名应用的其他实例仍要处理广播
        String instanceId = applicationName + ":" + UUID.randomUUID();
        return new RocketMQCacheInvalidationBroadcaster(rocketMQTemplate,
            properties.getCache().getBroadcast().getTopic(), instanceId);
    }

    @Bean
    @ConditionalOnProperty(name = "agent-context.cache.broadcast.enabled", havingValue = "false", matchIfMissing = true)
    public CacheInvalidationBroadcaster noOpCacheInvalidationBroadcaster() {
        return new NoOpCacheInvalidationBroadcaster();
    }
}
