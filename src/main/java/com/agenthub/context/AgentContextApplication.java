package com.agenthub.context;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * 多 Agent 共享上下文存储服务启动类
 *
 * 架构：
 * - L1: Caffeine 本地缓存，单条目过期跟随 expiresAt
 * - L2: Redis 缓存 + 发布订阅变更通知
 * - 持久层: MongoDB
 * - 同 Key 写入由 Redisson 分布式锁串行化
 */
@SpringBootApplication
@EnableConfigurationProperties
public class AgentContextApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentContextApplication.class, args);
    }
}
