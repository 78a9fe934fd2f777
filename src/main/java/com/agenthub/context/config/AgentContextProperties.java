package com.agenthub.context.config;

import com.agenthub.context.constant.ContextConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 上下文存储配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent-context")
public class AgentContextProperties {

    /** Agent 优先级表（数值越小优先级越高） */
    private Map<String, Integer> priorities = defaultPriorities();

    /** 未登记 Agent 的优先级 */
    private int defaultRank = ContextConstants.DEFAULT_AGENT_RANK;

    /** 唯一可访问 restricted + security 数据的 Agent */
    private String validatorAgent = ContextConstants.DEFAULT_VALIDATOR_AGENT;

    /** protected 数据非 owner 写入所需的最低优先级 */
    private int protectedWriteMaxRank = 3;

    /** restricted + configuration 数据访问所需的最低优先级 */
    private int restrictedConfigurationMaxRank = 2;

    private StoreConfig store = new StoreConfig();

    private CacheConfig cache = new CacheConfig();

    private LockConfig lock = new LockConfig();

    private ResilienceConfig resilience = new ResilienceConfig();

    private NotifyConfig notify = new NotifyConfig();

    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class StoreConfig {
        /** MongoDB 集合名 */
        private String collection = ContextConstants.DEFAULT_COLLECTION;
    }

    @Data
    public static class CacheConfig {
        /** L1 最大条目数 */
        private long l1MaxSize = 50_000;
        /** L1 过期上限（条目 expiresAt 更早时以 expiresAt 为准） */
        private Duration l1MaxTtl = Duration.ofMinutes(5);
        /** L2 过期上限 */
        private Duration l2MaxTtl = Duration.ofMinutes(10);
        /** L2 Key 前缀 */
        private String l2KeyPrefix = ContextConstants.L2_ENTRY_PREFIX;
        /** 过期清理间隔 */
        private Duration sweepInterval = Duration.ofSeconds(60);
        private BroadcastConfig broadcast = new BroadcastConfig();
    }

    @Data
    public static class BroadcastConfig {
        /** 是否通过 RocketMQ 广播本地缓存失效 */
        private boolean enabled = false;
        private String topic = ContextConstants.TOPIC_LOCAL_CACHE_BROADCAST;
    }

    @Data
    public static class LockConfig {
        private String prefix = ContextConstants.LOCK_PREFIX;
        /** 等待锁超时 */
        private Duration waitTime = Duration.ofSeconds(3);
        /** 持有锁超时 */
        private Duration leaseTime = Duration.ofSeconds(10);
        /** Redis 不可用时退化使用的进程内锁分段数 */
        private int localStripes = 64;
    }

    @Data
    public static class ResilienceConfig {
        private Duration readTimeout = Duration.ofSeconds(2);
        private Duration writeTimeout = Duration.ofSeconds(5);
        private float failureRateThreshold = 50.0f;
        private int minimumNumberOfCalls = 10;
        private int slidingWindowSize = 100;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    @Data
    public static class NotifyConfig {
        private String channelPrefix = ContextConstants.CHANGE_CHANNEL_PREFIX;
        /** 回调分发线程数，同一 full key 固定落在同一线程 */
        private int dispatchThreads = 4;
    }

    @Data
    public static class ExecutorConfig {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 1000;
        /** 后端 I/O 线程数 */
        private int ioPoolSize = 16;
    }

    private static Map<String, Integer> defaultPriorities() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        priorities.put("security_validator", 1);
        priorities.put("intent_router", 2);
        priorities.put("audit_agent", 3);
        priorities.put("test_agent", 4);
        priorities.put("product_architect", 5);
        priorities.put("code_engineer", 6);
        priorities.put("research_agent", 7);
        return priorities;
    }
}
