package com.agenthub.context.constant;

/**
 * 上下文存储常量
 */
public final class ContextConstants {

    private ContextConstants() {}

    // ==================== 后端名称 ====================

    public static final String BACKEND_MONGO = "mongo";

    public static final String BACKEND_REDIS = "redis";

    // ==================== Key 前缀 ====================

    /** 写锁前缀 */
    public static final String LOCK_PREFIX = "context:lock:";

    /** L2 条目缓存前缀 */
    public static final String L2_ENTRY_PREFIX = "context:entry:";

    /** 订阅记录前缀 */
    public static final String SUBSCRIPTION_PREFIX = "subscription:";

    /** 变更通知 channel 前缀 */
    public static final String CHANGE_CHANNEL_PREFIX = "context_changes";

    // ==================== 访问日志 ====================

    public static final String OPERATION_READ = "read";

    public static final String OPERATION_WRITE = "write";

    /** 审计日志 Logger 名称 */
    public static final String AUDIT_LOGGER = "agent-context.audit";

    // ==================== MQ Topic ====================

    /** 本地缓存失效广播 Topic */
    public static final String TOPIC_LOCAL_CACHE_BROADCAST = "CONTEXT_LOCAL_CACHE_BROADCAST";

    // ==================== 默认配置 ====================

    /** 未登记 Agent 的优先级 */
    public static final int DEFAULT_AGENT_RANK = 999;

    /** 安全校验 Agent */
    public static final String DEFAULT_VALIDATOR_AGENT = "security_validator";

    public static final String DEFAULT_COLLECTION = "context_entries";
}
